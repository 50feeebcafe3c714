package com.dragnet.core.aggregate;

/**
 * Maps numeric breakdown values to buckets. A bucket is identified by its lower bound, and every lower bound falls in
 * its own bucket, so values that were already bucketized (for example rows read back from an index) map to
 * themselves.
 */
public interface Bucketizer {

    Number bucketize(double value);

    /** Records a raw value with the number of records that carried it. */
    default void observe(double value, long weight) {}
}
