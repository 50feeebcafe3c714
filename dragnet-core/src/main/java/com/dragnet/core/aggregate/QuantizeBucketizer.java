package com.dragnet.core.aggregate;

import com.datadoghq.sketch.ddsketch.DDSketch;
import com.datadoghq.sketch.ddsketch.DDSketches;

/**
 * Power-of-two buckets: {@code [2^k, 2^(k+1))} for values of at least one, {@code [0, 1)}, and the mirrored {@code
 * [-2^(k+1), -2^k)} for negative values. Observed values also feed a DDSketch so callers can report quantiles of the
 * distribution that was bucketed.
 */
public final class QuantizeBucketizer implements Bucketizer {

    private static final double RELATIVE_ACCURACY = 0.01;
    private static final long MAX_MAGNITUDE = 1L << 62;

    private final DDSketch sketch = DDSketches.unboundedDense(RELATIVE_ACCURACY);

    @Override
    public Number bucketize(double value) {
        return lowerBound(value);
    }

    static long lowerBound(double value) {
        if (value >= 1) {
            long floor = value >= MAX_MAGNITUDE ? MAX_MAGNITUDE : (long) Math.floor(value);
            return Long.highestOneBit(floor);
        }
        if (value >= 0) {
            return 0;
        }
        double ceil = Math.ceil(-value);
        long magnitude = ceil >= MAX_MAGNITUDE ? MAX_MAGNITUDE : (long) ceil;
        long pow = Long.highestOneBit(magnitude);
        return -(pow == magnitude ? magnitude : pow << 1);
    }

    @Override
    public synchronized void observe(double value, long weight) {
        if (weight > 0) {
            sketch.accept(value, weight);
        }
    }

    public synchronized long count() {
        return (long) sketch.getCount();
    }

    /** Approximate value at quantile {@code q} of the observed values, or {@code NaN} when nothing was observed. */
    public synchronized double quantile(double q) {
        return sketch.isEmpty() ? Double.NaN : sketch.getValueAtQuantile(q);
    }
}
