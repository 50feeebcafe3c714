package com.dragnet.core.aggregate;

import com.dragnet.core.model.FieldValues;

/** Fixed-width buckets {@code [k * step, (k + 1) * step)}. */
public final class LinearBucketizer implements Bucketizer {

    private final double step;

    public LinearBucketizer(double step) {
        if (!(step > 0)) {
            throw new IllegalArgumentException("step must be positive");
        }
        this.step = step;
    }

    @Override
    public Number bucketize(double value) {
        return (Number) FieldValues.normalize(Math.floor(value / step) * step);
    }
}
