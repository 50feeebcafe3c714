package com.dragnet.core.aggregate;

import com.dragnet.core.filter.Records;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.Aggregation;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.model.FieldValues;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups points by their breakdown values and sums their counts. Bucketed breakdowns are mapped through a {@link
 * Bucketizer} first; points whose bucketed value is not numeric are dropped and counted.
 *
 * <p>Not thread-safe; each pipeline owns its aggregator.
 */
@Slf4j
public final class PointAggregator {

    private final List<Breakdown> breakdowns;
    private final Map<String, Bucketizer> bucketizers;
    private final Map<List<Object>, long[]> groups = new LinkedHashMap<>();
    private long processed;
    private long nonNumeric;

    public PointAggregator(List<Breakdown> breakdowns) {
        this.breakdowns = List.copyOf(breakdowns);
        Map<String, Bucketizer> byName = new LinkedHashMap<>();
        for (Breakdown b : this.breakdowns) {
            if (b.aggr() == Aggregation.QUANTIZE) {
                byName.put(b.name(), new QuantizeBucketizer());
            } else if (b.aggr() == Aggregation.LQUANTIZE) {
                byName.put(b.name(), new LinearBucketizer(b.step()));
            }
        }
        this.bucketizers = Collections.unmodifiableMap(byName);
    }

    /**
     * Picks each breakdown's value out of a raw record: synthetic breakdowns were already written under their name,
     * the others are read from their source field.
     */
    public static Map<String, Object> project(Map<String, ?> record, List<Breakdown> breakdowns) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Breakdown b : breakdowns) {
            fields.put(b.name(), Records.pluck(record, b.isSynthetic() ? b.name() : b.field()));
        }
        return fields;
    }

    /** @return {@code false} if the point was dropped */
    public boolean add(AggregatedPoint point) {
        Object[] key = new Object[breakdowns.size()];
        for (int i = 0; i < key.length; i++) {
            Breakdown b = breakdowns.get(i);
            Object value = point.field(b.name());
            Bucketizer bucketizer = bucketizers.get(b.name());
            if (bucketizer != null) {
                Double numeric = FieldValues.asDouble(value);
                if (numeric == null || numeric.isNaN()) {
                    nonNumeric++;
                    log.debug("Dropping point with non-numeric value field={} value={}", b.name(), value);
                    return false;
                }
                bucketizer.observe(numeric, point.value());
                value = bucketizer.bucketize(numeric);
            }
            key[i] = FieldValues.normalize(value);
        }
        groups.computeIfAbsent(Arrays.asList(key), k -> new long[1])[0] += point.value();
        processed++;
        return true;
    }

    public List<AggregatedPoint> results() {
        List<AggregatedPoint> out = new ArrayList<>(groups.size());
        groups.forEach((key, sum) -> {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (int i = 0; i < breakdowns.size(); i++) {
                fields.put(breakdowns.get(i).name(), key.get(i));
            }
            out.add(new AggregatedPoint(fields, sum[0]));
        });
        return out;
    }

    public List<Breakdown> breakdowns() {
        return breakdowns;
    }

    public Map<String, Bucketizer> bucketizers() {
        return bucketizers;
    }

    public long processed() {
        return processed;
    }

    public long nonNumericErrors() {
        return nonNumeric;
    }
}
