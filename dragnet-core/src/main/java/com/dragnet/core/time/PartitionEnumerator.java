package com.dragnet.core.time;

import com.dragnet.core.exception.ConfigException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily lists every partition string a pattern renders to between two instants. Each call to {@link
 * Iterable#iterator()} restarts the enumeration; values are only computed as the consumer pulls them.
 */
public final class PartitionEnumerator implements Iterable<String> {

    private final PartitionPattern pattern;
    private final Instant start;
    private final Instant end;

    private PartitionEnumerator(PartitionPattern pattern, Instant start, Instant end) {
        this.pattern = pattern;
        this.start = start;
        this.end = end;
    }

    /**
     * @param start inclusive; rounded down to the pattern's smallest unit
     * @param end exclusive; an empty range yields nothing unless the pattern has no date fields
     */
    public static PartitionEnumerator enumerate(String pattern, Instant start, Instant end) {
        if (start == null || end == null) {
            throw new ConfigException("start and end are required");
        }
        if (start.isAfter(end)) {
            throw new ConfigException("start time must not be after end time");
        }
        return new PartitionEnumerator(PartitionPattern.parse(pattern), start, end);
    }

    @Override
    public Iterator<String> iterator() {
        if (!pattern.hasSpecifiers()) {
            return List.of(pattern.render(start.atZone(ZoneOffset.UTC))).iterator();
        }
        if (!start.isBefore(end)) {
            return Collections.emptyIterator();
        }
        PartitionUnit unit = pattern.smallestUnit().orElseThrow();
        ZonedDateTime first = unit.alignDown(start.atZone(ZoneOffset.UTC));
        return new Iterator<>() {
            private ZonedDateTime next = first;

            @Override
            public boolean hasNext() {
                return next.toInstant().isBefore(end);
            }

            @Override
            public String next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                String value = pattern.render(next);
                next = unit.increment(next);
                return value;
            }
        };
    }
}
