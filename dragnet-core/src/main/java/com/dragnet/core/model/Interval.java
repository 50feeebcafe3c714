package com.dragnet.core.model;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.time.PartitionPattern;
import java.time.Instant;
import java.time.ZoneOffset;

/** How an index build splits its output into files by record time. */
public enum Interval {
    ALL("all", 0, "all", null),
    HOUR("hour", 3600, "by_hour", "%Y-%m-%d-%H"),
    DAY("day", 86400, "by_day", "%Y-%m-%d");

    private final String label;
    private final long seconds;
    private final String directory;
    private final String timeFormat;

    Interval(String label, long seconds, String directory, String timeFormat) {
        this.label = label;
        this.seconds = seconds;
        this.directory = directory;
        this.timeFormat = timeFormat;
    }

    public static Interval fromLabel(String label) {
        if (label == null) {
            return ALL;
        }
        for (Interval i : values()) {
            if (i.label.equals(label)) {
                return i;
            }
        }
        throw new ConfigException("unsupported interval: \"" + label + "\"");
    }

    public String label() {
        return label;
    }

    /** Bucket width in seconds; zero for {@link #ALL}. */
    public long seconds() {
        return seconds;
    }

    /** Directory (or, for {@link #ALL}, file) name under the index root. */
    public String directory() {
        return directory;
    }

    /** Partition pattern of index file names relative to {@link #directory()}; {@code null} for {@link #ALL}. */
    public String fileNamePattern() {
        return timeFormat == null ? null : timeFormat + ".sqlite";
    }

    public long bucketStart(long epochSeconds) {
        return seconds == 0 ? 0 : Math.floorDiv(epochSeconds, seconds) * seconds;
    }

    public String fileName(long bucketStartSeconds) {
        if (timeFormat == null) {
            throw new IllegalStateException("interval \"all\" has a single index file");
        }
        return PartitionPattern.parse(fileNamePattern())
                .render(Instant.ofEpochSecond(bucketStartSeconds).atZone(ZoneOffset.UTC));
    }
}
