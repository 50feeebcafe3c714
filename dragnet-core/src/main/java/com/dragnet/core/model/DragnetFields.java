package com.dragnet.core.model;

/** Field names dragnet adds to records and points internally. User breakdowns may not use the prefix. */
public final class DragnetFields {

    public static final String RESERVED_PREFIX = "__dn";

    /** Record timestamp in epoch seconds, or its bucket when used as a breakdown. */
    public static final String TIMESTAMP = "__dn_ts";

    /** Index of the metric a point was aggregated for during an index build. */
    public static final String METRIC = "__dn_metric";

    private DragnetFields() {}

    public static boolean isReserved(String name) {
        return name.startsWith(RESERVED_PREFIX);
    }
}
