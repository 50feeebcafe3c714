package com.dragnet.core.filter;

import java.util.Map;

/** Field access on raw records, which are nested string-keyed maps as produced by Jackson. */
public final class Records {

    private Records() {}

    /**
     * Looks up {@code key} in {@code record}. An exact top-level key wins; otherwise dotted keys descend into nested
     * objects ({@code "req.method"} finds {@code {"req": {"method": ...}}}).
     */
    public static Object pluck(Map<String, ?> record, String key) {
        if (record == null) {
            return null;
        }
        if (record.containsKey(key)) {
            return record.get(key);
        }
        int dot = key.indexOf('.');
        while (dot != -1) {
            Object child = record.get(key.substring(0, dot));
            if (child instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, ?> typed = (Map<String, ?>) nested;
                Object found = pluck(typed, key.substring(dot + 1));
                if (found != null) {
                    return found;
                }
            }
            dot = key.indexOf('.', dot + 1);
        }
        return null;
    }
}
