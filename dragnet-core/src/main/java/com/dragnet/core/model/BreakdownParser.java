package com.dragnet.core.model;

import com.dragnet.core.exception.ConfigException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses comma-separated field lists with optional bracketed attributes, e.g. {@code
 * host,latency[aggr=quantize],ts[field=time,date,aggr=lquantize,step=3600]}.
 */
public final class BreakdownParser {

    private BreakdownParser() {}

    /**
     * Splits the list into attribute maps. Each map holds {@code name} plus one entry per attribute; bare attributes
     * map to the empty string. Empty list entries and empty attributes are skipped.
     */
    public static List<Map<String, String>> parseAttributes(String input) {
        List<Map<String, String>> result = new ArrayList<>();
        Map<String, String> props = null;
        int start = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (props == null) {
                if (c == ',') {
                    if (i > start) {
                        result.add(named(input.substring(start, i)));
                    }
                    start = i + 1;
                } else if (c == '[') {
                    if (i == start) {
                        throw new ConfigException("missing field name");
                    }
                    props = named(input.substring(start, i));
                    start = i + 1;
                }
                continue;
            }
            if (c == ',' || c == ']') {
                if (i > start) {
                    String def = input.substring(start, i);
                    int eq = def.indexOf('=');
                    if (eq == -1) {
                        props.put(def, "");
                    } else if (eq == 0) {
                        throw new ConfigException("missing attribute name");
                    } else {
                        props.put(def.substring(0, eq), def.substring(eq + 1));
                    }
                }
                if (c == ']') {
                    result.add(props);
                    props = null;
                }
                start = i + 1;
            }
        }
        if (props != null) {
            throw new ConfigException("unexpected end of string");
        }
        if (start < input.length()) {
            result.add(named(input.substring(start)));
        }
        return result;
    }

    public static List<Breakdown> parseList(String input) {
        List<Breakdown> breakdowns = new ArrayList<>();
        for (Map<String, String> attrs : parseAttributes(input)) {
            breakdowns.add(toBreakdown(attrs));
        }
        return breakdowns;
    }

    public static Breakdown parseOne(String input) {
        List<Map<String, String>> parsed = parseAttributes(input);
        if (parsed.size() != 1) {
            throw new ConfigException("expected exactly one field: \"" + input + "\"");
        }
        return toBreakdown(parsed.get(0));
    }

    private static Map<String, String> named(String name) {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("name", name);
        return props;
    }

    private static Breakdown toBreakdown(Map<String, String> attrs) {
        Double step = null;
        String name = attrs.get("name");
        for (String key : attrs.keySet()) {
            if (!key.equals("name") && !key.equals("field") && !key.equals("aggr") && !key.equals("step")
                    && !key.equals("date")) {
                throw new ConfigException("field \"" + name + "\": unsupported attribute \"" + key + "\"");
            }
        }
        String rawStep = attrs.get("step");
        if (rawStep != null) {
            try {
                step = Double.parseDouble(rawStep);
            } catch (NumberFormatException e) {
                throw new ConfigException("field \"" + name + "\": \"step\" is not a number: \"" + rawStep + "\"", e);
            }
        }
        return new Breakdown(name, attrs.get("field"), Aggregation.fromLabel(attrs.get("aggr")), step, attrs.get("date"));
    }
}
