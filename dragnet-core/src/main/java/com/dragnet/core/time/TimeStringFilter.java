package com.dragnet.core.time;

import com.dragnet.core.exception.PatternException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a partition string such as {@code year-2014/month-05} could hold data inside a time range.
 *
 * <p>The pattern is compiled into one regular expression per prefix ending at a newly introduced specifier. A string
 * is tested against the most specific prefix first; the first expression matching a prefix of the string fixes the
 * implied interval {@code [min, min + 1 unit)} where the unit is the smallest one captured. Strings matching no
 * expression carry no date information and are always contained.
 */
public final class TimeStringFilter {

    private record Partial(Pattern regex, List<PartitionUnit> groups) {}

    private final PartitionPattern pattern;
    private final List<Partial> partials;

    private TimeStringFilter(PartitionPattern pattern, List<Partial> partials) {
        this.pattern = pattern;
        this.partials = partials;
    }

    public static TimeStringFilter create(String pattern) {
        PartitionPattern parsed = PartitionPattern.parse(pattern);
        Map<PartitionUnit, Integer> groupOf = new EnumMap<>(PartitionUnit.class);
        List<PartitionUnit> groups = new ArrayList<>();
        List<Partial> partials = new ArrayList<>();
        StringBuilder regex = new StringBuilder();

        for (PartitionPattern.Token token : parsed.tokens()) {
            if (token instanceof PartitionPattern.Literal literal) {
                regex.append(Pattern.quote(literal.text()));
                continue;
            }
            PartitionUnit unit = ((PartitionPattern.Specifier) token).unit();
            Integer existing = groupOf.get(unit);
            if (existing != null) {
                regex.append('\\').append(existing);
                continue;
            }
            checkOrder(unit, groupOf);
            groups.add(unit);
            groupOf.put(unit, groups.size());
            regex.append(unit.regex());
            partials.add(new Partial(Pattern.compile(regex.toString()), List.copyOf(groups)));
        }

        List<Partial> mostSpecificFirst = new ArrayList<>(partials.size());
        for (int i = partials.size() - 1; i >= 0; i--) {
            mostSpecificFirst.add(partials.get(i));
        }
        return new TimeStringFilter(parsed, List.copyOf(mostSpecificFirst));
    }

    private static void checkOrder(PartitionUnit unit, Map<PartitionUnit, Integer> seen) {
        if (unit == PartitionUnit.YEAR) {
            return;
        }
        PartitionUnit parent = PartitionUnit.values()[unit.ordinal() - 1];
        if (!seen.containsKey(parent)) {
            throw new PatternException(
                    "\"%" + parent.conversion() + "\" must appear before \"%" + unit.conversion() + "\"");
        }
    }

    public PartitionPattern pattern() {
        return pattern;
    }

    /**
     * @param start inclusive lower bound, or {@code null} for unbounded
     * @param end exclusive upper bound, or {@code null} for unbounded
     */
    public boolean rangeContains(Instant start, Instant end, String value) {
        for (Partial partial : partials) {
            Matcher m = partial.regex().matcher(value);
            if (!m.lookingAt()) {
                continue;
            }
            ZonedDateTime min = ZonedDateTime.of(Integer.parseInt(m.group(1)), 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
            PartitionUnit smallest = PartitionUnit.YEAR;
            for (int g = 1; g < partial.groups().size(); g++) {
                PartitionUnit unit = partial.groups().get(g);
                int field = Integer.parseInt(m.group(g + 1));
                min = switch (unit) {
                    case MONTH -> min.plusMonths(field - 1L);
                    case DAY -> min.plusDays(field - 1L);
                    case HOUR -> min.plusHours(field);
                    case YEAR -> min;
                };
                smallest = unit;
            }
            if (end != null && !min.toInstant().isBefore(end)) {
                return false;
            }
            ZonedDateTime max = smallest.increment(min);
            return start == null || max.toInstant().isAfter(start);
        }
        return true;
    }
}
