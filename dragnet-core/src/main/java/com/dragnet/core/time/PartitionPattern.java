package com.dragnet.core.time;

import com.dragnet.core.exception.PatternException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * A strftime-like partition pattern restricted to {@code %Y %m %d %H} and the {@code %%} escape, e.g.
 * {@code /logs/%Y/%m/%d}. Specifiers run from larger to smaller units; a unit may repeat, but no new unit may follow a
 * smaller one.
 */
public final class PartitionPattern {

    public sealed interface Token permits Literal, Specifier {}

    public record Literal(String text) implements Token {}

    public record Specifier(PartitionUnit unit, int position) implements Token {}

    private final String source;
    private final List<Token> tokens;

    private PartitionPattern(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = Collections.unmodifiableList(tokens);
    }

    public static PartitionPattern parse(String pattern) {
        if (pattern == null) {
            throw new PatternException("pattern is required");
        }
        List<Token> tokens = new ArrayList<>();
        EnumSet<PartitionUnit> seen = EnumSet.noneOf(PartitionUnit.class);
        PartitionUnit smallest = null;
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i == pattern.length() - 1) {
                throw new PatternException("unexpected \"%\" at char " + (i + 1));
            }
            char conversion = pattern.charAt(++i);
            if (conversion == '%') {
                literal.append('%');
                continue;
            }
            PartitionUnit unit = PartitionUnit.forConversion(conversion);
            if (unit == null) {
                throw new PatternException("unsupported conversion \"%" + conversion + "\" at char " + i);
            }
            if (seen.add(unit)) {
                if (smallest != null && unit.compareTo(smallest) < 0) {
                    throw new PatternException(
                            "\"%" + unit.conversion() + "\" must appear before \"%" + smallest.conversion() + "\"");
                }
                smallest = unit;
            }
            if (literal.length() > 0) {
                tokens.add(new Literal(literal.toString()));
                literal.setLength(0);
            }
            tokens.add(new Specifier(unit, i - 1));
        }
        if (literal.length() > 0) {
            tokens.add(new Literal(literal.toString()));
        }
        return new PartitionPattern(pattern, tokens);
    }

    public String source() {
        return source;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public boolean hasSpecifiers() {
        return tokens.stream().anyMatch(t -> t instanceof Specifier);
    }

    /** The most specific unit present, if any. */
    public Optional<PartitionUnit> smallestUnit() {
        PartitionUnit smallest = null;
        for (Token token : tokens) {
            if (token instanceof Specifier s && (smallest == null || s.unit().compareTo(smallest) > 0)) {
                smallest = s.unit();
            }
        }
        return Optional.ofNullable(smallest);
    }

    public String render(ZonedDateTime time) {
        StringBuilder out = new StringBuilder();
        for (Token token : tokens) {
            if (token instanceof Literal l) {
                out.append(l.text());
            } else if (token instanceof Specifier s) {
                out.append(s.unit().render(time));
            }
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
