package com.dragnet.core.filter;

import com.dragnet.core.exception.CompileException;
import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.exception.FilterEvaluationException;
import com.dragnet.core.json.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * A compiled boolean filter over records.
 *
 * <p>Filters are JSON trees: {@code {"and": [..]}}, {@code {"or": [..]}} or a single comparison {@code {"op":
 * [field, literal]}} with {@code op} one of {@code eq ne lt le gt ge}. The empty object is the trivial filter that
 * accepts everything. Two filters are the same filter when their {@link #serialize() serialized} forms are equal.
 */
public final class FilterPredicate {

    private sealed interface Node permits Trivial, Junction, Comparison {}

    private record Trivial() implements Node {}

    private record Junction(boolean conjunction, List<Node> children) implements Node {}

    private record Comparison(ComparisonOp op, String field, Object literal) implements Node {}

    private final JsonNode tree;
    private final Node root;
    private final Set<String> fields;

    private FilterPredicate(JsonNode tree, Node root) {
        this.tree = tree;
        this.root = root;
        Set<String> collected = new LinkedHashSet<>();
        collectFields(root, collected);
        this.fields = Collections.unmodifiableSet(collected);
    }

    public static FilterPredicate compile(JsonNode tree) {
        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            throw new ConfigException("filter is required");
        }
        return new FilterPredicate(tree.deepCopy(), compileNode(tree));
    }

    public static FilterPredicate compile(String json) {
        try {
            return compile(JsonUtil.parse(json));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("invalid filter: " + e.getMessage(), e);
        }
    }

    /** Conjunction of two filters; either may be {@code null}. */
    public static FilterPredicate and(FilterPredicate left, FilterPredicate right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        ObjectNode node = JsonUtil.object();
        ArrayNode children = node.putArray("and");
        children.add(left.tree.deepCopy());
        children.add(right.tree.deepCopy());
        return compile(node);
    }

    private static Node compileNode(JsonNode node) {
        if (!node.isObject()) {
            throw new ConfigException("filter must be an object: " + node);
        }
        if (node.size() == 0) {
            return new Trivial();
        }
        if (node.size() != 1) {
            throw new ConfigException("filter object must have exactly one key: " + node);
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String key = entry.getKey();
        JsonNode args = entry.getValue();
        if (!args.isArray()) {
            throw new ConfigException("filter \"" + key + "\" must have an array value");
        }
        if ("and".equals(key) || "or".equals(key)) {
            if (args.isEmpty()) {
                throw new ConfigException("filter \"" + key + "\" requires at least one predicate");
            }
            List<Node> children = new ArrayList<>(args.size());
            for (JsonNode child : args) {
                children.add(compileNode(child));
            }
            return new Junction("and".equals(key), List.copyOf(children));
        }
        ComparisonOp op = ComparisonOp.forKey(key);
        if (op == null) {
            throw new ConfigException("unknown filter operator \"" + key + "\"");
        }
        if (args.size() != 2 || !args.get(0).isTextual()) {
            throw new ConfigException("filter \"" + key + "\" requires [field, value]");
        }
        Object literal = literalOf(args.get(1), key);
        if (literal instanceof Boolean && !op.isEquality()) {
            throw new ConfigException("filter \"" + key + "\" cannot compare booleans");
        }
        return new Comparison(op, args.get(0).asText(), literal);
    }

    private static Object literalOf(JsonNode value, String key) {
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        throw new ConfigException("filter \"" + key + "\" value must be a string, number or boolean");
    }

    private static void collectFields(Node node, Set<String> into) {
        if (node instanceof Comparison c) {
            into.add(c.field());
        } else if (node instanceof Junction j) {
            j.children().forEach(child -> collectFields(child, into));
        }
    }

    public JsonNode tree() {
        return tree.deepCopy();
    }

    /** Compact JSON form; used to compare filters for equality. */
    public String serialize() {
        return JsonUtil.toJson(tree);
    }

    /** Field names referenced anywhere in the filter, in first-appearance order. */
    public Set<String> fields() {
        return fields;
    }

    public boolean isTrivial() {
        return root instanceof Trivial;
    }

    /**
     * @throws FilterEvaluationException when a referenced field holds a value that cannot be compared
     */
    public boolean eval(Map<String, ?> record) {
        return eval(root, record);
    }

    private static boolean eval(Node node, Map<String, ?> record) {
        if (node instanceof Trivial) {
            return true;
        }
        if (node instanceof Junction j) {
            for (Node child : j.children()) {
                boolean result = eval(child, record);
                if (j.conjunction() && !result) {
                    return false;
                }
                if (!j.conjunction() && result) {
                    return true;
                }
            }
            return j.conjunction();
        }
        Comparison c = (Comparison) node;
        Object value = Records.pluck(record, c.field());
        if (value == null) {
            return c.op() == ComparisonOp.NE;
        }
        if (value instanceof Map || value instanceof Iterable) {
            throw new FilterEvaluationException("field \"" + c.field() + "\" is not a scalar");
        }
        if (c.literal() instanceof Boolean b) {
            return c.op().test(value.equals(b) ? 0 : 1);
        }
        if (c.literal() instanceof Number n) {
            if (!(value instanceof Number actual)) {
                return mismatchedType(c, value, "numeric");
            }
            return c.op().test(Double.compare(actual.doubleValue(), n.doubleValue()));
        }
        if (!(value instanceof String actual)) {
            return mismatchedType(c, value, "a string");
        }
        return c.op().test(actual.compareTo((String) c.literal()));
    }

    // values of another type are never equal; ordering them is an evaluation error
    private static boolean mismatchedType(Comparison c, Object value, String expected) {
        if (c.op().isEquality()) {
            return c.op().test(1);
        }
        throw new FilterEvaluationException("field \"" + c.field() + "\" is not " + expected + ": \"" + value + "\"");
    }

    /**
     * Renders the filter as a SQL boolean expression, e.g. {@code (host = 'a')}. Only conjunctions and disjunctions of
     * string or numeric comparisons can be rendered. The expression selects the same rows {@link #eval} accepts,
     * provided columns keep the storage class of the values written to them: missing values satisfy only {@code ne},
     * and values of the wrong type are unequal and never ordered.
     *
     * @param columns maps a field name to its column identifier
     * @return the expression, or {@code null} for the trivial filter
     */
    public String toRestrictedExpression(UnaryOperator<String> columns) {
        if (root instanceof Trivial) {
            return null;
        }
        return render(root, columns);
    }

    private static String render(Node node, UnaryOperator<String> columns) {
        if (node instanceof Trivial) {
            return "1";
        }
        if (node instanceof Junction j) {
            StringBuilder sb = new StringBuilder("(");
            Iterator<Node> it = j.children().iterator();
            while (it.hasNext()) {
                sb.append(render(it.next(), columns));
                if (it.hasNext()) {
                    sb.append(j.conjunction() ? " AND " : " OR ");
                }
            }
            return sb.append(')').toString();
        }
        Comparison c = (Comparison) node;
        String column = columns.apply(c.field());
        String comparison = column + " " + c.op().sql() + " " + sqlLiteral(c);
        if (c.op() == ComparisonOp.NE) {
            return "(" + column + " IS NULL OR " + comparison + ")";
        }
        if (!c.op().isEquality()) {
            // SQLite orders values of different storage classes instead of rejecting them
            String types = c.literal() instanceof String ? "= 'text'" : "IN ('integer', 'real')";
            return "(typeof(" + column + ") " + types + " AND " + comparison + ")";
        }
        return "(" + comparison + ")";
    }

    private static String sqlLiteral(Comparison c) {
        Object literal = c.literal();
        if (literal instanceof String s) {
            return "'" + s.replace("'", "''") + "'";
        }
        if (literal instanceof Long l) {
            return l.toString();
        }
        if (literal instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new CompileException("cannot express " + d + " in an index query");
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        throw new CompileException("filter on \"" + c.field() + "\" compares a " + literal.getClass().getSimpleName()
                + ", which index queries do not support");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FilterPredicate other && serialize().equals(other.serialize());
    }

    @Override
    public int hashCode() {
        return serialize().hashCode();
    }

    @Override
    public String toString() {
        return serialize();
    }
}
