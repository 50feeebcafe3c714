package com.dragnet.core.filter;

enum ComparisonOp {
    EQ("eq", "="),
    NE("ne", "<>"),
    LT("lt", "<"),
    LE("le", "<="),
    GT("gt", ">"),
    GE("ge", ">=");

    private final String key;
    private final String sql;

    ComparisonOp(String key, String sql) {
        this.key = key;
        this.sql = sql;
    }

    String key() {
        return key;
    }

    String sql() {
        return sql;
    }

    boolean isEquality() {
        return this == EQ || this == NE;
    }

    static ComparisonOp forKey(String key) {
        for (ComparisonOp op : values()) {
            if (op.key.equals(key)) {
                return op;
            }
        }
        return null;
    }

    boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
        };
    }
}
