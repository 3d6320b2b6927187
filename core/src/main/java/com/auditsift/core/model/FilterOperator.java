package com.auditsift.core.model;

/** sys_filter 비교 연산자 */
public enum FilterOperator {
    EQ("eq"),
    GT("gt"),
    LT("lt"),
    GE("ge"),
    LE("le"),
    IN("in");

    private final String value;

    FilterOperator(String value) { this.value = value; }

    public String value() { return value; }

    /** 순서 비교 연산자 여부 (gt/lt/ge/le) */
    public boolean isOrdering() {
        return this == GT || this == LT || this == GE || this == LE;
    }

    /** compareTo 결과를 연산자 의미로 해석 */
    public boolean test(int cmp) {
        return switch (this) {
            case EQ, IN -> cmp == 0;
            case GT -> cmp > 0;
            case LT -> cmp < 0;
            case GE -> cmp >= 0;
            case LE -> cmp <= 0;
        };
    }

    public static FilterOperator fromValue(String s) {
        if (s != null) {
            String v = s.trim();
            for (FilterOperator op : values()) {
                if (op.value.equalsIgnoreCase(v)) return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + s);
    }

    @Override public String toString() { return value; }
}
