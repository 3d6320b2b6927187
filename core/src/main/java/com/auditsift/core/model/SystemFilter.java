package com.auditsift.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SearchConfig 적용 대상을 제한하는 조건 1개.
 * value 는 스칼라, 또는 {@link FilterOperator#IN} 일 때만 컬렉션.
 */
public record SystemFilter(FilterAttribute attr, FilterOperator comp, Object value) {

    public SystemFilter {
        Objects.requireNonNull(attr, "attr");
        Objects.requireNonNull(comp, "comp");
        if (comp == FilterOperator.IN) {
            if (!(value instanceof Collection<?> c)) {
                throw new IllegalArgumentException("Operator 'in' requires a list value for " + attr);
            }
            value = Collections.unmodifiableList(new ArrayList<Object>(c)); // null 멤버 허용 (YAML ~)
        } else if (value instanceof Collection<?>) {
            throw new IllegalArgumentException("Operator '" + comp + "' does not accept a list value for " + attr);
        } else if (value == null) {
            throw new IllegalArgumentException("Filter value is required for " + attr);
        }
    }

    public static SystemFilter of(FilterAttribute attr, FilterOperator comp, Object value) {
        return new SystemFilter(attr, comp, value);
    }

    /** in 연산자의 후보 목록 (그 외 연산자면 빈 목록). null 멤버가 있을 수 있다. */
    @SuppressWarnings("unchecked")
    public List<Object> values() {
        return (comp == FilterOperator.IN) ? (List<Object>) value : List.of();
    }

    @Override
    public String toString() {
        return attr + " " + comp + " " + value;
    }
}
