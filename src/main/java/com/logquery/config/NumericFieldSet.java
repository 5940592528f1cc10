package com.logquery.config;

import java.util.Set;

/**
 * 按数值处理的规范列名集合，只读。
 */
public final class NumericFieldSet {
    private final Set<String> columns;

    private NumericFieldSet(Set<String> columns) {
        this.columns = Set.copyOf(columns);
    }

    public static NumericFieldSet of(Set<String> columns) {
        return new NumericFieldSet(columns);
    }

    public static NumericFieldSet defaults() {
        return new NumericFieldSet(Set.of("duration_ms"));
    }

    public boolean isNumeric(String column) {
        return columns.contains(column);
    }

    public Set<String> asSet() {
        return columns;
    }
}
