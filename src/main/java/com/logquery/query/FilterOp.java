package com.logquery.query;

import com.fasterxml.jackson.annotation.JsonValue;

/** 叶子节点的比较操作符 */
public enum FilterOp {
    EQUALS("eq", "="),
    NOT_EQUALS("neq", "!="),
    GREATER_THAN("gt", ">"),
    GREATER_OR_EQUAL("gte", ">="),
    LESS_THAN("lt", "<"),
    LESS_OR_EQUAL("lte", "<="),
    WILDCARD("wildcard", "ILIKE"),
    FULL_TEXT("fulltext", "ILIKE");

    private final String code;
    private final String sqlOperator;

    FilterOp(String code, String sqlOperator) {
        this.code = code;
        this.sqlOperator = sqlOperator;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String sqlOperator() {
        return sqlOperator;
    }
}
