package com.logquery.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * KQL 查询树节点：叶子为字段过滤（或全文词项），分支为布尔组合。
 * 节点构造后不可变，可在并发编译间共享。
 */
public sealed interface QueryNode permits QueryNode.FieldFilter, QueryNode.BooleanNode {

    /** 布尔操作类型 */
    enum BoolOp {
        AND,
        OR,
        NOT
    }

    boolean isLeaf();

    /**
     * 字段过滤叶子。field 为 null 表示全文词项。
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record FieldFilter(String field, FilterOp op, String value) implements QueryNode {
        public FieldFilter {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(value, "value");
            if (field == null && op != FilterOp.FULL_TEXT) {
                throw new IllegalArgumentException("只有全文叶子可以省略字段: " + op);
            }
        }

        public static FieldFilter fullText(String value) {
            return new FieldFilter(null, FilterOp.FULL_TEXT, value);
        }

        @Override
        @JsonIgnore
        public boolean isLeaf() {
            return true;
        }
    }

    /**
     * 布尔分支。NOT 恰有一个子节点，AND/OR 至少两个。
     */
    record BooleanNode(@JsonProperty("bool_op") BoolOp op, List<QueryNode> children) implements QueryNode {
        public BooleanNode {
            Objects.requireNonNull(op, "op");
            children = List.copyOf(children);
            if (op == BoolOp.NOT && children.size() != 1) {
                throw new IllegalArgumentException("NOT 需要恰好一个子节点，实际为 " + children.size());
            }
            if (op != BoolOp.NOT && children.size() < 2) {
                throw new IllegalArgumentException(op + " 至少需要两个子节点，实际为 " + children.size());
            }
        }

        public static BooleanNode and(QueryNode left, QueryNode right) {
            return new BooleanNode(BoolOp.AND, List.of(left, right));
        }

        public static BooleanNode or(QueryNode left, QueryNode right) {
            return new BooleanNode(BoolOp.OR, List.of(left, right));
        }

        public static BooleanNode not(QueryNode child) {
            return new BooleanNode(BoolOp.NOT, List.of(child));
        }

        @Override
        @JsonIgnore
        public boolean isLeaf() {
            return false;
        }
    }
}
