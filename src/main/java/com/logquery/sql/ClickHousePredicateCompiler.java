package com.logquery.sql;

import com.logquery.config.Constants;
import com.logquery.config.EngineConfig;
import com.logquery.config.FieldAliasTable;
import com.logquery.query.FilterOp;
import com.logquery.query.QueryNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 将查询树编译为 ClickHouse WHERE 片段。取值一律作为绑定参数，绝不拼接进片段文本。
 * 无状态，可在线程间共享。
 */
public class ClickHousePredicateCompiler {
    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final FieldAliasTable fieldAliases;
    private final String rawTextColumn;

    public ClickHousePredicateCompiler(EngineConfig config) {
        this(config.getFieldAliases(), config.getRawTextColumn());
    }

    public ClickHousePredicateCompiler(FieldAliasTable fieldAliases, String rawTextColumn) {
        this.fieldAliases = fieldAliases;
        this.rawTextColumn = rawTextColumn;
    }

    /**
     * 编译查询树；null 树返回恒真片段且无绑定值。
     */
    public SqlPredicate toPredicate(QueryNode node) {
        if (node == null) {
            return SqlPredicate.matchAll();
        }
        List<String> params = new ArrayList<>();
        String fragment = compile(node, params);
        return new SqlPredicate(fragment, params);
    }

    private String compile(QueryNode node, List<String> params) {
        if (node instanceof QueryNode.BooleanNode booleanNode) {
            if (booleanNode.op() == QueryNode.BoolOp.NOT) {
                return "NOT (" + compile(booleanNode.children().get(0), params) + ")";
            }
            StringBuilder fragment = new StringBuilder("(");
            String separator = " " + booleanNode.op().name() + " ";
            for (int i = 0; i < booleanNode.children().size(); i++) {
                if (i > 0) {
                    fragment.append(separator);
                }
                fragment.append(compile(booleanNode.children().get(i), params));
            }
            return fragment.append(')').toString();
        }
        return compileLeaf((QueryNode.FieldFilter) node, params);
    }

    private String compileLeaf(QueryNode.FieldFilter filter, List<String> params) {
        if (filter.op() == FilterOp.FULL_TEXT) {
            params.add("%" + escapeLikePattern(filter.value()) + "%");
            return rawTextColumn + " ILIKE ?";
        }

        String column = columnFor(filter.field());
        if (filter.op() == FilterOp.WILDCARD) {
            params.add(escapeLikePattern(filter.value()).replace('*', '%'));
        } else {
            params.add(filter.value());
        }
        return column + " " + filter.op().sqlOperator() + " ?";
    }

    /**
     * 解析列名。未登记字段原样透传；不是普通标识符时以反引号引用，防止字段名携带 SQL。
     */
    String columnFor(String field) {
        String column = fieldAliases.resolve(field);
        if (PLAIN_IDENTIFIER.matcher(column).matches()) {
            return column;
        }
        return "`" + column.replace("\\", "\\\\").replace("`", "\\`") + "`";
    }

    /**
     * 转义 LIKE 元字符 % 与 _，反斜杠作为转义符（ClickHouse ILIKE/LIKE 默认）。
     */
    static String escapeLikePattern(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == Constants.LIKE_ESCAPE || ch == '%' || ch == '_') {
                escaped.append(Constants.LIKE_ESCAPE);
            }
            escaped.append(ch);
        }
        return escaped.toString();
    }
}
