package com.logquery.index;

import com.logquery.config.EngineConfig;
import com.logquery.config.FieldAliasTable;
import com.logquery.config.NumericFieldSet;
import com.logquery.query.FilterOp;
import com.logquery.query.QueryNode;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.DoublePoint;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.util.QueryBuilder;
import org.apache.lucene.util.automaton.TooComplexToDeterminizeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * 将查询树编译为 Lucene {@link Query}。
 * <p>
 * NOT 与不等于都表示为 "全部文档减去子查询"（MUST MatchAll + MUST_NOT child），
 * 因为纯否定的布尔查询不匹配任何文档。范围取值无法解析为数字时退化为该字段上的匹配查询。
 */
public class LuceneQueryCompiler {
    private static final Logger logger = LoggerFactory.getLogger(LuceneQueryCompiler.class);
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final FieldAliasTable fieldAliases;
    private final NumericFieldSet numericFields;
    private final String fullTextField;
    private final QueryBuilder queryBuilder;

    public LuceneQueryCompiler(EngineConfig config) {
        this(config.getFieldAliases(), config.getNumericFields(), config.getFullTextField(), new StandardAnalyzer());
    }

    public LuceneQueryCompiler(FieldAliasTable fieldAliases, NumericFieldSet numericFields,
                               String fullTextField, Analyzer analyzer) {
        this.fieldAliases = fieldAliases;
        this.numericFields = numericFields;
        this.fullTextField = fullTextField;
        this.queryBuilder = new QueryBuilder(analyzer);
    }

    /**
     * 编译查询树；null 树返回 MatchAllDocsQuery。
     */
    public Query toIndexQuery(QueryNode node) {
        if (node == null) {
            return new MatchAllDocsQuery();
        }
        return compile(node);
    }

    private Query compile(QueryNode node) {
        if (node instanceof QueryNode.BooleanNode booleanNode) {
            return switch (booleanNode.op()) {
                case AND -> combine(booleanNode, BooleanClause.Occur.MUST);
                case OR -> combine(booleanNode, BooleanClause.Occur.SHOULD);
                case NOT -> everythingExcept(compile(booleanNode.children().get(0)));
            };
        }
        return compileLeaf((QueryNode.FieldFilter) node);
    }

    private Query combine(QueryNode.BooleanNode booleanNode, BooleanClause.Occur occur) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (QueryNode child : booleanNode.children()) {
            builder.add(compile(child), occur);
        }
        return builder.build();
    }

    private Query compileLeaf(QueryNode.FieldFilter filter) {
        if (filter.op() == FilterOp.FULL_TEXT) {
            return matchQuery(fullTextField, filter.value());
        }

        String column = fieldAliases.resolve(filter.field());
        return switch (filter.op()) {
            case EQUALS -> exactQuery(column, filter.value());
            case NOT_EQUALS -> everythingExcept(exactQuery(column, filter.value()));
            case WILDCARD -> wildcardQuery(column, filter.value());
            case GREATER_THAN, GREATER_OR_EQUAL, LESS_THAN, LESS_OR_EQUAL -> rangeQuery(column, filter);
            case FULL_TEXT -> matchQuery(fullTextField, filter.value());
        };
    }

    /**
     * 精确匹配。数值列上的数字取值使用点精确查询，其余使用词项查询。
     */
    private Query exactQuery(String column, String value) {
        if (numericFields.isNumeric(column)) {
            OptionalDouble number = parseNumber(value);
            if (number.isPresent()) {
                return DoublePoint.newExactQuery(column, number.getAsDouble());
            }
        }
        return new TermQuery(new Term(column, value));
    }

    /**
     * 通配查询；模式过于复杂无法确定化时退化为该字段上的匹配查询。
     */
    private Query wildcardQuery(String column, String value) {
        try {
            return new WildcardQuery(new Term(column, value));
        } catch (TooComplexToDeterminizeException e) {
            logger.debug("通配模式过于复杂，退化为匹配查询: {}:{}", column, value);
            return matchQuery(column, value);
        }
    }

    private Query rangeQuery(String column, QueryNode.FieldFilter filter) {
        OptionalDouble number = parseNumber(filter.value());
        if (number.isEmpty()) {
            logger.debug("范围取值非数字，退化为匹配查询: {} {} {}", column, filter.op().code(), filter.value());
            return matchQuery(column, filter.value());
        }

        double bound = number.getAsDouble();
        double lower = Double.NEGATIVE_INFINITY;
        double upper = Double.POSITIVE_INFINITY;
        switch (filter.op()) {
            case GREATER_THAN -> lower = DoublePoint.nextUp(bound);
            case GREATER_OR_EQUAL -> lower = bound;
            case LESS_THAN -> upper = DoublePoint.nextDown(bound);
            case LESS_OR_EQUAL -> upper = bound;
            default -> throw new IllegalStateException("非范围操作符: " + filter.op());
        }
        return DoublePoint.newRangeQuery(column, lower, upper);
    }

    /**
     * 相关性匹配查询；分析后没有词项时返回 MatchNoDocsQuery。
     */
    private Query matchQuery(String field, String value) {
        Query query = queryBuilder.createBooleanQuery(field, value);
        if (query == null) {
            logger.debug("取值分析后无词项，不匹配任何文档: {}:{}", field, value);
            return new MatchNoDocsQuery("no terms in \"" + value + "\"");
        }
        return query;
    }

    private static Query everythingExcept(Query excluded) {
        return new BooleanQuery.Builder()
                .add(excluded, BooleanClause.Occur.MUST_NOT)
                .add(new MatchAllDocsQuery(), BooleanClause.Occur.MUST)
                .build();
    }

    /**
     * 解析十进制数字；超出 double 范围（如 1e400）视为非数字。
     */
    static OptionalDouble parseNumber(String value) {
        if (!DECIMAL.matcher(value).matches()) {
            return OptionalDouble.empty();
        }
        double number = Double.parseDouble(value);
        return Double.isInfinite(number) ? OptionalDouble.empty() : OptionalDouble.of(number);
    }
}
