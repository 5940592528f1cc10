package com.logquery.query;

import com.logquery.config.Constants;
import com.logquery.config.EngineConfig;
import com.logquery.index.LuceneQueryCompiler;
import com.logquery.query.QueryParseException.ErrorKind;
import com.logquery.sql.ClickHousePredicateCompiler;
import com.logquery.sql.ScopedWhereClause;
import com.logquery.sql.SqlPredicate;
import org.apache.lucene.search.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KQL 查询管线入口：词法 -> 语法 -> 查询树 -> ClickHouse 谓词 / Lucene 查询。
 * 配置在构造时读取一次，之后实例无可变状态，可被多个请求线程共享。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final int maxQueryLength;
    private final ClickHousePredicateCompiler predicateCompiler;
    private final LuceneQueryCompiler indexCompiler;

    /**
     * 使用默认配置构造查询引擎。
     */
    public QueryEngine() {
        this(EngineConfig.defaults());
    }

    /**
     * 使用 EngineConfig 注入别名表、数值字段集与列名构造查询引擎。
     */
    public QueryEngine(EngineConfig config) {
        this.maxQueryLength = config.getMaxQueryLength();
        this.predicateCompiler = new ClickHousePredicateCompiler(config);
        this.indexCompiler = new LuceneQueryCompiler(config);
    }

    /**
     * 解析查询；空白查询返回 null，表示不过滤。
     */
    public QueryNode parse(String queryString) {
        String query = queryString == null ? "" : queryString;
        if (query.length() > maxQueryLength) {
            throw new QueryParseException(ErrorKind.TOO_LONG,
                    "查询长度超过限制（最大 " + maxQueryLength + " 字符）", maxQueryLength, query);
        }
        QueryParser.ParseResult result = new QueryParser().parse(query);
        logger.debug("解析完成: query=\"{}\", empty={}", query, result.isEmpty());
        return result.ast();
    }

    /**
     * 仅校验语法，非法时抛出 {@link QueryParseException}。
     */
    public void validate(String queryString) {
        parse(queryString);
    }

    public SqlPredicate toPredicate(String queryString) {
        return predicateCompiler.toPredicate(parse(queryString));
    }

    public SqlPredicate toPredicate(QueryNode ast) {
        return predicateCompiler.toPredicate(ast);
    }

    public Query toIndexQuery(String queryString) {
        return indexCompiler.toIndexQuery(parse(queryString));
    }

    public Query toIndexQuery(QueryNode ast) {
        return indexCompiler.toIndexQuery(ast);
    }

    /**
     * 构建带租户/作业范围的 WHERE 子句；空查询或单独的 * 不追加 KQL 条件。
     */
    public ScopedWhereClause toScopedWhere(String tenantId, String jobId, String queryString) {
        if (QueryLexer.isBlank(queryString)
                || Constants.MATCH_ALL_QUERY.equals(QueryLexer.trimSpaces(queryString))) {
            return ScopedWhereClause.of(tenantId, jobId, null);
        }
        QueryNode ast = parse(queryString);
        return ScopedWhereClause.of(tenantId, jobId, ast == null ? null : predicateCompiler.toPredicate(ast));
    }
}
