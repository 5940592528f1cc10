package com.logquery.query;

/**
 * 词法阶段错误：未闭合引号或无法识别的字符。
 */
public class QueryLexException extends QueryParseException {

    public QueryLexException(ErrorKind kind, String message, int position, String queryString) {
        super(kind, message, position, queryString);
    }
}
