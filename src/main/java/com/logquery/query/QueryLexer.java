package com.logquery.query;

import com.logquery.query.QueryParseException.ErrorKind;

import java.util.ArrayList;
import java.util.List;

public class QueryLexer {
    /**
     * 将原始 KQL 字符串切分为词法 token 序列，末尾总是追加 EOF。
     * 按码点扫描，token 位置为 UTF-16 下标。
     */
    public List<LexToken> tokenize(String query) {
        if (query == null) {
            throw new QueryLexException(ErrorKind.NULL_QUERY, "查询字符串不能为 null", 0, "");
        }

        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < query.length()) {
            int codePoint = query.codePointAt(index);
            if (isQuerySpace(codePoint)) {
                index += Character.charCount(codePoint);
                continue;
            }

            if (codePoint == '"') {
                index = readQuotedToken(query, index, tokens);
                continue;
            }

            if (codePoint == ':') {
                tokens.add(new LexToken(TokenType.COLON, ":", index));
                index++;
                continue;
            }
            if (codePoint == '(') {
                tokens.add(new LexToken(TokenType.LPAREN, "(", index));
                index++;
                continue;
            }
            if (codePoint == ')') {
                tokens.add(new LexToken(TokenType.RPAREN, ")", index));
                index++;
                continue;
            }
            if (codePoint == '>' || codePoint == '<') {
                index = readComparisonToken(query, index, tokens);
                continue;
            }

            if (!isWordChar(codePoint)) {
                String character = query.substring(index, index + Character.charCount(codePoint));
                throw new QueryLexException(ErrorKind.UNEXPECTED_CHARACTER,
                        "无法识别字符: '" + character + "'", index, query);
            }

            int tokenStart = index;
            while (index < query.length() && isWordChar(query.codePointAt(index))) {
                index += Character.charCount(query.codePointAt(index));
            }
            tokens.add(new LexToken(TokenType.WORD, query.substring(tokenStart, index), tokenStart));
        }

        tokens.add(new LexToken(TokenType.EOF, "", query.length()));
        return tokens;
    }

    /**
     * 读取双引号值并追加去掉引号的 WORD token；引号内不支持转义。
     */
    private int readQuotedToken(String query, int quoteIndex, List<LexToken> tokens) {
        int closing = query.indexOf('"', quoteIndex + 1);
        if (closing < 0) {
            throw new QueryLexException(ErrorKind.UNTERMINATED_QUOTE, "未闭合引号", quoteIndex, query);
        }
        tokens.add(new LexToken(TokenType.WORD, query.substring(quoteIndex + 1, closing), quoteIndex));
        return closing + 1;
    }

    /**
     * 读取 &gt;、&gt;=、&lt;、&lt;= 比较符。
     */
    private int readComparisonToken(String query, int index, List<LexToken> tokens) {
        boolean greater = query.charAt(index) == '>';
        boolean withEquals = index + 1 < query.length() && query.charAt(index + 1) == '=';
        if (withEquals) {
            tokens.add(new LexToken(greater ? TokenType.GTE : TokenType.LTE, greater ? ">=" : "<=", index));
            return index + 2;
        }
        tokens.add(new LexToken(greater ? TokenType.GT : TokenType.LT, greater ? ">" : "<", index));
        return index + 1;
    }

    /**
     * 裸词字符：任意 Unicode 字母、数字以及 _ - . * / +（覆盖通配符、日期、时区偏移与路径）。
     */
    static boolean isWordChar(int codePoint) {
        return Character.isLetterOrDigit(codePoint)
                || codePoint == '_'
                || codePoint == '-'
                || codePoint == '.'
                || codePoint == '*'
                || codePoint == '/'
                || codePoint == '+';
    }

    /**
     * 分隔空白，包含不换行空格等 Unicode 空格字符。
     */
    static boolean isQuerySpace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    /**
     * 去掉首尾空白（按 {@link #isQuerySpace(int)} 判断）。
     */
    static String trimSpaces(String query) {
        int start = 0;
        int end = query.length();
        while (start < end && isQuerySpace(query.codePointAt(start))) {
            start += Character.charCount(query.codePointAt(start));
        }
        while (end > start && isQuerySpace(query.codePointBefore(end))) {
            end -= Character.charCount(query.codePointBefore(end));
        }
        return query.substring(start, end);
    }

    static boolean isBlank(String query) {
        return query == null || trimSpaces(query).isEmpty();
    }
}
