package com.logquery.query;

/**
 * KQL 语法错误。位置为查询字符串中的字符下标，修复建议由错误类别决定。
 */
public class QueryParseException extends RuntimeException {

    /** 错误类别 */
    public enum ErrorKind {
        NULL_QUERY("请输入查询字符串"),
        UNTERMINATED_QUOTE("检测到未闭合引号，请补全右引号，例如 \"connection reset\""),
        UNEXPECTED_CHARACTER("该字符不能出现在裸词中，请用双引号包裹取值，例如 path:\"a@b\""),
        MISSING_VALUE("字段名后的冒号需要紧跟取值，例如 user:alice 或 duration:>500"),
        MISSING_OPERAND("AND、OR、NOT 需要连接完整子句，分组括号内不能为空"),
        MISSING_CLOSE_PAREN("括号需成对出现，请在分组末尾补上右括号"),
        UNEXPECTED_TOKEN("多余内容无法接续查询；检查多余的右括号，或用双引号包裹含冒号的取值"),
        TOO_LONG("请缩短查询或拆分为多次查询"),
        TOO_DEEP("请减少括号分组或 NOT 的嵌套层数");

        private final String suggestion;

        ErrorKind(String suggestion) {
            this.suggestion = suggestion;
        }

        public String suggestion() {
            return suggestion;
        }
    }

    private final ErrorKind kind;
    private final int position;
    private final String queryString;

    public QueryParseException(ErrorKind kind, String message, int position, String queryString) {
        super(buildMessage(message, position, queryString));
        this.kind = kind;
        this.position = position;
        this.queryString = queryString;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return kind.suggestion();
    }

    private static String buildMessage(String message, int pos, String query) {
        String safeQuery = query == null ? "" : query;
        int caretPos = Math.max(0, Math.min(pos, safeQuery.length()));
        return "Parse error at position " + pos + ": " + message + System.lineSeparator()
                + safeQuery + System.lineSeparator() + " ".repeat(caretPos) + "^";
    }
}
