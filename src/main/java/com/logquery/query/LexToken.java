package com.logquery.query;

public record LexToken(TokenType type, String value, int position) {

    /**
     * 判断是否为不区分大小写的关键字（AND/OR/NOT），仅对裸词生效。
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.WORD && keyword.equalsIgnoreCase(value);
    }
}

enum TokenType {
    WORD,
    COLON,
    LPAREN,
    RPAREN,
    GT,
    GTE,
    LT,
    LTE,
    EOF
}
