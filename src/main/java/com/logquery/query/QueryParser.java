package com.logquery.query;

import com.logquery.config.Constants;
import com.logquery.query.QueryParseException.ErrorKind;

import java.util.List;

/**
 * KQL 递归下降解析器。优先级从低到高：OR、AND（含隐式 AND）、NOT、原子。
 * 实例持有解析游标，不是线程安全的；每个线程或每次解析使用独立实例。
 */
public class QueryParser {
    private List<LexToken> tokens;
    private int pos;
    private String queryString;
    private int depth;

    /**
     * 将查询字符串解析为查询树。空白查询返回 ast 为 null 的结果，表示不过滤。
     */
    public ParseResult parse(String query) {
        this.queryString = query == null ? "" : query;
        if (QueryLexer.isBlank(queryString)) {
            return new ParseResult(null, queryString);
        }
        this.tokens = new QueryLexer().tokenize(queryString);
        this.pos = 0;
        this.depth = 0;

        QueryNode ast = parseOrExpression();

        if (current().type() != TokenType.EOF) {
            throw new QueryParseException(ErrorKind.UNEXPECTED_TOKEN, "意外token: " + current().value(),
                    current().position(), queryString);
        }

        return new ParseResult(ast, queryString);
    }

    /**
     * 解析 OR 层级，左结合，每个 OR 生成一个二叉分支。
     */
    private QueryNode parseOrExpression() {
        QueryNode left = parseAndExpression();
        while (current().isKeyword("OR")) {
            advance();
            QueryNode right = parseAndExpression();
            left = QueryNode.BooleanNode.or(left, right);
        }
        return left;
    }

    /**
     * 解析 AND 层级，并支持相邻子句的隐式 AND。
     */
    private QueryNode parseAndExpression() {
        QueryNode left = parseNotExpression();
        while (true) {
            if (current().isKeyword("AND")) {
                advance();
                QueryNode right = parseNotExpression();
                left = QueryNode.BooleanNode.and(left, right);
                continue;
            }
            if (isImplicitAndStart(current())) {
                QueryNode right = parseNotExpression();
                left = QueryNode.BooleanNode.and(left, right);
                continue;
            }
            break;
        }
        return left;
    }

    /**
     * 解析 NOT 前缀，右结合，NOT NOT x 为双重否定。
     */
    private QueryNode parseNotExpression() {
        if (current().isKeyword("NOT")) {
            enterNesting(advance());
            QueryNode negated = parseNotExpression();
            depth--;
            return QueryNode.BooleanNode.not(negated);
        }
        return parseAtom();
    }

    /**
     * 解析原子：分组、field:value、裸词全文。
     */
    private QueryNode parseAtom() {
        LexToken token = current();

        if (token.type() == TokenType.LPAREN) {
            return parseGroup();
        }

        if (token.type() == TokenType.WORD) {
            if (peek(1).type() == TokenType.COLON) {
                return parseFieldValue();
            }
            advance();
            return QueryNode.FieldFilter.fullText(token.value());
        }

        ErrorKind kind = token.type() == TokenType.EOF || token.type() == TokenType.RPAREN
                ? ErrorKind.MISSING_OPERAND
                : ErrorKind.UNEXPECTED_TOKEN;
        throw new QueryParseException(kind, "无法解析表达式: " + describe(token), token.position(), queryString);
    }

    /**
     * 解析分组表达式，括号内重置优先级。
     */
    private QueryNode parseGroup() {
        LexToken open = advance();
        enterNesting(open);
        QueryNode grouped = parseOrExpression();
        if (current().type() != TokenType.RPAREN) {
            throw new QueryParseException(ErrorKind.MISSING_CLOSE_PAREN,
                    "缺少右括号（左括号位于 " + open.position() + "）", current().position(), queryString);
        }
        advance();
        depth--;
        return grouped;
    }

    /**
     * 进入一层分组或 NOT，超过 {@link Constants#MAX_NESTING_DEPTH} 时在该 token 处报错。
     */
    private void enterNesting(LexToken token) {
        depth++;
        if (depth > Constants.MAX_NESTING_DEPTH) {
            throw new QueryParseException(ErrorKind.TOO_DEEP,
                    "嵌套层数超过限制（最大 " + Constants.MAX_NESTING_DEPTH + " 层）", token.position(), queryString);
        }
    }

    /**
     * 解析 field:value、field:&gt;value 等。取值中的 :segment 若形似时间或时区片段则并入当前取值。
     */
    private QueryNode parseFieldValue() {
        LexToken fieldToken = advance();
        advance();

        FilterOp op = switch (current().type()) {
            case GT -> FilterOp.GREATER_THAN;
            case GTE -> FilterOp.GREATER_OR_EQUAL;
            case LT -> FilterOp.LESS_THAN;
            case LTE -> FilterOp.LESS_OR_EQUAL;
            default -> FilterOp.EQUALS;
        };
        if (op != FilterOp.EQUALS) {
            advance();
        }

        LexToken valueToken = current();
        if (valueToken.type() != TokenType.WORD) {
            throw new QueryParseException(ErrorKind.MISSING_VALUE,
                    "字段 " + fieldToken.value() + " 缺少取值，实际为 " + describe(valueToken),
                    valueToken.position(), queryString);
        }
        advance();

        StringBuilder value = new StringBuilder(valueToken.value());
        while (current().type() == TokenType.COLON
                && peek(1).type() == TokenType.WORD
                && looksLikeValueContinuation(peek(1).value())) {
            advance();
            value.append(':').append(advance().value());
        }

        String rawValue = value.toString();
        if (op == FilterOp.EQUALS && rawValue.indexOf('*') >= 0) {
            op = FilterOp.WILDCARD;
        }
        return new QueryNode.FieldFilter(fieldToken.value(), op, rawValue);
    }

    /**
     * 冒号后的片段是否为取值延续：纯数字，或仅由数字与 . - + 组成。
     * field:123:abc 只并入数字前缀，保持该宽松行为不变。
     */
    static boolean looksLikeValueContinuation(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            char ch = segment.charAt(i);
            if (!Character.isDigit(ch) && ch != '.' && ch != '-' && ch != '+') {
                return false;
            }
        }
        return true;
    }

    /**
     * 判断当前 token 是否可触发隐式 AND：非 OR 的裸词或左括号。
     */
    private boolean isImplicitAndStart(LexToken token) {
        return (token.type() == TokenType.WORD && !token.isKeyword("OR"))
                || token.type() == TokenType.LPAREN;
    }

    private String describe(LexToken token) {
        return token.type() == TokenType.EOF ? "查询结尾" : "\"" + token.value() + "\"";
    }

    /**
     * 返回当前位置 token。
     */
    private LexToken current() {
        return peek(0);
    }

    /**
     * 向前查看 offset 个 token，越界时返回末尾 EOF。
     */
    private LexToken peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 消费并返回当前位置 token，EOF 不会被越过。
     */
    private LexToken advance() {
        LexToken token = current();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    public record ParseResult(QueryNode ast, String query) {

        /**
         * 是否为空查询（匹配全部）。
         */
        public boolean isEmpty() {
            return ast == null;
        }
    }
}
