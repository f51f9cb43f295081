/**
 * ConditionParser.java
 *
 * 将条件断点的表达式字符串解析为 Condition 语法树。
 * 支持的语法：
 * - 字面量：整数、小数、'单引号' 或 "双引号" 字符串、true/false、null (及 True/False/None)
 * - 变量：标识符，从变量环境中读取
 * - 列表：[1, 2, "a"]，用于 in / not in
 * - 算术：+ - * / % 和一元取负
 * - 比较：== != > < >= <= in, not in
 * - 逻辑：and / && , or / || , not / !
 * - 括号分组
 * 顶层必须是比较或逻辑组合；函数调用、属性访问、单独的值等任何其他结构都会被拒绝。
 */
package club.ppmc.flowdebug.debug.condition;

import club.ppmc.flowdebug.exception.ConditionEvaluationException;
import club.ppmc.flowdebug.model.debug.ComparisonOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ConditionParser {

    /**
     * 解析表达式。
     *
     * @throws ConditionEvaluationException 表达式为空、语法错误或包含不受支持的结构。
     */
    public Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConditionEvaluationException("条件表达式为空", expression);
        }
        List<Token> tokens = new Tokenizer(expression).tokenize();
        var parser = new Parser(expression, tokens);
        Condition condition = parser.parseOr();
        if (!parser.isAtEnd()) {
            throw parser.error("表达式末尾存在多余内容");
        }
        return condition;
    }

    // ==================== Tokenizer ====================

    private enum TokenType {
        NUMBER, STRING, IDENTIFIER,
        TRUE, FALSE, NULL,
        LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA,
        PLUS, MINUS, STAR, SLASH, PERCENT,
        EQ, NE, GT, LT, GE, LE,
        AND, OR, NOT, IN,
        EOF
    }

    private record Token(TokenType type, String text, int position) {}

    private static final class Tokenizer {
        private final String input;
        private int pos;

        Tokenizer(String input) {
            this.input = input;
        }

        List<Token> tokenize() {
            List<Token> tokens = new ArrayList<>();
            while (true) {
                while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                    pos++;
                }
                if (pos >= input.length()) {
                    break;
                }
                tokens.add(scan());
            }
            tokens.add(new Token(TokenType.EOF, "", pos));
            return tokens;
        }

        private Token scan() {
            int start = pos;
            char c = input.charAt(pos++);
            switch (c) {
                case '(': return new Token(TokenType.LPAREN, "(", start);
                case ')': return new Token(TokenType.RPAREN, ")", start);
                case '[': return new Token(TokenType.LBRACKET, "[", start);
                case ']': return new Token(TokenType.RBRACKET, "]", start);
                case ',': return new Token(TokenType.COMMA, ",", start);
                case '+': return new Token(TokenType.PLUS, "+", start);
                case '-': return new Token(TokenType.MINUS, "-", start);
                case '*': return new Token(TokenType.STAR, "*", start);
                case '/': return new Token(TokenType.SLASH, "/", start);
                case '%': return new Token(TokenType.PERCENT, "%", start);
                case '=':
                    if (match('=')) return new Token(TokenType.EQ, "==", start);
                    throw unexpected("'=' (比较请使用 '==')", start);
                case '!':
                    if (match('=')) return new Token(TokenType.NE, "!=", start);
                    return new Token(TokenType.NOT, "!", start);
                case '>':
                    if (match('=')) return new Token(TokenType.GE, ">=", start);
                    return new Token(TokenType.GT, ">", start);
                case '<':
                    if (match('=')) return new Token(TokenType.LE, "<=", start);
                    return new Token(TokenType.LT, "<", start);
                case '&':
                    if (match('&')) return new Token(TokenType.AND, "&&", start);
                    throw unexpected("'&'", start);
                case '|':
                    if (match('|')) return new Token(TokenType.OR, "||", start);
                    throw unexpected("'|'", start);
                case '"':
                case '\'':
                    return scanString(c, start);
                default:
                    break;
            }
            if (Character.isDigit(c) || (c == '.' && pos < input.length() && Character.isDigit(input.charAt(pos)))) {
                pos = start;
                return scanNumber();
            }
            if (Character.isLetter(c) || c == '_') {
                pos = start;
                return scanIdentifier();
            }
            throw unexpected("'" + c + "'", start);
        }

        private boolean match(char expected) {
            if (pos < input.length() && input.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private Token scanNumber() {
            int start = pos;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
            if (pos < input.length() && input.charAt(pos) == '.') {
                pos++;
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
            }
            if (pos < input.length() && Character.isLetter(input.charAt(pos))) {
                throw unexpected("数字后的 '" + input.charAt(pos) + "'", pos);
            }
            return new Token(TokenType.NUMBER, input.substring(start, pos), start);
        }

        private Token scanString(char quote, int start) {
            var sb = new StringBuilder();
            while (pos < input.length() && input.charAt(pos) != quote) {
                char c = input.charAt(pos++);
                if (c == '\\' && pos < input.length()) {
                    sb.append(input.charAt(pos++));
                } else {
                    sb.append(c);
                }
            }
            if (pos >= input.length()) {
                throw new ConditionEvaluationException("字符串未闭合 (位置 " + start + ")", input);
            }
            pos++;
            return new Token(TokenType.STRING, sb.toString(), start);
        }

        private Token scanIdentifier() {
            int start = pos;
            while (pos < input.length()
                    && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
                pos++;
            }
            String name = input.substring(start, pos);
            TokenType type = switch (name) {
                case "and" -> TokenType.AND;
                case "or" -> TokenType.OR;
                case "not" -> TokenType.NOT;
                case "in" -> TokenType.IN;
                case "true", "True" -> TokenType.TRUE;
                case "false", "False" -> TokenType.FALSE;
                case "null", "None" -> TokenType.NULL;
                default -> TokenType.IDENTIFIER;
            };
            return new Token(type, name, start);
        }

        private ConditionEvaluationException unexpected(String what, int position) {
            return new ConditionEvaluationException("无法识别的字符 " + what + " (位置 " + position + ")", input);
        }
    }

    // ==================== Parser ====================

    private static final class Parser {
        private final String expression;
        private final List<Token> tokens;
        private int current;

        Parser(String expression, List<Token> tokens) {
            this.expression = expression;
            this.tokens = tokens;
        }

        boolean isAtEnd() {
            return peek().type() == TokenType.EOF;
        }

        Condition parseOr() {
            List<Condition> operands = new ArrayList<>();
            operands.add(parseAnd());
            while (match(TokenType.OR)) {
                operands.add(parseAnd());
            }
            return operands.size() == 1 ? operands.get(0) : new Logical(Logical.Operator.OR, operands);
        }

        private Condition parseAnd() {
            List<Condition> operands = new ArrayList<>();
            operands.add(parseNot());
            while (match(TokenType.AND)) {
                operands.add(parseNot());
            }
            return operands.size() == 1 ? operands.get(0) : new Logical(Logical.Operator.AND, operands);
        }

        private Condition parseNot() {
            if (match(TokenType.NOT)) {
                return new Logical(Logical.Operator.NOT, List.of(parseNot()));
            }
            return parseConditionPrimary();
        }

        private Condition parseConditionPrimary() {
            if (peek().type() == TokenType.LPAREN) {
                // "(a > 1 or b)" 是分组条件，"(a + 1) > 2" 是比较的左侧，先按分组条件尝试
                int saved = current;
                try {
                    advance();
                    Condition grouped = parseOr();
                    expect(TokenType.RPAREN, "')'");
                    if (!isComparisonOperator(peek().type()) && !isArithmeticOperator(peek().type())) {
                        return grouped;
                    }
                } catch (ConditionEvaluationException ignored) {
                    // 回退后按比较表达式重新解析
                }
                current = saved;
            }
            return parseComparison();
        }

        private Condition parseComparison() {
            Operand left = parseAdditive();
            ComparisonOperator operator = parseComparisonOperator();
            if (operator == null) {
                throw error("此处需要比较运算符，条件必须是比较或逻辑组合");
            }
            Operand right = parseAdditive();
            if (isComparisonOperator(peek().type())) {
                throw error("不支持链式比较");
            }
            return new Comparison(left, operator, right);
        }

        private ComparisonOperator parseComparisonOperator() {
            Token token = peek();
            ComparisonOperator operator = switch (token.type()) {
                case EQ -> ComparisonOperator.EQUALS;
                case NE -> ComparisonOperator.NOT_EQUALS;
                case GT -> ComparisonOperator.GREATER_THAN;
                case LT -> ComparisonOperator.LESS_THAN;
                case GE -> ComparisonOperator.GREATER_OR_EQUAL;
                case LE -> ComparisonOperator.LESS_OR_EQUAL;
                case IN -> ComparisonOperator.IN;
                case NOT -> peekNext().type() == TokenType.IN && "not".equals(token.text())
                        ? ComparisonOperator.NOT_IN
                        : null;
                default -> null;
            };
            if (operator == ComparisonOperator.NOT_IN) {
                advance();
            }
            if (operator != null) {
                advance();
            }
            return operator;
        }

        private Operand parseAdditive() {
            Operand left = parseMultiplicative();
            while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
                char operator = advance().text().charAt(0);
                left = new Operand.Arithmetic(left, operator, parseMultiplicative());
            }
            return left;
        }

        private Operand parseMultiplicative() {
            Operand left = parseUnary();
            while (peek().type() == TokenType.STAR
                    || peek().type() == TokenType.SLASH
                    || peek().type() == TokenType.PERCENT) {
                char operator = advance().text().charAt(0);
                left = new Operand.Arithmetic(left, operator, parseUnary());
            }
            return left;
        }

        private Operand parseUnary() {
            if (match(TokenType.MINUS)) {
                return new Operand.Negation(parseUnary());
            }
            if (match(TokenType.PLUS)) {
                return parseUnary();
            }
            return parsePrimary();
        }

        private Operand parsePrimary() {
            Token token = advance();
            switch (token.type()) {
                case NUMBER:
                    return new Operand.Literal(parseNumber(token.text()));
                case STRING:
                    return new Operand.Literal(token.text());
                case TRUE:
                    return new Operand.Literal(Boolean.TRUE);
                case FALSE:
                    return new Operand.Literal(Boolean.FALSE);
                case NULL:
                    return new Operand.Literal(null);
                case IDENTIFIER:
                    if (peek().type() == TokenType.LPAREN) {
                        throw error("不支持函数调用: " + token.text());
                    }
                    return new Operand.Variable(token.text());
                case LPAREN: {
                    Operand inner = parseAdditive();
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                }
                case LBRACKET: {
                    List<Operand> elements = new ArrayList<>();
                    if (!match(TokenType.RBRACKET)) {
                        do {
                            elements.add(parseAdditive());
                        } while (match(TokenType.COMMA));
                        expect(TokenType.RBRACKET, "']'");
                    }
                    return new Operand.ListLiteral(elements);
                }
                default:
                    if (token.type() != TokenType.EOF) {
                        current--;
                    }
                    throw error("此处需要一个值");
            }
        }

        private Object parseNumber(String text) {
            if (text.contains(".")) {
                return Double.parseDouble(text);
            }
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return Double.parseDouble(text);
            }
        }

        private static boolean isComparisonOperator(TokenType type) {
            return switch (type) {
                case EQ, NE, GT, LT, GE, LE, IN -> true;
                default -> false;
            };
        }

        private static boolean isArithmeticOperator(TokenType type) {
            return switch (type) {
                case PLUS, MINUS, STAR, SLASH, PERCENT -> true;
                default -> false;
            };
        }

        private Token peek() {
            return tokens.get(current);
        }

        private Token peekNext() {
            return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
        }

        private Token advance() {
            Token token = tokens.get(current);
            if (token.type() != TokenType.EOF) {
                current++;
            }
            return token;
        }

        private boolean match(TokenType type) {
            if (peek().type() == type) {
                advance();
                return true;
            }
            return false;
        }

        private void expect(TokenType type, String description) {
            if (!match(type)) {
                throw error("此处需要 " + description);
            }
        }

        ConditionEvaluationException error(String message) {
            Token token = peek();
            String found = token.type() == TokenType.EOF ? "表达式结尾" : "'" + token.text() + "'";
            return new ConditionEvaluationException(
                    String.format(Locale.ROOT, "%s (位置 %d, 遇到 %s)", message, token.position(), found), expression);
        }
    }
}
