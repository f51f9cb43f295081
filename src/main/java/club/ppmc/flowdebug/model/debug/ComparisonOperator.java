/**
 * ComparisonOperator.java
 *
 * 变量断点和条件表达式共用的比较运算符。
 * 每个运算符都有一个对外使用的符号形式（如 "==", "not in"），用于序列化和表达式解析。
 */
package club.ppmc.flowdebug.model.debug;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ComparisonOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    IN("in"),
    NOT_IN("not in");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /**
     * 根据符号查找运算符。同时接受枚举名（例如 "GREATER_THAN"）。
     *
     * @param symbol 运算符符号。
     * @return 对应的运算符。
     * @throws IllegalArgumentException 如果符号无法识别。
     */
    @JsonCreator
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("比较运算符不能为空");
        }
        String normalized = symbol.trim().replaceAll("\\s+", " ");
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equalsIgnoreCase(normalized) || operator.name().equalsIgnoreCase(normalized)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("不支持的比较运算符: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
