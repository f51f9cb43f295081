/**
 * ConditionEvaluationException.java
 *
 * 一个自定义的运行时异常，表示条件表达式或变量比较无法求值：
 * 表达式语法错误、使用了不受支持的结构、引用了不存在的变量，或值之间无法比较。
 * 它只在调试子系统内部抛出，由 ExecutionController 捕获并记录，
 * 对应的断点被视为“未命中”，绝不会传播到执行流程的工作线程。
 */
package club.ppmc.flowdebug.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class ConditionEvaluationException extends RuntimeException {

    /** 出错的表达式原文；变量比较出错时为变量名。 */
    private final String expression;

    public ConditionEvaluationException(String message, String expression) {
        super(message);
        this.expression = expression;
    }

    public ConditionEvaluationException(String message, String expression, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "CONDITION_ERROR",
                "message", getMessage(),
                "expression", getExpression() != null ? getExpression() : "");
    }
}
