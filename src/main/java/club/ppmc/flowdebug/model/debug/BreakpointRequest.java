/**
 * BreakpointRequest.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装从前端传递到后端的添加断点请求。
 * 它由 DebugController 接收，并转换为 Breakpoint 对象交给 DebugSessionService。
 */
package club.ppmc.flowdebug.model.debug;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 封装了添加断点所需数据的记录。
 *
 * @param type 断点类型。
 * @param stepIndex 目标步骤索引，行断点必须指定；其他类型省略或为 -1 时表示任意步骤。
 * @param condition 条件表达式，仅用于 CONDITION 类型。
 * @param variableName 变量名，仅用于 VARIABLE 类型。
 * @param variableValue 比较值，仅用于 VARIABLE 类型。
 * @param comparisonOperator 比较运算符符号，仅用于 VARIABLE 类型，缺省为 "=="。
 * @param enabled 是否启用，缺省为 true。
 */
public record BreakpointRequest(
        @NotNull BreakpointType type,
        @JsonProperty("step_index") @Min(-1) Integer stepIndex,
        String condition,
        @JsonProperty("variable_name") String variableName,
        @JsonProperty("variable_value") Object variableValue,
        @JsonProperty("comparison_operator") String comparisonOperator,
        Boolean enabled) {}
