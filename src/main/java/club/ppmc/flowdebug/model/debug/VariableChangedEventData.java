/**
 * VariableChangedEventData.java
 *
 * VARIABLE_CHANGED 事件的数据负载。
 */
package club.ppmc.flowdebug.model.debug;

public record VariableChangedEventData(String variableName, Object variableValue) {}
