/**
 * VariableInfo.java
 *
 * 该文件定义了变量存储中一个变量的快照，包括名称、推断出的类型和当前值。
 * 它由 VariableStore 的实现创建，ExecutionController 用它构建条件表达式的求值环境。
 */
package club.ppmc.flowdebug.model.debug;

/**
 * 代表一个流程变量信息的记录。
 *
 * @param name 变量名称。
 * @param type 变量类型（例如 "string", "integer", "number", "boolean", "list", "dict"）。
 * @param value 变量当前的值，可能为 null。
 */
public record VariableInfo(String name, String type, Object value) {}
