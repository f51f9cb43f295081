/**
 * VariableStore.java
 *
 * 流程变量存储的只读视图。ExecutionController 只通过它查询变量，从不修改。
 */
package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.VariableInfo;
import java.util.Map;

public interface VariableStore {

    /**
     * @return 变量当前的值；变量不存在或值为 null 时返回 null。
     */
    Object getVariable(String name);

    /**
     * 区分"变量不存在"和"变量值为 null"。
     */
    boolean containsVariable(String name);

    /**
     * @return 所有变量的快照，按变量名索引。
     */
    Map<String, VariableInfo> getAllVariables();
}
