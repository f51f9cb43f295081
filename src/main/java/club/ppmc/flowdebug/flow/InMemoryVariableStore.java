/**
 * InMemoryVariableStore.java
 *
 * 基于内存的流程变量存储。步骤动作通过 set/remove 修改变量，
 * 调试器通过只读的 VariableStore 接口查询。
 * 变量类型按值推断，取值与前端变量面板使用的名称一致。
 */
package club.ppmc.flowdebug.flow;

import club.ppmc.flowdebug.debug.VariableStore;
import club.ppmc.flowdebug.model.debug.VariableInfo;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryVariableStore implements VariableStore {

    // ConcurrentHashMap 不允许 null 值，所以保存 VariableInfo 而不是原始值
    private final Map<String, VariableInfo> variables = new ConcurrentHashMap<>();

    public void set(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("变量名不能为空");
        }
        variables.put(name, new VariableInfo(name, inferType(value), value));
    }

    public boolean remove(String name) {
        return name != null && variables.remove(name) != null;
    }

    public void clear() {
        variables.clear();
    }

    @Override
    public Object getVariable(String name) {
        VariableInfo info = name != null ? variables.get(name) : null;
        return info != null ? info.value() : null;
    }

    @Override
    public boolean containsVariable(String name) {
        return name != null && variables.containsKey(name);
    }

    @Override
    public Map<String, VariableInfo> getAllVariables() {
        return Collections.unmodifiableMap(new TreeMap<>(variables));
    }

    static String inferType(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return "integer";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return "list";
        }
        if (value instanceof Map<?, ?>) {
            return "dict";
        }
        return value.getClass().getSimpleName();
    }
}
