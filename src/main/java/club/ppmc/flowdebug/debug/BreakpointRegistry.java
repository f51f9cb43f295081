/**
 * BreakpointRegistry.java
 *
 * 断点注册表，按ID保存断点定义，保持插入顺序（断点匹配时“先注册者优先”）。
 * 所有操作都是全函数：未知ID返回失败结果，从不抛出异常。
 * 断点只由控制线程增删；工作线程只读取列表快照。
 */
package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.BreakpointType;
import club.ppmc.flowdebug.model.debug.OperationResult;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BreakpointRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(BreakpointRegistry.class);
    private static final Type BREAKPOINT_LIST_TYPE = new TypeToken<List<Map<String, Object>>>() {}.getType();

    private final Map<String, Breakpoint> breakpoints = new LinkedHashMap<>();
    private final Gson gson = new Gson();

    /**
     * 添加断点。同ID的已有断点会被替换。
     *
     * @return 断点ID。
     */
    public synchronized String add(Breakpoint breakpoint) {
        breakpoints.put(breakpoint.getId(), breakpoint);
        LOGGER.debug("已添加断点: {}", breakpoint);
        return breakpoint.getId();
    }

    public synchronized boolean remove(String breakpointId) {
        if (breakpointId == null) {
            return false;
        }
        Breakpoint removed = breakpoints.remove(breakpointId);
        if (removed != null) {
            LOGGER.debug("已移除断点: {}", removed);
        }
        return removed != null;
    }

    public synchronized Breakpoint get(String breakpointId) {
        return breakpointId == null ? null : breakpoints.get(breakpointId);
    }

    /**
     * @return 按注册顺序排列的断点列表副本。
     */
    public synchronized List<Breakpoint> list() {
        return new ArrayList<>(breakpoints.values());
    }

    public synchronized int size() {
        return breakpoints.size();
    }

    public synchronized void clear() {
        breakpoints.clear();
    }

    public synchronized boolean setEnabled(String breakpointId, boolean enabled) {
        Breakpoint breakpoint = get(breakpointId);
        if (breakpoint == null) {
            return false;
        }
        breakpoint.setEnabled(enabled);
        return true;
    }

    public synchronized Optional<Breakpoint> findLineBreakpoint(int stepIndex) {
        return breakpoints.values().stream()
                .filter(bp -> bp.getType() == BreakpointType.LINE && bp.getStepIndex() == stepIndex)
                .findFirst();
    }

    /**
     * 切换指定步骤上的行断点：存在则移除，不存在则创建。
     *
     * @return 移除时为 (true, 提示消息)，创建时为 (true, 新断点ID)。
     */
    public synchronized OperationResult toggle(int stepIndex) {
        Optional<Breakpoint> existing = findLineBreakpoint(stepIndex);
        if (existing.isPresent()) {
            String id = existing.get().getId();
            remove(id);
            return OperationResult.ok("已移除断点 #" + id);
        }
        return OperationResult.ok(add(Breakpoint.line(stepIndex)));
    }

    /**
     * 将所有断点导出为JSON数组，每个元素是一个断点字典。
     */
    public String exportJson() {
        List<Map<String, Object>> data = list().stream().map(Breakpoint::toMap).toList();
        return gson.toJson(data);
    }

    /**
     * 从JSON数组导入断点，追加到现有断点之后。
     * 格式错误时不修改注册表，返回失败结果。
     */
    public OperationResult importJson(String json) {
        List<Breakpoint> imported = new ArrayList<>();
        try {
            List<Map<String, Object>> data = gson.fromJson(json, BREAKPOINT_LIST_TYPE);
            if (data == null) {
                return OperationResult.failure("导入断点失败: 内容为空");
            }
            for (Map<String, Object> item : data) {
                if (item != null) {
                    imported.add(Breakpoint.fromMap(item));
                }
            }
        } catch (JsonParseException | IllegalArgumentException e) {
            LOGGER.warn("导入断点失败: {}", e.getMessage());
            return OperationResult.failure("导入断点失败: " + e.getMessage());
        }
        synchronized (this) {
            imported.forEach(this::add);
        }
        return OperationResult.ok("已导入 " + imported.size() + " 个断点");
    }
}
