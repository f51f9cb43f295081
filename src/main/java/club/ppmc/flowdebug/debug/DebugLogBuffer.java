/**
 * DebugLogBuffer.java
 *
 * 面向用户的调试日志缓冲区。保存带时间戳和级别的日志条目，容量有上限，
 * 超出时按先进先出丢弃最旧的条目。支持导出为文本或JSON文件。
 * 工作线程写入，控制线程读取，所有访问都经过同一把锁。
 */
package club.ppmc.flowdebug.debug;

import club.ppmc.flowdebug.model.debug.DebugLogEntry;
import club.ppmc.flowdebug.model.debug.LogLevel;
import club.ppmc.flowdebug.model.debug.OperationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DebugLogBuffer {

    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private static final Logger LOGGER = LoggerFactory.getLogger(DebugLogBuffer.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Deque<DebugLogEntry> entries = new ArrayDeque<>();
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private int maxEntries;
    private volatile Consumer<DebugLogEntry> listener;

    public DebugLogBuffer() {
        this(DEFAULT_MAX_ENTRIES, Clock.systemDefaultZone());
    }

    public DebugLogBuffer(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries 必须为正数: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * 追加一条日志。超出容量时丢弃最旧的条目。
     */
    public DebugLogEntry add(LogLevel level, String message) {
        var entry = new DebugLogEntry(clock.millis(), level, message != null ? message : "");
        synchronized (entries) {
            entries.addLast(entry);
            trim();
        }
        Consumer<DebugLogEntry> current = listener;
        if (current != null) {
            try {
                current.accept(entry);
            } catch (RuntimeException e) {
                LOGGER.warn("调试日志监听器处理失败", e);
            }
        }
        return entry;
    }

    /**
     * @param filterLevel 为 null 时返回全部条目，否则只返回该级别的条目。
     */
    public List<DebugLogEntry> getLogs(LogLevel filterLevel) {
        synchronized (entries) {
            return entries.stream()
                    .filter(entry -> filterLevel == null || entry.level() == filterLevel)
                    .toList();
        }
    }

    public List<DebugLogEntry> getLogs() {
        return getLogs(null);
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getMaxEntries() {
        synchronized (entries) {
            return maxEntries;
        }
    }

    /**
     * 调整容量上限。缩小时立即丢弃多出的最旧条目。
     */
    public void setMaxEntries(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries 必须为正数: " + maxEntries);
        }
        synchronized (entries) {
            this.maxEntries = maxEntries;
            trim();
        }
    }

    /**
     * 注册新条目监听器，替换之前的监听器。传入 null 表示取消。
     */
    public void setListener(Consumer<DebugLogEntry> listener) {
        this.listener = listener;
    }

    /**
     * 以 "[时间] [级别] 消息" 的格式逐行导出。
     */
    public OperationResult exportText(Path path) {
        List<String> lines = getLogs().stream()
                .map(entry -> String.format("[%s] [%s] %s", formatTime(entry.timestamp()), entry.level(), entry.message()))
                .toList();
        try {
            FileUtils.forceMkdirParent(path.toFile());
            FileUtils.writeLines(path.toFile(), StandardCharsets.UTF_8.name(), lines);
            return OperationResult.ok("日志已导出到: " + path);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("导出调试日志失败: {}", path, e);
            return OperationResult.failure("导出日志失败: " + e.getMessage());
        }
    }

    /**
     * 导出为JSON数组，每个元素包含 timestamp、level、message 和 formatted_time。
     */
    public OperationResult exportJson(Path path) {
        List<Map<String, Object>> data = getLogs().stream().map(this::toExportMap).toList();
        try {
            FileUtils.forceMkdirParent(path.toFile());
            objectMapper.writeValue(path.toFile(), data);
            return OperationResult.ok("日志已导出到: " + path);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("导出调试日志失败: {}", path, e);
            return OperationResult.failure("导出日志失败: " + e.getMessage());
        }
    }

    private Map<String, Object> toExportMap(DebugLogEntry entry) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", entry.timestamp() / 1000.0);
        map.put("level", entry.level().name());
        map.put("message", entry.message());
        map.put("formatted_time", formatTime(entry.timestamp()));
        return map;
    }

    private String formatTime(long timestamp) {
        ZoneId zone = clock.getZone();
        return TIME_FORMAT.format(Instant.ofEpochMilli(timestamp).atZone(zone));
    }

    private void trim() {
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }
}
