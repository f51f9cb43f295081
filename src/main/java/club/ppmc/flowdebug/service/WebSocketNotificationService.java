/**
 * WebSocketNotificationService.java
 *
 * 统一的WebSocket消息发送服务。
 * 封装 SimpMessagingTemplate 的使用细节，将调试事件、调试日志和性能指标序列化后
 * 发送到前端对应的WebSocket主题(topic)上。
 */
package club.ppmc.flowdebug.service;

import club.ppmc.flowdebug.model.debug.DebugLogEntry;
import club.ppmc.flowdebug.model.debug.WsDebugEvent;
import club.ppmc.flowdebug.model.metrics.MetricsReport;
import com.google.gson.Gson;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    public static final String DEBUG_EVENTS_TOPIC = "/topic/debug-events";
    public static final String DEBUG_LOG_TOPIC = "/topic/debug-log";
    public static final String DEBUG_METRICS_TOPIC = "/topic/debug-metrics";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 发送调试事件到前端。
     * @param event 要发送的调试事件对象。
     */
    public void sendDebugEvent(WsDebugEvent<?> event) {
        // 使用Gson手动序列化，可以更好地控制JSON输出，特别是对于泛型记录类型
        sendMessage(DEBUG_EVENTS_TOPIC, gson.toJson(event));
    }

    /**
     * 推送一条新的调试日志。
     */
    public void sendDebugLog(DebugLogEntry entry) {
        sendMessage(DEBUG_LOG_TOPIC, gson.toJson(entry));
    }

    /**
     * 推送当前调试会话的性能指标。
     */
    public void sendMetrics(MetricsReport report) {
        sendMessage(DEBUG_METRICS_TOPIC, gson.toJson(report));
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题 (例如, "/topic/debug-events")
     * @param payload 要发送的任何对象 (将被框架自动序列化为JSON)
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
