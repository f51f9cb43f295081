/**
 * DebugMetricsPublisher.java
 *
 * 调试会话运行期间，周期性地把性能指标报告通过WebSocket推送到前端。
 * 没有会话运行时不推送。推送间隔由 app.debug.metrics-push-interval-ms 配置。
 */
package club.ppmc.flowdebug.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DebugMetricsPublisher {

    private final DebugSessionService debugSessionService;
    private final WebSocketNotificationService notificationService;

    public DebugMetricsPublisher(
            DebugSessionService debugSessionService, WebSocketNotificationService notificationService) {
        this.debugSessionService = debugSessionService;
        this.notificationService = notificationService;
    }

    /**
     * 定时任务：采集当前会话的指标报告并推送。
     */
    @Scheduled(fixedRateString = "${app.debug.metrics-push-interval-ms:1000}")
    public void publishMetrics() {
        if (!debugSessionService.isDebugging()) {
            return;
        }
        try {
            notificationService.sendMetrics(debugSessionService.getMetrics());
        } catch (Exception e) {
            log.error("推送调试性能指标时出错", e);
        }
    }
}
