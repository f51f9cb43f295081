/**
 * WebSocketConfig.java
 *
 * 配置Spring WebSocket和STOMP消息代理。
 * 调试事件、调试日志和性能指标都通过 /topic 下的主题广播给前端。
 */
package club.ppmc.flowdebug.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    /**
     * 配置消息代理。
     * 使用内置的 Simple Broker 处理 /topic 前缀的广播消息，并设置10秒的STOMP心跳。
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[] {10000, 10000}) // 10秒心跳
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    /**
     * 注册STOMP端点 /ws，并启用 SockJS 回退。
     * SockJS 每25秒发送一次传输层心跳，防止反向代理因连接空闲而断开。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS()
                .setHeartbeatTime(25000);
    }
}
