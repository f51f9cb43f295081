/**
 * FlowDebuggerApplication.java
 *
 * Spring Boot 应用的主入口类。
 * @EnableScheduling 用于启用定时任务，供 DebugMetricsPublisher 周期性推送性能指标。
 */
package club.ppmc.flowdebug;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FlowDebuggerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowDebuggerApplication.class, args);
    }
}
