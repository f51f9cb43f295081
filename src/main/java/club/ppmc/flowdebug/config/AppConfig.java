/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean：WebSocket消息使用的 Gson，以及调试子系统的核心 ExecutionController。
 */
package club.ppmc.flowdebug.config;

import club.ppmc.flowdebug.debug.ExecutionController;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket服务中用于将事件对象转换为JSON字符串，字段名转换为下划线风格，与REST接口保持一致。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .serializeNulls()
                .create();
    }

    /**
     * 应用内唯一的执行控制器。断点、调试日志和性能指标的生命周期与它相同。
     */
    @Bean
    public ExecutionController executionController() {
        return new ExecutionController();
    }
}
