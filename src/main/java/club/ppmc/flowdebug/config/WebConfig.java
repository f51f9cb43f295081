/**
 * WebConfig.java
 *
 * 全局的Spring Web MVC配置。
 * 目前只负责配置跨域资源共享 (CORS)，以允许调试前端与后端API进行交互。
 */
package club.ppmc.flowdebug.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 配置全局CORS映射。
     * 使用 allowedOriginPatterns 而不是 allowedOrigins("*")，以便与 allowCredentials(true) 同时使用。
     *
     * @param registry CORS配置注册表
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
