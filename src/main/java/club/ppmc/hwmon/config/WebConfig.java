/**
 * WebConfig.java
 *
 * 该文件定义了全局的Spring Web MVC配置。
 * 目前，它的主要职责是配置跨域资源共享 (CORS)，以允许仪表盘前端调用查询接口。
 */
package club.ppmc.hwmon.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 配置 /api 下所有端点的CORS映射。
     * 使用 allowedOriginPatterns 而不是 allowedOrigins("*")，这样才能与 allowCredentials(true) 同时使用。
     *
     * @param registry CORS配置注册表
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST", "PUT", "DELETE")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
