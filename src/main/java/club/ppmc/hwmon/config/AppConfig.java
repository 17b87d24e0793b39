/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean：JSON 序列化、HTTP 客户端、OSHI 系统信息入口、时钟以及采集用的线程池和调度器。
 */
package club.ppmc.hwmon.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;
import oshi.SystemInfo;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 RestTemplate Bean，供告警的 webhook 动作使用。
     * 设置较短的超时，避免一个无响应的 webhook 拖住告警评估线程。
     *
     * @param timeoutMs 连接与读取超时 (毫秒)。
     * @return 一个新的 RestTemplate 实例。
     */
    @Bean
    public RestTemplate restTemplate(@Value("${telemetry.webhook.timeout-ms:5000}") int timeoutMs) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket分发中用于将推送消息转换为JSON字符串，确保与前端的兼容性。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder().serializeSpecialFloatingPointValues().create();
    }

    /**
     * OSHI 的系统信息入口。内部会缓存平台相关的实现，全局共享一个实例即可。
     */
    @Bean
    public SystemInfo systemInfo() {
        return new SystemInfo();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 快照采集时各硬件类别并发执行所用的线程池。
     */
    @Bean(name = "adapterExecutor")
    public ThreadPoolTaskExecutor adapterExecutor(
            @Value("${telemetry.adapter.pool-size:5}") int poolSize) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("hw-adapter-");
        executor.initialize();
        return executor;
    }

    /**
     * 快照采集的定时器。只有一个线程，周期之间不会重叠。
     */
    @Bean(name = "pollScheduler")
    public ThreadPoolTaskScheduler pollScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("hw-poll-");
        return scheduler;
    }

    /**
     * {@code @Scheduled} 任务使用的调度器。
     * 容器中存在 pollScheduler 后 Spring Boot 不再自动创建默认调度器，这里按名称 taskScheduler 显式声明。
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduling-");
        return scheduler;
    }
}
