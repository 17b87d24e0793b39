/**
 * HardwareTelemetryApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个应用程序。
 * @EnableScheduling 注解用于启用Spring的定时任务功能，供 UnifiedSensorService 的独立轮询使用；
 * 快照采集的定时器由 HardwareMonitorService 自行管理，以便运行期调整间隔。
 */
package club.ppmc.hwmon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HardwareTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HardwareTelemetryApplication.class, args);
    }
}
