/**
 * JvmRuntimePlugin.java
 *
 * 内置插件：报告本进程 JVM 的堆内存占用、线程数和系统平均负载。
 */
package club.ppmc.hwmon.service.plugin;

import club.ppmc.hwmon.model.unified.SourceSensor;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class JvmRuntimePlugin implements TelemetryPlugin {

    static final String ID = "jvm";

    private MemoryMXBean memoryBean;
    private ThreadMXBean threadBean;
    private OperatingSystemMXBean osBean;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "JVM Runtime";
    }

    @Override
    public void init() {
        memoryBean = ManagementFactory.getMemoryMXBean();
        threadBean = ManagementFactory.getThreadMXBean();
        osBean = ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    public void start() {
        // 无后台任务，数据在 poll 时即时读取
    }

    @Override
    public List<SourceSensor> poll() {
        if (memoryBean == null) {
            throw new IllegalStateException("插件尚未初始化");
        }
        List<SourceSensor> sensors = new ArrayList<>();

        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        if (heap.getMax() > 0) {
            double percent = heap.getUsed() * 100.0 / heap.getMax();
            sensors.add(new SourceSensor("heap", "JVM Heap Usage", "usage", percent,
                    0.0, 100.0, null, "%", ID, false));
        }

        sensors.add(new SourceSensor("threads", "JVM Threads", "data", threadBean.getThreadCount(),
                null, null, null, "", ID, false));

        double loadAverage = osBean.getSystemLoadAverage();
        if (loadAverage >= 0) {
            sensors.add(new SourceSensor("load-average", "System Load Average", "level", loadAverage,
                    0.0, (double) osBean.getAvailableProcessors(), null, "", ID, false));
        }
        return sensors;
    }

    @Override
    public void stop() {
        // 同 start
    }
}
