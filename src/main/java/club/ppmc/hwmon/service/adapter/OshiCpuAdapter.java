/**
 * OshiCpuAdapter.java
 *
 * 通过 Oshi 采集CPU的负载、温度和电压。
 * CPU 使用率需要两次 tick 之间的差值来计算，因此该适配器在两次采集之间保存上一次的 tick。
 */
package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.CpuData;
import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.CentralProcessor;
import oshi.hardware.Sensors;

@Component
@Slf4j
public class OshiCpuAdapter implements SensorSourceAdapter<CpuData> {

    private static final double DEFAULT_TEMPERATURE_MAX = 100.0;

    private final CentralProcessor processor;
    private final Sensors sensors;

    // 用于计算CPU使用率的状态变量
    private long[] prevTicks;
    private long[][] prevProcessorTicks;

    public OshiCpuAdapter(SystemInfo systemInfo) {
        this.processor = systemInfo.getHardware().getProcessor();
        this.sensors = systemInfo.getHardware().getSensors();
    }

    /**
     * 在服务启动后立即初始化 tick 基线，使第一次采集就能得到有意义的使用率。
     */
    @PostConstruct
    public void init() {
        this.prevTicks = processor.getSystemCpuLoadTicks();
        this.prevProcessorTicks = processor.getProcessorCpuLoadTicks();
        log.info("CPU 适配器已初始化: {}", processor.getProcessorIdentifier().getName());
    }

    @Override
    public HardwareCategory category() {
        return HardwareCategory.CPU;
    }

    @Override
    public CpuData collect() {
        if (prevTicks == null) {
            init();
        }
        double load = processor.getSystemCpuLoadBetweenTicks(prevTicks) * 100.0;
        double[] coreLoads = processor.getProcessorCpuLoadBetweenTicks(prevProcessorTicks);
        this.prevTicks = processor.getSystemCpuLoadTicks();
        this.prevProcessorTicks = processor.getProcessorCpuLoadTicks();

        List<Double> loadCores = new ArrayList<>(coreLoads.length);
        for (double coreLoad : coreLoads) {
            loadCores.add(coreLoad * 100.0);
        }

        long maxFreq = processor.getMaxFreq();
        var identifier = processor.getProcessorIdentifier();
        return new CpuData(
                identifier.getVendor(),
                identifier.getName(),
                processor.getLogicalProcessorCount(),
                processor.getPhysicalProcessorCount(),
                maxFreq > 0 ? maxFreq / 1_000_000_000.0 : null,
                load,
                loadCores,
                positiveOrNull(sensors.getCpuTemperature()),
                DEFAULT_TEMPERATURE_MAX,
                positiveOrNull(sensors.getCpuVoltage()));
    }

    @Override
    public CpuData empty() {
        return CpuData.empty();
    }

    // Oshi 在不支持的平台上返回 0 或 NaN
    static Double positiveOrNull(double value) {
        return Double.isNaN(value) || value <= 0 ? null : value;
    }
}
