/**
 * ReadingExtractor.java
 *
 * 把一个快照投影为扁平、有序的规范读数列表。
 * 这是一个无副作用的纯函数：相同的快照总是得到顺序完全相同的读数列表。
 * 只提取固定的一组规范路径；子记录中缺失的值直接跳过，不会用 0 填充。
 */
package club.ppmc.hwmon.service;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.SensorType;
import club.ppmc.hwmon.model.snapshot.CpuData;
import club.ppmc.hwmon.model.snapshot.DiskData;
import club.ppmc.hwmon.model.snapshot.GpuData;
import club.ppmc.hwmon.model.snapshot.HardwareSnapshot;
import club.ppmc.hwmon.model.snapshot.NetworkInterfaceData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ReadingExtractor {

    private static final String CELSIUS = "°C";
    private static final String PERCENT = "%";
    private static final double DEFAULT_TEMPERATURE_MAX = 100.0;
    private static final double DISK_TEMPERATURE_MAX = 70.0;

    /**
     * 提取快照中的全部规范读数。路径顺序固定为：
     * cpu.load, cpu.temperature, gpu.&lt;i&gt;.*, memory.used, disk.&lt;i&gt;.*, network.rx, network.tx。
     */
    public List<SensorReading> extract(HardwareSnapshot snapshot) {
        List<SensorReading> readings = new ArrayList<>();
        long ts = snapshot.timestamp();

        CpuData cpu = snapshot.cpu();
        if (cpu.load() != null) {
            readings.add(new SensorReading("CPU Load", SensorType.LOAD, cpu.load(), 0, 100, PERCENT, "cpu.load", ts));
        }
        if (cpu.temperature() != null) {
            readings.add(new SensorReading("CPU Temperature", SensorType.TEMPERATURE, cpu.temperature(),
                    0, orDefault(cpu.temperatureMax(), DEFAULT_TEMPERATURE_MAX), CELSIUS, "cpu.temperature", ts));
        }

        for (GpuData gpu : snapshot.gpus()) {
            String prefix = "gpu." + gpu.index();
            String label = "GPU " + gpu.index();
            if (gpu.temperature() != null) {
                readings.add(new SensorReading(label + " Temperature", SensorType.TEMPERATURE, gpu.temperature(),
                        0, orDefault(gpu.temperatureMax(), DEFAULT_TEMPERATURE_MAX), CELSIUS, prefix + ".temperature", ts));
            }
            if (gpu.utilizationGpu() != null) {
                readings.add(new SensorReading(label + " Load", SensorType.LOAD, gpu.utilizationGpu(),
                        0, 100, PERCENT, prefix + ".load", ts));
            }
            if (gpu.utilizationMemory() != null) {
                readings.add(new SensorReading(label + " Memory", SensorType.LOAD, gpu.utilizationMemory(),
                        0, 100, PERCENT, prefix + ".memory", ts));
            }
            if (gpu.fanSpeed() != null) {
                readings.add(new SensorReading(label + " Fan", SensorType.FAN, gpu.fanSpeed(),
                        0, 100, PERCENT, prefix + ".fan", ts));
            }
            if (gpu.powerDraw() != null) {
                readings.add(new SensorReading(label + " Power", SensorType.POWER, gpu.powerDraw(),
                        0, Math.max(gpu.powerDraw(), 0), "W", prefix + ".power", ts));
            }
        }

        if (snapshot.memory().usedPercent() != null) {
            readings.add(new SensorReading("Memory Usage", SensorType.LOAD, snapshot.memory().usedPercent(),
                    0, 100, PERCENT, "memory.used", ts));
        }

        for (DiskData disk : snapshot.disks()) {
            String prefix = "disk." + disk.index();
            if (disk.usePercent() != null) {
                readings.add(new SensorReading("Disk " + disk.name() + " Usage", SensorType.LOAD, disk.usePercent(),
                        0, 100, PERCENT, prefix + ".usage", ts));
            }
            if (disk.temperature() != null && disk.temperature() > 0) {
                readings.add(new SensorReading("Disk " + disk.name() + " Temperature", SensorType.TEMPERATURE,
                        disk.temperature(), 0, DISK_TEMPERATURE_MAX, CELSIUS, prefix + ".temperature", ts));
            }
        }

        addNetworkTotals(snapshot.network(), ts, readings);
        return readings;
    }

    /**
     * 把读数列表转换为历史存储使用的 "规范路径 -> 数值" 映射，保持读数顺序。
     */
    public static Map<String, Double> toValueMap(List<SensorReading> readings) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (SensorReading reading : readings) {
            values.put(reading.source(), reading.value());
        }
        return values;
    }

    private static void addNetworkTotals(List<NetworkInterfaceData> network, long ts, List<SensorReading> readings) {
        double rx = 0;
        double tx = 0;
        boolean hasRate = false;
        for (NetworkInterfaceData iface : network) {
            if (iface.rxSec() != null) {
                rx += iface.rxSec();
                hasRate = true;
            }
            if (iface.txSec() != null) {
                tx += iface.txSec();
                hasRate = true;
            }
        }
        if (!hasRate) {
            return;
        }
        // 速率没有固定上限，max 取当前值
        readings.add(new SensorReading("Network Receive", SensorType.DATA, rx, 0, rx, "B/s", "network.rx", ts));
        readings.add(new SensorReading("Network Transmit", SensorType.DATA, tx, 0, tx, "B/s", "network.tx", ts));
    }

    private static double orDefault(Double value, double fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
