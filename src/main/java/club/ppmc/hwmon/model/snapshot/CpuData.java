/**
 * CpuData.java
 *
 * 快照中的CPU子记录。数值字段使用包装类型，null 表示该指标未能采集到，
 * ReadingExtractor 会据此跳过对应的读数，而不是填 0。
 */
package club.ppmc.hwmon.model.snapshot;

import java.util.List;

/**
 * @param manufacturer   厂商。
 * @param brand          型号名称。
 * @param cores          逻辑核心数。
 * @param physicalCores  物理核心数。
 * @param speedMax       最大频率 (GHz)。
 * @param load           总使用率 (0-100)。
 * @param loadCores      每个逻辑核心的使用率 (0-100)。
 * @param temperature    封装温度 (°C)。
 * @param temperatureMax 温度上限 (°C)。
 * @param voltage        核心电压 (V)。
 */
public record CpuData(
        String manufacturer,
        String brand,
        int cores,
        int physicalCores,
        Double speedMax,
        Double load,
        List<Double> loadCores,
        Double temperature,
        Double temperatureMax,
        Double voltage) {

    public CpuData {
        loadCores = loadCores == null ? List.of() : List.copyOf(loadCores);
    }

    /** 类别被禁用或采集失败时使用的空记录。 */
    public static CpuData empty() {
        return new CpuData("", "", 0, 0, null, null, List.of(), null, null, null);
    }
}
