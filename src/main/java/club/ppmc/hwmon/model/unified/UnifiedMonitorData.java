/**
 * UnifiedMonitorData.java
 *
 * 一次统一轮询的结果：各来源的可用状态、全部传感器以及按类型分组后的视图。
 */
package club.ppmc.hwmon.model.unified;

import java.util.List;
import java.util.Map;

public record UnifiedMonitorData(
        Map<String, Boolean> sources,
        List<UnifiedSensor> sensors,
        List<UnifiedSensor> temperatures,
        List<UnifiedSensor> voltages,
        List<UnifiedSensor> fans,
        List<UnifiedSensor> powers,
        List<UnifiedSensor> clocks,
        List<UnifiedSensor> loads,
        long timestamp) {

    public static UnifiedMonitorData of(Map<String, Boolean> sources, List<UnifiedSensor> sensors, long timestamp) {
        return new UnifiedMonitorData(
                Map.copyOf(sources),
                List.copyOf(sensors),
                ofType(sensors, UnifiedSensorType.TEMPERATURE),
                ofType(sensors, UnifiedSensorType.VOLTAGE),
                ofType(sensors, UnifiedSensorType.FAN),
                ofType(sensors, UnifiedSensorType.POWER),
                ofType(sensors, UnifiedSensorType.CLOCK),
                ofType(sensors, UnifiedSensorType.LOAD),
                timestamp);
    }

    public static UnifiedMonitorData empty() {
        return of(Map.of(), List.of(), 0L);
    }

    public List<UnifiedSensor> byType(UnifiedSensorType type) {
        return ofType(sensors, type);
    }

    public List<UnifiedSensor> byStatus(SensorStatus status) {
        return sensors.stream().filter(s -> s.status() == status).toList();
    }

    private static List<UnifiedSensor> ofType(List<UnifiedSensor> sensors, UnifiedSensorType type) {
        return sensors.stream().filter(s -> s.type() == type).toList();
    }
}
