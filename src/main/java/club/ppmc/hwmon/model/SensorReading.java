/**
 * SensorReading.java
 *
 * 从快照中展平出来的单条规范读数。只由 ReadingExtractor 生成。
 * source 字段是规范的点分路径（例如 "cpu.load"、"gpu.0.temperature"），
 * 历史存储和告警匹配都以它作为键。
 */
package club.ppmc.hwmon.model;

/**
 * @param name      便于阅读的名称，例如 "CPU Temperature"。
 * @param type      读数类型。
 * @param value     当前值。
 * @param min       量程下限。
 * @param max       量程上限。
 * @param unit      单位。
 * @param source    规范路径。
 * @param timestamp 所属快照的时间戳 (毫秒)。
 */
public record SensorReading(
        String name,
        SensorType type,
        double value,
        double min,
        double max,
        String unit,
        String source,
        long timestamp) {}
