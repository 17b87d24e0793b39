/**
 * UnifiedSensor.java
 *
 * 归一化之后的传感器。与 SensorReading 不同，它代表多来源融合后的数据，
 * 并通过 source 字段保留来源标签。同一物理量被多个来源报告时会出现多条记录。
 */
package club.ppmc.hwmon.model.unified;

public record UnifiedSensor(
        String id,
        String name,
        UnifiedSensorType type,
        double value,
        Double min,
        Double max,
        String unit,
        String source,
        String hardware,
        SensorStatus status) {}
