/**
 * SourceSensor.java
 *
 * 某个来源子系统（lm-sensors、OSHI、插件等）返回的原始传感器数据，尚未归一化。
 */
package club.ppmc.hwmon.model.unified;

/**
 * @param id        来源内唯一的标识。
 * @param name      传感器名称。
 * @param typeLabel 来源自己的类型标签，例如 "temperature"、"in"、"level"。
 * @param value     当前值。
 * @param min       下限，未知时为 null。
 * @param max       上限（温度为临界值），未知时为 null。
 * @param nominal   电压的标称值，未知时为 null。
 * @param unit      单位。
 * @param hardware  所属硬件（芯片名、设备名等）。
 * @param alarm     来源是否显式报告了告警标志。
 * @param status    来源自己给出的健康状态 (如 IPMI、SMART)，为 null 时按阈值规则计算。
 */
public record SourceSensor(
        String id,
        String name,
        String typeLabel,
        double value,
        Double min,
        Double max,
        Double nominal,
        String unit,
        String hardware,
        boolean alarm,
        SensorStatus status) {

    public SourceSensor(String id, String name, String typeLabel, double value, Double min, Double max,
            Double nominal, String unit, String hardware, boolean alarm) {
        this(id, name, typeLabel, value, min, max, nominal, unit, hardware, alarm, null);
    }
}
