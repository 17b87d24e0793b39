/**
 * BatteryData.java
 *
 * 快照中的电池子记录。没有电池或类别被禁用时 hasBattery 为 false，其余字段为 null。
 */
package club.ppmc.hwmon.model.snapshot;

/**
 * @param hasBattery      是否检测到电池。
 * @param name            电池名称。
 * @param manufacturer    厂商。
 * @param chemistry       电池化学类型。
 * @param percent         剩余电量 (%)。
 * @param charging        是否正在充电。
 * @param acConnected     是否接通外部电源。
 * @param timeRemaining   预计剩余时间 (秒)，无法估计时为 null。
 * @param currentCapacity 当前容量。
 * @param maxCapacity     满充容量。
 * @param designCapacity  设计容量。
 * @param capacityUnit    容量单位，例如 "MWH"、"MAH"。
 * @param voltage         电压 (V)。
 * @param cycleCount      循环次数。
 * @param health          健康度 (%)，满充容量相对设计容量的比例。
 */
public record BatteryData(
        boolean hasBattery,
        String name,
        String manufacturer,
        String chemistry,
        Double percent,
        Boolean charging,
        Boolean acConnected,
        Double timeRemaining,
        Integer currentCapacity,
        Integer maxCapacity,
        Integer designCapacity,
        String capacityUnit,
        Double voltage,
        Integer cycleCount,
        Double health) {

    public static BatteryData absent() {
        return new BatteryData(false, null, null, null, null, null, null, null, null, null, null, null, null, null,
                null);
    }
}
