package club.ppmc.hwmon.model.history;

/**
 * 单个规范路径在某一时刻的取值。
 */
public record SensorSample(long timestamp, double value) {}
