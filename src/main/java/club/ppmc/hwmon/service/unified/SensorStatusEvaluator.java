/**
 * SensorStatusEvaluator.java
 *
 * 根据传感器类型、当前值和来源提供的界限计算状态。纯函数，无状态。
 */
package club.ppmc.hwmon.service.unified;

import club.ppmc.hwmon.model.unified.SensorStatus;
import club.ppmc.hwmon.model.unified.UnifiedSensorType;

public final class SensorStatusEvaluator {

    static final double TEMP_CRITICAL_RATIO = 0.95;
    static final double TEMP_WARNING_RATIO = 0.85;
    static final double TEMP_CRITICAL_ABSOLUTE = 90.0;
    static final double TEMP_WARNING_ABSOLUTE = 80.0;
    static final double VOLTAGE_CRITICAL_DEVIATION = 0.10;
    static final double VOLTAGE_WARNING_DEVIATION = 0.05;
    static final double FAN_STALL_RPM = 200.0;
    static final double FAN_ACTIVE_MAX_RPM = 1000.0;

    private SensorStatusEvaluator() {}

    /**
     * @param max     上限；温度为临界值。未知时为 null。
     * @param nominal 电压标称值，未知时为 null。
     * @param alarm   来源是否报告了告警标志，为 true 时直接判为 critical。
     */
    public static SensorStatus evaluate(
            UnifiedSensorType type, double value, Double max, Double nominal, boolean alarm) {
        if (alarm) {
            return SensorStatus.CRITICAL;
        }
        if (type == null || !Double.isFinite(value)) {
            return SensorStatus.OK;
        }
        switch (type) {
            case TEMPERATURE:
                return evaluateTemperature(value, max);
            case VOLTAGE:
                return evaluateVoltage(value, nominal);
            case FAN:
                if (max != null && max > FAN_ACTIVE_MAX_RPM && value < FAN_STALL_RPM) {
                    return SensorStatus.WARNING;
                }
                return SensorStatus.OK;
            default:
                return SensorStatus.OK;
        }
    }

    private static SensorStatus evaluateTemperature(double value, Double max) {
        if (max != null && max > 0) {
            if (value >= max * TEMP_CRITICAL_RATIO) {
                return SensorStatus.CRITICAL;
            }
            if (value >= max * TEMP_WARNING_RATIO) {
                return SensorStatus.WARNING;
            }
            return SensorStatus.OK;
        }
        if (value >= TEMP_CRITICAL_ABSOLUTE) {
            return SensorStatus.CRITICAL;
        }
        if (value >= TEMP_WARNING_ABSOLUTE) {
            return SensorStatus.WARNING;
        }
        return SensorStatus.OK;
    }

    private static SensorStatus evaluateVoltage(double value, Double nominal) {
        if (nominal == null || nominal == 0) {
            return SensorStatus.OK;
        }
        double deviation = Math.abs(1 - value / nominal);
        if (deviation > VOLTAGE_CRITICAL_DEVIATION) {
            return SensorStatus.CRITICAL;
        }
        if (deviation > VOLTAGE_WARNING_DEVIATION) {
            return SensorStatus.WARNING;
        }
        return SensorStatus.OK;
    }
}
