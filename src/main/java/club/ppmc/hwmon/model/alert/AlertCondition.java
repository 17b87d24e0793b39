/**
 * AlertCondition.java
 *
 * 告警规则的触发条件。边界语义：
 * above / below 为严格比较；between 为闭区间；outside 为闭区间之外（等于边界不触发）。
 */
package club.ppmc.hwmon.model.alert;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

public enum AlertCondition {
    @JsonProperty("above") @SerializedName("above") ABOVE,
    @JsonProperty("below") @SerializedName("below") BELOW,
    @JsonProperty("between") @SerializedName("between") BETWEEN,
    @JsonProperty("outside") @SerializedName("outside") OUTSIDE;

    /**
     * 判断数值是否满足条件。调用方需保证条件所需的阈值不为 null（创建规则时已校验）。
     */
    public boolean test(double value, Double thresholdMin, Double thresholdMax) {
        return switch (this) {
            case ABOVE -> value > thresholdMax;
            case BELOW -> value < thresholdMin;
            case BETWEEN -> value >= thresholdMin && value <= thresholdMax;
            case OUTSIDE -> value < thresholdMin || value > thresholdMax;
        };
    }

    public boolean requiresMin() {
        return this != ABOVE;
    }

    public boolean requiresMax() {
        return this != BELOW;
    }
}
