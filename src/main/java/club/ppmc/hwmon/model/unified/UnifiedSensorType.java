package club.ppmc.hwmon.model.unified;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

/**
 * 统一传感器的规范类型。各来源的原生类型标签通过固定映射表归一到这里，无法映射的归为 OTHER。
 */
public enum UnifiedSensorType {
    @JsonProperty("temperature") @SerializedName("temperature") TEMPERATURE,
    @JsonProperty("voltage") @SerializedName("voltage") VOLTAGE,
    @JsonProperty("fan") @SerializedName("fan") FAN,
    @JsonProperty("power") @SerializedName("power") POWER,
    @JsonProperty("clock") @SerializedName("clock") CLOCK,
    @JsonProperty("load") @SerializedName("load") LOAD,
    @JsonProperty("current") @SerializedName("current") CURRENT,
    @JsonProperty("other") @SerializedName("other") OTHER
}
