/**
 * SensorType.java
 *
 * 快照读数 (SensorReading) 的类型。序列化时使用小写名称。
 */
package club.ppmc.hwmon.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

public enum SensorType {
    @JsonProperty("temperature") @SerializedName("temperature") TEMPERATURE,
    @JsonProperty("voltage") @SerializedName("voltage") VOLTAGE,
    @JsonProperty("fan") @SerializedName("fan") FAN,
    @JsonProperty("power") @SerializedName("power") POWER,
    @JsonProperty("load") @SerializedName("load") LOAD,
    @JsonProperty("clock") @SerializedName("clock") CLOCK,
    @JsonProperty("data") @SerializedName("data") DATA
}
