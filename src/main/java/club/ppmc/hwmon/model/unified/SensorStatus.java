package club.ppmc.hwmon.model.unified;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

/**
 * 统一传感器的健康状态。
 */
public enum SensorStatus {
    @JsonProperty("ok") @SerializedName("ok") OK,
    @JsonProperty("warning") @SerializedName("warning") WARNING,
    @JsonProperty("critical") @SerializedName("critical") CRITICAL
}
