package club.ppmc.hwmon.model.alert;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

/**
 * 告警触发后可执行的动作类型。
 */
public enum AlertActionType {
    @JsonProperty("notification") @SerializedName("notification") NOTIFICATION,
    @JsonProperty("webhook") @SerializedName("webhook") WEBHOOK,
    @JsonProperty("command") @SerializedName("command") COMMAND,
    @JsonProperty("sound") @SerializedName("sound") SOUND,
    @JsonProperty("email") @SerializedName("email") EMAIL
}
