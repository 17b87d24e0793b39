/**
 * AlertAction.java
 *
 * 告警规则中的一个动作。config 的内容由动作类型决定：
 * webhook 需要 "url"，command 需要 "command"，email 可选 "to"。
 */
package club.ppmc.hwmon.model.alert;

import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertAction {

    private AlertActionType type;

    private Map<String, Object> config = new HashMap<>();

    /**
     * 读取字符串类型的配置项，不存在或为空白时返回 null。
     */
    public String configString(String key) {
        Object value = config == null ? null : config.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
