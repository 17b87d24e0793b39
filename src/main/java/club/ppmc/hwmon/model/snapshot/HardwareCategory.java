/**
 * HardwareCategory.java
 *
 * 快照中可开关的硬件类别。
 * 类别名与 MonitorSettings.enabledSensors 中保存的字符串一一对应。
 */
package club.ppmc.hwmon.model.snapshot;

import java.util.Arrays;
import java.util.Optional;

public enum HardwareCategory {
    CPU("cpu"),
    GPU("gpu"),
    MEMORY("memory"),
    DISK("disk"),
    NETWORK("network"),
    BATTERY("battery"),
    PROCESSES("processes");

    private final String key;

    HardwareCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 按配置中的名称查找类别，忽略大小写。
     */
    public static Optional<HardwareCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(c -> c.key.equalsIgnoreCase(key.trim())).findFirst();
    }
}
