/**
 * MonitorSettings.java
 *
 * 运行期可修改的监控配置。由 SettingsService 负责加载和保存到数据目录下的 settings.json。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.hwmon.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;

@Data
public class MonitorSettings {

    // --- 采集 ---
    /** 快照采集间隔 (毫秒)，允许范围 100 - 60000。 */
    private long pollingInterval = 1000;

    /** 启用的硬件类别，取值见 HardwareCategory。 */
    private Set<String> enabledSensors =
            new LinkedHashSet<>(List.of("cpu", "gpu", "memory", "disk", "network", "processes"));

    /** 是否启用多来源统一传感器轮询。 */
    private boolean unifiedEnabled = true;

    // --- 订阅端鉴权 ---
    private boolean enableAuth = false;
    private String apiKey = "";

    // --- 历史 ---
    private boolean enableHistory = true;

    /** 历史保留时长 (秒)，允许范围 60 - 30天。 */
    private long historyRetention = 3600;

    /** 内存中最多保留的历史条目数。 */
    private int historyMaxEntries = 3600;

    // --- 告警 ---
    private boolean enableAlerts = true;

    /** 告警事件历史的容量上限。 */
    private int alertHistoryLimit = 1000;

    /**
     * 判断某个硬件类别是否启用。
     */
    public boolean isCategoryEnabled(String category) {
        return enabledSensors != null
                && enabledSensors.stream().anyMatch(s -> s.equalsIgnoreCase(category));
    }

    public MonitorSettings copy() {
        var copy = new MonitorSettings();
        copy.setPollingInterval(pollingInterval);
        copy.setEnabledSensors(enabledSensors == null ? new LinkedHashSet<>() : new LinkedHashSet<>(enabledSensors));
        copy.setUnifiedEnabled(unifiedEnabled);
        copy.setEnableAuth(enableAuth);
        copy.setApiKey(apiKey);
        copy.setEnableHistory(enableHistory);
        copy.setHistoryRetention(historyRetention);
        copy.setHistoryMaxEntries(historyMaxEntries);
        copy.setEnableAlerts(enableAlerts);
        copy.setAlertHistoryLimit(alertHistoryLimit);
        return copy;
    }
}
