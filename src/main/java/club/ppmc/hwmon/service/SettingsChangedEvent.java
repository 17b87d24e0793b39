package club.ppmc.hwmon.service;

import club.ppmc.hwmon.model.MonitorSettings;

/**
 * 设置被成功保存后发布的应用事件，携带修改前后的设置副本。
 */
public record SettingsChangedEvent(MonitorSettings previous, MonitorSettings current) {

    public boolean pollingIntervalChanged() {
        return previous.getPollingInterval() != current.getPollingInterval();
    }
}
