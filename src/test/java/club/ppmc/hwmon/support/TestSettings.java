/**
 * TestSettings.java
 *
 * 构造不依赖 Spring 容器的 SettingsService。
 */
package club.ppmc.hwmon.support;

import club.ppmc.hwmon.model.MonitorSettings;
import club.ppmc.hwmon.service.SettingsService;
import java.nio.file.Path;
import java.util.function.Consumer;

public final class TestSettings {

    private TestSettings() {}

    public static SettingsService of(Path dataDir, Consumer<MonitorSettings> customizer) {
        var settings = new MonitorSettings();
        customizer.accept(settings);
        return new SettingsService(dataDir, settings, event -> {});
    }

    public static SettingsService defaults(Path dataDir) {
        return of(dataDir, s -> {});
    }
}
