/**
 * TelemetryLifecycle.java
 *
 * 管理遥测流水线的启停：应用启动完成后初始化插件与统一传感器来源，并按当前设置启动快照采集；
 * 应用关闭时停止采集、关闭所有订阅端连接并停止插件。每一步都可以重复执行。
 */
package club.ppmc.hwmon.service;

import club.ppmc.hwmon.service.distribution.DistributionHub;
import club.ppmc.hwmon.service.plugin.PluginRegistry;
import club.ppmc.hwmon.service.unified.UnifiedSensorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class TelemetryLifecycle implements SmartLifecycle {

    private final HardwareMonitorService hardwareMonitorService;
    private final UnifiedSensorService unifiedSensorService;
    private final PluginRegistry pluginRegistry;
    private final DistributionHub distributionHub;
    private final SettingsService settingsService;
    private final boolean autoStartup;

    private volatile boolean running = false;

    public TelemetryLifecycle(
            HardwareMonitorService hardwareMonitorService,
            UnifiedSensorService unifiedSensorService,
            PluginRegistry pluginRegistry,
            DistributionHub distributionHub,
            SettingsService settingsService,
            @Value("${telemetry.autostart:true}") boolean autoStartup) {
        this.hardwareMonitorService = hardwareMonitorService;
        this.unifiedSensorService = unifiedSensorService;
        this.pluginRegistry = pluginRegistry;
        this.distributionHub = distributionHub;
        this.settingsService = settingsService;
        this.autoStartup = autoStartup;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        pluginRegistry.initAll();
        pluginRegistry.startAll();
        unifiedSensorService.initialize();
        hardwareMonitorService.start(settingsService.getSettings().getPollingInterval());
        running = true;
        log.info("遥测流水线已启动");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        hardwareMonitorService.stop();
        distributionHub.closeAll();
        pluginRegistry.destroyAll();
        running = false;
        log.info("遥测流水线已停止");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * 采集间隔变化时用新间隔重启定时采集。
     */
    @EventListener
    public synchronized void onSettingsChanged(SettingsChangedEvent event) {
        if (!running || !event.pollingIntervalChanged()) {
            return;
        }
        long interval = event.current().getPollingInterval();
        log.info("采集间隔已变更为 {} ms，重启定时采集", interval);
        hardwareMonitorService.stop();
        hardwareMonitorService.start(interval);
    }
}
