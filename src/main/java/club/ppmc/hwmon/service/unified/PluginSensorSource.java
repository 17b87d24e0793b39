/**
 * PluginSensorSource.java
 *
 * "plugin" 来源：汇总所有正在运行的遥测插件的轮询结果。
 */
package club.ppmc.hwmon.service.unified;

import club.ppmc.hwmon.model.unified.SourceSensor;
import club.ppmc.hwmon.service.plugin.PluginRegistry;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PluginSensorSource implements SensorSource {

    static final String TAG = "plugin";

    private final PluginRegistry pluginRegistry;

    public PluginSensorSource(PluginRegistry pluginRegistry) {
        this.pluginRegistry = pluginRegistry;
    }

    @Override
    public String tag() {
        return TAG;
    }

    /**
     * 插件在来源探测之前启动，因此这里反映的是启动后的状态。
     */
    @Override
    public boolean isAvailable() {
        return pluginRegistry.hasRunningPlugins();
    }

    @Override
    public List<SourceSensor> readSensors() {
        return pluginRegistry.pollAll();
    }
}
