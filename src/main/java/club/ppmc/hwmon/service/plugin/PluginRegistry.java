/**
 * PluginRegistry.java
 *
 * 管理所有已注册遥测插件的生命周期，并汇总正在运行的插件的轮询结果。
 * 单个插件的失败只会把该插件标记为 FAILED，不会影响其他插件。
 */
package club.ppmc.hwmon.service.plugin;

import club.ppmc.hwmon.model.unified.SourceSensor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class PluginRegistry {

    private final Map<String, TelemetryPlugin> plugins = new LinkedHashMap<>();
    private final Map<String, PluginState> states = new LinkedHashMap<>();

    @FunctionalInterface
    private interface PluginStep {
        void apply(TelemetryPlugin plugin) throws Exception;
    }

    public PluginRegistry(List<TelemetryPlugin> plugins) {
        for (TelemetryPlugin plugin : plugins) {
            if (this.plugins.putIfAbsent(plugin.id(), plugin) != null) {
                log.warn("插件 id 重复，已忽略: {}", plugin.id());
                continue;
            }
            states.put(plugin.id(), PluginState.REGISTERED);
        }
    }

    public synchronized void initAll() {
        transition(PluginState.REGISTERED, PluginState.INITIALIZED, TelemetryPlugin::init, "初始化");
    }

    public synchronized void startAll() {
        transition(PluginState.INITIALIZED, PluginState.STARTED, TelemetryPlugin::start, "启动");
        transition(PluginState.STOPPED, PluginState.STARTED, TelemetryPlugin::start, "启动");
    }

    public synchronized void stopAll() {
        transition(PluginState.STARTED, PluginState.STOPPED, TelemetryPlugin::stop, "停止");
    }

    public synchronized void destroyAll() {
        stopAll();
        transition(PluginState.STOPPED, PluginState.DESTROYED, TelemetryPlugin::destroy, "销毁");
        transition(PluginState.INITIALIZED, PluginState.DESTROYED, TelemetryPlugin::destroy, "销毁");
    }

    /**
     * 轮询所有处于 STARTED 状态的插件。轮询失败的插件本次不贡献数据，但保持运行状态。
     */
    public List<SourceSensor> pollAll() {
        List<TelemetryPlugin> running;
        synchronized (this) {
            running = plugins.values().stream()
                    .filter(p -> states.get(p.id()) == PluginState.STARTED)
                    .toList();
        }
        List<SourceSensor> sensors = new ArrayList<>();
        for (TelemetryPlugin plugin : running) {
            try {
                List<SourceSensor> polled = plugin.poll();
                if (polled != null) {
                    sensors.addAll(polled);
                }
            } catch (Exception e) {
                log.warn("轮询插件 {} 失败: {}", plugin.id(), e.getMessage());
            }
        }
        return sensors;
    }

    public synchronized boolean hasRunningPlugins() {
        return states.containsValue(PluginState.STARTED);
    }

    public synchronized Map<String, PluginState> getStates() {
        return Map.copyOf(states);
    }

    public synchronized PluginState getState(String pluginId) {
        return states.get(pluginId);
    }

    private void transition(PluginState from, PluginState to, PluginStep step, String action) {
        for (TelemetryPlugin plugin : plugins.values()) {
            if (states.get(plugin.id()) != from) {
                continue;
            }
            try {
                step.apply(plugin);
                states.put(plugin.id(), to);
                log.info("插件 {} 已{}", plugin.id(), action);
            } catch (Exception e) {
                log.error("{}插件 {} 失败", action, plugin.id(), e);
                states.put(plugin.id(), PluginState.FAILED);
            }
        }
    }
}
