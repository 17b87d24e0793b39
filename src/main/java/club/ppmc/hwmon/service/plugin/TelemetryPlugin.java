/**
 * TelemetryPlugin.java
 *
 * 遥测插件的契约。插件以 Spring Bean 的形式静态注册，由 PluginRegistry 统一管理生命周期，
 * 轮询结果通过 "plugin" 来源进入统一传感器视图。
 *
 * <p>生命周期顺序为 init → start → (poll)* → stop → destroy。
 * 任何一个方法抛出的异常都只影响该插件本身。
 */
package club.ppmc.hwmon.service.plugin;

import club.ppmc.hwmon.model.unified.SourceSensor;
import java.util.List;

public interface TelemetryPlugin {

    /** 插件唯一标识，同时作为其传感器的 hardware 字段。 */
    String id();

    default String name() {
        return id();
    }

    void init() throws Exception;

    void start() throws Exception;

    /**
     * 读取插件当前提供的全部传感器。
     */
    List<SourceSensor> poll() throws Exception;

    void stop() throws Exception;

    default void destroy() throws Exception {}
}
