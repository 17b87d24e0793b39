/**
 * PluginState.java
 *
 * 插件在注册表中的生命周期状态。
 */
package club.ppmc.hwmon.service.plugin;

public enum PluginState {
    REGISTERED,
    INITIALIZED,
    STARTED,
    STOPPED,
    DESTROYED,
    FAILED
}
