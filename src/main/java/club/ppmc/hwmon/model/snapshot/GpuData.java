/**
 * GpuData.java
 *
 * 单块显卡的采集结果。来自 nvidia-smi 时包含温度、负载等实时指标；
 * 仅来自 OSHI 时只有静态信息，实时指标为 null。
 */
package club.ppmc.hwmon.model.snapshot;

/**
 * @param index             显卡序号，与规范路径 gpu.&lt;i&gt; 中的 i 对应。
 * @param vendor            厂商。
 * @param model             型号。
 * @param vram              显存容量 (字节)。
 * @param temperature       核心温度 (°C)。
 * @param temperatureMax    温度上限 (°C)。
 * @param utilizationGpu    核心使用率 (%)。
 * @param utilizationMemory 显存控制器使用率 (%)。
 * @param fanSpeed          风扇转速 (%)。
 * @param powerDraw         当前功耗 (W)。
 */
public record GpuData(
        int index,
        String vendor,
        String model,
        long vram,
        Double temperature,
        Double temperatureMax,
        Double utilizationGpu,
        Double utilizationMemory,
        Double fanSpeed,
        Double powerDraw) {}
