/**
 * GpuAdapter.java
 *
 * 显卡数据适配器。优先调用 nvidia-smi 获取温度、负载、风扇和功耗等实时指标；
 * nvidia-smi 不可用或没有输出时，退回到 Oshi 提供的静态显卡列表（没有实时指标）。
 */
package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.GpuData;
import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import club.ppmc.hwmon.util.SystemCommandExecutor;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.GraphicsCard;

@Component
@Slf4j
public class GpuAdapter implements SensorSourceAdapter<List<GpuData>> {

    static final List<String> NVIDIA_SMI_COMMAND = List.of(
            "nvidia-smi",
            "--query-gpu=index,memory.total,temperature.gpu,utilization.gpu,utilization.memory,fan.speed,power.draw,name",
            "--format=csv,noheader,nounits");

    private static final double DEFAULT_TEMPERATURE_MAX = 100.0;
    private static final long MIB = 1024L * 1024L;

    private final SystemInfo systemInfo;
    private final SystemCommandExecutor commandExecutor;
    private final Duration timeout;

    // 第一次执行失败后不再尝试，避免每个周期都启动一个必然失败的进程
    private volatile boolean nvidiaSmiAvailable = true;

    public GpuAdapter(
            SystemInfo systemInfo,
            SystemCommandExecutor commandExecutor,
            @Value("${telemetry.adapter.command-timeout-ms:3000}") long timeoutMs) {
        this.systemInfo = systemInfo;
        this.commandExecutor = commandExecutor;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public HardwareCategory category() {
        return HardwareCategory.GPU;
    }

    @Override
    public List<GpuData> collect() throws InterruptedException {
        if (nvidiaSmiAvailable) {
            try {
                var result = commandExecutor.run(NVIDIA_SMI_COMMAND, timeout);
                if (result.isSuccess()) {
                    List<GpuData> gpus = parseNvidiaSmi(result.output());
                    if (!gpus.isEmpty()) {
                        return gpus;
                    }
                } else {
                    log.debug("nvidia-smi 退出码 {}，使用 Oshi 显卡信息", result.exitCode());
                }
            } catch (IOException e) {
                log.info("未检测到 nvidia-smi，后续仅使用 Oshi 显卡信息");
                nvidiaSmiAvailable = false;
            }
        }
        return fromOshi();
    }

    @Override
    public List<GpuData> empty() {
        return List.of();
    }

    private List<GpuData> fromOshi() {
        List<GraphicsCard> cards = systemInfo.getHardware().getGraphicsCards();
        List<GpuData> gpus = new ArrayList<>(cards.size());
        for (int i = 0; i < cards.size(); i++) {
            GraphicsCard card = cards.get(i);
            gpus.add(new GpuData(i, card.getVendor(), card.getName(), card.getVRam(),
                    null, null, null, null, null, null));
        }
        return gpus;
    }

    /**
     * 解析 nvidia-smi 的 CSV 输出 (noheader, nounits)。无法解析的行会被跳过，"[N/A]" 等值视为缺失。
     * 型号名可能含逗号，因此放在最后一列并按列数上限拆分。
     */
    static List<GpuData> parseNvidiaSmi(String output) {
        List<GpuData> gpus = new ArrayList<>();
        if (output == null) {
            return gpus;
        }
        for (String line : output.split("\\R")) {
            String[] parts = line.split(",", 8);
            if (parts.length < 8) {
                continue;
            }
            Double index = number(parts[0]);
            if (index == null) {
                continue;
            }
            Double memoryTotal = number(parts[1]);
            gpus.add(new GpuData(
                    index.intValue(),
                    "NVIDIA",
                    parts[7].trim(),
                    memoryTotal == null ? 0L : memoryTotal.longValue() * MIB,
                    number(parts[2]),
                    DEFAULT_TEMPERATURE_MAX,
                    number(parts[3]),
                    number(parts[4]),
                    number(parts[5]),
                    number(parts[6])));
        }
        return gpus;
    }

    private static Double number(String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
