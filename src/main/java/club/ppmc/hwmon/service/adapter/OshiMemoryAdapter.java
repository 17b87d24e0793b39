package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import club.ppmc.hwmon.model.snapshot.MemoryData;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.GlobalMemory;

/**
 * 通过 Oshi 采集物理内存与交换区的使用情况。
 */
@Component
public class OshiMemoryAdapter implements SensorSourceAdapter<MemoryData> {

    private final GlobalMemory memory;

    public OshiMemoryAdapter(SystemInfo systemInfo) {
        this.memory = systemInfo.getHardware().getMemory();
    }

    @Override
    public HardwareCategory category() {
        return HardwareCategory.MEMORY;
    }

    @Override
    public MemoryData collect() {
        long total = memory.getTotal();
        long available = memory.getAvailable();
        long used = total - available;
        var virtualMemory = memory.getVirtualMemory();
        return new MemoryData(
                total,
                used,
                available,
                virtualMemory.getSwapTotal(),
                virtualMemory.getSwapUsed(),
                total > 0 ? used * 100.0 / total : null);
    }

    @Override
    public MemoryData empty() {
        return MemoryData.empty();
    }
}
