/**
 * OshiBatteryAdapter.java
 *
 * 通过 Oshi 的 PowerSource 采集电池状态。有多块电池时只取第一块。
 */
package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.BatteryData;
import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import java.util.List;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.PowerSource;

@Component
public class OshiBatteryAdapter implements SensorSourceAdapter<BatteryData> {

    private final HardwareAbstractionLayer hardware;

    public OshiBatteryAdapter(SystemInfo systemInfo) {
        this.hardware = systemInfo.getHardware();
    }

    @Override
    public HardwareCategory category() {
        return HardwareCategory.BATTERY;
    }

    @Override
    public BatteryData collect() {
        List<PowerSource> sources = hardware.getPowerSources();
        if (sources.isEmpty()) {
            return BatteryData.absent();
        }
        return toBatteryData(sources.get(0));
    }

    @Override
    public BatteryData empty() {
        return BatteryData.absent();
    }

    static BatteryData toBatteryData(PowerSource source) {
        int current = source.getCurrentCapacity();
        int max = source.getMaxCapacity();
        int design = source.getDesignCapacity();
        // Oshi 用 -1 表示"正在估算"，-2 表示接通电源时无限
        double remaining = source.getTimeRemainingEstimated();
        double voltage = source.getVoltage();
        int cycles = source.getCycleCount();
        return new BatteryData(
                true,
                source.getName(),
                source.getManufacturer(),
                source.getChemistry(),
                source.getRemainingCapacityPercent() * 100.0,
                source.isCharging(),
                source.isPowerOnLine(),
                remaining >= 0 ? remaining : null,
                current > 0 ? current : null,
                max > 0 ? max : null,
                design > 0 ? design : null,
                source.getCapacityUnits() == null ? null : source.getCapacityUnits().name(),
                voltage > 0 ? voltage : null,
                cycles >= 0 ? cycles : null,
                max > 0 && design > 0 ? max * 100.0 / design : null);
    }
}
