/**
 * OshiProcessAdapter.java
 *
 * 通过 Oshi 采集 CPU 占用最高的进程。
 * 与 CPU 使用率一样，进程的 CPU 占用需要上一次采集的进程快照才能计算差值。
 */
package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import club.ppmc.hwmon.model.snapshot.ProcessData;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.GlobalMemory;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

@Component
public class OshiProcessAdapter implements SensorSourceAdapter<List<ProcessData>> {

    static final int MAX_PROCESSES = 50;

    private final OperatingSystem operatingSystem;
    private final GlobalMemory memory;
    private final int logicalProcessors;

    // pid -> 上一次采集时的进程快照
    private Map<Integer, OSProcess> previous = new HashMap<>();

    public OshiProcessAdapter(SystemInfo systemInfo) {
        this.operatingSystem = systemInfo.getOperatingSystem();
        this.memory = systemInfo.getHardware().getMemory();
        this.logicalProcessors = Math.max(1, systemInfo.getHardware().getProcessor().getLogicalProcessorCount());
    }

    @Override
    public HardwareCategory category() {
        return HardwareCategory.PROCESSES;
    }

    @Override
    public List<ProcessData> collect() {
        List<OSProcess> processes = operatingSystem.getProcesses(
                OperatingSystem.ProcessFiltering.ALL_PROCESSES,
                OperatingSystem.ProcessSorting.CPU_DESC,
                MAX_PROCESSES);
        long totalMemory = memory.getTotal();

        Map<Integer, OSProcess> current = new HashMap<>();
        List<ProcessData> result = new ArrayList<>(processes.size());
        for (OSProcess process : processes) {
            current.put(process.getProcessID(), process);
            double load = process.getProcessCpuLoadBetweenTicks(previous.get(process.getProcessID()));
            result.add(new ProcessData(
                    process.getProcessID(),
                    process.getParentProcessID(),
                    process.getName(),
                    load * 100.0 / logicalProcessors,
                    totalMemory > 0 ? process.getResidentSetSize() * 100.0 / totalMemory : 0.0,
                    process.getResidentSetSize(),
                    process.getVirtualSize(),
                    process.getPriority(),
                    process.getState() == null ? "" : process.getState().name(),
                    process.getUser(),
                    process.getCommandLine(),
                    process.getPath(),
                    process.getStartTime()));
        }
        this.previous = current;
        return result;
    }

    @Override
    public List<ProcessData> empty() {
        return List.of();
    }
}
