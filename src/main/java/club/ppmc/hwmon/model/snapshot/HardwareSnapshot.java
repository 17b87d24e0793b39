/**
 * HardwareSnapshot.java
 *
 * 一次完整采集周期的不可变结果。
 * 每个硬件类别都有对应的子记录：被禁用或采集失败的类别使用空记录/空列表填充，
 * 因此快照的结构总是完整的。新的快照整体替换旧的缓存，从不原地修改。
 */
package club.ppmc.hwmon.model.snapshot;

import java.util.List;

/**
 * @param timestamp 采集完成时间 (毫秒)，在连续的采集之间单调不减。
 * @param machineId 机器唯一标识。
 * @param system    系统信息。
 * @param os        操作系统信息。
 * @param cpu       CPU 子记录。
 * @param gpus      显卡列表。
 * @param memory    内存子记录。
 * @param disks     文件系统列表。
 * @param network   网卡列表。
 * @param battery   电池信息，没有电池时 hasBattery 为 false。
 * @param processes CPU 占用最高的进程。
 */
public record HardwareSnapshot(
        long timestamp,
        String machineId,
        SystemData system,
        OsData os,
        CpuData cpu,
        List<GpuData> gpus,
        MemoryData memory,
        List<DiskData> disks,
        List<NetworkInterfaceData> network,
        BatteryData battery,
        List<ProcessData> processes) {

    public HardwareSnapshot {
        system = system == null ? SystemData.empty() : system;
        os = os == null ? OsData.empty() : os;
        battery = battery == null ? BatteryData.absent() : battery;
        cpu = cpu == null ? CpuData.empty() : cpu;
        memory = memory == null ? MemoryData.empty() : memory;
        gpus = gpus == null ? List.of() : List.copyOf(gpus);
        disks = disks == null ? List.of() : List.copyOf(disks);
        network = network == null ? List.of() : List.copyOf(network);
        processes = processes == null ? List.of() : List.copyOf(processes);
    }
}
