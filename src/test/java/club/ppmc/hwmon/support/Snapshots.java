/**
 * Snapshots.java
 *
 * 测试用的快照数据。
 */
package club.ppmc.hwmon.support;

import club.ppmc.hwmon.model.snapshot.BatteryData;
import club.ppmc.hwmon.model.snapshot.CpuData;
import club.ppmc.hwmon.model.snapshot.DiskData;
import club.ppmc.hwmon.model.snapshot.GpuData;
import club.ppmc.hwmon.model.snapshot.HardwareSnapshot;
import club.ppmc.hwmon.model.snapshot.MemoryData;
import club.ppmc.hwmon.model.snapshot.NetworkInterfaceData;
import club.ppmc.hwmon.model.snapshot.OsData;
import club.ppmc.hwmon.model.snapshot.ProcessData;
import club.ppmc.hwmon.model.snapshot.SystemData;
import java.util.List;

public final class Snapshots {

    private Snapshots() {}

    public static CpuData cpu(Double load, Double temperature) {
        return new CpuData("Intel", "Core i7", 8, 4, 4.2, load, List.of(), temperature, 100.0, 1.2);
    }

    public static GpuData gpu(int index, Double temperature, Double load) {
        return new GpuData(index, "NVIDIA", "RTX", 8L << 30, temperature, 100.0, load, 30.0, 45.0, 120.0);
    }

    public static MemoryData memory(Double usedPercent) {
        return new MemoryData(16L << 30, 8L << 30, 8L << 30, 0L, 0L, usedPercent);
    }

    public static DiskData disk(int index, Double usePercent, Double temperature) {
        return new DiskData(index, "sd" + (char) ('a' + index), "/", "ext4", 1000L, 500L, usePercent, temperature);
    }

    public static NetworkInterfaceData nic(String name, Double rxSec, Double txSec) {
        return new NetworkInterfaceData(name, name, "00:00:00:00:00:00", List.of("10.0.0.1"), 1000L, 0L, 0L,
                rxSec, txSec);
    }

    public static OsData os() {
        return new OsData("Linux", "GNU/Linux", "22.04", "jammy", "6.5.0", "amd64", 64, "host", false, 300, 1200);
    }

    public static BatteryData battery(Double percent) {
        return new BatteryData(true, "BAT0", "ACME", "Li-ion", percent, true, true, null, 40_000, 50_000, 56_000,
                "MWH", 12.1, 120, 50_000 * 100.0 / 56_000);
    }

    public static ProcessData process(int pid, String name, double cpu) {
        return new ProcessData(pid, 1, name, cpu, 2.5, 200L << 20, 2L << 30, 20, "RUNNING", "root", name, "/usr/bin/" + name,
                0L);
    }

    /** 一个各类别都有数据的快照。 */
    public static HardwareSnapshot full(long timestamp) {
        return new HardwareSnapshot(
                timestamp,
                "machine-1",
                new SystemData("Dell", "XPS", "Linux", "6.0", "host", 100L),
                os(),
                cpu(25.0, 55.0),
                List.of(gpu(0, 60.0, 70.0)),
                memory(50.0),
                List.of(disk(0, 40.0, 35.0)),
                List.of(nic("eth0", 100.0, 50.0), nic("wlan0", 20.0, 10.0)),
                battery(80.0),
                List.of(process(42, "java", 12.5)));
    }
}
