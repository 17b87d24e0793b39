/**
 * OsData.java
 *
 * 快照中的操作系统信息。与 SystemData 一样不受类别开关控制。
 */
package club.ppmc.hwmon.model.snapshot;

/**
 * @param family       操作系统家族。
 * @param manufacturer 发行方。
 * @param version      版本号。
 * @param codeName     版本代号。
 * @param buildNumber  构建号，Linux 上为内核版本。
 * @param arch         CPU 架构。
 * @param bitness      操作系统位数。
 * @param hostname     主机名。
 * @param elevated     当前进程是否以管理员/root 权限运行。
 * @param processCount 进程总数。
 * @param threadCount  线程总数。
 */
public record OsData(
        String family,
        String manufacturer,
        String version,
        String codeName,
        String buildNumber,
        String arch,
        int bitness,
        String hostname,
        boolean elevated,
        int processCount,
        int threadCount) {

    public static OsData empty() {
        return new OsData("", "", "", "", "", "", 0, "", false, 0, 0);
    }
}
