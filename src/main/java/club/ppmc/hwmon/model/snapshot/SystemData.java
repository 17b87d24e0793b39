/**
 * SystemData.java
 *
 * 快照中的系统/操作系统基础信息。该部分不受类别开关控制，每次采集都会填充。
 */
package club.ppmc.hwmon.model.snapshot;

/**
 * @param manufacturer 整机厂商。
 * @param model        整机型号。
 * @param osFamily     操作系统家族，例如 "Ubuntu"、"Windows"。
 * @param osVersion    操作系统版本号。
 * @param hostname     主机名。
 * @param uptime       系统运行时间 (秒)。
 */
public record SystemData(
        String manufacturer,
        String model,
        String osFamily,
        String osVersion,
        String hostname,
        long uptime) {

    public static SystemData empty() {
        return new SystemData("", "", "", "", "", 0L);
    }
}
