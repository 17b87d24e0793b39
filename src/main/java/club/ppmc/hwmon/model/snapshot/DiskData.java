/**
 * DiskData.java
 *
 * 单个文件系统（挂载点）的容量信息。
 */
package club.ppmc.hwmon.model.snapshot;

/**
 * @param index       序号，与规范路径 disk.&lt;i&gt; 中的 i 对应。
 * @param name        卷名称。
 * @param mount       挂载点。
 * @param fsType      文件系统类型。
 * @param size        总容量 (字节)。
 * @param used        已用容量 (字节)。
 * @param usePercent  使用率 (%)。
 * @param temperature 磁盘温度 (°C)，无法获取时为 null。
 */
public record DiskData(
        int index,
        String name,
        String mount,
        String fsType,
        long size,
        long used,
        Double usePercent,
        Double temperature) {}
