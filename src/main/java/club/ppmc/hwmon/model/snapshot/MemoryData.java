/**
 * MemoryData.java
 *
 * 快照中的内存子记录，单位均为字节。
 */
package club.ppmc.hwmon.model.snapshot;

public record MemoryData(
        Long total,
        Long used,
        Long available,
        Long swapTotal,
        Long swapUsed,
        Double usedPercent) {

    public static MemoryData empty() {
        return new MemoryData(null, null, null, null, null, null);
    }
}
