package club.ppmc.hwmon.model.history;

/**
 * 历史缓冲区的统计信息。缓冲区为空时两个时间戳均为 null。
 */
public record HistoryStats(int entries, Long oldestTimestamp, Long newestTimestamp) {}
