/**
 * HistoryEntry.java
 *
 * 时间序列中的一个采样点：时间戳加上 "规范路径 -> 数值" 的映射。
 */
package club.ppmc.hwmon.model.history;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record HistoryEntry(long timestamp, Map<String, Double> readings) {

    public HistoryEntry {
        // 保留插入顺序，便于前端按固定顺序绘图
        readings = readings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(readings));
    }
}
