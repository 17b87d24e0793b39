/**
 * HistoryQuery.java
 *
 * 历史区间查询的参数。所有字段都是可选的：
 * startTime 缺省为 0，endTime 缺省为当前时间，resolution 缺省为 RAW，limit 缺省为 1000。
 */
package club.ppmc.hwmon.model.history;

public record HistoryQuery(Long startTime, Long endTime, Resolution resolution, Integer limit) {

    public static final int DEFAULT_LIMIT = 1000;

    public static HistoryQuery all() {
        return new HistoryQuery(null, null, null, null);
    }

    public Resolution resolutionOrRaw() {
        return resolution == null ? Resolution.RAW : resolution;
    }

    public int limitOrDefault() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }
}
