/**
 * Resolution.java
 *
 * 历史查询的降采样粒度。RAW 表示不分桶。
 */
package club.ppmc.hwmon.model.history;

import java.util.Arrays;

public enum Resolution {
    RAW(0L),
    MINUTE(60_000L),
    HOUR(3_600_000L),
    DAY(86_400_000L);

    private final long bucketMillis;

    Resolution(long bucketMillis) {
        this.bucketMillis = bucketMillis;
    }

    public long getBucketMillis() {
        return bucketMillis;
    }

    /**
     * 解析请求参数中的粒度，空值视为 RAW。
     *
     * @throws IllegalArgumentException 无法识别的粒度名称。
     */
    public static Resolution parse(String value) {
        if (value == null || value.isBlank()) {
            return RAW;
        }
        return Arrays.stream(values())
                .filter(r -> r.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("不支持的粒度: " + value));
    }
}
