/**
 * HistoryService.java
 *
 * 内存中的时间序列存储。每个采集周期写入一个 HistoryEntry，
 * 写入后从队首淘汰超出保留时长的条目（均摊 O(1)），并受最大条目数约束。
 * 查询支持时间区间过滤、按分钟/小时/天分桶求平均以及按步长抽稀。
 * 数据只保存在内存中，进程重启后丢失。
 */
package club.ppmc.hwmon.service;

import club.ppmc.hwmon.model.MonitorSettings;
import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.history.HistoryEntry;
import club.ppmc.hwmon.model.history.HistoryQuery;
import club.ppmc.hwmon.model.history.HistoryStats;
import club.ppmc.hwmon.model.history.Resolution;
import club.ppmc.hwmon.model.history.SensorSample;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class HistoryService {

    private final Deque<HistoryEntry> buffer = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SettingsService settingsService;
    private final Clock clock;

    public HistoryService(SettingsService settingsService, Clock clock) {
        this.settingsService = settingsService;
        this.clock = clock;
    }

    /**
     * 把一个采集周期的读数写入历史。
     */
    public void ingest(List<SensorReading> readings, long timestamp) {
        ingest(new HistoryEntry(timestamp, ReadingExtractor.toValueMap(readings)));
    }

    /**
     * 追加一个条目，然后从队首淘汰过期或超出容量的条目。
     */
    public void ingest(HistoryEntry entry) {
        MonitorSettings settings = settingsService.getSettings();
        long cutoff = clock.millis() - settings.getHistoryRetention() * 1000L;
        int maxEntries = settings.getHistoryMaxEntries();

        lock.writeLock().lock();
        try {
            buffer.addLast(entry);
            while (!buffer.isEmpty() && buffer.peekFirst().timestamp() < cutoff) {
                buffer.pollFirst();
            }
            while (buffer.size() > maxEntries) {
                buffer.pollFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按条件查询历史。时间窗口非法（start &gt; end）或 limit 不为正时返回空列表。
     */
    public List<HistoryEntry> query(HistoryQuery query) {
        long now = clock.millis();
        long start = query.startTime() == null ? 0L : query.startTime();
        long end = query.endTime() == null ? now : query.endTime();
        int limit = query.limitOrDefault();
        if (start > end || limit <= 0) {
            return List.of();
        }

        long lowerBound = Math.max(start, retentionCutoff(now));
        List<HistoryEntry> results = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (HistoryEntry entry : buffer) {
                if (entry.timestamp() >= lowerBound && entry.timestamp() <= end) {
                    results.add(entry);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        Resolution resolution = query.resolutionOrRaw();
        if (resolution != Resolution.RAW) {
            results = downsample(results, resolution.getBucketMillis());
        }
        return decimate(results, limit);
    }

    /**
     * 返回某个规范路径在最近 durationMs 毫秒内的取值序列。
     */
    public List<SensorSample> getSensorHistory(String path, long durationMs) {
        long now = clock.millis();
        long start = Math.max(now - durationMs, retentionCutoff(now));
        List<SensorSample> samples = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (HistoryEntry entry : buffer) {
                Double value = entry.readings().get(path);
                if (entry.timestamp() >= start && value != null) {
                    samples.add(new SensorSample(entry.timestamp(), value));
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return samples;
    }

    /**
     * 最近一个条目中的全部取值，没有数据时返回空映射。
     */
    public Map<String, Double> getLatestReadings() {
        lock.readLock().lock();
        try {
            HistoryEntry last = buffer.peekLast();
            return last == null ? Map.of() : new LinkedHashMap<>(last.readings());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            buffer.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("历史数据已清空");
    }

    public HistoryStats getStats() {
        lock.readLock().lock();
        try {
            if (buffer.isEmpty()) {
                return new HistoryStats(0, null, null);
            }
            return new HistoryStats(buffer.size(), buffer.peekFirst().timestamp(), buffer.peekLast().timestamp());
        } finally {
            lock.readLock().unlock();
        }
    }

    private long retentionCutoff(long now) {
        return now - settingsService.getSettings().getHistoryRetention() * 1000L;
    }

    /**
     * 按固定宽度分桶，桶的键为 floor(timestamp / width) * width。
     * 每个桶中对出现过的每个键取算术平均，某个键只在定义了它的条目间平均，不会补 0。
     */
    static List<HistoryEntry> downsample(List<HistoryEntry> entries, long bucketMillis) {
        TreeMap<Long, List<HistoryEntry>> buckets = new TreeMap<>();
        for (HistoryEntry entry : entries) {
            long key = Math.floorDiv(entry.timestamp(), bucketMillis) * bucketMillis;
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
        }

        List<HistoryEntry> results = new ArrayList<>(buckets.size());
        for (Map.Entry<Long, List<HistoryEntry>> bucket : buckets.entrySet()) {
            Map<String, double[]> sums = new LinkedHashMap<>();
            for (HistoryEntry entry : bucket.getValue()) {
                entry.readings().forEach((key, value) -> {
                    if (value != null) {
                        double[] acc = sums.computeIfAbsent(key, k -> new double[2]);
                        acc[0] += value;
                        acc[1]++;
                    }
                });
            }
            Map<String, Double> averages = new LinkedHashMap<>();
            sums.forEach((key, acc) -> averages.put(key, acc[0] / acc[1]));
            results.add(new HistoryEntry(bucket.getKey(), averages));
        }
        return results;
    }

    /**
     * 结果超过 limit 时按步长 ceil(n / limit) 抽稀，保留下标为步长整数倍的元素。
     */
    static List<HistoryEntry> decimate(List<HistoryEntry> entries, int limit) {
        int n = entries.size();
        if (n <= limit) {
            return entries;
        }
        int step = (n + limit - 1) / limit;
        List<HistoryEntry> kept = new ArrayList<>(n / step + 1);
        for (int i = 0; i < n; i += step) {
            kept.add(entries.get(i));
        }
        return kept;
    }
}
