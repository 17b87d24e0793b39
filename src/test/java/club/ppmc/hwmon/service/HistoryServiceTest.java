package club.ppmc.hwmon.service;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.SensorType;
import club.ppmc.hwmon.model.history.HistoryEntry;
import club.ppmc.hwmon.model.history.HistoryQuery;
import club.ppmc.hwmon.model.history.HistoryStats;
import club.ppmc.hwmon.model.history.Resolution;
import club.ppmc.hwmon.model.history.SensorSample;
import club.ppmc.hwmon.support.MutableClock;
import club.ppmc.hwmon.support.TestSettings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * 历史存储测试
 */
class HistoryServiceTest {

    // 整点对齐的起始时间，便于按小时分桶
    private static final long T0 = 472_223L * 3_600_000L;

    @TempDir
    Path tempDir;

    private HistoryService newService(MutableClock clock, long retentionSeconds, int maxEntries) {
        SettingsService settings = TestSettings.of(tempDir, s -> {
            s.setHistoryRetention(retentionSeconds);
            s.setHistoryMaxEntries(maxEntries);
        });
        return new HistoryService(settings, clock);
    }

    private static HistoryEntry entry(long timestamp, double value) {
        return new HistoryEntry(timestamp, Map.of("cpu.load", value));
    }

    @Test
    void testIngest_EvictsEntriesOlderThanRetention() {
        var clock = new MutableClock(0);
        HistoryService service = newService(clock, 60, 10_000);

        for (int i = 0; i < 120; i++) {
            clock.setMillis(i * 1000L);
            service.ingest(entry(i * 1000L, i));
        }

        // 截止时间为 119s - 60s = 59s，59s 到 119s 的条目保留
        HistoryStats stats = service.getStats();
        assertEquals(61, stats.entries());
        assertEquals(59_000L, stats.oldestTimestamp());
        assertEquals(119_000L, stats.newestTimestamp());
    }

    @Test
    void testIngest_CapsAtMaxEntries() {
        var clock = new MutableClock(10_000);
        HistoryService service = newService(clock, 3600, 5);

        for (int i = 0; i < 10; i++) {
            service.ingest(entry(10_000 + i, i));
        }

        HistoryStats stats = service.getStats();
        assertEquals(5, stats.entries());
        assertEquals(10_005L, stats.oldestTimestamp());
    }

    @Test
    void testIngest_FromReadings() {
        var clock = new MutableClock(5_000);
        HistoryService service = newService(clock, 3600, 100);
        List<SensorReading> readings = List.of(
                new SensorReading("CPU Load", SensorType.LOAD, 42.0, 0, 100, "%", "cpu.load", 5_000),
                new SensorReading("CPU Temperature", SensorType.TEMPERATURE, 55.0, 0, 100, "°C", "cpu.temperature", 5_000));

        service.ingest(readings, 5_000);

        Map<String, Double> latest = service.getLatestReadings();
        assertEquals(List.of("cpu.load", "cpu.temperature"), List.copyOf(latest.keySet()));
        assertEquals(55.0, latest.get("cpu.temperature"));
    }

    @Test
    void testQuery_ThreeHoursByMinuteAndHour() {
        var clock = new MutableClock(T0 + 10_799_000L);
        HistoryService service = newService(clock, 4 * 3600, 20_000);
        for (int i = 0; i < 10_800; i++) {
            service.ingest(entry(T0 + i * 1000L, i));
        }

        List<HistoryEntry> minutes = service.query(new HistoryQuery(T0, null, Resolution.MINUTE, null));
        assertEquals(180, minutes.size());
        assertEquals(T0, minutes.get(0).timestamp());
        assertEquals(29.5, minutes.get(0).readings().get("cpu.load"), 1e-9);
        assertEquals(179 * 60 + 29.5, minutes.get(179).readings().get("cpu.load"), 1e-9);

        List<HistoryEntry> hours = service.query(new HistoryQuery(T0, null, Resolution.HOUR, null));
        assertEquals(3, hours.size());
        assertEquals(1799.5, hours.get(0).readings().get("cpu.load"), 1e-9);
        assertEquals(2 * 3600 + 1799.5, hours.get(2).readings().get("cpu.load"), 1e-9);
        assertEquals(T0 + 2 * 3_600_000L, hours.get(2).timestamp());
    }

    @Test
    void testQuery_RawDecimatedByStride() {
        var clock = new MutableClock(T0 + 10_799_000L);
        HistoryService service = newService(clock, 4 * 3600, 20_000);
        for (int i = 0; i < 10_800; i++) {
            service.ingest(entry(T0 + i * 1000L, i));
        }

        // 步长 ceil(10800 / 1000) = 11
        List<HistoryEntry> raw = service.query(HistoryQuery.all());
        assertEquals(982, raw.size());
        assertEquals(T0, raw.get(0).timestamp());
        assertEquals(T0 + 11_000L, raw.get(1).timestamp());
        assertTrue(raw.size() <= HistoryQuery.DEFAULT_LIMIT);
    }

    @Test
    void testQuery_InvalidWindowReturnsEmpty() {
        var clock = new MutableClock(100_000);
        HistoryService service = newService(clock, 3600, 100);
        service.ingest(entry(90_000, 1));

        assertTrue(service.query(new HistoryQuery(95_000L, 80_000L, null, null)).isEmpty());
        assertTrue(service.query(new HistoryQuery(null, null, null, 0)).isEmpty());
        assertTrue(service.query(new HistoryQuery(null, null, null, -5)).isEmpty());
        assertEquals(1, service.query(HistoryQuery.all()).size());
    }

    @Test
    void testQuery_FiltersByTimeRange() {
        var clock = new MutableClock(100_000);
        HistoryService service = newService(clock, 3600, 100);
        for (int i = 0; i < 10; i++) {
            service.ingest(entry(90_000 + i * 1000L, i));
        }

        List<HistoryEntry> result = service.query(new HistoryQuery(92_000L, 94_000L, Resolution.RAW, null));
        assertEquals(List.of(92_000L, 93_000L, 94_000L), result.stream().map(HistoryEntry::timestamp).toList());
    }

    @Test
    void testDownsample_AveragesOnlyDefinedKeys() {
        List<HistoryEntry> entries = List.of(
                new HistoryEntry(0, Map.of("a", 10.0, "b", 4.0)),
                new HistoryEntry(10_000, Map.of("a", 20.0)),
                new HistoryEntry(61_000, Map.of("b", 8.0)));

        List<HistoryEntry> buckets = HistoryService.downsample(entries, 60_000);

        assertEquals(2, buckets.size());
        assertEquals(15.0, buckets.get(0).readings().get("a"));
        assertEquals(4.0, buckets.get(0).readings().get("b"));
        assertEquals(60_000L, buckets.get(1).timestamp());
        assertFalse(buckets.get(1).readings().containsKey("a"));
    }

    @Test
    void testGetSensorHistory_ReturnsOnlyPathWithinDuration() {
        var clock = new MutableClock(100_000);
        HistoryService service = newService(clock, 3600, 100);
        service.ingest(new HistoryEntry(80_000, Map.of("cpu.load", 1.0)));
        service.ingest(new HistoryEntry(95_000, Map.of("cpu.load", 2.0, "memory.used", 50.0)));
        service.ingest(new HistoryEntry(99_000, Map.of("memory.used", 51.0)));

        List<SensorSample> samples = service.getSensorHistory("cpu.load", 10_000);

        assertEquals(List.of(new SensorSample(95_000, 2.0)), samples);
    }

    @Test
    void testClear() {
        var clock = new MutableClock(100_000);
        HistoryService service = newService(clock, 3600, 100);
        service.ingest(entry(99_000, 1));

        service.clear();

        HistoryStats stats = service.getStats();
        assertEquals(0, stats.entries());
        assertNull(stats.oldestTimestamp());
        assertTrue(service.getLatestReadings().isEmpty());
    }
}
