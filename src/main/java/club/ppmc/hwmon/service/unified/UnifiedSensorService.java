/**
 * UnifiedSensorService.java
 *
 * 统一传感器服务：并发轮询所有可用的来源，把各来源的原始传感器归一化为统一类型并计算状态，
 * 缓存最近一次结果并推送到 unified 频道。
 *
 * <p>同一物理量被多个来源报告时不做去重，每个来源各保留一条记录。
 */
package club.ppmc.hwmon.service.unified;

import club.ppmc.hwmon.model.unified.SensorStatus;
import club.ppmc.hwmon.model.unified.SourceSensor;
import club.ppmc.hwmon.model.unified.UnifiedMonitorData;
import club.ppmc.hwmon.model.unified.UnifiedSensor;
import club.ppmc.hwmon.model.unified.UnifiedSensorType;
import club.ppmc.hwmon.service.SettingsService;
import club.ppmc.hwmon.service.distribution.DistributionChannel;
import club.ppmc.hwmon.service.distribution.DistributionHub;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class UnifiedSensorService {

    /** 来源类型标签到统一类型的映射，不在表中的标签归为 OTHER。 */
    private static final Map<String, UnifiedSensorType> TYPE_TABLE = Map.ofEntries(
            Map.entry("temperature", UnifiedSensorType.TEMPERATURE),
            Map.entry("voltage", UnifiedSensorType.VOLTAGE),
            Map.entry("fan", UnifiedSensorType.FAN),
            Map.entry("power", UnifiedSensorType.POWER),
            Map.entry("clock", UnifiedSensorType.CLOCK),
            Map.entry("load", UnifiedSensorType.LOAD),
            Map.entry("current", UnifiedSensorType.CURRENT),
            Map.entry("level", UnifiedSensorType.LOAD),
            Map.entry("usage", UnifiedSensorType.LOAD),
            Map.entry("data", UnifiedSensorType.OTHER),
            Map.entry("throughput", UnifiedSensorType.OTHER),
            Map.entry("humidity", UnifiedSensorType.OTHER),
            Map.entry("intrusion", UnifiedSensorType.OTHER));

    private final List<SensorSource> sources;
    private final SettingsService settingsService;
    private final DistributionHub distributionHub;
    private final Executor executor;
    private final Clock clock;

    private final Map<String, Boolean> availability = new LinkedHashMap<>();
    private volatile boolean initialized = false;
    private volatile UnifiedMonitorData lastData = UnifiedMonitorData.empty();

    public UnifiedSensorService(
            List<SensorSource> sources,
            SettingsService settingsService,
            DistributionHub distributionHub,
            @Qualifier("adapterExecutor") Executor executor,
            Clock clock) {
        this.sources = List.copyOf(sources);
        this.settingsService = settingsService;
        this.distributionHub = distributionHub;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * 探测每个来源的可用性。只需调用一次，重复调用会重新探测。
     */
    public synchronized void initialize() {
        availability.clear();
        for (SensorSource source : sources) {
            boolean available;
            try {
                available = source.isAvailable();
            } catch (RuntimeException e) {
                log.warn("探测传感器来源 {} 失败", source.tag(), e);
                available = false;
            }
            availability.put(source.tag(), available);
            log.info("传感器来源 {}: {}", source.tag(), available ? "可用" : "不可用");
        }
        initialized = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    @Scheduled(
            fixedDelayString = "${telemetry.unified.poll-interval-ms:5000}",
            initialDelayString = "${telemetry.unified.poll-interval-ms:5000}")
    public void scheduledRefresh() {
        if (!initialized || !settingsService.getSettings().isUnifiedEnabled()) {
            return;
        }
        try {
            refresh();
        } catch (RuntimeException e) {
            log.error("刷新统一传感器数据失败", e);
        }
    }

    /**
     * 并发读取所有可用来源，归一化后缓存并推送。
     */
    public UnifiedMonitorData refresh() {
        Map<String, Boolean> probed;
        synchronized (this) {
            probed = new LinkedHashMap<>(availability);
        }

        Map<String, CompletableFuture<List<SourceSensor>>> reads = new LinkedHashMap<>();
        for (SensorSource source : sources) {
            if (Boolean.TRUE.equals(probed.get(source.tag()))) {
                reads.put(source.tag(), CompletableFuture.supplyAsync(() -> read(source), executor));
            }
        }

        Map<String, Boolean> sourceStates = new LinkedHashMap<>();
        List<UnifiedSensor> sensors = new ArrayList<>();
        for (SensorSource source : sources) {
            CompletableFuture<List<SourceSensor>> read = reads.get(source.tag());
            List<SourceSensor> raw = read == null ? null : read.join();
            sourceStates.put(source.tag(), raw != null);
            if (raw != null) {
                for (SourceSensor sensor : raw) {
                    sensors.add(normalize(source.tag(), sensor));
                }
            }
        }

        UnifiedMonitorData data = UnifiedMonitorData.of(sourceStates, sensors, clock.millis());
        lastData = data;
        try {
            distributionHub.publish(DistributionChannel.UNIFIED, data);
        } catch (RuntimeException e) {
            log.error("推送统一传感器数据失败", e);
        }
        return data;
    }

    /**
     * 读取一个来源。失败时返回 null，表示该来源本次不可用。
     */
    private List<SourceSensor> read(SensorSource source) {
        try {
            List<SourceSensor> sensors = source.readSensors();
            return sensors == null ? List.of() : sensors;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("读取传感器来源 {} 时被中断", source.tag());
            return null;
        } catch (Exception e) {
            log.warn("读取传感器来源 {} 失败: {}", source.tag(), e.getMessage());
            return null;
        }
    }

    static UnifiedSensor normalize(String sourceTag, SourceSensor sensor) {
        UnifiedSensorType type = mapType(sensor.typeLabel());
        SensorStatus status = sensor.status() != null
                ? sensor.status()
                : SensorStatusEvaluator.evaluate(type, sensor.value(), sensor.max(), sensor.nominal(), sensor.alarm());
        return new UnifiedSensor(
                sourceTag + ":" + sensor.id(),
                sensor.name(),
                type,
                sensor.value(),
                sensor.min(),
                sensor.max(),
                sensor.unit(),
                sourceTag,
                sensor.hardware(),
                status);
    }

    static UnifiedSensorType mapType(String typeLabel) {
        if (typeLabel == null) {
            return UnifiedSensorType.OTHER;
        }
        return TYPE_TABLE.getOrDefault(typeLabel.toLowerCase(Locale.ROOT), UnifiedSensorType.OTHER);
    }

    // --- 查询 ---

    public UnifiedMonitorData getAllData() {
        return lastData;
    }

    public List<UnifiedSensor> getByType(UnifiedSensorType type) {
        return lastData.byType(type);
    }

    public List<UnifiedSensor> getCritical() {
        return lastData.byStatus(SensorStatus.CRITICAL);
    }

    public List<UnifiedSensor> getWarnings() {
        return lastData.byStatus(SensorStatus.WARNING);
    }

    /**
     * 各来源的可用状态：已刷新过时为最近一次刷新的结果，否则为探测结果。
     */
    public Map<String, Boolean> getSources() {
        UnifiedMonitorData data = lastData;
        if (data.timestamp() > 0) {
            return data.sources();
        }
        synchronized (this) {
            return Map.copyOf(availability);
        }
    }
}
