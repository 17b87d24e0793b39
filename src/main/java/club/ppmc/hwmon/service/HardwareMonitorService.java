/**
 * HardwareMonitorService.java
 *
 * 快照采集服务：按设定的间隔周期性地并发调用各类别的采集适配器，组装成完整的硬件快照，
 * 然后依次完成推送快照、提取读数、写入历史、评估告警和推送读数。
 *
 * <p>同一时刻最多只有一个采集周期在执行：定时触发在上一个周期未完成时直接跳过，
 * 手动调用 {@link #poll()} 则等待当前周期结束。
 */
package club.ppmc.hwmon.service;

import club.ppmc.hwmon.model.MonitorSettings;
import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.snapshot.BatteryData;
import club.ppmc.hwmon.model.snapshot.CpuData;
import club.ppmc.hwmon.model.snapshot.DiskData;
import club.ppmc.hwmon.model.snapshot.GpuData;
import club.ppmc.hwmon.model.snapshot.HardwareSnapshot;
import club.ppmc.hwmon.model.snapshot.MemoryData;
import club.ppmc.hwmon.model.snapshot.NetworkInterfaceData;
import club.ppmc.hwmon.model.snapshot.OsData;
import club.ppmc.hwmon.model.snapshot.ProcessData;
import club.ppmc.hwmon.model.snapshot.SystemData;
import club.ppmc.hwmon.service.adapter.OshiSystemAdapter;
import club.ppmc.hwmon.service.adapter.SensorSourceAdapter;
import club.ppmc.hwmon.service.alert.AlertService;
import club.ppmc.hwmon.service.distribution.DistributionChannel;
import club.ppmc.hwmon.service.distribution.DistributionHub;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class HardwareMonitorService {

    private final SensorSourceAdapter<CpuData> cpuAdapter;
    private final SensorSourceAdapter<List<GpuData>> gpuAdapter;
    private final SensorSourceAdapter<MemoryData> memoryAdapter;
    private final SensorSourceAdapter<List<DiskData>> diskAdapter;
    private final SensorSourceAdapter<List<NetworkInterfaceData>> networkAdapter;
    private final SensorSourceAdapter<BatteryData> batteryAdapter;
    private final SensorSourceAdapter<List<ProcessData>> processAdapter;
    private final OshiSystemAdapter systemAdapter;
    private final ReadingExtractor readingExtractor;
    private final HistoryService historyService;
    private final AlertService alertService;
    private final DistributionHub distributionHub;
    private final SettingsService settingsService;
    private final Executor adapterExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    // 只保存最近一个周期提取出的读数，整体替换
    private volatile Map<String, SensorReading> latestReadings = Map.of();
    private volatile HardwareSnapshot lastSnapshot;
    private ScheduledFuture<?> pollingTask;

    public HardwareMonitorService(
            SensorSourceAdapter<CpuData> cpuAdapter,
            SensorSourceAdapter<List<GpuData>> gpuAdapter,
            SensorSourceAdapter<MemoryData> memoryAdapter,
            SensorSourceAdapter<List<DiskData>> diskAdapter,
            SensorSourceAdapter<List<NetworkInterfaceData>> networkAdapter,
            SensorSourceAdapter<BatteryData> batteryAdapter,
            SensorSourceAdapter<List<ProcessData>> processAdapter,
            OshiSystemAdapter systemAdapter,
            ReadingExtractor readingExtractor,
            HistoryService historyService,
            AlertService alertService,
            DistributionHub distributionHub,
            SettingsService settingsService,
            @Qualifier("adapterExecutor") Executor adapterExecutor,
            @Qualifier("pollScheduler") TaskScheduler scheduler,
            Clock clock) {
        this.cpuAdapter = cpuAdapter;
        this.gpuAdapter = gpuAdapter;
        this.memoryAdapter = memoryAdapter;
        this.diskAdapter = diskAdapter;
        this.networkAdapter = networkAdapter;
        this.batteryAdapter = batteryAdapter;
        this.processAdapter = processAdapter;
        this.systemAdapter = systemAdapter;
        this.readingExtractor = readingExtractor;
        this.historyService = historyService;
        this.alertService = alertService;
        this.distributionHub = distributionHub;
        this.settingsService = settingsService;
        this.adapterExecutor = adapterExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // --- 定时控制 ---

    /**
     * 以固定间隔启动周期采集。已在运行时只记录警告。
     */
    public synchronized void start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("采集间隔必须为正数: " + intervalMs);
        }
        if (pollingTask != null) {
            log.warn("硬件监控已在运行，忽略重复的启动请求");
            return;
        }
        pollingTask = scheduler.scheduleAtFixedRate(this::tick, Duration.ofMillis(intervalMs));
        log.info("硬件监控已启动，采集间隔 {} ms", intervalMs);
    }

    /**
     * 停止周期采集。可以重复调用；正在执行的周期会自然完成。
     */
    public synchronized void stop() {
        if (pollingTask == null) {
            return;
        }
        pollingTask.cancel(false);
        pollingTask = null;
        log.info("硬件监控已停止");
    }

    public synchronized boolean isRunning() {
        return pollingTask != null;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /**
     * 定时触发的入口。上一个周期仍在执行时跳过本次。
     *
     * @return 本次是否执行了采集。
     */
    boolean tick() {
        if (!cycleLock.tryLock()) {
            log.debug("上一个采集周期尚未完成，跳过本次触发");
            return false;
        }
        try {
            runCycle();
            return true;
        } catch (RuntimeException e) {
            // 异常不能逃出定时任务，否则后续触发会被取消
            log.error("采集周期执行失败", e);
            return false;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * 立即同步执行一次采集，有周期在执行时等待其完成。
     */
    public HardwareSnapshot poll() {
        cycleLock.lock();
        try {
            return runCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    // --- 查询 ---

    public HardwareSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    /**
     * 最近一个采集周期提取出的读数，按提取顺序。类别被禁用或设备消失后，对应路径不再出现。
     */
    public List<SensorReading> getSensorReadings() {
        return List.copyOf(latestReadings.values());
    }

    public List<String> getSensorPaths() {
        return List.copyOf(latestReadings.keySet());
    }

    // --- 采集周期 ---

    private HardwareSnapshot runCycle() {
        MonitorSettings settings = settingsService.getSettings();

        CompletableFuture<CpuData> cpu = collectAsync(cpuAdapter, settings);
        CompletableFuture<List<GpuData>> gpus = collectAsync(gpuAdapter, settings);
        CompletableFuture<MemoryData> memory = collectAsync(memoryAdapter, settings);
        CompletableFuture<List<DiskData>> disks = collectAsync(diskAdapter, settings);
        CompletableFuture<List<NetworkInterfaceData>> network = collectAsync(networkAdapter, settings);
        CompletableFuture<BatteryData> battery = collectAsync(batteryAdapter, settings);
        CompletableFuture<List<ProcessData>> processes = collectAsync(processAdapter, settings);

        SystemData system;
        try {
            system = systemAdapter.collect();
        } catch (RuntimeException e) {
            log.warn("采集系统信息失败: {}", e.getMessage());
            system = SystemData.empty();
        }
        OsData os;
        try {
            os = systemAdapter.collectOs();
        } catch (RuntimeException e) {
            log.warn("采集操作系统信息失败: {}", e.getMessage());
            os = OsData.empty();
        }
        String machineId = systemAdapter.machineId();

        CompletableFuture.allOf(cpu, gpus, memory, disks, network, battery, processes).join();

        HardwareSnapshot previous = lastSnapshot;
        long timestamp = clock.millis();
        if (previous != null && previous.timestamp() > timestamp) {
            timestamp = previous.timestamp();
        }

        var snapshot = new HardwareSnapshot(timestamp, machineId, system, os, cpu.join(), gpus.join(), memory.join(),
                disks.join(), network.join(), battery.join(), processes.join());
        lastSnapshot = snapshot;

        afterSnapshot(snapshot, settings);
        return snapshot;
    }

    /**
     * 异步调用一个适配器。类别被禁用时直接返回空记录；适配器失败时记录警告并用空记录替代。
     */
    private <T> CompletableFuture<T> collectAsync(SensorSourceAdapter<T> adapter, MonitorSettings settings) {
        if (!settings.isCategoryEnabled(adapter.category().getKey())) {
            return CompletableFuture.completedFuture(adapter.empty());
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return adapter.collect();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("采集 {} 数据时被中断", adapter.category().getKey());
                return adapter.empty();
            } catch (Exception e) {
                log.warn("采集 {} 数据失败: {}", adapter.category().getKey(), e.getMessage());
                return adapter.empty();
            }
        }, adapterExecutor);
    }

    /**
     * 快照完成之后的各个阶段。每个阶段独立捕获异常，一个阶段失败不影响后续阶段。
     */
    private void afterSnapshot(HardwareSnapshot snapshot, MonitorSettings settings) {
        try {
            distributionHub.publish(DistributionChannel.SNAPSHOT, snapshot);
        } catch (RuntimeException e) {
            log.error("推送快照失败", e);
        }

        List<SensorReading> readings;
        try {
            readings = readingExtractor.extract(snapshot);
        } catch (RuntimeException e) {
            log.error("从快照提取读数失败", e);
            return;
        }
        Map<String, SensorReading> latest = new LinkedHashMap<>();
        for (SensorReading reading : readings) {
            latest.put(reading.source(), reading);
        }
        latestReadings = Collections.unmodifiableMap(latest);

        if (settings.isEnableHistory()) {
            try {
                historyService.ingest(readings, snapshot.timestamp());
            } catch (RuntimeException e) {
                log.error("写入历史数据失败", e);
            }
        }

        if (settings.isEnableAlerts()) {
            try {
                alertService.evaluate(readings);
            } catch (RuntimeException e) {
                log.error("评估告警失败", e);
            }
        }

        try {
            distributionHub.publish(DistributionChannel.READINGS, readings);
        } catch (RuntimeException e) {
            log.error("推送读数失败", e);
        }
    }
}
