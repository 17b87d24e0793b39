package club.ppmc.hwmon.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import club.ppmc.hwmon.model.snapshot.BatteryData;
import club.ppmc.hwmon.model.snapshot.CpuData;
import club.ppmc.hwmon.model.snapshot.DiskData;
import club.ppmc.hwmon.model.snapshot.GpuData;
import club.ppmc.hwmon.model.snapshot.HardwareCategory;
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
import club.ppmc.hwmon.support.MutableClock;
import club.ppmc.hwmon.support.Snapshots;
import club.ppmc.hwmon.support.TestSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 快照采集服务测试
 */
@ExtendWith(MockitoExtension.class)
class HardwareMonitorServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private OshiSystemAdapter systemAdapter;

    @Mock
    private AlertService alertService;

    @Mock
    private DistributionHub distributionHub;

    private MutableClock clock;
    private ThreadPoolTaskScheduler scheduler;
    private HistoryService historyService;
    private HardwareMonitorService service;

    /** 返回固定值或抛出异常的适配器，并记录调用次数。 */
    private static class FakeAdapter<T> implements SensorSourceAdapter<T> {

        interface Collector<T> {
            T collect() throws Exception;
        }

        private final HardwareCategory category;
        private final T empty;
        private volatile Collector<T> collector;
        final AtomicInteger calls = new AtomicInteger();

        FakeAdapter(HardwareCategory category, T value, T empty) {
            this.category = category;
            this.empty = empty;
            this.collector = () -> value;
        }

        void setCollector(Collector<T> collector) {
            this.collector = collector;
        }

        @Override
        public HardwareCategory category() {
            return category;
        }

        @Override
        public T collect() throws Exception {
            calls.incrementAndGet();
            return collector.collect();
        }

        @Override
        public T empty() {
            return empty;
        }
    }

    private FakeAdapter<CpuData> cpu;
    private FakeAdapter<List<GpuData>> gpu;
    private FakeAdapter<MemoryData> memory;
    private FakeAdapter<List<DiskData>> disk;
    private FakeAdapter<List<NetworkInterfaceData>> network;
    private FakeAdapter<BatteryData> battery;
    private FakeAdapter<List<ProcessData>> processes;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(5_000);
        cpu = new FakeAdapter<>(HardwareCategory.CPU, Snapshots.cpu(25.0, 55.0), CpuData.empty());
        gpu = new FakeAdapter<>(HardwareCategory.GPU, List.of(Snapshots.gpu(0, 60.0, 70.0)), List.of());
        memory = new FakeAdapter<>(HardwareCategory.MEMORY, Snapshots.memory(50.0), MemoryData.empty());
        disk = new FakeAdapter<>(HardwareCategory.DISK, List.of(Snapshots.disk(0, 40.0, null)), List.of());
        network = new FakeAdapter<>(HardwareCategory.NETWORK, List.of(Snapshots.nic("eth0", 10.0, 5.0)), List.of());
        battery = new FakeAdapter<>(HardwareCategory.BATTERY, Snapshots.battery(80.0), BatteryData.absent());
        processes = new FakeAdapter<>(HardwareCategory.PROCESSES, List.of(Snapshots.process(42, "java", 12.5)),
                List.of());
        lenient().when(systemAdapter.collect()).thenReturn(SystemData.empty());
        lenient().when(systemAdapter.collectOs()).thenReturn(Snapshots.os());
        lenient().when(systemAdapter.machineId()).thenReturn("machine-1");
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        service = newService(TestSettings.defaults(tempDir));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        scheduler.shutdown();
    }

    private HardwareMonitorService newService(SettingsService settings) {
        return newService(settings, scheduler);
    }

    private HardwareMonitorService newService(SettingsService settings, TaskScheduler taskScheduler) {
        historyService = new HistoryService(settings, clock);
        return new HardwareMonitorService(cpu, gpu, memory, disk, network, battery, processes, systemAdapter,
                new ReadingExtractor(), historyService, alertService, distributionHub, settings, Runnable::run,
                taskScheduler, clock);
    }

    @Test
    void testPoll_ComposesSnapshotFromAllAdapters() {
        HardwareSnapshot snapshot = service.poll();

        assertEquals(5_000L, snapshot.timestamp());
        assertEquals("machine-1", snapshot.machineId());
        assertEquals(25.0, snapshot.cpu().load());
        assertEquals(1, snapshot.gpus().size());
        assertEquals(50.0, snapshot.memory().usedPercent());
        assertEquals("Linux", snapshot.os().family());
        assertEquals("java", snapshot.processes().get(0).name());
        assertSame(snapshot, service.getLastSnapshot());
        assertTrue(service.getSensorPaths().contains("gpu.0.temperature"));
        assertEquals(1, historyService.getStats().entries());
        verify(alertService, times(1)).evaluate(anyList());
    }

    @Test
    void testPoll_TimestampNeverGoesBackwards() {
        service.poll();
        clock.setMillis(3_000);

        HardwareSnapshot second = service.poll();

        assertEquals(5_000L, second.timestamp());
    }

    @Test
    void testPoll_DisabledCategoriesAreEmpty() {
        service.shutdown();
        service = newService(TestSettings.of(tempDir, s -> s.setEnabledSensors(Set.of("cpu"))));

        HardwareSnapshot snapshot = service.poll();

        assertEquals(25.0, snapshot.cpu().load());
        assertTrue(snapshot.gpus().isEmpty());
        assertNull(snapshot.memory().usedPercent());
        assertTrue(snapshot.disks().isEmpty());
        assertTrue(snapshot.network().isEmpty());
        assertTrue(snapshot.processes().isEmpty());
        assertFalse(snapshot.battery().hasBattery());
        assertEquals("Linux", snapshot.os().family());
        assertEquals(0, gpu.calls.get());
        assertEquals(0, memory.calls.get());
    }

    @Test
    void testPoll_AdapterFailureIsIsolated() {
        cpu.setCollector(() -> {
            throw new IllegalStateException("sensor unavailable");
        });

        HardwareSnapshot snapshot = service.poll();

        assertEquals(CpuData.empty(), snapshot.cpu());
        assertEquals(50.0, snapshot.memory().usedPercent());
        assertFalse(service.getSensorPaths().contains("cpu.load"));
    }

    @Test
    void testPoll_PublishesSnapshotThenReadings() {
        service.poll();

        InOrder order = inOrder(distributionHub, alertService);
        order.verify(distributionHub).publish(eq(DistributionChannel.SNAPSHOT), any());
        order.verify(alertService).evaluate(anyList());
        order.verify(distributionHub).publish(eq(DistributionChannel.READINGS), any());
    }

    @Test
    void testPoll_FailingStageDoesNotStopLaterStages() {
        when(alertService.evaluate(anyList())).thenThrow(new IllegalStateException("alert failure"));

        service.poll();

        verify(distributionHub).publish(eq(DistributionChannel.READINGS), any());
        assertEquals(1, historyService.getStats().entries());
    }

    @Test
    void testPoll_HistoryAndAlertsCanBeDisabled() {
        service.shutdown();
        service = newService(TestSettings.of(tempDir, s -> {
            s.setEnableHistory(false);
            s.setEnableAlerts(false);
        }));

        service.poll();

        assertEquals(0, historyService.getStats().entries());
        verify(alertService, never()).evaluate(anyList());
    }

    @Test
    void testTick_SkipsWhileCycleInFlight() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        memory.setCollector(() -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Snapshots.memory(50.0);
        });
        var failure = new AtomicReference<Throwable>();
        Thread worker = new Thread(() -> {
            try {
                service.poll();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        worker.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        boolean ran = service.tick();

        release.countDown();
        worker.join(5_000);
        assertFalse(ran);
        assertNull(failure.get());
        assertEquals(1, memory.calls.get());
        assertTrue(service.tick());
    }

    @Test
    void testStartStop_Idempotent() {
        service.stop();
        assertFalse(service.isRunning());

        service.start(60_000);
        service.start(60_000);
        assertTrue(service.isRunning());

        service.stop();
        service.stop();
        assertFalse(service.isRunning());
        assertThrows(IllegalArgumentException.class, () -> service.start(0));
    }

    @Test
    void testPoll_BatteryOnlyWhenEnabled() {
        assertFalse(service.poll().battery().hasBattery());
        assertEquals(0, battery.calls.get());

        service.shutdown();
        service = newService(TestSettings.of(tempDir, s -> s.setEnabledSensors(Set.of("cpu", "battery"))));

        BatteryData collected = service.poll().battery();

        assertTrue(collected.hasBattery());
        assertEquals(80.0, collected.percent());
    }

    @Test
    void testPoll_SensorPathsFollowLatestCycle() {
        service.poll();
        assertTrue(service.getSensorPaths().contains("gpu.0.temperature"));

        gpu.setCollector(List::of);
        service.poll();

        assertFalse(service.getSensorPaths().contains("gpu.0.temperature"));
        assertTrue(service.getSensorReadings().stream().noneMatch(r -> r.source().startsWith("gpu.")));
        assertTrue(service.getSensorPaths().contains("cpu.load"));
    }

    @Test
    void testStart_UsesInjectedScheduler() {
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        service.shutdown();
        service = newService(TestSettings.defaults(tempDir), taskScheduler);

        service.start(250);
        service.stop();

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMillis(250)));
        verify(future).cancel(false);
        assertFalse(service.isRunning());
    }
}
