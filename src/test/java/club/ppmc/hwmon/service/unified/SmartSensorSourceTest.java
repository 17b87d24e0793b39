package club.ppmc.hwmon.service.unified;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import club.ppmc.hwmon.model.unified.SensorStatus;
import club.ppmc.hwmon.model.unified.SourceSensor;
import club.ppmc.hwmon.util.SystemCommandExecutor;
import club.ppmc.hwmon.util.SystemCommandExecutor.CommandResult;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * SMART 来源测试
 */
@ExtendWith(MockitoExtension.class)
class SmartSensorSourceTest {

    private static final String SCAN = """
            {"devices": [{"name": "/dev/sda", "type": "sat"}, {"name": "/dev/nvme0", "type": "nvme"}]}
            """;

    private static final String HEALTHY = """
            {"model_name": "Samsung SSD 870", "smart_status": {"passed": true}, "temperature": {"current": 38}}
            """;

    private static final String FAILING = """
            {"model_name": "WD Blue", "smart_status": {"passed": false}, "temperature": {"current": 51}}
            """;

    @Mock
    private SystemCommandExecutor commandExecutor;

    @Test
    void testParseScan() {
        assertEquals(List.of("/dev/sda", "/dev/nvme0"), SmartSensorSource.parseScan(SCAN));
        assertEquals(List.of(), SmartSensorSource.parseScan("{}"));
    }

    @Test
    void testParseDevice() {
        SourceSensor healthy = SmartSensorSource.parseDevice("/dev/sda", HEALTHY);

        assertEquals("/dev/sda", healthy.id());
        assertEquals("temperature", healthy.typeLabel());
        assertEquals(38.0, healthy.value());
        assertEquals(70.0, healthy.max());
        assertNull(healthy.status());
        assertEquals(SensorStatus.CRITICAL, SmartSensorSource.parseDevice("/dev/sdb", FAILING).status());
        assertNull(SmartSensorSource.parseDevice("/dev/sdc", "{\"model_name\": \"USB stick\"}"));
    }

    @Test
    void testReadSensors_NonZeroExitCodeStillParsed() throws Exception {
        when(commandExecutor.run(eq(List.of("smartctl", "--scan", "-j")), any(Duration.class)))
                .thenReturn(new CommandResult(0, SCAN));
        when(commandExecutor.run(eq(List.of("smartctl", "-a", "-j", "/dev/sda")), any(Duration.class)))
                .thenReturn(new CommandResult(0, HEALTHY));
        // smartctl 的退出码是位掩码，自检失败时非零
        when(commandExecutor.run(eq(List.of("smartctl", "-a", "-j", "/dev/nvme0")), any(Duration.class)))
                .thenReturn(new CommandResult(8, FAILING));

        List<SourceSensor> sensors = new SmartSensorSource(commandExecutor, 1000).readSensors();

        assertEquals(2, sensors.size());
        assertEquals(SensorStatus.CRITICAL, sensors.get(1).status());
    }
}
