package club.ppmc.hwmon.service.unified;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.hwmon.model.unified.SourceSensor;
import com.google.gson.JsonParseException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/**
 * lm-sensors 输出解析测试
 */
class LmSensorsSourceTest {

    private static final String OUTPUT = """
            {
              "coretemp-isa-0000": {
                "Adapter": "ISA adapter",
                "Package id 0": {"temp1_input": 52.0, "temp1_max": 80.0, "temp1_crit": 100.0, "temp1_crit_alarm": 0.0},
                "Core 0": {"temp2_input": 99.0, "temp2_max": 80.0, "temp2_crit": 100.0, "temp2_crit_alarm": 1.0}
              },
              "nct6775-isa-0290": {
                "Adapter": "ISA adapter",
                "Vcore": {"in0_input": 1.10, "in0_min": 1.0, "in0_max": 1.2, "in0_alarm": 0.0},
                "fan1": {"fan1_input": 1450.0, "fan1_min": 0.0},
                "intrusion0": {"intrusion0_alarm": 1.0}
              },
              "amdgpu-pci-0300": {
                "Adapter": "PCI adapter",
                "PPT": {"power1_average": 35.5, "power1_cap": 150.0},
                "sclk": {"freq1_input": 500000000.0}
              }
            }
            """;

    @Test
    void testParse_ClassifiesFeatures() {
        Map<String, SourceSensor> sensors = LmSensorsSource.parse(OUTPUT).stream()
                .collect(Collectors.toMap(SourceSensor::id, Function.identity()));

        assertEquals(6, sensors.size());

        SourceSensor pkg = sensors.get("coretemp-isa-0000/temp1");
        assertEquals("temperature", pkg.typeLabel());
        assertEquals("Package id 0", pkg.name());
        assertEquals(52.0, pkg.value());
        assertEquals(100.0, pkg.max());
        assertFalse(pkg.alarm());
        assertTrue(sensors.get("coretemp-isa-0000/temp2").alarm());

        SourceSensor vcore = sensors.get("nct6775-isa-0290/in0");
        assertEquals("voltage", vcore.typeLabel());
        assertEquals(1.1, vcore.nominal(), 1e-9);
        assertEquals("V", vcore.unit());

        assertEquals("fan", sensors.get("nct6775-isa-0290/fan1").typeLabel());
        assertEquals(35.5, sensors.get("amdgpu-pci-0300/power1").value());
        assertEquals(500.0, sensors.get("amdgpu-pci-0300/freq1").value(), 1e-9);
        assertEquals("clock", sensors.get("amdgpu-pci-0300/freq1").typeLabel());
    }

    @Test
    void testParse_EmptyAndMalformed() {
        assertEquals(List.of(), LmSensorsSource.parse(""));
        assertEquals(List.of(), LmSensorsSource.parse("[]"));
        assertThrows(JsonParseException.class, () -> LmSensorsSource.parse("{not json"));
    }
}
