/**
 * OshiSensorSource.java
 *
 * "system" 来源：通过 OSHI 的 Sensors 读取 CPU 温度、CPU 电压和风扇转速。
 * OSHI 在无法读取时返回 0，这些值在这里被视为不存在。
 */
package club.ppmc.hwmon.service.unified;

import club.ppmc.hwmon.model.unified.SourceSensor;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.Sensors;

@Component
@Slf4j
public class OshiSensorSource implements SensorSource {

    static final String TAG = "system";

    private final SystemInfo systemInfo;

    public OshiSensorSource(SystemInfo systemInfo) {
        this.systemInfo = systemInfo;
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public boolean isAvailable() {
        try {
            return systemInfo.getHardware().getSensors() != null;
        } catch (RuntimeException e) {
            log.debug("OSHI 传感器不可用", e);
            return false;
        }
    }

    @Override
    public List<SourceSensor> readSensors() {
        Sensors sensors = systemInfo.getHardware().getSensors();
        List<SourceSensor> result = new ArrayList<>();

        double temperature = sensors.getCpuTemperature();
        if (temperature > 0 && Double.isFinite(temperature)) {
            result.add(new SourceSensor("cpu-temp", "CPU Temperature", "temperature", temperature,
                    null, null, null, "°C", "cpu", false));
        }

        double voltage = sensors.getCpuVoltage();
        if (voltage > 0 && Double.isFinite(voltage)) {
            result.add(new SourceSensor("cpu-voltage", "CPU Voltage", "voltage", voltage,
                    null, null, null, "V", "cpu", false));
        }

        int[] fans = sensors.getFanSpeeds();
        if (fans != null) {
            for (int i = 0; i < fans.length; i++) {
                if (fans[i] > 0) {
                    result.add(new SourceSensor("fan" + i, "Fan " + (i + 1), "fan", fans[i],
                            null, null, null, "RPM", "motherboard", false));
                }
            }
        }
        return result;
    }
}
