/**
 * SmartSensorSource.java
 *
 * "smart" 来源：通过 smartmontools 读取各磁盘的温度和健康自检结果。
 * 先用 {@code smartctl --scan -j} 列出设备，再对每个设备执行 {@code smartctl -a -j}。
 *
 * <p>smartctl 的退出码是位掩码，磁盘有告警时也会非零，因此只要输出是合法 JSON 就解析。
 * 自检失败 (smart_status.passed == false) 的磁盘温度传感器直接标记为 critical。
 */
package club.ppmc.hwmon.service.unified;

import club.ppmc.hwmon.model.unified.SensorStatus;
import club.ppmc.hwmon.model.unified.SourceSensor;
import club.ppmc.hwmon.util.SystemCommandExecutor;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class SmartSensorSource implements SensorSource {

    static final String TAG = "smart";
    private static final double DISK_TEMPERATURE_MAX = 70.0;

    private final SystemCommandExecutor commandExecutor;
    private final Duration timeout;

    public SmartSensorSource(
            SystemCommandExecutor commandExecutor,
            @Value("${telemetry.adapter.command-timeout-ms:3000}") long timeoutMs) {
        this.commandExecutor = commandExecutor;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public boolean isAvailable() {
        try {
            return commandExecutor.run(List.of("smartctl", "--version"), timeout).isSuccess();
        } catch (IOException e) {
            log.info("未检测到 smartctl: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public List<SourceSensor> readSensors() throws IOException, InterruptedException {
        var scan = commandExecutor.run(List.of("smartctl", "--scan", "-j"), timeout);
        List<String> devices = parseScan(scan.output());
        List<SourceSensor> sensors = new ArrayList<>();
        for (String device : devices) {
            var result = commandExecutor.run(List.of("smartctl", "-a", "-j", device), timeout);
            try {
                SourceSensor sensor = parseDevice(device, result.output());
                if (sensor != null) {
                    sensors.add(sensor);
                }
            } catch (JsonParseException e) {
                log.warn("无法解析设备 {} 的 SMART 数据 (退出码 {}): {}", device, result.exitCode(), e.getMessage());
            }
        }
        return sensors;
    }

    /**
     * 从 {@code smartctl --scan -j} 的输出中取出设备路径。
     */
    static List<String> parseScan(String json) {
        List<String> devices = new ArrayList<>();
        JsonObject root = objectOrNull(json);
        if (root == null || !root.has("devices") || !root.get("devices").isJsonArray()) {
            return devices;
        }
        for (JsonElement device : root.getAsJsonArray("devices")) {
            if (device.isJsonObject() && device.getAsJsonObject().has("name")) {
                devices.add(device.getAsJsonObject().get("name").getAsString());
            }
        }
        return devices;
    }

    /**
     * 把单个设备的 {@code smartctl -a -j} 输出转换为一个温度传感器。没有温度时返回 null。
     */
    static SourceSensor parseDevice(String device, String json) {
        JsonObject root = objectOrNull(json);
        if (root == null) {
            return null;
        }
        JsonObject temperature = root.has("temperature") && root.get("temperature").isJsonObject()
                ? root.getAsJsonObject("temperature")
                : null;
        if (temperature == null || !temperature.has("current")) {
            return null;
        }
        String model = root.has("model_name") ? root.get("model_name").getAsString() : device;

        SensorStatus status = null;
        if (root.has("smart_status") && root.get("smart_status").isJsonObject()) {
            JsonElement passed = root.getAsJsonObject("smart_status").get("passed");
            if (passed != null && passed.isJsonPrimitive() && !passed.getAsBoolean()) {
                status = SensorStatus.CRITICAL;
            }
        }
        return new SourceSensor(device, model + " Temperature", "temperature",
                temperature.get("current").getAsDouble(), null, DISK_TEMPERATURE_MAX, null, "°C", model, false,
                status);
    }

    private static JsonObject objectOrNull(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        JsonElement root = JsonParser.parseString(json);
        return root.isJsonObject() ? root.getAsJsonObject() : null;
    }
}
