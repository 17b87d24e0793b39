/**
 * LmSensorsSource.java
 *
 * "lm-sensors" 来源：执行 {@code sensors -j} 并解析其 JSON 输出。
 *
 * <p>输出结构为 芯片 → 特征 → 子特征，例如：
 * <pre>
 * {"coretemp-isa-0000": {"Adapter": "ISA adapter",
 *     "Core 0": {"temp2_input": 45.0, "temp2_max": 80.0, "temp2_crit": 100.0, "temp2_crit_alarm": 0.0}}}
 * </pre>
 * 子特征名的前缀决定类型标签，{@code _input}（功率可为 {@code _average}）为当前值。
 */
package club.ppmc.hwmon.service.unified;

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
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LmSensorsSource implements SensorSource {

    static final String TAG = "lm-sensors";
    private static final List<String> SENSORS_COMMAND = List.of("sensors", "-j");

    /** 子特征前缀 → 类型标签与单位。顺序有意义："in" 必须排在 "intrusion" 之后。 */
    private static final List<String[]> PREFIXES = List.of(
            new String[] {"temp", "temperature", "°C"},
            new String[] {"intrusion", "intrusion", ""},
            new String[] {"in", "voltage", "V"},
            new String[] {"fan", "fan", "RPM"},
            new String[] {"power", "power", "W"},
            new String[] {"curr", "current", "A"},
            new String[] {"freq", "clock", "MHz"},
            new String[] {"humidity", "humidity", "%"},
            new String[] {"energy", "energy", "J"});

    private final SystemCommandExecutor commandExecutor;
    private final Duration timeout;

    public LmSensorsSource(
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
            return commandExecutor.run(SENSORS_COMMAND, timeout).isSuccess();
        } catch (IOException e) {
            log.info("未检测到 lm-sensors: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public List<SourceSensor> readSensors() throws IOException, InterruptedException {
        var result = commandExecutor.run(SENSORS_COMMAND, timeout);
        if (!result.isSuccess()) {
            throw new IOException("sensors -j 退出码 " + result.exitCode());
        }
        return parse(result.output());
    }

    /**
     * 解析 {@code sensors -j} 的输出。
     *
     * @throws JsonParseException 输出不是合法的 JSON。
     */
    static List<SourceSensor> parse(String json) {
        List<SourceSensor> sensors = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return sensors;
        }
        JsonElement root = JsonParser.parseString(json);
        if (!root.isJsonObject()) {
            return sensors;
        }
        for (Map.Entry<String, JsonElement> chip : root.getAsJsonObject().entrySet()) {
            if (!chip.getValue().isJsonObject()) {
                continue;
            }
            for (Map.Entry<String, JsonElement> feature : chip.getValue().getAsJsonObject().entrySet()) {
                if (feature.getValue().isJsonObject()) {
                    SourceSensor sensor = parseFeature(chip.getKey(), feature.getKey(),
                            feature.getValue().getAsJsonObject());
                    if (sensor != null) {
                        sensors.add(sensor);
                    }
                }
            }
        }
        return sensors;
    }

    private static SourceSensor parseFeature(String chip, String featureName, JsonObject values) {
        String inputKey = null;
        for (String key : values.keySet()) {
            if (key.endsWith("_input") || (inputKey == null && key.endsWith("_average"))) {
                inputKey = key;
            }
        }
        if (inputKey == null) {
            return null;
        }
        String stem = inputKey.substring(0, inputKey.lastIndexOf('_'));
        String[] kind = classify(stem);
        Double value = number(values, inputKey);
        if (value == null) {
            return null;
        }

        String typeLabel = kind == null ? "unknown" : kind[1];
        String unit = kind == null ? "" : kind[2];
        Double min = number(values, stem + "_min");
        Double max = number(values, stem + "_crit");
        if (max == null) {
            max = number(values, stem + "_max");
        }
        if ("clock".equals(typeLabel)) {
            // lm-sensors 以 Hz 报告频率
            value = value / 1_000_000;
            min = min == null ? null : min / 1_000_000;
            max = max == null ? null : max / 1_000_000;
        }
        Double nominal = null;
        if ("voltage".equals(typeLabel) && min != null && max != null) {
            nominal = (min + max) / 2;
        }

        boolean alarm = false;
        for (String key : values.keySet()) {
            if (key.startsWith(stem + "_") && key.endsWith("_alarm")) {
                Double flag = number(values, key);
                if (flag != null && flag > 0) {
                    alarm = true;
                }
            }
        }

        return new SourceSensor(chip + "/" + stem, featureName, typeLabel, value,
                min, max, nominal, unit, chip, alarm);
    }

    private static String[] classify(String stem) {
        for (String[] prefix : PREFIXES) {
            if (stem.startsWith(prefix[0])) {
                return prefix;
            }
        }
        return null;
    }

    private static Double number(JsonObject values, String key) {
        JsonElement element = values.get(key);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        double value = element.getAsDouble();
        return Double.isFinite(value) ? value : null;
    }
}
