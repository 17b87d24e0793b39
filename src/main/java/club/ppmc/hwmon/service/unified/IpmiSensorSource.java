/**
 * IpmiSensorSource.java
 *
 * "ipmi" 来源：执行 {@code ipmitool sdr elist full} 读取 BMC 报告的传感器。
 *
 * <p>每行的格式为 {@code 名称 | 传感器ID | 状态 | 实体ID | 读数}，例如：
 * <pre>
 * CPU1 Temp        | 30h | ok  |  3.1 | 45 degrees C
 * FAN1             | 41h | cr  | 29.1 | 300 RPM
 * </pre>
 * BMC 自己判断的状态直接作为传感器状态，不再按阈值计算。
 */
package club.ppmc.hwmon.service.unified;

import club.ppmc.hwmon.model.unified.SensorStatus;
import club.ppmc.hwmon.model.unified.SourceSensor;
import club.ppmc.hwmon.util.SystemCommandExecutor;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class IpmiSensorSource implements SensorSource {

    static final String TAG = "ipmi";
    private static final List<String> SDR_COMMAND = List.of("ipmitool", "sdr", "elist", "full");
    private static final Pattern READING = Pattern.compile("^(-?\\d+(?:\\.\\d+)?)\\s*(.*)$");
    private static final String HARDWARE = "BMC";

    private final SystemCommandExecutor commandExecutor;
    private final Duration timeout;

    public IpmiSensorSource(
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
            return commandExecutor.run(SDR_COMMAND, timeout).isSuccess();
        } catch (IOException e) {
            log.info("未检测到 ipmitool: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public List<SourceSensor> readSensors() throws IOException, InterruptedException {
        var result = commandExecutor.run(SDR_COMMAND, timeout);
        if (!result.isSuccess()) {
            throw new IOException("ipmitool sdr 退出码 " + result.exitCode());
        }
        return parse(result.output());
    }

    /**
     * 解析 {@code ipmitool sdr elist full} 的输出。没有读数的行 (no reading、disabled 等) 被跳过。
     */
    static List<SourceSensor> parse(String output) {
        List<SourceSensor> sensors = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return sensors;
        }
        for (String line : output.split("\\R")) {
            String[] columns = line.split("\\|");
            if (columns.length < 5) {
                continue;
            }
            String name = columns[0].trim();
            Matcher matcher = READING.matcher(columns[4].trim());
            if (name.isEmpty() || !matcher.matches()) {
                continue;
            }
            double value = Double.parseDouble(matcher.group(1));
            String rawUnit = matcher.group(2).trim();
            String[] kind = classify(rawUnit, name);
            sensors.add(new SourceSensor(name, name, kind[0], value, null, null, null, kind[1], HARDWARE, false,
                    status(columns[2].trim())));
        }
        return sensors;
    }

    /**
     * 返回 {类型标签, 单位}。
     */
    private static String[] classify(String rawUnit, String name) {
        String unit = rawUnit.toLowerCase(Locale.ROOT);
        if (unit.contains("degrees")) {
            return new String[] {"temperature", unit.endsWith("f") ? "°F" : "°C"};
        }
        if (unit.contains("volts")) {
            return new String[] {"voltage", "V"};
        }
        if (unit.contains("rpm")) {
            return new String[] {"fan", "RPM"};
        }
        if (unit.contains("watts")) {
            return new String[] {"power", "W"};
        }
        if (unit.contains("amps")) {
            return new String[] {"current", "A"};
        }
        if (unit.contains("percent")) {
            return new String[] {"load", "%"};
        }
        if (name.toLowerCase(Locale.ROOT).contains("fan")) {
            return new String[] {"fan", rawUnit};
        }
        return new String[] {"other", rawUnit};
    }

    /**
     * ipmitool 的状态缩写：ok；nc = 非临界；cr = 临界；nr = 不可恢复。其余 (ns 等) 交给阈值规则。
     */
    static SensorStatus status(String code) {
        return switch (code.toLowerCase(Locale.ROOT)) {
            case "ok" -> SensorStatus.OK;
            case "nc" -> SensorStatus.WARNING;
            case "cr", "nr" -> SensorStatus.CRITICAL;
            default -> null;
        };
    }
}
