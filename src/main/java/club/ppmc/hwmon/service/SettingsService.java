/**
 * SettingsService.java
 *
 * 该服务是整个应用的配置中心，负责管理监控的所有运行期可配置项。
 * 它处理配置的加载、校验、更新和持久化，将配置信息以JSON格式存储在数据目录的 settings.json 中。
 * 在首次启动时，它会使用 application.properties 中的值作为默认设置来创建配置文件。
 * 所有其他需要运行期配置的服务都应依赖此服务，而不是直接使用 @Value 注解。
 */
package club.ppmc.hwmon.service;

import club.ppmc.hwmon.model.MonitorSettings;
import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String SETTINGS_FILE_NAME = "settings.json";

    private static final long MIN_POLLING_INTERVAL = 100;
    private static final long MAX_POLLING_INTERVAL = 60_000;
    private static final long MIN_RETENTION = 60;
    private static final long MAX_RETENTION = 86_400L * 30;

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private final MonitorSettings initialSettings;
    private final ApplicationEventPublisher eventPublisher;
    private volatile MonitorSettings currentSettings;

    @Autowired
    public SettingsService(
            @Value("${telemetry.data-dir:./data}") String dataDir,
            @Value("${telemetry.polling-interval-ms:1000}") long initialPollingInterval,
            @Value("${telemetry.history.retention-seconds:3600}") long initialRetention,
            @Value("${telemetry.auth.enabled:false}") boolean initialAuthEnabled,
            @Value("${telemetry.auth.api-key:}") String initialApiKey,
            ApplicationEventPublisher eventPublisher) {
        this(Paths.get(dataDir), defaults(initialPollingInterval, initialRetention, initialAuthEnabled, initialApiKey),
                eventPublisher);
    }

    public SettingsService(Path dataDir, MonitorSettings initialSettings, ApplicationEventPublisher eventPublisher) {
        this.settingsFilePath = dataDir.resolve(SETTINGS_FILE_NAME).toAbsolutePath().normalize();
        this.initialSettings = initialSettings.copy();
        this.eventPublisher = eventPublisher;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.currentSettings = initialSettings.copy();
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = initialSettings.copy();
        }
    }

    /**
     * 返回当前设置的副本，调用方对其的修改不会影响服务内部状态。
     */
    public MonitorSettings getSettings() {
        return this.currentSettings.copy();
    }

    /**
     * 校验并保存新的设置，成功后发布 SettingsChangedEvent。
     *
     * @throws IllegalArgumentException 设置中存在非法取值。
     * @throws IOException 写入设置文件失败。
     */
    public synchronized MonitorSettings updateSettings(MonitorSettings newSettings) throws IOException {
        List<String> errors = validate(newSettings);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
        MonitorSettings previous = this.currentSettings;
        MonitorSettings normalized = newSettings.copy();
        writeSettings(normalized);
        this.currentSettings = normalized;
        eventPublisher.publishEvent(new SettingsChangedEvent(previous.copy(), normalized.copy()));
        return normalized.copy();
    }

    static List<String> validate(MonitorSettings settings) {
        List<String> errors = new ArrayList<>();
        if (settings.getPollingInterval() < MIN_POLLING_INTERVAL
                || settings.getPollingInterval() > MAX_POLLING_INTERVAL) {
            errors.add("pollingInterval 必须在 " + MIN_POLLING_INTERVAL + " 到 " + MAX_POLLING_INTERVAL + " 毫秒之间");
        }
        if (settings.getHistoryRetention() < MIN_RETENTION || settings.getHistoryRetention() > MAX_RETENTION) {
            errors.add("historyRetention 必须在 " + MIN_RETENTION + " 到 " + MAX_RETENTION + " 秒之间");
        }
        if (settings.getHistoryMaxEntries() <= 0) {
            errors.add("historyMaxEntries 必须大于 0");
        }
        if (settings.getAlertHistoryLimit() <= 0) {
            errors.add("alertHistoryLimit 必须大于 0");
        }
        Set<String> sensors = settings.getEnabledSensors() == null ? Set.of() : settings.getEnabledSensors();
        for (String sensor : sensors) {
            if (HardwareCategory.fromKey(sensor).isEmpty()) {
                errors.add("未知的硬件类别: " + sensor);
            }
        }
        if (settings.isEnableAuth() && !StringUtils.hasText(settings.getApiKey())) {
            errors.add("启用鉴权时 apiKey 不能为空");
        }
        return errors;
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            MonitorSettings loaded = objectMapper.readValue(jsonData, MonitorSettings.class);
            List<String> errors = validate(loaded);
            if (!errors.isEmpty()) {
                LOGGER.warn("设置文件 {} 中存在非法取值 ({})，将使用默认设置。", settingsFilePath, errors);
                this.currentSettings = initialSettings.copy();
                return;
            }
            this.currentSettings = loaded;
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。下次保存时将创建新的默认文件。", e);
            this.currentSettings = initialSettings.copy();
            throw e;
        }
    }

    private void writeSettings(MonitorSettings settings) throws IOException {
        if (Files.notExists(settingsFilePath.getParent())) {
            Files.createDirectories(settingsFilePath.getParent());
        }
        try {
            byte[] jsonData = objectMapper.writeValueAsBytes(settings);
            Files.write(settingsFilePath, jsonData);
            LOGGER.info("已成功将设置保存到 {}", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", settingsFilePath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = initialSettings.copy();
        writeSettings(this.currentSettings);
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private static MonitorSettings defaults(long pollingInterval, long retention, boolean authEnabled, String apiKey) {
        var settings = new MonitorSettings();
        settings.setPollingInterval(pollingInterval);
        settings.setHistoryRetention(retention);
        settings.setEnableAuth(authEnabled && StringUtils.hasText(apiKey));
        settings.setApiKey(apiKey == null ? "" : apiKey);
        return settings;
    }
}
