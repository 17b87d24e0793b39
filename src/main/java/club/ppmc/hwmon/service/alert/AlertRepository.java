/**
 * AlertRepository.java
 *
 * 告警规则的持久化。规则集合以 JSON 数组的形式整体写入数据目录下的 alerts.json，
 * 每次修改都会重写整个文件。这是尽力而为的持久化，不提供事务保证。
 */
package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.alert.Alert;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

@Repository
public class AlertRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlertRepository.class);
    private static final String ALERTS_FILE_NAME = "alerts.json";

    private final Path alertsFilePath;
    private final ObjectMapper objectMapper;

    @Autowired
    public AlertRepository(@Value("${telemetry.data-dir:./data}") String dataDir) {
        this(Paths.get(dataDir));
    }

    public AlertRepository(Path dataDir) {
        this.alertsFilePath = dataDir.resolve(ALERTS_FILE_NAME).toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 读取全部规则。文件不存在时返回空列表。
     *
     * @throws IOException 文件存在但无法读取或解析。
     */
    public List<Alert> loadAll() throws IOException {
        if (Files.notExists(alertsFilePath)) {
            return List.of();
        }
        List<Alert> alerts = objectMapper.readValue(alertsFilePath.toFile(), new TypeReference<List<Alert>>() {});
        LOGGER.info("已从 {} 加载 {} 条告警规则", alertsFilePath, alerts.size());
        return alerts;
    }

    /**
     * 用给定的规则集合整体覆盖文件。先写临时文件再替换，避免写到一半时留下损坏的文件。
     */
    public void saveAll(Collection<Alert> alerts) throws IOException {
        Path dir = alertsFilePath.getParent();
        if (Files.notExists(dir)) {
            Files.createDirectories(dir);
        }
        Path tmp = dir.resolve(ALERTS_FILE_NAME + ".tmp");
        Files.write(tmp, objectMapper.writeValueAsBytes(alerts));
        Files.move(tmp, alertsFilePath, StandardCopyOption.REPLACE_EXISTING);
        LOGGER.debug("已保存 {} 条告警规则到 {}", alerts.size(), alertsFilePath);
    }

    public Path getAlertsFilePath() {
        return alertsFilePath;
    }
}
