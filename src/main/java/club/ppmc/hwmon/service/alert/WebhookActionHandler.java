package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertEvent;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Webhook 动作：把 {event, reading} 以 JSON 形式 POST 到配置的 url。
 */
@Component
@Slf4j
public class WebhookActionHandler implements AlertActionHandler {

    private final RestTemplate restTemplate;

    public WebhookActionHandler(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public AlertActionType type() {
        return AlertActionType.WEBHOOK;
    }

    @Override
    public void execute(AlertAction action, AlertEvent event, SensorReading reading) {
        String url = action.configString("url");
        if (url == null) {
            log.warn("告警 '{}' 的 webhook 动作缺少 url，已跳过", event.getAlertName());
            return;
        }
        restTemplate.postForEntity(url, Map.of("event", event, "reading", reading), Void.class);
        log.info("告警 '{}' 已发送 webhook 到 {}", event.getAlertName(), url);
    }
}
