package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertEvent;
import club.ppmc.hwmon.service.distribution.DistributionChannel;
import club.ppmc.hwmon.service.distribution.DistributionHub;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 通知动作：在 alerts 频道上推送一条 notification 消息，由前端负责弹出提示。
 */
@Component
@Slf4j
public class NotificationActionHandler implements AlertActionHandler {

    private final DistributionHub distributionHub;

    public NotificationActionHandler(DistributionHub distributionHub) {
        this.distributionHub = distributionHub;
    }

    @Override
    public AlertActionType type() {
        return AlertActionType.NOTIFICATION;
    }

    @Override
    public void execute(AlertAction action, AlertEvent event, SensorReading reading) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("title", "Hardware Alert: " + event.getAlertName());
        notification.put("message", reading.name() + ": " + reading.value() + reading.unit());
        notification.put("eventId", event.getId());
        Object sound = action.getConfig() == null ? null : action.getConfig().get("sound");
        notification.put("sound", !Boolean.FALSE.equals(sound));
        int delivered = distributionHub.publish(DistributionChannel.ALERTS, "notification", notification);
        log.info("告警通知 '{}' 已推送给 {} 个订阅端", event.getAlertName(), delivered);
    }
}
