package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 邮件动作。尚未配置 SMTP，只记录一条日志。
 */
@Component
@Slf4j
public class EmailActionHandler implements AlertActionHandler {

    @Override
    public AlertActionType type() {
        return AlertActionType.EMAIL;
    }

    @Override
    public void execute(AlertAction action, AlertEvent event, SensorReading reading) {
        log.info("告警 '{}' 的邮件动作未执行：未配置 SMTP (收件人 {})",
                event.getAlertName(), action.configString("to"));
    }
}
