package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 声音动作。服务端没有音频输出，提示音由收到 notification 消息的前端播放，这里只做记录。
 */
@Component
@Slf4j
public class SoundActionHandler implements AlertActionHandler {

    @Override
    public AlertActionType type() {
        return AlertActionType.SOUND;
    }

    @Override
    public void execute(AlertAction action, AlertEvent event, SensorReading reading) {
        log.debug("告警 '{}' 请求播放提示音", event.getAlertName());
    }
}
