/**
 * AlertActionDispatcher.java
 *
 * 按配置顺序执行告警的动作列表。每个动作单独捕获异常，
 * 一个动作失败不会阻止后续动作，也不会影响之后的告警评估。
 */
package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertEvent;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class AlertActionDispatcher {

    private final Map<AlertActionType, AlertActionHandler> handlers = new EnumMap<>(AlertActionType.class);

    public AlertActionDispatcher(List<AlertActionHandler> handlers) {
        for (AlertActionHandler handler : handlers) {
            this.handlers.put(handler.type(), handler);
        }
    }

    /**
     * @return 成功执行的动作数量。
     */
    public int dispatch(List<AlertAction> actions, AlertEvent event, SensorReading reading) {
        int succeeded = 0;
        for (AlertAction action : actions) {
            if (action == null || action.getType() == null) {
                continue;
            }
            AlertActionHandler handler = handlers.get(action.getType());
            if (handler == null) {
                log.warn("没有可用的 {} 动作执行器，已跳过", action.getType());
                continue;
            }
            try {
                handler.execute(action, event, reading);
                succeeded++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("执行告警动作 {} 时被中断 (告警 {})", action.getType(), event.getAlertName());
                return succeeded;
            } catch (Exception e) {
                log.error("执行告警动作 {} 失败 (告警 {})", action.getType(), event.getAlertName(), e);
            }
        }
        return succeeded;
    }
}
