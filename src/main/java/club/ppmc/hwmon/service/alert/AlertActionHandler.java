package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertEvent;

/**
 * 一种告警动作的执行器。每种 AlertActionType 对应一个 Spring Bean，由 AlertActionDispatcher 按类型查找。
 */
public interface AlertActionHandler {

    AlertActionType type();

    /**
     * 执行动作。抛出的任何异常都由调度器捕获并记录，不会影响同一告警的其他动作。
     */
    void execute(AlertAction action, AlertEvent event, SensorReading reading) throws Exception;
}
