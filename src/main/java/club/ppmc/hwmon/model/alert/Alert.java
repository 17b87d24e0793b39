/**
 * Alert.java
 *
 * 用户定义的阈值告警规则。由 AlertService 负责增删改查并持久化到 alerts.json。
 * 除了显式的 CRUD 操作之外，只有告警评估过程会修改 lastTriggered 和 triggerCount。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.hwmon.model.alert;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import lombok.Data;

@Data
public class Alert {

    private String id;

    @NotBlank(message = "告警名称不能为空")
    private String name;

    private boolean enabled = true;

    /**
     * 传感器路径模式：精确路径（"cpu.temperature"）、前缀通配（"gpu.*"）或全部（"*"）。
     */
    @NotBlank(message = "传感器路径不能为空")
    private String sensorPath;

    @NotNull(message = "触发条件不能为空")
    private AlertCondition condition;

    private Double thresholdMin;

    private Double thresholdMax;

    /** 条件需要持续的时间 (秒)。目前只做保存与校验。 */
    @PositiveOrZero(message = "持续时间不能为负数")
    private long duration = 0;

    /** 两次触发之间的最小间隔 (秒)。 */
    @PositiveOrZero(message = "冷却时间不能为负数")
    private long cooldown = 60;

    @NotNull(message = "动作列表不能为 null")
    private List<@Valid @NotNull AlertAction> actions = new ArrayList<>();

    private Long lastTriggered;

    private int triggerCount;

    /**
     * 深拷贝，用于对外返回快照，避免调用方修改内部状态。
     */
    public Alert copy() {
        var copy = new Alert();
        copy.setId(id);
        copy.setName(name);
        copy.setEnabled(enabled);
        copy.setSensorPath(sensorPath);
        copy.setCondition(condition);
        copy.setThresholdMin(thresholdMin);
        copy.setThresholdMax(thresholdMax);
        copy.setDuration(duration);
        copy.setCooldown(cooldown);
        List<AlertAction> actionCopies = new ArrayList<>();
        if (actions != null) {
            for (AlertAction action : actions) {
                actionCopies.add(action == null
                        ? null
                        : new AlertAction(action.getType(),
                                action.getConfig() == null ? new HashMap<>() : new HashMap<>(action.getConfig())));
            }
        }
        copy.setActions(actionCopies);
        copy.setLastTriggered(lastTriggered);
        copy.setTriggerCount(triggerCount);
        return copy;
    }
}
