/**
 * AlertEvent.java
 *
 * 一次告警触发的记录。事件历史只追加，超过容量时丢弃最旧的事件；
 * 唯一允许的修改是把 acknowledged 置为 true。
 */
package club.ppmc.hwmon.model.alert;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertEvent {

    private String id;
    private String alertId;
    private String alertName;
    /** 命中的规范路径。 */
    private String sensorPath;
    private double value;
    /** below 条件取 thresholdMin，其余条件取 thresholdMax。 */
    private Double threshold;
    private AlertCondition condition;
    private long timestamp;
    private boolean acknowledged;
}
