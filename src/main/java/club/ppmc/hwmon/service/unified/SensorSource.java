/**
 * SensorSource.java
 *
 * 统一传感器视图的一个数据来源。来源在启动时探测一次可用性，之后每次刷新都会被调用。
 */
package club.ppmc.hwmon.service.unified;

import club.ppmc.hwmon.model.unified.SourceSensor;
import java.util.List;

public interface SensorSource {

    /** 来源标签，写入 UnifiedSensor.source，例如 "system"、"lm-sensors"。 */
    String tag();

    /**
     * 探测来源是否可用。只在初始化时调用一次，不应抛出异常。
     */
    boolean isAvailable();

    /**
     * 读取来源当前报告的全部传感器。
     *
     * @throws Exception 读取失败，调用方会把本次结果视为空。
     */
    List<SourceSensor> readSensors() throws Exception;
}
