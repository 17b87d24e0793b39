/**
 * SensorSourceAdapter.java
 *
 * 单个硬件类别的数据来源。HardwareMonitorService 在每个采集周期中并发调用所有启用类别的 collect()。
 * 实现可以直接抛出异常：调用方会捕获、记录并用 empty() 替代，不会中断整个采集周期。
 *
 * @param <T> 该类别在快照中的子记录类型。
 */
package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.HardwareCategory;

public interface SensorSourceAdapter<T> {

    HardwareCategory category();

    /**
     * 采集一次该类别的数据。
     *
     * @throws Exception 任何采集失败。
     */
    T collect() throws Exception;

    /**
     * 类别被禁用或采集失败时使用的默认值。
     */
    T empty();
}
