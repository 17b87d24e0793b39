/**
 * DistributionChannel.java
 *
 * 分发中心拥有的广播频道。生产者（快照采集、告警、统一传感器轮询）只能向这些频道推送事件，
 * 订阅端通过 subscribe 消息按频道名订阅。
 */
package club.ppmc.hwmon.service.distribution;

import java.util.Arrays;
import java.util.Optional;

public enum DistributionChannel {
    SNAPSHOT("snapshot", "snapshot"),
    READINGS("readings", "readings"),
    ALERTS("alerts", "alert"),
    UNIFIED("unified", "unified");

    /** 订阅时使用的频道名。 */
    private final String channelName;

    /** 推送消息的 type 字段。 */
    private final String messageType;

    DistributionChannel(String channelName, String messageType) {
        this.channelName = channelName;
        this.messageType = messageType;
    }

    public String getChannelName() {
        return channelName;
    }

    public String getMessageType() {
        return messageType;
    }

    public static Optional<DistributionChannel> fromName(String name) {
        return Arrays.stream(values()).filter(c -> c.channelName.equals(name)).findFirst();
    }
}
