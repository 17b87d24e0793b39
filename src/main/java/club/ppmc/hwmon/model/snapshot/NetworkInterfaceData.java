/**
 * NetworkInterfaceData.java
 *
 * 单个网卡的流量统计。速率由两次采集之间的字节差计算得到，首次采集时为 null。
 */
package club.ppmc.hwmon.model.snapshot;

import java.util.List;

public record NetworkInterfaceData(
        String iface,
        String displayName,
        String mac,
        List<String> ip4,
        long speed,
        long rxBytes,
        long txBytes,
        Double rxSec,
        Double txSec) {

    public NetworkInterfaceData {
        ip4 = ip4 == null ? List.of() : List.copyOf(ip4);
    }
}
