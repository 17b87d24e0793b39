/**
 * OshiNetworkAdapter.java
 *
 * 通过 Oshi 采集非回环网卡的累计流量，并根据相邻两次采集的字节差计算每秒速率。
 */
package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import club.ppmc.hwmon.model.snapshot.NetworkInterfaceData;
import java.net.SocketException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.hardware.HardwareAbstractionLayer;
import oshi.hardware.NetworkIF;

@Component
@Slf4j
public class OshiNetworkAdapter implements SensorSourceAdapter<List<NetworkInterfaceData>> {

    private final HardwareAbstractionLayer hardware;
    private final Clock clock;

    // 网卡名 -> {接收字节, 发送字节, 时间戳}
    private final Map<String, long[]> previousCounters = new HashMap<>();

    public OshiNetworkAdapter(SystemInfo systemInfo, Clock clock) {
        this.hardware = systemInfo.getHardware();
        this.clock = clock;
    }

    @Override
    public HardwareCategory category() {
        return HardwareCategory.NETWORK;
    }

    @Override
    public List<NetworkInterfaceData> collect() {
        long now = clock.millis();
        List<NetworkInterfaceData> result = new ArrayList<>();
        for (NetworkIF net : hardware.getNetworkIFs()) {
            if (isLoopback(net)) {
                continue;
            }
            long rx = net.getBytesRecv();
            long tx = net.getBytesSent();
            long[] previous = previousCounters.put(net.getName(), new long[] {rx, tx, now});

            Double rxSec = null;
            Double txSec = null;
            if (previous != null && now > previous[2]) {
                double seconds = (now - previous[2]) / 1000.0;
                // 计数器回绕或网卡重置时不输出负速率
                rxSec = Math.max(0, rx - previous[0]) / seconds;
                txSec = Math.max(0, tx - previous[1]) / seconds;
            }
            result.add(new NetworkInterfaceData(
                    net.getName(),
                    net.getDisplayName(),
                    net.getMacaddr(),
                    Arrays.asList(net.getIPv4addr()),
                    net.getSpeed(),
                    rx,
                    tx,
                    rxSec,
                    txSec));
        }
        return result;
    }

    @Override
    public List<NetworkInterfaceData> empty() {
        return List.of();
    }

    private boolean isLoopback(NetworkIF net) {
        try {
            var networkInterface = net.queryNetworkInterface();
            return networkInterface != null && networkInterface.isLoopback();
        } catch (SocketException e) {
            log.debug("无法查询网卡 {} 的属性，按非回环处理", net.getName(), e);
            return false;
        }
    }
}
