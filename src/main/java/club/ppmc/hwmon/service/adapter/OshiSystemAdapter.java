/**
 * OshiSystemAdapter.java
 *
 * 提供快照中不受类别开关控制的部分：机器标识、系统基础信息和操作系统信息。
 */
package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.OsData;
import club.ppmc.hwmon.model.snapshot.SystemData;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import oshi.SystemInfo;

@Component
@Slf4j
public class OshiSystemAdapter {

    private final SystemInfo systemInfo;
    private volatile String machineId;

    public OshiSystemAdapter(SystemInfo systemInfo) {
        this.systemInfo = systemInfo;
    }

    /**
     * 机器唯一标识。优先使用硬件 UUID，无法获取时生成一个随机 UUID 并在进程生命周期内保持不变。
     */
    public String machineId() {
        if (machineId == null) {
            String uuid = null;
            try {
                uuid = systemInfo.getHardware().getComputerSystem().getHardwareUUID();
            } catch (RuntimeException e) {
                log.debug("读取硬件 UUID 失败", e);
            }
            if (!StringUtils.hasText(uuid) || "unknown".equalsIgnoreCase(uuid)) {
                log.warn("无法获取机器ID，将生成随机ID");
                uuid = UUID.randomUUID().toString();
            }
            machineId = uuid;
        }
        return machineId;
    }

    public SystemData collect() {
        var computerSystem = systemInfo.getHardware().getComputerSystem();
        var os = systemInfo.getOperatingSystem();
        return new SystemData(
                computerSystem.getManufacturer(),
                computerSystem.getModel(),
                os.getFamily(),
                os.getVersionInfo().getVersion(),
                os.getNetworkParams().getHostName(),
                os.getSystemUptime());
    }

    public OsData collectOs() {
        var os = systemInfo.getOperatingSystem();
        var versionInfo = os.getVersionInfo();
        return new OsData(
                os.getFamily(),
                os.getManufacturer(),
                versionInfo.getVersion(),
                versionInfo.getCodeName(),
                versionInfo.getBuildNumber(),
                System.getProperty("os.arch", ""),
                os.getBitness(),
                os.getNetworkParams().getHostName(),
                os.isElevated(),
                os.getProcessCount(),
                os.getThreadCount());
    }
}
