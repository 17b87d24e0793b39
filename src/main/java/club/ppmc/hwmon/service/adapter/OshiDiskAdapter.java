package club.ppmc.hwmon.service.adapter;

import club.ppmc.hwmon.model.snapshot.DiskData;
import club.ppmc.hwmon.model.snapshot.HardwareCategory;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.software.os.FileSystem;
import oshi.software.os.OSFileStore;

/**
 * 通过 Oshi 采集各挂载点的容量信息。Oshi 不提供磁盘温度，temperature 始终为 null。
 */
@Component
public class OshiDiskAdapter implements SensorSourceAdapter<List<DiskData>> {

    private final FileSystem fileSystem;

    public OshiDiskAdapter(SystemInfo systemInfo) {
        this.fileSystem = systemInfo.getOperatingSystem().getFileSystem();
    }

    @Override
    public HardwareCategory category() {
        return HardwareCategory.DISK;
    }

    @Override
    public List<DiskData> collect() {
        List<OSFileStore> stores = fileSystem.getFileStores(true);
        List<DiskData> disks = new ArrayList<>(stores.size());
        for (int i = 0; i < stores.size(); i++) {
            OSFileStore store = stores.get(i);
            long total = store.getTotalSpace();
            long used = total - store.getUsableSpace();
            disks.add(new DiskData(
                    i,
                    store.getName(),
                    store.getMount(),
                    store.getType(),
                    total,
                    used,
                    total > 0 ? used * 100.0 / total : null,
                    null));
        }
        return disks;
    }

    @Override
    public List<DiskData> empty() {
        return List.of();
    }
}
