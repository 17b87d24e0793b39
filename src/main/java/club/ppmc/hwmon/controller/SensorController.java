/**
 * SensorController.java
 *
 * 提供硬件快照和规范读数的查询接口。
 */
package club.ppmc.hwmon.controller;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.snapshot.HardwareSnapshot;
import club.ppmc.hwmon.service.HardwareMonitorService;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Slf4j
public class SensorController {

    private final HardwareMonitorService hardwareMonitorService;

    public SensorController(HardwareMonitorService hardwareMonitorService) {
        this.hardwareMonitorService = hardwareMonitorService;
    }

    /**
     * 获取最近一次采集的快照，尚未采集过时返回 503。
     */
    @GetMapping("/snapshot")
    public ResponseEntity<?> getSnapshot() {
        HardwareSnapshot snapshot = hardwareMonitorService.getLastSnapshot();
        if (snapshot == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("message", "尚无可用的快照，请稍后重试。"));
        }
        return ResponseEntity.ok(snapshot);
    }

    /**
     * 立即执行一次采集并返回结果。
     */
    @GetMapping("/snapshot/live")
    public ResponseEntity<?> getLiveSnapshot() {
        try {
            return ResponseEntity.ok(hardwareMonitorService.poll());
        } catch (RuntimeException e) {
            log.error("实时采集失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "实时采集失败: " + e.getMessage()));
        }
    }

    @GetMapping("/sensors")
    public ResponseEntity<List<SensorReading>> getSensors() {
        return ResponseEntity.ok(hardwareMonitorService.getSensorReadings());
    }

    @GetMapping("/sensors/paths")
    public ResponseEntity<List<String>> getSensorPaths() {
        return ResponseEntity.ok(hardwareMonitorService.getSensorPaths());
    }
}
