/**
 * UnifiedController.java
 *
 * 统一传感器视图的查询接口。
 */
package club.ppmc.hwmon.controller;

import club.ppmc.hwmon.model.unified.UnifiedMonitorData;
import club.ppmc.hwmon.model.unified.UnifiedSensor;
import club.ppmc.hwmon.model.unified.UnifiedSensorType;
import club.ppmc.hwmon.service.unified.UnifiedSensorService;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/unified")
public class UnifiedController {

    private final UnifiedSensorService unifiedSensorService;

    public UnifiedController(UnifiedSensorService unifiedSensorService) {
        this.unifiedSensorService = unifiedSensorService;
    }

    @GetMapping
    public ResponseEntity<UnifiedMonitorData> getAll() {
        return ResponseEntity.ok(unifiedSensorService.getAllData());
    }

    @GetMapping("/critical")
    public ResponseEntity<List<UnifiedSensor>> getCritical() {
        return ResponseEntity.ok(unifiedSensorService.getCritical());
    }

    @GetMapping("/warnings")
    public ResponseEntity<List<UnifiedSensor>> getWarnings() {
        return ResponseEntity.ok(unifiedSensorService.getWarnings());
    }

    /**
     * 按统一类型查询，例如 /api/unified/temperature。
     */
    @GetMapping("/{type}")
    public ResponseEntity<?> getByType(@PathVariable String type) {
        try {
            var sensorType = UnifiedSensorType.valueOf(type.toUpperCase(Locale.ROOT));
            return ResponseEntity.ok(unifiedSensorService.getByType(sensorType));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", "未知的传感器类型: " + type));
        }
    }
}
