/**
 * HistoryController.java
 *
 * 历史读数的查询与管理接口。
 */
package club.ppmc.hwmon.controller;

import club.ppmc.hwmon.model.history.HistoryEntry;
import club.ppmc.hwmon.model.history.HistoryQuery;
import club.ppmc.hwmon.model.history.HistoryStats;
import club.ppmc.hwmon.model.history.Resolution;
import club.ppmc.hwmon.service.HistoryService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/history")
public class HistoryController {

    /** getSensorHistory 未指定 duration 时的默认时长 (毫秒)。 */
    private static final long DEFAULT_SENSOR_DURATION_MS = 3_600_000L;

    private final HistoryService historyService;

    public HistoryController(HistoryService historyService) {
        this.historyService = historyService;
    }

    /**
     * 按时间窗口查询历史，可选降采样粒度 (raw/minute/hour/day) 和返回条数上限。
     */
    @GetMapping
    public ResponseEntity<?> query(
            @RequestParam(required = false) Long startTime,
            @RequestParam(required = false) Long endTime,
            @RequestParam(required = false) String resolution,
            @RequestParam(required = false) Integer limit) {
        try {
            var query = new HistoryQuery(startTime, endTime, Resolution.parse(resolution), limit);
            List<HistoryEntry> entries = historyService.query(query);
            return ResponseEntity.ok(entries);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }

    /**
     * 查询单个传感器路径在最近一段时间内的取值。
     *
     * @param duration 时长 (毫秒)。
     */
    @GetMapping("/sensor")
    public ResponseEntity<?> getSensorHistory(
            @RequestParam String path, @RequestParam(required = false) Long duration) {
        long durationMs = duration == null ? DEFAULT_SENSOR_DURATION_MS : duration;
        if (durationMs <= 0) {
            return ResponseEntity.badRequest().body(Map.of("message", "duration 必须为正数"));
        }
        return ResponseEntity.ok(historyService.getSensorHistory(path, durationMs));
    }

    @GetMapping("/latest")
    public ResponseEntity<Map<String, Double>> getLatest() {
        return ResponseEntity.ok(historyService.getLatestReadings());
    }

    @GetMapping("/stats")
    public ResponseEntity<HistoryStats> getStats() {
        return ResponseEntity.ok(historyService.getStats());
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> clear() {
        historyService.clear();
        return ResponseEntity.ok(Map.of("message", "历史数据已清空。"));
    }
}
