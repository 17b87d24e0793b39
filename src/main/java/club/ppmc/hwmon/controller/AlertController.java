/**
 * AlertController.java
 *
 * 告警规则的增删改查接口，以及告警事件历史的查询、确认和清空。
 * 规则校验失败时返回 400 和结构化的错误信息。
 */
package club.ppmc.hwmon.controller;

import club.ppmc.hwmon.exception.InvalidAlertException;
import club.ppmc.hwmon.model.alert.Alert;
import club.ppmc.hwmon.model.alert.AlertEvent;
import club.ppmc.hwmon.service.alert.AlertService;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private static final int DEFAULT_EVENT_LIMIT = 100;

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    public ResponseEntity<List<Alert>> getAlerts() {
        return ResponseEntity.ok(alertService.getAllAlerts());
    }

    @PostMapping
    public ResponseEntity<?> createAlert(@RequestBody Alert alert) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(alertService.createAlert(alert));
        } catch (InvalidAlertException e) {
            return ResponseEntity.badRequest().body(e.toErrorData());
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getAlert(@PathVariable String id) {
        return alertService.getAlert(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updateAlert(@PathVariable String id, @RequestBody Alert alert) {
        try {
            return alertService.updateAlert(id, alert)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> notFound(id));
        } catch (InvalidAlertException e) {
            return ResponseEntity.badRequest().body(e.toErrorData());
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteAlert(@PathVariable String id) {
        if (!alertService.deleteAlert(id)) {
            return notFound(id);
        }
        return ResponseEntity.ok(Map.of("message", "告警规则已删除。"));
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<?> enableAlert(@PathVariable String id) {
        if (!alertService.enableAlert(id)) {
            return notFound(id);
        }
        return ResponseEntity.ok(Map.of("message", "告警规则已启用。"));
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<?> disableAlert(@PathVariable String id) {
        if (!alertService.disableAlert(id)) {
            return notFound(id);
        }
        return ResponseEntity.ok(Map.of("message", "告警规则已禁用。"));
    }

    // --- 告警事件 ---

    @GetMapping("/events")
    public ResponseEntity<List<AlertEvent>> getEvents(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(alertService.getAlertHistory(limit == null ? DEFAULT_EVENT_LIMIT : limit));
    }

    @PostMapping("/events/{id}/acknowledge")
    public ResponseEntity<?> acknowledgeEvent(@PathVariable String id) {
        if (!alertService.acknowledgeEvent(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("message", "告警事件不存在: " + id));
        }
        return ResponseEntity.ok(Map.of("message", "告警事件已确认。"));
    }

    @DeleteMapping("/events")
    public ResponseEntity<Map<String, String>> clearEvents() {
        alertService.clearHistory();
        return ResponseEntity.ok(Map.of("message", "告警事件历史已清空。"));
    }

    private static ResponseEntity<?> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "告警规则不存在: " + id));
    }
}
