/**
 * SettingsController.java
 *
 * 该控制器负责处理运行期监控设置的读取和更新请求。
 * 它通过 SettingsService 来获取和持久化配置。
 */
package club.ppmc.hwmon.controller;

import club.ppmc.hwmon.model.MonitorSettings;
import club.ppmc.hwmon.service.SettingsService;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * 获取当前的监控设置。
     */
    @GetMapping
    public ResponseEntity<MonitorSettings> getSettings() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    /**
     * 更新并保存监控设置。非法取值返回 400。
     */
    @PostMapping
    public ResponseEntity<?> updateSettings(@RequestBody MonitorSettings newSettings) {
        try {
            settingsService.updateSettings(newSettings);
            return ResponseEntity.ok(Map.of("message", "设置更新成功。"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (IOException e) {
            log.error("保存设置失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "保存设置失败: " + e.getMessage()));
        }
    }
}
