/**
 * SubscriberProtocolService.java
 *
 * 处理订阅端发来的消息：auth、subscribe、unsubscribe、ping 和 get。
 * 所有回复只发给发起请求的订阅端，广播由 DistributionHub 负责。
 *
 * <p>未鉴权的订阅端只能发送 auth 和 ping，其他请求一律回复 error。
 */
package club.ppmc.hwmon.service.distribution;

import club.ppmc.hwmon.model.MonitorSettings;
import club.ppmc.hwmon.model.history.HistoryQuery;
import club.ppmc.hwmon.model.snapshot.HardwareSnapshot;
import club.ppmc.hwmon.service.HardwareMonitorService;
import club.ppmc.hwmon.service.HistoryService;
import club.ppmc.hwmon.service.SettingsService;
import club.ppmc.hwmon.service.alert.AlertService;
import club.ppmc.hwmon.service.unified.UnifiedSensorService;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SubscriberProtocolService {

    private final DistributionHub distributionHub;
    private final SettingsService settingsService;
    private final HardwareMonitorService hardwareMonitorService;
    private final HistoryService historyService;
    private final AlertService alertService;
    private final UnifiedSensorService unifiedSensorService;
    private final Clock clock;

    public SubscriberProtocolService(
            DistributionHub distributionHub,
            SettingsService settingsService,
            HardwareMonitorService hardwareMonitorService,
            HistoryService historyService,
            AlertService alertService,
            UnifiedSensorService unifiedSensorService,
            Clock clock) {
        this.distributionHub = distributionHub;
        this.settingsService = settingsService;
        this.hardwareMonitorService = hardwareMonitorService;
        this.historyService = historyService;
        this.alertService = alertService;
        this.unifiedSensorService = unifiedSensorService;
        this.clock = clock;
    }

    /**
     * 处理一条入站文本消息。任何错误都以 error 消息回复给订阅端，不会向外抛出。
     */
    public void handle(Subscriber subscriber, String text) {
        JsonObject message;
        try {
            JsonElement parsed = JsonParser.parseString(text);
            if (!parsed.isJsonObject()) {
                sendError(subscriber, "消息必须是 JSON 对象");
                return;
            }
            message = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            sendError(subscriber, "无效的消息格式");
            return;
        }

        String type = stringField(message, "type");
        if (type == null) {
            sendError(subscriber, "缺少消息类型");
            return;
        }

        try {
            switch (type) {
                case "auth" -> handleAuth(subscriber, message);
                case "ping" -> reply(subscriber, "pong", Map.of("timestamp", clock.millis()));
                case "subscribe", "unsubscribe", "get" -> {
                    if (!subscriber.isAuthenticated()) {
                        sendError(subscriber, "未认证");
                        return;
                    }
                    if ("get".equals(type)) {
                        handleGet(subscriber, message);
                    } else {
                        handleSubscription(subscriber, type, message);
                    }
                }
                default -> sendError(subscriber, "未知的消息类型: " + type);
            }
        } catch (RuntimeException e) {
            log.error("处理订阅端 {} 的 {} 消息失败", subscriber.getId(), type, e);
            sendError(subscriber, "处理请求失败: " + e.getMessage());
        }
    }

    private void handleAuth(Subscriber subscriber, JsonObject message) {
        MonitorSettings settings = settingsService.getSettings();
        String key = stringField(message, "key");
        if (key == null) {
            key = stringField(message, "apiKey");
        }
        boolean success = !settings.isEnableAuth()
                || (key != null && settings.getApiKey() != null && !settings.getApiKey().isEmpty()
                        && key.equals(settings.getApiKey()));
        if (success) {
            subscriber.setAuthenticated(true);
        } else {
            log.warn("订阅端 {} 鉴权失败", subscriber.getId());
        }
        reply(subscriber, "auth", Map.of("success", success));
    }

    private void handleSubscription(Subscriber subscriber, String type, JsonObject message) {
        List<String> requested = channelsField(message);
        List<String> accepted = new ArrayList<>();
        for (String name : requested) {
            if (DistributionChannel.fromName(name).isPresent()) {
                accepted.add(name);
            } else {
                log.debug("订阅端 {} 请求了未知频道 {}", subscriber.getId(), name);
            }
        }
        if ("subscribe".equals(type)) {
            subscriber.subscribe(accepted);
            reply(subscriber, "subscribed", Map.of("channels", subscriber.channelList()));
        } else {
            subscriber.unsubscribe(accepted);
            reply(subscriber, "unsubscribed", Map.of("channels", subscriber.channelList()));
        }
    }

    private void handleGet(Subscriber subscriber, JsonObject message) {
        String resource = stringField(message, "resource");
        if (resource == null) {
            sendError(subscriber, "缺少 resource 字段");
            return;
        }
        Optional<Object> data = resolveResource(resource);
        if (data.isEmpty()) {
            sendError(subscriber, "未知的资源: " + resource);
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("resource", resource);
        body.put("data", data.get());
        reply(subscriber, "data", body);
    }

    /**
     * 查找资源的当前值。snapshot 在尚无缓存时会触发一次同步采集，其余硬件资源取自缓存快照。
     */
    Optional<Object> resolveResource(String resource) {
        return switch (resource) {
            case "snapshot" -> Optional.of(currentSnapshot());
            case "cpu" -> Optional.of(currentSnapshot().cpu());
            case "gpu" -> Optional.of(currentSnapshot().gpus());
            case "memory" -> Optional.of(currentSnapshot().memory());
            case "disks" -> Optional.of(currentSnapshot().disks());
            case "network" -> Optional.of(currentSnapshot().network());
            case "os" -> Optional.of(currentSnapshot().os());
            case "battery" -> Optional.of(currentSnapshot().battery());
            case "processes" -> Optional.of(currentSnapshot().processes());
            case "sensors" -> Optional.of(hardwareMonitorService.getSensorReadings());
            case "alerts" -> Optional.of(alertService.getAllAlerts());
            case "history" -> Optional.of(historyService.query(HistoryQuery.all()));
            case "unified" -> Optional.of(unifiedSensorService.getAllData());
            default -> Optional.empty();
        };
    }

    private HardwareSnapshot currentSnapshot() {
        HardwareSnapshot snapshot = hardwareMonitorService.getLastSnapshot();
        return snapshot != null ? snapshot : hardwareMonitorService.poll();
    }

    private void reply(Subscriber subscriber, String type, Map<String, Object> fields) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.putAll(fields);
        distributionHub.sendTo(subscriber, message);
    }

    private void sendError(Subscriber subscriber, String errorMessage) {
        reply(subscriber, "error", Map.of("message", errorMessage));
    }

    private static String stringField(JsonObject message, String name) {
        JsonElement element = message.get(name);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    private static List<String> channelsField(JsonObject message) {
        JsonElement element = message.get("channels");
        List<String> channels = new ArrayList<>();
        if (element == null) {
            return channels;
        }
        if (element.isJsonPrimitive()) {
            channels.add(element.getAsString());
        } else if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            for (JsonElement item : array) {
                if (item.isJsonPrimitive()) {
                    channels.add(item.getAsString());
                }
            }
        }
        return channels;
    }
}
