/**
 * AlertService.java
 *
 * 告警评估服务：持有用户定义的告警规则，对每批实时读数进行匹配和条件判断，
 * 满足条件且不在冷却期内时触发告警事件、推送到 alerts 频道并依次执行配置的动作。
 *
 * <p>一次评估过程在同一把锁内完成冷却检查与更新，因此同一批读数中多条命中同一规则的读数
 * 最多只会触发一次。动作在锁外执行，慢动作不会阻塞规则的增删改查。
 *
 * <p>规则的每次修改都会持久化到 alerts.json；持久化失败只记录日志，不影响内存中的状态。
 */
package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.exception.InvalidAlertException;
import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.Alert;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertCondition;
import club.ppmc.hwmon.model.alert.AlertEvent;
import club.ppmc.hwmon.service.SettingsService;
import club.ppmc.hwmon.service.distribution.DistributionChannel;
import club.ppmc.hwmon.service.distribution.DistributionHub;
import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class AlertService {

    private final Map<String, Alert> alerts = new LinkedHashMap<>();
    private final Map<String, Long> lastFired = new HashMap<>();
    private final Deque<AlertEvent> eventHistory = new ArrayDeque<>();

    private final AlertRepository alertRepository;
    private final AlertActionDispatcher actionDispatcher;
    private final DistributionHub distributionHub;
    private final SettingsService settingsService;
    private final Validator validator;
    private final Clock clock;

    /** 一次触发：规则副本、事件和触发它的读数。 */
    private record Firing(Alert alert, AlertEvent event, SensorReading reading) {}

    public AlertService(
            AlertRepository alertRepository,
            AlertActionDispatcher actionDispatcher,
            DistributionHub distributionHub,
            SettingsService settingsService,
            Validator validator,
            Clock clock) {
        this.alertRepository = alertRepository;
        this.actionDispatcher = actionDispatcher;
        this.distributionHub = distributionHub;
        this.settingsService = settingsService;
        this.validator = validator;
        this.clock = clock;
    }

    @PostConstruct
    public synchronized void init() {
        try {
            for (Alert alert : alertRepository.loadAll()) {
                if (alert.getId() == null) {
                    log.warn("跳过一条没有 id 的告警规则: {}", alert.getName());
                    continue;
                }
                alerts.put(alert.getId(), alert);
                if (alert.getLastTriggered() != null) {
                    lastFired.put(alert.getId(), alert.getLastTriggered());
                }
            }
        } catch (IOException e) {
            log.error("加载告警规则失败，将以空规则集启动", e);
        }
    }

    // --- 评估 ---

    /**
     * 用一批读数评估所有启用的规则。
     *
     * @return 本次触发的告警事件。
     */
    public List<AlertEvent> evaluate(List<SensorReading> readings) {
        if (readings == null || readings.isEmpty()) {
            return List.of();
        }
        List<Firing> firings = new ArrayList<>();
        synchronized (this) {
            if (alerts.isEmpty()) {
                return List.of();
            }
            long now = clock.millis();
            // 同一批读数中每条规则最多触发一次，与冷却时间无关
            Set<String> firedThisPass = new HashSet<>();
            for (SensorReading reading : readings) {
                for (Alert alert : alerts.values()) {
                    if (!alert.isEnabled() || !matchesSensorPath(reading.source(), alert.getSensorPath())) {
                        continue;
                    }
                    if (!Double.isFinite(reading.value())) {
                        log.debug("读数 {} 的值 {} 无法参与告警 '{}' 的评估，已跳过",
                                reading.source(), reading.value(), alert.getName());
                        continue;
                    }
                    if (firedThisPass.contains(alert.getId())) {
                        continue;
                    }
                    Long last = lastFired.get(alert.getId());
                    if (last != null && now < last + alert.getCooldown() * 1000L) {
                        continue;
                    }
                    boolean triggered;
                    try {
                        triggered = alert.getCondition().test(
                                reading.value(), alert.getThresholdMin(), alert.getThresholdMax());
                    } catch (RuntimeException e) {
                        log.warn("评估告警 '{}' 时出错，已跳过读数 {}", alert.getName(), reading.source(), e);
                        continue;
                    }
                    if (triggered) {
                        firedThisPass.add(alert.getId());
                        firings.add(fire(alert, reading, now));
                    }
                }
            }
            if (!firings.isEmpty()) {
                persist();
            }
        }

        List<AlertEvent> events = new ArrayList<>(firings.size());
        for (Firing firing : firings) {
            AlertEvent event = firing.event();
            log.warn("告警触发: {} - {} = {}{}", event.getAlertName(), firing.reading().name(),
                    firing.reading().value(), firing.reading().unit());
            try {
                distributionHub.publish(DistributionChannel.ALERTS, copyOf(event));
            } catch (RuntimeException e) {
                log.error("推送告警事件 {} 失败", event.getId(), e);
            }
            actionDispatcher.dispatch(firing.alert().getActions(), copyOf(event), firing.reading());
            events.add(copyOf(event));
        }
        return events;
    }

    /**
     * 路径匹配：'*' 匹配全部，以 '*' 结尾的模式做前缀匹配，其余做精确匹配。
     */
    static boolean matchesSensorPath(String path, String pattern) {
        if (path == null || pattern == null) {
            return false;
        }
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith("*")) {
            return path.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return path.equals(pattern);
    }

    private Firing fire(Alert alert, SensorReading reading, long now) {
        var event = new AlertEvent(
                UUID.randomUUID().toString(),
                alert.getId(),
                alert.getName(),
                reading.source(),
                reading.value(),
                alert.getCondition() == AlertCondition.BELOW ? alert.getThresholdMin() : alert.getThresholdMax(),
                alert.getCondition(),
                now,
                false);
        eventHistory.addLast(event);
        int limit = settingsService.getSettings().getAlertHistoryLimit();
        while (eventHistory.size() > limit) {
            eventHistory.pollFirst();
        }
        alert.setLastTriggered(now);
        alert.setTriggerCount(alert.getTriggerCount() + 1);
        lastFired.put(alert.getId(), now);
        return new Firing(alert.copy(), event, reading);
    }

    // --- 规则 CRUD ---

    public synchronized Alert createAlert(Alert draft) {
        validate(draft);
        Alert alert = draft.copy();
        alert.setId(UUID.randomUUID().toString());
        alert.setLastTriggered(null);
        alert.setTriggerCount(0);
        alerts.put(alert.getId(), alert);
        persist();
        log.info("已创建告警规则: {} ({})", alert.getName(), alert.getId());
        return alert.copy();
    }

    /**
     * 用新的定义替换规则的可编辑字段，保留 id、lastTriggered 和 triggerCount。
     *
     * @return 更新后的规则；规则不存在时为空。
     */
    public synchronized Optional<Alert> updateAlert(String id, Alert updates) {
        Alert existing = alerts.get(id);
        if (existing == null) {
            return Optional.empty();
        }
        validate(updates);
        Alert updated = updates.copy();
        updated.setId(existing.getId());
        updated.setLastTriggered(existing.getLastTriggered());
        updated.setTriggerCount(existing.getTriggerCount());
        alerts.put(id, updated);
        persist();
        log.info("已更新告警规则: {} ({})", updated.getName(), id);
        return Optional.of(updated.copy());
    }

    public synchronized boolean deleteAlert(String id) {
        if (alerts.remove(id) == null) {
            return false;
        }
        lastFired.remove(id);
        persist();
        log.info("已删除告警规则: {}", id);
        return true;
    }

    public boolean enableAlert(String id) {
        return setEnabled(id, true);
    }

    public boolean disableAlert(String id) {
        return setEnabled(id, false);
    }

    private synchronized boolean setEnabled(String id, boolean enabled) {
        Alert alert = alerts.get(id);
        if (alert == null) {
            return false;
        }
        alert.setEnabled(enabled);
        persist();
        log.info("告警规则 {} 已{}", id, enabled ? "启用" : "禁用");
        return true;
    }

    public synchronized Optional<Alert> getAlert(String id) {
        return Optional.ofNullable(alerts.get(id)).map(Alert::copy);
    }

    public synchronized List<Alert> getAllAlerts() {
        return alerts.values().stream().map(Alert::copy).toList();
    }

    // --- 事件历史 ---

    /**
     * 返回最近的 limit 条告警事件，按触发时间升序。
     */
    public synchronized List<AlertEvent> getAlertHistory(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<AlertEvent> all = new ArrayList<>(eventHistory);
        return all.subList(Math.max(0, all.size() - limit), all.size()).stream()
                .map(AlertService::copyOf)
                .toList();
    }

    public synchronized boolean acknowledgeEvent(String eventId) {
        for (AlertEvent event : eventHistory) {
            if (event.getId().equals(eventId)) {
                event.setAcknowledged(true);
                return true;
            }
        }
        return false;
    }

    public synchronized void clearHistory() {
        eventHistory.clear();
        log.info("告警事件历史已清空");
    }

    // --- 内部方法 ---

    /**
     * 校验规则定义。字段级约束由 Bean Validation 检查，条件与阈值之间的关系在这里检查。
     *
     * @throws InvalidAlertException 存在任何问题时。
     */
    void validate(Alert alert) {
        if (alert == null) {
            throw new InvalidAlertException(List.of("告警规则不能为空"));
        }
        List<String> violations = new ArrayList<>();
        for (ConstraintViolation<Alert> violation : validator.validate(alert)) {
            violations.add(violation.getPropertyPath() + ": " + violation.getMessage());
        }

        AlertCondition condition = alert.getCondition();
        if (condition != null) {
            if (condition.requiresMin() && !isFinite(alert.getThresholdMin())) {
                violations.add("条件 " + condition + " 需要有效的 thresholdMin");
            }
            if (condition.requiresMax() && !isFinite(alert.getThresholdMax())) {
                violations.add("条件 " + condition + " 需要有效的 thresholdMax");
            }
            if ((condition == AlertCondition.BETWEEN || condition == AlertCondition.OUTSIDE)
                    && isFinite(alert.getThresholdMin()) && isFinite(alert.getThresholdMax())
                    && alert.getThresholdMin() > alert.getThresholdMax()) {
                violations.add("thresholdMin 不能大于 thresholdMax");
            }
        }

        if (alert.getActions() != null) {
            for (AlertAction action : alert.getActions()) {
                if (action == null) {
                    continue;
                }
                if (action.getType() == null) {
                    violations.add("动作类型不能为空");
                } else if (action.getType() == AlertActionType.WEBHOOK && action.configString("url") == null) {
                    violations.add("webhook 动作需要配置 url");
                } else if (action.getType() == AlertActionType.COMMAND && action.configString("command") == null) {
                    violations.add("command 动作需要配置 command");
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidAlertException(violations);
        }
    }

    private void persist() {
        try {
            alertRepository.saveAll(alerts.values());
        } catch (IOException e) {
            log.error("保存告警规则失败", e);
        }
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }

    private static AlertEvent copyOf(AlertEvent event) {
        return new AlertEvent(event.getId(), event.getAlertId(), event.getAlertName(), event.getSensorPath(),
                event.getValue(), event.getThreshold(), event.getCondition(), event.getTimestamp(),
                event.isAcknowledged());
    }
}
