package club.ppmc.hwmon.service.alert;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import club.ppmc.hwmon.exception.InvalidAlertException;
import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.SensorType;
import club.ppmc.hwmon.model.alert.Alert;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertCondition;
import club.ppmc.hwmon.model.alert.AlertEvent;
import club.ppmc.hwmon.service.SettingsService;
import club.ppmc.hwmon.service.distribution.DistributionChannel;
import club.ppmc.hwmon.service.distribution.DistributionHub;
import club.ppmc.hwmon.support.MutableClock;
import club.ppmc.hwmon.support.TestSettings;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * 告警评估服务测试
 */
@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    @TempDir
    Path tempDir;

    @Mock
    private DistributionHub distributionHub;

    private MutableClock clock;
    private AlertRepository repository;
    private SettingsService settingsService;
    private List<AlertAction> executedActions;
    private AlertService alertService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0);
        repository = new AlertRepository(tempDir);
        settingsService = TestSettings.defaults(tempDir);
        executedActions = new ArrayList<>();
        alertService = newService(settingsService);
    }

    private AlertService newService(SettingsService settings) {
        AlertActionHandler recordingNotification = new AlertActionHandler() {
            @Override
            public AlertActionType type() {
                return AlertActionType.NOTIFICATION;
            }

            @Override
            public void execute(AlertAction action, AlertEvent event, SensorReading reading) {
                executedActions.add(action);
            }
        };
        AlertActionHandler failingWebhook = new AlertActionHandler() {
            @Override
            public AlertActionType type() {
                return AlertActionType.WEBHOOK;
            }

            @Override
            public void execute(AlertAction action, AlertEvent event, SensorReading reading) throws Exception {
                throw new IOException("connection refused");
            }
        };
        var dispatcher = new AlertActionDispatcher(List.of(recordingNotification, failingWebhook));
        var service = new AlertService(repository, dispatcher, distributionHub, settings, VALIDATOR, clock);
        service.init();
        return service;
    }

    private static Alert alert(String path, AlertCondition condition, Double min, Double max, long cooldown) {
        var alert = new Alert();
        alert.setName("test-" + condition);
        alert.setSensorPath(path);
        alert.setCondition(condition);
        alert.setThresholdMin(min);
        alert.setThresholdMax(max);
        alert.setCooldown(cooldown);
        alert.setActions(new ArrayList<>(List.of(new AlertAction(AlertActionType.NOTIFICATION, Map.of()))));
        return alert;
    }

    private SensorReading reading(String path, double value) {
        return new SensorReading(path, SensorType.TEMPERATURE, value, 0, 100, "°C", path, clock.millis());
    }

    private int fireCount(String path, double value) {
        return alertService.evaluate(List.of(reading(path, value))).size();
    }

    @Test
    void testEvaluate_ConditionBoundaries() {
        alertService.createAlert(alert("a.above", AlertCondition.ABOVE, null, 80.0, 0));
        alertService.createAlert(alert("a.below", AlertCondition.BELOW, 10.0, null, 0));
        alertService.createAlert(alert("a.between", AlertCondition.BETWEEN, 10.0, 20.0, 0));
        alertService.createAlert(alert("a.outside", AlertCondition.OUTSIDE, 10.0, 20.0, 0));

        assertEquals(0, fireCount("a.above", 80.0));
        assertEquals(1, fireCount("a.above", 80.5));
        assertEquals(0, fireCount("a.below", 10.0));
        assertEquals(1, fireCount("a.below", 9.5));
        assertEquals(1, fireCount("a.between", 10.0));
        assertEquals(1, fireCount("a.between", 20.0));
        assertEquals(0, fireCount("a.between", 20.5));
        assertEquals(0, fireCount("a.outside", 10.0));
        assertEquals(0, fireCount("a.outside", 20.0));
        assertEquals(1, fireCount("a.outside", 9.9));
    }

    @Test
    void testEvaluate_CooldownScenario() {
        alertService.createAlert(alert("cpu.temperature", AlertCondition.ABOVE, null, 80.0, 60));
        double[] values = {70, 85, 86, 60, 90};
        long[] seconds = {0, 1, 2, 3, 65};

        List<Long> fireTimes = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            clock.setMillis(seconds[i] * 1000L);
            for (AlertEvent event : alertService.evaluate(List.of(reading("cpu.temperature", values[i])))) {
                fireTimes.add(event.getTimestamp());
            }
        }

        assertEquals(List.of(1_000L, 65_000L), fireTimes);
        Alert stored = alertService.getAllAlerts().get(0);
        assertEquals(2, stored.getTriggerCount());
        assertEquals(65_000L, stored.getLastTriggered());
    }

    @Test
    void testEvaluate_BatchFiresRuleOnlyOnce() {
        alertService.createAlert(alert("gpu.*", AlertCondition.ABOVE, null, 80.0, 60));

        List<AlertEvent> events = alertService.evaluate(List.of(
                reading("gpu.0.temperature", 90),
                reading("gpu.1.temperature", 95)));

        assertEquals(1, events.size());
        assertEquals("gpu.0.temperature", events.get(0).getSensorPath());
        assertEquals(1, alertService.getAlertHistory(10).size());
    }

    @Test
    void testEvaluate_ZeroCooldownStillFiresOncePerBatch() {
        Alert created = alertService.createAlert(alert("gpu.*", AlertCondition.ABOVE, null, 80.0, 0));

        List<AlertEvent> events = alertService.evaluate(List.of(
                reading("gpu.0.temperature", 90),
                reading("gpu.1.temperature", 95)));

        assertEquals(1, events.size());
        assertEquals(1, alertService.getAlert(created.getId()).orElseThrow().getTriggerCount());

        // 冷却为 0 时，下一批可以立即再次触发
        assertEquals(1, alertService.evaluate(List.of(reading("gpu.1.temperature", 95))).size());
    }

    @Test
    void testEvaluate_PathMatching() {
        assertTrue(AlertService.matchesSensorPath("cpu.load", "*"));
        assertTrue(AlertService.matchesSensorPath("gpu.0.load", "gpu.*"));
        assertTrue(AlertService.matchesSensorPath("cpu.load", "cpu.load"));
        assertFalse(AlertService.matchesSensorPath("cpu.load", "cpu.temperature"));
        assertFalse(AlertService.matchesSensorPath("cpu.load", "gpu.*"));
    }

    @Test
    void testEvaluate_EventContentAndPublish() {
        Alert created = alertService.createAlert(alert("memory.used", AlertCondition.BELOW, 5.0, null, 60));
        clock.setMillis(42_000);

        List<AlertEvent> events = alertService.evaluate(List.of(reading("memory.used", 2.0)));

        assertEquals(1, events.size());
        AlertEvent event = events.get(0);
        assertEquals(created.getId(), event.getAlertId());
        assertEquals(created.getName(), event.getAlertName());
        assertEquals(5.0, event.getThreshold());
        assertEquals(2.0, event.getValue());
        assertEquals(42_000L, event.getTimestamp());
        assertFalse(event.isAcknowledged());
        verify(distributionHub, times(1)).publish(eq(DistributionChannel.ALERTS), any(AlertEvent.class));
        assertEquals(1, executedActions.size());
    }

    @Test
    void testEvaluate_SkipsDisabledAndNonFinite() {
        Alert created = alertService.createAlert(alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 0));

        assertEquals(0, fireCount("cpu.load", Double.NaN));
        assertEquals(0, fireCount("cpu.load", Double.POSITIVE_INFINITY));

        assertTrue(alertService.disableAlert(created.getId()));
        assertEquals(0, fireCount("cpu.load", 90));

        assertTrue(alertService.enableAlert(created.getId()));
        assertEquals(1, fireCount("cpu.load", 90));
    }

    @Test
    void testEvaluate_FailingActionDoesNotStopOthers() {
        Alert draft = alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 0);
        draft.setActions(new ArrayList<>(List.of(
                new AlertAction(AlertActionType.WEBHOOK, Map.of("url", "http://127.0.0.1:1/hook")),
                new AlertAction(AlertActionType.NOTIFICATION, Map.of()))));
        alertService.createAlert(draft);

        List<AlertEvent> events = alertService.evaluate(List.of(reading("cpu.load", 90)));

        assertEquals(1, events.size());
        assertEquals(1, executedActions.size());
        assertEquals(AlertActionType.NOTIFICATION, executedActions.get(0).getType());
    }

    @Test
    void testCreateAlert_RejectsInvalidDefinitions() {
        Alert missingName = alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 0);
        missingName.setName(" ");
        Alert missingMax = alert("cpu.load", AlertCondition.ABOVE, null, null, 0);
        Alert invertedRange = alert("cpu.load", AlertCondition.BETWEEN, 30.0, 10.0, 0);
        Alert negativeCooldown = alert("cpu.load", AlertCondition.ABOVE, null, 50.0, -1);
        Alert webhookWithoutUrl = alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 0);
        webhookWithoutUrl.setActions(new ArrayList<>(List.of(new AlertAction(AlertActionType.WEBHOOK, Map.of()))));

        for (Alert invalid : List.of(missingName, missingMax, invertedRange, negativeCooldown, webhookWithoutUrl)) {
            InvalidAlertException e = assertThrows(InvalidAlertException.class, () -> alertService.createAlert(invalid));
            assertFalse(e.getViolations().isEmpty());
        }
        assertTrue(alertService.getAllAlerts().isEmpty());
        assertFalse(Files.exists(repository.getAlertsFilePath()));
    }

    @Test
    void testUpdateAlert_KeepsIdentityAndCounters() {
        Alert created = alertService.createAlert(alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 0));
        alertService.evaluate(List.of(reading("cpu.load", 90)));

        Alert changes = alert("cpu.load", AlertCondition.ABOVE, null, 95.0, 0);
        changes.setName("renamed");
        Alert updated = alertService.updateAlert(created.getId(), changes).orElseThrow();

        assertEquals(created.getId(), updated.getId());
        assertEquals("renamed", updated.getName());
        assertEquals(1, updated.getTriggerCount());
        assertTrue(alertService.updateAlert("missing", changes).isEmpty());
    }

    @Test
    void testPersistence_SurvivesRestart() {
        Alert created = alertService.createAlert(alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 60));
        clock.setMillis(5_000);
        alertService.evaluate(List.of(reading("cpu.load", 90)));

        AlertService restarted = newService(settingsService);

        Alert loaded = restarted.getAlert(created.getId()).orElseThrow();
        assertEquals(1, loaded.getTriggerCount());
        assertEquals(5_000L, loaded.getLastTriggered());
        // 冷却期从持久化的 lastTriggered 继续计算
        clock.setMillis(10_000);
        assertTrue(restarted.evaluate(List.of(reading("cpu.load", 90))).isEmpty());
    }

    @Test
    void testDeleteAlert() {
        Alert created = alertService.createAlert(alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 0));

        assertTrue(alertService.deleteAlert(created.getId()));
        assertFalse(alertService.deleteAlert(created.getId()));
        assertTrue(alertService.getAlert(created.getId()).isEmpty());
        assertEquals(0, fireCount("cpu.load", 90));
    }

    @Test
    void testAlertHistory_CappedAcknowledgedAndCleared() {
        SettingsService limited = TestSettings.of(tempDir, s -> s.setAlertHistoryLimit(2));
        alertService = newService(limited);
        alertService.createAlert(alert("cpu.load", AlertCondition.ABOVE, null, 50.0, 0));

        alertService.evaluate(List.of(reading("cpu.load", 60)));
        alertService.evaluate(List.of(reading("cpu.load", 70)));
        alertService.evaluate(List.of(reading("cpu.load", 80)));

        List<AlertEvent> history = alertService.getAlertHistory(10);
        assertEquals(2, history.size());
        assertEquals(70.0, history.get(0).getValue());
        assertEquals(1, alertService.getAlertHistory(1).size());

        assertTrue(alertService.acknowledgeEvent(history.get(1).getId()));
        assertTrue(alertService.getAlertHistory(10).get(1).isAcknowledged());
        assertFalse(alertService.acknowledgeEvent("missing"));

        alertService.clearHistory();
        assertTrue(alertService.getAlertHistory(10).isEmpty());
    }
}
