package club.ppmc.hwmon.service.distribution;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.hwmon.model.alert.AlertCondition;
import club.ppmc.hwmon.model.alert.AlertEvent;
import club.ppmc.hwmon.support.MutableClock;
import club.ppmc.hwmon.support.RecordingSink;
import club.ppmc.hwmon.support.Snapshots;
import club.ppmc.hwmon.support.TestSettings;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * 分发中心测试
 */
class DistributionHubTest {

    @TempDir
    Path tempDir;

    private DistributionHub newHub(boolean authEnabled) {
        var settings = TestSettings.of(tempDir, s -> {
            s.setEnableAuth(authEnabled);
            s.setApiKey(authEnabled ? "secret" : "");
        });
        return new DistributionHub(settings, new Gson(), new MutableClock(1_000));
    }

    private static AlertEvent event() {
        return new AlertEvent("e1", "a1", "High CPU", "cpu.load", 95.0, 90.0, AlertCondition.ABOVE, 1_000L, false);
    }

    @Test
    void testConnect_SendsConnectedAndDefaultsToSnapshot() {
        DistributionHub hub = newHub(false);
        var sink = new RecordingSink();

        Subscriber subscriber = hub.connect(sink);

        JsonObject connected = sink.last();
        assertEquals("connected", connected.get("type").getAsString());
        assertEquals(subscriber.getId(), connected.get("clientId").getAsString());
        assertEquals(1_000L, connected.get("timestamp").getAsLong());
        assertEquals(List.of("snapshot"), subscriber.channelList());
        assertTrue(subscriber.isAuthenticated());
        assertEquals(1, hub.getSubscriberCount());
    }

    @Test
    void testPublish_RoutesByChannel() {
        DistributionHub hub = newHub(false);
        var snapshotSink = new RecordingSink();
        var alertSink = new RecordingSink();
        hub.connect(snapshotSink);
        Subscriber alertsOnly = hub.connect(alertSink);
        alertsOnly.unsubscribe(List.of("snapshot"));
        alertsOnly.subscribe(List.of("alerts"));
        snapshotSink.clear();
        alertSink.clear();

        assertEquals(1, hub.publish(DistributionChannel.ALERTS, event()));
        assertEquals(1, hub.publish(DistributionChannel.SNAPSHOT, Snapshots.full(5L)));

        assertEquals(List.of("snapshot"), snapshotSink.types());
        assertEquals(List.of("alert"), alertSink.types());
        JsonObject alert = alertSink.last().getAsJsonObject("data");
        assertEquals("High CPU", alert.get("alertName").getAsString());
        assertEquals("above", alert.get("condition").getAsString());
        assertEquals(5L, snapshotSink.last().getAsJsonObject("data").get("timestamp").getAsLong());
    }

    @Test
    void testPublish_SkipsUnauthenticatedSubscribers() {
        DistributionHub hub = newHub(true);
        var pending = new RecordingSink();
        var authed = new RecordingSink();
        Subscriber unauthenticated = hub.connect(pending);
        Subscriber authenticated = hub.connect(authed);
        authenticated.setAuthenticated(true);

        int delivered = hub.publish(DistributionChannel.SNAPSHOT, Snapshots.full(1L));

        assertFalse(unauthenticated.isAuthenticated());
        assertEquals(1, delivered);
        assertEquals(List.of("connected"), pending.types());
        assertEquals(List.of("connected", "snapshot"), authed.types());
    }

    @Test
    void testPublish_BrokenSinkDoesNotAffectOthers() {
        DistributionHub hub = newHub(false);
        var broken = new RecordingSink();
        var healthy = new RecordingSink();
        hub.connect(broken);
        hub.connect(healthy);
        broken.breakConnection();

        int delivered = hub.publish(DistributionChannel.SNAPSHOT, Snapshots.full(1L));

        assertEquals(1, delivered);
        assertEquals(List.of("connected", "snapshot"), healthy.types());
        // 发送失败不会立即注销，等待连接关闭事件
        assertEquals(2, hub.getSubscriberCount());
    }

    @Test
    void testDisconnectAndCloseAll() {
        DistributionHub hub = newHub(false);
        var first = new RecordingSink();
        var second = new RecordingSink();
        Subscriber subscriber = hub.connect(first);
        hub.connect(second);

        hub.disconnect(subscriber.getId());
        hub.disconnect(subscriber.getId());
        assertEquals(1, hub.getSubscriberCount());
        assertTrue(hub.find(subscriber.getId()).isEmpty());

        hub.closeAll();
        hub.closeAll();
        assertEquals(0, hub.getSubscriberCount());
        assertEquals(1, second.getCloseCount());
        assertEquals(0, first.getCloseCount());
        assertEquals(0, hub.publish(DistributionChannel.SNAPSHOT, Snapshots.full(1L)));
    }
}
