/**
 * TelemetryWebSocketHandler.java
 *
 * 订阅端 WebSocket 处理器：连接建立时在分发中心注册订阅端，收到的文本消息交给
 * SubscriberProtocolService 处理，连接关闭或传输出错时注销订阅端。
 */
package club.ppmc.hwmon.service.distribution;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class TelemetryWebSocketHandler extends TextWebSocketHandler {

    private static final String SUBSCRIBER_ID = "subscriberId";

    private final DistributionHub distributionHub;
    private final SubscriberProtocolService protocolService;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final Map<String, Subscriber> sessions = new ConcurrentHashMap<>();

    public TelemetryWebSocketHandler(
            DistributionHub distributionHub,
            SubscriberProtocolService protocolService,
            @Value("${telemetry.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${telemetry.ws.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.distributionHub = distributionHub;
        this.protocolService = protocolService;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("WebSocket 连接建立: {} ({})", session.getId(), session.getRemoteAddress());
        Subscriber subscriber = distributionHub.connect(
                new WebSocketSessionSink(session, sendTimeLimitMs, bufferSizeLimit));
        session.getAttributes().put(SUBSCRIBER_ID, subscriber.getId());
        sessions.put(session.getId(), subscriber);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Subscriber subscriber = sessions.get(session.getId());
        if (subscriber == null) {
            log.warn("收到未注册会话 {} 的消息，已忽略", session.getId());
            return;
        }
        protocolService.handle(subscriber, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket 传输错误: {} - {}", session.getId(), exception.getMessage());
        unregister(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket 连接关闭: {}, 状态: {}", session.getId(), status);
        unregister(session);
    }

    private void unregister(WebSocketSession session) {
        Subscriber subscriber = sessions.remove(session.getId());
        if (subscriber != null) {
            distributionHub.disconnect(subscriber.getId());
        }
    }
}
