/**
 * WebSocketSessionSink.java
 *
 * 基于 Spring WebSocketSession 的发送端。会话被 ConcurrentWebSocketSessionDecorator 包装，
 * 并发发送会排队到缓冲区，超出发送时间或缓冲区上限时由装饰器关闭会话。
 */
package club.ppmc.hwmon.service.distribution;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Slf4j
public class WebSocketSessionSink implements MessageSink {

    private final WebSocketSession session;

    public WebSocketSessionSink(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("关闭 WebSocket 会话 {} 失败: {}", session.getId(), e.getMessage());
        }
    }
}
