/**
 * WebSocketConfig.java
 *
 * 配置订阅端使用的原生 WebSocket 端点。
 * 协议是基于 JSON 文本帧的简单消息协议（auth/subscribe/unsubscribe/ping/get），
 * 不使用 STOMP，因此这里直接注册 TelemetryWebSocketHandler。
 */
package club.ppmc.hwmon.config;

import club.ppmc.hwmon.service.distribution.TelemetryWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TelemetryWebSocketHandler telemetryWebSocketHandler;
    private final String endpoint;

    public WebSocketConfig(
            TelemetryWebSocketHandler telemetryWebSocketHandler,
            @Value("${telemetry.ws.endpoint:/ws}") String endpoint) {
        this.telemetryWebSocketHandler = telemetryWebSocketHandler;
        this.endpoint = endpoint;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(telemetryWebSocketHandler, endpoint)
                .setAllowedOriginPatterns("*");
    }
}
