package club.ppmc.hwmon.service.distribution;

import java.io.IOException;

/**
 * 订阅端连接的发送端抽象，使分发中心与具体传输方式（WebSocket 或测试中的内存实现）解耦。
 */
public interface MessageSink {

    /**
     * 发送一条文本消息。实现不应等待对端确认。
     *
     * @throws IOException 连接已关闭或发送失败。
     */
    void send(String text) throws IOException;

    boolean isOpen();

    /**
     * 关闭连接。对已关闭的连接重复调用不会产生任何效果。
     */
    void close();
}
