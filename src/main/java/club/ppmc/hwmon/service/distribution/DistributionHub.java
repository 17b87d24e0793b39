/**
 * DistributionHub.java
 *
 * 实时分发中心：维护所有已连接订阅端的注册表，并把快照、读数、告警等事件广播给订阅了对应频道的订阅端。
 * 广播时每个订阅端独立发送，一个连接的发送失败或阻塞不会影响其他连接；
 * 发送失败的连接不会在广播过程中被移除，而是等待连接关闭事件自然清理。
 * 不提供投递保证，也不支持断线重连后的补发。
 */
package club.ppmc.hwmon.service.distribution;

import club.ppmc.hwmon.service.SettingsService;
import com.google.gson.Gson;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DistributionHub {

    /** 新连接默认订阅的频道。 */
    static final String DEFAULT_CHANNEL = DistributionChannel.SNAPSHOT.getChannelName();

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final SettingsService settingsService;
    private final Gson gson;
    private final Clock clock;

    public DistributionHub(SettingsService settingsService, Gson gson, Clock clock) {
        this.settingsService = settingsService;
        this.gson = gson;
        this.clock = clock;
    }

    /**
     * 注册一个新连接，并向其发送 connected 消息。
     * 全局未启用鉴权时，新订阅端直接视为已鉴权。
     */
    public Subscriber connect(MessageSink sink) {
        String id = UUID.randomUUID().toString();
        boolean authenticated = !settingsService.getSettings().isEnableAuth();
        var subscriber = new Subscriber(id, sink, authenticated);
        subscriber.subscribe(List.of(DEFAULT_CHANNEL));
        subscribers.put(id, subscriber);
        log.info("订阅端已连接: {} (当前连接数 {})", id, subscribers.size());

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "connected");
        message.put("clientId", id);
        message.put("timestamp", clock.millis());
        sendTo(subscriber, message);
        return subscriber;
    }

    public void disconnect(String subscriberId) {
        if (subscriberId != null && subscribers.remove(subscriberId) != null) {
            log.info("订阅端已断开: {} (当前连接数 {})", subscriberId, subscribers.size());
        }
    }

    public Optional<Subscriber> find(String subscriberId) {
        return Optional.ofNullable(subscriberId).map(subscribers::get);
    }

    public Collection<Subscriber> getSubscribers() {
        return List.copyOf(subscribers.values());
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * 向频道推送一个事件，消息类型取频道的默认类型。
     *
     * @return 成功投递的订阅端数量。
     */
    public int publish(DistributionChannel channel, Object payload) {
        return publish(channel, channel.getMessageType(), payload);
    }

    /**
     * 向频道推送一个指定类型的事件。消息只序列化一次，然后逐个发送给已鉴权且订阅了该频道的订阅端。
     *
     * @return 成功投递的订阅端数量。
     */
    public int publish(DistributionChannel channel, String messageType, Object payload) {
        if (subscribers.isEmpty()) {
            return 0;
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", messageType);
        message.put("data", payload);
        String text = gson.toJson(message);

        int delivered = 0;
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.isAuthenticated() && subscriber.isSubscribedTo(channel.getChannelName())) {
                if (deliver(subscriber, text)) {
                    delivered++;
                }
            }
        }
        return delivered;
    }

    /**
     * 只向一个订阅端发送消息，用于请求的回复。
     */
    public boolean sendTo(Subscriber subscriber, Map<String, Object> message) {
        return deliver(subscriber, gson.toJson(message));
    }

    /**
     * 关闭所有连接并清空注册表。可以重复调用。
     */
    public void closeAll() {
        if (subscribers.isEmpty()) {
            return;
        }
        log.info("正在关闭 {} 个订阅端连接", subscribers.size());
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            try {
                subscriber.getSink().close();
            } catch (RuntimeException e) {
                log.debug("关闭订阅端 {} 时出错", subscriber.getId(), e);
            }
        }
        subscribers.clear();
    }

    private boolean deliver(Subscriber subscriber, String text) {
        MessageSink sink = subscriber.getSink();
        if (!sink.isOpen()) {
            return false;
        }
        try {
            sink.send(text);
            return true;
        } catch (Exception e) {
            // 连接已损坏：只记录，由连接关闭事件负责移除
            log.debug("向订阅端 {} 发送消息失败: {}", subscriber.getId(), e.getMessage());
            return false;
        }
    }
}
