/**
 * Subscriber.java
 *
 * 分发中心中每个已连接订阅端的记录：标识、已订阅的频道集合、鉴权状态以及发送端。
 */
package club.ppmc.hwmon.service.distribution;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.Setter;

@Getter
public class Subscriber {

    private final String id;
    private final MessageSink sink;
    private final Set<String> channels = ConcurrentHashMap.newKeySet();

    @Setter
    private volatile boolean authenticated;

    public Subscriber(String id, MessageSink sink, boolean authenticated) {
        this.id = id;
        this.sink = sink;
        this.authenticated = authenticated;
    }

    public boolean isSubscribedTo(String channel) {
        return channels.contains(channel);
    }

    public void subscribe(List<String> names) {
        channels.addAll(names);
    }

    public void unsubscribe(List<String> names) {
        names.forEach(channels::remove);
    }

    /**
     * 以排序后的列表形式返回当前订阅，便于回复给客户端。
     */
    public List<String> channelList() {
        return channels.stream().sorted().toList();
    }
}
