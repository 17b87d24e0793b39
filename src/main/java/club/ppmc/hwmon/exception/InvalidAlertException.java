/**
 * InvalidAlertException.java
 *
 * 一个自定义的运行时异常，表示告警规则的定义不合法。
 * AlertService 在创建或更新规则时进行校验，失败即抛出此异常，非法规则永远不会被保存。
 * 它携带了结构化的错误信息，以便 Controller 层可以将其转换为对前端友好的响应。
 */
package club.ppmc.hwmon.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

@Getter
public class InvalidAlertException extends RuntimeException {

    /** 所有校验失败的描述，每条对应一个问题。 */
    private final List<String> violations;

    public InvalidAlertException(List<String> violations) {
        super("告警规则无效: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "INVALID_ALERT",
                "message", getMessage(),
                "violations", violations);
    }
}
