package club.ppmc.hwmon.service.alert;

import club.ppmc.hwmon.model.SensorReading;
import club.ppmc.hwmon.model.alert.AlertAction;
import club.ppmc.hwmon.model.alert.AlertActionType;
import club.ppmc.hwmon.model.alert.AlertEvent;
import club.ppmc.hwmon.util.SystemCommandExecutor;
import java.io.File;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 命令动作：通过系统 shell 异步执行配置的命令，不等待其结束。
 * 命令的输出记录在 DEBUG 级别的日志中。
 */
@Component
@Slf4j
public class CommandActionHandler implements AlertActionHandler {

    private static final boolean IS_WINDOWS = System.getProperty("os.name", "").toLowerCase().contains("win");

    private final SystemCommandExecutor commandExecutor;

    public CommandActionHandler(SystemCommandExecutor commandExecutor) {
        this.commandExecutor = commandExecutor;
    }

    @Override
    public AlertActionType type() {
        return AlertActionType.COMMAND;
    }

    @Override
    public void execute(AlertAction action, AlertEvent event, SensorReading reading) {
        String command = action.configString("command");
        if (command == null) {
            log.warn("告警 '{}' 的 command 动作缺少 command，已跳过", event.getAlertName());
            return;
        }
        List<String> shellCommand = IS_WINDOWS ? List.of("cmd", "/c", command) : List.of("sh", "-c", command);
        commandExecutor
                .executeCommand(shellCommand, new File("."), line -> log.debug("[alert-command] {}", line))
                .whenComplete((exitCode, throwable) -> {
                    if (throwable != null) {
                        log.error("告警 '{}' 的命令无法执行", event.getAlertName(), throwable);
                    } else if (exitCode != 0) {
                        log.error("告警 '{}' 的命令执行失败，退出码 {}", event.getAlertName(), exitCode);
                    }
                });
    }
}
