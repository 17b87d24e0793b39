/**
 * SystemCommandExecutor.java
 *
 * 这是一个工具类，负责以跨平台、安全的方式执行外部系统命令。
 * 它接受一个命令列表（而不是单个字符串）以避免因参数中存在空格而导致的解析问题。
 * 传感器适配器用它同步读取 nvidia-smi、sensors 等工具的输出；告警的 command 动作用它异步执行用户命令。
 */
package club.ppmc.hwmon.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SystemCommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCommandExecutor.class);

    /**
     * 命令的执行结果。
     *
     * @param exitCode 进程退出码，超时时为 -1。
     * @param output   标准输出与错误输出合并后的全部内容。
     */
    public record CommandResult(int exitCode, String output) {
        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * 同步执行一个命令并收集其全部输出。
     *
     * @param commandList 要执行的命令及其参数列表 (e.g., ["sensors", "-j"])。
     * @param timeout     最长等待时间，超时后进程会被强制终止。
     * @return 命令的执行结果。
     * @throws IOException 命令无法启动（例如可执行文件不存在）。
     * @throws InterruptedException 等待过程中线程被中断。
     */
    public CommandResult run(List<String> commandList, Duration timeout)
            throws IOException, InterruptedException {
        if (commandList == null || commandList.isEmpty()) {
            throw new IllegalArgumentException("执行的命令不能为空");
        }
        LOGGER.debug("执行命令: {}", String.join(" ", commandList));

        var process = new ProcessBuilder(commandList).redirectErrorStream(true).start();
        var outputFuture = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            LOGGER.warn("命令 {} 在 {} ms 内未完成，已强制终止", commandList.get(0), timeout.toMillis());
            return new CommandResult(-1, "");
        }
        return new CommandResult(process.exitValue(), outputFuture.join());
    }

    /**
     * 异步执行一个系统命令，并实时流式传输其标准输出和错误流。
     *
     * @param commandList 要执行的命令及其参数列表。
     * @param workingDirectory 命令执行的工作目录。
     * @param outputConsumer 一个消费者，用于处理命令输出的每一行。
     * @return 一个CompletableFuture，当命令执行完毕时完成，其值为进程的退出码。
     */
    public CompletableFuture<Integer> executeCommand(
            List<String> commandList, File workingDirectory, Consumer<String> outputConsumer) {
        return CompletableFuture.supplyAsync(
                () -> {
                    if (commandList == null || commandList.isEmpty()) {
                        outputConsumer.accept("致命错误: 执行的命令不能为空。");
                        return -1;
                    }
                    try {
                        LOGGER.info(
                                "在目录 {} 中执行命令: {}",
                                workingDirectory.getAbsolutePath(),
                                String.join(" ", commandList));

                        var process =
                                new ProcessBuilder(commandList)
                                        .directory(workingDirectory)
                                        .redirectErrorStream(true)
                                        .start();

                        try (var reader = new BufferedReader(
                                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                            reader.lines().forEach(outputConsumer);
                        }

                        int exitCode = process.waitFor();
                        LOGGER.info("命令执行完毕，退出码: {}", exitCode);
                        return exitCode;

                    } catch (IOException | InterruptedException e) {
                        LOGGER.error("执行命令 {} 时出错", commandList, e);
                        outputConsumer.accept("致命错误: 命令执行失败。 " + e.getMessage());
                        if (e instanceof InterruptedException) {
                            Thread.currentThread().interrupt(); // 重新设置中断状态
                        }
                        return -1;
                    }
                });
    }

    private static String readAll(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            LOGGER.warn("读取命令输出失败", e);
            return "";
        }
    }
}
