/**
 * ProcessData.java
 *
 * 单个进程的资源占用。快照中只保留 CPU 占用最高的若干个进程。
 */
package club.ppmc.hwmon.model.snapshot;

/**
 * @param pid        进程号。
 * @param parentPid  父进程号。
 * @param name       进程名。
 * @param cpu        两次采集之间的 CPU 占用 (%，相对全部逻辑核)。
 * @param mem        常驻内存占物理内存的比例 (%)。
 * @param memRss     常驻内存 (字节)。
 * @param memVsz     虚拟内存 (字节)。
 * @param priority   优先级。
 * @param state      进程状态。
 * @param user       所属用户。
 * @param command    命令行。
 * @param path       可执行文件路径。
 * @param started    启动时间 (毫秒)。
 */
public record ProcessData(
        int pid,
        int parentPid,
        String name,
        double cpu,
        double mem,
        long memRss,
        long memVsz,
        int priority,
        String state,
        String user,
        String command,
        String path,
        long started) {
}
