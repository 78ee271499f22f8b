/**
 * WorkerCommand.java
 *
 * 启动录制程序所需的全部信息：命令行、工作目录以及需要追加的环境变量。
 * 由 WorkerEnvironmentResolver 在启动前校验环境后生成。
 */
package club.ppmc.recorder.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record WorkerCommand(List<String> command, Path workingDirectory, Map<String, String> environment) {

    public WorkerCommand {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }
}
