/**
 * ProcessWorkerLauncher.java
 *
 * 使用 ProcessBuilder 启动录制进程的默认实现。
 * 错误流重定向到标准输出流，使两者按产生顺序合并为一个输出流交给 OutputRelay 读取。
 */
package club.ppmc.recorder.util;

import club.ppmc.recorder.model.WorkerCommand;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    @Override
    public WorkerHandle launch(WorkerCommand command) throws IOException {
        LOGGER.info(
                "在目录 {} 中启动录制程序: {}",
                command.workingDirectory(),
                String.join(" ", command.command()));

        var processBuilder =
                new ProcessBuilder(command.command())
                        .directory(command.workingDirectory().toFile())
                        .redirectErrorStream(true);
        processBuilder.environment().putAll(command.environment());

        Process process = processBuilder.start();
        LOGGER.info("录制程序已启动，PID: {}", process.pid());
        return new ProcessWorkerHandle(process);
    }
}
