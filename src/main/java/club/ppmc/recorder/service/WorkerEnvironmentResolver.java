/**
 * WorkerEnvironmentResolver.java
 *
 * 启动录制程序前的环境校验。
 * 确认启动脚本存在、能找到可执行的解释器，并组装出最终的启动命令和环境变量。
 * 校验失败时抛出带错误码的 SupervisorException，由 ProcessSupervisor 负责状态回退。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.exception.SupervisorException;
import club.ppmc.recorder.exception.SupervisorException.ErrorCode;
import club.ppmc.recorder.model.RecorderSettings;
import club.ppmc.recorder.model.WorkerCommand;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class WorkerEnvironmentResolver {

    private final RecorderSettings settings;
    private final Map<String, String> systemEnvironment;

    @Autowired
    public WorkerEnvironmentResolver(RecorderSettings settings) {
        this(settings, System.getenv());
    }

    WorkerEnvironmentResolver(RecorderSettings settings, Map<String, String> systemEnvironment) {
        this.settings = settings;
        this.systemEnvironment = systemEnvironment;
    }

    /**
     * 校验运行环境并生成启动命令。
     *
     * @return 可以直接交给 WorkerLauncher 的启动命令。
     * @throws SupervisorException 脚本不存在 (NOT_FOUND) 或没有可用的解释器 (ENVIRONMENT_MISSING)。
     */
    public WorkerCommand resolve() {
        Path home = settings.workerHomePath();
        Path script = home.resolve(settings.getWorkerScript()).normalize();
        if (!Files.isRegularFile(script)) {
            throw new SupervisorException(
                    ErrorCode.NOT_FOUND, String.format("找不到录制程序启动脚本 '%s'", script));
        }

        Path interpreter = findInterpreter(home)
                .orElseThrow(() -> new SupervisorException(
                        ErrorCode.ENVIRONMENT_MISSING,
                        "找不到可用的解释器，已尝试: " + String.join(", ", settings.getInterpreters())));
        log.info("使用解释器: {}", interpreter);

        List<String> command = new ArrayList<>();
        command.add(interpreter.toString());
        command.addAll(settings.getInterpreterArgs());
        command.add(script.toString());

        return new WorkerCommand(command, home, buildEnvironment(home));
    }

    private Optional<Path> findInterpreter(Path home) {
        for (String candidate : settings.getInterpreters()) {
            if (!StringUtils.hasText(candidate)) {
                continue;
            }
            Optional<Path> resolved = candidate.contains("/") || candidate.contains(File.separator)
                    ? executable(home.resolve(candidate).normalize())
                    : searchPath(candidate.trim());
            if (resolved.isPresent()) {
                return resolved;
            }
            log.debug("解释器候选 '{}' 不可用。", candidate);
        }
        return Optional.empty();
    }

    private Optional<Path> searchPath(String name) {
        String path = systemEnvironment.get("PATH");
        if (!StringUtils.hasText(path)) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty()) {
                Optional<Path> found = executable(Paths.get(dir, name));
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> executable(Path path) {
        if (Files.isRegularFile(path) && Files.isExecutable(path)) {
            return Optional.of(path.toAbsolutePath());
        }
        return Optional.empty();
    }

    /**
     * 子进程会继承服务自身的环境变量，这里只列出需要追加或覆盖的部分。
     */
    private Map<String, String> buildEnvironment(Path home) {
        Map<String, String> env = new HashMap<>();
        env.put("PYTHONPATH", home.toString());
        String virtualEnv = systemEnvironment.get("VIRTUAL_ENV");
        if (StringUtils.hasText(virtualEnv)) {
            String venvBin = Paths.get(virtualEnv, "bin").toString();
            String path = systemEnvironment.getOrDefault("PATH", "");
            env.put("PATH", path.isEmpty() ? venvBin : venvBin + File.pathSeparator + path);
        }
        return env;
    }
}
