/**
 * RecorderSettings.java
 *
 * 控制台的运行参数。由 AppConfig 根据 application.properties 中 recorder.* 的配置创建，
 * 各服务通过构造函数注入使用。它是一个可变的POJO，测试中可以直接 new 出来修改。
 */
package club.ppmc.recorder.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class RecorderSettings {

    // --- 录制程序 ---
    /**
     * 录制程序所在目录，同时作为进程的工作目录和 PYTHONPATH。
     */
    private String workerHome = ".";

    /**
     * 启动脚本，相对于 workerHome。
     */
    private String workerScript = "main.py";

    /**
     * 解释器候选列表，按顺序查找第一个可执行的。
     * 含路径分隔符的按 workerHome 解析，裸命令名在 PATH 中查找。
     */
    private List<String> interpreters =
            new ArrayList<>(List.of("venv/bin/python", "/usr/local/bin/python3", "/usr/bin/python3", "python3"));

    /**
     * 传给解释器的参数，默认 -u 关闭输出缓冲，保证日志实时到达。
     */
    private List<String> interpreterArgs = new ArrayList<>(List.of("-u"));

    private String outputCharset = "UTF-8";

    private long stopTimeoutSeconds = 5;

    /**
     * 优雅停止超时后是否强制结束进程。默认不强制。
     */
    private boolean forceKillOnTimeout = false;

    // --- 广播 ---
    /**
     * 每个观察者允许积压的事件数，超过即视为投递失败并移除该观察者。
     */
    private int observerQueueCapacity = 1000;

    // --- 配置文件 ---
    private String configDir = "config";
    private String mainConfigFile = "config.ini";
    private String urlConfigFile = "URL_config.ini";

    // --- 访问控制 ---
    /**
     * 控制台密码，为空时不启用登录校验。
     */
    private String authPassword = "";

    public Path workerHomePath() {
        return Paths.get(workerHome).toAbsolutePath().normalize();
    }

    public Path mainConfigPath() {
        return Paths.get(configDir, mainConfigFile).toAbsolutePath().normalize();
    }

    public Path urlConfigPath() {
        return Paths.get(configDir, urlConfigFile).toAbsolutePath().normalize();
    }
}
