/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean：控制台运行参数 RecorderSettings，以及用于序列化 WebSocket 事件的 Gson。
 */
package club.ppmc.recorder.config;

import club.ppmc.recorder.model.RecorderSettings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class AppConfig {

    /**
     * 从 application.properties 中的 recorder.* 配置构建运行参数。
     * 所有需要这些参数的服务都应依赖此 Bean，而不是各自使用 @Value 注解。
     */
    @Bean
    public RecorderSettings recorderSettings(
            @Value("${recorder.worker.home:.}") String workerHome,
            @Value("${recorder.worker.script:main.py}") String workerScript,
            @Value("${recorder.worker.interpreters:venv/bin/python,/usr/local/bin/python3,/usr/bin/python3,python3}")
                    String[] interpreters,
            @Value("${recorder.worker.interpreter-args:-u}") String[] interpreterArgs,
            @Value("${recorder.worker.output-charset:UTF-8}") String outputCharset,
            @Value("${recorder.worker.stop-timeout-seconds:5}") long stopTimeoutSeconds,
            @Value("${recorder.worker.force-kill-on-timeout:false}") boolean forceKillOnTimeout,
            @Value("${recorder.broadcast.observer-queue-capacity:1000}") int observerQueueCapacity,
            @Value("${recorder.config.dir:config}") String configDir,
            @Value("${recorder.config.main-file:config.ini}") String mainConfigFile,
            @Value("${recorder.config.url-file:URL_config.ini}") String urlConfigFile,
            @Value("${recorder.auth.password:}") String authPassword) {
        var settings = new RecorderSettings();
        settings.setWorkerHome(workerHome);
        settings.setWorkerScript(workerScript);
        settings.setInterpreters(nonBlank(interpreters));
        settings.setInterpreterArgs(nonBlank(interpreterArgs));
        settings.setOutputCharset(outputCharset);
        settings.setStopTimeoutSeconds(stopTimeoutSeconds);
        settings.setForceKillOnTimeout(forceKillOnTimeout);
        settings.setObserverQueueCapacity(observerQueueCapacity);
        settings.setConfigDir(configDir);
        settings.setMainConfigFile(mainConfigFile);
        settings.setUrlConfigFile(urlConfigFile);
        settings.setAuthPassword(authPassword);
        return settings;
    }

    /**
     * 定义一个全局的 Gson Bean，用于将推送给观察者的事件转换为JSON字符串。
     * java.time.Instant 以 ISO-8601 字符串输出。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder()
                .registerTypeAdapter(
                        Instant.class,
                        (JsonSerializer<Instant>) (src, type, context) -> new JsonPrimitive(src.toString()))
                .disableHtmlEscaping()
                .create();
    }

    private static List<String> nonBlank(String[] values) {
        return Arrays.stream(values).map(String::trim).filter(StringUtils::hasText).toList();
    }
}
