/**
 * RecorderConsoleApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动录制程序 Web 控制台：进程控制接口、配置编辑接口以及实时日志的 WebSocket 推送。
 */
package club.ppmc.recorder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecorderConsoleApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecorderConsoleApplication.class, args);
    }
}
