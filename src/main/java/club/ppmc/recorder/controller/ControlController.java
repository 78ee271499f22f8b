/**
 * ControlController.java
 *
 * 录制程序的控制接口：启动、停止、强制结束和状态查询。
 * 所有操作都委托给 ProcessSupervisor，监管器抛出的结构化错误在这里转换为对应的 HTTP 状态码。
 */
package club.ppmc.recorder.controller;

import club.ppmc.recorder.exception.SupervisorException;
import club.ppmc.recorder.model.StatusEvent;
import club.ppmc.recorder.service.ProcessSupervisor;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Slf4j
public class ControlController {

    private final ProcessSupervisor processSupervisor;

    public ControlController(ProcessSupervisor processSupervisor) {
        this.processSupervisor = processSupervisor;
    }

    /**
     * 执行控制操作。
     *
     * @param action start、stop 或 kill。
     */
    @PostMapping("/control/{action}")
    public ResponseEntity<Map<String, Object>> control(@PathVariable String action) {
        log.info("收到控制请求: {}", action);
        try {
            switch (action) {
                case "start" -> {
                    long pid = processSupervisor.start();
                    Map<String, Object> body = success(String.format("程序已启动 (PID: %d)", pid));
                    body.put("pid", pid);
                    return ResponseEntity.ok(body);
                }
                case "stop" -> {
                    processSupervisor.stop();
                    return ResponseEntity.ok(success("录制程序已停止"));
                }
                case "kill" -> {
                    processSupervisor.kill();
                    return ResponseEntity.ok(success("录制程序已被强制结束"));
                }
                default -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", "error");
                    body.put("message", "无效的操作");
                    return ResponseEntity.badRequest().body(body);
                }
            }
        } catch (SupervisorException e) {
            log.warn("控制操作 '{}' 失败: [{}] {}", action, e.getErrorCode(), e.getMessage());
            return ResponseEntity.status(statusOf(e.getErrorCode())).body(e.toErrorData());
        }
    }

    /**
     * 获取录制程序状态。
     */
    @GetMapping("/status")
    public ResponseEntity<StatusEvent> status() {
        return ResponseEntity.ok(processSupervisor.status());
    }

    private static Map<String, Object> success(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("message", message);
        return body;
    }

    private static HttpStatus statusOf(SupervisorException.ErrorCode errorCode) {
        return switch (errorCode) {
            case CONFLICT, NOT_RUNNING -> HttpStatus.CONFLICT;
            case STOP_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case NOT_FOUND, ENVIRONMENT_MISSING, LAUNCH_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
