/**
 * SupervisorException.java
 *
 * 进程监管器的控制操作失败时抛出的运行时异常。
 * 它携带结构化的错误码，Controller 层据此决定 HTTP 状态码并转换为前端友好的响应。
 * 这些错误都不是致命的：抛出时监管器已经回到一个一致的状态。
 */
package club.ppmc.recorder.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public class SupervisorException extends RuntimeException {

    public enum ErrorCode {
        /** 当前状态下不允许该操作，例如重复启动。 */
        CONFLICT,
        /** 找不到录制程序的启动脚本。 */
        NOT_FOUND,
        /** 找不到可用的解释器或运行环境。 */
        ENVIRONMENT_MISSING,
        /** 进程创建失败。 */
        LAUNCH_FAILED,
        /** 录制程序未在运行。 */
        NOT_RUNNING,
        /** 在限定时间内进程没有退出。 */
        STOP_TIMEOUT
    }

    private final ErrorCode errorCode;

    public SupervisorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SupervisorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "error");
        data.put("code", errorCode.name());
        data.put("message", getMessage());
        return data;
    }
}
