/**
 * AccessGateService.java
 *
 * 控制台的简单密码校验。
 * 未配置密码时不启用校验；配置后，登录成功会在 HTTP 会话中记录一个标志，
 * 之后的 API 请求和 WebSocket 握手都依据该标志放行。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.model.RecorderSettings;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class AccessGateService {

    static final String SESSION_FLAG = "recorder.authenticated";

    private final byte[] password;

    public AccessGateService(RecorderSettings settings) {
        String configured = settings.getAuthPassword();
        this.password = StringUtils.hasText(configured) ? configured.getBytes(StandardCharsets.UTF_8) : null;
        if (this.password == null) {
            log.warn("未配置 recorder.auth.password，控制台不启用登录校验。");
        }
    }

    public boolean isEnabled() {
        return password != null;
    }

    /**
     * 校验密码，成功时更换会话 ID 并在会话中记录登录标志，防止会话固定攻击。
     *
     * @return 密码正确 (或未启用校验) 时返回 true。
     */
    public boolean login(HttpServletRequest request, String candidate) {
        if (!isEnabled()) {
            return true;
        }
        byte[] given = candidate == null ? new byte[0] : candidate.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(password, given)) {
            log.warn("来自 {} 的登录失败：密码错误。", request.getRemoteAddr());
            return false;
        }
        HttpSession session = request.getSession(true);
        String newSessionId = request.changeSessionId();
        session.setAttribute(SESSION_FLAG, Boolean.TRUE);
        log.info("来自 {} 的登录成功，新会话 ID: {}", request.getRemoteAddr(), newSessionId);
        return true;
    }

    public void logout(HttpSession session) {
        if (session != null) {
            log.info("会话 {} 已退出登录。", session.getId());
            session.invalidate();
        }
    }

    /**
     * @param session 当前请求的会话，可以为 null。
     */
    public boolean isAuthorized(HttpSession session) {
        return !isEnabled() || (session != null && Boolean.TRUE.equals(session.getAttribute(SESSION_FLAG)));
    }
}
