/**
 * AccessGateInterceptor.java
 *
 * 同时作为 MVC 拦截器和 WebSocket 握手拦截器，未登录的请求一律返回 401。
 * 登录相关接口 (/api/auth/**) 在 WebConfig 中被排除在外。
 */
package club.ppmc.recorder.config;

import club.ppmc.recorder.service.AccessGateService;
import com.google.gson.Gson;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

@Component
@Slf4j
public class AccessGateInterceptor implements HandlerInterceptor, HandshakeInterceptor {

    private static final Map<String, String> UNAUTHORIZED_BODY =
            Map.of("status", "error", "message", "未登录或会话已过期");

    private final AccessGateService accessGateService;
    private final Gson gson;

    public AccessGateInterceptor(AccessGateService accessGateService, Gson gson) {
        this.accessGateService = accessGateService;
        this.gson = gson;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        if (accessGateService.isAuthorized(request.getSession(false))) {
            return true;
        }
        log.debug("拒绝未登录的请求: {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(gson.toJson(UNAUTHORIZED_BODY));
        return false;
    }

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        HttpSession session = request instanceof ServletServerHttpRequest servletRequest
                ? servletRequest.getServletRequest().getSession(false)
                : null;
        if (accessGateService.isAuthorized(session)) {
            return true;
        }
        log.debug("拒绝未登录的 WebSocket 握手: {}", request.getURI());
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        return false;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request, ServerHttpResponse response, WebSocketHandler wsHandler, Exception exception) {}
}
