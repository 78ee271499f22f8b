/**
 * WebSocketConfig.java
 *
 * 注册推送录制程序实时日志和状态的 WebSocket 端点。
 * 每个连接都是 EventBroadcaster 中的一个观察者，由 RecorderEventSocketHandler 管理其订阅生命周期。
 */
package club.ppmc.recorder.config;

import club.ppmc.recorder.listener.RecorderEventSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String EVENTS_ENDPOINT = "/ws/events";

    private final RecorderEventSocketHandler eventSocketHandler;
    private final AccessGateInterceptor accessGateInterceptor;

    public WebSocketConfig(
            RecorderEventSocketHandler eventSocketHandler, AccessGateInterceptor accessGateInterceptor) {
        this.eventSocketHandler = eventSocketHandler;
        this.accessGateInterceptor = accessGateInterceptor;
    }

    /**
     * <p><b>设计思路</b>:
     * 1. <b>Handshake Interceptor</b>: 握手阶段复用 MVC 的登录校验，未登录的连接直接返回 401。
     * 2. <b>SockJS Fallback</b>: 在不支持WebSocket的浏览器或网络环境中退化为长轮询等方式。
     * 3. <b>SockJS Heartbeat</b>: 每 25 秒发送一个心跳帧，防止反向代理因连接长时间无数据而将其关闭。
     * </p>
     */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(eventSocketHandler, EVENTS_ENDPOINT)
                .addInterceptors(accessGateInterceptor)
                .setAllowedOriginPatterns("*")
                .withSockJS()
                .setHeartbeatTime(25000);
    }
}
