/**
 * RecorderEventSocketHandler.java
 *
 * 处理事件推送端点上的 WebSocket 连接和断开。
 * 每个新连接都会作为一个观察者订阅 EventBroadcaster：连接建立时首先收到当前状态快照，
 * 之后实时收到录制程序的日志和状态变化；连接断开或传输出错时取消订阅。
 *
 * <p>会话被包装为 ConcurrentWebSocketSessionDecorator，发送耗时或缓冲超过上限时发送会失败，
 * 该观察者随即被广播中心移除，不会拖慢其他连接。
 */
package club.ppmc.recorder.listener;

import club.ppmc.recorder.model.RecorderEvent;
import club.ppmc.recorder.model.WsEvent;
import club.ppmc.recorder.service.EventBroadcaster;
import club.ppmc.recorder.service.EventObserver;
import com.google.gson.Gson;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class RecorderEventSocketHandler extends TextWebSocketHandler {

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT_BYTES = 512 * 1024;

    private final EventBroadcaster broadcaster;
    private final Gson gson;

    public RecorderEventSocketHandler(EventBroadcaster broadcaster, Gson gson) {
        this.broadcaster = broadcaster;
        this.gson = gson;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("接收到新的 WebSocket 连接，会话 ID: {}，来源: {}", session.getId(), session.getRemoteAddress());
        var decorated = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT_BYTES);
        broadcaster.subscribe(new SessionObserver(decorated));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // 事件流是单向的，客户端发来的消息只记录不处理
        log.debug("忽略会话 {} 发来的消息: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket 会话 {} 传输出错: {}", session.getId(), exception.getMessage());
        broadcaster.unsubscribe(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket 连接断开，会话 ID: {}，状态: {}", session.getId(), status);
        broadcaster.unsubscribe(session.getId());
    }

    /**
     * 把一个 WebSocket 会话适配为广播中心的观察者。
     */
    private final class SessionObserver implements EventObserver {

        private final WebSocketSession session;

        private SessionObserver(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public String id() {
            return session.getId();
        }

        @Override
        public void deliver(RecorderEvent event) throws IOException {
            if (!session.isOpen()) {
                throw new IOException("会话已关闭");
            }
            session.sendMessage(new TextMessage(gson.toJson(WsEvent.of(event))));
        }
    }
}
