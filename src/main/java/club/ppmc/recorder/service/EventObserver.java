/**
 * EventObserver.java
 *
 * 一个事件接收方，通常对应一个 WebSocket 连接。
 * EventBroadcaster 只管理观察者集合，不拥有其底层传输通道。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.model.RecorderEvent;
import java.io.IOException;

public interface EventObserver {

    /**
     * 观察者的唯一标识，例如 WebSocket 会话 ID。
     */
    String id();

    /**
     * 将事件投递给该观察者。在该观察者专属的投递任务中被串行调用。
     *
     * @throws IOException 投递失败，观察者随后会被移除。
     */
    void deliver(RecorderEvent event) throws IOException;
}
