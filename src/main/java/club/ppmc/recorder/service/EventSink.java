/**
 * EventSink.java
 *
 * OutputRelay 和 ProcessSupervisor 发布事件的出口。生产环境中由 EventBroadcaster 实现。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.model.RecorderEvent;

@FunctionalInterface
public interface EventSink {

    /**
     * 发布一个事件。实现不得阻塞调用方，也不得抛出异常。
     */
    void publish(RecorderEvent event);
}
