/**
 * RecorderEvent.java
 *
 * 推送给观察者的事件的公共类型。
 * 只有两种事件：录制程序的一行输出 (LogEvent) 和运行状态变化 (StatusEvent)。
 */
package club.ppmc.recorder.model;

public sealed interface RecorderEvent permits LogEvent, StatusEvent {

    /**
     * 事件类型标识，前端根据它分发处理逻辑 ("log" 或 "status")。
     */
    String type();
}
