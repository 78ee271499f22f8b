/**
 * WsEvent.java
 *
 * 通过 WebSocket 发送给前端的统一事件包装。
 * 前端根据 'type' 字段分发处理，'data' 为具体的事件内容。
 */
package club.ppmc.recorder.model;

/**
 * @param type 事件类型，"log" 或 "status"。
 * @param data 事件数据。
 * @param <T> 数据负载的类型。
 */
public record WsEvent<T>(String type, T data) {

    public static WsEvent<RecorderEvent> of(RecorderEvent event) {
        return new WsEvent<>(event.type(), event);
    }
}
