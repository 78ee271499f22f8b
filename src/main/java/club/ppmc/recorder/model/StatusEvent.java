/**
 * StatusEvent.java
 *
 * 录制程序运行状态的快照。
 * 既作为 WebSocket 推送的状态事件 (Gson 序列化)，也作为 /api/status 的响应体 (Jackson 序列化)，
 * 两边的字段名都与原有前端约定的 is_running 保持一致。
 */
package club.ppmc.recorder.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusEvent(
        @JsonProperty("is_running") @SerializedName("is_running") boolean running,
        @JsonProperty("pid") Long pid)
        implements RecorderEvent {

    public static StatusEvent running(long pid) {
        return new StatusEvent(true, pid);
    }

    public static StatusEvent stopped() {
        return new StatusEvent(false, null);
    }

    @Override
    public String type() {
        return "status";
    }
}
