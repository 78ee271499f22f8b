/**
 * LogEvent.java
 *
 * 录制程序输出的一行日志。由 OutputRelay 产生，创建后不可变，广播后即丢弃，不做持久化。
 */
package club.ppmc.recorder.model;

import com.google.gson.annotations.SerializedName;
import java.time.Instant;

/**
 * @param sequenceNumber 在一次运行内严格递增的序号，从 1 开始，每次启动重新计数。
 * @param rawText 从输出流读到的原始行。
 * @param sanitizedText 去除转义序列并去掉首尾空白后的文本，保证非空。
 * @param timestamp 读取到该行的时间。
 */
public record LogEvent(
        @SerializedName("sequence") long sequenceNumber,
        @SerializedName("raw") String rawText,
        @SerializedName("text") String sanitizedText,
        Instant timestamp)
        implements RecorderEvent {

    @Override
    public String type() {
        return "log";
    }
}
