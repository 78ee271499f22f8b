/**
 * OutputRelay.java
 *
 * 把一次运行中录制进程的原始输出流转换为一串清理后的 LogEvent，并在结束时发出终止状态事件。
 *
 * <p>每次启动都会创建一个新的实例，在独立的线程中执行 {@link #run()}，绝不能在处理控制请求的线程中运行。
 * 它逐行读取输出，直到流结束、收到停止请求，或在某次读取后发现进程已经退出为止。
 * 读取出错时只记录日志，按进程正常退出处理：这是进程意外死亡被发现的唯一途径。
 *
 * <p>无论以何种方式结束，都会关闭输出流，先回调监管器的退出处理，再发布唯一的一条
 * {@code StatusEvent{is_running:false}}，它总是本次运行的最后一个事件。
 * 在 ProcessSupervisor 中，事件出口只接受当前运行的事件，终止状态改由监管器在回到 Idle 时发布。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.model.LogEvent;
import club.ppmc.recorder.model.StatusEvent;
import club.ppmc.recorder.util.LineSanitizer;
import club.ppmc.recorder.util.WorkerHandle;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OutputRelay implements Runnable {

    private final WorkerHandle handle;
    private final EventSink sink;
    private final Charset charset;
    private final Clock clock;
    private final Runnable onTermination;

    private volatile boolean stopRequested;
    private long sequence;

    /**
     * @param handle 本次运行的进程句柄。
     * @param sink 事件的发布目标，通常是 EventBroadcaster。
     * @param charset 输出流的字符编码。
     * @param clock 用于生成日志事件的时间戳。
     * @param onTermination 读取结束后、发布终止状态事件之前执行的回调。
     */
    public OutputRelay(
            WorkerHandle handle, EventSink sink, Charset charset, Clock clock, Runnable onTermination) {
        this.handle = handle;
        this.sink = sink;
        this.charset = charset;
        this.clock = clock;
        this.onTermination = onTermination;
    }

    @Override
    public void run() {
        long pid = handle.pid();
        log.info("开始转发进程 PID {} 的输出。", pid);
        try (var reader = new BufferedReader(new InputStreamReader(handle.output(), charset))) {
            String line;
            while (!stopRequested && (line = reader.readLine()) != null) {
                relayLine(line);
                if (!handle.isAlive()) {
                    // 进程已退出，不再阻塞读取，只把管道中已缓冲的输出转发完
                    while (reader.ready() && (line = reader.readLine()) != null) {
                        relayLine(line);
                    }
                    log.info("检测到进程 PID {} 已退出。", pid);
                    break;
                }
            }
        } catch (IOException e) {
            log.warn("读取进程 PID {} 的输出时出错，按进程退出处理: {}", pid, e.getMessage());
        } finally {
            try {
                onTermination.run();
            } catch (RuntimeException e) {
                log.error("处理进程 PID {} 的退出时出错", pid, e);
            }
            sink.publish(StatusEvent.stopped());
            log.info("进程 PID {} 的输出转发已结束，共转发 {} 行。", pid, sequence);
        }
    }

    /**
     * 请求在下一次读取后停止转发。不会打断正在阻塞的读取，需要配合关闭输出流使用。
     */
    public void requestStop() {
        stopRequested = true;
    }

    private void relayLine(String rawLine) {
        String text = LineSanitizer.sanitize(rawLine).strip();
        if (text.isEmpty()) {
            return;
        }
        log.debug("进程输出: {}", text);
        sink.publish(new LogEvent(++sequence, rawLine, text, clock.instant()));
    }
}
