package club.ppmc.recorder.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.recorder.model.LogEvent;
import club.ppmc.recorder.model.RecorderEvent;
import club.ppmc.recorder.model.StatusEvent;
import club.ppmc.recorder.util.WorkerHandle;
import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OutputRelayTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private List<RecorderEvent> published;
    private List<String> trace;
    private EventSink sink;

    @BeforeEach
    void setUp() {
        published = new CopyOnWriteArrayList<>();
        trace = new CopyOnWriteArrayList<>();
        sink = event -> {
            published.add(event);
            trace.add(event.type());
        };
    }

    private OutputRelay relayFor(WorkerHandle handle) {
        return new OutputRelay(handle, sink, StandardCharsets.UTF_8, clock, () -> trace.add("terminated"));
    }

    private List<LogEvent> logEvents() {
        return published.stream().filter(LogEvent.class::isInstance).map(LogEvent.class::cast).toList();
    }

    @Nested
    @DisplayName("日志转发")
    class Relaying {

        @Test
        @DisplayName("清理后的每一行按顺序发布，序号从 1 开始连续递增")
        void publishesSanitizedLinesInOrder() {
            var handle = new StreamHandle("A\n\u001B[31mB\u001B[0m\n  C  \r\n", true);

            relayFor(handle).run();

            assertThat(logEvents()).extracting(LogEvent::sanitizedText).containsExactly("A", "B", "C");
            assertThat(logEvents()).extracting(LogEvent::sequenceNumber).containsExactly(1L, 2L, 3L);
            assertThat(logEvents().get(1).rawText()).isEqualTo("\u001B[31mB\u001B[0m");
            assertThat(logEvents()).extracting(LogEvent::timestamp).containsOnly(NOW);
        }

        @Test
        @DisplayName("清理后为空的行不发布，也不占用序号")
        void skipsLinesThatSanitizeToEmpty() {
            var handle = new StreamHandle("\u001B[2K\n\n   \nreal\n\u001B[0m\u001B[?25h\nnext\n", true);

            relayFor(handle).run();

            assertThat(logEvents()).extracting(LogEvent::sanitizedText).containsExactly("real", "next");
            assertThat(logEvents()).extracting(LogEvent::sequenceNumber).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("进程退出后把管道中已缓冲的输出转发完再结束")
        void drainsBufferedOutputAfterExit() {
            var handle = new StreamHandle("first\nsecond\nthird\n", false);

            relayFor(handle).run();

            assertThat(logEvents()).extracting(LogEvent::sanitizedText).containsExactly("first", "second", "third");
            assertThat(published.get(published.size() - 1)).isEqualTo(StatusEvent.stopped());
        }

        @Test
        @DisplayName("按配置的字符集解码输出")
        void decodesWithConfiguredCharset() {
            var handle = new StreamHandle(new ByteArrayInputStream("直播".getBytes(StandardCharsets.UTF_16BE)), true);

            new OutputRelay(handle, sink, StandardCharsets.UTF_16BE, clock, () -> {}).run();

            assertThat(logEvents()).extracting(LogEvent::sanitizedText).containsExactly("直播");
        }
    }

    @Nested
    @DisplayName("结束处理")
    class Termination {

        @Test
        @DisplayName("正常结束时先回调退出处理，再发布唯一的终止状态")
        void callbackRunsBeforeTerminalStatus() {
            var handle = new StreamHandle("A\n", true);

            relayFor(handle).run();

            assertThat(trace).containsExactly("log", "terminated", "status");
            assertThat(published.get(1)).isEqualTo(StatusEvent.stopped());
            assertThat(handle.closed.get()).isTrue();
        }

        @Test
        @DisplayName("读取出错时按进程退出处理，依然发布终止状态并关闭流")
        void readErrorStillTerminates() {
            var closed = new AtomicBoolean(false);
            InputStream failing = new InputStream() {
                private int reads;

                @Override
                public int read() throws IOException {
                    throw new IOException("管道已断开");
                }

                @Override
                public int read(byte[] b, int off, int len) throws IOException {
                    if (reads++ == 0) {
                        byte[] line = "partial\n".getBytes(StandardCharsets.UTF_8);
                        System.arraycopy(line, 0, b, off, line.length);
                        return line.length;
                    }
                    throw new IOException("管道已断开");
                }

                @Override
                public void close() {
                    closed.set(true);
                }
            };
            var handle = new StreamHandle(failing, true);

            relayFor(handle).run();

            assertThat(trace).containsExactly("log", "terminated", "status");
            assertThat(published.get(published.size() - 1)).isEqualTo(StatusEvent.stopped());
            assertThat(closed.get()).isTrue();
        }

        @Test
        @DisplayName("退出回调抛出异常时仍发布终止状态")
        void terminalStatusSurvivesFailingCallback() {
            var handle = new StreamHandle("", true);

            new OutputRelay(handle, sink, StandardCharsets.UTF_8, clock, () -> {
                        throw new IllegalStateException("回调失败");
                    })
                    .run();

            assertThat(published).containsExactly(StatusEvent.stopped());
        }

        @Test
        @DisplayName("没有任何输出的运行只发布一条终止状态")
        void emptyOutputPublishesOnlyTerminalStatus() {
            relayFor(new StreamHandle("", true)).run();

            assertThat(published).containsExactly(StatusEvent.stopped());
        }

        @Test
        @DisplayName("收到停止请求后不再继续读取")
        void requestStopEndsRelayBeforeNextRead() throws InterruptedException {
            var handle = new FakeWorkerHandle(77, "one\n");
            var relay = relayFor(handle);
            relay.requestStop();

            var thread = new Thread(relay);
            thread.start();
            thread.join(Duration.ofSeconds(5).toMillis());

            assertThat(thread.isAlive()).isFalse();
            assertThat(logEvents()).isEmpty();
            assertThat(published).containsExactly(StatusEvent.stopped());
            assertThat(handle.streamClosed()).isTrue();
        }
    }

    /**
     * 输出为固定内容的进程句柄。
     */
    private static final class StreamHandle implements WorkerHandle {

        private final InputStream output;
        private final boolean alive;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        StreamHandle(String text, boolean alive) {
            this(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), alive);
        }

        StreamHandle(InputStream source, boolean alive) {
            this.alive = alive;
            this.output = new FilterInputStream(source) {
                @Override
                public void close() throws IOException {
                    closed.set(true);
                    super.close();
                }
            };
        }

        @Override
        public long pid() {
            return 1234;
        }

        @Override
        public InputStream output() {
            return output;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public void terminate() {}

        @Override
        public void forceKill() {}

        @Override
        public boolean waitForExit(Duration timeout) {
            return true;
        }
    }
}
