/**
 * ProcessSupervisor.java
 *
 * 录制程序的进程监管器，负责唯一一个录制进程的生命周期。
 * 它持有状态机 (SupervisorState) 和当前进程句柄，对外提供 start / stop / kill / status 控制操作。
 *
 * <p>所有状态变更都在内部锁中完成，锁只在一次状态迁移期间持有，不会跨越进程启动后的运行或等待退出。
 * 启动成功后，为新进程创建 OutputRelay 并在独立线程中运行，输出经 EventBroadcaster 推送给所有观察者。
 * 无论进程是被停止、崩溃还是被信号杀死，状态最终都会恰好一次地回到 Idle。
 *
 * <p>状态事件与状态迁移在同一把锁内发布：运行状态随 Running 一起发出，终止状态随回到 Idle 一起发出。
 * 输出转发线程的事件只在它所属的运行仍是当前运行时才会发布，
 * 因此上一次运行残留的转发线程 (例如子进程继承了输出管道) 不会在新运行期间写入过期的日志或状态。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.exception.SupervisorException;
import club.ppmc.recorder.exception.SupervisorException.ErrorCode;
import club.ppmc.recorder.model.RecorderEvent;
import club.ppmc.recorder.model.RecorderSettings;
import club.ppmc.recorder.model.StatusEvent;
import club.ppmc.recorder.model.SupervisorState;
import club.ppmc.recorder.model.WorkerCommand;
import club.ppmc.recorder.util.WorkerHandle;
import club.ppmc.recorder.util.WorkerLauncher;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.Charset;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ProcessSupervisor {

    private final WorkerEnvironmentResolver environmentResolver;
    private final WorkerLauncher launcher;
    private final EventSink eventSink;
    private final RecorderSettings settings;
    private final Clock clock;
    private final ExecutorService relayExecutor;

    private final Object lock = new Object();
    private volatile SupervisorState state = SupervisorState.IDLE;
    private WorkerHandle currentHandle;
    private OutputRelay currentRelay;

    @Autowired
    public ProcessSupervisor(
            WorkerEnvironmentResolver environmentResolver,
            WorkerLauncher launcher,
            EventBroadcaster broadcaster,
            RecorderSettings settings) {
        this(environmentResolver, launcher, broadcaster, settings, Clock.systemDefaultZone());
    }

    ProcessSupervisor(
            WorkerEnvironmentResolver environmentResolver,
            WorkerLauncher launcher,
            EventSink eventSink,
            RecorderSettings settings,
            Clock clock) {
        this.environmentResolver = environmentResolver;
        this.launcher = launcher;
        this.eventSink = eventSink;
        this.settings = settings;
        this.clock = clock;
        var threadCounter = new AtomicInteger();
        this.relayExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "output-relay-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 启动录制程序。同一时刻只允许一个启动流程，非 Idle 状态下的调用直接返回冲突错误，没有任何副作用。
     *
     * @return 新进程的 PID。
     * @throws SupervisorException CONFLICT / NOT_FOUND / ENVIRONMENT_MISSING / LAUNCH_FAILED。
     */
    public long start() {
        synchronized (lock) {
            if (!(state instanceof SupervisorState.Idle)) {
                log.warn("拒绝启动请求，当前状态: {}", state);
                throw new SupervisorException(ErrorCode.CONFLICT, "录制程序已经在运行中");
            }
            transition(SupervisorState.STARTING);
        }

        WorkerHandle handle;
        try {
            WorkerCommand command = environmentResolver.resolve();
            handle = launcher.launch(command);
        } catch (SupervisorException e) {
            fail(e.getMessage());
            throw e;
        } catch (IOException e) {
            log.error("启动录制程序失败", e);
            fail(e.getMessage());
            throw new SupervisorException(ErrorCode.LAUNCH_FAILED, "启动录制程序失败: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("启动录制程序时发生意外错误", e);
            fail(String.valueOf(e.getMessage()));
            throw e;
        }

        long pid = handle.pid();
        var relay = new OutputRelay(
                handle,
                event -> publishForRun(handle, event),
                Charset.forName(settings.getOutputCharset()),
                clock,
                () -> onWorkerExit(handle));
        synchronized (lock) {
            currentHandle = handle;
            currentRelay = relay;
            transition(new SupervisorState.Running(pid, clock.instant()));
            // 先发布运行状态，再启动输出转发，保证观察者看到的第一条事件是本次运行的开始
            eventSink.publish(StatusEvent.running(pid));
        }
        relayExecutor.execute(relay);
        log.info("录制程序已启动，PID: {}", pid);
        return pid;
    }

    /**
     * 优雅停止录制程序：发送终止信号并在限定时间内等待其退出。
     * 超时后默认不强制结束进程，状态保持 Stopping，待输出转发线程检测到进程退出后再回到 Idle。
     *
     * @throws SupervisorException NOT_RUNNING / STOP_TIMEOUT。
     */
    public void stop() {
        WorkerHandle handle;
        OutputRelay relay;
        synchronized (lock) {
            if (!(state instanceof SupervisorState.Running running)) {
                throw new SupervisorException(ErrorCode.NOT_RUNNING, "录制程序未在运行");
            }
            handle = currentHandle;
            relay = currentRelay;
            transition(new SupervisorState.Stopping(running.pid()));
        }

        log.info("正在停止录制程序，PID: {}", handle.pid());
        handle.terminate();
        boolean exited = awaitExit(handle);
        if (!exited && settings.isForceKillOnTimeout()) {
            log.warn("录制程序 PID {} 未在 {} 秒内退出，强制结束。", handle.pid(), settings.getStopTimeoutSeconds());
            handle.forceKill();
            exited = awaitExit(handle);
        }
        if (!exited) {
            log.warn("录制程序 PID {} 未在 {} 秒内退出。", handle.pid(), settings.getStopTimeoutSeconds());
            throw new SupervisorException(ErrorCode.STOP_TIMEOUT, "等待录制程序退出超时");
        }
        onWorkerExit(handle);
        releaseRelay(relay, handle);
        log.info("录制程序已停止，PID: {}", handle.pid());
    }

    /**
     * 强制结束录制程序。用于优雅停止超时后进程仍未退出的情况，在 Running 和 Stopping 状态下均可调用。
     *
     * @throws SupervisorException NOT_RUNNING / STOP_TIMEOUT。
     */
    public void kill() {
        WorkerHandle handle;
        OutputRelay relay;
        synchronized (lock) {
            if (state instanceof SupervisorState.Running running) {
                transition(new SupervisorState.Stopping(running.pid()));
            } else if (!(state instanceof SupervisorState.Stopping)) {
                throw new SupervisorException(ErrorCode.NOT_RUNNING, "录制程序未在运行");
            }
            handle = currentHandle;
            relay = currentRelay;
        }

        log.warn("正在强制结束录制程序，PID: {}", handle.pid());
        handle.forceKill();
        if (!awaitExit(handle)) {
            throw new SupervisorException(ErrorCode.STOP_TIMEOUT, "等待录制程序退出超时");
        }
        onWorkerExit(handle);
        releaseRelay(relay, handle);
    }

    /**
     * 查询当前状态。只读取状态快照，不加锁，不做任何 I/O。
     */
    public StatusEvent status() {
        return state.toStatusEvent();
    }

    public SupervisorState currentState() {
        return state;
    }

    /**
     * 进程退出后的统一收尾。stop()、kill() 和 OutputRelay 都会调用它；
     * 只有当前持有的句柄才会触发迁移到 Idle 并发布终止状态，因此多次调用只生效一次，过期的回调也不会影响新的运行。
     */
    private void onWorkerExit(WorkerHandle handle) {
        synchronized (lock) {
            if (currentHandle != handle) {
                log.debug("忽略进程 PID {} 的重复或过期退出通知。", handle.pid());
                return;
            }
            currentHandle = null;
            currentRelay = null;
            transition(SupervisorState.IDLE);
            eventSink.publish(StatusEvent.stopped());
        }
        log.info("录制程序 PID {} 已退出，状态已回到 Idle。", handle.pid());
    }

    /**
     * OutputRelay 的事件出口。句柄已不是当前运行时丢弃事件，
     * 转发线程自身发出的终止状态也因此被丢弃，终止状态只由 onWorkerExit 发布。
     */
    private void publishForRun(WorkerHandle handle, RecorderEvent event) {
        synchronized (lock) {
            if (currentHandle != handle) {
                log.debug("丢弃已结束的进程 PID {} 的事件: {}", handle.pid(), event.type());
                return;
            }
            eventSink.publish(event);
        }
    }

    /**
     * 进程已确认退出后，让转发线程停止并关闭输出流，
     * 避免继承了输出管道的子进程让转发线程一直阻塞在读取上。
     */
    private void releaseRelay(OutputRelay relay, WorkerHandle handle) {
        if (relay != null) {
            relay.requestStop();
        }
        try {
            handle.output().close();
        } catch (IOException e) {
            log.warn("关闭进程 PID {} 的输出流失败: {}", handle.pid(), e.getMessage());
        }
    }

    private void fail(String reason) {
        synchronized (lock) {
            transition(new SupervisorState.Failed(reason));
            transition(SupervisorState.IDLE);
        }
        log.warn("录制程序启动失败: {}", reason);
    }

    private boolean awaitExit(WorkerHandle handle) {
        try {
            return handle.waitForExit(Duration.ofSeconds(settings.getStopTimeoutSeconds()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待录制程序 PID {} 退出时线程被中断。", handle.pid());
            return false;
        }
    }

    /**
     * 必须在持有锁时调用。
     */
    private void transition(SupervisorState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("非法的状态迁移: %s -> %s", state, next));
        }
        log.debug("状态变更: {} -> {}", state, next);
        state = next;
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 ProcessSupervisor...");
        WorkerHandle handle;
        synchronized (lock) {
            handle = currentHandle;
        }
        if (handle != null && handle.isAlive()) {
            log.info("服务关闭，终止录制程序 PID {}", handle.pid());
            handle.terminate();
            if (!awaitExit(handle)) {
                handle.forceKill();
            }
        }
        relayExecutor.shutdown();
        try {
            if (!relayExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                relayExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            relayExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
