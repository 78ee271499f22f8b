/**
 * WorkerHandle.java
 *
 * 对一个正在运行的录制进程的抽象。
 * 由 ProcessSupervisor 独占持有；进程确认退出后即被丢弃。
 * 生产实现是 ProcessWorkerHandle，测试中可以提供受控的假实现。
 */
package club.ppmc.recorder.util;

import java.io.InputStream;
import java.time.Duration;

public interface WorkerHandle {

    long pid();

    /**
     * 进程的合并输出流 (stdout 与 stderr)。
     */
    InputStream output();

    boolean isAlive();

    /**
     * 发送优雅终止信号 (SIGTERM)。
     */
    void terminate();

    /**
     * 强制结束进程 (SIGKILL)。
     */
    void forceKill();

    /**
     * 最多等待给定时长，直到进程退出。
     *
     * @return 进程在超时前退出则返回 true。
     * @throws InterruptedException 等待过程中线程被中断。
     */
    boolean waitForExit(Duration timeout) throws InterruptedException;
}
