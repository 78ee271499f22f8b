/**
 * ProcessWorkerHandle.java
 *
 * 基于 {@link Process} 的 WorkerHandle 实现。
 */
package club.ppmc.recorder.util;

import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class ProcessWorkerHandle implements WorkerHandle {

    private final Process process;

    public ProcessWorkerHandle(Process process) {
        this.process = process;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public InputStream output() {
        return process.getInputStream();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void terminate() {
        process.destroy();
    }

    @Override
    public void forceKill() {
        process.destroyForcibly();
    }

    @Override
    public boolean waitForExit(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
