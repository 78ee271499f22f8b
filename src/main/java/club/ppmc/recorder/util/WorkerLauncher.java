/**
 * WorkerLauncher.java
 *
 * 对进程创建的抽象，便于在测试中替换为不启动真实进程的实现。
 */
package club.ppmc.recorder.util;

import club.ppmc.recorder.model.WorkerCommand;
import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {

    /**
     * 按给定命令启动录制进程。
     *
     * @param command 已校验过的启动命令。
     * @return 新进程的句柄。
     * @throws IOException 进程无法创建时抛出。
     */
    WorkerHandle launch(WorkerCommand command) throws IOException;
}
