/**
 * SupervisorState.java
 *
 * 进程监管器的状态机。每个 ProcessSupervisor 只持有一个当前状态，
 * 状态只能沿以下路径变化：
 *
 * <pre>
 *   Idle -> Starting -> Running -> Stopping -> Idle
 *   Starting -> Failed -> Idle
 *   Running -> Idle            (输出转发线程检测到进程退出)
 * </pre>
 */
package club.ppmc.recorder.model;

import java.time.Instant;

public sealed interface SupervisorState {

    Idle IDLE = new Idle();
    Starting STARTING = new Starting();

    /**
     * 判断从当前状态能否直接迁移到目标状态。
     */
    boolean canTransitionTo(SupervisorState next);

    /**
     * 将状态投影为对外可见的 {is_running, pid}。
     */
    StatusEvent toStatusEvent();

    record Idle() implements SupervisorState {
        @Override
        public boolean canTransitionTo(SupervisorState next) {
            return next instanceof Starting;
        }

        @Override
        public StatusEvent toStatusEvent() {
            return StatusEvent.stopped();
        }
    }

    record Starting() implements SupervisorState {
        @Override
        public boolean canTransitionTo(SupervisorState next) {
            return next instanceof Running || next instanceof Failed;
        }

        @Override
        public StatusEvent toStatusEvent() {
            return StatusEvent.stopped();
        }
    }

    record Running(long pid, Instant startedAt) implements SupervisorState {
        @Override
        public boolean canTransitionTo(SupervisorState next) {
            return next instanceof Stopping || next instanceof Idle;
        }

        @Override
        public StatusEvent toStatusEvent() {
            return StatusEvent.running(pid);
        }
    }

    /**
     * 已发出终止信号，等待进程退出。进程此时仍然存活，因此对外仍报告为运行中。
     */
    record Stopping(long pid) implements SupervisorState {
        @Override
        public boolean canTransitionTo(SupervisorState next) {
            return next instanceof Idle;
        }

        @Override
        public StatusEvent toStatusEvent() {
            return StatusEvent.running(pid);
        }
    }

    record Failed(String reason) implements SupervisorState {
        @Override
        public boolean canTransitionTo(SupervisorState next) {
            return next instanceof Idle;
        }

        @Override
        public StatusEvent toStatusEvent() {
            return StatusEvent.stopped();
        }
    }
}
