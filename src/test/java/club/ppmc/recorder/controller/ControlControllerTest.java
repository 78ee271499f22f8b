package club.ppmc.recorder.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.recorder.config.AppConfig;
import club.ppmc.recorder.exception.SupervisorException;
import club.ppmc.recorder.exception.SupervisorException.ErrorCode;
import club.ppmc.recorder.model.StatusEvent;
import club.ppmc.recorder.service.AccessGateService;
import club.ppmc.recorder.service.ProcessSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ControlController.class)
@Import(AppConfig.class)
class ControlControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProcessSupervisor processSupervisor;

    @MockitoBean
    private AccessGateService accessGateService;

    @BeforeEach
    void allowAccess() {
        when(accessGateService.isAuthorized(any())).thenReturn(true);
    }

    @Nested
    @DisplayName("POST /api/control/{action}")
    class Control {

        @Test
        @DisplayName("start 成功时返回 PID")
        void start() throws Exception {
            when(processSupervisor.start()).thenReturn(4321L);

            mockMvc.perform(post("/api/control/start"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("success"))
                    .andExpect(jsonPath("$.pid").value(4321))
                    .andExpect(jsonPath("$.message").value("程序已启动 (PID: 4321)"));
        }

        @Test
        @DisplayName("重复启动返回 409 和错误码")
        void startConflict() throws Exception {
            when(processSupervisor.start())
                    .thenThrow(new SupervisorException(ErrorCode.CONFLICT, "录制程序已经在运行中"));

            mockMvc.perform(post("/api/control/start"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.status").value("error"))
                    .andExpect(jsonPath("$.code").value("CONFLICT"))
                    .andExpect(jsonPath("$.message").value("录制程序已经在运行中"));
        }

        @Test
        @DisplayName("环境缺失返回 500")
        void startEnvironmentMissing() throws Exception {
            when(processSupervisor.start())
                    .thenThrow(new SupervisorException(ErrorCode.ENVIRONMENT_MISSING, "找不到可用的解释器"));

            mockMvc.perform(post("/api/control/start"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.code").value("ENVIRONMENT_MISSING"));
        }

        @Test
        @DisplayName("stop 成功")
        void stop() throws Exception {
            mockMvc.perform(post("/api/control/stop"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("success"));

            verify(processSupervisor).stop();
        }

        @Test
        @DisplayName("未运行时 stop 返回 409")
        void stopNotRunning() throws Exception {
            doThrow(new SupervisorException(ErrorCode.NOT_RUNNING, "录制程序未在运行"))
                    .when(processSupervisor)
                    .stop();

            mockMvc.perform(post("/api/control/stop"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("NOT_RUNNING"));
        }

        @Test
        @DisplayName("停止超时返回 504")
        void stopTimeout() throws Exception {
            doThrow(new SupervisorException(ErrorCode.STOP_TIMEOUT, "等待录制程序退出超时"))
                    .when(processSupervisor)
                    .stop();

            mockMvc.perform(post("/api/control/stop"))
                    .andExpect(status().isGatewayTimeout())
                    .andExpect(jsonPath("$.code").value("STOP_TIMEOUT"));
        }

        @Test
        @DisplayName("kill 委托给监管器")
        void kill() throws Exception {
            mockMvc.perform(post("/api/control/kill")).andExpect(status().isOk());

            verify(processSupervisor).kill();
        }

        @Test
        @DisplayName("未知操作返回 400，不调用监管器")
        void unknownAction() throws Exception {
            mockMvc.perform(post("/api/control/restart"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("无效的操作"));

            verifyNoInteractions(processSupervisor);
        }
    }

    @Nested
    @DisplayName("GET /api/status")
    class Status {

        @Test
        @DisplayName("运行中时返回 is_running 和 pid")
        void running() throws Exception {
            when(processSupervisor.status()).thenReturn(StatusEvent.running(99));

            mockMvc.perform(get("/api/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.is_running").value(true))
                    .andExpect(jsonPath("$.pid").value(99));
        }

        @Test
        @DisplayName("未运行时不输出 pid")
        void stopped() throws Exception {
            when(processSupervisor.status()).thenReturn(StatusEvent.stopped());

            mockMvc.perform(get("/api/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.is_running").value(false))
                    .andExpect(jsonPath("$.pid").doesNotExist());
        }
    }

    @Test
    @DisplayName("未登录的请求返回 401，不会到达监管器")
    void rejectsUnauthorized() throws Exception {
        when(accessGateService.isAuthorized(any())).thenReturn(false);

        mockMvc.perform(post("/api/control/start"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("未登录或会话已过期"));

        verify(processSupervisor, never()).start();
    }
}
