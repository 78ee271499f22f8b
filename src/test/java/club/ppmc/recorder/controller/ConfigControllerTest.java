package club.ppmc.recorder.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.recorder.config.AppConfig;
import club.ppmc.recorder.model.RecorderConfigContent;
import club.ppmc.recorder.service.AccessGateService;
import club.ppmc.recorder.service.RecorderConfigService;
import java.io.IOException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ConfigController.class)
@Import(AppConfig.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RecorderConfigService configService;

    @MockitoBean
    private AccessGateService accessGateService;

    @BeforeEach
    void allowAccess() {
        when(accessGateService.isAuthorized(any())).thenReturn(true);
    }

    @Test
    @DisplayName("GET /api/config 返回两个配置文件的内容")
    void getConfig() throws Exception {
        when(configService.read()).thenReturn(new RecorderConfigContent(
                Map.of("录制设置", Map.of("Language", "zh_cn")),
                new RecorderConfigContent.UrlConfig("https://live.douyin.com/1\n")));

        mockMvc.perform(get("/api/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.main_config['录制设置'].Language").value("zh_cn"))
                .andExpect(jsonPath("$.url_config.content").value("https://live.douyin.com/1\n"));
    }

    @Test
    @DisplayName("POST /api/config 保存配置")
    void saveConfig() throws Exception {
        String body = """
                {"main_config": {"录制设置": {"Language": "en"}}, "url_config": {"content": "a\\nb"}}
                """;

        mockMvc.perform(post("/api/config").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        var captor = ArgumentCaptor.forClass(RecorderConfigContent.class);
        verify(configService).save(captor.capture());
        assertThat(captor.getValue().mainConfig().get("录制设置"))
                .containsEntry("Language", "en");
        assertThat(captor.getValue().urlConfig().content()).isEqualTo("a\nb");
    }

    @Test
    @DisplayName("写入失败时返回 400 和错误信息")
    void saveFailure() throws Exception {
        doThrow(new IOException("磁盘已满")).when(configService).save(any());

        mockMvc.perform(post("/api/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url_config\": {\"content\": \"x\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("保存配置失败: 磁盘已满"));
    }
}
