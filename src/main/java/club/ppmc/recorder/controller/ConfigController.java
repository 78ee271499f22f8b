/**
 * ConfigController.java
 *
 * 录制程序配置文件的读取和保存接口。
 */
package club.ppmc.recorder.controller;

import club.ppmc.recorder.model.RecorderConfigContent;
import club.ppmc.recorder.service.RecorderConfigService;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/config")
@Slf4j
public class ConfigController {

    private final RecorderConfigService configService;

    public ConfigController(RecorderConfigService configService) {
        this.configService = configService;
    }

    @GetMapping
    public ResponseEntity<RecorderConfigContent> getConfig() {
        return ResponseEntity.ok(configService.read());
    }

    /**
     * 更新配置，请求中未出现的部分保持不变。
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> updateConfig(@RequestBody RecorderConfigContent content) {
        try {
            configService.save(content);
            return ResponseEntity.ok(Map.of("status", "success"));
        } catch (IOException e) {
            log.error("保存配置失败", e);
            return ResponseEntity.badRequest()
                    .body(Map.of("status", "error", "message", "保存配置失败: " + e.getMessage()));
        }
    }
}
