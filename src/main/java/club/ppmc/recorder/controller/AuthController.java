/**
 * AuthController.java
 *
 * 控制台的登录、退出和登录状态查询接口。该路径不受登录拦截器限制。
 */
package club.ppmc.recorder.controller;

import club.ppmc.recorder.model.LoginRequest;
import club.ppmc.recorder.service.AccessGateService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AccessGateService accessGateService;

    public AuthController(AccessGateService accessGateService) {
        this.accessGateService = accessGateService;
    }

    @PostMapping("/login")
    public ResponseEntity<Map<String, String>> login(
            @Valid @RequestBody LoginRequest loginRequest, HttpServletRequest request) {
        if (accessGateService.login(request, loginRequest.password())) {
            return ResponseEntity.ok(Map.of("status", "success"));
        }
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("status", "error", "message", "密码错误"));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(HttpServletRequest request) {
        accessGateService.logout(request.getSession(false));
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    /**
     * @return authenticated 表示当前会话是否已登录，required 表示是否启用了登录校验。
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Boolean>> status(HttpServletRequest request) {
        return ResponseEntity.ok(Map.of(
                "authenticated", accessGateService.isAuthorized(request.getSession(false)),
                "required", accessGateService.isEnabled()));
    }
}
