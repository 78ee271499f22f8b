/**
 * LoginRequest.java
 *
 * 控制台登录请求。
 */
package club.ppmc.recorder.model;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(@NotBlank(message = "密码不能为空") String password) {}
