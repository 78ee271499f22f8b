/**
 * WebConfig.java
 *
 * 全局的Spring Web MVC配置。
 * 负责跨域资源共享 (CORS)，并为 /api/** 注册登录校验拦截器。
 */
package club.ppmc.recorder.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AccessGateInterceptor accessGateInterceptor;

    public WebConfig(AccessGateInterceptor accessGateInterceptor) {
        this.accessGateInterceptor = accessGateInterceptor;
    }

    /**
     * 使用 allowedOriginPatterns("*") 而不是 allowedOrigins("*")，
     * 因为后者不能与 allowCredentials(true) 同时使用，而登录状态依赖会话 Cookie。
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns("*")
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(accessGateInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/auth/**");
    }
}
