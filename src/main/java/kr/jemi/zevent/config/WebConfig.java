package kr.jemi.zevent.config;

import kr.jemi.zevent.common.web.AdminRateLimitInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AdminRateLimitInterceptor adminRateLimitInterceptor;

    public WebConfig(AdminRateLimitInterceptor adminRateLimitInterceptor) {
        this.adminRateLimitInterceptor = adminRateLimitInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(adminRateLimitInterceptor).addPathPatterns("/admin/**");
    }
}
