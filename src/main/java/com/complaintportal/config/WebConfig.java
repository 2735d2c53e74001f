package com.complaintportal.config;

import com.complaintportal.exception.ErrorMessage;
import com.complaintportal.ratelimit.RateLimitInterceptor;
import com.complaintportal.ratelimit.SlidingWindowRateLimiter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    private final SlidingWindowRateLimiter creationRateLimiter;
    private final SlidingWindowRateLimiter upvoteRateLimiter;

    public WebConfig(@Qualifier("creationRateLimiter") SlidingWindowRateLimiter creationRateLimiter,
                     @Qualifier("upvoteRateLimiter") SlidingWindowRateLimiter upvoteRateLimiter) {
        this.creationRateLimiter = creationRateLimiter;
        this.upvoteRateLimiter = upvoteRateLimiter;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        var registration = registry.addMapping("/**")
                .allowedMethods("GET", "POST", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);

        // "*" reflects the caller's origin
        if (allowedOrigins.length == 1 && "*".equals(allowedOrigins[0])) {
            registration.allowedOriginPatterns("*").allowCredentials(false);
        } else {
            registration.allowedOrigins(allowedOrigins).allowCredentials(false);
        }
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RateLimitInterceptor(creationRateLimiter, HttpMethod.POST,
                        ErrorMessage.TOO_MANY_COMPLAINTS))
                .addPathPatterns("/api/complaints");
        registry.addInterceptor(new RateLimitInterceptor(upvoteRateLimiter, HttpMethod.POST,
                        ErrorMessage.TOO_MANY_UPVOTES))
                .addPathPatterns("/api/complaints/*/upvote");
    }
}
