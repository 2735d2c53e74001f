package com.complaintportal.ratelimit;

import com.complaintportal.exception.ErrorMessage;
import com.complaintportal.exception.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies a {@link SlidingWindowRateLimiter} keyed by client address to one HTTP method of the
 * paths it is registered on. Runs before argument binding, so limited requests are never validated.
 */
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    private final SlidingWindowRateLimiter limiter;
    private final HttpMethod method;
    private final ErrorMessage rejection;

    public RateLimitInterceptor(SlidingWindowRateLimiter limiter, HttpMethod method, ErrorMessage rejection) {
        this.limiter = limiter;
        this.method = method;
        this.rejection = rejection;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!method.matches(request.getMethod())) {
            return true;
        }
        String address = request.getRemoteAddr();
        long waitMillis = limiter.tryAcquire(address);
        if (waitMillis > 0) {
            log.warn("Rate limit hit for {} on {} {}", address, request.getMethod(), request.getRequestURI());
            throw new RateLimitExceededException(rejection, (waitMillis + 999) / 1000);
        }
        return true;
    }
}
