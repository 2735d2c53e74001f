package com.complaintportal.config;

import com.complaintportal.ratelimit.SlidingWindowRateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RateLimitConfig {

    @Bean
    public SlidingWindowRateLimiter creationRateLimiter(@Value("${app.rate-limit.create.max:5}") int max,
                                                        @Value("${app.rate-limit.create.window:60s}") Duration window,
                                                        Clock clock) {
        return new SlidingWindowRateLimiter(max, window, clock);
    }

    @Bean
    public SlidingWindowRateLimiter upvoteRateLimiter(@Value("${app.rate-limit.upvote.max:20}") int max,
                                                      @Value("${app.rate-limit.upvote.window:60s}") Duration window,
                                                      Clock clock) {
        return new SlidingWindowRateLimiter(max, window, clock);
    }
}
