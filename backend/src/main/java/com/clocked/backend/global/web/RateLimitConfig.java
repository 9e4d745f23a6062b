package com.clocked.backend.global.web;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimitConfig {

    @Bean
    public RequestRateLimiter magicLinkRateLimiter(
            @Value("${clocked.auth.magic-link.rate-limit.max-requests:5}") int maxRequests,
            @Value("${clocked.auth.magic-link.rate-limit.window:PT15M}") Duration window
    ) {
        return new RequestRateLimiter("magic-link", maxRequests, window);
    }
}
