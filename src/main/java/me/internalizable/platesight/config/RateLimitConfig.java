package me.internalizable.platesight.config;

import me.internalizable.platesight.ratelimit.LocalRateLimiter;
import me.internalizable.platesight.ratelimit.RateLimitSettings;
import me.internalizable.platesight.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RateLimitConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    public RateLimiter recognitionRateLimiter(
            Clock clock,
            @Value("${recognition.rate-limit.max-concurrent:100}") int maxConcurrent,
            @Value("${recognition.rate-limit.window:60s}") Duration window,
            @Value("${recognition.rate-limit.max-requests:100}") int maxRequests) {
        logger.info("Recognition rate limit: {} concurrent, {} requests per {} s",
                maxConcurrent, maxRequests, window.toSeconds());
        return new LocalRateLimiter(clock, new RateLimitSettings(maxConcurrent, window, maxRequests));
    }
}
