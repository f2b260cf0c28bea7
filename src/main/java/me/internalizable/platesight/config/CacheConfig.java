package me.internalizable.platesight.config;

import com.github.benmanes.caffeine.cache.Ticker;
import me.internalizable.platesight.cache.RecognitionCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RecognitionCache recognitionCache(
            Clock clock,
            @Value("${recognition.cache.max-entries:1000}") int maxEntries,
            @Value("${recognition.cache.ttl:5m}") Duration ttl) {
        return RecognitionCache.builder()
                .name("recognition")
                .maxEntries(maxEntries)
                .ttl(ttl)
                .ticker(clockTicker(clock))
                .build();
    }

    /**
     * Lets cache expiry follow the same clock as the rest of the pipeline.
     */
    static Ticker clockTicker(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }
}
