package me.internalizable.platesight.config;

import me.internalizable.platesight.audit.RecognitionAuditLog;
import me.internalizable.platesight.dedup.DuplicateSuppressor;
import me.internalizable.platesight.quality.QualityGate;
import me.internalizable.platesight.quality.QualityThresholds;
import me.internalizable.platesight.retry.RetryOrchestrator;
import me.internalizable.platesight.retry.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.Executors;

@Configuration
public class PipelineConfig {

    @Bean
    public QualityGate qualityGate(
            @Value("${recognition.quality.min-width:640}") int minWidth,
            @Value("${recognition.quality.min-height:480}") int minHeight,
            @Value("${recognition.quality.blur-threshold:100}") double blurThreshold,
            @Value("${recognition.quality.max-angle-deg:45}") double maxAngleDeg,
            @Value("${recognition.quality.dark-threshold:50}") double darkThreshold,
            @Value("${recognition.quality.bright-threshold:200}") double brightThreshold) {
        return new QualityGate(new QualityThresholds(minWidth, minHeight, blurThreshold,
                maxAngleDeg, darkThreshold, brightThreshold));
    }

    @Bean
    public DuplicateSuppressor duplicateSuppressor(
            @Value("${recognition.suppression.duration:5000ms}") Duration duration,
            @Value("${recognition.suppression.max-history:100}") int maxHistory) {
        return DuplicateSuppressor.builder()
                .suppressionDuration(duration)
                .maxHistory(maxHistory)
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public RetryOrchestrator retryOrchestrator(
            @Value("${recognition.retry.max-retries:3}") int maxRetries,
            @Value("${recognition.retry.initial-delay:1000ms}") Duration initialDelay,
            @Value("${recognition.retry.max-delay:5000ms}") Duration maxDelay,
            @Value("${recognition.retry.backoff-multiplier:2.0}") double backoffMultiplier,
            @Value("${recognition.timeout:5000ms}") Duration timeout) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("recognizer-");
        threadFactory.setDaemon(true);
        CustomizableThreadFactory backoffThreadFactory = new CustomizableThreadFactory("recognizer-backoff-");
        backoffThreadFactory.setDaemon(true);
        return new RetryOrchestrator(
                new RetryPolicy(maxRetries, initialDelay, maxDelay, backoffMultiplier),
                timeout,
                Executors.newCachedThreadPool(threadFactory),
                Executors.newSingleThreadScheduledExecutor(backoffThreadFactory));
    }

    @Bean
    public RecognitionAuditLog recognitionAuditLog(
            @Value("${recognition.audit.max-entries:10000}") int maxEntries) {
        return new RecognitionAuditLog(maxEntries);
    }
}
