package me.internalizable.platesight.controller;

import me.internalizable.platesight.audit.RecognitionAuditLog;
import me.internalizable.platesight.cache.RecognitionCache;
import me.internalizable.platesight.dedup.DuplicateSuppressor;
import me.internalizable.platesight.dto.RecognizeRequest;
import me.internalizable.platesight.dto.RecognizeResponse;
import me.internalizable.platesight.image.ImageDecoder;
import me.internalizable.platesight.model.CapturedImage;
import me.internalizable.platesight.model.RecognitionErrorCode;
import me.internalizable.platesight.ratelimit.RateLimiter;
import me.internalizable.platesight.service.RecognitionOutcome;
import me.internalizable.platesight.service.RecognitionPipeline;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class RecognitionController {

    private final RecognitionPipeline pipeline;
    private final ImageDecoder imageDecoder;
    private final RecognitionCache cache;
    private final RateLimiter rateLimiter;
    private final DuplicateSuppressor duplicateSuppressor;
    private final RecognitionAuditLog auditLog;

    public RecognitionController(RecognitionPipeline pipeline,
                                 ImageDecoder imageDecoder,
                                 RecognitionCache cache,
                                 RateLimiter rateLimiter,
                                 DuplicateSuppressor duplicateSuppressor,
                                 RecognitionAuditLog auditLog) {
        this.pipeline = pipeline;
        this.imageDecoder = imageDecoder;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.duplicateSuppressor = duplicateSuppressor;
        this.auditLog = auditLog;
    }

    @PostMapping("/license-plate/recognize")
    public ResponseEntity<RecognizeResponse> recognize(@RequestBody RecognizeRequest request) {
        CapturedImage image = imageDecoder.decode(request.image());
        RecognitionOutcome outcome = pipeline.recognize(image, request.modeOrDefault());
        HttpStatus status = outcome.isFailed() ? statusFor(outcome.error().code()) : HttpStatus.OK;
        return ResponseEntity.status(status).body(RecognizeResponse.from(outcome));
    }

    /**
     * Get cache, rate limit, suppression and audit statistics
     */
    @GetMapping("/recognition/stats")
    public Map<String, Object> stats() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("cache", cache.getStats());
        result.put("rateLimit", rateLimiter.getStats());
        result.put("suppression", Map.of(
                "size", duplicateSuppressor.size(),
                "maxHistory", duplicateSuppressor.getMaxHistory(),
                "suppressionDurationMs", duplicateSuppressor.getSuppressionDuration().toMillis()));
        result.put("recognitions", auditLog.getStatistics());
        return result;
    }

    @PostMapping("/cache/clear")
    public Map<String, Object> clearCache() {
        cache.clear();
        return Map.of(
                "success", true,
                "message", "Recognition cache cleared"
        );
    }

    @PostMapping("/suppression/clear")
    public Map<String, Object> clearSuppression() {
        duplicateSuppressor.clear();
        return Map.of(
                "success", true,
                "message", "Duplicate suppression history cleared"
        );
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    static HttpStatus statusFor(RecognitionErrorCode code) {
        return switch (code) {
            case INVALID_IMAGE -> HttpStatus.BAD_REQUEST;
            case PLATE_NOT_RECOGNIZED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case API_CONNECTION_FAILED -> HttpStatus.BAD_GATEWAY;
            case REQUEST_CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
