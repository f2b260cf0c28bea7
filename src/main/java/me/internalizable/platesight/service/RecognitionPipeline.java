package me.internalizable.platesight.service;

import me.internalizable.platesight.audit.RecognitionAuditLog;
import me.internalizable.platesight.cache.ImageHasher;
import me.internalizable.platesight.cache.RecognitionCache;
import me.internalizable.platesight.dedup.DuplicateCheckResult;
import me.internalizable.platesight.dedup.DuplicateSuppressor;
import me.internalizable.platesight.model.CapturedImage;
import me.internalizable.platesight.model.PlateResult;
import me.internalizable.platesight.model.RecognitionError;
import me.internalizable.platesight.model.RecognitionErrorCode;
import me.internalizable.platesight.model.RecognitionMode;
import me.internalizable.platesight.quality.ImageQualityAnalyzer;
import me.internalizable.platesight.quality.ImageQualityMetrics;
import me.internalizable.platesight.quality.QualityGate;
import me.internalizable.platesight.quality.ValidationError;
import me.internalizable.platesight.ratelimit.RateLimiter;
import me.internalizable.platesight.recognizer.RecognitionException;
import me.internalizable.platesight.recognizer.Recognizer;
import me.internalizable.platesight.recognizer.RecognizerResponse;
import me.internalizable.platesight.retry.CancellationSignal;
import me.internalizable.platesight.retry.RetryOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Request path from a captured frame to a plate result.
 *
 * Flow:
 * - quality gate, rejecting unusable frames before any network call
 * - cache lookup by image hash
 * - on a miss: admission through the rate limiter, then the recognizer under
 *   timeout and retry, then the cache write
 * - in realtime mode, duplicate suppression of the recognized plate
 *
 * Failures come back as a FAILED outcome carrying a code and a suggestion.
 * Concurrent misses for the same image may both reach the recognizer; the
 * last cache write wins.
 */
@Service
public class RecognitionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionPipeline.class);

    private final QualityGate qualityGate;
    private final RecognitionCache cache;
    private final RateLimiter rateLimiter;
    private final DuplicateSuppressor duplicateSuppressor;
    private final RetryOrchestrator retryOrchestrator;
    private final Recognizer recognizer;
    private final RecognitionAuditLog auditLog;
    private final Clock clock;

    public RecognitionPipeline(QualityGate qualityGate,
                               RecognitionCache cache,
                               RateLimiter rateLimiter,
                               DuplicateSuppressor duplicateSuppressor,
                               RetryOrchestrator retryOrchestrator,
                               Recognizer recognizer,
                               RecognitionAuditLog auditLog,
                               Clock clock) {
        this.qualityGate = qualityGate;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.duplicateSuppressor = duplicateSuppressor;
        this.retryOrchestrator = retryOrchestrator;
        this.recognizer = recognizer;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public RecognitionOutcome recognize(CapturedImage image, RecognitionMode mode) {
        return recognize(image, mode, CancellationSignal.none());
    }

    public RecognitionOutcome recognize(CapturedImage image, RecognitionMode mode, CancellationSignal signal) {
        long startNanos = System.nanoTime();
        byte[] imageBytes = image.encoded();
        String imageHash = ImageHasher.sha256Hex(imageBytes);

        ImageQualityMetrics metrics = ImageQualityAnalyzer.analyze(image);
        List<ValidationError> validationErrors = qualityGate.validate(image, metrics);
        if (!validationErrors.isEmpty()) {
            ValidationError first = validationErrors.get(0);
            logger.warn("Image {} rejected by quality gate: {}", ImageHasher.abbreviate(imageHash),
                    validationErrors.stream().map(ValidationError::code).toList());
            RecognitionError error = new RecognitionError(RecognitionErrorCode.INVALID_IMAGE, first.message(), first.suggestion());
            return recordFailure(RecognitionOutcome.invalidImage(error, validationErrors, imageHash, elapsedMs(startNanos)), mode);
        }

        if (signal.isCancelled()) {
            return recordFailure(failed(RecognitionErrorCode.REQUEST_CANCELLED, imageHash, startNanos), mode);
        }

        PlateResult plate;
        boolean fromCache;
        Optional<PlateResult> cached = cache.get(imageHash);
        if (cached.isPresent()) {
            plate = cached.get();
            fromCache = true;
        } else {
            if (!rateLimiter.tryStart()) {
                logger.warn("Image {} rejected: rate limit reached", ImageHasher.abbreviate(imageHash));
                return recordFailure(failed(RecognitionErrorCode.RATE_LIMITED, imageHash, startNanos), mode);
            }
            try {
                RecognizerResponse response = retryOrchestrator.execute(() -> recognizer.recognize(imageBytes), signal);
                if (!response.hasPlate()) {
                    logger.info("No plate recognized in image {}", ImageHasher.abbreviate(imageHash));
                    return recordFailure(failed(RecognitionErrorCode.PLATE_NOT_RECOGNIZED, imageHash, startNanos), mode);
                }
                plate = response.parsedData();
                fromCache = false;
                cache.put(imageHash, plate);
            } catch (RecognitionException e) {
                logger.error("Recognition of image {} failed: {} ({})", ImageHasher.abbreviate(imageHash),
                        e.getKind(), e.getMessage());
                return recordFailure(failed(e.getKind().toErrorCode(), imageHash, startNanos), mode);
            } finally {
                rateLimiter.end();
            }
        }

        if (mode == RecognitionMode.REALTIME) {
            DuplicateCheckResult check = duplicateSuppressor.checkAndRecord(plate.fullText(), clock.instant());
            if (check.duplicate()) {
                long elapsed = elapsedMs(startNanos);
                auditLog.recordSuccess(clock.instant(), imageHash, elapsed, plate.confidence(), mode, fromCache, true);
                return RecognitionOutcome.suppressed(fromCache, imageHash, elapsed);
            }
        }

        long elapsed = elapsedMs(startNanos);
        auditLog.recordSuccess(clock.instant(), imageHash, elapsed, plate.confidence(), mode, fromCache, false);
        return RecognitionOutcome.success(plate, fromCache, imageHash, elapsed);
    }

    private RecognitionOutcome failed(RecognitionErrorCode code, String imageHash, long startNanos) {
        return RecognitionOutcome.failed(RecognitionError.of(code), imageHash, elapsedMs(startNanos));
    }

    private RecognitionOutcome recordFailure(RecognitionOutcome outcome, RecognitionMode mode) {
        auditLog.recordFailure(clock.instant(), outcome.imageHash(), outcome.processingTimeMs(),
                outcome.error().code(), mode);
        return outcome;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
