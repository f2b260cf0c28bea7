package me.internalizable.platesight.audit;

import me.internalizable.platesight.model.RecognitionErrorCode;
import me.internalizable.platesight.model.RecognitionMode;

import java.time.Instant;

/**
 * One recognition request as recorded for auditing. Identifies the image only by hash.
 *
 * @param errorCode  null on success
 * @param confidence null when no plate was read
 */
public record AuditEntry(
        String id,
        Instant timestamp,
        String imageHash,
        boolean success,
        long processingTimeMs,
        RecognitionErrorCode errorCode,
        Integer confidence,
        RecognitionMode mode,
        boolean fromCache,
        boolean suppressed
) {
}
