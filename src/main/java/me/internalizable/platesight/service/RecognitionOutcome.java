package me.internalizable.platesight.service;

import me.internalizable.platesight.model.PlateResult;
import me.internalizable.platesight.model.RecognitionError;
import me.internalizable.platesight.quality.ValidationError;

import java.util.List;

/**
 * Result of one pass through the pipeline. SUPPRESSED means the plate was read
 * but was already surfaced within the suppression window, so there is no new result.
 */
public record RecognitionOutcome(
        Status status,
        PlateResult result,
        RecognitionError error,
        List<ValidationError> validationErrors,
        boolean fromCache,
        String imageHash,
        long processingTimeMs
) {

    public enum Status {
        SUCCESS,
        SUPPRESSED,
        FAILED
    }

    public static RecognitionOutcome success(PlateResult result, boolean fromCache, String imageHash, long processingTimeMs) {
        return new RecognitionOutcome(Status.SUCCESS, result, null, List.of(), fromCache, imageHash, processingTimeMs);
    }

    public static RecognitionOutcome suppressed(boolean fromCache, String imageHash, long processingTimeMs) {
        return new RecognitionOutcome(Status.SUPPRESSED, null, null, List.of(), fromCache, imageHash, processingTimeMs);
    }

    public static RecognitionOutcome failed(RecognitionError error, String imageHash, long processingTimeMs) {
        return new RecognitionOutcome(Status.FAILED, null, error, List.of(), false, imageHash, processingTimeMs);
    }

    public static RecognitionOutcome invalidImage(RecognitionError error, List<ValidationError> validationErrors,
                                                  String imageHash, long processingTimeMs) {
        return new RecognitionOutcome(Status.FAILED, null, error, List.copyOf(validationErrors), false,
                imageHash, processingTimeMs);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isSuppressed() {
        return status == Status.SUPPRESSED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
