package me.internalizable.platesight.dto;

import me.internalizable.platesight.model.PlateResult;
import me.internalizable.platesight.model.RecognitionError;
import me.internalizable.platesight.quality.ValidationError;
import me.internalizable.platesight.service.RecognitionOutcome;

import java.util.List;

public record RecognizeResponse(
        boolean success,
        PlateResult data,
        RecognitionError error,
        List<ValidationError> validationErrors,
        boolean fromCache,
        boolean duplicate,
        long processingTime
) {

    public static RecognizeResponse from(RecognitionOutcome outcome) {
        return new RecognizeResponse(
                !outcome.isFailed(),
                outcome.result(),
                outcome.error(),
                outcome.validationErrors(),
                outcome.fromCache(),
                outcome.isSuppressed(),
                outcome.processingTimeMs());
    }

    public static RecognizeResponse error(RecognitionError error) {
        return new RecognizeResponse(false, null, error, List.of(), false, false, 0);
    }
}
