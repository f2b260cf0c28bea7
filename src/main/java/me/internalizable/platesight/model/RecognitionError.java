package me.internalizable.platesight.model;

import java.util.Objects;

public record RecognitionError(RecognitionErrorCode code, String message, String suggestion) {

    public RecognitionError {
        Objects.requireNonNull(code, "code");
        if (message == null || message.isBlank()) {
            message = code.defaultMessage();
        }
        if (suggestion == null || suggestion.isBlank()) {
            throw new IllegalArgumentException("suggestion must not be empty for " + code);
        }
    }

    public static RecognitionError of(RecognitionErrorCode code) {
        return new RecognitionError(code, code.defaultMessage(), code.defaultSuggestion());
    }
}
