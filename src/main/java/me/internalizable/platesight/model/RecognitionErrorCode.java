package me.internalizable.platesight.model;

/**
 * Caller-facing failure codes, each with its default message and remediation.
 */
public enum RecognitionErrorCode {
    PLATE_NOT_RECOGNIZED(
            "The license plate could not be recognized",
            "Make sure the whole plate is inside the frame and try again"),
    INVALID_IMAGE(
            "The image cannot be used for recognition",
            "Take the photo again following the guidance"),
    RATE_LIMITED(
            "Too many recognition requests",
            "Wait a moment and try again"),
    TIMEOUT(
            "Recognition took too long",
            "Check your connection and try again"),
    API_CONNECTION_FAILED(
            "Could not reach the recognition service",
            "Check your network connection and try again later"),
    REQUEST_CANCELLED(
            "The recognition request was cancelled",
            "Start the recognition again when ready");

    private final String defaultMessage;
    private final String defaultSuggestion;

    RecognitionErrorCode(String defaultMessage, String defaultSuggestion) {
        this.defaultMessage = defaultMessage;
        this.defaultSuggestion = defaultSuggestion;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public String defaultSuggestion() {
        return defaultSuggestion;
    }
}
