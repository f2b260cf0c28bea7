package me.internalizable.platesight.recognizer;

import me.internalizable.platesight.model.RecognitionErrorCode;

public enum RecognitionErrorKind {
    API_CONNECTION_FAILED(RecognitionErrorCode.API_CONNECTION_FAILED),
    TIMEOUT(RecognitionErrorCode.TIMEOUT),
    INVALID_RESPONSE(RecognitionErrorCode.PLATE_NOT_RECOGNIZED),
    NO_PLATE_DETECTED(RecognitionErrorCode.PLATE_NOT_RECOGNIZED),
    PARSE_ERROR(RecognitionErrorCode.PLATE_NOT_RECOGNIZED),
    REQUEST_CANCELLED(RecognitionErrorCode.REQUEST_CANCELLED);

    private final RecognitionErrorCode errorCode;

    RecognitionErrorKind(RecognitionErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    /**
     * Caller-facing code this recognizer failure is reported as.
     */
    public RecognitionErrorCode toErrorCode() {
        return errorCode;
    }
}
