package me.internalizable.platesight.recognizer;

import java.time.Duration;

/**
 * A recognizer failure. Whether it is worth another attempt is carried
 * explicitly in {@link #isRetryable()}.
 */
public class RecognitionException extends RuntimeException {

    private final RecognitionErrorKind kind;
    private final boolean retryable;

    public RecognitionException(RecognitionErrorKind kind, String message, boolean retryable) {
        super(message);
        this.kind = kind;
        this.retryable = retryable;
    }

    public RecognitionException(RecognitionErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public static RecognitionException retryable(RecognitionErrorKind kind, String message) {
        return new RecognitionException(kind, message, true);
    }

    public static RecognitionException terminal(RecognitionErrorKind kind, String message) {
        return new RecognitionException(kind, message, false);
    }

    public static RecognitionException timeout(Duration timeout) {
        return new RecognitionException(RecognitionErrorKind.TIMEOUT,
                "Recognition did not complete within " + timeout.toMillis() + " ms", true);
    }

    public static RecognitionException cancelled() {
        return new RecognitionException(RecognitionErrorKind.REQUEST_CANCELLED, "Recognition request was cancelled", false);
    }

    public RecognitionErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
