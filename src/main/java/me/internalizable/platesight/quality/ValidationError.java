package me.internalizable.platesight.quality;

public record ValidationError(ValidationErrorCode code, String message, String suggestion) {

    public static ValidationError of(ValidationErrorCode code) {
        return new ValidationError(code, code.message(), code.suggestion());
    }
}
