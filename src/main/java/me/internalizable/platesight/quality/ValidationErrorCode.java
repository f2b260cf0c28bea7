package me.internalizable.platesight.quality;

public enum ValidationErrorCode {
    RESOLUTION("The image resolution is too low", "Move closer to the plate"),
    BLUR("The image is blurry", "Hold the camera steady and take the photo again"),
    ANGLE_TOO_STEEP("The plate is photographed at too steep an angle", "Shoot the plate from the front"),
    TOO_DARK("The image is too dark", "Move to a brighter place"),
    TOO_BRIGHT("The image is too bright", "Avoid direct sunlight on the plate");

    private final String message;
    private final String suggestion;

    ValidationErrorCode(String message, String suggestion) {
        this.message = message;
        this.suggestion = suggestion;
    }

    public String message() {
        return message;
    }

    public String suggestion() {
        return suggestion;
    }
}
