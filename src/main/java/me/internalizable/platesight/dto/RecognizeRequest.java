package me.internalizable.platesight.dto;

import me.internalizable.platesight.model.RecognitionMode;

/**
 * @param image base64 image data, optionally as a {@code data:image/...;base64,} URL
 * @param mode  single when absent
 */
public record RecognizeRequest(String image, RecognitionMode mode) {

    public RecognitionMode modeOrDefault() {
        return mode != null ? mode : RecognitionMode.SINGLE;
    }
}
