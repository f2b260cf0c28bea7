package me.internalizable.platesight.recognizer;

import me.internalizable.platesight.model.PlateResult;

/**
 * @param parsedData null when the recognizer answered but found no readable plate
 */
public record RecognizerResponse(String rawText, PlateResult parsedData, int confidence) {

    public boolean hasPlate() {
        return parsedData != null;
    }
}
