package me.internalizable.platesight.recognizer;

/**
 * The external vision service that reads a plate from an image.
 */
public interface Recognizer {

    /**
     * @param imageBytes decoded image file bytes
     * @throws RecognitionException tagged with the failure kind and whether a retry may help
     */
    RecognizerResponse recognize(byte[] imageBytes);
}
