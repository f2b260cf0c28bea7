package me.internalizable.platesight.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A recognized license plate. {@code fullText} is always the concatenation of
 * region, classification, kana and serial, in that order.
 */
public record PlateResult(
        String region,
        String classification,
        String kana,
        String serial,
        String fullText,
        int confidence,
        PlateCategory plateCategory,
        Instant recognizedAt
) {

    public PlateResult {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(kana, "kana");
        Objects.requireNonNull(serial, "serial");
        Objects.requireNonNull(plateCategory, "plateCategory");
        Objects.requireNonNull(recognizedAt, "recognizedAt");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within 0..100 but was " + confidence);
        }
        String expected = composeFullText(region, classification, kana, serial);
        if (fullText == null) {
            fullText = expected;
        } else if (!fullText.equals(expected)) {
            throw new IllegalArgumentException("fullText '" + fullText + "' does not match plate fields '" + expected + "'");
        }
    }

    public static PlateResult of(String region, String classification, String kana, String serial,
                                 int confidence, PlateCategory plateCategory, Instant recognizedAt) {
        return new PlateResult(region, classification, kana, serial, null, confidence, plateCategory, recognizedAt);
    }

    public static String composeFullText(String region, String classification, String kana, String serial) {
        return region + classification + kana + serial;
    }
}
