package me.internalizable.platesight.model;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable captured frame: the encoded bytes as received plus the decoded
 * pixels packed as 0xRRGGBB, row-major.
 */
public final class CapturedImage {

    private final byte[] encoded;
    private final int[] rgb;
    private final int width;
    private final int height;
    private final Instant capturedAt;

    public CapturedImage(byte[] encoded, int width, int height, int[] rgb, Instant capturedAt) {
        Objects.requireNonNull(encoded, "encoded");
        Objects.requireNonNull(rgb, "rgb");
        Objects.requireNonNull(capturedAt, "capturedAt");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (rgb.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " pixels but got " + rgb.length);
        }
        this.encoded = encoded.clone();
        this.rgb = rgb.clone();
        this.width = width;
        this.height = height;
        this.capturedAt = capturedAt;
    }

    public static CapturedImage fromBufferedImage(byte[] encoded, BufferedImage image, Instant capturedAt) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < rgb.length; i++) {
            rgb[i] &= 0xFFFFFF;
        }
        return new CapturedImage(encoded, width, height, rgb, capturedAt);
    }

    public byte[] encoded() {
        return encoded.clone();
    }

    public int rgbAt(int x, int y) {
        return rgb[y * width + x];
    }

    public int pixelCount() {
        return rgb.length;
    }

    public int rgbAt(int index) {
        return rgb[index];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public Instant capturedAt() {
        return capturedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapturedImage that)) return false;
        return width == that.width && height == that.height
                && Arrays.equals(encoded, that.encoded)
                && Arrays.equals(rgb, that.rgb)
                && capturedAt.equals(that.capturedAt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(width, height, capturedAt);
        result = 31 * result + Arrays.hashCode(encoded);
        return 31 * result + Arrays.hashCode(rgb);
    }

    @Override
    public String toString() {
        return "CapturedImage[" + width + "x" + height + ", " + encoded.length + " bytes, capturedAt=" + capturedAt + "]";
    }
}
