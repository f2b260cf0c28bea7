package me.internalizable.platesight.quality;

import me.internalizable.platesight.model.CapturedImage;

/**
 * Single-pass image measurements used by the {@link QualityGate}: mean luminance,
 * variance of the Laplacian (sharpness) and the dominant edge orientation (tilt).
 * Convolutions only visit interior pixels, so images narrower or shorter than
 * three pixels report zero sharpness and zero tilt.
 */
public final class ImageQualityAnalyzer {

    static final double EDGE_MAGNITUDE_THRESHOLD = 50;
    static final int ANGLE_BUCKET_DEG = 5;

    private ImageQualityAnalyzer() {
    }

    public static ImageQualityMetrics analyze(CapturedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Input image cannot be null");
        }
        double[] gray = toGrayscale(image);
        int width = image.width();
        int height = image.height();
        return new ImageQualityMetrics(
                laplacianVariance(gray, width, height),
                estimateAngle(gray, width, height),
                averageBrightness(gray));
    }

    public static double[] toGrayscale(CapturedImage image) {
        double[] gray = new double[image.pixelCount()];
        for (int i = 0; i < gray.length; i++) {
            gray[i] = luminance(image.rgbAt(i));
        }
        return gray;
    }

    static double luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return 0.299 * r + 0.587 * g + 0.114 * b;
    }

    public static double averageBrightness(double[] gray) {
        if (gray.length == 0) {
            return 0;
        }
        double total = 0;
        for (double value : gray) {
            total += value;
        }
        return total / gray.length;
    }

    /**
     * Population variance of the 4-neighbour Laplacian response.
     */
    public static double laplacianVariance(double[] gray, int width, int height) {
        if (width < 3 || height < 3) {
            return 0;
        }
        int count = (width - 2) * (height - 2);
        double sum = 0;
        double sumOfSquares = 0;
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int idx = y * width + x;
                double laplacian = gray[idx - width] + gray[idx - 1] - 4 * gray[idx] + gray[idx + 1] + gray[idx + width];
                sum += laplacian;
                sumOfSquares += laplacian * laplacian;
            }
        }
        double mean = sum / count;
        return Math.max(0, sumOfSquares / count - mean * mean);
    }

    /**
     * Deviation in degrees of the dominant Sobel edge direction from the nearest axis.
     * Returns 0 when no pixel has a gradient stronger than the edge threshold.
     */
    public static double estimateAngle(double[] gray, int width, int height) {
        if (width < 3 || height < 3) {
            return 0;
        }
        int[] histogram = new int[180 / ANGLE_BUCKET_DEG + 1];
        boolean anyEdge = false;
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int idx = y * width + x;
                double gx = -gray[idx - width - 1] + gray[idx - width + 1]
                        - 2 * gray[idx - 1] + 2 * gray[idx + 1]
                        - gray[idx + width - 1] + gray[idx + width + 1];
                double gy = -gray[idx - width - 1] - 2 * gray[idx - width] - gray[idx - width + 1]
                        + gray[idx + width - 1] + 2 * gray[idx + width] + gray[idx + width + 1];
                if (Math.sqrt(gx * gx + gy * gy) > EDGE_MAGNITUDE_THRESHOLD) {
                    double angle = Math.abs(Math.toDegrees(Math.atan2(gy, gx)));
                    histogram[(int) Math.round(angle / ANGLE_BUCKET_DEG)]++;
                    anyEdge = true;
                }
            }
        }
        if (!anyEdge) {
            return 0;
        }

        int dominantBucket = 0;
        for (int bucket = 1; bucket < histogram.length; bucket++) {
            if (histogram[bucket] > histogram[dominantBucket]) {
                dominantBucket = bucket;
            }
        }
        double dominantAngle = dominantBucket * ANGLE_BUCKET_DEG;
        return Math.min(dominantAngle, Math.min(Math.abs(90 - dominantAngle), Math.abs(180 - dominantAngle)));
    }
}
