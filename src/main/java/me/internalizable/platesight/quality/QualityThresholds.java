package me.internalizable.platesight.quality;

public record QualityThresholds(
        int minWidth,
        int minHeight,
        double blurThreshold,
        double maxAngleDeg,
        double darkThreshold,
        double brightThreshold
) {

    public static final int DEFAULT_MIN_WIDTH = 640;
    public static final int DEFAULT_MIN_HEIGHT = 480;
    public static final double DEFAULT_BLUR_THRESHOLD = 100;
    public static final double DEFAULT_MAX_ANGLE_DEG = 45;
    public static final double DEFAULT_DARK_THRESHOLD = 50;
    public static final double DEFAULT_BRIGHT_THRESHOLD = 200;

    public QualityThresholds {
        if (minWidth <= 0 || minHeight <= 0) {
            throw new IllegalArgumentException("Minimum resolution must be positive");
        }
        if (darkThreshold > brightThreshold) {
            throw new IllegalArgumentException("darkThreshold must not exceed brightThreshold");
        }
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(DEFAULT_MIN_WIDTH, DEFAULT_MIN_HEIGHT, DEFAULT_BLUR_THRESHOLD,
                DEFAULT_MAX_ANGLE_DEG, DEFAULT_DARK_THRESHOLD, DEFAULT_BRIGHT_THRESHOLD);
    }
}
