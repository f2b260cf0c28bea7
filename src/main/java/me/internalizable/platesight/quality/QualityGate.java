package me.internalizable.platesight.quality;

import me.internalizable.platesight.model.CapturedImage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a frame is worth sending to the recognizer. Every check runs,
 * so callers receive the complete list of problems in the order resolution,
 * blur, angle, lighting. Stateless and safe for concurrent use.
 */
public class QualityGate {

    private final QualityThresholds thresholds;

    public QualityGate(QualityThresholds thresholds) {
        this.thresholds = thresholds != null ? thresholds : QualityThresholds.defaults();
    }

    public QualityThresholds getThresholds() {
        return thresholds;
    }

    public List<ValidationError> validate(CapturedImage image, ImageQualityMetrics metrics) {
        List<ValidationError> errors = new ArrayList<>(4);
        checkResolution(image.width(), image.height()).ifPresent(errors::add);
        checkBlur(metrics.laplacianVariance()).ifPresent(errors::add);
        checkAngle(metrics.estimatedAngleDeg()).ifPresent(errors::add);
        checkLighting(metrics.averageBrightness()).ifPresent(errors::add);
        return List.copyOf(errors);
    }

    public List<ValidationError> validate(CapturedImage image) {
        return validate(image, ImageQualityAnalyzer.analyze(image));
    }

    public Optional<ValidationError> checkResolution(int width, int height) {
        if (width < thresholds.minWidth() || height < thresholds.minHeight()) {
            return Optional.of(ValidationError.of(ValidationErrorCode.RESOLUTION));
        }
        return Optional.empty();
    }

    public Optional<ValidationError> checkBlur(double laplacianVariance) {
        if (laplacianVariance < thresholds.blurThreshold()) {
            return Optional.of(ValidationError.of(ValidationErrorCode.BLUR));
        }
        return Optional.empty();
    }

    public Optional<ValidationError> checkAngle(double estimatedAngleDeg) {
        if (estimatedAngleDeg > thresholds.maxAngleDeg()) {
            return Optional.of(ValidationError.of(ValidationErrorCode.ANGLE_TOO_STEEP));
        }
        return Optional.empty();
    }

    public Optional<ValidationError> checkLighting(double averageBrightness) {
        if (averageBrightness < thresholds.darkThreshold()) {
            return Optional.of(ValidationError.of(ValidationErrorCode.TOO_DARK));
        }
        if (averageBrightness > thresholds.brightThreshold()) {
            return Optional.of(ValidationError.of(ValidationErrorCode.TOO_BRIGHT));
        }
        return Optional.empty();
    }
}
