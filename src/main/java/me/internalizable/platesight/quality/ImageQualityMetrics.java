package me.internalizable.platesight.quality;

public record ImageQualityMetrics(double laplacianVariance, double estimatedAngleDeg, double averageBrightness) {
}
