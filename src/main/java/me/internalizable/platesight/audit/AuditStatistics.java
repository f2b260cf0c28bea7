package me.internalizable.platesight.audit;

import me.internalizable.platesight.model.RecognitionErrorCode;

import java.util.Map;

/**
 * @param successRate percentage 0-100
 */
public record AuditStatistics(
        long totalRequests,
        long successCount,
        long failureCount,
        double successRate,
        double averageProcessingTimeMs,
        Map<RecognitionErrorCode, Long> errorCounts
) {
}
