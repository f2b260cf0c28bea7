package me.internalizable.platesight.dedup;

import java.time.Instant;

public record SuppressionEntry(String plateKey, Instant lastSeenAt, int occurrenceCount) {

    SuppressionEntry recordOccurrence(Instant now) {
        return new SuppressionEntry(plateKey, now, occurrenceCount + 1);
    }
}
