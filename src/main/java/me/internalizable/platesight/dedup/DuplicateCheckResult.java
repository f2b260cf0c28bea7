package me.internalizable.platesight.dedup;

import java.time.Duration;

/**
 * @param sinceLastSeen time since the previous observation, only set for duplicates
 */
public record DuplicateCheckResult(boolean duplicate, int occurrenceCount, Duration sinceLastSeen) {

    public static DuplicateCheckResult duplicate(int occurrenceCount, Duration sinceLastSeen) {
        return new DuplicateCheckResult(true, occurrenceCount, sinceLastSeen);
    }

    public static DuplicateCheckResult fresh(int occurrenceCount) {
        return new DuplicateCheckResult(false, occurrenceCount, null);
    }
}
