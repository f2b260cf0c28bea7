package me.internalizable.platesight.dedup;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps realtime capture from surfacing the same plate over and over. A plate
 * seen again within the suppression window is a duplicate and does not move
 * its last-seen time; a later sighting counts as a new occurrence. History is
 * bounded and the least recently recorded plate is dropped first.
 *
 * Thread-safety: synchronized for concurrent access.
 */
@Getter
public class DuplicateSuppressor {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateSuppressor.class);

    public static final Duration DEFAULT_SUPPRESSION_DURATION = Duration.ofMillis(5000);
    public static final int DEFAULT_MAX_HISTORY = 100;

    private final Duration suppressionDuration;
    private final int maxHistory;

    @Getter(AccessLevel.NONE)
    private final LinkedHashMap<String, SuppressionEntry> history = new LinkedHashMap<>();

    @Builder
    public DuplicateSuppressor(Duration suppressionDuration, Integer maxHistory) {
        this.suppressionDuration = suppressionDuration != null ? suppressionDuration : DEFAULT_SUPPRESSION_DURATION;
        this.maxHistory = maxHistory != null ? maxHistory : DEFAULT_MAX_HISTORY;
        if (this.maxHistory <= 0) {
            throw new IllegalArgumentException("maxHistory must be positive but was " + this.maxHistory);
        }
        if (this.suppressionDuration.isNegative()) {
            throw new IllegalArgumentException("suppressionDuration must not be negative");
        }
    }

    public synchronized DuplicateCheckResult checkAndRecord(String plateKey, Instant now) {
        SuppressionEntry existing = history.get(plateKey);

        if (existing != null) {
            Duration sinceLastSeen = Duration.between(existing.lastSeenAt(), now);
            if (sinceLastSeen.compareTo(suppressionDuration) < 0) {
                logger.debug("Suppressed duplicate plate sighting ({} ms since last)", sinceLastSeen.toMillis());
                return DuplicateCheckResult.duplicate(existing.occurrenceCount(), sinceLastSeen);
            }

            SuppressionEntry updated = existing.recordOccurrence(now);
            history.remove(plateKey);
            history.put(plateKey, updated);
            return DuplicateCheckResult.fresh(updated.occurrenceCount());
        }

        if (history.size() >= maxHistory) {
            Iterator<String> eldest = history.keySet().iterator();
            eldest.next();
            eldest.remove();
        }
        history.put(plateKey, new SuppressionEntry(plateKey, now, 1));
        return DuplicateCheckResult.fresh(1);
    }

    /**
     * Read-only variant of {@link #checkAndRecord}: history is left untouched.
     */
    public synchronized boolean isDuplicate(String plateKey, Instant now) {
        SuppressionEntry existing = history.get(plateKey);
        if (existing == null) {
            return false;
        }
        return Duration.between(existing.lastSeenAt(), now).compareTo(suppressionDuration) < 0;
    }

    public synchronized void clear() {
        history.clear();
        logger.info("Duplicate suppression history cleared");
    }

    /**
     * Drops entries whose suppression window has passed.
     * @return number of entries removed
     */
    public synchronized int cleanup(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, SuppressionEntry>> it = history.entrySet().iterator();
        while (it.hasNext()) {
            SuppressionEntry entry = it.next().getValue();
            if (Duration.between(entry.lastSeenAt(), now).compareTo(suppressionDuration) >= 0) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return history.size();
    }

    /**
     * @return history entries from least to most recently recorded
     */
    public synchronized List<SuppressionEntry> snapshot() {
        return List.copyOf(history.values());
    }
}
