package me.internalizable.platesight.audit;

import me.internalizable.platesight.cache.ImageHasher;
import me.internalizable.platesight.model.RecognitionErrorCode;
import me.internalizable.platesight.model.RecognitionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Bounded in-memory trail of recognition requests. The oldest entries are
 * dropped once the limit is reached. Every entry is also written to the log.
 */
public class RecognitionAuditLog {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionAuditLog.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private final int maxEntries;
    private final ArrayDeque<AuditEntry> entries = new ArrayDeque<>();

    public RecognitionAuditLog() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public RecognitionAuditLog(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive but was " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public AuditEntry recordSuccess(Instant timestamp, String imageHash, long processingTimeMs, int confidence,
                                    RecognitionMode mode, boolean fromCache, boolean suppressed) {
        AuditEntry entry = new AuditEntry(UUID.randomUUID().toString(), timestamp, imageHash, true,
                processingTimeMs, null, confidence, mode, fromCache, suppressed);
        logger.info("Recognition succeeded [image={}, mode={}, time={}ms, confidence={}, cached={}, suppressed={}]",
                ImageHasher.abbreviate(imageHash), mode, processingTimeMs, confidence, fromCache, suppressed);
        return append(entry);
    }

    public AuditEntry recordFailure(Instant timestamp, String imageHash, long processingTimeMs,
                                    RecognitionErrorCode errorCode, RecognitionMode mode) {
        AuditEntry entry = new AuditEntry(UUID.randomUUID().toString(), timestamp, imageHash, false,
                processingTimeMs, errorCode, null, mode, false, false);
        logger.warn("Recognition failed [image={}, mode={}, time={}ms, error={}]",
                ImageHasher.abbreviate(imageHash), mode, processingTimeMs, errorCode);
        return append(entry);
    }

    private synchronized AuditEntry append(AuditEntry entry) {
        entries.addLast(entry);
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
        return entry;
    }

    public AuditStatistics getStatistics() {
        return getStatistics(null);
    }

    /**
     * @param since only entries at or after this instant, all entries when null
     */
    public synchronized AuditStatistics getStatistics(Instant since) {
        long total = 0;
        long successes = 0;
        long processingTimeTotal = 0;
        Map<RecognitionErrorCode, Long> errorCounts = new EnumMap<>(RecognitionErrorCode.class);

        for (AuditEntry entry : entries) {
            if (since != null && entry.timestamp().isBefore(since)) {
                continue;
            }
            total++;
            processingTimeTotal += entry.processingTimeMs();
            if (entry.success()) {
                successes++;
            } else if (entry.errorCode() != null) {
                errorCounts.merge(entry.errorCode(), 1L, Long::sum);
            }
        }

        double successRate = total == 0 ? 0 : successes * 100.0 / total;
        double averageTime = total == 0 ? 0 : (double) processingTimeTotal / total;
        return new AuditStatistics(total, successes, total - successes, successRate, averageTime,
                Collections.unmodifiableMap(errorCounts));
    }

    /**
     * @return up to {@code limit} entries, newest first
     */
    public synchronized List<AuditEntry> getRecent(int limit) {
        List<AuditEntry> recent = new ArrayList<>(Math.max(0, Math.min(limit, entries.size())));
        Iterator<AuditEntry> it = entries.descendingIterator();
        while (it.hasNext() && recent.size() < limit) {
            recent.add(it.next());
        }
        return recent;
    }

    /**
     * @return up to {@code limit} failures with this code, newest first
     */
    public synchronized List<AuditEntry> getByErrorCode(RecognitionErrorCode errorCode, int limit) {
        List<AuditEntry> matches = new ArrayList<>();
        Iterator<AuditEntry> it = entries.descendingIterator();
        while (it.hasNext() && matches.size() < limit) {
            AuditEntry entry = it.next();
            if (entry.errorCode() == errorCode) {
                matches.add(entry);
            }
        }
        return matches;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        logger.info("Recognition audit log cleared");
    }
}
