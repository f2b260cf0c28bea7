package me.internalizable.platesight.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Caller-owned flag that aborts waiting on a recognition. Cancelling stops the
 * caller's wait and any further attempts; work already sent to the recognizer
 * may still run to completion.
 */
public class CancellationSignal {

    private static final Logger logger = LoggerFactory.getLogger(CancellationSignal.class);

    private volatile boolean cancelled = false;
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation listener failed", e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Runs {@code listener} on cancellation, or immediately if already cancelled.
     * @return handle that unregisters the listener
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
