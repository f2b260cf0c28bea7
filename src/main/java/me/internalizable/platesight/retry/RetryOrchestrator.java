package me.internalizable.platesight.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import me.internalizable.platesight.recognizer.RecognitionErrorKind;
import me.internalizable.platesight.recognizer.RecognitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs recognizer calls with a per-attempt timeout and bounded exponential
 * backoff. Only failures marked retryable are attempted again; anything that is
 * not a {@link RecognitionException} is treated as a transient connection problem.
 */
public class RetryOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RetryOrchestrator.class);

    private final RetryPolicy policy;
    private final Duration attemptTimeout;
    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;

    public RetryOrchestrator(RetryPolicy policy, Duration attemptTimeout, ExecutorService executor) {
        this(policy, attemptTimeout, executor, Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "recognizer-backoff");
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * @param executor  runs recognizer attempts
     * @param scheduler schedules the backoff wait before each retry
     */
    public RetryOrchestrator(RetryPolicy policy, Duration attemptTimeout, ExecutorService executor,
                             ScheduledExecutorService scheduler) {
        if (attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
        this.policy = policy != null ? policy : RetryPolicy.defaults();
        this.attemptTimeout = attemptTimeout;
        this.executor = executor;
        this.scheduler = scheduler;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    /**
     * Retries {@code operation} under the configured policy, bounding every attempt by the configured timeout.
     */
    public <T> T execute(Supplier<T> operation, CancellationSignal signal) {
        return withRetry(() -> withTimeout(operation, attemptTimeout, signal), policy, signal);
    }

    /**
     * Runs {@code operation} on the orchestrator's executor and waits at most {@code timeout}.
     * A late result is discarded. Cancelling {@code signal} stops the wait.
     *
     * @throws RecognitionException TIMEOUT (retryable) when the wait expires,
     *                              REQUEST_CANCELLED when the signal fires
     */
    public <T> T withTimeout(Supplier<T> operation, Duration timeout, CancellationSignal signal) {
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());

        CompletableFuture<T> future = CompletableFuture.supplyAsync(operation, executor);
        try (CancellationSignal.Registration ignored = signal.onCancel(() -> future.cancel(true))) {
            return timeLimiter.executeFutureSupplier(() -> future);
        } catch (TimeoutException e) {
            logger.warn("Recognizer attempt timed out after {} ms", timeout.toMillis());
            throw RecognitionException.timeout(timeout);
        } catch (CancellationException e) {
            throw RecognitionException.cancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw RecognitionException.cancelled();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RecognitionException(RecognitionErrorKind.API_CONNECTION_FAILED,
                    "Recognizer call failed: " + e.getMessage(), true, e);
        }
    }

    /**
     * Attempts {@code operation} up to {@code maxRetries + 1} times. A terminal
     * failure ends the loop at once. The last failure is rethrown, with unknown
     * exceptions reported as API_CONNECTION_FAILED. Backoff waits run on the
     * scheduler, so cancelling {@code signal} also ends a wait between attempts.
     */
    public <T> T withRetry(Supplier<T> operation, RetryPolicy retryPolicy, CancellationSignal signal) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retryPolicy.maxAttempts())
                .intervalFunction(backoff(retryPolicy))
                .retryOnException(RetryOrchestrator::isRetryable)
                .build();
        Retry retry = Retry.of("recognizer", config);
        retry.getEventPublisher().onRetry(event -> logger.warn("Recognizer attempt {} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));

        CompletableFuture<T> result = Retry.<T>decorateCompletionStage(retry, scheduler,
                () -> attempt(operation, signal)).get().toCompletableFuture();

        try (CancellationSignal.Registration ignored = signal.onCancel(() -> result.cancel(true))) {
            return result.get();
        } catch (CancellationException e) {
            throw RecognitionException.cancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(true);
            throw RecognitionException.cancelled();
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RecognitionException recognitionException) {
                throw recognitionException;
            }
            throw new RecognitionException(RecognitionErrorKind.API_CONNECTION_FAILED,
                    "Recognizer call failed: " + cause.getMessage(), false, cause);
        }
    }

    private <T> CompletionStage<T> attempt(Supplier<T> operation, CancellationSignal signal) {
        CompletableFuture<T> outcome = new CompletableFuture<>();
        if (signal.isCancelled()) {
            outcome.completeExceptionally(RecognitionException.cancelled());
            return outcome;
        }
        try {
            executor.execute(() -> {
                try {
                    outcome.complete(operation.get());
                } catch (RuntimeException | Error e) {
                    outcome.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            outcome.completeExceptionally(RecognitionException.terminal(RecognitionErrorKind.API_CONNECTION_FAILED,
                    "Recognizer executor is shut down"));
        }
        return outcome;
    }

    static boolean isRetryable(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof RecognitionException recognitionException) {
            return recognitionException.isRetryable();
        }
        return true;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Delays below one millisecond end an asynchronous retry, so the wait is floored at 1 ms.
     */
    private static IntervalFunction backoff(RetryPolicy retryPolicy) {
        return retry -> Math.max(1L, retryPolicy.delayBeforeRetry(retry).toMillis());
    }

    public void shutdown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }
}
