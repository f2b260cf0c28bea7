package me.internalizable.platesight.retry;

import me.internalizable.platesight.recognizer.RecognitionErrorKind;
import me.internalizable.platesight.recognizer.RecognitionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RetryOrchestratorTest {

    private static final RetryPolicy FAST = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(40), 2.0);

    private ExecutorService executor;
    private RetryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        orchestrator = new RetryOrchestrator(FAST, Duration.ofSeconds(2), executor);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private static Supplier<String> failingTimes(AtomicInteger calls, int failures, RecognitionException error) {
        return () -> {
            if (calls.incrementAndGet() <= failures) {
                throw error;
            }
            return "plate";
        };
    }

    private static RecognitionException transientFailure() {
        return RecognitionException.retryable(RecognitionErrorKind.API_CONNECTION_FAILED, "503");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3})
    void retryBoundAttemptsAreMaxRetriesPlusOne(int maxRetries) {
        RetryPolicy policy = new RetryPolicy(maxRetries, Duration.ofMillis(10), Duration.ofMillis(20), 2.0);
        AtomicInteger calls = new AtomicInteger();

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withRetry(failingTimes(calls, Integer.MAX_VALUE, transientFailure()), policy, CancellationSignal.none()), RecognitionException.class);

        assertThat(calls.get()).isEqualTo(maxRetries + 1);
        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.API_CONNECTION_FAILED);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3})
    void stopsAtFirstSuccess(int failures) {
        AtomicInteger calls = new AtomicInteger();

        String result = orchestrator.withRetry(failingTimes(calls, failures, transientFailure()), FAST, CancellationSignal.none());

        assertThat(result).isEqualTo("plate");
        assertThat(calls.get()).isEqualTo(failures + 1);
    }

    @Test
    void terminalFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        RecognitionException parseError = RecognitionException.terminal(RecognitionErrorKind.PARSE_ERROR, "not json");

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withRetry(failingTimes(calls, 5, parseError), FAST, CancellationSignal.none()), RecognitionException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.PARSE_ERROR);
    }

    @Test
    void terminalFailureAfterTransientOnesStopsImmediately() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> operation = () -> {
            if (calls.incrementAndGet() == 1) {
                throw transientFailure();
            }
            throw RecognitionException.terminal(RecognitionErrorKind.INVALID_RESPONSE, "garbage");
        };

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withRetry(operation, FAST, CancellationSignal.none()), RecognitionException.class);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.INVALID_RESPONSE);
    }

    @Test
    void unknownFailuresAreRetriedThenReportedAsConnectionFailure() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> operation = () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("socket closed");
        };

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withRetry(operation, FAST, CancellationSignal.none()), RecognitionException.class);

        assertThat(calls.get()).isEqualTo(4);
        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.API_CONNECTION_FAILED);
        assertThat(error.isRetryable()).isFalse();
        assertThat(error).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void lastRecognizedErrorIsSurfacedUnchanged() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> operation = () -> {
            calls.incrementAndGet();
            throw RecognitionException.timeout(Duration.ofMillis(5));
        };

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withRetry(operation, FAST, CancellationSignal.none()), RecognitionException.class);

        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.TIMEOUT);
        assertThat(error.isRetryable()).isTrue();
    }

    @Test
    void timeoutStopsWaitingForSlowOperation() {
        CountDownLatch release = new CountDownLatch(1);
        Supplier<String> slow = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        };

        long start = System.nanoTime();
        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withTimeout(slow, Duration.ofMillis(100), CancellationSignal.none()), RecognitionException.class);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        release.countDown();

        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.TIMEOUT);
        assertThat(error.isRetryable()).isTrue();
        assertThat(elapsedMs).isLessThan(2000);
    }

    @Test
    void withTimeoutPassesResultAndErrorsThrough() {
        assertThat(orchestrator.withTimeout(() -> "fast", Duration.ofSeconds(1), CancellationSignal.none())).isEqualTo("fast");

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withTimeout(() -> {
                    throw RecognitionException.terminal(RecognitionErrorKind.NO_PLATE_DETECTED, "none");
                }, Duration.ofSeconds(1), CancellationSignal.none()), RecognitionException.class);
        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.NO_PLATE_DETECTED);
    }

    @Test
    void timedOutAttemptsAreRetried() {
        RetryOrchestrator shortTimeout = new RetryOrchestrator(
                new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(10), 1.0), Duration.ofMillis(50), executor);
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> slowThenFast = () -> {
            if (calls.incrementAndGet() == 1) {
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "late";
            }
            return "plate";
        };

        assertThat(shortTimeout.execute(slowThenFast, CancellationSignal.none())).isEqualTo("plate");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void cancellationAbortsWaiting() throws InterruptedException {
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch started = new CountDownLatch(1);
        Supplier<String> blocking = () -> {
            started.countDown();
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        };

        Thread canceller = new Thread(() -> {
            try {
                started.await(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.execute(blocking, signal), RecognitionException.class);
        canceller.join();

        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.REQUEST_CANCELLED);
        assertThat(error.isRetryable()).isFalse();
    }

    @Test
    void cancellationDuringBackoffEndsWaitWithoutFurtherAttempts() throws InterruptedException {
        RetryPolicy slowBackoff = new RetryPolicy(3, Duration.ofMillis(3000), Duration.ofMillis(5000), 2.0);
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch firstAttempt = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        Supplier<String> failing = () -> {
            calls.incrementAndGet();
            firstAttempt.countDown();
            throw transientFailure();
        };

        Thread canceller = new Thread(() -> {
            try {
                firstAttempt.await(1, TimeUnit.SECONDS);
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();

        long start = System.nanoTime();
        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.withRetry(failing, slowBackoff, signal), RecognitionException.class);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        canceller.join();

        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.REQUEST_CANCELLED);
        assertThat(elapsedMs).isLessThan(1500);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void cancelledSignalPreventsAnyAttempt() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        RecognitionException error = catchThrowableOfType(() ->
                orchestrator.execute(failingTimes(calls, 0, transientFailure()), signal), RecognitionException.class);

        assertThat(error.getKind()).isEqualTo(RecognitionErrorKind.REQUEST_CANCELLED);
        assertThat(calls.get()).isEqualTo(0);
    }

    @Test
    void backoffGrowsAndIsCapped() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.delayBeforeRetry(3)).isEqualTo(Duration.ofMillis(4000));
        assertThat(policy.delayBeforeRetry(4)).isEqualTo(Duration.ofMillis(5000));
        assertThat(policy.maxAttempts()).isEqualTo(4);
    }

    @Test
    void invalidPoliciesAreRejected() {
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, 2));
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(10), Duration.ofMillis(5), 2));
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> new RetryPolicy(1, Duration.ofMillis(10), Duration.ofMillis(50), 0.5));
    }
}
