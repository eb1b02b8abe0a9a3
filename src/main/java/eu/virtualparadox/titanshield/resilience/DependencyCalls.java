package eu.virtualparadox.titanshield.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs blocking calls to external services under a caller-supplied timeout and turns every outcome into a
 * {@link DependencyResult}.
 * <p>
 * The call executes on the given executor; on timeout the task is cancelled with interruption so a blocked
 * HTTP read or model run does not keep a worker busy after the caller has moved on.
 */
@Slf4j
public final class DependencyCalls {

    private DependencyCalls() {
        // prevent instantiation
    }

    /**
     * Single attempt bounded by {@code timeout}.
     */
    public static <T> DependencyResult<T> call(final AsyncTaskExecutor executor,
                                               final String operation,
                                               final Duration timeout,
                                               final Callable<T> callable) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return DependencyResult.failure(operation, FailureKind.TIMEOUT, "no time budget left");
        }

        final Future<T> future;
        try {
            future = executor.submit(callable);
        } catch (final RejectedExecutionException e) {
            return DependencyResult.failure(operation, FailureKind.UNAVAILABLE, "executor rejected call: " + e.getMessage());
        }

        try {
            final T value = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (value == null) {
                return DependencyResult.failure(operation, FailureKind.INVALID_RESPONSE, "null result");
            }
            return DependencyResult.success(value);
        } catch (final TimeoutException e) {
            future.cancel(true);
            return DependencyResult.failure(operation, FailureKind.TIMEOUT, "no response within " + timeout.toMillis() + " ms");
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return DependencyResult.failure(operation, FailureKind.INTERRUPTED, "caller interrupted");
        } catch (final CancellationException e) {
            return DependencyResult.failure(operation, FailureKind.INTERRUPTED, "call cancelled");
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof InvalidResponseException) {
                return DependencyResult.failure(operation, FailureKind.INVALID_RESPONSE, cause.getMessage());
            }
            return DependencyResult.failure(operation, FailureKind.UNAVAILABLE,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    /**
     * Backoff for dependency retries: 1 s doubling to at most 8 s, each wait randomised by 20 %.
     */
    public static IntervalFunction exponentialBackoff() {
        return IntervalFunction.ofExponentialRandomBackoff(Duration.ofSeconds(1), 2.0, 0.2, Duration.ofSeconds(8));
    }

    /**
     * Repeats {@link #call} through a Resilience4j {@link Retry} while the failure is retryable. {@code timeout} is
     * the budget for all attempts together; a retry whose backoff would not fit in the rest of it is not started and
     * the last failure is returned.
     *
     * @param maxRetries retries after the first attempt, {@code 0} for a single attempt
     * @param backoff    wait before each retry, by 1-based retry number
     */
    public static <T> DependencyResult<T> callWithRetry(final AsyncTaskExecutor executor,
                                                        final String operation,
                                                        final Duration timeout,
                                                        final int maxRetries,
                                                        final IntervalFunction backoff,
                                                        final Callable<T> callable) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return DependencyResult.failure(operation, FailureKind.TIMEOUT, "no time budget left");
        }
        final long deadline = System.nanoTime() + timeout.toNanos();
        final AtomicInteger attempts = new AtomicInteger();
        final AtomicLong plannedWait = new AtomicLong();

        final RetryConfig config = RetryConfig.<DependencyResult<T>>custom()
                .maxAttempts(Math.max(0, maxRetries) + 1)
                .retryOnResult(result -> {
                    if (result.isSuccess() || !result.failure().isRetryable()) {
                        return false;
                    }
                    final long waitMillis = backoff.apply(attempts.get());
                    plannedWait.set(waitMillis);
                    return TimeUnit.MILLISECONDS.toNanos(waitMillis) < deadline - System.nanoTime();
                })
                .intervalBiFunction((attempt, outcome) -> plannedWait.get())
                .failAfterMaxAttempts(false)
                .build();
        final Retry retry = Retry.of(operation, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} attempt {}/{} failed. Retrying in {} ms",
                operation, event.getNumberOfRetryAttempts(), maxRetries + 1, event.getWaitInterval().toMillis()));

        final Supplier<DependencyResult<T>> attempt = () -> {
            attempts.incrementAndGet();
            return call(executor, operation, Duration.ofNanos(deadline - System.nanoTime()), callable);
        };
        try {
            return retry.executeSupplier(attempt);
        } catch (final RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                return DependencyResult.failure(operation, FailureKind.INTERRUPTED, "interrupted during backoff");
            }
            throw e;
        }
    }
}
