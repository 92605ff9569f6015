package eu.nurkert.depSync.net;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded retry with exponential backoff for remote calls.
 * <p>
 * The delay before attempt {@code n + 1} is {@code baseDelay * 2^(n - 1)}, capped at
 * {@code maxDelay}. A 404 response is final: it is never retried.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    private static final Logger LOGGER = Logger.getLogger(RetryPolicy.class.getName());

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        this(maxAttempts, baseDelay, maxDelay, Sleeper.THREAD);
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * A policy that performs exactly one attempt.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code attempt} until it succeeds, fails with a non-retryable error or the
     * attempt budget is exhausted. The last failure is rethrown unchanged.
     */
    public <T> T execute(String description, Attempt<T> attempt) throws IOException {
        IOException lastException = null;
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            try {
                return attempt.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Request interrupted: " + description, e);
            } catch (IOException e) {
                lastException = e;
                if (attemptNumber >= maxAttempts || !isRetryable(e)) {
                    throw e;
                }
                Duration delay = delayBeforeRetry(attemptNumber);
                LOGGER.log(Level.FINE, "Attempt {0}/{1} for {2} failed ({3}); retrying in {4} ms",
                        new Object[]{attemptNumber, maxAttempts, description, e.getMessage(), delay.toMillis()});
                sleep(delay, description);
            }
        }
        throw lastException != null ? lastException : new IOException("No attempt made for " + description);
    }

    Duration delayBeforeRetry(int failedAttempt) {
        long factor = 1L << Math.min(30, failedAttempt - 1);
        Duration delay = baseDelay.multipliedBy(factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    static boolean isRetryable(IOException exception) {
        if (exception instanceof HttpException httpException) {
            return !httpException.isNotFound();
        }
        return true;
    }

    private void sleep(Duration delay, String description) throws IOException {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to retry " + description, e);
        }
    }

    /**
     * A single remote call.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws IOException, InterruptedException;
    }

    /**
     * Blocks between attempts; replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

        void sleep(Duration delay) throws InterruptedException;
    }
}
