package fun.fengwk.readex.core.resilience;

import fun.fengwk.readex.core.exception.ExtractionTimeoutException;
import fun.fengwk.readex.core.exception.RetryExhaustedException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Timeout, retry and fallback wrappers.
 *
 * <p>A timed out task is abandoned, not interrupted: it keeps its thread and whatever it holds until it
 * finishes on its own.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class Resilience {

    static final Duration BASE_BACKOFF = Duration.ofMillis(100);

    private final ExecutorService executor;
    private final Sleeper sleeper;
    private final AtomicInteger threadIdGen = new AtomicInteger(1);

    @Autowired
    public Resilience() {
        this(Sleeper.THREAD);
    }

    Resilience(Sleeper sleeper) {
        this.sleeper = sleeper;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("readex-timeout-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> T withTimeout(Duration timeout, Callable<T> task) {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("operation timed out, timeoutMs={}", timeout.toMillis());
            throw new ExtractionTimeoutException(timeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for operation", ex);
        } catch (ExecutionException ex) {
            throw propagate(ex.getCause() == null ? ex : ex.getCause());
        }
    }

    public <T> T withRetry(int maxRetries, Callable<T> task) {
        return withRetry(maxRetries, task, ex -> true);
    }

    /**
     * Runs the task, re-invoking it up to {@code maxRetries} more times while it fails with a retryable error.
     * Attempt {@code i} is followed by a {@code 100ms * 2^i} pause.
     *
     * @throws RetryExhaustedException when every attempt failed.
     */
    public <T> T withRetry(int maxRetries, Callable<T> task, Predicate<RuntimeException> retryable) {
        int retries = Math.max(0, maxRetries);
        RuntimeException lastError = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return call(task);
            } catch (RuntimeException ex) {
                if (!retryable.test(ex)) {
                    throw ex;
                }
                lastError = ex;
                if (attempt < retries) {
                    Duration backoff = backoff(attempt);
                    log.warn("operation failed, attempt={}, backoffMs={}, error={}",
                        attempt + 1, backoff.toMillis(), ex.getMessage());
                    pause(backoff);
                }
            }
        }
        throw new RetryExhaustedException(retries, lastError);
    }

    /**
     * Runs the primary task, switching to the fallback when it fails. The fallback must not fail.
     */
    public <T> FallbackResult<T> withFallback(Callable<T> primary, Supplier<T> fallback) {
        try {
            return FallbackResult.primary(call(primary));
        } catch (RuntimeException ex) {
            log.warn("primary operation failed, using fallback, error={}", ex.getMessage());
            return FallbackResult.degraded(fallback.get(), ex);
        }
    }

    static Duration backoff(int attempt) {
        return BASE_BACKOFF.multipliedBy(1L << Math.min(attempt, 20));
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted during retry backoff", ex);
        }
    }

    private static <T> T call(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("operation failed: " + ex.getMessage(), ex);
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("operation failed: " + cause.getMessage(), cause);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

}
