package fun.fengwk.readex.core.resilience;

import fun.fengwk.readex.core.exception.ExtractionStage;
import fun.fengwk.readex.core.exception.ExtractionTimeoutException;
import fun.fengwk.readex.core.exception.HtmlParseException;
import fun.fengwk.readex.core.exception.RetryExhaustedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ResilienceTest {

    private final List<Duration> pauses = new ArrayList<>();

    private final Resilience resilience = new Resilience(pauses::add);

    @AfterEach
    void tearDown() {
        resilience.shutdown();
    }

    @Test
    public void shouldReturnResultBeforeDeadline() {
        assertThat(resilience.withTimeout(Duration.ofSeconds(5), () -> "done")).isEqualTo("done");
    }

    @Test
    public void shouldAbandonSlowTask() {
        CountDownLatch never = new CountDownLatch(1);

        assertThatThrownBy(() -> resilience.withTimeout(Duration.ofMillis(50), () -> {
            never.await();
            return "late";
        }))
            .isInstanceOf(ExtractionTimeoutException.class)
            .hasMessage("operation timed out after 50ms");
    }

    @Test
    public void shouldRethrowTaskFailureFromTimeoutWrapper() {
        assertThatThrownBy(() -> resilience.withTimeout(Duration.ofSeconds(5), () -> {
            throw new HtmlParseException("broken");
        }))
            .isInstanceOf(HtmlParseException.class)
            .hasMessage("broken");
    }

    @Test
    public void shouldRetryWithExponentialBackoff() {
        AtomicInteger attempts = new AtomicInteger();

        String result = resilience.withRetry(3, () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(pauses).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    public void shouldReportAttemptsWhenExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> resilience.withRetry(2, () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("still down");
        }))
            .isInstanceOf(RetryExhaustedException.class)
            .hasMessage("operation failed after 2 retries: still down")
            .hasCauseInstanceOf(IllegalStateException.class)
            .extracting(ex -> ((RetryExhaustedException) ex).getStage())
            .isEqualTo(ExtractionStage.RETRY);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(pauses).hasSize(2);
    }

    @Test
    public void shouldKeepStageOfLastTypedError() {
        RetryExhaustedException ex = new RetryExhaustedException(1, new ExtractionTimeoutException(Duration.ofMillis(10)));

        assertThat(ex.getStage()).isEqualTo(ExtractionStage.TIMEOUT);
        assertThat(ex.getRetries()).isEqualTo(1);
    }

    @Test
    public void shouldNotRetryNonRetryableErrors() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> resilience.withRetry(3, () -> {
            attempts.incrementAndGet();
            throw new HtmlParseException("fatal");
        }, ExtractionTimeoutException.class::isInstance))
            .isInstanceOf(HtmlParseException.class);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(pauses).isEmpty();
    }

    @Test
    public void shouldComputeBackoff() {
        assertThat(Resilience.backoff(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(Resilience.backoff(3)).isEqualTo(Duration.ofMillis(800));
    }

    @Test
    public void shouldUsePrimaryResultWhenItSucceeds() {
        FallbackResult<String> result = resilience.withFallback(() -> "primary", () -> "fallback");

        assertThat(result.value()).isEqualTo("primary");
        assertThat(result.isDegraded()).isFalse();
    }

    @Test
    public void shouldReturnFallbackAlongsideOriginalError() {
        IllegalStateException failure = new IllegalStateException("primary failed");

        FallbackResult<String> result = resilience.withFallback(() -> {
            throw failure;
        }, () -> "fallback");

        assertThat(result.value()).isEqualTo("fallback");
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.error()).isSameAs(failure);
    }

}
