package fun.fengwk.readex.core.exception;

import java.time.Duration;

/**
 * Thrown when an operation does not complete before its deadline. The abandoned work may still be running.
 *
 * @author fengwk
 */
public class ExtractionTimeoutException extends ReadexException {

    private final Duration timeout;

    public ExtractionTimeoutException(Duration timeout) {
        super(ExtractionStage.TIMEOUT, "operation timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

}
