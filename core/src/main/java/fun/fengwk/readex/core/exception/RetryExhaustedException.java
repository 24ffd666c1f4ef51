package fun.fengwk.readex.core.exception;

/**
 * Thrown when an operation keeps failing after all retries. The stage of the last failure is kept.
 *
 * @author fengwk
 */
public class RetryExhaustedException extends ReadexException {

    private final int retries;

    public RetryExhaustedException(int retries, Throwable lastError) {
        super(resolveStage(lastError), buildMessage(retries, lastError), lastError);
        this.retries = retries;
    }

    public int getRetries() {
        return retries;
    }

    private static ExtractionStage resolveStage(Throwable lastError) {
        if (lastError instanceof ReadexException readexException) {
            return readexException.getStage();
        }
        return ExtractionStage.RETRY;
    }

    private static String buildMessage(int retries, Throwable lastError) {
        String message = "operation failed after " + retries + " retries";
        if (lastError == null || lastError.getMessage() == null) {
            return message;
        }
        return message + ": " + lastError.getMessage();
    }

}
