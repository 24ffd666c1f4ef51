package fun.fengwk.readex.core.exception;

/**
 * Thrown when the repair fallback could not recover from a parse failure either.
 *
 * @author fengwk
 */
public class ExhaustedFallbackException extends ReadexException {

    public static final String DEFAULT_MESSAGE = "html could not be parsed even after repair";

    public ExhaustedFallbackException(Throwable cause) {
        super(ExtractionStage.FALLBACK, cause == null || cause.getMessage() == null
            ? DEFAULT_MESSAGE : DEFAULT_MESSAGE + ": " + cause.getMessage(), cause);
    }

}
