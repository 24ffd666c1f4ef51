package fun.fengwk.readex.core.exception;

/**
 * Base type of every failure surfaced by an extraction call.
 *
 * @author fengwk
 */
public class ReadexException extends RuntimeException {

    private final ExtractionStage stage;

    public ReadexException(ExtractionStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public ReadexException(ExtractionStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public ExtractionStage getStage() {
        return stage;
    }

}
