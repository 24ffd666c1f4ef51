package fun.fengwk.readex.core.exception;

/**
 * Thrown when the input cannot be tokenized as html at all.
 *
 * @author fengwk
 */
public class HtmlParseException extends ReadexException {

    public static final String DEFAULT_MESSAGE = "html input cannot be parsed";

    public HtmlParseException() {
        super(ExtractionStage.PARSE, DEFAULT_MESSAGE);
    }

    public HtmlParseException(String message) {
        super(ExtractionStage.PARSE, message);
    }

    public HtmlParseException(String message, Throwable cause) {
        super(ExtractionStage.PARSE, message, cause);
    }

}
