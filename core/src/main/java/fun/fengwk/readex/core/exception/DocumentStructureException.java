package fun.fengwk.readex.core.exception;

/**
 * Thrown when a parsed document has no body element.
 *
 * @author fengwk
 */
public class DocumentStructureException extends ReadexException {

    public static final String DEFAULT_MESSAGE = "document has no body element";

    public DocumentStructureException() {
        super(ExtractionStage.STRUCTURE, DEFAULT_MESSAGE);
    }

    public DocumentStructureException(String message) {
        super(ExtractionStage.STRUCTURE, message);
    }

}
