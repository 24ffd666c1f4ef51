package fun.fengwk.readex.core.exception;

/**
 * Extraction stage that produced a failure.
 *
 * @author fengwk
 */
public enum ExtractionStage {

    PARSE("parse"),
    STRUCTURE("structure"),
    TIMEOUT("timeout"),
    RETRY("retry"),
    FALLBACK("fallback");

    private final String value;

    ExtractionStage(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

}
