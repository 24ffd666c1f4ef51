package fun.fengwk.readex.core.service;

import fun.fengwk.readex.core.dom.HtmlDocuments;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Extraction deadlines, retries and input limits.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "readex.extraction")
public class ExtractionProperties {

    /**
     * Deadline of a whole extraction in milliseconds.
     */
    private long timeoutMs = 30000;

    /**
     * Deadline of a single parse attempt in milliseconds.
     */
    private long parseTimeoutMs = 5000;

    /**
     * Additional parse attempts after a timed out one.
     */
    private int maxRetries = 3;

    /**
     * Maximum accepted html length in characters, non-positive means unlimited.
     */
    private int maxInputLength = HtmlDocuments.DEFAULT_MAX_INPUT_LENGTH;

    /**
     * Retry a rejected input once after wrapping it into a minimal html skeleton.
     */
    private boolean enableFallback = true;

}
