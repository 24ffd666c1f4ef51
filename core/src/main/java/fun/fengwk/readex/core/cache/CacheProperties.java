package fun.fengwk.readex.core.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Extraction cache configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "readex.cache")
public class CacheProperties {

    /**
     * Whether parsed documents, located nodes and scores are memoized.
     */
    private boolean enabled = true;

    /**
     * Time to live of every cache entry in milliseconds.
     */
    private long expirationMs = 5 * 60 * 1000L;

    /**
     * Interval of the background expiry sweep in milliseconds; non-positive disables the sweep.
     */
    private long sweepIntervalMs = 30 * 1000L;

    /**
     * Maximum number of parsed documents.
     */
    private int documentMaxSize = 200;

    /**
     * Maximum number of located content nodes.
     */
    private int contentNodeMaxSize = 200;

    /**
     * Maximum number of node scores.
     */
    private int scoreMaxSize = 2000;

}
