package fun.fengwk.readex.core.concurrent;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Parallel node mapping configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "readex.parallel")
public class ParallelProperties {

    /**
     * Whether node collections may be processed by the worker pool.
     */
    private boolean enabled = true;

    /**
     * Number of worker threads.
     */
    private int maxParallelism = 4;

    /**
     * Collections of at most this size are processed on the calling thread.
     */
    private int sequentialThreshold = 1;

    /**
     * Collections of at least this size are drained from a shared queue instead of contiguous batches.
     */
    private int queueThreshold = 20;

}
