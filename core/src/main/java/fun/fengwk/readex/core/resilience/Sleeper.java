package fun.fengwk.readex.core.resilience;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;

}
