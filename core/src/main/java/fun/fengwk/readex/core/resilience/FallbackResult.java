package fun.fengwk.readex.core.resilience;

/**
 * Result of a primary/fallback execution. A non-null error means the value came from the fallback.
 *
 * @author fengwk
 */
public record FallbackResult<T>(T value, Throwable error) {

    public static <T> FallbackResult<T> primary(T value) {
        return new FallbackResult<>(value, null);
    }

    public static <T> FallbackResult<T> degraded(T value, Throwable error) {
        return new FallbackResult<>(value, error);
    }

    public boolean isDegraded() {
        return error != null;
    }

}
