package eu.virtualparadox.titanshield.resilience;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Value-or-failure returned by every external collaborator call.
 * <p>
 * Callers branch on {@link #isSuccess()} and take their documented degrade path on failure; nothing at this
 * boundary is reported by throwing.
 *
 * @param <T> value type
 */
public final class DependencyResult<T> {

    private final T value;
    private final DependencyFailure failure;

    private DependencyResult(final T value, final DependencyFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> DependencyResult<T> success(final T value) {
        return new DependencyResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> DependencyResult<T> failure(final DependencyFailure failure) {
        return new DependencyResult<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public static <T> DependencyResult<T> failure(final String operation, final FailureKind kind, final String message) {
        return failure(new DependencyFailure(operation, kind, message));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T value() {
        if (failure != null) {
            throw new IllegalStateException("No value: " + failure.describe());
        }
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * @throws IllegalStateException if this result is a success
     */
    public DependencyFailure failure() {
        if (failure == null) {
            throw new IllegalStateException("Result is a success");
        }
        return failure;
    }

    public <R> DependencyResult<R> map(final Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "DependencyResult[success]" : "DependencyResult[" + failure.describe() + "]";
    }
}
