package com.tyron.keystone.api.container;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a resolution: either a value or the failure that prevented it.
 * <p>
 * {@link ServiceContainer#resolve(Class)} and {@link ServiceContainer#tryResolve(Class)} are thin
 * wrappers over {@link ServiceContainer#resolveResult(Class)}.
 */
public final class Resolution<T> {

    private final T value;
    private final RuntimeException failure;

    private Resolution(T value, RuntimeException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Resolution<T> success(@NotNull T value) {
        return new Resolution<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Resolution<T> failure(@NotNull RuntimeException failure) {
        return new Resolution<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @return the resolved value, or throws the recorded failure.
     */
    public T getOrThrow() {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    public @Nullable T getOrNull() {
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public @Nullable RuntimeException getFailure() {
        return failure;
    }

    /**
     * @return a human readable reason for the failure, or {@code null} on success.
     */
    public @Nullable String getReason() {
        return failure == null ? null : failure.getMessage();
    }

    public <R> Resolution<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess() ? "Resolution{value=" + value + "}" : "Resolution{failure=" + failure + "}";
    }
}
