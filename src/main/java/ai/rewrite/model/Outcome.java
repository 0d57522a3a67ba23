package ai.rewrite.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of one pipeline stage: either a value or a {@link RewriteError}.
 * Stages are chained with {@link #flatMap}; the first failure short-circuits the rest.
 */
public interface Outcome<T> {

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(RewriteError error) {
        return new Failure<>(error);
    }

    <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> next);

    default <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
        return flatMap(v -> success(fn.apply(v)));
    }

    record Success<T>(T value) implements Outcome<T> {

        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> next) {
            return Objects.requireNonNull(next.apply(value), "next outcome");
        }
    }

    record Failure<T>(RewriteError error) implements Outcome<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> next) {
            return new Failure<>(error);
        }
    }
}
