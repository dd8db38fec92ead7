package kaspi.lab.archiveService.support;

import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Result of a side effect whose failure may or may not matter to the caller.
 * <ul>
 *     <li>{@code SUCCEEDED}: the operation completed, {@link #value()} may still be empty (e.g. a cache miss)</li>
 *     <li>{@code ABSORBED}: the operation failed, the failure was recorded and must not change the result</li>
 *     <li>{@code FATAL}: the operation failed and the request must fail with {@link #error()}</li>
 * </ul>
 */
public record Outcome<T>(Kind kind, T payload, Throwable error) {

    public enum Kind { SUCCEEDED, ABSORBED, FATAL }

    public static <T> Outcome<T> succeeded(T payload) {
        return new Outcome<>(Kind.SUCCEEDED, payload, null);
    }

    public static <T> Outcome<T> empty() {
        return new Outcome<>(Kind.SUCCEEDED, null, null);
    }

    public static <T> Outcome<T> absorbed(Throwable error) {
        return new Outcome<>(Kind.ABSORBED, null, error);
    }

    public static <T> Outcome<T> fatal(Throwable error) {
        return new Outcome<>(Kind.FATAL, null, error);
    }

    public Optional<T> value() {
        return Optional.ofNullable(payload);
    }

    public boolean isSucceeded() {
        return kind == Kind.SUCCEEDED;
    }

    public boolean isAbsorbed() {
        return kind == Kind.ABSORBED;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }

    /**
     * Back into the reactive pipeline: fatal outcomes become error signals,
     * absorbed ones and empty successes complete empty.
     */
    public Mono<T> toMono() {
        if (isFatal()) {
            return Mono.error(error);
        }
        return Mono.justOrEmpty(payload);
    }
}
