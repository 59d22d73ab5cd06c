package org.Arcane.otf.config;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of parsing one configuration value: either a value or an error message.
 *
 * @param <T> parsed value type.
 */
public final class ParseResult<T> {
    private final T value;
    private final String error;

    private ParseResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> error(String error) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Applies {@code parser}, turning a thrown {@link RuntimeException} into an error result.
     */
    public static <T> ParseResult<T> attempt(String raw, Function<String, T> parser) {
        try {
            return ok(parser.apply(raw));
        } catch (RuntimeException ex) {
            return error("cannot parse '" + raw + "': " + ex.getMessage());
        }
    }

    public boolean isOk() {
        return error == null;
    }

    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("No value: " + error);
        }
        return value;
    }

    public String error() {
        return error;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : error(error);
    }

    @Override
    public String toString() {
        return isOk() ? "ParseResult{value=" + value + "}" : "ParseResult{error=" + error + "}";
    }
}
