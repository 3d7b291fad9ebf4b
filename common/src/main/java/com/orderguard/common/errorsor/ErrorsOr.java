package com.orderguard.common.errorsor;

import com.orderguard.common.function.ThrowingSupplier;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages. Used where a failure is an expected answer
 * (validation, decoding) rather than an exceptional condition.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** The value, or the exception {@code toException} makes from the errors joined with "; ". */
    default T valueOrThrow(Function<String, ? extends RuntimeException> toException) {
        return fold(v -> v, errors -> {
            throw toException.apply(String.join("; ", errors));
        });
    }

    /** Wrap a throwing supplier, describing a failure with {@code toMsg}. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(toMsg.apply(e));
        }
    }
}
