package com.hcltech.stackorder.common.errorsor;

import com.hcltech.stackorder.common.function.ThrowingSupplier;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of human readable error messages.
 * <p>
 * Used wherever problems should be collected and reported together (for example, every broken
 * {@code dependencies.json} in a repository) rather than thrown one at a time.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    /** {0} is the exception's simple class name, {1} its message. */
    static <T> ErrorsOr<T> error(String pattern, Exception e) {
        return new Error<>(List.of(MessageFormat.format(pattern, e.getClass().getSimpleName(), e.getMessage())));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /**
     * Collapses a list of results into a result of a list. All errors are kept, in order.
     */
    static <T> ErrorsOr<List<T>> sequence(List<ErrorsOr<T>> all) {
        List<T> values = new ArrayList<>(all.size());
        List<String> errors = new ArrayList<>();
        for (ErrorsOr<T> eo : all) {
            if (eo.isError()) errors.addAll(eo.getErrors());
            else values.add(eo.getValue().get());
        }
        return errors.isEmpty() ? ErrorsOr.lift(List.copyOf(values)) : ErrorsOr.errors(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    /** Runs {@code body}; an exception becomes a single error formatted by {@code toMsg}. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(toMsg.apply(e));
        }
    }
}
