package com.questrail.testkit.engine;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link Engine#dispatch} and {@link Engine#tick} when one or more
 * handlers reported an error, or when the operation was cancelled.
 *
 * <p>The engine does not stop at the first error; every error from the cycle
 * is available from {@link #errors()}.</p>
 */
public class EngineException extends Exception {

    private final List<Exception> errors;

    public EngineException(List<? extends Exception> errors) {
        super(describe(errors), errors.isEmpty() ? null : errors.get(0));
        this.errors = List.copyOf(errors);
        for (int i = 1; i < this.errors.size(); i++) {
            addSuppressed(this.errors.get(i));
        }
    }

    public List<Exception> errors() {
        return errors;
    }

    private static String describe(List<? extends Exception> errors) {
        if (errors.size() == 1) {
            return errors.get(0).getMessage();
        }
        return errors.size() + " errors occurred: " + errors.stream()
                .map(Exception::getMessage)
                .collect(Collectors.joining("; "));
    }
}
