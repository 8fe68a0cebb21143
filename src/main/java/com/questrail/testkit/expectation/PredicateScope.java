package com.questrail.testkit.expectation;

import com.questrail.testkit.config.ApplicationConfig;

import java.util.Objects;

/**
 * The parts of a test's state that a predicate may inspect.
 */
public record PredicateScope(ApplicationConfig app, PredicateOptions options) {
    public PredicateScope {
        Objects.requireNonNull(app, "app");
        Objects.requireNonNull(options, "options");
    }
}
