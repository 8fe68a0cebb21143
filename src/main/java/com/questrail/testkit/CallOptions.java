package com.questrail.testkit;

import java.util.List;
import java.util.Optional;

/**
 * The resolved form of a set of {@link CallOption} values.
 */
public final class CallOptions {

    private final CommandExecutorInterceptor interceptor;

    private CallOptions(Builder b) {
        this.interceptor = b.interceptor;
    }

    static CallOptions resolve(List<? extends CallOption> options) {
        Builder b = new Builder();
        for (CallOption o : options) {
            o.applyTo(b);
        }
        return new CallOptions(b);
    }

    public Optional<CommandExecutorInterceptor> interceptor() {
        return Optional.ofNullable(interceptor);
    }

    public static final class Builder {
        private CommandExecutorInterceptor interceptor;

        private Builder() {
        }

        public Builder interceptor(CommandExecutorInterceptor interceptor) {
            this.interceptor = interceptor;
            return this;
        }
    }
}
