package com.questrail.testkit;

import com.questrail.testkit.engine.OperationOption;
import com.questrail.testkit.expectation.MessageComparator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The resolved form of a set of {@link TestOption} values.
 */
public final class TestOptions {

    private final Instant startTime;
    private final List<OperationOption> operationOptions;
    private final MessageComparator comparator;
    private final boolean verbose;
    private final CommandExecutorInterceptor interceptor;

    private TestOptions(Builder b) {
        this.startTime = b.startTime;
        this.operationOptions = List.copyOf(b.operationOptions);
        this.comparator = b.comparator;
        this.verbose = b.verbose;
        this.interceptor = b.interceptor;
    }

    static TestOptions resolve(List<? extends TestOption> options) {
        Builder b = new Builder();
        for (TestOption o : options) {
            o.applyTo(b);
        }
        return new TestOptions(b);
    }

    public Optional<Instant> startTime() {
        return Optional.ofNullable(startTime);
    }

    public List<OperationOption> operationOptions() {
        return operationOptions;
    }

    public MessageComparator comparator() {
        return comparator;
    }

    public boolean verbose() {
        return verbose;
    }

    public Optional<CommandExecutorInterceptor> interceptor() {
        return Optional.ofNullable(interceptor);
    }

    public static final class Builder {
        private Instant startTime;
        private final List<OperationOption> operationOptions = new ArrayList<>(List.of(
                OperationOption.enableIntegrations(false),
                OperationOption.enableProjections(false)));
        private MessageComparator comparator = MessageComparator.DEFAULT;
        private boolean verbose;
        private CommandExecutorInterceptor interceptor;

        private Builder() {
        }

        public Builder startTime(Instant t) {
            this.startTime = t;
            return this;
        }

        public Builder addOperationOption(OperationOption option) {
            operationOptions.add(option);
            return this;
        }

        public Builder comparator(MessageComparator comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder verbose(boolean enabled) {
            this.verbose = enabled;
            return this;
        }

        public Builder interceptor(CommandExecutorInterceptor interceptor) {
            this.interceptor = interceptor;
            return this;
        }
    }
}
