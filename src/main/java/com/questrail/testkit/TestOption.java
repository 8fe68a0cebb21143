package com.questrail.testkit;

import com.questrail.testkit.config.HandlerType;
import com.questrail.testkit.engine.OperationOption;
import com.questrail.testkit.expectation.MessageComparator;

import java.time.Instant;
import java.util.Objects;

/**
 * TestOption
 * =============================================================================
 * Optional settings applied when a {@link Test} begins.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>integration and projection handlers are disabled</li>
 *   <li>the virtual clock starts at the engine's wall-clock time</li>
 *   <li>messages are compared with {@link MessageComparator#DEFAULT}</li>
 * </ul>
 */
@FunctionalInterface
public interface TestOption
{
    void applyTo(TestOptions.Builder builder);

    /**
     * Sets the initial time of the test's virtual clock.
     */
    static TestOption startTime(Instant t) {
        Objects.requireNonNull(t, "t");
        return b -> b.startTime(t);
    }

    /**
     * Applies {@code option} to every engine operation performed by the test.
     */
    static TestOption withOperationOption(OperationOption option) {
        Objects.requireNonNull(option, "option");
        return b -> b.addOperationOption(option);
    }

    static TestOption enableHandlerType(HandlerType type, boolean enabled) {
        return withOperationOption(OperationOption.enableHandlerType(type, enabled));
    }

    static TestOption withComparator(MessageComparator comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return b -> b.comparator(comparator);
    }

    /**
     * Calls {@code interceptor} whenever a command is executed through
     * {@link Test#commandExecutor()}. The result may also be passed to
     * {@link Actions#call} to intercept commands during that call only.
     *
     * @throws IllegalArgumentException if {@code interceptor} is null
     */
    static InterceptCommandExecutor interceptCommandExecutor(CommandExecutorInterceptor interceptor) {
        if (interceptor == null) {
            throw new IllegalArgumentException("interceptCommandExecutor(<null>): function must not be null");
        }
        return new InterceptCommandExecutor(interceptor);
    }

    /**
     * When enabled, every fact produced by the engine is logged through
     * {@link com.questrail.testkit.fact.Slf4jFactLogger}.
     */
    static TestOption verbose(boolean enabled) {
        return b -> b.verbose(enabled);
    }
}
