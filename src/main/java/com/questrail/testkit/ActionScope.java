package com.questrail.testkit;

import com.questrail.testkit.config.ApplicationConfig;
import com.questrail.testkit.engine.Engine;
import com.questrail.testkit.engine.OperationOption;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The parts of a {@link Test} an {@link Action} may use.
 *
 * <p>A scope lives for one action. Operation options added to it apply to
 * the rest of that action only, while changes to the virtual clock are kept
 * by the test.</p>
 */
public final class ActionScope {

    private final Test test;
    private final List<OperationOption> operationOptions;

    ActionScope(Test test, List<OperationOption> operationOptions) {
        this.test = test;
        this.operationOptions = new ArrayList<>(operationOptions);
    }

    public ApplicationConfig app() {
        return test.engine().configuration();
    }

    public Engine engine() {
        return test.engine();
    }

    public TestingT testingT() {
        return test.testingT();
    }

    public Instant virtualClock() {
        return test.virtualClock();
    }

    public void virtualClock(Instant now) {
        test.virtualClock(Objects.requireNonNull(now, "now"));
    }

    public List<OperationOption> operationOptions() {
        return Collections.unmodifiableList(operationOptions);
    }

    public OperationOption[] operationOptionArray() {
        return operationOptions.toArray(new OperationOption[0]);
    }

    public void addOperationOption(OperationOption option) {
        operationOptions.add(Objects.requireNonNull(option, "option"));
    }

    BoundCommandExecutor executor() {
        return test.executor();
    }

    BoundEventRecorder recorder() {
        return test.recorder();
    }
}
