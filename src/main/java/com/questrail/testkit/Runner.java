package com.questrail.testkit;

import com.questrail.testkit.api.Application;
import com.questrail.testkit.api.OperationContext;
import com.questrail.testkit.config.ConfigurationException;
import com.questrail.testkit.engine.Engine;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runner
 * =============================================================================
 * Runs tests against a single application.
 *
 * <p>The engine is built once, when the runner is created. Each call to
 * {@link #begin} resets it, so a runner may be shared by every test in a
 * class as long as the tests do not run concurrently.</p>
 *
 * <pre>{@code
 * Runner runner = Runner.create(new BankApplication());
 *
 * runner.begin(t)
 *       .expect(Actions.executeCommand(new OpenAccount("A1")),
 *               Expectations.toRecordEvent(new AccountOpened("A1")));
 * }</pre>
 */
public final class Runner {

    private final Engine engine;

    private Runner(Engine engine) {
        this.engine = engine;
    }

    /**
     * @throws ConfigurationException if the application's configuration is
     *         invalid
     */
    public static Runner create(Application app) throws ConfigurationException {
        return create(app, b -> { });
    }

    /**
     * Creates a runner whose engine is customised by {@code customizer} before
     * it is built.
     *
     * @throws ConfigurationException if the application's configuration is
     *         invalid
     */
    public static Runner create(Application app, Consumer<Engine.Builder> customizer) throws ConfigurationException {
        Objects.requireNonNull(customizer, "customizer");
        Engine.Builder b = Engine.builder(app);
        customizer.accept(b);
        return new Runner(b.build());
    }

    public Engine engine() {
        return engine;
    }

    public Test begin(TestingT t, TestOption... options) {
        return begin(OperationContext.background(), t, options);
    }

    /**
     * Resets the engine and begins a new test.
     *
     * @param ctx the context passed to every engine operation of the test
     */
    public Test begin(OperationContext ctx, TestingT t, TestOption... options) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(t, "t");

        TestOptions o = TestOptions.resolve(Arrays.asList(options));

        engine.reset();

        return new Test(ctx, t, engine, o.startTime().orElseGet(() -> engine.wallClock().now()), o);
    }
}
