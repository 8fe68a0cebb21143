package com.questrail.testkit.expectation;

import com.questrail.testkit.fact.Fact;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SatisfyT
 * =============================================================================
 * A miniature test runner passed to the function given to
 * {@link Expectations#toSatisfy}.
 *
 * <p>The function inspects {@link #facts()} and reports problems through the
 * familiar methods: {@link #error}, {@link #fail}, {@link #fatal},
 * {@link #skip}, and so on. The first failure or skip records the source
 * location that caused it, so the report points at the user's assertion
 * rather than at this class. Methods that call {@link #helper()} are skipped
 * over when finding that location.</p>
 *
 * <h2>Aborting</h2>
 * <p>{@link #failNow()}, {@link #fatal}, {@link #fatalf} and all of the skip
 * methods stop the function immediately by throwing an exception that the
 * expectation catches. Functions must not catch it themselves.</p>
 */
public final class SatisfyT
{
    private static final StackWalker WALKER = StackWalker.getInstance();

    private final String name;
    private final PredicateOptions options;
    private final List<Fact> facts = new ArrayList<>();

    private boolean skipped;
    private boolean failed;
    private String explanation = "";
    private final List<String> messages = new ArrayList<>();
    private final List<Runnable> cleanups = new ArrayList<>();
    private final Set<String> helpers = new HashSet<>();
    private String caller = "";

    SatisfyT(String name, PredicateOptions options) {
        this.name = name;
        this.options = options;
    }

    public String name() {
        return name;
    }

    public PredicateOptions options() {
        return options;
    }

    /**
     * Returns the facts produced by the action, in order.
     */
    public synchronized List<Fact> facts() {
        return Collections.unmodifiableList(new ArrayList<>(facts));
    }

    /**
     * Registers a function to run once the predicate function returns.
     * Cleanups run in reverse order of registration.
     */
    public synchronized void cleanup(Runnable fn) {
        cleanups.add(fn);
    }

    public synchronized void error(Object... args) {
        log(args);
        fail("error");
    }

    public synchronized void errorf(String format, Object... args) {
        logf(format, args);
        fail("errorf");
    }

    public synchronized void fail() {
        fail("fail");
    }

    public synchronized void failNow() {
        fail("failNow");
        throw new Abort();
    }

    public synchronized boolean failed() {
        return failed;
    }

    public synchronized void fatal(Object... args) {
        log(args);
        fail("fatal");
        throw new Abort();
    }

    public synchronized void fatalf(String format, Object... args) {
        logf(format, args);
        fail("fatalf");
        throw new Abort();
    }

    /**
     * Marks the calling method as a helper. Its frames are skipped when
     * attributing a failure to a source location.
     */
    public synchronized void helper() {
        helpers.add(WALKER.walk(s -> s.skip(1).findFirst().map(SatisfyT::key).orElse("")));
    }

    public synchronized void log(Object... args) {
        messages.add(Arrays.stream(args).map(String::valueOf).collect(Collectors.joining(" ")));
    }

    public synchronized void logf(String format, Object... args) {
        messages.add(String.format(format, args));
    }

    public synchronized void skip(Object... args) {
        log(args);
        skip("skip");
    }

    public synchronized void skipNow() {
        skip("skipNow");
    }

    public synchronized void skipf(String format, Object... args) {
        logf(format, args);
        skip("skipf");
    }

    public synchronized boolean skipped() {
        return skipped;
    }

    // ---------------------------------------------------------------------
    // Package
    // ---------------------------------------------------------------------

    synchronized void add(Fact fact) {
        facts.add(fact);
    }

    synchronized void caller(String caller) {
        this.caller = caller;
    }

    synchronized String explanation() {
        return explanation;
    }

    synchronized List<String> messages() {
        return List.copyOf(messages);
    }

    void close() {
        List<Runnable> fns;
        synchronized (this) {
            fns = new ArrayList<>(cleanups);
        }
        for (int i = fns.size() - 1; i >= 0; i--) {
            fns.get(i).run();
        }
    }

    static String key(StackWalker.StackFrame frame) {
        return frame.getClassName() + "#" + frame.getMethodName();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void skip(String fn) {
        skipped = true;
        explain(fn);
        throw new Abort();
    }

    private void fail(String fn) {
        failed = true;
        explain(fn);
    }

    private void explain(String fn) {
        if (!explanation.isEmpty()) {
            return;
        }

        // skip explain(), fail() or skip(), and the public method that called them
        List<StackWalker.StackFrame> frames = WALKER.walk(s -> s.skip(3).limit(50).collect(Collectors.toList()));
        if (frames.isEmpty()) {
            explanation = String.format("%s() called at ???:1", fn);
            return;
        }

        StackWalker.StackFrame first = frames.get(0);
        StackWalker.StackFrame found = frames.get(frames.size() - 1);
        StackWalker.StackFrame prev = null;

        for (StackWalker.StackFrame frame : frames) {
            if (key(frame).equals(caller)) {
                found = prev;
                break;
            }
            if (!helpers.contains(key(frame))) {
                found = frame;
                break;
            }
            prev = frame;
        }

        String file = "???";
        int line = 1;
        if (found != null) {
            if (found.getFileName() != null) {
                file = found.getFileName();
            }
            if (found.getLineNumber() > 0) {
                line = found.getLineNumber();
            }
        }

        if (found == first) {
            explanation = String.format("%s() called at %s:%d", fn, file, line);
        } else {
            explanation = String.format("%s() called indirectly by call at %s:%d", fn, file, line);
        }
    }

    /**
     * Stops the predicate function.
     */
    static final class Abort extends RuntimeException {
        Abort() {
            super(null, null, false, false);
        }
    }
}
