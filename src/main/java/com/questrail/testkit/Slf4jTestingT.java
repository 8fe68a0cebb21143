package com.questrail.testkit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link TestingT} that writes to SLF4J.
 *
 * <p>Everything logged during the test is repeated in the message of the
 * {@link TestFailedError} thrown by {@link #failNow()}, so that the report
 * appears in the runner's failure output as well as in the log.</p>
 */
public final class Slf4jTestingT implements TestingT {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTestingT.class);

    private final List<String> messages = new ArrayList<>();
    private boolean failed;

    @Override
    public synchronized void log(String message) {
        log.info("{}", message);
        messages.add(message);
    }

    @Override
    public synchronized void fail() {
        failed = true;
    }

    @Override
    public synchronized boolean failed() {
        return failed;
    }

    @Override
    public void failNow() {
        String output;
        synchronized (this) {
            failed = true;
            output = String.join("\n", messages);
        }
        throw new TestFailedError(output);
    }
}
