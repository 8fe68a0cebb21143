package com.questrail.testkit.fact;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A message logged by a handler through its scope, kept as the original
 * format string and arguments.
 */
public record LogEntry(String format, List<Object> arguments) {
    public LogEntry {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(arguments, "arguments");
    }

    public static LogEntry of(String format, Object... args) {
        return new LogEntry(format, Collections.unmodifiableList(Arrays.asList(args.clone())));
    }

    /**
     * Returns the formatted message.
     */
    public String text() {
        return String.format(format, arguments.toArray());
    }

    @Override
    public String toString() {
        return text();
    }
}
