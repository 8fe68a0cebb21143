package com.questrail.testkit.location;

import java.util.Optional;

/**
 * Location
 * -----------------------------------------------------------------------------
 * A position in the source code, captured by walking the stack.
 *
 * <p>Used to attribute failures to the application or test code that caused
 * them rather than to the engine frames that detected them. Any component may
 * be unknown: {@code function} and {@code file} may be empty and {@code line}
 * may be zero.</p>
 */
public record Location(String function, String file, int line) {

    private static final StackWalker WALKER = StackWalker.getInstance();

    public static final Location UNKNOWN = new Location("", "", 0);

    public Location {
        function = function == null ? "" : function;
        file = file == null ? "" : file;
    }

    /**
     * Returns the location of the code that called the method that called
     * {@code ofCall()}.
     */
    public static Location ofCall() {
        return ofCaller(2);
    }

    /**
     * Returns the location of the frame {@code skip} frames above the caller of
     * this method, where 0 is the caller itself.
     */
    public static Location ofCaller(int skip) {
        return WALKER.walk(frames -> frames
                .skip(skip + 1L)
                .findFirst()
                .map(Location::of)
                .orElse(UNKNOWN));
    }

    /**
     * Returns the location at which {@code t} was constructed.
     */
    public static Location ofThrowable(Throwable t) {
        StackTraceElement[] trace = t.getStackTrace();
        if (trace.length == 0) {
            return UNKNOWN;
        }
        StackTraceElement top = trace[0];
        return new Location(top.getClassName() + "." + top.getMethodName(), top.getFileName(), top.getLineNumber());
    }

    /**
     * Returns a location naming a method of {@code receiver}'s class. The file
     * and line are not available through reflection and are left unknown.
     */
    public static Location ofMethod(Object receiver, String method) {
        return new Location(receiver.getClass().getName() + "." + method, "", 0);
    }

    public static Location of(StackWalker.StackFrame frame) {
        return new Location(frame.getClassName() + "." + frame.getMethodName(), frame.getFileName(), frame.getLineNumber());
    }

    /**
     * Returns "file:line", if the file is known.
     */
    public Optional<String> fileLine() {
        if (file.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(file + ":" + Math.max(line, 1));
    }

    @Override
    public String toString() {
        Optional<String> fl = fileLine();
        if (fl.isPresent()) {
            if (!function.isEmpty()) {
                return fl.get() + " [" + function + "(...)]";
            }
            return fl.get();
        }
        if (!function.isEmpty()) {
            return function + "(...)";
        }
        return "<unknown>";
    }
}
