package com.questrail.testkit.expectation;

import java.util.Objects;

/**
 * The verdict of a {@link MessageMatcher} on a single message.
 */
public final class MatchResult {

    private static final MatchResult MATCHED = new MatchResult(Status.MATCHED, "");
    private static final MatchResult IGNORED = new MatchResult(Status.IGNORED, "");

    enum Status {
        MATCHED,
        IGNORED,
        MISMATCH
    }

    private final Status status;
    private final String reason;

    private MatchResult(Status status, String reason) {
        this.status = status;
        this.reason = reason;
    }

    public static MatchResult matched() {
        return MATCHED;
    }

    /**
     * The message is not relevant to the matcher and should not count
     * towards the outcome.
     */
    public static MatchResult ignored() {
        return IGNORED;
    }

    public static MatchResult mismatch(String reason) {
        Objects.requireNonNull(reason, "reason");
        if (reason.isEmpty()) {
            throw new IllegalArgumentException("reason must not be empty");
        }
        return new MatchResult(Status.MISMATCH, reason);
    }

    Status status() {
        return status;
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    public boolean isIgnored() {
        return status == Status.IGNORED;
    }

    /**
     * The reason the message did not match, or an empty string.
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return status == Status.MISMATCH ? "mismatch: " + reason : status.name().toLowerCase();
    }
}
