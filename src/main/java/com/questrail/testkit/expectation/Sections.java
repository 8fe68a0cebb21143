package com.questrail.testkit.expectation;

/**
 * Titles of the report sections used by the built-in expectations.
 */
final class Sections {

    static final String SUGGESTIONS = "Suggestions";
    static final String LOG_MESSAGES = "Log Messages";
    static final String MESSAGE_DIFF = "Message Diff";
    static final String MESSAGE_TYPE_DIFF = "Message Type Diff";
    static final String FAILED_MATCHES = "Failed Matches";

    private Sections() {
    }
}
