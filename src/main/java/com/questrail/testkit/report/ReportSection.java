package com.questrail.testkit.report;

import java.util.Objects;

/**
 * A titled block of free text within a {@link Report}.
 */
public final class ReportSection {

    private final String title;
    private final StringBuilder content = new StringBuilder();

    ReportSection(String title) {
        this.title = Objects.requireNonNull(title, "title");
    }

    public String title() {
        return title;
    }

    public String content() {
        return content.toString();
    }

    /**
     * Appends a line of text, formatted with {@link String#format}.
     */
    public ReportSection append(String format, Object... args) {
        content.append(args.length == 0 ? format : String.format(format, args)).append('\n');
        return this;
    }

    /**
     * Appends a line of text prefixed with a bullet.
     */
    public ReportSection appendListItem(String format, Object... args) {
        return append("• " + format, args);
    }

    /**
     * Appends text verbatim, without a trailing newline.
     */
    public ReportSection appendRaw(String text) {
        content.append(text);
        return this;
    }
}
