package com.questrail.testkit.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Report
 * -----------------------------------------------------------------------------
 * The outcome of an expectation, in a form that can be rendered for a human.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li><b>criteria</b>: what the expectation required, as an imperative
 *       phrase such as "record a specific 'OrderPlaced' event"</li>
 *   <li><b>outcome</b>: an optional short summary shown after the
 *       criteria</li>
 *   <li><b>explanation</b>: what actually happened, if the expectation
 *       failed</li>
 *   <li><b>sections</b>: titled blocks such as suggestions and diffs</li>
 *   <li><b>sub-reports</b>: the reports of child expectations</li>
 * </ul>
 *
 * <h2>Rendering</h2>
 * <pre>
 * ✗ record a specific 'com.example.OrderPlaced' event
 *
 *   | EXPLANATION
 *   |     a similar event was recorded by the 'orders' aggregate message handler
 *   |
 *   | SUGGESTIONS
 *   |     • check the content of the message
 * </pre>
 */
public final class Report {

    private static final String SECTIONS_INDENT = "  | ";
    private static final String SECTION_CONTENT_INDENT = "    ";
    private static final String SUB_REPORTS_INDENT = "    ";

    private final boolean treeOk;
    private final boolean ok;
    private final String criteria;
    private String outcome = "";
    private String explanation = "";
    private final List<ReportSection> sections = new ArrayList<>();
    private final List<Report> subReports = new ArrayList<>();

    public Report(boolean treeOk, boolean ok, String criteria) {
        this.treeOk = treeOk;
        this.ok = ok;
        this.criteria = criteria;
    }

    /**
     * True if the whole expectation tree this report belongs to passed.
     */
    public boolean treeOk() {
        return treeOk;
    }

    public boolean ok() {
        return ok;
    }

    public String criteria() {
        return criteria;
    }

    public String outcome() {
        return outcome;
    }

    public Report outcome(String outcome) {
        this.outcome = outcome == null ? "" : outcome;
        return this;
    }

    public String explanation() {
        return explanation;
    }

    public Report explanation(String explanation) {
        this.explanation = explanation == null ? "" : explanation;
        return this;
    }

    /**
     * Returns the section with the given title, adding it if it does not
     * already exist.
     */
    public ReportSection section(String title) {
        for (ReportSection s : sections) {
            if (s.title().equals(title)) {
                return s;
            }
        }

        ReportSection s = new ReportSection(title);
        sections.add(s);
        return s;
    }

    public List<ReportSection> sections() {
        return Collections.unmodifiableList(sections);
    }

    public Report append(Report subReport) {
        subReports.add(subReport);
        return this;
    }

    public List<Report> subReports() {
        return Collections.unmodifiableList(subReports);
    }

    public void writeTo(StringBuilder out) {
        out.append(ok ? "✓" : "✗").append(' ').append(criteria);

        if (!outcome.isEmpty()) {
            out.append(" (").append(outcome).append(')');
        }

        out.append('\n');

        if (!sections.isEmpty() || !explanation.isEmpty()) {
            StringBuilder body = new StringBuilder();

            if (!explanation.isEmpty()) {
                body.append("EXPLANATION\n");
                body.append(indent(explanation, SECTION_CONTENT_INDENT));
                body.append('\n');

                if (!sections.isEmpty()) {
                    body.append('\n');
                }
            }

            for (int i = 0; i < sections.size(); i++) {
                ReportSection s = sections.get(i);
                body.append(s.title().toUpperCase()).append('\n');
                body.append(indent(s.content().strip(), SECTION_CONTENT_INDENT));
                body.append('\n');

                if (i < sections.size() - 1) {
                    body.append('\n');
                }
            }

            out.append('\n');
            out.append(indent(body.toString(), SECTIONS_INDENT));
            out.append('\n');
        }

        for (Report sub : subReports) {
            StringBuilder nested = new StringBuilder();
            sub.writeTo(nested);
            out.append(indent(nested.toString(), SUB_REPORTS_INDENT));
        }
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        writeTo(out);
        return out.toString();
    }

    /**
     * Prefixes every line of {@code text} with {@code prefix}. A trailing
     * newline does not start a new line.
     */
    static String indent(String text, String prefix) {
        if (text.isEmpty()) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length() + prefix.length() * 4);
        boolean lineStart = true;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (lineStart) {
                out.append(prefix);
                lineStart = false;
            }
            out.append(c);
            if (c == '\n') {
                lineStart = true;
            }
        }

        return out.toString();
    }
}
