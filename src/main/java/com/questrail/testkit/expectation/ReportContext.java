package com.questrail.testkit.expectation;

/**
 * Parameters for building a predicate's report.
 *
 * @param treeOk   true if the whole expectation tree passed, in which case
 *                 reports omit their failure diagnostics
 * @param inverted true if the predicate is reported beneath a negation, in
 *                 which case its failure is the desired outcome
 */
public record ReportContext(boolean treeOk, boolean inverted) {

    public ReportContext invert() {
        return new ReportContext(treeOk, !inverted);
    }
}
