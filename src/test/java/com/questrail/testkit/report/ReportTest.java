package com.questrail.testkit.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReportTest
 * -----------------------------------------------------------------------------
 * Rendering of reports, sections and sub-reports.
 */
class ReportTest {

    @Test
    void passingReportIsOneLine() {
        assertEquals("✓ do the thing\n", new Report(true, true, "do the thing").toString());
    }

    @Test
    void outcomeFollowsTheCriteria() {
        Report r = new Report(false, false, "do the thing").outcome("it was not done");

        assertEquals("✗ do the thing (it was not done)\n", r.toString());
    }

    @Test
    void explanationAndSectionsAreIndented() {
        Report r = new Report(false, false, "do the thing")
                .outcome("bad")
                .explanation("it happened");
        r.section("Suggestions").appendListItem("try %s", "harder");

        assertEquals(
                "✗ do the thing (bad)\n"
                        + "\n"
                        + "  | EXPLANATION\n"
                        + "  |     it happened\n"
                        + "  | \n"
                        + "  | SUGGESTIONS\n"
                        + "  |     • try harder\n"
                        + "\n",
                r.toString());
    }

    @Test
    void sectionsAreReusedByTitle() {
        Report r = new Report(false, false, "x");
        r.section("Log Messages").append("one");
        r.section("Log Messages").append("two");

        assertEquals(1, r.sections().size());
        assertEquals("one\ntwo\n", r.sections().get(0).content());
    }

    @Test
    void subReportsAreNested() {
        Report parent = new Report(false, false, "all of").outcome("1 of the expectations failed");
        parent.append(new Report(false, true, "pass"));
        parent.append(new Report(false, false, "fail").explanation("no"));

        assertEquals(
                "✗ all of (1 of the expectations failed)\n"
                        + "    ✓ pass\n"
                        + "    ✗ fail\n"
                        + "    \n"
                        + "      | EXPLANATION\n"
                        + "      |     no\n"
                        + "    \n",
                parent.toString());
    }

    @Test
    void rawSectionContentIsNotTerminated() {
        Report r = new Report(false, false, "x");
        r.section("Message Diff").appendRaw("a[-b-]{+c+}");

        assertTrue(r.toString().endsWith("  | MESSAGE DIFF\n  |     a[-b-]{+c+}\n\n"));
    }

    @Test
    void indentDoesNotPrefixTrailingNewline() {
        assertEquals("> a\n> b\n", Report.indent("a\nb\n", "> "));
        assertEquals("", Report.indent("", "> "));
    }
}
