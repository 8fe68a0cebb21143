package com.questrail.testkit.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextDiffTest {

    @Test
    void identicalStrings() {
        assertEquals("same", TextDiff.diff("same", "same"));
    }

    @Test
    void replacementShowsRemovalBeforeInsertion() {
        assertEquals("foo [-bar-]{+qux+} baz", TextDiff.diff("foo bar baz", "foo qux baz"));
    }

    @Test
    void pureInsertionAndRemoval() {
        assertEquals("a{+b+}c", TextDiff.diff("ac", "abc"));
        assertEquals("a[-b-]c", TextDiff.diff("abc", "ac"));
        assertEquals("{+x+}", TextDiff.diff("", "x"));
        assertEquals("[-x-]", TextDiff.diff("x", ""));
    }

    @Test
    void separateChangesAreReportedSeparately() {
        assertEquals(
                "Rec{a=[-1-]{+2+}, b=x, c=[-3-]{+4+}}",
                TextDiff.diff("Rec{a=1, b=x, c=3}", "Rec{a=2, b=x, c=4}"));
    }

    @Test
    void appendsToAnExistingBuffer() {
        StringBuilder out = new StringBuilder("diff: ");
        TextDiff.writeDiff(out, "v", "w");

        assertEquals("diff: [-v-]{+w+}", out.toString());
    }
}
