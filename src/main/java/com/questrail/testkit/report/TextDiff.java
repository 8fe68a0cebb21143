package com.questrail.testkit.report;

/**
 * Character-level diff of two strings, rendered inline.
 *
 * <p>Removed text is wrapped in {@code [-...-]} and inserted text in
 * {@code {+...+}}. Within each changed region the removal is shown before
 * the insertion, for example {@code diff("foo bar baz", "foo qux baz")}
 * renders as {@code "foo [-bar-]{+qux+} baz"}.</p>
 */
public final class TextDiff {

    // Above this many cells the inputs are shown as a single replacement.
    private static final long MAX_CELLS = 4_000_000L;

    private TextDiff() {
    }

    public static String diff(String a, String b) {
        StringBuilder out = new StringBuilder();
        writeDiff(out, a, b);
        return out.toString();
    }

    public static void writeDiff(StringBuilder out, String a, String b) {
        int prefix = commonPrefix(a, b);
        int suffix = commonSuffix(a, b, prefix);

        out.append(a, 0, prefix);

        String x = a.substring(prefix, a.length() - suffix);
        String y = b.substring(prefix, b.length() - suffix);

        if ((long) x.length() * y.length() > MAX_CELLS) {
            flush(out, new StringBuilder(x), new StringBuilder(y));
        } else {
            writeMiddle(out, x, y);
        }

        out.append(a, a.length() - suffix, a.length());
    }

    private static void writeMiddle(StringBuilder out, String x, String y) {
        int n = x.length();
        int m = y.length();

        // lcs[i][j] is the length of the longest common subsequence of x[i:] and y[j:]
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                if (x.charAt(i) == y.charAt(j)) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }

        StringBuilder deleted = new StringBuilder();
        StringBuilder inserted = new StringBuilder();

        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (x.charAt(i) == y.charAt(j)) {
                flush(out, deleted, inserted);
                out.append(x.charAt(i));
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                deleted.append(x.charAt(i++));
            } else {
                inserted.append(y.charAt(j++));
            }
        }

        deleted.append(x, i, n);
        inserted.append(y, j, m);
        flush(out, deleted, inserted);
    }

    private static void flush(StringBuilder out, StringBuilder deleted, StringBuilder inserted) {
        if (deleted.length() > 0) {
            out.append("[-").append(deleted).append("-]");
            deleted.setLength(0);
        }
        if (inserted.length() > 0) {
            out.append("{+").append(inserted).append("+}");
            inserted.setLength(0);
        }
    }

    private static int commonPrefix(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    private static int commonSuffix(String a, String b, int prefix) {
        int n = Math.min(a.length(), b.length()) - prefix;
        int i = 0;
        while (i < n && a.charAt(a.length() - 1 - i) == b.charAt(b.length() - 1 - i)) {
            i++;
        }
        return i;
    }
}
