package com.codegraph.builder.heuristics;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language-neutral cyclomatic complexity over raw body text.
 *
 * Used when a parser adapter does not supply an AST-derived count. Comments and
 * string literals are blanked out first, then every branching keyword,
 * short-circuit operator and ternary adds one to a base of 1.
 */
public final class CyclomaticComplexity {

    private static final Pattern BRANCH_KEYWORDS =
            Pattern.compile("\\b(if|elif|for|foreach|while|case|catch|except|and|or)\\b");
    private static final Pattern SHORT_CIRCUIT =
            Pattern.compile("&&|\\|\\||\\?\\?");
    // '?' that is not '??', '?.', '?:', or a generic wildcard like <?>, <? extends T>
    private static final Pattern TERNARY =
            Pattern.compile("(?<![?<])\\?(?![?.:>,])(?!\\s*(extends|super)\\b)");

    private CyclomaticComplexity() {}

    public static int count(String body) {
        if (body == null || body.isBlank()) return 1;
        String code = stripCommentsAndStrings(body);
        return 1 + occurrences(BRANCH_KEYWORDS, code)
                + occurrences(SHORT_CIRCUIT, code)
                + occurrences(TERNARY, code);
    }

    private static int occurrences(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    /**
     * Replaces comment and string-literal contents with spaces, keeping line structure.
     * Handles //, /* *&#47;, # line comments (when followed by whitespace), and
     * '...', "...", `...` literals with backslash escapes.
     */
    static String stripCommentsAndStrings(String src) {
        StringBuilder out = new StringBuilder(src.length());
        int i = 0;
        int n = src.length();
        while (i < n) {
            char c = src.charAt(i);
            char next = i + 1 < n ? src.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                i = skipToLineEnd(src, i, out);
            } else if (c == '#' && (next == ' ' || next == '\t' || next == '\0')) {
                i = skipToLineEnd(src, i, out);
            } else if (c == '/' && next == '*') {
                int end = src.indexOf("*/", i + 2);
                int stop = end < 0 ? n : end + 2;
                blank(src, i, stop, out);
                i = stop;
            } else if (c == '"' || c == '\'' || c == '`') {
                int j = i + 1;
                while (j < n && src.charAt(j) != c) {
                    if (src.charAt(j) == '\\') j++;
                    else if (src.charAt(j) == '\n' && c != '`') break;
                    j++;
                }
                int stop = Math.min(j + 1, n);
                blank(src, i, stop, out);
                i = stop;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int skipToLineEnd(String src, int from, StringBuilder out) {
        int end = src.indexOf('\n', from);
        int stop = end < 0 ? src.length() : end;
        blank(src, from, stop, out);
        return stop;
    }

    private static void blank(String src, int from, int to, StringBuilder out) {
        for (int k = from; k < to; k++) {
            out.append(src.charAt(k) == '\n' ? '\n' : ' ');
        }
    }
}
