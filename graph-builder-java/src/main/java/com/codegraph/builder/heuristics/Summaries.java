package com.codegraph.builder.heuristics;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Synthesizes the one-line {@code short} summary of a declaration.
 *
 * Priority: first line of the doc comment, then a verb template picked from the
 * declaration name, then the name's words themselves.
 */
public final class Summaries {

    public static final int MAX_TOKENS = 80;
    public static final String ELLIPSIS = "...";
    public static final String FALLBACK = "performs operation";

    private static final Pattern COMMENT_PREFIX =
            Pattern.compile("^(/\\*\\*+|/\\*+|\\*+/?|//+|#+|\"\"\"|''')\\s*");
    private static final Pattern COMMENT_SUFFIX =
            Pattern.compile("\\s*(\\*+/|\"\"\"|''')$");
    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern LOWER_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");

    /** Ordered: the first verb equal to the name's first word wins. */
    private static final List<VerbRule> VERB_RULES = List.of(
            new VerbRule("get", "gets {object}"),
            new VerbRule("set", "sets {object}"),
            new VerbRule("create", "creates {object}"),
            new VerbRule("delete", "deletes {object}"),
            new VerbRule("update", "updates {object}"),
            new VerbRule("fetch", "fetches {object}"),
            new VerbRule("find", "finds {object}"),
            new VerbRule("search", "searches {object}"),
            new VerbRule("validate", "validates {object}"),
            new VerbRule("process", "processes {object}"),
            new VerbRule("handle", "handles {object}"),
            new VerbRule("calculate", "calculates {object}"),
            new VerbRule("compute", "computes {object}"),
            new VerbRule("load", "loads {object}"),
            new VerbRule("save", "saves {object}"),
            new VerbRule("is", "checks if {object}"),
            new VerbRule("has", "checks if has {object}"),
            new VerbRule("can", "checks if can {object}"),
            new VerbRule("on", "handles {object}")
    );

    private record VerbRule(String verb, String template) {}

    private Summaries() {}

    /**
     * Summary for a callable.
     *
     * @param doc    raw doc comment or docstring, may be null
     * @param name   declaration name
     * @param params parameter names
     */
    public static String synthesize(String doc, String name, List<String> params) {
        String fromDoc = firstDocLine(doc);
        if (fromDoc != null) {
            return truncate(fromDoc);
        }
        return truncate(fromName(name));
    }

    /**
     * Summary for a declarative kind: the doc line, else "{@code <Kind> <Name>}".
     */
    public static String describe(String doc, String kindLabel, String name) {
        String fromDoc = firstDocLine(doc);
        if (fromDoc != null) {
            return truncate(fromDoc);
        }
        return truncate(kindLabel + " " + name);
    }

    /**
     * First non-empty line of a doc comment with comment markers removed.
     * Block tag lines ({@code @param}, {@code @return}, ...) are skipped.
     * Returns null when nothing usable remains.
     */
    public static String firstDocLine(String doc) {
        if (doc == null || doc.isBlank()) return null;
        for (String raw : doc.split("\\R")) {
            String line = raw.trim();
            line = COMMENT_PREFIX.matcher(line).replaceFirst("");
            line = COMMENT_SUFFIX.matcher(line).replaceFirst("").trim();
            if (line.isEmpty() || line.startsWith("@")) continue;
            return line;
        }
        return null;
    }

    static String fromName(String name) {
        List<String> words = splitWords(name);
        if (words.isEmpty()) return FALLBACK;

        String first = words.get(0);
        for (VerbRule rule : VERB_RULES) {
            if (rule.verb().equals(first)) {
                String object = String.join(" ", words.subList(1, words.size()));
                return rule.template().replace("{object}", object.isEmpty() ? "value" : object);
            }
        }
        return String.join(" ", words);
    }

    /** Splits camelCase, PascalCase, snake_case and kebab-case into lower-case words. */
    static List<String> splitWords(String name) {
        if (name == null) return List.of();
        String spaced = ACRONYM_WORD.matcher(name).replaceAll("$1 $2");
        spaced = LOWER_UPPER.matcher(spaced).replaceAll("$1 $2");
        spaced = NON_ALNUM.matcher(spaced).replaceAll(" ").trim();
        if (spaced.isEmpty()) return List.of();
        return Arrays.stream(spaced.split(" +"))
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    static String truncate(String text) {
        if (TokenEstimator.estimate(text) <= MAX_TOKENS) {
            return text;
        }
        int maxChars = MAX_TOKENS * TokenEstimator.CHARS_PER_TOKEN;
        return text.substring(0, maxChars - ELLIPSIS.length()) + ELLIPSIS;
    }
}
