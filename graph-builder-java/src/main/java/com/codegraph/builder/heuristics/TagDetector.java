package com.codegraph.builder.heuristics;

import com.codegraph.builder.graph.GraphModel.Tag;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Advisory side-effect tagging by keyword families.
 *
 * IO, DB and NETWORK are matched against the declaration's source text and its
 * signature, so a parameter or return type such as {@code EntityManager} counts. ASYNC is
 * raised by an async/await keyword or {@code @Async} in the text, or by a
 * future/promise-shaped return type in the signature. PURE is attached only when
 * none of those matched.
 */
public final class TagDetector {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern IO = Pattern.compile(
            "\\b(open|read|write|close|files?|fs|readline|readlines|fopen|fwrite)\\b"
            + "|\\b(read|write)(all|line|lines|string|bytes|text)\\b"
            + "|\\b(file|buffered)(reader|writer|inputstream|outputstream)\\b", FLAGS);

    private static final Pattern DB = Pattern.compile(
            "\\b(query|execute|executequery|executeupdate|select|insert|update|delete"
            + "|db|database|sql|jdbc|cursor|entitymanager|jdbctemplate)\\b", FLAGS);

    private static final Pattern NETWORK = Pattern.compile(
            "\\b(fetch|https?|request|axios|ajax|socket|websocket|ws|urllib|requests"
            + "|httpclient|resttemplate|webclient|url)\\b", FLAGS);

    private static final Pattern ASYNC_KEYWORD = Pattern.compile("\\b(async|await)\\b", FLAGS);

    private static final Pattern ASYNC_RETURN = Pattern.compile(
            "\\b(Promise|\\w*Future|CompletionStage|Awaitable|Coroutine|Mono|Flux)\\b");

    private static final String RETURN_ARROW = "->";

    private TagDetector() {}

    /**
     * @param code full source text of the declaration
     * @param sig  canonical signature, {@code (params)->Return} for callables
     * @return tags in canonical order, never empty
     */
    public static List<Tag> detect(String code, String sig) {
        String text = code == null ? "" : code;
        String searched = sig == null ? text : text + " " + sig;
        Set<Tag> tags = EnumSet.noneOf(Tag.class);

        if (IO.matcher(searched).find()) tags.add(Tag.IO);
        if (DB.matcher(searched).find()) tags.add(Tag.DB);
        if (NETWORK.matcher(searched).find()) tags.add(Tag.NETWORK);
        if (hasAsyncSignal(text, sig)) tags.add(Tag.ASYNC);

        if (tags.isEmpty()) tags.add(Tag.PURE);
        return List.copyOf(tags);
    }

    static boolean hasAsyncSignal(String code, String sig) {
        if (ASYNC_KEYWORD.matcher(code).find()) return true;
        return ASYNC_RETURN.matcher(returnType(sig)).find();
    }

    private static String returnType(String sig) {
        if (sig == null) return "";
        int arrow = sig.lastIndexOf(RETURN_ARROW);
        return arrow < 0 ? "" : sig.substring(arrow + RETURN_ARROW.length());
    }
}
