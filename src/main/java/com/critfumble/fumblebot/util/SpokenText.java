package com.critfumble.fumblebot.util;

import java.util.regex.Pattern;

/**
 * Turns markdown chat text into plain text suitable for speech synthesis.
 */
public final class SpokenText {

    private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```", Pattern.MULTILINE);
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s*", Pattern.MULTILINE);
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]+\\)");
    private static final Pattern BOLD_ITALIC = Pattern.compile("(\\*\\*|__|\\*|_)(.+?)\\1");
    private static final Pattern STRIKE = Pattern.compile("~~(.+?)~~");
    private static final Pattern QUOTE = Pattern.compile("^>\\s?", Pattern.MULTILINE);
    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*[-*]\\s+|^\\s*\\d+\\.\\s+", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SpokenText() {}

    /**
     * Strips markdown, code and URLs.
     *
     * @param markdown chat text; null yields ""
     * @return single-line plain text
     */
    public static String fromMarkdown(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        String out = CODE_BLOCK.matcher(markdown).replaceAll(" ");
        out = INLINE_CODE.matcher(out).replaceAll("$1");
        out = LINK.matcher(out).replaceAll("$1");
        out = URL.matcher(out).replaceAll("");
        out = HEADING.matcher(out).replaceAll("");
        out = STRIKE.matcher(out).replaceAll("$1");
        out = BOLD_ITALIC.matcher(out).replaceAll("$2");
        out = QUOTE.matcher(out).replaceAll("");
        out = LIST_MARKER.matcher(out).replaceAll("");
        return WHITESPACE.matcher(out).replaceAll(" ").trim();
    }
}
