package org.sjsu.puffplanner.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MarkdownUtil {

    // Every character Telegram reserves in MarkdownV2, backslash included
    private static final Pattern MARKDOWN_V2_ESCAPE_PATTERN =
            Pattern.compile("([_*()\\[\\]~`>#+\\-=|{}.!\\\\])");

    private MarkdownUtil() {
    }

    public static String escapeMarkdownV2(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = MARKDOWN_V2_ESCAPE_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement("\\" + matcher.group(1)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
