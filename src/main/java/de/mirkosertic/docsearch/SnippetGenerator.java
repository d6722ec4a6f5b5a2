package de.mirkosertic.docsearch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds short excerpts of document text around a query match.
 * <p>
 * Lengths are counted in UTF-16 chars. Window edges that would fall between the two halves
 * of a surrogate pair are moved outwards, so an excerpt never contains a broken code point.
 */
public final class SnippetGenerator {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n[ \t]*\n");

    private SnippetGenerator() {
    }

    /**
     * Excerpt centered on the first case-insensitive occurrence of the trimmed query, extending
     * {@code maxLen / 2} chars to either side. Without an occurrence, the head of the text.
     * Empty text or a blank query yield an empty string.
     */
    public static String makeSnippet(final String text, final String query, final int maxLen) {
        if (text == null || text.isEmpty() || query == null || query.isBlank() || maxLen <= 0) {
            return "";
        }
        final String needle = query.trim();
        final int match = indexOfIgnoreCase(text, needle);
        if (match < 0) {
            return head(text, maxLen);
        }

        final int half = maxLen / 2;
        int start = Math.max(0, match - half);
        int end = Math.min(text.length(), match + needle.length() + half);
        start = alignStart(text, start);
        end = alignEnd(text, end);
        return text.substring(start, end).trim();
    }

    /**
     * One centered excerpt for every blank-line separated paragraph that contains the query.
     */
    public static List<String> makeSnippets(final String text, final String query, final int maxLen) {
        final List<String> snippets = new ArrayList<>();
        if (text == null || text.isEmpty() || query == null || query.isBlank() || maxLen <= 0) {
            return snippets;
        }
        final String needle = query.trim();
        for (final String paragraph : PARAGRAPH_BREAK.split(text)) {
            if (indexOfIgnoreCase(paragraph, needle) >= 0) {
                final String snippet = makeSnippet(paragraph, needle, maxLen);
                if (!snippet.isEmpty()) {
                    snippets.add(snippet);
                }
            }
        }
        return snippets;
    }

    static int indexOfIgnoreCase(final String text, final String needle) {
        final int last = text.length() - needle.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private static String head(final String text, final int maxLen) {
        if (text.length() <= maxLen) {
            return text.trim();
        }
        int end = maxLen;
        // keep the head within maxLen by dropping a dangling high surrogate
        if (Character.isHighSurrogate(text.charAt(end - 1)) && Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return text.substring(0, end).trim();
    }

    private static int alignStart(final String text, final int start) {
        if (start > 0 && start < text.length()
                && Character.isLowSurrogate(text.charAt(start)) && Character.isHighSurrogate(text.charAt(start - 1))) {
            return start - 1;
        }
        return start;
    }

    private static int alignEnd(final String text, final int end) {
        if (end > 0 && end < text.length()
                && Character.isLowSurrogate(text.charAt(end)) && Character.isHighSurrogate(text.charAt(end - 1))) {
            return end + 1;
        }
        return end;
    }
}
