package de.mirkosertic.docsearch.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Utility class for cleaning extracted text before it is cached, indexed or snippeted.
 *
 * <p>Every extractor runs its output through {@link #sanitize(String)} and then
 * {@link #normalizePreservingParagraphs(String)}, so that all bodies share the same shape:</p>
 * <ul>
 *   <li>no replacement characters from failed decoding</li>
 *   <li>no control characters other than tab, newline and carriage return</li>
 *   <li>no zero-width or other invisible format characters</li>
 *   <li>paragraphs separated by exactly one blank line</li>
 * </ul>
 */
public final class TextCleaner {

    /**
     * Pattern matching characters to remove:
     * <ul>
     *   <li>U+0000-U+001F: Control characters (except \t \n \r)</li>
     *   <li>U+007F-U+009F: DEL and C1 controls</li>
     *   <li>U+200B-U+200F: Zero-width space, joiners, direction marks</li>
     *   <li>U+2028-U+202F: Line/paragraph separators, embedding controls</li>
     *   <li>U+2060-U+206F: Word joiner and invisible operators</li>
     *   <li>U+FEFF: Byte order mark / zero-width no-break space</li>
     *   <li>U+FFFD: Replacement character</li>
     * </ul>
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +             // Control chars before TAB
        "\u000B-\u000C" +             // Control chars between LF and CR
        "\u000E-\u001F" +             // Control chars after CR
        "\u007F-\u009F" +             // DEL and C1 controls
        "\u200B-\u200F" +             // Zero-width and direction marks
        "\u2028-\u202F" +             // Separators and embedding controls
        "\u2060-\u206F" +             // Invisible operators
        "\uFEFF" +                    // Byte order mark
        "\uFFFD" +                    // Replacement character
        "]"
    );

    // Unicode-aware, so NBSP, ideographic space and the U+2000 range count as whitespace
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n[\\s&&[^\n]]*\n",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern MULTIPLE_WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Remove invalid and invisible characters, keeping all whitespace as-is.
     *
     * @param text the text to clean (may be null)
     * @return sanitized text, or null if input was null
     */
    public static String sanitize(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        final String stripped = INVALID_CHARS.matcher(text).replaceAll("");

        // Remaining format characters (soft hyphen, tag characters, ...) are matched by category
        final StringBuilder result = new StringBuilder(stripped.length());
        stripped.codePoints()
                .filter(cp -> Character.getType(cp) != Character.FORMAT)
                .forEach(result::appendCodePoint);
        return result.toString();
    }

    /**
     * Normalize whitespace while keeping paragraph structure.
     * Line endings become LF, every paragraph is collapsed to a single line with single spaces,
     * and paragraphs are joined by exactly one blank line. Empty paragraphs disappear.
     *
     * @param text the text to normalize (may be null)
     * @return normalized text, never null
     */
    public static String normalizePreservingParagraphs(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        final String unified = text.replace("\r\n", "\n").replace('\r', '\n');

        final List<String> paragraphs = new ArrayList<>();
        for (final String paragraph : PARAGRAPH_BREAK.split(unified)) {
            final String collapsed = MULTIPLE_WHITESPACE.matcher(paragraph).replaceAll(" ").strip();
            if (!collapsed.isEmpty()) {
                paragraphs.add(collapsed);
            }
        }
        return String.join("\n\n", paragraphs);
    }

    /**
     * Sanitize and normalize in one step.
     */
    public static String clean(final String text) {
        return normalizePreservingParagraphs(sanitize(text));
    }
}
