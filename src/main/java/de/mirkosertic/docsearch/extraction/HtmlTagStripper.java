package de.mirkosertic.docsearch.extraction;

import de.mirkosertic.docsearch.util.TextCleaner;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fallback extractor for HTML when the Tika parser is not available. Removes markup with a
 * single character scan, drops script and style content, turns block level tags into paragraph
 * breaks and decodes the common character entities.
 */
public class HtmlTagStripper implements ExtractionStrategy {

    private static final Set<String> BLOCK_TAGS = Set.of(
            "p", "div", "br", "h1", "h2", "h3", "h4", "h5", "h6", "li", "tr", "pre",
            "blockquote", "table", "ul", "ol", "section", "article", "header", "footer", "hr"
    );
    private static final Set<String> SKIPPED_CONTENT = Set.of("script", "style", "head");

    private final int textMaxBytes;

    public HtmlTagStripper(final int textMaxBytes) {
        this.textMaxBytes = textMaxBytes;
    }

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.FALLBACK;
    }

    @Override
    public boolean supports(final Path file) {
        return FileTypes.isHtml(file);
    }

    @Override
    public ExtractedDocument extract(final Path file) throws ExtractionException {
        final String html;
        try {
            html = FileTypes.decodeUtf8(FileTypes.readPrefix(file, textMaxBytes));
        } catch (final IOException e) {
            throw new ExtractionException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        final String title = FileTypes.titleOrFileName(extractTitle(html), file);
        final String body = TextCleaner.clean(stripTags(html));
        return new ExtractedDocument(title, file.toString(), List.of(PageText.unpaged(body)), ExtractorKind.FALLBACK);
    }

    static @Nullable String extractTitle(final String html) {
        final String lower = html.toLowerCase(Locale.ROOT);
        final int open = lower.indexOf("<title");
        if (open < 0) {
            return null;
        }
        final int contentStart = lower.indexOf('>', open);
        if (contentStart < 0) {
            return null;
        }
        final int close = lower.indexOf("</title", contentStart);
        if (close < 0) {
            return null;
        }
        final String title = TextCleaner.clean(decodeEntities(html.substring(contentStart + 1, close)));
        return title.isEmpty() ? null : title.replace("\n\n", " ");
    }

    static String stripTags(final String html) {
        final StringBuilder text = new StringBuilder(html.length());
        @Nullable String skipUntil = null;
        int i = 0;
        while (i < html.length()) {
            final char c = html.charAt(i);
            if (c != '<') {
                if (skipUntil == null) {
                    text.append(c);
                }
                i++;
                continue;
            }

            if (html.startsWith("<!--", i)) {
                final int end = html.indexOf("-->", i + 4);
                i = end < 0 ? html.length() : end + 3;
                continue;
            }

            final int end = html.indexOf('>', i);
            if (end < 0) {
                // Unterminated tag, rest is markup
                break;
            }
            final String tagName = tagName(html.substring(i + 1, end));
            final boolean closing = html.charAt(i + 1) == '/';
            i = end + 1;

            if (skipUntil != null) {
                if (closing && skipUntil.equals(tagName)) {
                    skipUntil = null;
                }
                continue;
            }
            if (!closing && SKIPPED_CONTENT.contains(tagName) && html.charAt(end - 1) != '/') {
                skipUntil = tagName;
                continue;
            }
            if (BLOCK_TAGS.contains(tagName)) {
                text.append("\n\n");
            } else {
                text.append(' ');
            }
        }
        return decodeEntities(text.toString());
    }

    private static String tagName(final String tagContent) {
        int start = 0;
        while (start < tagContent.length() && (tagContent.charAt(start) == '/' || tagContent.charAt(start) == '!')) {
            start++;
        }
        int end = start;
        while (end < tagContent.length() && Character.isLetterOrDigit(tagContent.charAt(end))) {
            end++;
        }
        return tagContent.substring(start, end).toLowerCase(Locale.ROOT);
    }

    static String decodeEntities(final String text) {
        if (!text.contains("&")) {
            return text;
        }
        final StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '&') {
                final int semicolon = text.indexOf(';', i + 1);
                if (semicolon > i && semicolon <= i + 10) {
                    final String decoded = decodeEntity(text.substring(i + 1, semicolon));
                    if (decoded != null) {
                        result.append(decoded);
                        i = semicolon + 1;
                        continue;
                    }
                }
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    private static @Nullable String decodeEntity(final String entity) {
        if (entity.length() > 1 && entity.charAt(0) == '#') {
            try {
                final int codePoint = entity.charAt(1) == 'x' || entity.charAt(1) == 'X'
                        ? Integer.parseInt(entity.substring(2), 16)
                        : Integer.parseInt(entity.substring(1), 10);
                return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : null;
            } catch (final NumberFormatException e) {
                return null;
            }
        }
        return switch (entity) {
            case "amp" -> "&";
            case "lt" -> "<";
            case "gt" -> ">";
            case "quot" -> "\"";
            case "apos" -> "'";
            case "nbsp" -> " ";
            default -> null;
        };
    }
}
