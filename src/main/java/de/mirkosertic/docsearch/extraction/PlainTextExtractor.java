package de.mirkosertic.docsearch.extraction;

import de.mirkosertic.docsearch.util.TextCleaner;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Primary extractor for plain text and Markdown. Reads up to the text byte cap and
 * produces a single unnumbered page.
 * <p>
 * Markdown is reduced to its readable text: fences, rules, heading, quote and list markers
 * are dropped, links and images keep their label, emphasis and inline code keep their content.
 */
public class PlainTextExtractor implements ExtractionStrategy {

    private static final Pattern FENCE = Pattern.compile("(?m)^\\s*(```|~~~).*$");
    private static final Pattern HORIZONTAL_RULE = Pattern.compile("(?m)^\\s{0,3}([-*_])(\\s*\\1){2,}\\s*$");
    private static final Pattern HEADING = Pattern.compile("(?m)^\\s{0,3}#{1,6}\\s*");
    private static final Pattern CLOSING_HASHES = Pattern.compile("(?m)\\s+#+\\s*$");
    private static final Pattern QUOTE = Pattern.compile("(?m)^\\s{0,3}(>\\s?)+");
    private static final Pattern LIST_MARKER = Pattern.compile("(?m)^\\s*([-*+]|\\d+[.)])\\s+");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern REFERENCE_LINK = Pattern.compile("\\[([^\\]]*)]\\[[^\\]]*]");
    private static final Pattern LINK_DEFINITION = Pattern.compile("(?m)^\\s{0,3}\\[[^\\]]+]:\\s+\\S+.*$");
    private static final Pattern BOLD = Pattern.compile("(\\*\\*|__)(.+?)\\1");
    private static final Pattern ITALIC = Pattern.compile("(?<![\\w*])([*_])(?!\\s)(.+?)(?<!\\s)\\1(?![\\w*])");
    private static final Pattern STRIKETHROUGH = Pattern.compile("~~(.+?)~~");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]*)`");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>\\n]+>");

    private final int textMaxBytes;

    public PlainTextExtractor(final int textMaxBytes) {
        this.textMaxBytes = textMaxBytes;
    }

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.PRIMARY;
    }

    @Override
    public boolean supports(final Path file) {
        return FileTypes.isPlainText(file) || FileTypes.isMarkdown(file);
    }

    @Override
    public ExtractedDocument extract(final Path file) throws ExtractionException {
        final String raw;
        try {
            raw = TextCleaner.sanitize(FileTypes.decodeUtf8(FileTypes.readPrefix(file, textMaxBytes)));
        } catch (final IOException e) {
            throw new ExtractionException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        final boolean markdown = FileTypes.isMarkdown(file);
        final String title = FileTypes.titleOrFileName(markdown ? markdownTitle(raw) : firstNonEmptyLine(raw), file);
        final String text = markdown ? renderMarkdown(raw) : raw;

        return new ExtractedDocument(title, file.toString(),
                List.of(PageText.unpaged(TextCleaner.normalizePreservingParagraphs(text))),
                ExtractorKind.PRIMARY);
    }

    static @Nullable String firstNonEmptyLine(final String text) {
        return text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse(null);
    }

    static @Nullable String markdownTitle(final String text) {
        return text.lines()
                .map(String::strip)
                .filter(line -> line.startsWith("#"))
                .map(line -> CLOSING_HASHES.matcher(HEADING.matcher(line).replaceFirst("")).replaceFirst(""))
                .map(line -> renderInline(line).strip())
                .filter(line -> !line.isEmpty())
                .findFirst()
                .orElse(null);
    }

    static String renderMarkdown(final String markdown) {
        String text = markdown.replace("\r\n", "\n").replace('\r', '\n');
        text = FENCE.matcher(text).replaceAll("");
        text = LINK_DEFINITION.matcher(text).replaceAll("");
        text = HORIZONTAL_RULE.matcher(text).replaceAll("");
        text = HEADING.matcher(text).replaceAll("");
        text = CLOSING_HASHES.matcher(text).replaceAll("");
        text = QUOTE.matcher(text).replaceAll("");
        text = LIST_MARKER.matcher(text).replaceAll("");
        return renderInline(text);
    }

    private static String renderInline(final String line) {
        String text = IMAGE.matcher(line).replaceAll("$1");
        text = LINK.matcher(text).replaceAll("$1");
        text = REFERENCE_LINK.matcher(text).replaceAll("$1");
        text = INLINE_CODE.matcher(text).replaceAll("$1");
        text = BOLD.matcher(text).replaceAll("$2");
        text = STRIKETHROUGH.matcher(text).replaceAll("$1");
        text = ITALIC.matcher(text).replaceAll("$2");
        return HTML_TAG.matcher(text).replaceAll("");
    }
}
