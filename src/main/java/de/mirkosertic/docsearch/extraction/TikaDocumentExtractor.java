package de.mirkosertic.docsearch.extraction;

import de.mirkosertic.docsearch.util.TextCleaner;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Primary extractor for PDF and HTML, backed by the Apache Tika parser from {@link TikaBinding}.
 * PDF pages are taken from the page divisions of Tika's XHTML output. HTML is read up to the
 * text byte cap and becomes one unnumbered page.
 */
public class TikaDocumentExtractor implements ExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(TikaDocumentExtractor.class);

    private final TikaBinding binding;
    private final int textMaxBytes;

    public TikaDocumentExtractor(final TikaBinding binding, final int textMaxBytes) {
        this.binding = binding;
        this.textMaxBytes = textMaxBytes;
    }

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.PRIMARY;
    }

    @Override
    public boolean supports(final Path file) {
        return FileTypes.isPdf(file) || FileTypes.isHtml(file);
    }

    @Override
    public boolean isAvailable() {
        return binding.isAvailable();
    }

    @Override
    public ExtractedDocument extract(final Path file) throws ExtractionException {
        final Parser parser = binding.parser()
                .orElseThrow(() -> new ExtractionException("Tika parser is not available"));

        final boolean pdf = FileTypes.isPdf(file);
        final Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());
        final PagedTextContentHandler handler = new PagedTextContentHandler();

        try (final InputStream stream = pdf
                ? TikaInputStream.get(file)
                : new ByteArrayInputStream(FileTypes.readPrefix(file, textMaxBytes))) {
            parser.parse(stream, handler, metadata, new ParseContext());
        } catch (final IOException | SAXException | TikaException e) {
            throw new ExtractionException("Tika failed to parse " + file + ": " + e.getMessage(), e);
        }

        final String title = FileTypes.titleOrFileName(metadata.get(TikaCoreProperties.TITLE), file);
        final List<PageText> pages = new ArrayList<>();
        if (pdf) {
            if (!handler.hasPageDivisions()) {
                logger.debug("No page divisions in parser output for {}, body becomes page 1", file);
            }
            final List<String> rawPages = handler.pages();
            for (int i = 0; i < rawPages.size(); i++) {
                final String body = TextCleaner.clean(rawPages.get(i));
                if (!body.isEmpty()) {
                    pages.add(new PageText(i + 1, body));
                }
            }
        } else {
            pages.add(PageText.unpaged(TextCleaner.clean(String.join("\n\n", handler.pages()))));
        }

        logger.debug("Tika extracted {} page(s) from {}", pages.size(), file);
        return new ExtractedDocument(title, file.toString(), pages, ExtractorKind.PRIMARY);
    }
}
