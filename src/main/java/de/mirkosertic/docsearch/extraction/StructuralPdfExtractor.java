package de.mirkosertic.docsearch.extraction;

import de.mirkosertic.docsearch.util.TextCleaner;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Fallback PDF extractor. Walks each page's content stream with PDFBox's low-level parser and
 * decodes the text-showing operators ({@code Tj}, {@code TJ}, {@code '}, {@code "}) without
 * font-aware layout. {@code T*}, {@code '} and {@code "} start a new paragraph.
 * Pages without text are dropped; the remaining pages keep their original numbers.
 */
public class StructuralPdfExtractor implements ExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(StructuralPdfExtractor.class);

    // TJ displacement (thousandths of text space) treated as a word gap
    private static final float WORD_GAP = -200f;

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.FALLBACK;
    }

    @Override
    public boolean supports(final Path file) {
        return FileTypes.isPdf(file);
    }

    @Override
    public ExtractedDocument extract(final Path file) throws ExtractionException {
        try (final PDDocument document = Loader.loadPDF(file.toFile())) {
            final String title = FileTypes.titleOrFileName(document.getDocumentInformation().getTitle(), file);

            final List<PageText> pages = new ArrayList<>();
            int pageNumber = 0;
            for (final PDPage page : document.getPages()) {
                pageNumber++;
                final String body = TextCleaner.clean(pageText(page, pageNumber, file));
                if (!body.isEmpty()) {
                    pages.add(new PageText(pageNumber, body));
                }
            }

            logger.debug("Structural parser extracted {} of {} page(s) from {}", pages.size(), pageNumber, file);
            return new ExtractedDocument(title, file.toString(), pages, ExtractorKind.FALLBACK);
        } catch (final IOException e) {
            throw new ExtractionException("Failed to parse PDF " + file + ": " + e.getMessage(), e);
        }
    }

    private static String pageText(final PDPage page, final int pageNumber, final Path file) {
        final List<Object> tokens;
        try {
            tokens = new PDFStreamParser(page).parse();
        } catch (final IOException e) {
            logger.debug("Unreadable content stream on page {} of {}", pageNumber, file, e);
            return "";
        }

        final StringBuilder out = new StringBuilder();
        final List<COSBase> operands = new ArrayList<>();
        for (final Object token : tokens) {
            if (token instanceof COSBase operand) {
                operands.add(operand);
                continue;
            }
            if (token instanceof Operator operator) {
                applyOperator(operator.getName(), operands, out);
            }
            operands.clear();
        }
        return out.toString();
    }

    static void applyOperator(final String name, final List<COSBase> operands, final StringBuilder out) {
        switch (name) {
            case "Tj" -> {
                if (!operands.isEmpty() && operands.get(0) instanceof COSString text) {
                    out.append(decode(text)).append(' ');
                }
            }
            case "TJ" -> {
                if (!operands.isEmpty() && operands.get(0) instanceof COSArray array) {
                    for (final COSBase item : array) {
                        if (item instanceof COSString text) {
                            out.append(decode(text));
                        } else if (item instanceof COSNumber number && number.floatValue() <= WORD_GAP) {
                            out.append(' ');
                        }
                    }
                    out.append(' ');
                }
            }
            case "'", "\"" -> {
                // the string is the last operand ('" also carries word and char spacing)
                if (!operands.isEmpty() && operands.get(operands.size() - 1) instanceof COSString text) {
                    out.append("\n\n").append(decode(text)).append(' ');
                }
            }
            case "T*" -> out.append("\n\n");
            default -> {
                // positioning, graphics and font operators carry no text
            }
        }
    }

    /**
     * UTF-16BE strings with byte order mark and valid UTF-8 are decoded as such,
     * everything else as PDFDocEncoding.
     */
    static String decode(final COSString string) {
        final byte[] bytes = string.getBytes();
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            return string.getString();
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (final CharacterCodingException e) {
            return string.getString();
        }
    }
}
