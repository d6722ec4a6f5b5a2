package de.mirkosertic.docsearch.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Runs an ordered chain of {@link ExtractionStrategy extraction strategies} over a file.
 * The first available strategy that supports the file and succeeds wins; a failing strategy
 * is logged and the next one is tried. Failures never escape as exceptions.
 */
public class ContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractor.class);

    static final String UNSUPPORTED = "unsupported file type";

    private final List<ExtractionStrategy> strategies;

    public ContentExtractor(final List<ExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * The default chain: Tika and the plain text reader first, then the structural PDF parser
     * and the HTML tag stripper.
     */
    public static ContentExtractor createDefault(final TikaBinding binding, final int textMaxBytes) {
        return new ContentExtractor(List.of(
                new TikaDocumentExtractor(binding, textMaxBytes),
                new PlainTextExtractor(textMaxBytes),
                new StructuralPdfExtractor(),
                new HtmlTagStripper(textMaxBytes)
        ));
    }

    public ExtractionOutcome extract(final Path file) {
        return runChain(file, strategies);
    }

    /**
     * Run only the strategies of one tier. Used to upgrade cached fallback results.
     */
    public ExtractionOutcome extractWith(final ExtractorKind kind, final Path file) {
        final List<ExtractionStrategy> ofKind = new ArrayList<>();
        for (final ExtractionStrategy strategy : strategies) {
            if (strategy.kind() == kind) {
                ofKind.add(strategy);
            }
        }
        return runChain(file, ofKind);
    }

    /**
     * Tiers that have at least one strategy able to run on {@code file} right now.
     */
    public Set<ExtractorKind> availableKinds(final Path file) {
        final Set<ExtractorKind> kinds = EnumSet.noneOf(ExtractorKind.class);
        for (final ExtractionStrategy strategy : strategies) {
            if (!kinds.contains(strategy.kind()) && strategy.supports(file) && strategy.isAvailable()) {
                kinds.add(strategy.kind());
            }
        }
        return kinds;
    }

    public boolean supports(final Path file) {
        for (final ExtractionStrategy strategy : strategies) {
            if (strategy.supports(file)) {
                return true;
            }
        }
        return false;
    }

    private ExtractionOutcome runChain(final Path file, final List<ExtractionStrategy> chain) {
        final List<String> failures = new ArrayList<>();
        for (final ExtractionStrategy strategy : chain) {
            if (!strategy.supports(file)) {
                continue;
            }
            final String name = strategy.getClass().getSimpleName();
            if (!strategy.isAvailable()) {
                failures.add(name + ": not available");
                continue;
            }
            try {
                final ExtractedDocument document = strategy.extract(file);
                if (!failures.isEmpty()) {
                    logger.info("Extracted {} with {} after: {}", file, name, failures);
                }
                return ExtractionOutcome.of(document);
            } catch (final ExtractionException | RuntimeException e) {
                logger.warn("{} failed on {}: {}", name, file, e.getMessage());
                logger.debug("Extraction failure details", e);
                failures.add(name + ": " + e.getMessage());
            }
        }

        if (failures.isEmpty()) {
            return ExtractionOutcome.failed(UNSUPPORTED);
        }
        return ExtractionOutcome.failed(String.join("; ", failures));
    }
}
