package de.mirkosertic.docsearch.extraction;

import org.apache.tika.config.TikaConfig;
import org.apache.tika.exception.TikaException;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.Parser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazily binds the Apache Tika parser used by the primary extraction tier.
 * <p>
 * Configuration is searched in this order:
 * <ol>
 *   <li>an explicitly configured {@code tika-config.xml}</li>
 *   <li>the file named by the {@code DOCSEARCH_TIKA_CONFIG} environment variable</li>
 *   <li>{@code tika-config.xml} in the data directory</li>
 *   <li>{@code resources/tika-config.xml} under the working directory</li>
 *   <li>Tika's built-in default configuration</li>
 * </ol>
 * The first existing file wins. If it cannot be loaded the binding fails and the primary
 * tier reports itself unavailable, so that extraction falls through to the fallback tier.
 * Binding is attempted once; the outcome is remembered.
 */
public class TikaBinding {

    private static final Logger logger = LoggerFactory.getLogger(TikaBinding.class);

    static final String CONFIG_FILE_NAME = "tika-config.xml";
    static final String ENV_TIKA_CONFIG = "DOCSEARCH_TIKA_CONFIG";
    static final String DEFAULT_SOURCE = "tika-default";

    private final boolean enabled;
    private final List<Path> candidates;
    private final ReentrantLock bindLock = new ReentrantLock();

    private volatile boolean attempted;
    private volatile @Nullable Parser parser;
    private volatile @Nullable String source;

    public TikaBinding(final boolean enabled, final @Nullable String explicitConfig, final Path dataDirectory) {
        this(enabled, configCandidates(explicitConfig, dataDirectory));
    }

    TikaBinding(final boolean enabled, final List<Path> candidates) {
        this.enabled = enabled;
        this.candidates = List.copyOf(candidates);
    }

    static List<Path> configCandidates(final @Nullable String explicitConfig, final Path dataDirectory) {
        final List<Path> result = new ArrayList<>();
        if (explicitConfig != null && !explicitConfig.isBlank()) {
            result.add(Paths.get(explicitConfig));
        }
        final String fromEnv = System.getenv(ENV_TIKA_CONFIG);
        if (fromEnv != null && !fromEnv.isBlank()) {
            result.add(Paths.get(fromEnv.trim()));
        }
        result.add(dataDirectory.resolve(CONFIG_FILE_NAME));
        result.add(Paths.get("").toAbsolutePath().resolve("resources").resolve(CONFIG_FILE_NAME));
        return result;
    }

    /**
     * The bound parser, binding on first use. Empty when disabled or when binding failed.
     */
    public Optional<Parser> parser() {
        if (!attempted) {
            bindLock.lock();
            try {
                if (!attempted) {
                    bind();
                    attempted = true;
                }
            } finally {
                bindLock.unlock();
            }
        }
        return Optional.ofNullable(parser);
    }

    public boolean isAvailable() {
        return parser().isPresent();
    }

    /**
     * Where the configuration came from: a file path, {@code tika-default}, or null when not bound.
     */
    public @Nullable String bindingSource() {
        parser();
        return source;
    }

    private void bind() {
        if (!enabled) {
            logger.info("Primary extractor disabled by configuration");
            return;
        }

        for (final Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                try {
                    parser = new AutoDetectParser(new TikaConfig(candidate));
                    source = candidate.toString();
                    logger.info("Bound Tika parser with configuration {}", candidate);
                } catch (final TikaException | IOException | SAXException | RuntimeException e) {
                    logger.warn("Failed to bind Tika parser with configuration {}, primary extractor unavailable",
                            candidate, e);
                }
                return;
            }
        }

        try {
            parser = new AutoDetectParser(TikaConfig.getDefaultConfig());
            source = DEFAULT_SOURCE;
            logger.info("Bound Tika parser with default configuration");
        } catch (final RuntimeException | LinkageError e) {
            logger.warn("Failed to bind Tika parser, primary extractor unavailable", e);
        }
    }
}
