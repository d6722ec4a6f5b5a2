package de.mirkosertic.docsearch.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the document search core.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.docsearch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_DATA_DIR = "DOCSEARCH_DATA_DIR";
    private static final String ENV_DIRECTORIES = "DOCSEARCH_DIRECTORIES";
    private static final String ENV_TIKA_CONFIG = "DOCSEARCH_TIKA_CONFIG";
    private static final String PROP_DATA_DIR = "docsearch.data.dir";
    private static final String CONFIG_DIR = ".docsearch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    static final int MIN_THREADS = 2;
    static final int MAX_THREADS = 8;

    private Path dataDirectory = Paths.get(System.getProperty("user.home"), CONFIG_DIR);

    // Watched folders
    private List<String> directories = new ArrayList<>();
    private List<String> includePatterns = List.of(
            "*.txt", "*.md", "*.markdown", "*.html", "*.htm", "*.pdf"
    );
    private List<String> excludePatterns = List.of(
            "**/node_modules/**", "**/.git/**"
    );

    // Extraction
    private int textMaxBytes = 2 * 1024 * 1024;
    private boolean primaryExtractorEnabled = true;
    private String tikaConfigPath;

    // Extraction cache
    private int cacheMaxPages = 2000;
    private long cacheMaxBytes = 300L * 1024 * 1024;
    private long cacheMaxAgeDays = 30;
    private long pruneIntervalMinutes = 10;

    // Index
    private int indexMaxPdfPages = 300;
    private int threadPoolSize = 0;

    // Search
    private int snippetMaxLength = 400;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: dataDirectory={}, directories={}",
                config.dataDirectory, config.directories.size());

        return config;
    }

    /**
     * Built-in defaults only, rooted at the given data directory. No files or environment are consulted.
     */
    public static ApplicationConfig defaults(final Path dataDirectory) {
        final ApplicationConfig config = new ApplicationConfig();
        config.dataDirectory = dataDirectory;
        return config;
    }

    /**
     * Data directory from the same sources as {@link #load()}, read without logging so that the
     * log directory can be placed before logging is configured.
     */
    public static Path resolveDataDirectory() {
        return resolveDataDirectory(System.getProperty(PROP_DATA_DIR), System.getenv(ENV_DATA_DIR),
                getUserConfigPath());
    }

    static Path resolveDataDirectory(final @Nullable String propDataDir, final @Nullable String envDataDir,
                                     final Path userConfigPath) {
        if (propDataDir != null && !propDataDir.isEmpty()) {
            return Paths.get(propDataDir);
        }
        if (envDataDir != null && !envDataDir.trim().isEmpty()) {
            return Paths.get(envDataDir.trim());
        }
        final ApplicationConfig config = new ApplicationConfig();
        if (Files.isRegularFile(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> yaml = new Yaml().load(is);
                if (yaml != null) {
                    config.applyYamlConfig(yaml);
                }
            } catch (final IOException e) {
                System.err.println("Warning: Could not read " + userConfigPath + ": " + e.getMessage());
            }
        }
        return config.dataDirectory;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("docsearch");
        if (root == null) {
            return;
        }

        final Object dataDir = root.get("data-dir");
        if (dataDir != null) {
            this.dataDirectory = Paths.get(resolveVariables(dataDir.toString()));
        }
        if (root.get("directories") instanceof List) {
            this.directories = new ArrayList<>((List<String>) root.get("directories"));
        }
        if (root.get("include-patterns") instanceof List) {
            this.includePatterns = new ArrayList<>((List<String>) root.get("include-patterns"));
        }
        if (root.get("exclude-patterns") instanceof List) {
            this.excludePatterns = new ArrayList<>((List<String>) root.get("exclude-patterns"));
        }

        final Map<String, Object> extraction = (Map<String, Object>) root.get("extraction");
        if (extraction != null) {
            if (extraction.containsKey("text-max-bytes")) {
                this.textMaxBytes = ((Number) extraction.get("text-max-bytes")).intValue();
            }
            if (extraction.containsKey("primary-enabled")) {
                this.primaryExtractorEnabled = (Boolean) extraction.get("primary-enabled");
            }
            if (extraction.get("tika-config") != null) {
                this.tikaConfigPath = resolveVariables(extraction.get("tika-config").toString());
            }
        }

        final Map<String, Object> cache = (Map<String, Object>) root.get("cache");
        if (cache != null) {
            if (cache.containsKey("max-pages")) {
                this.cacheMaxPages = ((Number) cache.get("max-pages")).intValue();
            }
            if (cache.containsKey("max-bytes")) {
                this.cacheMaxBytes = ((Number) cache.get("max-bytes")).longValue();
            }
            if (cache.containsKey("max-age-days")) {
                this.cacheMaxAgeDays = ((Number) cache.get("max-age-days")).longValue();
            }
            if (cache.containsKey("prune-interval-minutes")) {
                this.pruneIntervalMinutes = ((Number) cache.get("prune-interval-minutes")).longValue();
            }
        }

        final Map<String, Object> index = (Map<String, Object>) root.get("index");
        if (index != null && index.containsKey("max-pdf-pages")) {
            this.indexMaxPdfPages = ((Number) index.get("max-pdf-pages")).intValue();
        }

        final Map<String, Object> indexing = (Map<String, Object>) root.get("indexing");
        if (indexing != null && indexing.containsKey("thread-pool-size")) {
            this.threadPoolSize = ((Number) indexing.get("thread-pool-size")).intValue();
        }

        final Map<String, Object> search = (Map<String, Object>) root.get("search");
        if (search != null && search.containsKey("snippet-max-length")) {
            this.snippetMaxLength = ((Number) search.get("snippet-max-length")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envDataDir = System.getenv(ENV_DATA_DIR);
        if (envDataDir != null && !envDataDir.trim().isEmpty()) {
            this.dataDirectory = Paths.get(envDataDir.trim());
            logger.info("Data directory from environment: {}", this.dataDirectory);
        }

        // Watched folders from environment (overrides all other sources)
        final String envDirs = System.getenv(ENV_DIRECTORIES);
        if (envDirs != null && !envDirs.trim().isEmpty()) {
            this.directories = new ArrayList<>();
            for (final String dir : envDirs.split(",")) {
                final String trimmed = dir.trim();
                if (!trimmed.isEmpty()) {
                    this.directories.add(trimmed);
                }
            }
            logger.info("Watched directories from environment: {}", this.directories);
        }

        final String envTikaConfig = System.getenv(ENV_TIKA_CONFIG);
        if (envTikaConfig != null && !envTikaConfig.trim().isEmpty()) {
            this.tikaConfigPath = envTikaConfig.trim();
        }

        final String propDataDir = System.getProperty(PROP_DATA_DIR);
        if (propDataDir != null && !propDataDir.isEmpty()) {
            this.dataDirectory = Paths.get(propDataDir);
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    /**
     * Number of extraction workers: the configured size, or the available processors clamped to [2, 8].
     */
    public int getEffectiveThreadPoolSize() {
        if (threadPoolSize > 0) {
            return threadPoolSize;
        }
        final int cpus = Runtime.getRuntime().availableProcessors();
        return Math.max(MIN_THREADS, Math.min(MAX_THREADS, cpus));
    }

    // Getters
    public Path getDataDirectory() {
        return dataDirectory;
    }

    public Path getIndexPath() {
        return dataDirectory.resolve("index");
    }

    public Path getCachePath() {
        return dataDirectory.resolve("cache");
    }

    public Path getFingerprintPath() {
        return dataDirectory.resolve("fingerprints.json");
    }

    public List<String> getDirectories() {
        return directories;
    }

    public void setDirectories(final List<String> directories) {
        this.directories = new ArrayList<>(directories);
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public int getTextMaxBytes() {
        return textMaxBytes;
    }

    public boolean isPrimaryExtractorEnabled() {
        return primaryExtractorEnabled;
    }

    public void setPrimaryExtractorEnabled(final boolean primaryExtractorEnabled) {
        this.primaryExtractorEnabled = primaryExtractorEnabled;
    }

    public String getTikaConfigPath() {
        return tikaConfigPath;
    }

    public int getCacheMaxPages() {
        return cacheMaxPages;
    }

    public long getCacheMaxBytes() {
        return cacheMaxBytes;
    }

    public long getCacheMaxAgeDays() {
        return cacheMaxAgeDays;
    }

    public long getPruneIntervalMinutes() {
        return pruneIntervalMinutes;
    }

    public int getIndexMaxPdfPages() {
        return indexMaxPdfPages;
    }

    public void setThreadPoolSize(final int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public int getSnippetMaxLength() {
        return snippetMaxLength;
    }
}
