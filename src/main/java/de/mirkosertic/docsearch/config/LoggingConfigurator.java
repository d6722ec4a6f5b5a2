package de.mirkosertic.docsearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to file logging when the {@code deployed} profile is active.
 * <p>
 * Deployed mode (embedded behind the desktop shell) loads logback-deployed.xml and writes to
 * {@code <data-dir>/log}, keeping stdout and stderr free. The command line keeps the default
 * logback.xml, which logs to stderr so that results on stdout stay machine readable.
 * Runs before anything else logs, so problems are reported on stderr directly.
 */
public final class LoggingConfigurator {

    static final String DEPLOYED_CONFIG = "logback-deployed.xml";
    static final String LOG_DIR_PROPERTY = "LOG_DIR";
    static final String LOG_SUBDIRECTORY = "log";

    private LoggingConfigurator() {
    }

    /**
     * Log directory below the data directory, resolved the way {@link ApplicationConfig#load()} does.
     */
    public static Path defaultLogDirectory() {
        return ApplicationConfig.resolveDataDirectory().resolve(LOG_SUBDIRECTORY);
    }

    public static void configure(final boolean deployedMode) {
        configure(deployedMode, defaultLogDirectory());
    }

    public static void configure(final boolean deployedMode, final Path logDirectory) {
        if (!deployedMode) {
            return;
        }
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDirectory + ": " + e.getMessage());
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (final InputStream configStream = LoggingConfigurator.class.getClassLoader()
                .getResourceAsStream(DEPLOYED_CONFIG)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + DEPLOYED_CONFIG + " on classpath");
                return;
            }
            context.reset();
            context.putProperty(LOG_DIR_PROPERTY, logDirectory.toString());

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        }
    }
}
