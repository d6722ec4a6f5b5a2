package de.mirkosertic.docsearch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build timestamp from the Maven-filtered {@code build-info.properties}.
 * The version is written into every index commit as {@code software_version}.
 * Unfiltered placeholders (running from an IDE) read as "dev" and "unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final Properties PROPERTIES = load();

    private BuildInfo() {
    }

    public static String getVersion() {
        return value("build.version", "dev");
    }

    public static String getBuildTimestamp() {
        return value("build.timestamp", "unknown");
    }

    private static String value(final String key, final String fallback) {
        final String value = PROPERTIES.getProperty(key);
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value.trim();
    }

    private static Properties load() {
        final Properties properties = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                properties.load(input);
            } else {
                logger.debug("{} not found on classpath", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load {}", BUILD_INFO_FILE, e);
        }
        return properties;
    }
}
