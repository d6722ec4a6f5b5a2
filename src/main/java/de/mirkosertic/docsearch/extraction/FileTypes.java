package de.mirkosertic.docsearch.extraction;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * File name based type checks and small I/O helpers shared by the extractors.
 */
final class FileTypes {

    private FileTypes() {
    }

    static String extension(final Path file) {
        final Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        final String fileName = name.toString();
        final int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static boolean isPdf(final Path file) {
        return "pdf".equals(extension(file));
    }

    static boolean isHtml(final Path file) {
        final String ext = extension(file);
        return "html".equals(ext) || "htm".equals(ext);
    }

    static boolean isMarkdown(final Path file) {
        final String ext = extension(file);
        return "md".equals(ext) || "markdown".equals(ext);
    }

    static boolean isPlainText(final Path file) {
        return "txt".equals(extension(file));
    }

    /**
     * Read at most {@code maxBytes} bytes from the start of the file.
     */
    static byte[] readPrefix(final Path file, final int maxBytes) throws IOException {
        try (final InputStream in = Files.newInputStream(file)) {
            return in.readNBytes(maxBytes);
        }
    }

    /**
     * Decode as UTF-8; malformed sequences (including one cut off by the byte cap) become U+FFFD
     * and are dropped later by the sanitizer.
     */
    static String decodeUtf8(final byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static String titleOrFileName(final @Nullable String title, final Path file) {
        if (title != null && !title.isBlank()) {
            return title.strip();
        }
        final Path name = file.getFileName();
        return name != null ? name.toString() : file.toString();
    }
}
