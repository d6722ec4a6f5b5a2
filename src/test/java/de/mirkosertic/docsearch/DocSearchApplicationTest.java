package de.mirkosertic.docsearch;

import de.mirkosertic.docsearch.config.ApplicationConfig;
import de.mirkosertic.docsearch.extraction.TestPdfGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocSearchApplication Tests")
class DocSearchApplicationTest {

    @TempDir
    Path tempDir;

    private Path library;
    private LibraryContext context;
    private ByteArrayOutputStream output;
    private DocSearchApplication application;

    @BeforeEach
    void setUp() throws Exception {
        library = tempDir.resolve("library");
        Files.createDirectories(library);

        final ApplicationConfig config = ApplicationConfig.defaults(tempDir.resolve("data"));
        config.setDirectories(List.of(library.toString()));
        config.setThreadPoolSize(2);
        context = LibraryContext.create(config);
        output = new ByteArrayOutputStream();
        application = new DocSearchApplication(context, new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should print usage and exit with 2 without a command")
    void shouldPrintUsage() {
        assertThat(application.run(List.of())).isEqualTo(2);
        assertThat(output()).contains("Usage: docsearch");
    }

    @Test
    @DisplayName("Should reject unknown commands")
    void shouldRejectUnknownCommand() {
        assertThat(application.run(List.of("frobnicate"))).isEqualTo(2);
    }

    @Test
    @DisplayName("Should exit with 3 when searching before the first rebuild")
    void shouldReportMissingIndex() {
        assertThat(application.run(List.of("search", "hello"))).isEqualTo(3);
        assertThat(output()).contains("No index available");
    }

    @Test
    @DisplayName("Should rebuild, search and list pages")
    void shouldRebuildAndSearch() throws Exception {
        // Given
        Files.writeString(library.resolve("notes.txt"), "Hello world");
        final Path pdf = library.resolve("manual.pdf");
        TestPdfGenerator.createPdf(pdf, "Manual", List.of(List.of("solar panels"), List.of("wiring"),
                List.of("more solar")));

        // When
        final int rebuild = application.run(List.of("rebuild"));
        final int search = application.run(List.of("search", "world"));
        final int pages = application.run(List.of("pages", pdf.toString(), "solar"));

        // Then
        assertThat(rebuild).isZero();
        assertThat(search).isZero();
        assertThat(pages).isZero();
        assertThat(output()).contains("REBUILD: 2 files found, 2 indexed")
                .contains("notes.txt")
                .contains("1 result(s)")
                .contains("[1, 3]");
    }

    @Test
    @DisplayName("Should run an incremental update")
    void shouldUpdate() throws Exception {
        Files.writeString(library.resolve("notes.txt"), "Hello world");
        application.run(List.of("rebuild"));

        assertThat(application.run(List.of("update"))).isZero();
        assertThat(output()).contains("UPDATE: 1 files found, 0 indexed, 0 failed, 0 deleted, 1 unchanged");
    }

    @Test
    @DisplayName("Should clear and prune the extraction cache")
    void shouldMaintainCache() throws Exception {
        Files.writeString(library.resolve("notes.txt"), "Hello world");
        application.run(List.of("rebuild"));

        assertThat(application.run(List.of("prune-cache"))).isZero();
        assertThat(application.run(List.of("clear-cache"))).isZero();
        assertThat(output()).contains("Deleted 0 cache entries,").contains("Deleted 1 cache entries");
    }

    @Test
    @DisplayName("Should reject a non-numeric limit")
    void shouldRejectInvalidLimit() throws Exception {
        Files.writeString(library.resolve("notes.txt"), "Hello world");
        application.run(List.of("rebuild"));

        assertThat(application.run(List.of("search", "world", "many"))).isEqualTo(2);
        assertThat(output()).contains("Invalid limit");
    }

    @Test
    @DisplayName("Should report an invalid query with exit code 1")
    void shouldReportInvalidQuery() throws Exception {
        Files.writeString(library.resolve("notes.txt"), "Hello world");
        application.run(List.of("rebuild"));

        assertThat(application.run(List.of("search", "title:("))).isEqualTo(1);
        assertThat(output()).contains("Search failed");
    }
}
