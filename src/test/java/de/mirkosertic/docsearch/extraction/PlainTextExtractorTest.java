package de.mirkosertic.docsearch.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PlainTextExtractor Tests")
class PlainTextExtractorTest {

    @TempDir
    Path tempDir;

    private final PlainTextExtractor extractor = new PlainTextExtractor(1024);

    @ParameterizedTest
    @ValueSource(strings = {"notes.txt", "README.md", "guide.markdown", "UPPER.TXT"})
    @DisplayName("Should support text and Markdown files")
    void shouldSupportTextFiles(final String fileName) {
        assertThat(extractor.supports(tempDir.resolve(fileName))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"report.pdf", "index.html", "archive.zip", "noextension"})
    @DisplayName("Should not support other files")
    void shouldNotSupportOtherFiles(final String fileName) {
        assertThat(extractor.supports(tempDir.resolve(fileName))).isFalse();
    }

    @Nested
    @DisplayName("Plain text")
    class PlainText {

        @Test
        @DisplayName("Should produce one unnumbered page titled by the first non-empty line")
        void shouldExtractSinglePage() throws Exception {
            // Given
            final Path file = tempDir.resolve("notes.txt");
            Files.writeString(file, "  \nFirst line\n\nSecond paragraph  with   spaces\n");

            // When
            final ExtractedDocument document = extractor.extract(file);

            // Then
            assertThat(document.title()).isEqualTo("First line");
            assertThat(document.extractor()).isEqualTo(ExtractorKind.PRIMARY);
            assertThat(document.isPaged()).isFalse();
            assertThat(document.pages()).containsExactly(
                    PageText.unpaged("First line\n\nSecond paragraph with spaces"));
        }

        @Test
        @DisplayName("Should fall back to the file name as title for an empty file")
        void shouldUseFileNameForEmptyFile() throws Exception {
            final Path file = tempDir.resolve("empty.txt");
            Files.writeString(file, "");

            final ExtractedDocument document = extractor.extract(file);

            assertThat(document.title()).isEqualTo("empty.txt");
            assertThat(document.pages()).containsExactly(PageText.unpaged(""));
        }

        @Test
        @DisplayName("Should read no more than the byte cap")
        void shouldHonorByteCap() throws Exception {
            final Path file = tempDir.resolve("long.txt");
            Files.writeString(file, "abcdefghij");

            final ExtractedDocument document = new PlainTextExtractor(4).extract(file);

            assertThat(document.pages().get(0).body()).isEqualTo("abcd");
        }

        @Test
        @DisplayName("Should drop a multi-byte character cut by the byte cap")
        void shouldDropCutCharacter() throws Exception {
            final Path file = tempDir.resolve("umlaut.txt");
            Files.write(file, "a\u00E4".getBytes(StandardCharsets.UTF_8));

            final ExtractedDocument document = new PlainTextExtractor(2).extract(file);

            assertThat(document.pages().get(0).body()).isEqualTo("a");
        }

        @Test
        @DisplayName("Should drop invalid UTF-8 sequences")
        void shouldDropInvalidBytes() throws Exception {
            final Path file = tempDir.resolve("binary.txt");
            Files.write(file, new byte[]{'o', 'k', (byte) 0xC3, (byte) 0x28, ' ', 'd', 'o', 'n', 'e'});

            final ExtractedDocument document = extractor.extract(file);

            assertThat(document.pages().get(0).body()).isEqualTo("ok( done");
        }
    }

    @Nested
    @DisplayName("Markdown")
    class Markdown {

        @Test
        @DisplayName("Should take the first heading as title and strip markup")
        void shouldRenderMarkdown() throws Exception {
            // Given
            final Path file = tempDir.resolve("README.md");
            Files.writeString(file, "# My Title\n\nSome **bold** and [a link](http://example.com).\n\n"
                    + "- item one\n- item two\n");

            // When
            final ExtractedDocument document = extractor.extract(file);

            // Then
            assertThat(document.title()).isEqualTo("My Title");
            assertThat(document.pages().get(0).body())
                    .isEqualTo("My Title\n\nSome bold and a link.\n\nitem one item two");
        }

        @Test
        @DisplayName("Should use the file name when there is no heading")
        void shouldUseFileNameWithoutHeading() throws Exception {
            final Path file = tempDir.resolve("plain.md");
            Files.writeString(file, "Just text without heading.");

            final ExtractedDocument document = extractor.extract(file);

            assertThat(document.title()).isEqualTo("plain.md");
        }

        @Test
        @DisplayName("Should keep the content of inline code, images and emphasis")
        void shouldRenderInlineElements() {
            final String rendered = PlainTextExtractor.renderMarkdown(
                    "Use `mvn test` and ![diagram](img.png) with _care_ or ~~not~~.");

            assertThat(rendered).isEqualTo("Use mvn test and diagram with care or not.");
        }

        @Test
        @DisplayName("Should drop fences, rules and quote markers")
        void shouldDropBlockMarkers() {
            final String rendered = PlainTextExtractor.renderMarkdown(
                    "> quoted\n\n---\n\n```java\ncode line\n```\n");

            assertThat(rendered).contains("quoted", "code line");
            assertThat(rendered).doesNotContain(">", "---", "```");
        }
    }
}
