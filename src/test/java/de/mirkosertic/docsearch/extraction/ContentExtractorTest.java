package de.mirkosertic.docsearch.extraction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ContentExtractor Tests")
class ContentExtractorTest {

    private final Path file = Paths.get("/library/report.pdf").toAbsolutePath();

    private ExtractionStrategy primary;
    private ExtractionStrategy fallback;
    private ContentExtractor extractor;

    @BeforeEach
    void setUp() {
        primary = strategy(ExtractorKind.PRIMARY);
        fallback = strategy(ExtractorKind.FALLBACK);
        extractor = new ContentExtractor(List.of(primary, fallback));
    }

    private static ExtractionStrategy strategy(final ExtractorKind kind) {
        final ExtractionStrategy strategy = mock(ExtractionStrategy.class);
        when(strategy.kind()).thenReturn(kind);
        when(strategy.supports(any())).thenReturn(true);
        when(strategy.isAvailable()).thenReturn(true);
        return strategy;
    }

    private ExtractedDocument document(final ExtractorKind kind) {
        return new ExtractedDocument("Report", file.toString(), List.of(new PageText(1, "text")), kind);
    }

    @Nested
    @DisplayName("Fallback chain")
    class FallbackChain {

        @Test
        @DisplayName("Should use the primary strategy when it succeeds")
        void shouldPreferPrimary() throws Exception {
            // Given
            when(primary.extract(file)).thenReturn(document(ExtractorKind.PRIMARY));

            // When
            final ExtractionOutcome outcome = extractor.extract(file);

            // Then
            assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.PRIMARY);
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.failureReason()).isNull();
            verify(fallback, never()).extract(any());
        }

        @Test
        @DisplayName("Should fall back when the primary strategy fails")
        void shouldFallBackOnFailure() throws Exception {
            when(primary.extract(file)).thenThrow(new ExtractionException("corrupt xref"));
            when(fallback.extract(file)).thenReturn(document(ExtractorKind.FALLBACK));

            final ExtractionOutcome outcome = extractor.extract(file);

            assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.FALLBACK);
            assertThat(outcome.document()).isNotNull();
            assertThat(outcome.document().extractor()).isEqualTo(ExtractorKind.FALLBACK);
        }

        @Test
        @DisplayName("Should treat runtime exceptions like extraction failures")
        void shouldCatchRuntimeExceptions() throws Exception {
            when(primary.extract(file)).thenThrow(new IllegalStateException("parser bug"));
            when(fallback.extract(file)).thenReturn(document(ExtractorKind.FALLBACK));

            assertThat(extractor.extract(file).status()).isEqualTo(ExtractionOutcome.Status.FALLBACK);
        }

        @Test
        @DisplayName("Should skip an unavailable primary strategy without calling it")
        void shouldSkipUnavailableStrategy() throws Exception {
            when(primary.isAvailable()).thenReturn(false);
            when(fallback.extract(file)).thenReturn(document(ExtractorKind.FALLBACK));

            final ExtractionOutcome outcome = extractor.extract(file);

            assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.FALLBACK);
            verify(primary, never()).extract(any());
        }

        @Test
        @DisplayName("Should report every failure when all strategies fail")
        void shouldReportAllFailures() throws Exception {
            when(primary.extract(file)).thenThrow(new ExtractionException("primary broke"));
            when(fallback.extract(file)).thenThrow(new ExtractionException("fallback broke"));

            final ExtractionOutcome outcome = extractor.extract(file);

            assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.FAILED);
            assertThat(outcome.document()).isNull();
            assertThat(outcome.failureReason()).contains("primary broke", "fallback broke");
        }

        @Test
        @DisplayName("Should fail with unsupported file type when no strategy supports the file")
        void shouldRejectUnsupportedFile() throws Exception {
            when(primary.supports(any())).thenReturn(false);
            when(fallback.supports(any())).thenReturn(false);

            final ExtractionOutcome outcome = extractor.extract(file);

            assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.FAILED);
            assertThat(outcome.failureReason()).isEqualTo(ContentExtractor.UNSUPPORTED);
            assertThat(extractor.supports(file)).isFalse();
        }

        @Test
        @DisplayName("Should turn a failed outcome into an ExtractionException")
        void shouldThrowOnFailedOutcome() {
            final ExtractionOutcome outcome = ExtractionOutcome.failed("nothing worked");

            assertThatThrownBy(outcome::orElseThrow)
                    .isInstanceOf(ExtractionException.class)
                    .hasMessage("nothing worked");
        }
    }

    @Nested
    @DisplayName("Tier selection")
    class TierSelection {

        @Test
        @DisplayName("Should run only strategies of the requested tier")
        void shouldExtractWithKind() throws Exception {
            when(primary.extract(file)).thenThrow(new ExtractionException("still broken"));

            final ExtractionOutcome outcome = extractor.extractWith(ExtractorKind.PRIMARY, file);

            assertThat(outcome.status()).isEqualTo(ExtractionOutcome.Status.FAILED);
            verify(fallback, never()).extract(any());
        }

        @Test
        @DisplayName("Should list the tiers that can run")
        void shouldListAvailableKinds() {
            assertThat(extractor.availableKinds(file))
                    .containsExactlyInAnyOrder(ExtractorKind.PRIMARY, ExtractorKind.FALLBACK);

            when(primary.isAvailable()).thenReturn(false);

            assertThat(extractor.availableKinds(file)).containsExactly(ExtractorKind.FALLBACK);
        }

        @Test
        @DisplayName("Should ignore tiers whose strategies do not support the file")
        void shouldListKindsPerFile() {
            final Path notes = Paths.get("/library/notes.txt").toAbsolutePath();
            when(primary.supports(notes)).thenReturn(false);

            assertThat(extractor.availableKinds(notes)).containsExactly(ExtractorKind.FALLBACK);
        }
    }
}
