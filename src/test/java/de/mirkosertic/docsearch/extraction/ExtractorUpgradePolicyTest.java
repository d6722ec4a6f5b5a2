package de.mirkosertic.docsearch.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExtractorUpgradePolicy Tests")
class ExtractorUpgradePolicyTest {

    @Test
    @DisplayName("Should upgrade fallback results once the primary tier is available")
    void shouldUpgradeFallback() {
        assertThat(ExtractorUpgradePolicy.shouldUpgrade(ExtractorKind.FALLBACK,
                EnumSet.of(ExtractorKind.PRIMARY, ExtractorKind.FALLBACK))).isTrue();
    }

    @Test
    @DisplayName("Should keep fallback results while the primary tier is missing")
    void shouldKeepFallbackWithoutPrimary() {
        assertThat(ExtractorUpgradePolicy.shouldUpgrade(ExtractorKind.FALLBACK,
                EnumSet.of(ExtractorKind.FALLBACK))).isFalse();
        assertThat(ExtractorUpgradePolicy.shouldUpgrade(ExtractorKind.FALLBACK, Set.of())).isFalse();
    }

    @Test
    @DisplayName("Should never upgrade primary results")
    void shouldNeverUpgradePrimary() {
        assertThat(ExtractorUpgradePolicy.shouldUpgrade(ExtractorKind.PRIMARY,
                EnumSet.allOf(ExtractorKind.class))).isFalse();
    }

    @Test
    @DisplayName("Should map unknown persisted names to the fallback tier")
    void shouldResolvePersistedNames() {
        assertThat(ExtractorKind.fromPersistedName("tika")).isEqualTo(ExtractorKind.PRIMARY);
        assertThat(ExtractorKind.fromPersistedName("structural")).isEqualTo(ExtractorKind.FALLBACK);
        assertThat(ExtractorKind.fromPersistedName("something-else")).isEqualTo(ExtractorKind.FALLBACK);
        assertThat(ExtractorKind.fromPersistedName(null)).isEqualTo(ExtractorKind.FALLBACK);
    }
}
