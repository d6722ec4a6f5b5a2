package de.mirkosertic.docsearch.extraction;

import java.util.Locale;

/**
 * Tier of an extraction strategy. The name is what gets persisted in cache entries
 * and stored in the {@code section} field of indexed PDF pages.
 */
public enum ExtractorKind {

    PRIMARY("tika"),
    FALLBACK("structural");

    private final String persistedName;

    ExtractorKind(final String persistedName) {
        this.persistedName = persistedName;
    }

    public String persistedName() {
        return persistedName;
    }

    /**
     * Resolve a persisted name. Unknown names map to {@link #FALLBACK}, so that an entry
     * of unclear origin is treated as the weaker result and becomes eligible for an upgrade.
     */
    public static ExtractorKind fromPersistedName(final String name) {
        if (name == null) {
            return FALLBACK;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "tika", "primary" -> PRIMARY;
            default -> FALLBACK;
        };
    }
}
