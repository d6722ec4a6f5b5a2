package de.mirkosertic.docsearch.extraction;

import java.util.Set;

/**
 * Decides whether a cached extraction result should be replaced by a fresh pass.
 */
public final class ExtractorUpgradePolicy {

    private ExtractorUpgradePolicy() {
    }

    /**
     * A result produced by the fallback tier is upgraded as soon as the primary tier can run.
     */
    public static boolean shouldUpgrade(final ExtractorKind cached, final Set<ExtractorKind> available) {
        return cached == ExtractorKind.FALLBACK && available.contains(ExtractorKind.PRIMARY);
    }
}
