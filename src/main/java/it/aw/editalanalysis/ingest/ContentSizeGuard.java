package it.aw.editalanalysis.ingest;

import java.util.Optional;

/** Tetto di caratteri sul testo aggregato: esattamente {@code maxChars} passa. */
public class ContentSizeGuard {

    private final int maxChars;

    public ContentSizeGuard(int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars deve essere >= 1 (ricevuto: " + maxChars + ")");
        }
        this.maxChars = maxChars;
    }

    public Optional<IngestionResult.DocumentTooLarge> check(String text) {
        int actual = text.length();
        return actual > maxChars
                ? Optional.of(new IngestionResult.DocumentTooLarge(maxChars, actual))
                : Optional.empty();
    }

    public int maxChars() {
        return maxChars;
    }
}
