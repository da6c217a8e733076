package com.marketpulse.backend.service.ingest;

import com.marketpulse.backend.model.ItemSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void stripsTagsEntitiesAndWhitespace() {
        String cleaned = normalizer.clean("<p>ETH  breaks out &amp; <b>rallies</b></p>\n\n");

        assertThat(cleaned).isEqualTo("ETH breaks out & rallies");
    }

    @Test
    void normalizeCaseFolds() {
        assertThat(normalizer.normalize("  Ethereum   UPGRADE ")).isEqualTo("ethereum upgrade");
        assertThat(normalizer.clean(null)).isEmpty();
    }

    @Test
    void hashIsStableHexAndDependsOnSourceAndAsset() {
        String a = normalizer.dedupHash("eth up", ItemSource.FEED, "ETH-USD");
        String b = normalizer.dedupHash("eth up", ItemSource.FEED, "ETH-USD");
        String otherSource = normalizer.dedupHash("eth up", ItemSource.SOCIAL, "ETH-USD");
        String otherAsset = normalizer.dedupHash("eth up", ItemSource.FEED, "BTC-USD");

        assertThat(a).hasSize(64).matches("[0-9a-f]+").isEqualTo(b);
        assertThat(a).isNotEqualTo(otherSource).isNotEqualTo(otherAsset);
    }
}
