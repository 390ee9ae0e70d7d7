package de.julielab.jules.ae.placemapping.utils.norm;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PlaceNameNormalizerTest {

    private final PlaceNameNormalizer normalizer = new PlaceNameNormalizer();

    @Test
    void removesAllWhitespaceIncludingIdeographicSpace() {
        assertThat(normalizer.normalize("　千葉県 船橋市 ")).isEqualTo("千葉県船橋市");
    }

    @Test
    void foldsWidthVariants() {
        assertThat(normalizer.normalize("ﾛｰﾏ")).isEqualTo("ローマ");
        assertThat(normalizer.normalize("ＮＹ１")).isEqualTo("NY1");
    }

    @Test
    void blankInputBecomesEmpty() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize(" 　")).isEmpty();
    }

    @Test
    void stripsProvinceMarker() {
        assertThat(normalizer.stripProvinceMarker("伊勢国")).isEqualTo("伊勢");
        assertThat(normalizer.stripProvinceMarker("伊勢")).isEqualTo("伊勢");
        assertThat(normalizer.stripProvinceMarker("国")).isEqualTo("国");
    }
}
