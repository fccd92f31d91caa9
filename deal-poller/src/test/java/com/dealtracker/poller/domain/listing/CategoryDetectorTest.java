package com.dealtracker.poller.domain.listing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CategoryDetectorTest {

    @Test
    void detect_matchesWholeWordsOnly() {
        assertThat(CategoryDetector.detect("Herbal Shampoo 400ml", null)).isEqualTo("Health & Beauty");
    }

    @Test
    void detect_highestScoreWins() {
        assertThat(CategoryDetector.detect("Chicken breast", "fresh chicken thighs and wings")).isEqualTo("Meat");
    }

    @Test
    void detect_usesDescription() {
        assertThat(CategoryDetector.detect("Mystery box", "assorted bread and muffins")).isEqualTo("Bakery");
    }

    @Test
    void detect_tieGoesToFirstDeclaredCategory() {
        assertThat(CategoryDetector.detect("Ice cream", null)).isEqualTo("Dairy");
    }

    @Test
    void detect_noKeyword_isOther() {
        assertThat(CategoryDetector.detect("Gift card", null)).isEqualTo(CategoryDetector.OTHER);
        assertThat(CategoryDetector.detect(null, null)).isEqualTo(CategoryDetector.OTHER);
    }

    @Test
    void categories_endWithOther() {
        assertThat(CategoryDetector.categories()).startsWith("Produce").endsWith("Other").contains("Pet Food");
    }
}
