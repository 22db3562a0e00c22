package com.openrangelabs.donpetre.mlssync.duplicate;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FuzzyAddressMatcherTest {

    @Test
    void normalize_FoldsCaseAndStripsPunctuation() {
        assertThat(FuzzyAddressMatcher.normalize("  123 Main St., Apt #4 ")).isEqualTo("123 main st apt 4");
        assertThat(FuzzyAddressMatcher.normalize(null)).isEmpty();
    }

    @Test
    void normalizeStreet_AbbreviatesSuffixesAndDirections() {
        assertThat(FuzzyAddressMatcher.normalizeStreet("123 Main Street")).isEqualTo("123 main st");
        assertThat(FuzzyAddressMatcher.normalizeStreet("123 main st.")).isEqualTo("123 main st");
        assertThat(FuzzyAddressMatcher.normalizeStreet("500 North Lake Shore Drive")).isEqualTo("500 n lake shore dr");
        assertThat(FuzzyAddressMatcher.normalizeStreet("9 Oak Avenue Suite 2")).isEqualTo("9 oak ave ste 2");
    }

    @Test
    void normalizeStreet_DropsOrdinalSuffixes() {
        assertThat(FuzzyAddressMatcher.normalizeStreet("1 West 42nd Street")).isEqualTo("1 w 42 st");
        assertThat(FuzzyAddressMatcher.normalizeStreet("1 W 42 St")).isEqualTo("1 w 42 st");
    }

    @Test
    void similarity_IsOneMinusRelativeEditDistance() {
        assertThat(FuzzyAddressMatcher.similarity("austin", "austin")).isEqualTo(1.0);
        assertThat(FuzzyAddressMatcher.similarity("", "")).isEqualTo(1.0);
        assertThat(FuzzyAddressMatcher.similarity("abc", "")).isEqualTo(0.0);
        assertThat(FuzzyAddressMatcher.similarity("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7, within(1e-9));
    }

    @Test
    void levenshtein_CountsInsertionsDeletionsAndSubstitutions() {
        assertThat(FuzzyAddressMatcher.levenshtein("flaw", "lawn")).isEqualTo(2);
        assertThat(FuzzyAddressMatcher.levenshtein("", "abc")).isEqualTo(3);
        assertThat(FuzzyAddressMatcher.levenshtein("same", "same")).isZero();
    }
}
