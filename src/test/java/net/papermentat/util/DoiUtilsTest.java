package net.papermentat.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DoiUtilsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "10.1038/nature14539|10.1038/nature14539",
        "https://doi.org/10.1038/NATURE14539|10.1038/nature14539",
        "http://dx.doi.org/10.1145/3065386|10.1145/3065386",
        "doi: 10.1016/j.oregeorev.2018.12.018.|10.1016/j.oregeorev.2018.12.018",
        "10.1000/xyz);|10.1000/xyz"
    })
    void normalize_stripsPrefixesAndPunctuation(String raw, String expected) {
        assertThat(DoiUtils.normalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not a doi", "11.1000/xyz", "10.12/short-registrant", "https://example.org/paper"})
    void normalize_rejectsNonDois(String raw) {
        assertThat(DoiUtils.normalize(raw)).isNull();
    }

    @Test
    @DisplayName("normalize is idempotent")
    void normalize_isIdempotent() {
        String once = DoiUtils.normalize("https://doi.org/10.1093/BIOINFORMATICS/btz682");
        assertThat(DoiUtils.normalize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("extractFirst finds a DOI embedded in a publisher URL")
    void extractFirst_findsEmbeddedDoi() {
        assertThat(DoiUtils.extractFirst("https://link.springer.com/article/10.1007/s00126-019-00925-2"))
            .contains("10.1007/s00126-019-00925-2");
        assertThat(DoiUtils.extractFirst("https://example.org/no-doi-here")).isEmpty();
        assertThat(DoiUtils.extractFirst(null)).isEmpty();
    }

    @Test
    @DisplayName("component DOIs are recognised")
    void isComponentDoi() {
        assertThat(DoiUtils.isComponentDoi("10.7717/peerj.1234/fig-2")).isTrue();
        assertThat(DoiUtils.isComponentDoi("10.7717/peerj.1234/table-1")).isTrue();
        assertThat(DoiUtils.isComponentDoi("10.7717/peerj.1234/supp-3")).isTrue();
        assertThat(DoiUtils.isComponentDoi("10.7717/peerj.1234")).isFalse();
    }

    @Test
    @DisplayName("resolver URLs are detected case-insensitively")
    void isResolverUrl() {
        assertThat(DoiUtils.isResolverUrl("https://DOI.org/10.1000/xyz")).isTrue();
        assertThat(DoiUtils.isResolverUrl("https://dx.doi.org/10.1000/xyz")).isTrue();
        assertThat(DoiUtils.isResolverUrl("https://example.org/10.1000/xyz")).isFalse();
        assertThat(DoiUtils.toResolverUrl("10.1000/xyz")).isEqualTo("https://doi.org/10.1000/xyz");
    }
}
