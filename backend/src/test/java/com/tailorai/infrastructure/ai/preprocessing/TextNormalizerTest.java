package com.tailorai.infrastructure.ai.preprocessing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
    }

    @Test
    @DisplayName("null and empty input")
    void nullAndEmpty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("invisible and control characters are removed")
    void invisibleAndControlChars() {
        assertThat(normalizer.normalize("Led\u200B team\uFEFF")).isEqualTo("Led team");
        assertThat(normalizer.normalize("Led\u0001 team\u0007")).isEqualTo("Led team");
    }

    @Test
    @DisplayName("line endings, space runs and blank lines are collapsed")
    void whitespace() {
        assertThat(normalizer.normalize("one\r\ntwo\rthree")).isEqualTo("one\ntwo\nthree");
        assertThat(normalizer.normalize("Led   team\t\tof 4")).isEqualTo("Led team of 4");
        assertThat(normalizer.normalize("one\n\n\n\ntwo")).isEqualTo("one\n\ntwo");
        assertThat(normalizer.normalize("  padded  ")).isEqualTo("padded");
    }

    @Test
    @DisplayName("Unicode NFC normalization")
    void nfc() {
        // 'e' + combining acute accent -> 'é'
        assertThat(normalizer.normalize("Re\u0301sume\u0301")).isEqualTo("R\u00e9sum\u00e9");
    }

    @Test
    @DisplayName("code fence payload is extracted")
    void stripCodeFences() {
        assertThat(normalizer.stripCodeFences("```json\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(normalizer.stripCodeFences("```\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
        assertThat(normalizer.stripCodeFences("  {\"a\": 1}  ")).isEqualTo("{\"a\": 1}");
        assertThat(normalizer.stripCodeFences(null)).isEmpty();
    }

    @Test
    @DisplayName("comparison key ignores case and all whitespace")
    void comparisonKey() {
        assertThat(normalizer.comparisonKey("Built ETL  pipeline\n daily"))
                .isEqualTo(normalizer.comparisonKey("built etl pipeline daily"));
    }
}
