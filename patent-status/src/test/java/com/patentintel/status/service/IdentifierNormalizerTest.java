package com.patentintel.status.service;

import com.patentintel.status.exception.InvalidIdentifierFormatException;
import com.patentintel.status.model.CanonicalIdentifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierNormalizerTest {

    private final IdentifierNormalizer normalizer = new IdentifierNormalizer();

    @Test
    void stripsPunctuationAndUpperCases() {
        CanonicalIdentifier id = normalizer.normalize(" ep 1.234.567 b1 ");

        assertThat(id.jurisdiction()).isEqualTo("EP");
        assertThat(id.number()).isEqualTo("1234567");
        assertThat(id.kind()).isEqualTo("B1");
        assertThat(id.key()).isEqualTo("EP1234567");
        assertThat(id.display()).isEqualTo("EP1234567B1");
    }

    @Test
    void acceptsSevenAndEightDigitUsNumbers() {
        assertThat(normalizer.normalize("US-10,000,000").key()).isEqualTo("US10000000");
        assertThat(normalizer.normalize("us7654321").key()).isEqualTo("US7654321");
    }

    @ParameterizedTest
    @ValueSource(strings = {"EP1234567", "ep 1234567 b1", "US 10/000/000 B2", "us_7654321_a"})
    void normalizingTheDisplayFormIsIdempotent(String raw) {
        CanonicalIdentifier once = normalizer.normalize(raw);
        CanonicalIdentifier twice = normalizer.normalize(once.display());

        assertThat(twice).isEqualTo(once);
    }

    @ParameterizedTest
    @ValueSource(strings = {"INVALID", "", "   ", "EP123", "EP12345678", "US123456", "US123456789",
            "1234567", "EPX1234567", "GB1234567", "EP1234567BB"})
    void rejectsMalformedInput(String raw) {
        assertThatThrownBy(() -> normalizer.normalize(raw))
                .isInstanceOf(InvalidIdentifierFormatException.class)
                .satisfies(e -> assertThat(((InvalidIdentifierFormatException) e).outcomeCode()).isEqualTo(400));
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> normalizer.normalize(null))
                .isInstanceOf(InvalidIdentifierFormatException.class);
    }
}
