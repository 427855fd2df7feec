package io.fluenthttp.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class MediaTypeTest {

    @Test
    void headerValueCarriesCharsetOnlyForText() {
        assertThat(MediaType.TEXT.headerValue()).isEqualTo("text/plain; charset=utf-8");
        assertThat(MediaType.JSON.headerValue()).isEqualTo("application/json");
        assertThat(MediaType.FORM.value()).isEqualTo("application/x-www-form-urlencoded");
    }

    @ParameterizedTest
    @CsvSource({
        "application/json, JSON, true",
        "'application/json; charset=utf-8', JSON, true",
        "application/problem+json, JSON, true",
        "'APPLICATION/X-WWW-FORM-URLENCODED; charset=UTF-8', FORM, true",
        "multipart/form-data, FORM, false",
        "text/plain, TEXT, true",
        "application/problem+json, BINARY, false",
        "image/png, BINARY, false"
    })
    void matchesContentTypeHeader(String contentType, MediaType type, boolean expected) {
        assertThat(type.matches(contentType)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "; charset=utf-8"})
    void blankContentTypeMatchesNothing(String contentType) {
        for (MediaType type : MediaType.values()) {
            assertThat(type.matches(contentType)).isFalse();
        }
    }
}
