package it.aw.readingqueue.service;

import it.aw.readingqueue.error.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlPreparerTest {

    @ParameterizedTest
    @CsvSource({
            "example.com/post,                 https://example.com/post",
            "'  https://example.com/a?b=1  ',  https://example.com/a?b=1",
            "http://blog.example.org,          http://blog.example.org",
            "localhost:8080/page,              https://localhost:8080/page",
            "192.168.1.10/x,                   https://192.168.1.10/x"
    })
    void normalizes(String raw, String expected) {
        assertThat(UrlPreparer.prepare(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not a url", "intranet/page", "https://-bad-.com", "https://exa_mple.com"})
    void rejects(String raw) {
        assertThatThrownBy(() -> UrlPreparer.prepare(raw)).isInstanceOf(ValidationException.class);
    }
}
