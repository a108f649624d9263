package com.delta.warmup.placement.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DomainNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"example.com", "Mail.Example.COM", "a-b.c-d.io", "x1.example.co.uk", "example.com."})
    void acceptsAsciiHostNames(String name) {
        assertThat(DomainNames.isValid(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "localhost", "-bad.com", "bad-.com", "under_score.com", "example.c", "example.123",
        "two..dots.com", "spa ce.com", "bücher.de"})
    void rejectsMalformedNames(String name) {
        assertThat(DomainNames.isValid(name)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {64, 254})
    void enforcesLengthLimits(int length) {
        String name = length == 64
            ? "a".repeat(64) + ".com"
            : ("a".repeat(60) + ".").repeat(4) + "a".repeat(length - 248) + ".com";
        assertThat(DomainNames.isValid(name)).isFalse();
    }
}
