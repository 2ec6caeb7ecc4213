package com.pystructure.core.analyzer;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NamingConventions}.
 */
class NamingConventionsTest {

    @ParameterizedTest
    @ValueSource(strings = {"MAX_SIZE", "DEBUG", "X", "HTTP2_PORT", "A1", "API_V2_URL"})
    void isConstantName_upperCaseNames_returnsTrue(String name) {
        assertThat(NamingConventions.isConstantName(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"my_const", "MyClass", "_PRIVATE", "__ALL__", "Max_Size", "_", "123", "__", "2X", "MAX-SIZE"})
    void isConstantName_otherNames_returnsFalse(String name) {
        assertThat(NamingConventions.isConstantName(name)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    void isConstantName_missingName_returnsFalse(String name) {
        assertThat(NamingConventions.isConstantName(name)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"x", "_tmp", "café", "__init__", "snake_case_2"})
    void isIdentifier_validIdentifiers_returnsTrue(String name) {
        assertThat(NamingConventions.isIdentifier(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"1abc", "a-b", "a b", "a.b"})
    void isIdentifier_invalidIdentifiers_returnsFalse(String name) {
        assertThat(NamingConventions.isIdentifier(name)).isFalse();
    }
}
