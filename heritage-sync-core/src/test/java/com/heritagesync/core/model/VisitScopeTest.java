package com.heritagesync.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link VisitScope}.
 */
class VisitScopeTest {

    @Test
    void decode_propertyKey_returnsPropertyScope() {
        VisitScope scope = VisitScope.decode("property:438");

        assertThat(scope).isEqualTo(new VisitScope.PropertyScope("438"));
        assertThat(scope.encode()).isEqualTo("property:438");
    }

    @Test
    void decode_componentId_returnsComponentScope() {
        VisitScope scope = VisitScope.decode("Q29583927");

        assertThat(scope).isEqualTo(new VisitScope.ComponentScope("Q29583927"));
        assertThat(scope.encode()).isEqualTo("Q29583927");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "property:", "property:  "})
    void decode_invalidKey_throwsException(String key) {
        assertThatThrownBy(() -> VisitScope.decode(key))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void componentScope_reservedPrefix_throwsException() {
        assertThatThrownBy(() -> new VisitScope.ComponentScope("property:438"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reserved prefix");
    }

    @Test
    void isReserved_detectsPrefixOnly() {
        assertThat(VisitScope.isReserved("property:1")).isTrue();
        assertThat(VisitScope.isReserved("Q1")).isFalse();
        assertThat(VisitScope.isReserved("my-property:1")).isFalse();
        assertThat(VisitScope.isReserved(null)).isFalse();
    }
}
