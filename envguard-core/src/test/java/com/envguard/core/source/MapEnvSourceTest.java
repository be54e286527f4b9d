package com.envguard.core.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MapEnvSource}.
 */
class MapEnvSourceTest {

    @Test
    @DisplayName("Should return raw values untrimmed")
    void shouldReturnRawValue() {
        EnvSource source = new MapEnvSource(Map.of("HOST", "  db  "));

        assertThat(source.lookup("HOST")).contains("  db  ");
    }

    @Test
    @DisplayName("Should treat absent and null values alike")
    void shouldTreatNullAsAbsent() {
        Map<String, Object> values = new HashMap<>();
        values.put("EMPTY", null);
        EnvSource source = new MapEnvSource(values);

        assertThat(source.lookup("EMPTY")).isEmpty();
        assertThat(source.lookup("MISSING")).isEmpty();
    }

    @Test
    @DisplayName("Should stringify non-string values")
    void shouldStringifyValues() {
        EnvSource source = new MapEnvSource(Map.of("WORKERS", 8, "DEBUG", false));

        assertThat(source.lookup("WORKERS")).contains("8");
        assertThat(source.lookup("DEBUG")).contains("false");
    }

    @Test
    @DisplayName("Should reject a null map")
    void shouldRejectNullMap() {
        assertThatThrownBy(() -> new MapEnvSource(null))
                .isInstanceOf(NullPointerException.class);
    }
}
