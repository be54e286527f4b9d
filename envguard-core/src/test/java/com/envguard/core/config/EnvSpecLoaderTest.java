package com.envguard.core.config;

import com.envguard.core.model.EntrySpec;
import com.envguard.core.model.EntryType;
import com.envguard.core.model.EnvSpec;
import com.envguard.core.model.ResolvedConfig;
import com.envguard.core.source.MapEnvSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EnvSpecLoader}.
 */
class EnvSpecLoaderTest {

    @Test
    @DisplayName("Should load test spec from classpath")
    void shouldLoadFromClasspath() {
        EnvSpec spec = EnvSpecLoader.fromClasspath("test-env-spec.yml");

        assertThat(spec.getGlobal()).hasSize(4);
        EntrySpec port = spec.getGlobal().get(0);
        assertThat(port.getName()).isEqualTo("PORT");
        assertThat(port.getType()).isEqualTo("int");
        assertThat(port.getDefaultValue()).isEqualTo(8080);
        assertThat(port.getMin()).isEqualTo(1);
        assertThat(port.getMax()).isEqualTo(65535);
        assertThat(spec.getGlobal().get(1).getAllowed()).containsExactly("Dev", "Prod");
        assertThat(spec.getGlobal().get(2).isRequired()).isTrue();
    }

    @Test
    @DisplayName("Should read equal specs from YAML and JSON")
    void shouldReadJsonLikeYaml() throws IOException {
        String json;
        try (InputStream in = EnvSpecLoaderTest.class.getClassLoader().getResourceAsStream("test-env-spec.json")) {
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        assertThat(EnvSpecLoader.fromJson(json))
                .isEqualTo(EnvSpecLoader.fromClasspath("test-env-spec.yml"));
    }

    @Test
    @DisplayName("Should resolve a loaded spec end to end")
    void shouldResolveLoadedSpec() {
        Map<String, String> env = new HashMap<>();
        env.put("MODE", "PROD");
        env.put("TOKEN", " s3cret ");
        EnvLoader loader = new EnvLoader(new MapEnvSource(env));

        ResolvedConfig config = loader.load(EnvSpecLoader.fromClasspath("test-env-spec.yml"));

        assertThat(config.asMap()).containsExactly(
                Map.entry("PORT", 8080L),
                Map.entry("MODE", "Prod"),
                Map.entry("TOKEN", "s3cret"));
    }

    @Test
    @DisplayName("Should load spec from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("env.yml");
        Files.writeString(file, "global:\n  - name: HOST\n    default: localhost\n");

        EnvSpec spec = EnvSpecLoader.fromFile(file.toString());

        assertThat(spec.getGlobal()).containsExactly(
                EntrySpec.builder().name("HOST").defaultValue("localhost").build());
    }

    @Test
    @DisplayName("Should throw when classpath resource or file does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EnvSpecLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> EnvSpecLoader.fromFile("/no/such/env.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject malformed documents as invalid specs")
    void shouldRejectMalformedDocuments() {
        assertThatThrownBy(() -> EnvSpecLoader.fromYaml("global:\n  - name: A\nglobal: []\n"))
                .isInstanceOfSatisfying(EnvConfigException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_SPEC))
                .hasCauseInstanceOf(YAMLException.class);
        assertThatThrownBy(() -> EnvSpecLoader.fromJson("{\"global\": ["))
                .isInstanceOfSatisfying(EnvConfigException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_SPEC));
        assertThatThrownBy(() -> EnvSpecLoader.fromYaml("- just\n- a list\n"))
                .isInstanceOf(EnvConfigException.class)
                .hasMessage("EnvLoader.load requires a configuration object");
        assertThatThrownBy(() -> EnvSpecLoader.fromJson("{\"entries\": []}"))
                .isInstanceOf(EnvConfigException.class)
                .hasMessage("EnvLoader.load requires a `global` array of env specs");
    }

    @Test
    @DisplayName("Should accept an empty global list")
    void shouldAcceptEmptyGlobal() {
        assertThat(EnvSpecLoader.fromYaml("global: []").getGlobal()).isEmpty();
    }

    @Test
    @DisplayName("Should convert loosely typed entry fields")
    void shouldConvertEntriesLeniently() {
        Map<String, Object> bounded = new HashMap<>();
        bounded.put("name", "RATE");
        bounded.put("type", "INT");
        bounded.put("min", 1.5);
        bounded.put("max", 9.9);
        bounded.put("required", "TRUE");
        Map<String, Object> loose = new HashMap<>();
        loose.put("name", 42);
        loose.put("type", 7);
        loose.put("min", "1");
        loose.put("allowed", Arrays.asList("a", 1, null, "b"));

        EnvSpec spec = EnvSpecLoader.fromObject(Map.of("global", Arrays.asList(bounded, loose, "PORT", null)));

        EntrySpec rate = spec.getGlobal().get(0);
        assertThat(rate.getType()).isEqualTo("INT");
        assertThat(rate.entryType()).isEqualTo(EntryType.STRING);
        assertThat(rate.getMin()).isEqualTo(1.5);
        assertThat(rate.getMax()).isEqualTo(9.9);
        assertThat(rate.isRequired()).isTrue();

        EntrySpec other = spec.getGlobal().get(1);
        assertThat(other.getName()).isNull();
        assertThat(other.getType()).isNull();
        assertThat(other.getMin()).isNull();
        assertThat(other.getAllowed()).isEqualTo(List.of("a", "b"));

        assertThat(spec.getGlobal().get(2).getName()).isNull();
        assertThat(spec.getGlobal().get(3).getName()).isNull();
    }

    @Test
    @DisplayName("Should keep fractional bounds from a document and report them as declared")
    void shouldKeepFractionalBounds() {
        EnvSpec spec = EnvSpecLoader.fromYaml(
                "global:\n  - name: RATE\n    type: int\n    min: 1.5\n    max: .inf\n");
        EnvLoader loader = new EnvLoader(new MapEnvSource(Map.of("RATE", "1")));

        assertThat(spec.getGlobal().get(0).getMin()).isEqualTo(1.5);
        assertThat(spec.getGlobal().get(0).getMax()).isNull();
        assertThatThrownBy(() -> loader.load(spec))
                .isInstanceOfSatisfying(EnvConfigException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.BELOW_MIN);
                    assertThat(e.getConstraint()).isEqualTo(1.5);
                })
                .hasMessage("EnvLoader: \"RATE\" must be >= 1.5");
    }

    @Test
    @DisplayName("Should resolve a type that is not spelled exactly as a plain string")
    void shouldTreatInexactTypeAsString() {
        EnvSpec spec = EnvSpecLoader.fromJson(
                "{\"global\": [{\"name\": \"X\", \"type\": \"INT\", \"min\": 1}]}");
        EnvLoader loader = new EnvLoader(new MapEnvSource(Map.of("X", "abc")));

        assertThat(loader.load(spec).getString("X")).isEqualTo("abc");
    }
}
