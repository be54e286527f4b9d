package com.envguard.core.config;

import com.envguard.core.model.EntrySpec;
import com.envguard.core.model.EnvSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads {@link EnvSpec} documents from YAML or JSON.
 *
 * <h3>Sources</h3>
 * <ul>
 * <li>An explicit file system path via {@link #fromFile(String)}</li>
 * <li>A classpath resource via {@link #fromClasspath(String)}</li>
 * <li>In-memory text via {@link #fromYaml(String)} or
 * {@link #fromJson(String)}</li>
 * </ul>
 *
 * <p>
 * Nothing is searched for: the caller names the document. Every document,
 * whatever its origin, goes through {@link #fromObject(Object)}, which
 * checks the top-level shape and converts each entry leniently. Entries
 * that cannot carry a name are kept with a {@code null} name so that the
 * loader skips them instead of failing.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnvSpecLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EnvSpecLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EnvSpecLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load a YAML spec from a file system path.
     *
     * @param path absolute or relative path to the YAML file; must not be
     *             {@code null}
     * @return parsed spec
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws EnvConfigException       if the document is malformed
     */
    public static EnvSpec fromFile(String path) {
        Objects.requireNonNull(path, "Spec file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            LOG.info("Loading env spec from file: {}", path);
            return parseYaml(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Env spec file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read env spec file: " + path, e);
        }
    }

    /**
     * Load a YAML spec from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed spec
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws EnvConfigException       if the document is malformed
     */
    public static EnvSpec fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EnvSpecLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            LOG.info("Loading env spec from classpath: {}", resource);
            return parseYaml(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse a YAML spec held in memory.
     *
     * @param yaml document text; must not be {@code null}
     * @return parsed spec
     * @throws EnvConfigException if the document is malformed
     */
    public static EnvSpec fromYaml(String yaml) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        try {
            return fromObject(newYaml().load(yaml));
        } catch (YAMLException e) {
            throw new EnvConfigException("Malformed env spec YAML: " + e.getMessage(), e);
        }
    }

    /**
     * Parse a JSON spec held in memory.
     *
     * @param json document text; must not be {@code null}
     * @return parsed spec
     * @throws EnvConfigException if the document is malformed
     */
    public static EnvSpec fromJson(String json) {
        Objects.requireNonNull(json, "JSON text must not be null");
        try {
            return fromObject(MAPPER.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new EnvConfigException("Malformed env spec JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Convert an untyped document into a spec.
     *
     * <p>
     * The document must be a {@link Map} holding a {@link List} under
     * {@code global}. Within each entry map:
     * </p>
     * <ul>
     * <li>a non-string {@code name} or {@code type} is treated as absent;</li>
     * <li>{@code required} is true for boolean {@code true} or the string
     * {@code "true"} (any case);</li>
     * <li>non-numeric or non-finite {@code min}/{@code max} are ignored;
     * other bounds are kept as declared, fractions included;</li>
     * <li>non-string {@code allowed} options are dropped.</li>
     * </ul>
     *
     * @param document parsed document
     * @return the spec
     * @throws EnvConfigException with {@link ErrorKind#INVALID_SPEC} if the
     *                            top-level shape is wrong
     */
    public static EnvSpec fromObject(Object document) {
        if (!(document instanceof Map<?, ?> map)) {
            throw EnvConfigException.invalidSpec("EnvLoader.load requires a configuration object");
        }
        if (!(map.get("global") instanceof List<?> global)) {
            throw EnvConfigException.invalidSpec("EnvLoader.load requires a `global` array of env specs");
        }
        if (global.isEmpty()) {
            LOG.warn("No env entries declared in spec document");
        }

        List<EntrySpec> entries = new ArrayList<>(global.size());
        for (Object item : global) {
            entries.add(toEntry(item));
        }
        return new EnvSpec(entries);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }

    private static EnvSpec parseYaml(InputStream is) {
        try {
            return fromObject(newYaml().load(is));
        } catch (YAMLException e) {
            throw new EnvConfigException("Malformed env spec YAML: " + e.getMessage(), e);
        }
    }

    private static EntrySpec toEntry(Object item) {
        if (!(item instanceof Map<?, ?> fields)) {
            return EntrySpec.builder().build();
        }
        return EntrySpec.builder()
                .name(asString(fields.get("name")))
                .type(asString(fields.get("type")))
                .defaultValue(fields.get("default"))
                .required(asFlag(fields.get("required")))
                .min(asBound(fields.get("min")))
                .max(asBound(fields.get("max")))
                .allowed(asOptions(fields.get("allowed")))
                .build();
    }

    private static String asString(Object raw) {
        return raw instanceof String s ? s : null;
    }

    private static boolean asFlag(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        return raw instanceof String s && s.trim().toLowerCase(Locale.ROOT).equals("true");
    }

    private static Number asBound(Object raw) {
        if (!(raw instanceof Number n)) {
            return null;
        }
        if ((n instanceof Double || n instanceof Float) && !Double.isFinite(n.doubleValue())) {
            return null;
        }
        return n;
    }

    private static List<String> asOptions(Object raw) {
        if (!(raw instanceof List<?> options)) {
            return null;
        }
        List<String> result = new ArrayList<>(options.size());
        for (Object option : options) {
            if (option instanceof String s) {
                result.add(s);
            }
        }
        return result;
    }
}
