package com.envguard.core.source;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EnvSource} over an arbitrary map, mainly for tests.
 *
 * <p>
 * The map is held <strong>by reference</strong>: later changes made by the
 * owner are visible to subsequent lookups, and the source never writes to
 * it. Non-string values are converted with {@link String#valueOf(Object)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MapEnvSource implements EnvSource {

    private final Map<String, ?> values;

    /**
     * @param values backing map; must not be {@code null}
     * @throws NullPointerException if {@code values} is {@code null}
     */
    public MapEnvSource(Map<String, ?> values) {
        this.values = Objects.requireNonNull(values, "Source map must not be null");
    }

    @Override
    public Optional<String> lookup(String name) {
        Object raw = values.get(name);
        return raw == null ? Optional.empty() : Optional.of(String.valueOf(raw));
    }

    @Override
    public String toString() {
        return "MapEnvSource" + values.keySet();
    }
}
