package com.envguard.core.source;

import java.util.Optional;

/**
 * Read-only key-value provider backing env lookups.
 *
 * <p>
 * Implementations return the value in its string form and never trim or
 * otherwise normalize it; the loader does that.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EnvSource {

    /**
     * Look up a variable.
     *
     * @param name variable name
     * @return the raw value, or empty if the variable is absent or
     *         {@code null}
     */
    Optional<String> lookup(String name);
}
