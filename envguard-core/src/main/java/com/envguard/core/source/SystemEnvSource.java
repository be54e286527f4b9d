package com.envguard.core.source;

import java.util.Optional;

/**
 * {@link EnvSource} backed by the process environment.
 *
 * @since 1.0.0
 */
public final class SystemEnvSource implements EnvSource {

    public static final SystemEnvSource INSTANCE = new SystemEnvSource();

    private SystemEnvSource() {
    }

    @Override
    public Optional<String> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(System.getenv(name));
    }

    @Override
    public String toString() {
        return "SystemEnvSource";
    }
}
