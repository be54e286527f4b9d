package com.envguard.core.config;

import com.envguard.core.model.ResolvedConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link EnvLoader#tryLoad}: either a resolved config or the
 * error that stopped resolution.
 *
 * @since 1.0.0
 */
public final class LoadResult {

    private final ResolvedConfig config;
    private final EnvConfigException error;

    private LoadResult(ResolvedConfig config, EnvConfigException error) {
        this.config = config;
        this.error = error;
    }

    public static LoadResult success(ResolvedConfig config) {
        return new LoadResult(Objects.requireNonNull(config, "config must not be null"), null);
    }

    public static LoadResult failure(EnvConfigException error) {
        return new LoadResult(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the resolved config, empty on failure
     */
    public Optional<ResolvedConfig> getConfig() {
        return Optional.ofNullable(config);
    }

    /**
     * @return the failure, empty on success
     */
    public Optional<EnvConfigException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return kind of the failure, empty on success
     */
    public Optional<ErrorKind> errorKind() {
        return getError().map(EnvConfigException::getKind);
    }

    /**
     * Unwrap the config.
     *
     * @return the resolved config
     * @throws EnvConfigException the captured failure
     */
    public ResolvedConfig orElseThrow() {
        if (error != null) {
            throw error;
        }
        return config;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "LoadResult{success=" + config + '}'
                : "LoadResult{failure=" + error.getKind() + ": " + error.getMessage() + '}';
    }
}
