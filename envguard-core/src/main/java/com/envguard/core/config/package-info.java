/**
 * Loading and validation of environment configuration.
 *
 * <p>
 * Declarations are read by
 * {@link com.envguard.core.config.EnvSpecLoader} (or built in code) and
 * resolved by {@link com.envguard.core.config.EnvLoader} into a
 * {@link com.envguard.core.model.ResolvedConfig}. Any invalid value raises an
 * {@link com.envguard.core.config.EnvConfigException} so that the
 * application fails at startup rather than running half-configured.
 * </p>
 *
 * @since 1.0.0
 */
package com.envguard.core.config;
