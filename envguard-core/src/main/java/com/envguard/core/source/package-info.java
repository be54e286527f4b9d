/**
 * Pluggable lookup sources for the loader.
 *
 * <p>
 * {@link com.envguard.core.source.SystemEnvSource} is the production
 * default; {@link com.envguard.core.source.MapEnvSource} lets tests inject a
 * synthetic environment.
 * </p>
 *
 * @since 1.0.0
 */
package com.envguard.core.source;
