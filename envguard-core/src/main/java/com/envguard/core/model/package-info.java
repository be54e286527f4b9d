/**
 * Domain model classes for Env Guard.
 *
 * <ul>
 * <li>{@link com.envguard.core.model.EntrySpec}: declaration of one
 * variable</li>
 * <li>{@link com.envguard.core.model.EnvSpec}: ordered list of
 * declarations</li>
 * <li>{@link com.envguard.core.model.ResolvedConfig}: typed result of a
 * load</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.envguard.core.model;
