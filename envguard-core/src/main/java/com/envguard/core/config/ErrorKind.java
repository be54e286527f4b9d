package com.envguard.core.config;

/**
 * Kinds of load failure carried by {@link EnvConfigException}.
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    /** The spec document is missing, not an object, or lacks a {@code global} list. */
    INVALID_SPEC,

    /** A required entry is empty after default substitution. */
    MISSING_REQUIRED,

    /** An int entry does not hold a finite whole number. */
    NOT_AN_INTEGER,

    BELOW_MIN,

    ABOVE_MAX,

    /** An enum entry matches none of its allowed options. */
    ENUM_MISMATCH
}
