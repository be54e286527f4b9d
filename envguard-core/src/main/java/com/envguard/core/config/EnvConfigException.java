package com.envguard.core.config;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Raised when a spec or a resolved value is invalid.
 *
 * <p>
 * Every instance is fatal for the {@code load} call that produced it. Callers
 * can branch on {@link #getKind()} instead of parsing the message; the
 * message still names the variable and the violated constraint for logs.
 * </p>
 *
 * @since 1.0.0
 */
public class EnvConfigException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String variableName;
    private final transient Object constraint;

    EnvConfigException(ErrorKind kind, String variableName, Object constraint, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.variableName = variableName;
        this.constraint = constraint;
    }

    EnvConfigException(String message, Throwable cause) {
        super(message, cause);
        this.kind = ErrorKind.INVALID_SPEC;
        this.variableName = null;
        this.constraint = null;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    static EnvConfigException invalidSpec(String message) {
        return new EnvConfigException(ErrorKind.INVALID_SPEC, null, null, message);
    }

    static EnvConfigException missingRequired(String name) {
        return new EnvConfigException(ErrorKind.MISSING_REQUIRED, name, null,
                "EnvLoader: missing required env \"" + name + "\"");
    }

    static EnvConfigException notAnInteger(String name) {
        return new EnvConfigException(ErrorKind.NOT_AN_INTEGER, name, null,
                "EnvLoader: \"" + name + "\" must be an integer");
    }

    static EnvConfigException belowMin(String name, Number min) {
        return new EnvConfigException(ErrorKind.BELOW_MIN, name, min,
                "EnvLoader: \"" + name + "\" must be >= " + formatBound(min));
    }

    static EnvConfigException aboveMax(String name, Number max) {
        return new EnvConfigException(ErrorKind.ABOVE_MAX, name, max,
                "EnvLoader: \"" + name + "\" must be <= " + formatBound(max));
    }

    /** Whole bounds print without a fraction: {@code 2.0} reads as {@code 2}. */
    private static String formatBound(Number bound) {
        if (bound instanceof Double || bound instanceof Float || bound instanceof BigDecimal) {
            return new BigDecimal(bound.toString()).stripTrailingZeros().toPlainString();
        }
        return bound.toString();
    }

    static EnvConfigException enumMismatch(String name, List<String> allowed) {
        return new EnvConfigException(ErrorKind.ENUM_MISMATCH, name, allowed,
                "EnvLoader: \"" + name + "\" must be one of: " + String.join(", ", allowed));
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the offending variable, or {@code null} for
     *         {@link ErrorKind#INVALID_SPEC}
     */
    public String getVariableName() {
        return variableName;
    }

    /**
     * The violated constraint: the bound as declared ({@link Number}) for
     * {@code BELOW_MIN}/{@code ABOVE_MAX}, the allowed options
     * ({@code List<String>}) for {@code ENUM_MISMATCH}, otherwise
     * {@code null}.
     *
     * @return the constraint, may be {@code null}
     */
    public Object getConstraint() {
        return constraint;
    }
}
