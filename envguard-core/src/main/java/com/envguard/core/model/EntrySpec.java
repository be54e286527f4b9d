package com.envguard.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of a single environment variable.
 *
 * <p>
 * Supported types:
 * </p>
 * <ul>
 * <li>{@code string} (default): the trimmed raw value</li>
 * <li>{@code int}: a whole number, optionally bounded by {@code min} /
 * {@code max}</li>
 * <li>{@code enum}: one of the {@code allowed} values, matched ignoring
 * case</li>
 * </ul>
 *
 * <p>
 * The type is matched exactly: {@code "INT"} or {@code " int"} is not an int
 * entry and resolves as a plain string.
 * </p>
 *
 * <p>
 * Instances are immutable; build them with {@link #builder()} or read them
 * from a spec document via {@link com.envguard.core.config.EnvSpecLoader#fromObject(Object)}. A declaration
 * whose name is {@code null} or blank is kept as-is and simply ignored by the
 * loader.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntrySpec {

    /** Lookup key in the env source. */
    private final String name;

    /** Declared type, verbatim; {@code null} means string. */
    private final String type;

    /** Fallback used when the source value is empty. */
    private final Object defaultValue;

    private final boolean required;

    // --- int bounds, as declared ---
    private final Number min;
    private final Number max;

    // --- enum options, in declaration order ---
    private final List<String> allowed;

    private EntrySpec(Builder b) {
        this.name = b.name;
        this.type = b.type;
        this.defaultValue = b.defaultValue;
        this.required = b.required;
        this.min = b.min;
        this.max = b.max;
        this.allowed = b.allowed != null
                ? Collections.unmodifiableList(new ArrayList<>(b.allowed))
                : null;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a plain optional string entry.
     *
     * @param name variable name
     * @return the entry
     */
    public static EntrySpec named(String name) {
        return builder().name(name).build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    /**
     * @return the resolved kind for {@link #getType()}
     */
    public EntryType entryType() {
        return EntryType.of(type);
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return required;
    }

    public Number getMin() {
        return min;
    }

    public Number getMax() {
        return max;
    }

    /**
     * @return unmodifiable allowed options, or {@code null} if none were
     *         declared
     */
    public List<String> getAllowed() {
        return allowed;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EntrySpec}. Nothing is validated at build
     * time; malformed declarations surface when the entry is loaded.
     */
    public static class Builder {
        private String name;
        private String type;
        private Object defaultValue;
        private boolean required;
        private Number min;
        private Number max;
        private List<String> allowed;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder type(EntryType type) {
            this.type = type != null ? type.id() : null;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder min(Number min) {
            this.min = min;
            return this;
        }

        public Builder max(Number max) {
            this.max = max;
            return this;
        }

        public Builder allowed(List<String> allowed) {
            this.allowed = allowed;
            return this;
        }

        public Builder allowed(String... allowed) {
            this.allowed = Arrays.asList(allowed);
            return this;
        }

        public EntrySpec build() {
            return new EntrySpec(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntrySpec that))
            return false;
        return required == that.required
                && Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(min, that.min)
                && Objects.equals(max, that.max)
                && Objects.equals(allowed, that.allowed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, defaultValue, required, min, max, allowed);
    }

    @Override
    public String toString() {
        return "EntrySpec{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", required=" + required +
                ", min=" + min +
                ", max=" + max +
                ", allowed=" + allowed +
                '}';
    }
}
