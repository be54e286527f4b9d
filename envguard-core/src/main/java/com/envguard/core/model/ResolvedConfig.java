package com.envguard.core.model;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a successful load: normalized variable name to typed value.
 *
 * <p>
 * Values are {@link String} for string and enum entries. Int entries hold a
 * {@link Long}, or a {@link BigInteger} when the number does not fit in one.
 * An optional entry that resolved to nothing is present with the empty
 * string, regardless of its declared type.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and safe to share once returned by the loader.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResolvedConfig {

    private final Map<String, Object> values;

    /**
     * @param values resolved values; copied
     * @throws NullPointerException if {@code values} is {@code null}
     */
    public ResolvedConfig(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * Retrieve a value by name.
     *
     * @param name normalized variable name
     * @return optional containing the value, or empty if not declared
     */
    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Retrieve a value in its string form.
     *
     * @param name normalized variable name
     * @return the value, or {@code null} if not declared
     */
    public String getString(String name) {
        Object raw = values.get(name);
        return raw == null ? null : raw.toString();
    }

    /**
     * Retrieve an int-typed value of any magnitude.
     *
     * @param name normalized variable name
     * @return optional containing the number; empty if the name is not
     *         declared or resolved to the empty string
     */
    public Optional<BigInteger> getBigInteger(String name) {
        Object raw = values.get(name);
        if (raw instanceof BigInteger big) {
            return Optional.of(big);
        }
        if (raw instanceof Number n) {
            return Optional.of(BigInteger.valueOf(n.longValue()));
        }
        return Optional.empty();
    }

    /**
     * Retrieve an int-typed value as a {@code long}.
     *
     * @param name normalized variable name
     * @return optional containing the number; empty if the name is not
     *         declared or resolved to the empty string
     * @throws ArithmeticException if the value does not fit in a {@code long}
     */
    public Optional<Long> getLong(String name) {
        return getBigInteger(name).map(BigInteger::longValueExact);
    }

    /**
     * Same as {@link #getLong(String)} narrowed to {@code int}.
     *
     * @param name normalized variable name
     * @return optional containing the number
     * @throws ArithmeticException if the value does not fit in an {@code int}
     */
    public Optional<Integer> getInt(String name) {
        return getLong(name).map(Math::toIntExact);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    /**
     * Return an <strong>unmodifiable</strong> view of all values, in
     * declaration order.
     *
     * @return unmodifiable map of names to values
     */
    public Map<String, Object> asMap() {
        return values;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResolvedConfig that))
            return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /**
     * Lists names only; values may be secrets.
     */
    @Override
    public String toString() {
        return "ResolvedConfig" + values.keySet();
    }
}
