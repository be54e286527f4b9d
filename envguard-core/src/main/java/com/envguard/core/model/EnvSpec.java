package com.envguard.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Top-level container of environment declarations.
 *
 * <p>
 * Expected document structure:
 * </p>
 *
 * <pre>
 * global:
 *   - name: PORT
 *     type: int
 *     default: 8080
 *     min: 1
 *     max: 65535
 *   - name: MODE
 *     type: enum
 *     allowed: [Dev, Prod]
 * </pre>
 *
 * <p>
 * Entries are kept in declaration order, which is also the order in which
 * the loader resolves and reports on them.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnvSpec {

    private final List<EntrySpec> global;

    /**
     * @param global ordered declarations; must not be {@code null}, may
     *               contain {@code null} elements (skipped on load)
     * @throws NullPointerException if {@code global} is {@code null}
     */
    public EnvSpec(List<EntrySpec> global) {
        Objects.requireNonNull(global, "global entries must not be null");
        this.global = Collections.unmodifiableList(new ArrayList<>(global));
    }

    public static EnvSpec of(EntrySpec... entries) {
        return new EnvSpec(Arrays.asList(entries));
    }

    /**
     * Return the declarations. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of entries
     */
    public List<EntrySpec> getGlobal() {
        return global;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnvSpec that))
            return false;
        return global.equals(that.global);
    }

    @Override
    public int hashCode() {
        return global.hashCode();
    }

    @Override
    public String toString() {
        return "EnvSpec{global=" + global + '}';
    }
}
