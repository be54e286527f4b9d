package com.envguard.core.config;

import com.envguard.core.model.EntrySpec;
import com.envguard.core.model.EnvSpec;
import com.envguard.core.model.ResolvedConfig;
import com.envguard.core.source.EnvSource;
import com.envguard.core.source.MapEnvSource;
import com.envguard.core.source.SystemEnvSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolves an {@link EnvSpec} against an {@link EnvSource} into a typed
 * {@link ResolvedConfig}.
 *
 * <h3>Resolution Pipeline</h3>
 * <p>
 * Each entry is processed in declaration order:
 * </p>
 * <ol>
 * <li>Trim the name; entries without a usable name are skipped.</li>
 * <li>Read and trim the raw value; absent means empty.</li>
 * <li>Substitute the declared default when the value is empty.</li>
 * <li>Fail if a required entry is still empty.</li>
 * <li>Keep empty optional values as {@code ""} without coercion.</li>
 * <li>Coerce {@code int} and {@code enum} entries; leave the rest as
 * strings.</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Resolution <strong>fails fast</strong>: the first invalid entry aborts the
 * whole load with an {@link EnvConfigException}, so callers never see a
 * partially populated configuration.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The loader keeps no state besides the source reference, which
 * {@link #init(EnvSource)} swaps atomically. The source itself is read
 * without locking; callers must not mutate it while a load is running.
 * </p>
 *
 * @since 1.0.0
 */
public class EnvLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EnvLoader.class);

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern RADIX_PREFIXED = Pattern.compile("0[xXoObB][0-9a-fA-F]+");

    /** Magnitudes beyond the largest finite double are not finite numbers. */
    private static final BigDecimal LARGEST_FINITE = new BigDecimal(Double.MAX_VALUE);

    private volatile EnvSource source;

    /**
     * @param source lookup source; {@code null} selects the process
     *               environment
     */
    public EnvLoader(EnvSource source) {
        this.source = source != null ? source : SystemEnvSource.INSTANCE;
    }

    /**
     * Create a loader reading from the process environment.
     *
     * @return new loader
     */
    public static EnvLoader fromSystemEnvironment() {
        return new EnvLoader(SystemEnvSource.INSTANCE);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Replace the lookup source. The source is kept by reference, not copied.
     *
     * @param newSource the source to read from; {@code null} restores the
     *                  process environment
     */
    public void init(EnvSource newSource) {
        this.source = newSource != null ? newSource : SystemEnvSource.INSTANCE;
        LOG.debug("Env source set to {}", this.source);
    }

    /**
     * Replace the lookup source with a map.
     *
     * @param values backing map; {@code null} restores the process
     *               environment
     */
    public void init(Map<String, ?> values) {
        init(values != null ? new MapEnvSource(values) : null);
    }

    /**
     * @return the source currently used for lookups
     */
    public EnvSource getSource() {
        return source;
    }

    /**
     * Resolve every declared entry.
     *
     * @param spec the declarations
     * @return newly allocated resolved configuration
     * @throws EnvConfigException if {@code spec} is {@code null} or any entry
     *                            fails validation
     */
    public ResolvedConfig load(EnvSpec spec) {
        if (spec == null) {
            throw EnvConfigException.invalidSpec("EnvLoader.load requires a configuration object");
        }

        EnvSource current = source;
        Map<String, Object> resolved = new LinkedHashMap<>();

        for (EntrySpec entry : spec.getGlobal()) {
            String name = normalizeName(entry);
            if (name.isEmpty()) {
                LOG.debug("Skipping env entry without a usable name: {}", entry);
                continue;
            }
            resolved.put(name, resolveValue(current, entry, name));
        }

        LOG.info("Resolved {} env value(s)", resolved.size());
        return new ResolvedConfig(resolved);
    }

    /**
     * Resolve an untyped spec document, such as a parsed YAML or JSON tree.
     *
     * @param document map with a {@code global} list of entry maps
     * @return newly allocated resolved configuration
     * @throws EnvConfigException if the document is malformed or any entry
     *                            fails validation
     * @see EnvSpecLoader#fromObject(Object)
     */
    public ResolvedConfig load(Object document) {
        if (document instanceof EnvSpec spec) {
            return load(spec);
        }
        return load(EnvSpecLoader.fromObject(document));
    }

    /**
     * Same as {@link #load(EnvSpec)} but reports validation failures as a
     * value instead of throwing.
     *
     * @param spec the declarations
     * @return success with the config, or failure with the first error
     */
    public LoadResult tryLoad(EnvSpec spec) {
        try {
            return LoadResult.success(load(spec));
        } catch (EnvConfigException e) {
            LOG.debug("Env load failed: {}", e.getMessage());
            return LoadResult.failure(e);
        }
    }

    /**
     * Untyped-document variant of {@link #tryLoad(EnvSpec)}.
     *
     * @param document map with a {@code global} list of entry maps
     * @return success with the config, or failure with the first error
     */
    public LoadResult tryLoad(Object document) {
        try {
            return LoadResult.success(load(document));
        } catch (EnvConfigException e) {
            LOG.debug("Env load failed: {}", e.getMessage());
            return LoadResult.failure(e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String normalizeName(EntrySpec entry) {
        if (entry == null || entry.getName() == null) {
            return "";
        }
        return entry.getName().trim();
    }

    private static Object resolveValue(EnvSource current, EntrySpec entry, String name) {
        String raw = current.lookup(name).map(String::trim).orElse("");
        String value = raw.isEmpty() && entry.getDefaultValue() != null
                ? String.valueOf(entry.getDefaultValue()).trim()
                : raw;

        if (entry.isRequired() && value.isEmpty()) {
            throw EnvConfigException.missingRequired(name);
        }
        if (value.isEmpty()) {
            return value;
        }

        return switch (entry.entryType()) {
            case INT -> resolveInt(name, value, entry);
            case ENUM -> resolveEnum(name, value, entry);
            case STRING -> value;
        };
    }

    private static Number resolveInt(String name, String value, EntrySpec entry) {
        BigInteger parsed = parseWholeNumber(value);
        if (parsed == null) {
            throw EnvConfigException.notAnInteger(name);
        }
        BigDecimal exact = new BigDecimal(parsed);
        BigDecimal min = bound(entry.getMin());
        if (min != null && exact.compareTo(min) < 0) {
            throw EnvConfigException.belowMin(name, entry.getMin());
        }
        BigDecimal max = bound(entry.getMax());
        if (max != null && exact.compareTo(max) > 0) {
            throw EnvConfigException.aboveMax(name, entry.getMax());
        }
        return parsed.bitLength() < Long.SIZE ? (Number) parsed.longValue() : parsed;
    }

    private static String resolveEnum(String name, String value, EntrySpec entry) {
        List<String> allowed = entry.getAllowed() != null ? entry.getAllowed() : List.of();
        String wanted = value.toLowerCase(Locale.ROOT);
        // First match wins; duplicates differing only in case are tolerated.
        for (String option : allowed) {
            if (option != null && option.toLowerCase(Locale.ROOT).equals(wanted)) {
                return option;
            }
        }
        throw EnvConfigException.enumMismatch(name,
                allowed.stream().filter(Objects::nonNull).toList());
    }

    /**
     * Parse a trimmed string as a whole number.
     *
     * <p>
     * Accepts signed decimals with an optional fraction and exponent as long
     * as the value is whole ({@code "42"}, {@code "4.2e1"}, {@code "42.0"}),
     * plus unsigned {@code 0x}, {@code 0o} and {@code 0b} literals. There is
     * no fixed width; only magnitudes beyond the finite double range are
     * rejected.
     * </p>
     *
     * @return the value, or {@code null} if it is not a finite whole number
     */
    static BigInteger parseWholeNumber(String value) {
        try {
            BigDecimal decimal;
            if (RADIX_PREFIXED.matcher(value).matches()) {
                int radix = switch (Character.toLowerCase(value.charAt(1))) {
                    case 'x' -> 16;
                    case 'o' -> 8;
                    default -> 2;
                };
                decimal = new BigDecimal(new BigInteger(value.substring(2), radix));
            } else if (DECIMAL.matcher(value).matches()) {
                decimal = new BigDecimal(value).stripTrailingZeros();
            } else {
                return null;
            }
            // checked before any exact conversion so "1e999999999" stays cheap
            if (decimal.precision() - decimal.scale() > 310
                    || decimal.abs().compareTo(LARGEST_FINITE) > 0
                    || decimal.scale() > 0) {
                return null;
            }
            return decimal.toBigIntegerExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    /**
     * @return the bound as an exact decimal, or {@code null} when absent or
     *         not finite
     */
    private static BigDecimal bound(Number declared) {
        if (declared == null) {
            return null;
        }
        if (declared instanceof BigDecimal d) {
            return d;
        }
        if (declared instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (declared instanceof Long || declared instanceof Integer
                || declared instanceof Short || declared instanceof Byte) {
            return BigDecimal.valueOf(declared.longValue());
        }
        double d = declared.doubleValue();
        return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
    }
}
