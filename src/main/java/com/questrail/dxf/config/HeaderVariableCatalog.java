package com.questrail.dxf.config;

import com.questrail.dxf.model.HeaderValue;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupCodes;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Properties;
import java.util.TreeMap;

/**
 * HeaderVariableCatalog
 * -----------------------------------------------------------------------------
 * Header variable name → group code of its value.
 *
 * <p>Parsing does not need the catalog: every variable read from a stream keeps
 * its own code. The catalog is used when a host sets a variable without
 * stating a code, see {@link #valueOf(String, Object)}.</p>
 *
 * <p>{@link #defaults()} carries the AutoCAD header variables, loaded from
 * {@code header-variables.properties} next to this class.</p>
 */
public final class HeaderVariableCatalog
{
    private static final String DEFAULTS_RESOURCE = "header-variables.properties";

    private final Map<String, Integer> codes;

    private HeaderVariableCatalog(Map<String, Integer> codes) {
        this.codes = Collections.unmodifiableMap(new LinkedHashMap<>(codes));
    }

    public static HeaderVariableCatalog defaults() {
        return DefaultsHolder.INSTANCE;
    }

    public static HeaderVariableCatalog empty() {
        return new HeaderVariableCatalog(Map.of());
    }

    public static HeaderVariableCatalog of(Map<String, Integer> codes) {
        Objects.requireNonNull(codes, "codes");
        return new HeaderVariableCatalog(codes);
    }

    /** A copy of this catalog with {@code name} mapped to {@code code}. */
    public HeaderVariableCatalog with(String name, int code) {
        Map<String, Integer> copy = new LinkedHashMap<>(codes);
        copy.put(Objects.requireNonNull(name, "name"), code);
        return new HeaderVariableCatalog(copy);
    }

    public OptionalInt codeOf(String name) {
        Integer code = codes.get(name);
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    public Map<String, Integer> codes() {
        return codes;
    }

    /**
     * Builds the value of variable {@code name} from a plain Java value, typed by
     * the variable's code: a {@link String}, a {@link Number}, a {@link Boolean}
     * or a {@link Point}.
     *
     * @throws IllegalArgumentException if the name is not in the catalog or the
     *                                  value does not suit the variable's code
     */
    public HeaderValue valueOf(String name, Object value) {
        Objects.requireNonNull(value, "value");
        int code = codeOf(name).orElseThrow(
            () -> new IllegalArgumentException("Unknown header variable " + name));
        if (value instanceof Point point) {
            return HeaderValue.point(code, point);
        }
        Group group = switch (GroupCodes.typeOf(code)) {
            case TEXT -> value instanceof String text ? Group.text(code, text) : null;
            case FLOAT -> value instanceof Number number ? Group.real(code, number.doubleValue()) : null;
            case INTEGER -> value instanceof Number number
                ? Group.integer(code, number.longValue())
                : value instanceof Boolean bool ? Group.integer(code, bool ? 1 : 0) : null;
            case BOOLEAN -> value instanceof Boolean bool ? Group.bool(code, bool) : null;
        };
        if (group != null) {
            return HeaderValue.of(group);
        }
        throw new IllegalArgumentException("Header variable " + name + " (group code " + code
            + ") cannot hold a " + value.getClass().getSimpleName());
    }

    private static final class DefaultsHolder
    {
        static final HeaderVariableCatalog INSTANCE = load();

        private static HeaderVariableCatalog load() {
            Properties properties = new Properties();
            try (InputStream in = HeaderVariableCatalog.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
                }
                properties.load(in);
            }
            catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
            }
            Map<String, Integer> codes = new TreeMap<>();
            properties.forEach((name, code) -> codes.put((String) name, Integer.parseInt(((String) code).trim())));
            return new HeaderVariableCatalog(codes);
        }
    }
}
