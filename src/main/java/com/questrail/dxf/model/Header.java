package com.questrail.dxf.model;

import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Header
 * -----------------------------------------------------------------------------
 * The {@code HEADER} section: named variables ({@code $ACADVER},
 * {@code $EXTMIN}, ...) in the order they were read.
 *
 * <h2>Dates</h2>
 * Date variables such as {@code $TDCREATE} are stored as read, as a Julian day
 * number with the time of day in the fraction. {@link #getDateTime(String)}
 * converts them to an {@link Instant}.
 *
 * <p>The typed getters return empty when the variable is absent or holds a
 * value of another type.</p>
 */
public final class Header
{
    /** Julian day number of 1970-01-01T00:00:00Z. */
    private static final double UNIX_EPOCH_JULIAN_DAY = 2440587.5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final Map<String, HeaderValue> variables = new LinkedHashMap<>();

    public Header put(String name, HeaderValue value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        variables.put(name, value);
        return this;
    }

    public Optional<HeaderValue> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public HeaderValue remove(String name) {
        return variables.remove(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public Map<String, HeaderValue> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public int size() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    public Optional<String> getText(String name) {
        return scalar(name)
            .filter(group -> group.value() instanceof GroupValue.Text)
            .map(Group::text);
    }

    public Optional<Double> getReal(String name) {
        return scalar(name)
            .filter(group -> !(group.value() instanceof GroupValue.Text || group.value() instanceof GroupValue.Bool))
            .map(Group::real);
    }

    public Optional<Long> getInteger(String name) {
        return scalar(name)
            .filter(group -> group.value() instanceof GroupValue.Int)
            .map(Group::longValue);
    }

    public Optional<Point> getPoint(String name) {
        return get(name)
            .filter(HeaderValue.PointValue.class::isInstance)
            .map(value -> ((HeaderValue.PointValue) value).point());
    }

    /** A Julian date variable as an instant. */
    public Optional<Instant> getDateTime(String name) {
        return getReal(name).map(Header::julianDayToInstant);
    }

    /** Stores {@code instant} as a Julian date on group code 40. */
    public Header putDateTime(String name, Instant instant) {
        return put(name, HeaderValue.of(Group.real(40, instantToJulianDay(instant))));
    }

    public static Instant julianDayToInstant(double julianDay) {
        return Instant.ofEpochMilli(Math.round((julianDay - UNIX_EPOCH_JULIAN_DAY) * MILLIS_PER_DAY));
    }

    public static double instantToJulianDay(Instant instant) {
        return instant.toEpochMilli() / MILLIS_PER_DAY + UNIX_EPOCH_JULIAN_DAY;
    }

    private Optional<Group> scalar(String name) {
        return get(name)
            .filter(HeaderValue.Scalar.class::isInstance)
            .map(value -> ((HeaderValue.Scalar) value).toGroup());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Header that && variables.equals(that.variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return "Header" + variables;
    }
}
