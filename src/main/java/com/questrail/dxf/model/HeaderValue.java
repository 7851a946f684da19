package com.questrail.dxf.model;

import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupValue;

import java.util.Objects;

/**
 * HeaderValue
 * -----------------------------------------------------------------------------
 * The value of one header variable, together with the group code it was read
 * from. Keeping the code lets any variable be written back, including ones the
 * {@link com.questrail.dxf.config.HeaderVariableCatalog} does not know.
 *
 * <ul>
 *   <li>{@link Scalar}: a single group</li>
 *   <li>{@link PointValue}: a point on {@code code}, {@code code + 10} and
 *       optionally {@code code + 20}</li>
 * </ul>
 */
public sealed interface HeaderValue permits HeaderValue.Scalar, HeaderValue.PointValue
{
    int code();

    static HeaderValue of(Group group) {
        return new Scalar(group.code(), group.value());
    }

    static HeaderValue point(int code, Point point) {
        return new PointValue(code, point);
    }

    record Scalar(int code, GroupValue value) implements HeaderValue
    {
        public Scalar {
            Objects.requireNonNull(value, "value");
        }

        public Group toGroup() {
            return new Group(code, value);
        }
    }

    record PointValue(int code, Point point) implements HeaderValue
    {
        public PointValue {
            Objects.requireNonNull(point, "point");
        }
    }
}
