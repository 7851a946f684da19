package com.questrail.dxf.codec;

import com.questrail.dxf.MalformedPointException;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

import java.util.Optional;

/**
 * Point parser and serializer.
 *
 * <p>A point with base code {@code N} is written as {@code N/x}, {@code N+10/y}
 * and, for 3D points only, {@code N+20/z}.</p>
 */
public final class Points
{
    private Points() {}

    /**
     * Reads a point whose x component is the scanner's last read group.
     *
     * <p>The y component must follow immediately. The z component is optional:
     * when the following group does not carry {@code N+20} that one read is undone
     * and the point is 2D. The scanner ends on the last group of the point.</p>
     *
     * @throws MalformedPointException if the group after x is not the y component
     */
    public static Point read(GroupScanner scanner) {
        Group x = scanner.lastRead();
        Group y = scanner.next();
        if (y.code() != x.code() + 10) {
            throw new MalformedPointException(x.code() + 10, y.code());
        }
        Optional<Group> z = scanner.nextIf(code -> code == x.code() + 20);
        return z.isPresent()
            ? Point.of(x.real(), y.real(), z.get().real())
            : Point.of(x.real(), y.real());
    }

    public static void write(GroupWriter out, int code, Point point) {
        out.real(code, point.x());
        out.real(code + 10, point.y());
        if (point.is3d()) {
            out.real(code + 20, point.z());
        }
    }
}
