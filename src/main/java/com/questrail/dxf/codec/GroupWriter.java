package com.questrail.dxf.codec;

import com.questrail.dxf.model.Point;
import com.questrail.dxf.observability.DxfDiagnosticsSink;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupCodes;
import com.questrail.dxf.scan.GroupValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collects the output lines of one record.
 *
 * <p>Every group is rendered as it is written, so a value whose type does not fit
 * its code fails at the record that produced it rather than somewhere in the
 * middle of the output stream.</p>
 */
public final class GroupWriter
{
    private final List<String> lines = new ArrayList<>();
    private final DxfDiagnosticsSink diagnostics;

    public GroupWriter(DxfDiagnosticsSink diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public GroupWriter group(Group group) {
        return write(group.code(), group.value());
    }

    public GroupWriter marker(String token) {
        return write(0, new GroupValue.Text(token));
    }

    public GroupWriter text(int code, String value) {
        return write(code, new GroupValue.Text(value));
    }

    public GroupWriter real(int code, double value) {
        return write(code, new GroupValue.Real(value));
    }

    public GroupWriter integer(int code, long value) {
        return write(code, new GroupValue.Int(value));
    }

    public GroupWriter bool(int code, boolean value) {
        return write(code, new GroupValue.Bool(value));
    }

    public GroupWriter point(int code, Point point) {
        Points.write(this, code, point);
        return this;
    }

    private GroupWriter write(int code, GroupValue value) {
        if (!GroupCodes.isDefined(code)) {
            diagnostics.onWarning(new DxfWarningEvent(DxfWarningEvent.Kind.UNDEFINED_VALUE_TYPE,
                "WRITER", "Group code " + code + " has no defined value type; written as text"));
        }
        String rendered = GroupCodes.render(code, value);
        lines.add(Integer.toString(code));
        lines.add(rendered);
        return this;
    }

    public DxfDiagnosticsSink diagnostics() {
        return diagnostics;
    }

    /** Alternating code and value lines written so far. */
    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }
}
