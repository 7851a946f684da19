package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.Points;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.Header;
import com.questrail.dxf.model.HeaderValue;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupCodes;
import com.questrail.dxf.scan.GroupScanner;
import com.questrail.dxf.scan.GroupValueType;

import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * The {@code HEADER} section: {@code 9/$NAME} followed by the variable's value,
 * either a single group or a point ({@code N}, {@code N+10}, optional
 * {@code N+20}).
 */
public final class HeaderSectionCodec implements SectionCodec
{
    public static final String NAME = "HEADER";

    private static final int VARIABLE_NAME = 9;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isPresent(DxfDocument document) {
        return document.getHeader().isPresent();
    }

    @Override
    public int read(ParseContext context, DxfDocument document) {
        Header header = new Header();
        document.setHeader(header);
        GroupScanner scanner = context.scanner();
        Group group = scanner.next();
        while (!group.isMarker(Group.END_SECTION)) {
            if (group.isEof()) {
                SectionBodies.unterminated(context, NAME);
                break;
            }
            if (group.code() != VARIABLE_NAME) {
                context.unhandled(NAME, group);
                group = scanner.next();
                continue;
            }
            String name = group.text();
            group = scanner.next();
            if (group.code() == VARIABLE_NAME || group.startsRecord()) {
                context.warn(DxfWarningEvent.Kind.STRAY_GROUP, NAME, "Header variable " + name + " has no value");
                continue;
            }
            header.put(name, readValue(scanner, group));
            group = scanner.next();
        }
        return header.size();
    }

    private static HeaderValue readValue(GroupScanner scanner, Group first) {
        int code = first.code();
        if (GroupCodes.typeOf(code) == GroupValueType.FLOAT && scanner.peek().code() == code + 10) {
            return HeaderValue.point(code, Points.read(scanner));
        }
        return HeaderValue.of(first);
    }

    @Override
    public Stream<Consumer<GroupWriter>> records(DxfDocument document) {
        return document.getHeader()
            .map(header -> header.variables().entrySet().stream())
            .orElseGet(Stream::empty)
            .map(HeaderSectionCodec::variableWriter);
    }

    private static Consumer<GroupWriter> variableWriter(Map.Entry<String, HeaderValue> variable) {
        return out -> {
            out.text(VARIABLE_NAME, variable.getKey());
            HeaderValue value = variable.getValue();
            if (value instanceof HeaderValue.PointValue point) {
                out.point(point.code(), point.point());
            }
            else if (value instanceof HeaderValue.Scalar scalar) {
                out.group(scalar.toGroup());
            }
        };
    }
}
