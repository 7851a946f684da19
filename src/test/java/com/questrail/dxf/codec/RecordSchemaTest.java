package com.questrail.dxf.codec;

import com.questrail.dxf.DxfText;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.entity.Circle;
import com.questrail.dxf.observability.NullDiagnosticsSink;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import com.questrail.dxf.scan.GroupScanner;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RecordSchemaTest
{
    private static final RecordSchema<Circle> SCHEMA = RecordSchema.<Circle>builder()
        .point(10, Circle::getCenter, Circle::setCenter)
        .real(40, Circle::getRadius, Circle::setRadius)
        .real(39, Circle::getThickness, Circle::setThickness)
        .build();

    @Test
    void readsBoundFieldsAndReportsTheRest() {
        RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
        GroupScanner scanner = GroupScanner.of(
            DxfText.of(10, "1.0", 20, "2.0", 40, "3.5", 999, "note", 0, "EOF"), sink);
        ParseContext context = new ParseContext(scanner, sink, EntityCodecRegistry.empty());

        Circle circle = context.readFields("CIRCLE", new Circle(), SCHEMA);

        assertEquals(Point.of(1.0, 2.0), circle.getCenter());
        assertEquals(3.5, circle.getRadius());
        assertNull(circle.getThickness());
        assertEquals(1, sink.getUnhandledGroups().size());
        assertEquals(999, sink.getUnhandledGroups().get(0).group().code());
        assertTrue(scanner.lastRead().isEof());
    }

    @Test
    void writesPresentFieldsInDeclarationOrder() {
        Circle circle = new Circle();
        circle.setRadius(2.0);
        circle.setCenter(Point.of(0.0, 0.0));
        GroupWriter out = new GroupWriter(NullDiagnosticsSink.INSTANCE);

        SCHEMA.write(circle, out);

        assertEquals(DxfText.lines(10, "0.0", 20, "0.0", 40, "2.0"), out.lines());
    }

    @Test
    void bindingACodeTwiceIsRejected() {
        RecordSchema.Builder<Circle> builder = RecordSchema.<Circle>builder()
            .real(40, Circle::getRadius, Circle::setRadius);

        assertThrows(IllegalStateException.class,
            () -> builder.real(40, Circle::getThickness, Circle::setThickness));
    }

    @Test
    void bindingACodeToAFieldOfTheWrongTypeIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> RecordSchema.<Circle>builder().real(70, Circle::getRadius, Circle::setRadius));
        assertThrows(IllegalArgumentException.class,
            () -> RecordSchema.<Circle>builder().text(40, Circle::getLayer, Circle::setLayer));
    }

    @Test
    void invertedFlagReadsZeroAsTrue() {
        RecordSchema<Circle> schema = RecordSchema.<Circle>builder()
            .invertedFlag(60, Circle::getVisible, Circle::setVisible)
            .build();
        GroupScanner scanner = GroupScanner.of(DxfText.of(60, "1", 0, "EOF"), NullDiagnosticsSink.INSTANCE);
        ParseContext context = new ParseContext(scanner, NullDiagnosticsSink.INSTANCE, EntityCodecRegistry.empty());

        Circle hidden = context.readFields("CIRCLE", new Circle(), schema);
        Circle visible = new Circle();
        visible.setVisible(true);
        GroupWriter out = new GroupWriter(NullDiagnosticsSink.INSTANCE);
        schema.write(visible, out);

        assertFalse(hidden.getVisible());
        assertEquals(DxfText.lines(60, "0"), out.lines());
    }
}
