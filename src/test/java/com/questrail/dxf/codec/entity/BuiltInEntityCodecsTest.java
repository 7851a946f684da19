package com.questrail.dxf.codec.entity;

import com.questrail.dxf.DxfCodec;
import com.questrail.dxf.DxfText;
import com.questrail.dxf.codec.EntityCodec;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.entity.Arc;
import com.questrail.dxf.model.entity.AttributeDefinition;
import com.questrail.dxf.model.entity.Circle;
import com.questrail.dxf.model.entity.Dimension;
import com.questrail.dxf.model.entity.Ellipse;
import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.model.entity.Insert;
import com.questrail.dxf.model.entity.PointEntity;
import com.questrail.dxf.model.entity.Solid;
import com.questrail.dxf.model.entity.Text;
import com.questrail.dxf.model.entity.TextGenerationFlag;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class BuiltInEntityCodecsTest
{
    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final DxfCodec codec = new DxfCodec();

    @Test
    void registersEveryTopLevelKind() {
        Set<String> kinds = BuiltInEntityCodecs.all().stream()
            .map(EntityCodec::kind)
            .collect(Collectors.toSet());

        assertEquals(Set.of("3DFACE", "ARC", "ATTDEF", "CIRCLE", "DIMENSION", "ELLIPSE", "INSERT", "LINE",
            "LWPOLYLINE", "MTEXT", "MULTILEADER", "POINT", "POLYLINE", "SOLID", "SPLINE", "TEXT"), kinds);
    }

    @Test
    void roundTripsTheSimpleKinds() {
        PointEntity point = new PointEntity();
        point.setPosition(Point.of(1.0, 2.0, 3.0));
        point.setThickness(0.5);

        Circle circle = new Circle();
        circle.setCenter(Point.of(0.0, 0.0, 0.0));
        circle.setRadius(12.5);
        circle.setExtrusion(Point.of(0.0, 0.0, -1.0));

        Arc arc = new Arc();
        arc.setCenter(Point.of(5.0, 5.0, 0.0));
        arc.setRadius(2.0);
        arc.setStartAngle(350.0);
        arc.setEndAngle(10.0);

        Ellipse ellipse = new Ellipse();
        ellipse.setCenter(Point.of(0.0, 0.0, 0.0));
        ellipse.setMajorAxisEndPoint(Point.of(4.0, 0.0, 0.0));
        ellipse.setAxisRatio(0.5);
        ellipse.setStartParameter(0.0);
        ellipse.setEndParameter(6.283185307179586);

        Solid solid = new Solid();
        solid.setFirstCorner(Point.of(0.0, 0.0, 0.0));
        solid.setSecondCorner(Point.of(1.0, 0.0, 0.0));
        solid.setThirdCorner(Point.of(0.0, 1.0, 0.0));
        solid.setFourthCorner(Point.of(1.0, 1.0, 0.0));

        Insert insert = new Insert();
        insert.setBlockName("Door");
        insert.setPosition(Point.of(10.0, 0.0, 0.0));
        insert.setXScale(2.0);
        insert.setRotation(90.0);
        insert.setColumnCount(3);
        insert.setColumnSpacing(1.5);

        Text text = new Text();
        text.setText("Room 101  ");
        text.setStartPoint(Point.of(0.0, 0.0, 0.0));
        text.setHeight(0.25);
        text.setGenerationFlags(2);
        text.setHorizontalJustification(1);
        text.setEndPoint(Point.of(1.0, 0.0, 0.0));

        AttributeDefinition attribute = new AttributeDefinition();
        attribute.setTag("ROOM");
        attribute.setPrompt("Room number");
        attribute.setDefaultValue("000");
        attribute.setStartPoint(Point.of(0.0, 0.0, 0.0));
        attribute.setTextHeight(0.2);
        attribute.setAttributeFlags(9);
        attribute.setFieldLength(0);

        Dimension dimension = new Dimension();
        dimension.setBlockName("*D1");
        dimension.setStyleName("Standard");
        dimension.setDefinitionPoint(Point.of(0.0, 1.0, 0.0));
        dimension.setTextMidpoint(Point.of(2.0, 1.2, 0.0));
        dimension.setFirstDefinitionPoint(Point.of(0.0, 0.0, 0.0));
        dimension.setSecondDefinitionPoint(Point.of(4.0, 0.0, 0.0));
        dimension.setDimensionType(32);
        dimension.setActualMeasurement(4.0);
        dimension.setText("<>");

        List<Entity> entities = List.of(point, circle, arc, ellipse, solid, insert, text, attribute, dimension);
        DxfDocument document = new DxfDocument();
        document.setEntities(entities);

        DxfDocument parsed = codec.parse(codec.serializeToString(document), sink);

        assertEquals(entities, parsed.getEntities().orElseThrow());
        assertTrue(sink.getUnhandledGroups().isEmpty());
        assertTrue(sink.getWarnings().isEmpty());
    }

    @Test
    void arcSweepWrapsAroundZero() {
        Arc arc = new Arc();
        arc.setStartAngle(350.0);
        arc.setEndAngle(10.0);

        assertEquals(20.0, arc.angleLength());
        assertNull(new Arc().angleLength());
    }

    @Test
    void attributeDefinitionDefaultsAndFlags() {
        AttributeDefinition attribute = (AttributeDefinition) codec.parse(DxfText.entities(
            0, "ATTDEF",
            10, "0.0", 20, "0.0",
            2, "TAG",
            70, "9",
            71, "4"), sink).getEntities().orElseThrow().get(0);

        assertEquals("STANDARD", attribute.textStyleOrDefault());
        assertEquals(1.0, attribute.scaleOrDefault());
        assertEquals(EnumSet.of(AttributeDefinition.Flag.INVISIBLE, AttributeDefinition.Flag.PRESET),
            attribute.flags());
        assertEquals(EnumSet.of(TextGenerationFlag.UPSIDE_DOWN), attribute.generation());
    }
}
