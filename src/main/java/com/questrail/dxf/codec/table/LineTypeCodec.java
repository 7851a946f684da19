package com.questrail.dxf.codec.table;

import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.LineType;
import com.questrail.dxf.model.LineTypeElement;
import com.questrail.dxf.scan.Group;

import java.util.List;

/**
 * {@code LTYPE} records.
 *
 * <p>The pattern is a run of elements, each opened by its dash length (49)
 * and followed by the element's optional groups. Those groups belong to the
 * element opened last; before the first element they are unhandled.</p>
 */
public final class LineTypeCodec extends AbstractTableEntryCodec<LineType>
{
    private static final int ELEMENT_LENGTH = 49;

    private static final RecordSchema<LineType> SCHEMA = RecordSchema.<LineType>builder()
        .text(3, LineType::getDescription, LineType::setDescription)
        .integer(72, LineType::getAlignment, LineType::setAlignment)
        .integer(73, LineType::getElementCount, LineType::setElementCount)
        .real(40, LineType::getPatternLength, LineType::setPatternLength)
        .build();

    private static final RecordSchema<LineTypeElement> ELEMENT = RecordSchema.<LineTypeElement>builder()
        .real(ELEMENT_LENGTH, LineTypeElement::getLength, LineTypeElement::setLength)
        .integer(74, LineTypeElement::getElementType, LineTypeElement::setElementType)
        .integer(75, LineTypeElement::getShapeNumber, LineTypeElement::setShapeNumber)
        .text(340, LineTypeElement::getStyleHandle, LineTypeElement::setStyleHandle)
        .real(46, LineTypeElement::getScale, LineTypeElement::setScale)
        .real(50, LineTypeElement::getRotation, LineTypeElement::setRotation)
        .real(44, LineTypeElement::getXOffset, LineTypeElement::setXOffset)
        .real(45, LineTypeElement::getYOffset, LineTypeElement::setYOffset)
        .text(9, LineTypeElement::getText, LineTypeElement::setText)
        .build();

    public LineTypeCodec() {
        super(LineType.TYPE);
    }

    @Override
    protected LineType newEntry() {
        return new LineType();
    }

    @Override
    protected RecordSchema<LineType> schema() {
        return SCHEMA;
    }

    @Override
    protected boolean readSpecial(LineType lineType, Group group, ParseContext context) {
        List<LineTypeElement> elements = lineType.getElements();
        if (group.code() == ELEMENT_LENGTH) {
            elements.add(new LineTypeElement());
        }
        else if (elements.isEmpty()) {
            return false;
        }
        return ELEMENT.handle(elements.get(elements.size() - 1), group, context);
    }

    @Override
    protected void afterRead(LineType lineType, ParseContext context) {
        context.checkCount(LineType.TYPE, "pattern elements", lineType.getElementCount(),
            lineType.getElements().size());
    }

    @Override
    protected void writeSpecial(LineType lineType, GroupWriter out) {
        for (LineTypeElement element : lineType.getElements()) {
            ELEMENT.write(element, out);
        }
    }
}
