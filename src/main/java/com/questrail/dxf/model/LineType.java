package com.questrail.dxf.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An {@code LTYPE} table record: a named dash pattern.
 */
public final class LineType extends TableEntry
{
    public static final String TYPE = "LTYPE";

    private String description;
    private Integer alignment;
    private Integer elementCount;
    private Double patternLength;
    private final List<LineTypeElement> elements = new ArrayList<>();

    @Override
    public String type() {
        return TYPE;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /** Always 65, the letter A (group 72). */
    public Integer getAlignment() {
        return alignment;
    }

    public void setAlignment(Integer alignment) {
        this.alignment = alignment;
    }

    /** Declared element count (group 73). */
    public Integer getElementCount() {
        return elementCount;
    }

    public void setElementCount(Integer elementCount) {
        this.elementCount = elementCount;
    }

    public Double getPatternLength() {
        return patternLength;
    }

    public void setPatternLength(Double patternLength) {
        this.patternLength = patternLength;
    }

    public List<LineTypeElement> getElements() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LineType that
            && entryEquals(that)
            && Objects.equals(description, that.description)
            && Objects.equals(alignment, that.alignment)
            && Objects.equals(elementCount, that.elementCount)
            && Objects.equals(patternLength, that.patternLength)
            && Objects.equals(elements, that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entryHashCode(), description, alignment, elementCount, patternLength, elements);
    }
}
