package com.questrail.dxf.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The {@code TABLES} section. Each table is optional; a table that was not read
 * is not written.
 */
public final class Tables
{
    public static final String VIEW_PORTS = "VPORT";
    public static final String LINE_TYPES = "LTYPE";
    public static final String LAYERS = "LAYER";

    private SymbolTable<ViewPort> viewPorts;
    private SymbolTable<LineType> lineTypes;
    private SymbolTable<Layer> layers;

    public Optional<SymbolTable<ViewPort>> getViewPorts() {
        return Optional.ofNullable(viewPorts);
    }

    public void setViewPorts(SymbolTable<ViewPort> viewPorts) {
        this.viewPorts = viewPorts;
    }

    public Optional<SymbolTable<LineType>> getLineTypes() {
        return Optional.ofNullable(lineTypes);
    }

    public void setLineTypes(SymbolTable<LineType> lineTypes) {
        this.lineTypes = lineTypes;
    }

    public Optional<SymbolTable<Layer>> getLayers() {
        return Optional.ofNullable(layers);
    }

    public void setLayers(SymbolTable<Layer> layers) {
        this.layers = layers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Tables that
            && Objects.equals(viewPorts, that.viewPorts)
            && Objects.equals(lineTypes, that.lineTypes)
            && Objects.equals(layers, that.layers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(viewPorts, lineTypes, layers);
    }
}
