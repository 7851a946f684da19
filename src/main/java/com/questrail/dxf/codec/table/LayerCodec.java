package com.questrail.dxf.codec.table;

import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.Layer;

/**
 * {@code LAYER} records.
 */
public final class LayerCodec extends AbstractTableEntryCodec<Layer>
{
    private static final RecordSchema<Layer> SCHEMA = RecordSchema.<Layer>builder()
        .integer(62, Layer::getColorIndex, Layer::setColorIndex)
        .integer(420, Layer::getTrueColor, Layer::setTrueColor)
        .text(6, Layer::getLineType, Layer::setLineType)
        .bool(290, Layer::getPlot, Layer::setPlot)
        .integer(370, Layer::getLineweight, Layer::setLineweight)
        .text(390, Layer::getPlotStyleHandle, Layer::setPlotStyleHandle)
        .text(347, Layer::getMaterialHandle, Layer::setMaterialHandle)
        .text(348, Layer::getVisualStyleHandle, Layer::setVisualStyleHandle)
        .build();

    public LayerCodec() {
        super(Layer.TYPE);
    }

    @Override
    protected Layer newEntry() {
        return new Layer();
    }

    @Override
    protected RecordSchema<Layer> schema() {
        return SCHEMA;
    }
}
