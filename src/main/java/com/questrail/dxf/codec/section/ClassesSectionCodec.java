package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.DxfClass;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.observability.DxfWarningEvent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * The {@code CLASSES} section. Classes are keyed by record name; a class
 * without one is dropped.
 */
public final class ClassesSectionCodec implements SectionCodec
{
    public static final String NAME = "CLASSES";
    static final String CLASS = "CLASS";

    private static final RecordSchema<DxfClass> SCHEMA = RecordSchema.<DxfClass>builder()
        .text(1, DxfClass::getRecordName, DxfClass::setRecordName)
        .text(2, DxfClass::getCppClassName, DxfClass::setCppClassName)
        .text(3, DxfClass::getApplicationName, DxfClass::setApplicationName)
        .integer(90, DxfClass::getProxyFlags, DxfClass::setProxyFlags)
        .integer(91, DxfClass::getInstanceCount, DxfClass::setInstanceCount)
        .flag(280, DxfClass::getWasAProxy, DxfClass::setWasAProxy)
        .flag(281, DxfClass::getIsAnEntity, DxfClass::setIsAnEntity)
        .build();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isPresent(DxfDocument document) {
        return document.getClasses().isPresent();
    }

    @Override
    public int read(ParseContext context, DxfDocument document) {
        Map<String, DxfClass> classes = new LinkedHashMap<>();
        document.setClasses(classes);
        SectionBodies.readRecords(context, NAME, CLASS, () -> {
            DxfClass dxfClass = context.readFields(CLASS, new DxfClass(), SCHEMA);
            if (dxfClass.getRecordName() == null) {
                context.warn(DxfWarningEvent.Kind.MISSING_NAME, CLASS,
                    "Class " + dxfClass.getCppClassName() + " has no record name and was dropped");
            }
            else {
                classes.put(dxfClass.getRecordName(), dxfClass);
            }
        });
        return classes.size();
    }

    @Override
    public Stream<Consumer<GroupWriter>> records(DxfDocument document) {
        return document.getClasses()
            .map(classes -> classes.values().stream())
            .orElseGet(Stream::empty)
            .map(ClassesSectionCodec::classWriter);
    }

    private static Consumer<GroupWriter> classWriter(DxfClass dxfClass) {
        return out -> {
            out.marker(CLASS);
            SCHEMA.write(dxfClass, out);
        };
    }
}
