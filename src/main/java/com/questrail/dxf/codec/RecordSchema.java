package com.questrail.dxf.codec;

import com.questrail.dxf.model.Matrix4;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupCodes;
import com.questrail.dxf.scan.GroupValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * RecordSchema
 * =============================================================================
 * Ordered, bidirectional code↔field table of one record kind.
 *
 * <h2>Reading</h2>
 * As a {@link GroupHandler} the schema looks the incoming code up and assigns
 * the typed value to its field. Structural fields (points, matrices, chunked
 * text, repeated values) run the matching structural parser.
 *
 * <h2>Writing</h2>
 * {@link #write(Object, GroupWriter)} walks the fields in declaration order and
 * emits every field that is present. Absent fields ({@code null}, or an empty
 * list) are skipped, so a record that was read without a field is written
 * without it.
 *
 * <h2>Consistency</h2>
 * Each binding declares the value type it expects and the builder checks it
 * against {@link GroupCodes#typeOf(int)}, so a table cannot bind a code to a
 * field of the wrong type. Binding the same code twice is rejected as well.
 */
public final class RecordSchema<R> implements GroupHandler<R>
{
    /**
     * One field of the table: the codes it claims, how to read them, how to write
     * the field back.
     */
    public interface FieldBinding<R>
    {
        int[] codes();

        void read(R record, Group group, ParseContext context);

        void write(R record, GroupWriter out);
    }

    private final List<FieldBinding<R>> bindings;
    private final Map<Integer, FieldBinding<R>> byCode;

    private RecordSchema(List<FieldBinding<R>> bindings, Map<Integer, FieldBinding<R>> byCode) {
        this.bindings = List.copyOf(bindings);
        this.byCode = Map.copyOf(byCode);
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    @Override
    public boolean handle(R record, Group group, ParseContext context) {
        FieldBinding<R> binding = byCode.get(group.code());
        if (binding == null) {
            return false;
        }
        binding.read(record, group, context);
        return true;
    }

    public void write(R record, GroupWriter out) {
        for (FieldBinding<R> binding : bindings) {
            binding.write(record, out);
        }
    }

    public Set<Integer> codes() {
        return Collections.unmodifiableSet(byCode.keySet());
    }

    public static final class Builder<R>
    {
        private final List<FieldBinding<R>> bindings = new ArrayList<>();
        private final Map<Integer, FieldBinding<R>> byCode = new HashMap<>();

        private Builder() {}

        public Builder<R> text(int code, Function<R, String> getter, BiConsumer<R, String> setter) {
            requireType(code, GroupValueType.TEXT);
            return add(scalar(code,
                (record, group) -> setter.accept(record, group.text()),
                (record, out) -> {
                    String value = getter.apply(record);
                    if (value != null) {
                        out.text(code, value);
                    }
                }));
        }

        public Builder<R> real(int code, Function<R, Double> getter, BiConsumer<R, Double> setter) {
            requireType(code, GroupValueType.FLOAT);
            return add(scalar(code,
                (record, group) -> setter.accept(record, group.real()),
                (record, out) -> {
                    Double value = getter.apply(record);
                    if (value != null) {
                        out.real(code, value);
                    }
                }));
        }

        public Builder<R> integer(int code, Function<R, Integer> getter, BiConsumer<R, Integer> setter) {
            requireType(code, GroupValueType.INTEGER);
            return add(scalar(code,
                (record, group) -> setter.accept(record, group.integer()),
                (record, out) -> {
                    Integer value = getter.apply(record);
                    if (value != null) {
                        out.integer(code, value);
                    }
                }));
        }

        /** A field on one of the boolean codes (290-299). */
        public Builder<R> bool(int code, Function<R, Boolean> getter, BiConsumer<R, Boolean> setter) {
            requireType(code, GroupValueType.BOOLEAN);
            return add(scalar(code,
                (record, group) -> setter.accept(record, group.bool()),
                (record, out) -> {
                    Boolean value = getter.apply(record);
                    if (value != null) {
                        out.bool(code, value);
                    }
                }));
        }

        /** A boolean carried on an integer code: any non-zero value is {@code true}. */
        public Builder<R> flag(int code, Function<R, Boolean> getter, BiConsumer<R, Boolean> setter) {
            return integerBoolean(code, false, getter, setter);
        }

        /** A boolean carried on an integer code with inverted sense: {@code 0} is {@code true}. */
        public Builder<R> invertedFlag(int code, Function<R, Boolean> getter, BiConsumer<R, Boolean> setter) {
            return integerBoolean(code, true, getter, setter);
        }

        private Builder<R> integerBoolean(int code, boolean inverted,
                                          Function<R, Boolean> getter, BiConsumer<R, Boolean> setter) {
            requireType(code, GroupValueType.INTEGER);
            return add(scalar(code,
                (record, group) -> setter.accept(record, (group.longValue() == 0) == inverted),
                (record, out) -> {
                    Boolean value = getter.apply(record);
                    if (value != null) {
                        out.integer(code, value != inverted ? 1 : 0);
                    }
                }));
        }

        public Builder<R> point(int code, Function<R, Point> getter, BiConsumer<R, Point> setter) {
            requireType(code, GroupValueType.FLOAT);
            return add(new FieldBinding<>() {
                @Override
                public int[] codes() {
                    return new int[] { code };
                }

                @Override
                public void read(R record, Group group, ParseContext context) {
                    setter.accept(record, Points.read(context.scanner()));
                }

                @Override
                public void write(R record, GroupWriter out) {
                    Point point = getter.apply(record);
                    if (point != null) {
                        out.point(code, point);
                    }
                }
            });
        }

        /** A repeated point: each occurrence is appended to the list. */
        public Builder<R> points(int code, Function<R, List<Point>> list) {
            requireType(code, GroupValueType.FLOAT);
            return add(new FieldBinding<>() {
                @Override
                public int[] codes() {
                    return new int[] { code };
                }

                @Override
                public void read(R record, Group group, ParseContext context) {
                    list.apply(record).add(Points.read(context.scanner()));
                }

                @Override
                public void write(R record, GroupWriter out) {
                    for (Point point : list.apply(record)) {
                        out.point(code, point);
                    }
                }
            });
        }

        /** A repeated float: each occurrence is appended to the list. */
        public Builder<R> reals(int code, Function<R, List<Double>> list) {
            requireType(code, GroupValueType.FLOAT);
            return add(scalar(code,
                (record, group) -> list.apply(record).add(group.real()),
                (record, out) -> list.apply(record).forEach(value -> out.real(code, value))));
        }

        public Builder<R> matrix(int code, Function<R, Matrix4> getter, BiConsumer<R, Matrix4> setter) {
            requireType(code, GroupValueType.FLOAT);
            return add(new FieldBinding<>() {
                @Override
                public int[] codes() {
                    return new int[] { code };
                }

                @Override
                public void read(R record, Group group, ParseContext context) {
                    setter.accept(record, Matrices.read(context.scanner(), code));
                }

                @Override
                public void write(R record, GroupWriter out) {
                    Matrix4 matrix = getter.apply(record);
                    if (matrix != null) {
                        Matrices.write(out, code, matrix);
                    }
                }
            });
        }

        /** Text that may arrive in several chunks on {@code primaryCode} and {@code continuationCode}. */
        public Builder<R> chunkedText(int primaryCode, int continuationCode,
                                      Function<R, String> getter, BiConsumer<R, String> setter) {
            requireType(primaryCode, GroupValueType.TEXT);
            requireType(continuationCode, GroupValueType.TEXT);
            return add(new FieldBinding<>() {
                @Override
                public int[] codes() {
                    return new int[] { primaryCode, continuationCode };
                }

                @Override
                public void read(R record, Group group, ParseContext context) {
                    setter.accept(record, ChunkedText.append(getter.apply(record), group.text()));
                }

                @Override
                public void write(R record, GroupWriter out) {
                    String text = getter.apply(record);
                    if (text != null) {
                        ChunkedText.write(out, primaryCode, continuationCode, text);
                    }
                }
            });
        }

        /** A field with its own read and write procedure. */
        public Builder<R> custom(FieldBinding<R> binding) {
            return add(binding);
        }

        public RecordSchema<R> build() {
            return new RecordSchema<>(bindings, byCode);
        }

        private Builder<R> add(FieldBinding<R> binding) {
            for (int code : binding.codes()) {
                if (byCode.putIfAbsent(code, binding) != null) {
                    throw new IllegalStateException("Group code " + code + " is bound twice");
                }
            }
            bindings.add(binding);
            return this;
        }

        private static void requireType(int code, GroupValueType expected) {
            GroupValueType actual = GroupCodes.typeOf(code);
            if (actual != expected) {
                throw new IllegalArgumentException(
                    "Group code " + code + " carries " + actual + " values, not " + expected);
            }
        }

        private static <R> FieldBinding<R> scalar(int code,
                                                  BiConsumer<R, Group> reader,
                                                  BiConsumer<R, GroupWriter> writer) {
            Objects.requireNonNull(reader, "reader");
            Objects.requireNonNull(writer, "writer");
            return new FieldBinding<>() {
                @Override
                public int[] codes() {
                    return new int[] { code };
                }

                @Override
                public void read(R record, Group group, ParseContext context) {
                    reader.accept(record, group);
                }

                @Override
                public void write(R record, GroupWriter out) {
                    writer.accept(record, out);
                }
            };
        }
    }
}
