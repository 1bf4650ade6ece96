/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.karatelabs.reflect.view;

import io.karatelabs.reflect.ErrorKind;
import io.karatelabs.reflect.Ref;
import io.karatelabs.reflect.ReflectException;
import io.karatelabs.reflect.Refs;
import io.karatelabs.reflect.Value;
import io.karatelabs.reflect.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field-level access to a record-like value: a POJO or a java record, given directly or through a {@link Ref}.
 * Field wrappers are addressable, so writes go straight into the underlying instance.
 */
public class StructView {

    private static final Logger logger = LoggerFactory.getLogger(StructView.class);

    private final Value value;

    private StructView(Value value) {
        this.value = value;
    }

    public static StructView of(Object o) {
        Value v = Value.of(o);
        if (v.isPointer() || (v.isDynamic() && !v.isNil())) {
            if (v.isNil()) {
                throw new ReflectException(ErrorKind.NIL_POINTER, "ref to " + v.getType().getElementType() + " is null");
            }
            Value target = v.dereference();
            if (v.isPointer() && target.isRecord() && target.isNil()) {
                throw new ReflectException(ErrorKind.NIL_POINTER, "ref to " + target.getType() + " holds null");
            }
            v = target;
        }
        if (!v.isRecord()) {
            throw new ReflectException(ErrorKind.NOT_A_RECORD, v.isValid() ? v.getType().toString() : "absent value");
        }
        if (v.isNil()) {
            throw new ReflectException(ErrorKind.NIL_POINTER, v.getType() + " is null");
        }
        return new StructView(v);
    }

    public static StructView mustOf(Object o) {
        try {
            return of(o);
        } catch (ReflectException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    public <T> T getValue() {
        return value.getValue();
    }

    public ValueType getType() {
        return value.getType();
    }

    public Value asValue() {
        return value;
    }

    /**
     * A view over a fresh instance of the same type.
     */
    public StructView newInstance() {
        return new StructView(Value.of(instantiate(getType())));
    }

    public Value field(String name) {
        Field field = getType().getField(name);
        if (field == null) {
            return Value.ABSENT;
        }
        return Value.at(Refs.field(value.getValue(), field));
    }

    public Map<String, Value> fields() {
        Map<String, Value> map = new LinkedHashMap<>();
        Object target = value.getValue();
        for (Field field : getType().getFields()) {
            map.put(field.getName(), Value.at(Refs.field(target, field)));
        }
        return map;
    }

    public boolean hasField(String name) {
        return getType().getField(name) != null;
    }

    public <T> T fieldValue(String name) {
        Value field = field(name);
        if (!field.isValid()) {
            throw new ReflectException(ErrorKind.UNKNOWN_FIELD, name);
        }
        return field.getValue();
    }

    public <T> T fieldValueOrNull(String name) {
        Value field = field(name);
        return field.isValid() ? field.getValue() : null;
    }

    public void setField(String name, Object newValue) {
        setField(name, newValue, false);
    }

    public void setField(String name, Object newValue, boolean convert) {
        Value field = field(name);
        if (!field.isValid()) {
            throw new ReflectException(ErrorKind.UNKNOWN_FIELD, name);
        }
        field.set(newValue, convert);
    }

    /**
     * Nested non-zero records become nested maps. Zero fields are dropped when {@code omitZero} is set and
     * stored as null otherwise, empty fields are dropped when {@code omitEmpty} is set.
     */
    public Map<String, Object> toMap(boolean omitZero, boolean omitEmpty) {
        return toMap(omitZero, omitEmpty, 0);
    }

    private Map<String, Object> toMap(boolean omitZero, boolean omitEmpty, int depth) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : fields().entrySet()) {
            String name = entry.getKey();
            Value field = entry.getValue();
            Value nested = field.isRecordPointer() ? field.dereference() : field;
            if (nested.isRecord() && !nested.isZero() && depth < Value.MAX_DEPTH) {
                map.put(name, new StructView(nested).toMap(omitZero, omitEmpty, depth + 1));
                continue;
            }
            if (omitEmpty && field.isEmpty()) {
                continue;
            }
            if (field.isZero()) {
                if (!omitZero) {
                    map.put(name, null);
                }
                continue;
            }
            map.put(name, field.getValue());
        }
        return map;
    }

    public void fromMap(Map<String, ?> data) {
        fromMap(data, false);
    }

    /**
     * Sets fields from the map entries. Unknown keys and zero values are skipped, a nested map is applied to a
     * record-typed field, creating the nested instance when needed.
     */
    @SuppressWarnings("unchecked")
    public void fromMap(Map<String, ?> data, boolean convert) {
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            Value field = field(key);
            if (!field.isValid()) {
                logger.trace("skipping unknown field {} of {}", key, getType());
                continue;
            }
            Value raw = Value.of(entry.getValue());
            if (!raw.isValid() || raw.isZero()) {
                logger.trace("skipping zero value for field {} of {}", key, getType());
                continue;
            }
            try {
                if (raw.isMap() && (field.isRecord() || field.isRecordPointer())) {
                    nested(field).fromMap((Map<String, ?>) raw.getValue(), convert);
                } else {
                    field.set(raw, convert);
                }
            } catch (ReflectException e) {
                throw e.withPrefix("field " + key + ": ");
            }
        }
    }

    private static StructView nested(Value field) {
        if (field.isRecord()) {
            if (field.isNil()) {
                field.set(instantiate(field.getType()));
            }
            return of(field.getValue());
        }
        Ref<Object> ref = field.getValue();
        ValueType pointee = field.getType().getElementType();
        if (ref == null) {
            ref = Ref.of(pointee, instantiate(pointee));
            field.set(ref);
        } else if (ref.get() == null) {
            ref.set(instantiate(pointee));
        }
        return of(ref);
    }

    static Object instantiate(ValueType type) {
        Class<?> c = type.getRawClass();
        try {
            if (c.isRecord()) {
                RecordComponent[] components = c.getRecordComponents();
                Class<?>[] types = new Class<?>[components.length];
                Object[] args = new Object[components.length];
                for (int i = 0; i < components.length; i++) {
                    types[i] = components[i].getType();
                    args[i] = ValueType.of(types[i]).zeroValue();
                }
                Constructor<?> constructor = c.getDeclaredConstructor(types);
                constructor.trySetAccessible();
                return constructor.newInstance(args);
            }
            Constructor<?> constructor = c.getDeclaredConstructor();
            constructor.trySetAccessible();
            return constructor.newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ReflectException(ErrorKind.UNCONVERTIBLE, "cannot create " + type, e);
        }
    }

    @Override
    public String toString() {
        return value.toString();
    }

}
