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
package io.karatelabs.reflect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;

/**
 * A runtime value together with its {@link ValueType} and, when it was reached through a {@link Ref}, the
 * location it lives in. The type never changes; conversions produce new wrappers. Only addressable wrappers
 * can be written to.
 */
public class Value {

    private static final Logger logger = LoggerFactory.getLogger(Value.class);

    /**
     * Recursion limit for nested records and collections. Can be configured via system property
     * "karate.reflect.maxDepth", default is 64.
     */
    public static final int MAX_DEPTH = Integer.getInteger("karate.reflect.maxDepth", 64);

    public static final Value ABSENT = new Value();

    private final Object value;
    private final ValueType type;
    private final Kind kind;
    private final Ref<Object> location;

    private Value() {
        value = null;
        type = null;
        kind = Kind.INVALID;
        location = null;
    }

    Value(Object value, ValueType type, Ref<Object> location) {
        if (!type.isInstance(value)) {
            throw new IllegalStateException("value of " + ValueType.ofValue(value) + " cannot have type " + type);
        }
        this.value = value;
        this.type = type;
        this.kind = type.getKind();
        this.location = location;
    }

    public static Value of(Object value) {
        if (value == null) {
            return ABSENT;
        }
        if (value instanceof Value v) {
            return v;
        }
        return new Value(value, ValueType.ofValue(value), null);
    }

    public static Value of(Object value, ValueType type) {
        if (type == null) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "type is null");
        }
        Object raw = value instanceof Value v ? v.getValue() : value;
        if (!type.isInstance(raw)) {
            throw new ReflectException(ErrorKind.TYPE_MISMATCH, ValueType.ofValue(raw) + " is not a " + type);
        }
        return new Value(raw, type, null);
    }

    public static Value of(Object value, Type type) {
        return of(value, ValueType.of(type));
    }

    public static Value of(Object value, TypeRef<?> typeRef) {
        return of(value, ValueType.of(typeRef));
    }

    /**
     * An addressable wrapper over the content of a location, writes go to the location.
     */
    @SuppressWarnings("unchecked")
    public static Value at(Ref<?> ref) {
        if (ref == null) {
            throw new ReflectException(ErrorKind.NIL_POINTER, "location is null");
        }
        ValueType type = ref.getType();
        Object current = ref.get();
        if (!type.isInstance(current)) {
            throw new ReflectException(ErrorKind.TYPE_MISMATCH, "location of " + type + " holds " + ValueType.ofValue(current));
        }
        return new Value(current, type, (Ref<Object>) ref);
    }

    public static Value zero(ValueType type) {
        return new Value(type.zeroValue(), type, null);
    }

    /**
     * A wrapper over a new cell holding the zero value of the type.
     */
    public static Value newRef(ValueType type) {
        Ref<Object> cell = Refs.cell(type, type.zeroValue());
        return new Value(cell, ValueType.refOf(type), null);
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) (location == null ? value : location.get());
    }

    public ValueType getType() {
        return type;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isValid() {
        return kind != Kind.INVALID;
    }

    public boolean isAddressable() {
        return location != null;
    }

    public boolean isPointer() {
        return kind == Kind.POINTER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isSequence() {
        return kind == Kind.SEQUENCE;
    }

    public boolean isMap() {
        return kind == Kind.MAP;
    }

    public boolean isRecord() {
        return kind == Kind.RECORD;
    }

    public boolean isRecordPointer() {
        return kind == Kind.POINTER && type.getElementType().getKind() == Kind.RECORD;
    }

    public boolean isDynamic() {
        return kind == Kind.DYNAMIC;
    }

    public boolean isChannel() {
        return kind == Kind.CHANNEL;
    }

    public boolean isFunction() {
        return kind == Kind.FUNCTION;
    }

    public boolean isFixedArray() {
        return kind == Kind.FIXED_ARRAY;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isNumeric() {
        return kind.isNumeric();
    }

    public boolean isIterable() {
        return kind.isIterable();
    }

    public int len() {
        Object v = getValue();
        if (v == null) {
            return 0;
        }
        switch (kind) {
            case STRING:
                return ((String) v).length();
            case SEQUENCE:
                return ((List<?>) v).size();
            case FIXED_ARRAY:
                return Array.getLength(v);
            case MAP:
                return ((Map<?, ?>) v).size();
            case CHANNEL:
                return ((BlockingQueue<?>) v).size();
            default:
                return 0;
        }
    }

    public boolean isNil() {
        if (kind == Kind.INVALID) {
            return true;
        }
        return !type.isPrimitive() && getValue() == null;
    }

    public boolean isZero() {
        if (kind == Kind.INVALID) {
            return true;
        }
        return isZero(getValue(), type, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static boolean isZero(Object v, ValueType type, int depth, Set<Object> visiting) {
        if (v == null) {
            return true;
        }
        switch (type.getKind()) {
            case BOOLEAN:
                return !((Boolean) v);
            case INT:
                if (v instanceof BigInteger bi) {
                    return bi.signum() == 0;
                }
                return ((Number) v).longValue() == 0;
            case FLOAT:
                if (v instanceof BigDecimal bd) {
                    return bd.signum() == 0;
                }
                return ((Number) v).doubleValue() == 0;
            case STRING:
                return ((String) v).isEmpty();
            case OTHER:
                if (v instanceof Character c) {
                    return c == '\0';
                }
                if (v instanceof Duration d) {
                    return d.isZero();
                }
                return false;
            case RECORD:
                if (depth > MAX_DEPTH || !visiting.add(v)) {
                    return false;
                }
                try {
                    for (Field field : type.getFields()) {
                        ValueType fieldType = ValueType.of(field.getGenericType());
                        if (!isZero(Refs.read(field, v), fieldType, depth + 1, visiting)) {
                            return false;
                        }
                    }
                    return true;
                } finally {
                    visiting.remove(v);
                }
            default:
                return false;
        }
    }

    /**
     * Zero, or a pointer or dynamic slot whose content is deep-zero.
     */
    public boolean isDeepZero() {
        return isDeepZero(0);
    }

    private boolean isDeepZero(int depth) {
        if (isZero()) {
            return true;
        }
        if ((kind == Kind.POINTER || kind == Kind.DYNAMIC) && depth < MAX_DEPTH) {
            return dereference().isDeepZero(depth + 1);
        }
        return false;
    }

    public boolean isEmpty() {
        if (isZero()) {
            return true;
        }
        switch (kind) {
            case SEQUENCE:
            case FIXED_ARRAY:
            case MAP:
            case CHANNEL:
                return len() < 1;
            default:
                return false;
        }
    }

    /**
     * For a pointer, the addressable content. For a dynamic slot, the content typed by its runtime class.
     * Otherwise, or when nil, {@link #ABSENT}.
     */
    public Value dereference() {
        Object v = getValue();
        if (v == null) {
            return ABSENT;
        }
        if (kind == Kind.POINTER) {
            return at((Ref<?>) v);
        }
        if (kind == Kind.DYNAMIC) {
            return of(v);
        }
        return ABSENT;
    }

    public Value address() {
        if (location == null) {
            return ABSENT;
        }
        return new Value(location, ValueType.refOf(type), null);
    }

    public boolean deepEquals(Object other) {
        Object b = other instanceof Value v ? v.getValue() : other;
        return deepEquals(getValue(), b, 0);
    }

    static boolean deepEquals(Object a, Object b, int depth) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || depth > MAX_DEPTH) {
            return false;
        }
        if (a instanceof Ref<?> ra && b instanceof Ref<?> rb) {
            return deepEquals(ra.get(), rb.get(), depth + 1);
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) {
                return false;
            }
            Iterator<?> ia = la.iterator();
            Iterator<?> ib = lb.iterator();
            while (ia.hasNext()) {
                if (!deepEquals(ia.next(), ib.next(), depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : ma.entrySet()) {
                if (!mb.containsKey(entry.getKey()) || !deepEquals(entry.getValue(), mb.get(entry.getKey()), depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        if (a.getClass() != b.getClass()) {
            return false;
        }
        if (a.getClass().isArray()) {
            int length = Array.getLength(a);
            if (length != Array.getLength(b)) {
                return false;
            }
            for (int i = 0; i < length; i++) {
                if (!deepEquals(Array.get(a, i), Array.get(b, i), depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        ValueType type = ValueType.ofValue(a);
        if (type.getKind() == Kind.RECORD && !type.declaresEquals()) {
            for (Field field : type.getFields()) {
                if (!deepEquals(Refs.read(field, a), Refs.read(field, b), depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    public void set(Object newValue) {
        set(newValue, false);
    }

    /**
     * Writes through to the location of this value, converting the new value to this type first when allowed.
     */
    public void set(Object newValue, boolean convert) {
        if (location == null) {
            throw new ReflectException(ErrorKind.UNSETTABLE, "value of " + type + " is not addressable");
        }
        Value source = of(newValue);
        if (!source.isValid()) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "cannot set an absent value");
        }
        Object raw = source.getValue();
        if (!type.isInstance(raw)) {
            if (!convert) {
                throw new ReflectException(ErrorKind.TYPE_MISMATCH, "cannot set " + source.type + " to " + type);
            }
            raw = Conversion.convert(source, type).getValue();
        }
        write(location, raw);
    }

    private static void write(Ref<Object> location, Object raw) {
        try {
            location.set(raw);
        } catch (ReflectException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("location rejected write: {}", e.toString());
            throw new ReflectException(ErrorKind.UNSETTABLE, e.toString(), e);
        }
    }

    public void setMapKey(Object key, Object value) {
        setMapKey(key, value, false);
    }

    /**
     * Puts an entry into the map this value holds (or points to), the key and value converted to the map's key
     * and value types when allowed.
     */
    public void setMapKey(Object key, Object value, boolean convert) {
        Value target = kind == Kind.POINTER ? dereference() : this;
        if (target.kind != Kind.MAP) {
            throw new ReflectException(ErrorKind.NOT_A_MAP, "cannot put entry into " + (target.isValid() ? target.type : "absent value"));
        }
        Map<Object, Object> map = target.getValue();
        if (map == null) {
            throw new ReflectException(ErrorKind.NIL_POINTER, "map of " + target.type + " is null");
        }
        Object k = coerce(key, target.type.getKeyType(), convert, "key");
        Object v = coerce(value, target.type.getElementType(), convert, "value");
        write(Refs.mapEntry(map, k, target.type.getElementType()), v);
    }

    public void setMapEntry(String key, Object value) {
        setMapKey(key, value, false);
    }

    public void setMapEntry(String key, Object value, boolean convert) {
        setMapKey(key, value, convert);
    }

    private static Object coerce(Object raw, ValueType type, boolean convert, String what) {
        Value source = of(raw);
        if (!source.isValid()) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "map " + what + " is absent");
        }
        if (type.isInstance(source.getValue())) {
            return source.getValue();
        }
        if (!convert) {
            throw new ReflectException(ErrorKind.TYPE_MISMATCH, "map " + what + " of " + source.type + " is not a " + type);
        }
        return Conversion.convert(source, type).getValue();
    }

    public Value convertToType(ValueType target) {
        return Conversion.convert(this, target);
    }

    public Value convertToType(Type target) {
        return Conversion.convert(this, ValueType.of(target));
    }

    public Value convertTo(TypeRef<?> target) {
        return Conversion.convert(this, ValueType.of(target));
    }

    /**
     * Converts to the type of the sample, which must be a non-null raw value or a valid wrapper.
     */
    public Value convertTo(Object sample) {
        Value target = of(sample);
        if (!target.isValid()) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "conversion target is absent");
        }
        return Conversion.convert(this, target.type);
    }

    @SuppressWarnings("unchecked")
    public <T> T as(Class<T> target) {
        return (T) Conversion.convert(this, ValueType.of(target)).getValue();
    }

    public boolean compareTo(Object other, String operator) {
        return Comparison.compare(this, other, operator).pass();
    }

    public ComparisonResult compare(Object other, String operator) {
        return Comparison.compare(this, other, operator);
    }

    @Override
    public String toString() {
        if (kind == Kind.INVALID) {
            return "[type: invalid]";
        }
        return "[type: " + type + ", value: " + TextFormat.toText(getValue()) + "]";
    }

}
