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
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * Type descriptor of a {@link Value}: the java type plus its {@link Kind} and, for composite kinds, the element
 * and key types. Equality is the equality of the underlying {@link Type}.
 */
public class ValueType {

    private static final Logger logger = LoggerFactory.getLogger(ValueType.class);

    /**
     * Whether non-public record fields are made accessible. Can be configured via system property
     * "karate.reflect.accessPrivate", default is true.
     */
    public static final boolean ACCESS_PRIVATE = Boolean.parseBoolean(
            System.getProperty("karate.reflect.accessPrivate", "true"));

    public static final ValueType OBJECT = new ValueType(Object.class);
    public static final ValueType STRING = new ValueType(String.class);
    public static final ValueType BOOLEAN = new ValueType(Boolean.class);
    public static final ValueType INTEGER = new ValueType(Integer.class);
    public static final ValueType LONG = new ValueType(Long.class);
    public static final ValueType DOUBLE = new ValueType(Double.class);
    public static final ValueType TIMESTAMP = new ValueType(OffsetDateTime.class);

    private final Type type;
    private final Class<?> rawClass;
    private final Kind kind;

    private ValueType(Type type) {
        this.type = canonicalize(type);
        this.rawClass = raw(this.type);
        this.kind = Kind.of(rawClass);
    }

    public static ValueType of(Type type) {
        if (type == null) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "type is null");
        }
        return new ValueType(type);
    }

    public static ValueType of(TypeRef<?> typeRef) {
        return new ValueType(typeRef.getType());
    }

    /**
     * The descriptor for a raw value: lists, maps and queues are typed by their interface with {@code Object}
     * elements, a {@link Ref} by its declared pointee type, anything else by its runtime class.
     */
    public static ValueType ofValue(Object value) {
        if (value == null) {
            return OBJECT;
        }
        if (value instanceof Ref<?> ref) {
            return refOf(ref.getType());
        }
        if (value instanceof List) {
            return new ValueType(List.class);
        }
        if (value instanceof Map) {
            return new ValueType(Map.class);
        }
        if (value instanceof BlockingQueue) {
            return new ValueType(BlockingQueue.class);
        }
        return new ValueType(value.getClass());
    }

    public static ValueType listOf(ValueType elementType) {
        return new ValueType(new Parameterized(List.class, elementType.type));
    }

    public static ValueType listOf(Class<?> elementType) {
        return listOf(of(box(elementType)));
    }

    public static ValueType mapOf(ValueType keyType, ValueType valueType) {
        return new ValueType(new Parameterized(Map.class, keyType.type, valueType.type));
    }

    public static ValueType refOf(ValueType pointeeType) {
        Type pointee = pointeeType.rawClass.isPrimitive() ? box(pointeeType.rawClass) : pointeeType.type;
        return new ValueType(new Parameterized(Ref.class, pointee));
    }

    public static ValueType refOf(Class<?> pointeeType) {
        return refOf(of(pointeeType));
    }

    public static ValueType arrayOf(ValueType componentType) {
        return new ValueType(Array.newInstance(componentType.rawClass, 0).getClass());
    }

    public Type getType() {
        return type;
    }

    public Class<?> getRawClass() {
        return rawClass;
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return type.getTypeName();
    }

    public boolean isPrimitive() {
        return rawClass.isPrimitive();
    }

    public boolean isNumeric() {
        return kind.isNumeric();
    }

    /**
     * The class values of this type are instances of, primitives mapped to their wrapper.
     */
    public Class<?> getBoxedClass() {
        return box(rawClass);
    }

    public boolean isInstance(Object value) {
        if (value == null) {
            return !rawClass.isPrimitive();
        }
        return getBoxedClass().isInstance(value);
    }

    /**
     * Element type of sequences, arrays and queues, value type of maps, pointee type of refs, or null.
     */
    public ValueType getElementType() {
        switch (kind) {
            case FIXED_ARRAY:
                if (type instanceof GenericArrayType gat) {
                    return new ValueType(gat.getGenericComponentType());
                }
                return new ValueType(rawClass.getComponentType());
            case SEQUENCE:
            case CHANNEL:
            case POINTER:
                return new ValueType(typeArgument(0));
            case MAP:
                return new ValueType(typeArgument(1));
            default:
                return null;
        }
    }

    /**
     * Key type of maps, or null.
     */
    public ValueType getKeyType() {
        return kind == Kind.MAP ? new ValueType(typeArgument(0)) : null;
    }

    public boolean isTimestamp() {
        return rawClass == OffsetDateTime.class || rawClass == ZonedDateTime.class || rawClass == Instant.class;
    }

    public boolean isDuration() {
        return rawClass == Duration.class;
    }

    public boolean declaresToString() {
        return declares("toString");
    }

    public boolean declaresEquals() {
        return declares("equals", Object.class);
    }

    private boolean declares(String name, Class<?>... params) {
        try {
            return rawClass.getMethod(name, params).getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException | SecurityException e) {
            return false;
        }
    }

    /**
     * Instance fields of a record type in declaration order, superclass fields first. Static and synthetic
     * fields are skipped, and so are non-public fields unless {@link #ACCESS_PRIVATE} is set and the field can
     * be made accessible.
     */
    public List<Field> getFields() {
        if (kind != Kind.RECORD) {
            return List.of();
        }
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = rawClass; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || field.isSynthetic()) {
                    continue;
                }
                boolean visible = Modifier.isPublic(modifiers) && Modifier.isPublic(c.getModifiers());
                if (!visible) {
                    if (!ACCESS_PRIVATE) {
                        continue;
                    }
                    try {
                        field.setAccessible(true);
                    } catch (RuntimeException e) {
                        logger.warn("cannot access field {}.{}: {}", c.getName(), field.getName(), e.getMessage());
                        continue;
                    }
                }
                fields.add(field);
            }
        }
        return fields;
    }

    public Field getField(String name) {
        for (Field field : getFields()) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    /**
     * The value a slot of this type holds before anything is written to it.
     */
    public Object zeroValue() {
        if (!rawClass.isPrimitive()) {
            return null;
        }
        return Array.get(Array.newInstance(rawClass, 1), 0);
    }

    private Type typeArgument(int index) {
        if (type instanceof ParameterizedType pt) {
            Type[] args = pt.getActualTypeArguments();
            if (index < args.length) {
                return args[index];
            }
        }
        return Object.class;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o instanceof ValueType other) {
            return type.equals(other.type);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return getName();
    }

    static Class<?> box(Class<?> c) {
        if (!c.isPrimitive()) {
            return c;
        }
        if (c == int.class) {
            return Integer.class;
        }
        if (c == long.class) {
            return Long.class;
        }
        if (c == double.class) {
            return Double.class;
        }
        if (c == boolean.class) {
            return Boolean.class;
        }
        if (c == float.class) {
            return Float.class;
        }
        if (c == short.class) {
            return Short.class;
        }
        if (c == byte.class) {
            return Byte.class;
        }
        if (c == char.class) {
            return Character.class;
        }
        return Void.class;
    }

    static Type canonicalize(Type t) {
        if (t instanceof WildcardType w) {
            Type[] uppers = w.getUpperBounds();
            return uppers.length == 0 ? Object.class : canonicalize(uppers[0]);
        }
        if (t instanceof TypeVariable<?> tv) {
            Type[] bounds = tv.getBounds();
            return bounds.length == 0 ? Object.class : canonicalize(bounds[0]);
        }
        return t;
    }

    static Class<?> raw(Type t) {
        if (t instanceof Class<?> c) {
            return c;
        }
        if (t instanceof ParameterizedType pt) {
            return (Class<?>) pt.getRawType();
        }
        if (t instanceof GenericArrayType gat) {
            return Array.newInstance(raw(canonicalize(gat.getGenericComponentType())), 0).getClass();
        }
        throw new ReflectException(ErrorKind.INVALID_VALUE, "unsupported type: " + t);
    }

    /**
     * Parameterized type built at runtime, equal to the one the compiler records for the same declaration.
     */
    static class Parameterized implements ParameterizedType {

        private final Class<?> rawType;
        private final Type[] args;

        Parameterized(Class<?> rawType, Type... args) {
            this.rawType = rawType;
            this.args = args;
        }

        @Override
        public Type[] getActualTypeArguments() {
            return args.clone();
        }

        @Override
        public Type getRawType() {
            return rawType;
        }

        @Override
        public Type getOwnerType() {
            return rawType.getDeclaringClass();
        }

        @Override
        public boolean equals(Object o) {
            if (o instanceof ParameterizedType other) {
                return rawType.equals(other.getRawType())
                        && Objects.equals(getOwnerType(), other.getOwnerType())
                        && Arrays.equals(args, other.getActualTypeArguments());
            }
            return false;
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(args) ^ Objects.hashCode(getOwnerType()) ^ rawType.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(rawType.getName()).append('<');
            for (int i = 0; i < args.length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(args[i].getTypeName());
            }
            return sb.append('>').toString();
        }

    }

}
