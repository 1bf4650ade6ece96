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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factories for the {@link Ref} implementations: mutable cells and slot views.
 * Slot views are equal when they point at the same slot of the same container instance.
 */
public final class Refs {

    private Refs() {
        // only static methods
    }

    public static <T> Ref<T> cell(ValueType type, T value) {
        if (type == null) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "type is null");
        }
        if (!type.isInstance(value)) {
            throw new ReflectException(ErrorKind.TYPE_MISMATCH, "cannot store " + ValueType.ofValue(value) + " in " + type);
        }
        return new Cell<>(type, value);
    }

    public static Ref<Object> field(Object target, Field field) {
        if (target == null) {
            throw new ReflectException(ErrorKind.NIL_POINTER, "field " + field.getName() + " of null");
        }
        return new FieldRef(target, field);
    }

    public static Ref<Object> listElement(List<Object> list, int index, ValueType elementType) {
        return new ListElementRef(list, index, elementType);
    }

    public static Ref<Object> arrayElement(Object array, int index) {
        return new ArrayElementRef(array, index);
    }

    public static Ref<Object> mapEntry(Map<Object, Object> map, Object key, ValueType valueType) {
        return new MapEntryRef(map, key, valueType);
    }

    static Object read(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "cannot read field " + field.getName(), e);
        }
    }

    static class Cell<T> implements Ref<T> {

        private final ValueType type;
        private T value;

        Cell(ValueType type, T value) {
            this.type = type;
            this.value = value;
        }

        @Override
        public T get() {
            return value;
        }

        @Override
        public void set(T value) {
            this.value = value;
        }

        @Override
        public ValueType getType() {
            return type;
        }

        @Override
        public String toString() {
            return "&" + value;
        }

    }

    static class FieldRef implements Ref<Object> {

        private final Object target;
        private final Field field;
        private final ValueType type;

        FieldRef(Object target, Field field) {
            this.target = target;
            this.field = field;
            this.type = ValueType.of(field.getGenericType());
        }

        @Override
        public Object get() {
            return read(field, target);
        }

        @Override
        public void set(Object value) {
            if (Modifier.isFinal(field.getModifiers())) {
                throw new ReflectException(ErrorKind.UNSETTABLE, "field " + field.getName() + " is final");
            }
            try {
                field.set(target, value);
            } catch (IllegalAccessException e) {
                throw new ReflectException(ErrorKind.UNSETTABLE, "field " + field.getName() + " is not accessible", e);
            }
        }

        @Override
        public ValueType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (o instanceof FieldRef other) {
                return target == other.target && field.equals(other.field);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(target) * 31 + field.hashCode();
        }

        @Override
        public String toString() {
            return "&" + target.getClass().getSimpleName() + "." + field.getName();
        }

    }

    static class ListElementRef implements Ref<Object> {

        private final List<Object> list;
        private final int index;
        private final ValueType type;

        ListElementRef(List<Object> list, int index, ValueType type) {
            this.list = list;
            this.index = index;
            this.type = type;
        }

        @Override
        public Object get() {
            return list.get(index);
        }

        @Override
        public void set(Object value) {
            list.set(index, value);
        }

        @Override
        public ValueType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (o instanceof ListElementRef other) {
                return list == other.list && index == other.index;
            }
            return false;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(list) * 31 + index;
        }

        @Override
        public String toString() {
            return "&[" + index + "]";
        }

    }

    static class ArrayElementRef implements Ref<Object> {

        private final Object array;
        private final int index;
        private final ValueType type;

        ArrayElementRef(Object array, int index) {
            this.array = array;
            this.index = index;
            this.type = ValueType.of(array.getClass().getComponentType());
        }

        @Override
        public Object get() {
            return Array.get(array, index);
        }

        @Override
        public void set(Object value) {
            Array.set(array, index, value);
        }

        @Override
        public ValueType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (o instanceof ArrayElementRef other) {
                return array == other.array && index == other.index;
            }
            return false;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(array) * 31 + index;
        }

        @Override
        public String toString() {
            return "&[" + index + "]";
        }

    }

    static class MapEntryRef implements Ref<Object> {

        private final Map<Object, Object> map;
        private final Object key;
        private final ValueType type;

        MapEntryRef(Map<Object, Object> map, Object key, ValueType type) {
            this.map = map;
            this.key = key;
            this.type = type;
        }

        @Override
        public Object get() {
            return map.get(key);
        }

        @Override
        public void set(Object value) {
            map.put(key, value);
        }

        @Override
        public ValueType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (o instanceof MapEntryRef other) {
                return map == other.map && Objects.equals(key, other.key);
            }
            return false;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(map) * 31 + Objects.hashCode(key);
        }

        @Override
        public String toString() {
            return "&[" + key + "]";
        }

    }

}
