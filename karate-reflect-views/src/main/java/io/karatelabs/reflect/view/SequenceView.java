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

import io.karatelabs.reflect.Conversion;
import io.karatelabs.reflect.ErrorKind;
import io.karatelabs.reflect.Kind;
import io.karatelabs.reflect.Ref;
import io.karatelabs.reflect.ReflectException;
import io.karatelabs.reflect.Refs;
import io.karatelabs.reflect.Value;
import io.karatelabs.reflect.ValueType;

import java.lang.reflect.Array;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Element-level access to a {@link List} or a java array, given directly or through a {@link Ref}. Lists grow
 * in place; arrays are reallocated on append, which needs the location they live in.
 */
public class SequenceView {

    private final Value holder;
    private final ValueType elementType;

    private SequenceView(Value holder) {
        this.holder = holder;
        this.elementType = holder.getType().getElementType();
    }

    public static SequenceView of(Object o) {
        Value v = Value.of(o);
        if (!v.isValid()) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "cannot view an absent value as a sequence");
        }
        if (v.isDynamic() && !v.isNil()) {
            v = v.dereference();
        }
        if (v.isPointer()) {
            ValueType pointee = v.getType().getElementType();
            if (!isSequence(pointee)) {
                throw new ReflectException(ErrorKind.NOT_A_SEQUENCE, v.getType().toString());
            }
            if (v.isNil()) {
                throw new ReflectException(ErrorKind.NIL_POINTER, "ref to " + pointee + " is null");
            }
            v = v.dereference();
        }
        if (!isSequence(v.getType())) {
            throw new ReflectException(ErrorKind.NOT_A_SEQUENCE, v.getType().toString());
        }
        if (v.isNil()) {
            if (!v.isAddressable()) {
                throw new ReflectException(ErrorKind.NIL_POINTER, v.getType() + " is null");
            }
            v.set(newContainer(v.getType(), 0));
        }
        return new SequenceView(v);
    }

    public static SequenceView mustOf(Object o) {
        try {
            return of(o);
        } catch (ReflectException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    /**
     * A new empty list-backed view that can be appended to.
     */
    public static SequenceView empty(ValueType elementType) {
        ValueType type = ValueType.listOf(elementType.isPrimitive() ? ValueType.of(elementType.getBoxedClass()) : elementType);
        return new SequenceView(Value.at(Ref.of(type, new ArrayList<>())));
    }

    private static boolean isSequence(ValueType type) {
        return type.getKind() == Kind.SEQUENCE || type.getKind() == Kind.FIXED_ARRAY;
    }

    @SuppressWarnings("unchecked")
    private static Object newContainer(ValueType type, int length) {
        Class<?> c = type.getRawClass();
        if (c.isArray()) {
            return Array.newInstance(c.getComponentType(), length);
        }
        if (c.isInterface() || Modifier.isAbstract(c.getModifiers())) {
            return new ArrayList<>(length);
        }
        try {
            return c.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ReflectException(ErrorKind.UNCONVERTIBLE, "cannot create " + type, e);
        }
    }

    public <T> T getValue() {
        return holder.getValue();
    }

    public Value asValue() {
        return holder;
    }

    public ValueType getElementType() {
        return elementType;
    }

    public int len() {
        return holder.len();
    }

    public SequenceView newEmpty() {
        return empty(elementType);
    }

    @SuppressWarnings("unchecked")
    public Value index(int i) {
        if (i < 0 || i >= len()) {
            return Value.ABSENT;
        }
        Object container = holder.getValue();
        if (container instanceof List<?> list) {
            return Value.at(Refs.listElement((List<Object>) list, i, elementType));
        }
        return Value.at(Refs.arrayElement(container, i));
    }

    public <T> T indexValue(int i) {
        Value item = index(i);
        return item.isValid() ? item.getValue() : null;
    }

    public void setIndex(int i, Value newValue) {
        checkIndex(i);
        index(i).set(newValue);
    }

    public void setIndexValue(int i, Object newValue) {
        checkIndex(i);
        index(i).set(newValue);
    }

    @SuppressWarnings("unchecked")
    public void swap(int i, int j) {
        checkIndex(i);
        checkIndex(j);
        Object container = holder.getValue();
        try {
            if (container instanceof List<?> list) {
                Collections.swap((List<Object>) list, i, j);
            } else {
                Object temp = Array.get(container, i);
                Array.set(container, i, Array.get(container, j));
                Array.set(container, j, temp);
            }
        } catch (UnsupportedOperationException e) {
            throw new ReflectException(ErrorKind.UNSETTABLE, "sequence is read-only", e);
        }
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= len()) {
            throw new ReflectException(ErrorKind.INDEX_OUT_OF_BOUNDS, i + " of " + len());
        }
    }

    /**
     * The element wrappers in order, dynamic elements replaced by their content.
     */
    public List<Value> items() {
        int length = len();
        List<Value> items = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            Value item = index(i);
            if (item.isDynamic() && !item.isNil()) {
                item = item.dereference();
            }
            items.add(item);
        }
        return items;
    }

    /**
     * Appends all values or none: every value is checked against the element type before anything is written.
     */
    @SuppressWarnings("unchecked")
    public void append(Value... values) {
        Class<?> boxed = elementType.getBoxedClass();
        List<Object> raws = new ArrayList<>(values.length);
        for (Value v : values) {
            if (v == null || !v.isValid()) {
                throw new ReflectException(ErrorKind.INVALID_VALUE, "cannot append an absent value");
            }
            Object raw = v.getValue();
            if (!boxed.isInstance(raw)) {
                throw new ReflectException(ErrorKind.TYPE_MISMATCH, v.getType() + " is not a " + elementType);
            }
            raws.add(raw);
        }
        Object container = holder.getValue();
        if (container instanceof List<?> list) {
            try {
                ((List<Object>) list).addAll(raws);
            } catch (UnsupportedOperationException e) {
                throw new ReflectException(ErrorKind.UNSETTABLE, "sequence is read-only", e);
            }
            return;
        }
        if (!holder.isAddressable()) {
            throw new ReflectException(ErrorKind.CANNOT_APPEND_TO_NON_REFERENCE, holder.getType().toString());
        }
        int length = Array.getLength(container);
        Object grown = newContainer(holder.getType(), length + raws.size());
        System.arraycopy(container, 0, grown, 0, length);
        for (int i = 0; i < raws.size(); i++) {
            Array.set(grown, length + i, raws.get(i));
        }
        holder.set(grown);
    }

    public void appendValues(Object... values) {
        Value[] wrapped = new Value[values.length];
        for (int i = 0; i < values.length; i++) {
            wrapped[i] = Value.of(values[i]);
        }
        append(wrapped);
    }

    /**
     * A new list with every element converted to the given element type.
     */
    public Value convertToType(ValueType targetElementType) {
        return Conversion.convert(Value.of(holder.getValue(), holder.getType()), ValueType.listOf(targetElementType));
    }

    public Value convertTo(Object sample) {
        Value target = Value.of(sample);
        if (!target.isValid()) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "conversion target is absent");
        }
        return convertToType(target.getType());
    }

    /**
     * A new list-backed view holding the items the predicate accepts.
     */
    public SequenceView filterBy(Predicate<Value> predicate) {
        SequenceView result = newEmpty();
        for (Value item : items()) {
            if (predicate.test(item)) {
                result.holder.<List<Object>>getValue().add(item.getValue());
            }
        }
        return result;
    }

    /**
     * Stable sort by a less-than predicate. The order is computed on a snapshot and written back only when the
     * predicate completed for every pair, so a failing predicate leaves the sequence as it was. A predicate that
     * is not a strict weak ordering (NaN with {@code <} for example) yields some permutation and never fails.
     */
    @SuppressWarnings("unchecked")
    public void sortBy(BiPredicate<Value, Value> less) {
        List<Value> items = items();
        if (items.size() < 2) {
            return;
        }
        List<Object> raws = new ArrayList<>(items.size());
        for (Value item : items) {
            raws.add(item.getValue());
        }
        int[] order = stableOrder(items, less);
        Object container = holder.getValue();
        try {
            for (int i = 0; i < order.length; i++) {
                Object raw = raws.get(order[i]);
                if (container instanceof List<?> list) {
                    ((List<Object>) list).set(i, raw);
                } else {
                    Array.set(container, i, raw);
                }
            }
        } catch (UnsupportedOperationException e) {
            throw new ReflectException(ErrorKind.UNSETTABLE, "sequence is read-only", e);
        }
    }

    // bottom-up merge sort over indices, an element moves ahead only when strictly less
    private static int[] stableOrder(List<Value> items, BiPredicate<Value, Value> less) {
        int n = items.size();
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        int[] buffer = new int[n];
        for (int width = 1; width < n; width *= 2) {
            for (int lo = 0; lo < n - width; lo += 2 * width) {
                int mid = lo + width;
                int hi = Math.min(lo + 2 * width, n);
                int i = lo;
                int j = mid;
                int k = lo;
                while (i < mid && j < hi) {
                    if (less.test(items.get(order[j]), items.get(order[i]))) {
                        buffer[k++] = order[j++];
                    } else {
                        buffer[k++] = order[i++];
                    }
                }
                while (i < mid) {
                    buffer[k++] = order[i++];
                }
                while (j < hi) {
                    buffer[k++] = order[j++];
                }
                System.arraycopy(buffer, lo, order, lo, hi - lo);
            }
        }
        return order;
    }

    /**
     * Sorts records, refs to records or maps by the values of one field.
     */
    public void sortByFieldFunc(String field, BiPredicate<Value, Value> less) {
        for (Value item : items()) {
            checkSortable(item, field);
        }
        sortBy((a, b) -> less.test(fieldOf(a, field), fieldOf(b, field)));
    }

    public void sortByField(String field, boolean ascending) {
        String operator = ascending ? "<" : ">";
        List<Value> items = items();
        if (items.isEmpty()) {
            return;
        }
        checkSortable(items.get(0), field);
        Value first = fieldOf(items.get(0), field);
        try {
            first.compareTo(first, operator);
        } catch (ReflectException e) {
            throw new ReflectException(ErrorKind.INVALID_COMPARISON, "values of field " + field + " cannot be ordered", e);
        }
        sortByFieldFunc(field, (a, b) -> a.compareTo(b, operator));
    }

    private static void checkSortable(Value item, String field) {
        if (item.isMap()) {
            return;
        }
        if (!item.isRecord() && !item.isRecordPointer()) {
            throw new ReflectException(ErrorKind.NOT_A_RECORD, "cannot sort " + (item.isValid() ? item.getType() : "absent value") + " by field");
        }
        if (!item.isNil() && !StructView.of(item).hasField(field)) {
            throw new ReflectException(ErrorKind.UNKNOWN_FIELD, field);
        }
    }

    private static Value fieldOf(Value item, String field) {
        if (item.isNil()) {
            return Value.ABSENT;
        }
        Value v;
        if (item.isMap()) {
            v = Value.of(item.<Map<?, ?>>getValue().get(field));
        } else {
            Value record = item.isRecordPointer() ? item.dereference() : item;
            if (record.isNil()) {
                return Value.ABSENT;
            }
            v = StructView.of(record).field(field);
        }
        if (v.isDynamic() && !v.isNil()) {
            v = v.dereference();
        }
        return v;
    }

    @Override
    public String toString() {
        return holder.toString();
    }

}
