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

/**
 * A location holding a value of a declared type: either a free-standing cell created by the caller, or a view
 * onto a storage slot such as a record field, a list or array element or a map entry (see {@link Refs}).
 * Wrapping a ref with {@link Value#at(Ref)} yields an addressable {@link Value} that writes through.
 */
public interface Ref<T> {

    T get();

    void set(T value);

    /**
     * The declared type of the slot, not the runtime class of its content.
     */
    ValueType getType();

    static <T> Ref<T> of(T value) {
        return Refs.cell(ValueType.ofValue(value), value);
    }

    static <T> Ref<T> of(Class<T> type, T value) {
        return Refs.cell(ValueType.of(type), value);
    }

    static <T> Ref<T> of(ValueType type, T value) {
        return Refs.cell(type, value);
    }

    @SuppressWarnings("unchecked")
    static <T> Ref<T> empty(Class<T> type) {
        ValueType valueType = ValueType.of(type);
        return Refs.cell(valueType, (T) valueType.zeroValue());
    }

}
