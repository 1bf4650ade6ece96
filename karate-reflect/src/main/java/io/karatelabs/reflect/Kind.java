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

import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * Coarse classification of a java type, the dispatch key of the conversion and comparison engines.
 */
public enum Kind {

    INVALID,
    BOOLEAN,
    INT,
    FLOAT,
    STRING,
    RECORD,
    SEQUENCE,
    FIXED_ARRAY,
    MAP,
    POINTER,
    DYNAMIC,
    FUNCTION,
    CHANNEL,
    OTHER;

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    /**
     * Kinds whose values have an element count.
     */
    public boolean isIterable() {
        switch (this) {
            case FIXED_ARRAY:
            case CHANNEL:
            case MAP:
            case SEQUENCE:
            case STRING:
                return true;
            default:
                return false;
        }
    }

    static Kind of(Class<?> c) {
        if (c.isPrimitive()) {
            if (c == boolean.class) {
                return BOOLEAN;
            }
            if (c == float.class || c == double.class) {
                return FLOAT;
            }
            if (c == char.class || c == void.class) {
                return OTHER;
            }
            return INT;
        }
        if (c == Boolean.class) {
            return BOOLEAN;
        }
        if (c == Integer.class || c == Long.class || c == Short.class || c == Byte.class || c == BigInteger.class) {
            return INT;
        }
        if (c == Double.class || c == Float.class || c == BigDecimal.class) {
            return FLOAT;
        }
        if (c == String.class) {
            return STRING;
        }
        if (Ref.class.isAssignableFrom(c)) {
            return POINTER;
        }
        if (c.isArray()) {
            return FIXED_ARRAY;
        }
        if (List.class.isAssignableFrom(c)) {
            return SEQUENCE;
        }
        if (Map.class.isAssignableFrom(c)) {
            return MAP;
        }
        if (BlockingQueue.class.isAssignableFrom(c)) {
            return CHANNEL;
        }
        if (isFunction(c)) {
            return FUNCTION;
        }
        if (Enum.class.isAssignableFrom(c)) {
            return OTHER;
        }
        if (c == Object.class || c.isInterface() || Modifier.isAbstract(c.getModifiers())) {
            return DYNAMIC;
        }
        if (isPlatformClass(c)) {
            return OTHER;
        }
        return RECORD;
    }

    private static boolean isFunction(Class<?> c) {
        if (c.isInterface()) {
            return c.isAnnotationPresent(FunctionalInterface.class);
        }
        // lambda and method reference classes
        return c.isSynthetic() || c.getName().contains("$$Lambda");
    }

    static boolean isPlatformClass(Class<?> c) {
        String name = c.getName();
        return name.startsWith("java.")
                || name.startsWith("javax.")
                || name.startsWith("jdk.")
                || name.startsWith("sun.")
                || name.startsWith("com.sun.");
    }

}
