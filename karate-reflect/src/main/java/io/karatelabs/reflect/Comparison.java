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

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Relates two values of arbitrary type with an {@link Operator}. Numbers, timestamps and durations compare
 * arithmetically, strings lexicographically, anything else only for (in)equality.
 */
public final class Comparison {

    private Comparison() {
        // only static methods
    }

    public static ComparisonResult compare(Value value, Object other, String operator) {
        Operator op = Operator.of(operator);
        Value a = value == null ? Value.ABSENT : value;
        if (a.isDeepZero()) {
            a = Value.of(0.0d);
        }
        if (a.isPointer() || a.isDynamic()) {
            a = a.dereference();
        }
        Value b = Value.of(other);
        if (!b.isValid() || b.isDeepZero()) {
            // zero on the right is moved to the left, the original left operand becomes the right one
            b = a;
            a = Value.of(0.0d);
        }
        if (b.isPointer() || b.isDynamic()) {
            b = b.dereference();
        }
        Object x = a.getValue();
        Object y = b.getValue();
        Instant ia = toInstant(x);
        Instant ib = toInstant(y);
        if (ia != null && ib != null) {
            return new ComparisonResult(ordered(ia.compareTo(ib), op), op);
        }
        if (x instanceof Duration dx && y instanceof Duration dy) {
            return new ComparisonResult(ordered(dx.compareTo(dy), op), op);
        }
        a = toNanos(a);
        b = toNanos(b);
        return new ComparisonResult(evaluate(a, b, op), op);
    }

    private static boolean ordered(int result, Operator op) {
        switch (op) {
            case EQ:
                return result == 0;
            case NE:
                return result != 0;
            case LT:
                return result < 0;
            case LE:
                return result <= 0;
            case GT:
                return result > 0;
            case GE:
                return result >= 0;
            default:
                throw new ReflectException(ErrorKind.INVALID_COMPARISON, "like can only be used for string values");
        }
    }

    /**
     * Orders by unicode code point, which is also the order of the utf-8 encoded bytes.
     */
    static int compareCodePoints(String x, String y) {
        int i = 0;
        int j = 0;
        while (i < x.length() && j < y.length()) {
            int cx = x.codePointAt(i);
            int cy = y.codePointAt(j);
            if (cx != cy) {
                return Integer.compare(cx, cy);
            }
            i += Character.charCount(cx);
            j += Character.charCount(cy);
        }
        return Integer.compare(x.length() - i, y.length() - j);
    }

    private static boolean evaluate(Value a, Value b, Operator op) {
        if (a.isNumeric() || b.isNumeric()) {
            if (op == Operator.LIKE) {
                throw new ReflectException(ErrorKind.INVALID_COMPARISON, "like can only be used for string values, not numbers");
            }
            double x = toDouble(a);
            double y = toDouble(b);
            switch (op) {
                case EQ:
                    return x == y;
                case NE:
                    return x != y;
                case LT:
                    return x < y;
                case LE:
                    return x <= y;
                case GT:
                    return x > y;
                default:
                    return x >= y;
            }
        }
        if (a.isString()) {
            String x = a.getValue();
            String y = convert(b, ValueType.STRING).getValue();
            if (op == Operator.LIKE) {
                return x.contains(y);
            }
            return ordered(compareCodePoints(x, y), op);
        }
        if (op == Operator.EQ || op == Operator.NE) {
            Value converted = convert(b, a.getType());
            boolean equal = a.deepEquals(converted);
            return op == Operator.EQ ? equal : !equal;
        }
        throw new ReflectException(ErrorKind.INVALID_COMPARISON, "cannot compare " + describe(a) + " to " + describe(b));
    }

    private static double toDouble(Value v) {
        Double d = convert(v, ValueType.DOUBLE).getValue();
        return d;
    }

    private static Value convert(Value v, ValueType type) {
        try {
            return Conversion.convert(v, type);
        } catch (ReflectException e) {
            throw new ReflectException(ErrorKind.INVALID_COMPARISON, "conversion error: " + e.getMessage(), e);
        }
    }

    private static String describe(Value v) {
        if (!v.isValid()) {
            return "invalid";
        }
        return v.getKind() + " (value " + TextFormat.toText(v.getValue()) + ")";
    }

    private static Instant toInstant(Object o) {
        if (o instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (o instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (o instanceof Instant i) {
            return i;
        }
        if (o instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }

    /**
     * Timestamps as epoch nanoseconds and durations as nanoseconds, for comparing against plain numbers.
     */
    static Value toNanos(Value v) {
        Object o = v.getValue();
        try {
            if (o instanceof Duration d) {
                return Value.of(d.toNanos());
            }
            Instant instant = toInstant(o);
            if (instant == null) {
                return v;
            }
            return Value.of(Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano()));
        } catch (ArithmeticException e) {
            throw new ReflectException(ErrorKind.INVALID_COMPARISON, TextFormat.toText(o) + " does not fit in 64-bit nanoseconds", e);
        }
    }

}
