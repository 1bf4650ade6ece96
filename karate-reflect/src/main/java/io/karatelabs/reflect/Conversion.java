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
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts a {@link Value} to a target {@link ValueType}. The rules are tried in a fixed order and the first
 * that applies wins; anything that does not fit a rule falls through to plain java casts.
 */
public final class Conversion {

    private static final Logger logger = LoggerFactory.getLogger(Conversion.class);

    static final DateTimeFormatter RFC_3339 = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter()
            .withChronology(IsoChronology.INSTANCE)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern FLOAT_LITERAL = Pattern.compile("[+-]?(?:"
            + "(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?"
            + "|0[xX](?:[0-9a-fA-F]+\\.?[0-9a-fA-F]*|\\.[0-9a-fA-F]+)[pP][+-]?\\d+)");

    private Conversion() {
        // only static methods
    }

    public static Value convert(Value source, ValueType target) {
        if (target == null) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "conversion target is absent");
        }
        if (source == null || !source.isValid()) {
            throw new ReflectException(ErrorKind.INVALID_VALUE, "cannot convert an absent value to " + target);
        }
        if (source.isDynamic() && !source.isNil()) {
            source = source.dereference();
        }
        ValueType type = source.getType();
        Object value = source.getValue();
        if (type.equals(target)) {
            return new Value(value, target, null);
        }
        if (isSequenceKind(type) && isSequenceKind(target) && !sameSequence(value, type, target)) {
            return convertSequence(value, type, target);
        }
        if (target.getKind() == Kind.POINTER && samePointee(target.getElementType(), type)) {
            return new Value(Refs.cell(target.getElementType(), value), target, null);
        }
        if (type.getKind() == Kind.POINTER && samePointee(type.getElementType(), target)) {
            Ref<?> ref = (Ref<?>) value;
            if (ref == null || ref.get() == null) {
                throw new ReflectException(ErrorKind.NIL_POINTER, "cannot take " + target + " from a null " + type);
            }
            return new Value(ref.get(), target, null);
        }
        if (type.getKind() == Kind.STRING && value != null) {
            String text = (String) value;
            if (target.isTimestamp()) {
                return new Value(parseTimestamp(text, target), target, null);
            }
            if (target.getKind() == Kind.POINTER && target.getElementType().isTimestamp()) {
                ValueType pointee = target.getElementType();
                return new Value(Refs.cell(pointee, parseTimestamp(text, pointee)), target, null);
            }
            if (target.getKind() == Kind.BOOLEAN) {
                Boolean flag = toBoolean(text);
                if (flag != null) {
                    return new Value(flag, target, null);
                }
            }
        }
        if (target.getKind() == Kind.STRING) {
            return new Value(TextFormat.toText(value), target, null);
        }
        if (type.getKind() == Kind.STRING && value != null && target.isNumeric()) {
            Object number;
            try {
                number = castNumber(parseFloat((String) value), target.getBoxedClass());
            } catch (RuntimeException e) {
                throw new ReflectException(ErrorKind.UNCONVERTIBLE, e.getMessage(), e);
            }
            return new Value(number, target, null);
        }
        return fallback(value, type, target);
    }

    private static Value fallback(Object value, ValueType type, ValueType target) {
        Object result;
        try {
            result = cast(value, type, target);
        } catch (ReflectException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("cannot convert {} to {}: {}", type, target, e.toString());
            throw new ReflectException(ErrorKind.UNCONVERTIBLE, type + " to " + target + ": " + e.getMessage(), e);
        }
        if (result == null) {
            if (value == null && !target.isPrimitive() && target.getBoxedClass().isAssignableFrom(type.getBoxedClass())) {
                return new Value(null, target, null);
            }
            throw new ReflectException(ErrorKind.UNCONVERTIBLE, type + " to " + target);
        }
        return new Value(result, target, null);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object cast(Object value, ValueType type, ValueType target) {
        if (value == null) {
            return null;
        }
        Class<?> boxed = target.getBoxedClass();
        if ((value instanceof Number || value instanceof Character) && (target.isNumeric() || boxed == Character.class)) {
            return castNumber(value, boxed);
        }
        if (value instanceof String s && boxed.isEnum()) {
            return Enum.valueOf((Class<Enum>) boxed, s);
        }
        if (boxed.isInstance(value)) {
            return value;
        }
        return null;
    }

    /**
     * Java primitive conversion semantics: integral narrowing keeps the low bits, floating to integral
     * saturates and maps NaN to zero.
     */
    static Object castNumber(Object value, Class<?> boxed) {
        boolean floating = value instanceof Double || value instanceof Float || value instanceof BigDecimal;
        Number n = value instanceof Character c ? Integer.valueOf(c) : (Number) value;
        double d = n.doubleValue();
        long l = n.longValue();
        if (boxed == Integer.class) {
            return floating ? (int) d : (int) l;
        }
        if (boxed == Long.class) {
            return floating ? (long) d : l;
        }
        if (boxed == Double.class) {
            return d;
        }
        if (boxed == Float.class) {
            return n.floatValue();
        }
        if (boxed == Short.class) {
            return floating ? (short) d : (short) l;
        }
        if (boxed == Byte.class) {
            return floating ? (byte) d : (byte) l;
        }
        if (boxed == Character.class) {
            return floating ? (char) d : (char) l;
        }
        if (boxed == BigInteger.class) {
            if (n instanceof BigInteger bi) {
                return bi;
            }
            if (n instanceof BigDecimal bd) {
                return bd.toBigInteger();
            }
            return floating ? BigDecimal.valueOf(d).toBigInteger() : BigInteger.valueOf(l);
        }
        if (boxed == BigDecimal.class) {
            if (n instanceof BigDecimal bd) {
                return bd;
            }
            if (n instanceof BigInteger bi) {
                return new BigDecimal(bi);
            }
            return floating ? BigDecimal.valueOf(d) : BigDecimal.valueOf(l);
        }
        return null;
    }

    /**
     * Parses a decimal or hexadecimal floating point literal, or inf, infinity or nan in any case. Padding and
     * java type suffixes are rejected, as are finite literals out of the double range.
     */
    static double parseFloat(String text) {
        if (FLOAT_LITERAL.matcher(text).matches()) {
            double d = Double.parseDouble(text);
            if (Double.isInfinite(d)) {
                throw new NumberFormatException("value out of range: \"" + text + "\"");
            }
            return d;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("nan")) {
            return Double.NaN;
        }
        boolean negative = lower.startsWith("-");
        String unsigned = negative || lower.startsWith("+") ? lower.substring(1) : lower;
        if (unsigned.equals("inf") || unsigned.equals("infinity")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        throw new NumberFormatException("invalid syntax: \"" + text + "\"");
    }

    static Object parseTimestamp(String text, ValueType target) {
        OffsetDateTime odt;
        try {
            odt = OffsetDateTime.parse(text, RFC_3339);
        } catch (DateTimeParseException e) {
            throw new ReflectException(ErrorKind.INVALID_TIME, text, e);
        }
        Class<?> c = target.getRawClass();
        if (c == Instant.class) {
            return odt.toInstant();
        }
        if (c == ZonedDateTime.class) {
            return odt.toZonedDateTime();
        }
        return odt;
    }

    static Boolean toBoolean(String text) {
        switch (text.trim().toLowerCase()) {
            case "y":
            case "yes":
            case "1":
                return Boolean.TRUE;
            case "n":
            case "no":
            case "0":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static boolean isSequenceKind(ValueType type) {
        return type.getKind() == Kind.SEQUENCE || type.getKind() == Kind.FIXED_ARRAY;
    }

    private static boolean sameSequence(Object value, ValueType type, ValueType target) {
        return type.getKind() == target.getKind()
                && type.getElementType().equals(target.getElementType())
                && target.isInstance(value);
    }

    private static boolean samePointee(ValueType pointee, ValueType type) {
        return pointee.equals(type) || (type.isPrimitive() && pointee.getRawClass() == type.getBoxedClass());
    }

    @SuppressWarnings("unchecked")
    private static Value convertSequence(Object value, ValueType type, ValueType target) {
        if (value == null) {
            return new Value(null, target, null);
        }
        ValueType sourceElement = type.getElementType();
        ValueType targetElement = target.getElementType();
        List<Object> items = new ArrayList<>();
        if (value instanceof List<?> list) {
            items.addAll(list);
        } else {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
        }
        List<Object> converted = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (item == null && !targetElement.isPrimitive()) {
                converted.add(null);
                continue;
            }
            try {
                converted.add(convert(Value.of(item, sourceElement), targetElement).getValue());
            } catch (ReflectException e) {
                throw new ReflectException(ErrorKind.TYPE_MISMATCH, "element " + i + " to " + targetElement + ": " + e.getMessage(), e);
            }
        }
        Class<?> raw = target.getRawClass();
        if (raw.isArray()) {
            Object array = Array.newInstance(raw.getComponentType(), converted.size());
            for (int i = 0; i < converted.size(); i++) {
                Array.set(array, i, converted.get(i));
            }
            return new Value(array, target, null);
        }
        if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) {
            return new Value(converted, target, null);
        }
        List<Object> list;
        try {
            list = (List<Object>) raw.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ReflectException(ErrorKind.UNCONVERTIBLE, "cannot create " + target, e);
        }
        list.addAll(converted);
        return new Value(list, target, null);
    }

}
