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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Human-readable rendering used when a value is converted to a string. Values that declare their own
 * {@code toString()} use it; lists, maps, arrays and records are rendered as compact JSON-like text.
 */
public final class TextFormat {

    private TextFormat() {
        // only static methods
    }

    public static String toText(Object o) {
        if (o == null) {
            return "null";
        }
        if (o instanceof String s) {
            return s;
        }
        if (o instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (o instanceof Ref<?> ref) {
            return toText(ref.get());
        }
        if (isStructured(o)) {
            StringBuilder sb = new StringBuilder();
            formatRecurse(o, sb, 0);
            return sb.toString();
        }
        return o.toString();
    }

    private static boolean isStructured(Object o) {
        if (o instanceof List || o instanceof Map || o.getClass().isArray()) {
            return true;
        }
        ValueType type = ValueType.ofValue(o);
        return type.getKind() == Kind.RECORD && !type.declaresToString();
    }

    private static void formatRecurse(Object o, StringBuilder sb, int depth) {
        if (depth > Value.MAX_DEPTH) {
            sb.append("...");
            return;
        }
        if (o == null) {
            sb.append("null");
        } else if (o instanceof Ref<?> ref) {
            formatRecurse(ref.get(), sb, depth + 1);
        } else if (o instanceof List<?> list) {
            sb.append('[');
            Iterator<?> iterator = list.iterator();
            while (iterator.hasNext()) {
                formatRecurse(iterator.next(), sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(", ");
                }
            }
            sb.append(']');
        } else if (o.getClass().isArray()) {
            sb.append('[');
            int length = Array.getLength(o);
            for (int i = 0; i < length; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                formatRecurse(Array.get(o, i), sb, depth + 1);
            }
            sb.append(']');
        } else if (o instanceof Map<?, ?> map) {
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> iterator = map.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<?, ?> entry = iterator.next();
                appendKey(String.valueOf(entry.getKey()), sb);
                formatRecurse(entry.getValue(), sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(", ");
                }
            }
            sb.append('}');
        } else if (o instanceof Number || o instanceof Boolean) {
            sb.append(o);
        } else if (isStructured(o)) {
            sb.append('{');
            List<Field> fields = ValueType.ofValue(o).getFields();
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                Field field = fields.get(i);
                appendKey(field.getName(), sb);
                formatRecurse(Refs.read(field, o), sb, depth + 1);
            }
            sb.append('}');
        } else {
            sb.append('"').append(escape(o.toString())).append('"');
        }
    }

    private static void appendKey(String key, StringBuilder sb) {
        sb.append('"').append(escape(key)).append('"').append(':').append(' ');
    }

    private static String escape(String raw) {
        return JSONValue.escape(raw, JSONStyle.LT_COMPRESS);
    }

}
