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
 * The closed set of failure categories reported by {@link ReflectException}.
 * The tag is the stable string form that prefixes every exception message.
 */
public enum ErrorKind {

    INVALID_VALUE("invalid_value"),
    TYPE_MISMATCH("type_mismatch"),
    UNCONVERTIBLE("unconvertible_types"),
    INVALID_TIME("invalid_time_not_rfc3339"),
    UNSETTABLE("unsettable_value"),
    NOT_A_RECORD("not_a_record"),
    NOT_A_SEQUENCE("not_a_sequence"),
    NOT_A_MAP("not_a_map"),
    NIL_POINTER("nil_pointer"),
    UNKNOWN_FIELD("unknown_field"),
    UNKNOWN_OPERATOR("unknown_operator"),
    INVALID_COMPARISON("invalid_comparison"),
    INDEX_OUT_OF_BOUNDS("index_out_of_bounds"),
    CANNOT_APPEND_TO_NON_REFERENCE("cannot_append_to_non_reference");

    public final String tag;

    ErrorKind(String tag) {
        this.tag = tag;
    }

    @Override
    public String toString() {
        return tag;
    }

}
