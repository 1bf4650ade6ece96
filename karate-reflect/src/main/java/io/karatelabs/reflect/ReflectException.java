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
 * Typed failure of an introspection, conversion or comparison call.
 * The message always starts with the {@link ErrorKind#tag}.
 */
public class ReflectException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;

    public ReflectException(ErrorKind kind) {
        this(kind, null, null);
    }

    public ReflectException(ErrorKind kind, String detail) {
        this(kind, detail, null);
    }

    public ReflectException(ErrorKind kind, String detail, Throwable cause) {
        super(detail == null ? kind.tag : kind.tag + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }

    public boolean is(ErrorKind kind) {
        return this.kind == kind;
    }

    /**
     * Same kind and cause, with a prefix in front of the detail, used when a nested failure is re-thrown with
     * the path that led to it.
     */
    public ReflectException withPrefix(String prefix) {
        String text = detail == null ? prefix : prefix + detail;
        return new ReflectException(kind, text, getCause() == null ? this : getCause());
    }

}
