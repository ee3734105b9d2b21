/*
 * The MIT License
 *
 * Copyright 2026 Mastfrog Technologies.
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
package com.mastfrog.httpdefs.headers;

import com.mastfrog.util.preconditions.Checks;
import io.netty.util.AsciiString;

/**
 * Base class for the header types in this package. Holds the name as an
 * AsciiString, and checks arguments before handing them to the subclass'
 * conversion methods.
 *
 * @author Tim Boudreau
 */
abstract class NamedHeader<T> implements HeaderValueType<T> {

    private final Class<T> type;
    private final AsciiString name;
    private final int hash;

    NamedHeader(Class<T> type, CharSequence name) {
        this.type = Checks.notNull("type", type);
        this.name = AsciiString.of(Checks.notNull("name", name));
        // AsciiString's static hash ignores case
        this.hash = AsciiString.hashCode(this.name);
    }

    /**
     * Render a non-null value as header text.
     */
    abstract CharSequence render(T value);

    /**
     * Convert non-null header text to a value, or null if it is unusable.
     */
    abstract T interpret(CharSequence text);

    @Override
    public final CharSequence toCharSequence(T value) {
        return render(Checks.notNull("value", value));
    }

    @Override
    public final T toValue(CharSequence value) {
        return interpret(Checks.notNull("value", value));
    }

    @Override
    public final AsciiString name() {
        return name;
    }

    @Override
    public final Class<T> type() {
        return type;
    }

    @Override
    public final boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (!(obj instanceof HeaderValueType<?>)) {
            return false;
        }
        return name.contentEqualsIgnoreCase(((HeaderValueType<?>) obj).name());
    }

    @Override
    public final int hashCode() {
        return hash;
    }

    @Override
    public final String toString() {
        return name.toString();
    }
}
