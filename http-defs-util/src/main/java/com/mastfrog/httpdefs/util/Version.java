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
package com.mastfrog.httpdefs.util;

import com.mastfrog.util.preconditions.Checks;
import com.mastfrog.util.strings.Strings;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.AsciiString;

/**
 * HTTP protocol versions this library knows how to name.
 *
 * @author Tim Boudreau
 */
public enum Version {

    HTTP_1_0("HTTP/1.0"),
    HTTP_1_1("HTTP/1.1");

    private final AsciiString stringValue;

    Version(String stringValue) {
        this.stringValue = AsciiString.of(stringValue);
    }

    @Override
    public String toString() {
        return stringValue.toString();
    }

    public CharSequence toCharSequence() {
        return stringValue;
    }

    public HttpVersion toHttpVersion() {
        switch (this) {
            case HTTP_1_0:
                return HttpVersion.HTTP_1_0;
            case HTTP_1_1:
                return HttpVersion.HTTP_1_1;
            default:
                throw new AssertionError(this);
        }
    }

    public static Version get(HttpVersion version) {
        Checks.notNull("version", version);
        if (version.majorVersion() == 1) {
            switch (version.minorVersion()) {
                case 0:
                    return HTTP_1_0;
                case 1:
                    return HTTP_1_1;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Unsupported version " + version);
    }

    /**
     * Parse a protocol version as it appears in a request or status line.
     *
     * @param seq The text, e.g. <code>HTTP/1.1</code>
     * @return A version
     * @throws IllegalArgumentException if the text is not a known version
     */
    public static Version parse(CharSequence seq) {
        Checks.notNull("seq", seq);
        CharSequence trimmed = Strings.trim(seq);
        for (Version v : values()) {
            if (Strings.charSequencesEqual(trimmed, v.stringValue, true)) {
                return v;
            }
        }
        throw new IllegalArgumentException(seq.toString());
    }
}
