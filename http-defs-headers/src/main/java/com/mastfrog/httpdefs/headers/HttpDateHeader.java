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

import io.netty.util.AsciiString;

/**
 * Date-valued headers. Written in RFC 1123 form in GMT; read from any of the
 * HTTP-date forms.
 *
 * @author Tim Boudreau
 */
final class HttpDateHeader extends NamedHeader<FullDate> {

    HttpDateHeader(CharSequence name) {
        super(FullDate.class, name);
    }

    @Override
    CharSequence render(FullDate value) {
        return AsciiString.of(value.format(DateFormat.RFC1123_GMT));
    }

    @Override
    FullDate interpret(CharSequence text) {
        try {
            return FullDate.parse(text);
        } catch (InvalidDateFormatException ex) {
            // Already logged; an unparseable date header is treated as absent
            return null;
        }
    }
}
