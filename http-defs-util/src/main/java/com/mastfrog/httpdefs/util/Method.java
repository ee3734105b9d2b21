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
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.util.AsciiString;

/**
 * Enum of standard HTTP methods
 *
 * @author Tim Boudreau
 */
public enum Method {

    OPTIONS, GET, POST, HEAD, PUT, PATCH, DELETE, TRACE, CONNECT,
    // WEBDAV
    PROPFIND, PROPPATCH, MKCOL, COPY, MOVE, LOCK, UNLOCK;

    private final AsciiString stringValue;

    Method() {
        stringValue = AsciiString.of(name());
    }

    public static Method get(HttpRequest req) {
        Checks.notNull("req", req);
        return get(req.method());
    }

    public static Method get(HttpMethod m) {
        Checks.notNull("m", m);
        if (m == HttpMethod.GET) {
            return GET;
        } else if (m == HttpMethod.PUT) {
            return PUT;
        } else if (m == HttpMethod.POST) {
            return POST;
        } else if (m == HttpMethod.OPTIONS) {
            return OPTIONS;
        } else if (m == HttpMethod.HEAD) {
            return HEAD;
        } else if (m == HttpMethod.PATCH) {
            return PATCH;
        } else if (m == HttpMethod.DELETE) {
            return DELETE;
        } else if (m == HttpMethod.TRACE) {
            return TRACE;
        } else if (m == HttpMethod.CONNECT) {
            return CONNECT;
        }
        return valueOf(m.asciiName());
    }

    public HttpMethod toHttpMethod() {
        switch (this) {
            case GET:
                return HttpMethod.GET;
            case PUT:
                return HttpMethod.PUT;
            case POST:
                return HttpMethod.POST;
            case OPTIONS:
                return HttpMethod.OPTIONS;
            case HEAD:
                return HttpMethod.HEAD;
            case PATCH:
                return HttpMethod.PATCH;
            case DELETE:
                return HttpMethod.DELETE;
            case TRACE:
                return HttpMethod.TRACE;
            case CONNECT:
                return HttpMethod.CONNECT;
            default:
                return HttpMethod.valueOf(name());
        }
    }

    @Override
    public String toString() {
        return name();
    }

    public CharSequence toCharSequence() {
        return stringValue;
    }

    public static Method valueOf(CharSequence seq) {
        Checks.notNull("seq", seq);
        for (Method m : values()) {
            if (Strings.charSequencesEqual(seq, m.stringValue)) {
                return m;
            }
        }
        throw new IllegalArgumentException(seq.toString());
    }
}
