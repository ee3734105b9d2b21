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

import com.mastfrog.httpdefs.util.CacheControl;
import com.mastfrog.util.preconditions.Checks;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMessage;

/**
 * Standard HTTP headers whose values are HTTP-dates or Cache-Control
 * directives, and objects that convert between them and header strings.
 * Typical usage would be something like:
 * <pre>
 * Headers.write(Headers.LAST_MODIFIED, FullDate.now(), response);
 * FullDate since = Headers.read(Headers.IF_MODIFIED_SINCE, request);
 * </pre>
 *
 * @author Tim Boudreau
 */
public final class Headers {

    private Headers() {
        throw new AssertionError();
    }

    public static final HeaderValueType<FullDate> DATE = new HttpDateHeader(HttpHeaderNames.DATE);
    public static final HeaderValueType<FullDate> LAST_MODIFIED = new HttpDateHeader(HttpHeaderNames.LAST_MODIFIED);
    public static final HeaderValueType<FullDate> EXPIRES = new HttpDateHeader(HttpHeaderNames.EXPIRES);
    public static final HeaderValueType<FullDate> IF_MODIFIED_SINCE = new HttpDateHeader(HttpHeaderNames.IF_MODIFIED_SINCE);
    public static final HeaderValueType<FullDate> IF_UNMODIFIED_SINCE = new HttpDateHeader(HttpHeaderNames.IF_UNMODIFIED_SINCE);
    public static final HeaderValueType<FullDate> RETRY_AFTER_DATE = new HttpDateHeader(HttpHeaderNames.RETRY_AFTER);
    public static final HeaderValueType<CacheControl> CACHE_CONTROL = new CacheControlHeader();

    /**
     * Read a header from a message.
     *
     * @param <T> The value type
     * @param type The header
     * @param msg The message
     * @return The value, or null if the header is absent or unparseable
     */
    public static <T> T read(HeaderValueType<T> type, HttpMessage msg) {
        Checks.notNull("type", type);
        Checks.notNull("msg", msg);
        String val = msg.headers().get(type.name());
        return val == null ? null : type.toValue(val);
    }

    public static <T> CharSequence writeIfNotNull(HeaderValueType<T> type, T value, HttpMessage msg) {
        if (value != null) {
            return write(type, value, msg);
        }
        return null;
    }

    /**
     * Set a header on a message, replacing any existing value.
     *
     * @param <T> The value type
     * @param type The header
     * @param value The value
     * @param msg The message
     * @return The text written
     */
    public static <T> CharSequence write(HeaderValueType<T> type, T value, HttpMessage msg) {
        Checks.notNull("type", type);
        Checks.notNull("msg", msg);
        Checks.notNull("value " + type, value);
        CharSequence val = type.toCharSequence(value);
        msg.headers().set(type.name(), val);
        return val;
    }
}
