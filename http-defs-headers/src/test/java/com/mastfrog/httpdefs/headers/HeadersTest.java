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
import com.mastfrog.httpdefs.util.CacheDirectiveKind;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import java.time.Duration;
import java.time.Instant;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author Tim Boudreau
 */
public class HeadersTest {

    @Test
    public void testDateHeaderWrittenInGmt() {
        HttpResponse resp = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        FullDate date = FullDate.ofEpochSecond(784111777L);
        CharSequence written = Headers.write(Headers.LAST_MODIFIED, date, resp);
        assertEquals("Sun, 06 Nov 1994 08:49:37 GMT", written.toString());
        assertEquals("Sun, 06 Nov 1994 08:49:37 GMT", resp.headers().get(HttpHeaderNames.LAST_MODIFIED));
        assertEquals(date, Headers.read(Headers.LAST_MODIFIED, resp));
    }

    @Test
    public void testReadAnyDateForm() {
        HttpResponse resp = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        FullDate expect = FullDate.ofEpochSecond(784111777L);
        for (String s : new String[]{"Sun, 06 Nov 1994 08:49:37 GMT",
            "Sunday, 06-Nov-94 08:49:37 GMT", "Sun Nov  6 08:49:37 1994", "784111777"}) {
            resp.headers().set(HttpHeaderNames.EXPIRES, s);
            assertEquals(s, expect, Headers.read(Headers.EXPIRES, resp));
        }
    }

    @Test
    public void testUnparseableOrMissingDateIsNull() {
        HttpResponse resp = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        assertNull(Headers.read(Headers.DATE, resp));
        resp.headers().set(HttpHeaderNames.DATE, "not a date");
        assertNull(Headers.read(Headers.DATE, resp));
        assertNull(Headers.writeIfNotNull(Headers.DATE, null, resp));
        assertEquals("not a date", resp.headers().get(HttpHeaderNames.DATE));
    }

    @Test
    public void testCacheControlHeader() {
        HttpResponse resp = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        CharSequence txt = Headers.write(Headers.CACHE_CONTROL, CacheControl.PRIVATE_NO_CACHE_NO_STORE, resp);
        assertEquals("private, no-cache, no-store", txt.toString());
        assertSame(txt, Headers.CACHE_CONTROL.toCharSequence(CacheControl.PRIVATE_NO_CACHE_NO_STORE));

        CacheControl cc = new CacheControl(CacheDirectiveKind.PUBLIC).add(CacheDirectiveKind.MAX_AGE, Duration.ofHours(1));
        Headers.write(Headers.CACHE_CONTROL, cc, resp);
        assertEquals("public, max-age=3600", resp.headers().get(HttpHeaderNames.CACHE_CONTROL));
        CacheControl read = Headers.read(Headers.CACHE_CONTROL, resp);
        assertEquals(cc, read);
        assertEquals(Duration.ofHours(1), read.get(CacheDirectiveKind.MAX_AGE));
    }

    @Test
    public void testSharedCacheControlTextStaysCurrent() {
        HttpResponse resp = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
        Headers.write(Headers.CACHE_CONTROL, CacheControl.PUBLIC, resp);
        assertEquals("public", resp.headers().get(HttpHeaderNames.CACHE_CONTROL));
        try {
            CacheControl.PUBLIC.add(CacheDirectiveKind.NO_TRANSFORM);
            fail("Shared constant should not be modifiable");
        } catch (UnsupportedOperationException ex) {
            // ok
        }
        CacheControl modified = CacheControl.PUBLIC.copy().add(CacheDirectiveKind.NO_TRANSFORM);
        Headers.write(Headers.CACHE_CONTROL, modified, resp);
        assertEquals("public, no-transform", resp.headers().get(HttpHeaderNames.CACHE_CONTROL));
        Headers.write(Headers.CACHE_CONTROL, CacheControl.PUBLIC, resp);
        assertEquals("public", resp.headers().get(HttpHeaderNames.CACHE_CONTROL));
        assertEquals(CacheControl.PUBLIC.toString(),
                Headers.CACHE_CONTROL.toCharSequence(CacheControl.PUBLIC).toString());
    }

    @Test
    public void testHeaderIdentity() {
        assertTrue(Headers.DATE.is("date"));
        assertTrue(Headers.DATE.is("DATE"));
        assertEquals(new HttpDateHeader("Date"), Headers.DATE);
        assertEquals(new HttpDateHeader("Date").hashCode(), Headers.DATE.hashCode());
        assertNotEquals(Headers.DATE, Headers.EXPIRES);
        assertTrue(Headers.DATE.compareTo(Headers.EXPIRES) < 0);
        assertEquals("expires", Headers.EXPIRES.toString());
        assertEquals(FullDate.class, Headers.EXPIRES.type());
        assertEquals(Instant.ofEpochSecond(0), Headers.RETRY_AFTER_DATE.toValue("0").instant());
    }
}
