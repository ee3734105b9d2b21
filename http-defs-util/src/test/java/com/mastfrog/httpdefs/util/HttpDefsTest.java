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

import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import java.util.HashSet;
import java.util.Set;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author Tim Boudreau
 */
public class HttpDefsTest {

    @Test
    public void testVersions() {
        assertEquals("HTTP/1.1", HttpDefs.versionString(Version.HTTP_1_1));
        assertEquals("HTTP/1.0", HttpDefs.versionString(Version.HTTP_1_0));
        assertEquals("HTTP/1.1", Version.HTTP_1_1.toString());
        for (Version v : Version.values()) {
            assertSame(v, Version.parse(v.toString()));
            assertSame(v, Version.get(v.toHttpVersion()));
            assertEquals(v.toString(), v.toHttpVersion().text());
        }
        assertSame(Version.HTTP_1_1, Version.parse(" http/1.1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownVersion() {
        Version.parse("HTTP/2.0");
    }

    @Test
    public void testMethods() {
        Set<String> seen = new HashSet<>();
        for (Method m : Method.values()) {
            String s = HttpDefs.methodString(m);
            assertFalse(m.name(), s.isEmpty());
            assertTrue("Duplicate " + s, seen.add(s));
            assertEquals(s, m.toString());
            assertSame(m, Method.valueOf((CharSequence) s));
            assertSame(m, Method.get(m.toHttpMethod()));
            assertEquals(s, m.toHttpMethod().name());
        }
        assertEquals("GET", HttpDefs.methodString(Method.GET));
        assertSame(Method.PROPFIND, Method.get(HttpMethod.valueOf("PROPFIND")));
    }

    @Test
    public void testCodes() {
        assertEquals("OK", HttpDefs.codeString(Code.OK));
        assertEquals("Not Found", HttpDefs.codeString(Code.NOT_FOUND));
        assertEquals("I'm a teapot", HttpDefs.codeString(Code.I_AM_A_TEAPOT));
        assertEquals("", HttpDefs.codeString(Code.NO_RESPONSE));
        assertEquals("", HttpDefs.codeString(Code.CLIENT_CLOSED_REQUEST));
        assertEquals("", Code.NO_RESPONSE.toString());
        assertFalse(Code.NO_RESPONSE.hasReason());
        assertEquals("Service Unavailable", HttpDefs.codeString(503));
        assertEquals("", HttpDefs.codeString(599));
        Set<Integer> seen = new HashSet<>();
        for (Code c : Code.values()) {
            assertTrue("Duplicate " + c.code(), seen.add(c.code()));
            assertSame(c, Code.forCode(c.code()));
            assertEquals(c.code(), c.toStatus().code());
            assertEquals(c.reason(), c.toStatus().reasonPhrase());
            assertTrue(c.code() >= 100 && c.code() < 600);
        }
        assertNull(Code.forCode(299));
        assertSame(Code.NOT_MODIFIED, Code.get(HttpResponseStatus.NOT_MODIFIED));
        assertSame(Code.OK, Code.get(HttpResponseStatus.valueOf(200)));
        assertEquals(HttpVersion.HTTP_1_0, Version.HTTP_1_0.toHttpVersion());
    }
}
