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

/**
 * Canonical wire text for the protocol enums.
 *
 * @author Tim Boudreau
 */
public final class HttpDefs {

    private HttpDefs() {
        throw new AssertionError();
    }

    /**
     * Get the protocol token for a version, as used in request and status
     * lines.
     *
     * @param version A version
     * @return The token, e.g. <code>HTTP/1.1</code>
     */
    public static String versionString(Version version) {
        return Checks.notNull("version", version).toString();
    }

    public static String methodString(Method method) {
        return Checks.notNull("method", method).toString();
    }

    /**
     * Get the reason phrase for a status code. Extension codes with no
     * registered phrase produce the empty string rather than failing.
     *
     * @param code A code
     * @return A reason phrase or the empty string
     */
    public static String codeString(Code code) {
        return Checks.notNull("code", code).reason();
    }

    /**
     * Get the reason phrase for a raw numeric status code, or the empty
     * string if it is not one of the modeled codes.
     *
     * @param code A numeric status code
     * @return A reason phrase or the empty string
     */
    public static String codeString(int code) {
        Code c = Code.forCode(code);
        return c == null ? "" : c.reason();
    }
}
