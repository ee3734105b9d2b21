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

/**
 * Output grammars for {@link FullDate#format(DateFormat)}. Has no effect on
 * parsing, which always tries every grammar.
 *
 * @author Tim Boudreau
 */
public enum DateFormat {
    /**
     * <code>Mon, 02 Jan 2006 15:04:05 EST</code> - in the zone passed when
     * formatting, or the system default zone.
     */
    RFC1123,
    /**
     * <code>Mon, 02 Jan 2006 15:04:05 GMT</code> - always UTC, independent
     * of the system default zone. The form to send in HTTP headers.
     */
    RFC1123_GMT,
    /**
     * <code>Monday, 02-Jan-06 15:04:05 EST</code>
     */
    RFC850,
    /**
     * <code>Mon Jan  2 15:04:05 2006</code>, in UTC.
     */
    ASC_TIME
}
