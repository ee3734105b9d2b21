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
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * A protocol-level failure which should be turned into an HTTP error
 * response, carrying the numeric status code and a human-readable reason.
 *
 * @author Tim Boudreau
 */
public class HttpError extends RuntimeException {

    private final int code;
    private final String reason;

    public HttpError(Code code, String reason) {
        this(Checks.notNull("code", code).code(), reason);
    }

    public HttpError(int code, String reason) {
        super(code + " " + Checks.notNull("reason", reason));
        Checks.nonNegative("code", code);
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }

    /**
     * Get the status to send, which uses the reason of this error as the
     * reason phrase.
     *
     * @return A status
     */
    public HttpResponseStatus status() {
        return HttpResponseStatus.valueOf(code, reason);
    }

    /**
     * Get the modeled status code, if any.
     *
     * @return A code or null
     */
    public Code toCode() {
        return Code.forCode(code);
    }
}
