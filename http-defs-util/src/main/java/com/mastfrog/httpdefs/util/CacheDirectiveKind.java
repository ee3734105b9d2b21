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

import com.mastfrog.util.strings.Strings;

/**
 * Enum of valid values for cache control. Exactly four kinds take a number
 * of seconds as an argument.
 *
 * @author Tim Boudreau
 */
public enum CacheDirectiveKind {
    PUBLIC, PRIVATE, NO_CACHE, NO_STORE,
    MAX_AGE(true), S_MAXAGE(true), MAX_STALE(true), MIN_FRESH(true),
    NO_TRANSFORM, ONLY_IF_CACHED, MUST_REVALIDATE, PROXY_REVALIDATE,
    IMMUTABLE,
    // Placeholder for extension tokens, which have no fixed name
    EXT;

    final boolean takesValue;
    private final String token;

    CacheDirectiveKind(boolean takesValue) {
        this.takesValue = takesValue;
        char[] c = name().toLowerCase().toCharArray();
        for (int i = 0; i < c.length; i++) {
            if (c[i] == '_') {
                c[i] = '-';
            }
        }
        token = new String(c);
    }

    CacheDirectiveKind() {
        this(false);
    }

    public boolean takesValue() {
        return takesValue;
    }

    @Override
    public String toString() {
        return token;
    }

    /**
     * Find the kind whose token exactly matches (case-insensitively) the
     * passed name. Never returns EXT.
     *
     * @param name A directive name without any <code>=value</code> part
     * @return A kind or null
     */
    public static CacheDirectiveKind find(CharSequence name) {
        for (CacheDirectiveKind c : values()) {
            if (c != EXT && Strings.charSequencesEqual(name, c.token, true)) {
                return c;
            }
        }
        return null;
    }
}
