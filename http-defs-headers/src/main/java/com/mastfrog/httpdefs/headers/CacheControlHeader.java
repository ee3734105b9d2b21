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
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.util.AsciiString;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * The Cache-Control header. The text of the shared, unmodifiable
 * CacheControl constants is rendered once; any other value is rendered on
 * each write.
 *
 * @author Tim Boudreau
 */
final class CacheControlHeader extends NamedHeader<CacheControl> {

    private static final Map<CacheControl, AsciiString> RENDERED_CONSTANTS
            = renderConstants(CacheControl.PUBLIC, CacheControl.PUBLIC_MUST_REVALIDATE,
                    CacheControl.PUBLIC_MUST_REVALIDATE_MAX_AGE_1_DAY,
                    CacheControl.PRIVATE_NO_CACHE_NO_STORE, CacheControl.PUBLIC_IMMUTABLE,
                    CacheControl.PUBLIC_MAX_AGE_TEN_YEARS);

    CacheControlHeader() {
        super(CacheControl.class, HttpHeaderNames.CACHE_CONTROL);
    }

    private static Map<CacheControl, AsciiString> renderConstants(CacheControl... constants) {
        // Never written after class init
        Map<CacheControl, AsciiString> result = new IdentityHashMap<>(constants.length);
        for (CacheControl cc : constants) {
            if (cc.isModifiable()) {
                throw new IllegalStateException("Not a shared constant: " + cc);
            }
            result.put(cc, AsciiString.of(cc.toString()));
        }
        return result;
    }

    @Override
    CharSequence render(CacheControl value) {
        if (!value.isModifiable()) {
            AsciiString cached = RENDERED_CONSTANTS.get(value);
            if (cached != null) {
                return cached;
            }
        }
        return AsciiString.of(value.toString());
    }

    @Override
    CacheControl interpret(CharSequence text) {
        return CacheControl.fromString(text);
    }
}
