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

import static com.mastfrog.httpdefs.util.CacheDirectiveKind.*;
import java.time.Duration;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author Tim Boudreau
 */
public class CacheDirectiveTest {

    @Test
    public void testDelta() {
        assertEquals(Duration.ofSeconds(3600), new CacheDirective(MAX_AGE, Duration.ofSeconds(3600)).delta());
        assertEquals(Duration.ofSeconds(10), new CacheDirective(S_MAXAGE, Duration.ofSeconds(10)).delta());
        assertEquals(Duration.ofMinutes(2), new CacheDirective(MAX_STALE, Duration.ofMinutes(2)).delta());
        assertEquals(Duration.ofDays(1), new CacheDirective(MIN_FRESH, Duration.ofDays(1)).delta());
        assertEquals(Duration.ZERO, new CacheDirective(MAX_AGE).delta());
        // Sub-second parts are dropped
        assertEquals(Duration.ofSeconds(5), new CacheDirective(MAX_AGE, Duration.ofMillis(5999)).delta());
    }

    @Test
    public void testDeltaOfFlagDirectiveFails() {
        for (CacheDirectiveKind kind : CacheDirectiveKind.values()) {
            if (kind == EXT) {
                continue;
            }
            CacheDirective dir = new CacheDirective(kind, Duration.ofSeconds(30));
            assertEquals(kind, dir.kind());
            assertEquals(kind.takesValue(), dir.hasDelta());
            if (kind.takesValue()) {
                assertEquals(Duration.ofSeconds(30), dir.delta());
            } else {
                try {
                    dir.delta();
                    fail("Should not be able to get delta of " + kind);
                } catch (IllegalStateException ex) {
                    // ok
                }
            }
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testNoCacheDelta() {
        new CacheDirective(NO_CACHE).delta();
    }

    @Test
    public void testDurationIgnoredForFlagKinds() {
        assertEquals(new CacheDirective(NO_STORE), new CacheDirective(NO_STORE, Duration.ofHours(3)));
        assertEquals("no-store", new CacheDirective(NO_STORE, Duration.ofHours(3)).toString());
    }

    @Test
    public void testExtensionKindNeedsText() {
        for (Duration d : new Duration[]{Duration.ZERO, Duration.ofSeconds(30)}) {
            try {
                new CacheDirective(EXT, d);
                fail("Should not be able to create an EXT directive without text");
            } catch (IllegalArgumentException ex) {
                // ok
            }
        }
        try {
            new CacheDirective(EXT);
            fail("Should not be able to create an EXT directive without text");
        } catch (IllegalArgumentException ex) {
            // ok
        }
        assertEquals("community=\"UCI\"", CacheDirective.extension(" community=\"UCI\" ").toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDurationRejected() {
        new CacheDirective(MAX_AGE, Duration.ofSeconds(-1));
    }

    @Test
    public void testToString() {
        assertEquals("max-age=3600", new CacheDirective(MAX_AGE, Duration.ofHours(1)).toString());
        assertEquals("s-maxage=0", new CacheDirective(S_MAXAGE).toString());
        assertEquals("must-revalidate", new CacheDirective(MUST_REVALIDATE).toString());
        assertEquals("only-if-cached", new CacheDirective(ONLY_IF_CACHED).toString());
        assertEquals("public", new CacheDirective(PUBLIC).toString());
    }

    @Test
    public void testParse() {
        assertEquals(new CacheDirective(MAX_AGE, Duration.ofSeconds(60)), CacheDirective.parse("max-age=60"));
        assertEquals(new CacheDirective(MAX_AGE, Duration.ofSeconds(60)), CacheDirective.parse(" Max-Age = 60 "));
        assertEquals(new CacheDirective(MAX_AGE, Duration.ofSeconds(60)), CacheDirective.parse("max-age=\"60\""));
        assertEquals(new CacheDirective(NO_CACHE), CacheDirective.parse("no-cache"));
        assertEquals(new CacheDirective(PRIVATE), CacheDirective.parse("PRIVATE"));
        CacheDirective ext = CacheDirective.parse("stale-while-revalidate=30");
        assertEquals(EXT, ext.kind());
        assertEquals("stale-while-revalidate=30", ext.toString());
        assertFalse(ext.hasDelta());
        assertNotEquals(ext, CacheDirective.parse("stale-if-error=30"));
        assertEquals(ext, CacheDirective.extension("stale-while-revalidate=30"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseMissingValue() {
        CacheDirective.parse("max-age");
    }

    @Test(expected = NumberFormatException.class)
    public void testParseBadNumber() {
        CacheDirective.parse("max-age=soon");
    }

    @Test
    public void testKindTokens() {
        for (CacheDirectiveKind kind : CacheDirectiveKind.values()) {
            if (kind != EXT) {
                assertEquals(kind, CacheDirectiveKind.find(kind.toString()));
                assertTrue(kind.toString().equals(kind.toString().toLowerCase()));
            }
        }
        assertEquals(null, CacheDirectiveKind.find("ext"));
        assertEquals(null, CacheDirectiveKind.find("max-ag"));
        assertEquals(null, CacheDirectiveKind.find("max-age-forever"));
    }
}
