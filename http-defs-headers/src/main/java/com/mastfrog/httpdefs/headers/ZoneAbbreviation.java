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

import com.mastfrog.util.strings.Strings;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * The zone names an HTTP-date may carry, each with a fixed offset. RFC 822
 * defines exactly these; region names such as <code>IST</code> or a
 * <code>CST</code> meaning China are not recognized, since they are
 * ambiguous.
 *
 * @author Tim Boudreau
 */
enum ZoneAbbreviation {
    GMT(0),
    UT(0),
    UTC(0),
    EST(-5),
    EDT(-4),
    CST(-6),
    CDT(-5),
    MST(-7),
    MDT(-6),
    PST(-8),
    PDT(-7);

    private static final DateTimeFormatter SHORT_ZONE_NAME
            = DateTimeFormatter.ofPattern("zzz", Locale.US);
    private final ZoneOffset offset;

    ZoneAbbreviation(int hours) {
        this.offset = ZoneOffset.ofHours(hours);
    }

    ZoneOffset offset() {
        return offset;
    }

    /**
     * Look up a zone token, ignoring case.
     *
     * @param token The text following the time
     * @return The abbreviation or null
     */
    static ZoneAbbreviation find(CharSequence token) {
        for (ZoneAbbreviation z : values()) {
            if (Strings.charSequencesEqual(z.name(), token, true)) {
                return z;
            }
        }
        return null;
    }

    /**
     * Find the abbreviation the zone uses for itself at that moment, if it is
     * one of these and means the same offset. America/Chicago in winter is
     * CST; Asia/Shanghai, whose short name is also CST, is not.
     *
     * @param when A time in some zone
     * @return The abbreviation, or null if printing one would not parse back
     * to the same instant
     */
    static ZoneAbbreviation forZone(ZonedDateTime when) {
        ZoneAbbreviation result = find(SHORT_ZONE_NAME.format(when));
        if (result != null && result.offset.equals(when.getOffset())) {
            return result;
        }
        return null;
    }
}
