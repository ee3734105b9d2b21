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

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import static java.time.temporal.ChronoField.DAY_OF_MONTH;
import static java.time.temporal.ChronoField.DAY_OF_WEEK;
import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.MONTH_OF_YEAR;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;
import static java.time.temporal.ChronoField.YEAR;
import java.util.Locale;

/**
 * The formatters for the HTTP-date grammars. Parsers accept one or two digit
 * days and are case-insensitive; printers always emit the canonical form.
 * Two-digit years resolve into 1950-2049. Four-digit years may be longer, up
 * to the largest year a LocalDateTime holds, so that anything printed parses
 * back; years before 0000 are printed with a sign and do not.
 * <p>
 * The zone-bearing parsers stop after the seconds: the zone token is resolved
 * against the fixed offsets in {@link ZoneAbbreviation}, never against the
 * region zones java.time would pick.
 *
 * @author Tim Boudreau
 */
final class DateFormats {

    static final int TWO_DIGIT_YEAR_BASE = 1950;

    private DateFormats() {
        throw new AssertionError();
    }

    /**
     * <code>Mon, 02 Jan 2006 15:04:05 GMT</code>
     */
    static final DateTimeFormatter RFC_1123_PARSER
            = new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendText(DAY_OF_WEEK, TextStyle.SHORT).appendLiteral(", ")
                    .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE).appendLiteral(' ')
                    .appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral(' ')
                    .appendValue(YEAR, 4, 10, SignStyle.NOT_NEGATIVE).appendLiteral(' ')
                    .append(time())
                    .toFormatter(Locale.US).withResolverStyle(ResolverStyle.STRICT);

    /**
     * <code>Mon, 02-Jan-06 15:04:05 GMT</code> or
     * <code>Mon, 02-Jan-2006 15:04:05 GMT</code>, as sent in cookie expiry
     * dates by some large sites.
     */
    static final DateTimeFormatter RFC_1123_DASHED_PARSER
            = new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendText(DAY_OF_WEEK, TextStyle.SHORT).appendLiteral(", ")
                    .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE).appendLiteral('-')
                    .appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral('-')
                    .appendValueReduced(YEAR, 2, 4, TWO_DIGIT_YEAR_BASE).appendLiteral(' ')
                    .append(time())
                    .toFormatter(Locale.US).withResolverStyle(ResolverStyle.STRICT);

    /**
     * <code>Monday, 02-Jan-06 15:04:05 GMT</code>
     */
    static final DateTimeFormatter RFC_850_PARSER
            = new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendText(DAY_OF_WEEK, TextStyle.FULL).appendLiteral(", ")
                    .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE).appendLiteral('-')
                    .appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral('-')
                    .appendValueReduced(YEAR, 2, 2, TWO_DIGIT_YEAR_BASE).appendLiteral(' ')
                    .append(time())
                    .toFormatter(Locale.US).withResolverStyle(ResolverStyle.STRICT);

    /**
     * <code>Mon Jan 2 15:04:05 2006</code>, after whitespace runs have been
     * collapsed.
     */
    static final DateTimeFormatter ASC_TIME_PARSER
            = new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendText(DAY_OF_WEEK, TextStyle.SHORT).appendLiteral(' ')
                    .appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral(' ')
                    .appendValue(DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE).appendLiteral(' ')
                    .append(time())
                    .appendLiteral(' ').appendValue(YEAR, 4, 10, SignStyle.NOT_NEGATIVE)
                    .toFormatter(Locale.US).withResolverStyle(ResolverStyle.STRICT);

    /**
     * Everything up to the zone name, which is appended separately from
     * {@link ZoneAbbreviation}.
     */
    static final DateTimeFormatter RFC_1123_PRINTER = rfc1123DatePrefix();

    static final DateTimeFormatter RFC_1123_GMT_PRINTER
            = new DateTimeFormatterBuilder()
                    .append(rfc1123DatePrefix())
                    .appendLiteral("GMT")
                    .toFormatter(Locale.US).withZone(ZoneOffset.UTC);

    static final DateTimeFormatter RFC_850_PRINTER
            = new DateTimeFormatterBuilder()
                    .appendText(DAY_OF_WEEK, TextStyle.FULL).appendLiteral(", ")
                    .appendValue(DAY_OF_MONTH, 2).appendLiteral('-')
                    .appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral('-')
                    .appendValueReduced(YEAR, 2, 2, TWO_DIGIT_YEAR_BASE).appendLiteral(' ')
                    .append(time())
                    .appendLiteral(' ')
                    .toFormatter(Locale.US);

    /**
     * <code>Mon Jan  2 15:04:05 2006</code> - the day is space-padded; always
     * printed in UTC since the grammar has no zone.
     */
    static final DateTimeFormatter ASC_TIME_PRINTER
            = new DateTimeFormatterBuilder()
                    .appendText(DAY_OF_WEEK, TextStyle.SHORT).appendLiteral(' ')
                    .appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral(' ')
                    .padNext(2).appendValue(DAY_OF_MONTH).appendLiteral(' ')
                    .append(time())
                    .appendLiteral(' ').appendValue(YEAR, 4, 10, SignStyle.NORMAL)
                    .toFormatter(Locale.US).withZone(ZoneOffset.UTC);

    private static DateTimeFormatter rfc1123DatePrefix() {
        return new DateTimeFormatterBuilder()
                .appendText(DAY_OF_WEEK, TextStyle.SHORT).appendLiteral(", ")
                .appendValue(DAY_OF_MONTH, 2).appendLiteral(' ')
                .appendText(MONTH_OF_YEAR, TextStyle.SHORT).appendLiteral(' ')
                .appendValue(YEAR, 4, 10, SignStyle.NORMAL).appendLiteral(' ')
                .append(time())
                .appendLiteral(' ')
                .toFormatter(Locale.US);
    }

    private static DateTimeFormatter time() {
        return new DateTimeFormatterBuilder()
                .appendValue(HOUR_OF_DAY, 2).appendLiteral(':')
                .appendValue(MINUTE_OF_HOUR, 2).appendLiteral(':')
                .appendValue(SECOND_OF_MINUTE, 2)
                .toFormatter(Locale.US);
    }
}
