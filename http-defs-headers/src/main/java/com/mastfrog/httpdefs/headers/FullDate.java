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

import com.mastfrog.util.preconditions.Checks;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An HTTP-date: an instant with whole-second precision, which can be parsed
 * from any of the RFC 1123, RFC 850, asctime or epoch-seconds forms, and
 * written back out in any of the textual ones.
 * <p>
 * Immutable.
 *
 * @author Tim Boudreau
 */
public final class FullDate implements Comparable<FullDate> {

    private static final Logger LOG = Logger.getLogger(FullDate.class.getName());
    private final Instant instant;

    private FullDate(Instant instant) {
        this.instant = instant.truncatedTo(ChronoUnit.SECONDS);
    }

    public static FullDate of(Instant instant) {
        return new FullDate(Checks.notNull("instant", instant));
    }

    public static FullDate ofEpochSecond(long seconds) {
        return new FullDate(Instant.ofEpochSecond(seconds));
    }

    public static FullDate now() {
        return now(Clock.systemUTC());
    }

    public static FullDate now(Clock clock) {
        return new FullDate(Checks.notNull("clock", clock).instant());
    }

    /**
     * Parse an HTTP-date, trying RFC 1123 (including its dash-separated
     * variant), RFC 850, asctime and epoch seconds, in that order.
     *
     * @param text The header value
     * @return A date
     * @throws InvalidDateFormatException if no grammar matches
     */
    public static FullDate parse(CharSequence text) {
        Checks.notNull("text", text);
        Optional<Instant> result = DateRecognizer.recognizeAny(text);
        if (!result.isPresent()) {
            LOG.log(Level.FINE, "Failed parsing date: {0}", text);
            throw new InvalidDateFormatException(text.toString());
        }
        return new FullDate(result.get());
    }

    /**
     * Parse an HTTP-date, returning empty rather than failing if the text
     * does not match any grammar.
     *
     * @param text The header value
     * @return A date, if one could be parsed
     */
    public static Optional<FullDate> tryParse(CharSequence text) {
        Checks.notNull("text", text);
        return DateRecognizer.recognizeAny(text).map(FullDate::new);
    }

    public Instant instant() {
        return instant;
    }

    public long epochSecond() {
        return instant.getEpochSecond();
    }

    /**
     * Format this date, using the system default time zone for the
     * formats which include a zone name.
     *
     * @param format The output grammar
     * @return A string
     */
    public String format(DateFormat format) {
        return format(format, ZoneId.systemDefault());
    }

    /**
     * Format this date.
     *
     * @param format The output grammar
     * @param zone The zone to render RFC1123 and RFC850 dates in; ignored by
     * RFC1123_GMT and ASC_TIME, which are always UTC. If the zone's short
     * name at this instant is not one of the fixed-offset names an HTTP-date
     * may carry (GMT, UT, UTC and the US zones), the date is written in GMT
     * instead, so the output always parses back to this instant
     * @return A string
     */
    public String format(DateFormat format, ZoneId zone) {
        Checks.notNull("format", format);
        Checks.notNull("zone", zone);
        switch (format) {
            case RFC1123:
                return formatZoned(DateFormats.RFC_1123_PRINTER, zone);
            case RFC1123_GMT:
                return DateFormats.RFC_1123_GMT_PRINTER.format(instant);
            case RFC850:
                return formatZoned(DateFormats.RFC_850_PRINTER, zone);
            case ASC_TIME:
                return DateFormats.ASC_TIME_PRINTER.format(instant);
            default:
                throw new AssertionError(format);
        }
    }

    private String formatZoned(DateTimeFormatter printer, ZoneId zone) {
        ZonedDateTime when = instant.atZone(zone);
        ZoneAbbreviation abbreviation = ZoneAbbreviation.forZone(when);
        if (abbreviation == null) {
            // Only names which parse back to the same offset are written
            when = instant.atZone(ZoneOffset.UTC);
            abbreviation = ZoneAbbreviation.GMT;
        }
        return printer.format(when) + abbreviation.name();
    }

    /**
     * Append the formatted date to an output.
     *
     * @param <A> The type of output
     * @param out The output
     * @param format The output grammar
     * @return The output
     * @throws IOException if the output does
     */
    public <A extends Appendable> A write(A out, DateFormat format) throws IOException {
        Checks.notNull("out", out);
        out.append(format(format));
        return out;
    }

    @Override
    public int compareTo(FullDate o) {
        return instant.compareTo(o.instant);
    }

    @Override
    public boolean equals(Object o) {
        return o == this || (o instanceof FullDate && ((FullDate) o).instant.equals(instant));
    }

    @Override
    public int hashCode() {
        return instant.hashCode();
    }

    @Override
    public String toString() {
        return format(DateFormat.RFC1123_GMT);
    }
}
