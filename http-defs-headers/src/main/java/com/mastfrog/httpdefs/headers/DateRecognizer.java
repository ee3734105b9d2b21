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
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * The grammars an HTTP-date may be written in, in the order they are tried.
 * Each recognizer either matches the whole input or reports failure; none
 * throws on bad input.
 *
 * @author Tim Boudreau
 */
public enum DateRecognizer {

    /**
     * RFC 1123, falling back to the dash-separated variant with a two or
     * four digit year.
     */
    RFC_1123 {
        @Override
        public Optional<Instant> recognize(CharSequence text) {
            String normalized = normalizeWhitespace(text);
            Optional<Instant> result = parseZoned(DateFormats.RFC_1123_PARSER, normalized);
            if (!result.isPresent()) {
                result = parseZoned(DateFormats.RFC_1123_DASHED_PARSER, normalized);
            }
            return result;
        }
    },
    RFC_850 {
        @Override
        public Optional<Instant> recognize(CharSequence text) {
            return parseZoned(DateFormats.RFC_850_PARSER, normalizeWhitespace(text));
        }
    },
    /**
     * ANSI C asctime() format, which has no zone; treated as UTC.
     */
    ASC_TIME {
        @Override
        public Optional<Instant> recognize(CharSequence text) {
            try {
                LocalDateTime ldt = DateFormats.ASC_TIME_PARSER.parse(
                        normalizeWhitespace(text), LocalDateTime::from);
                return Optional.of(ldt.toInstant(ZoneOffset.UTC));
            } catch (DateTimeException ex) {
                return Optional.empty();
            }
        }
    },
    /**
     * Unsigned decimal seconds since the epoch. Values which overflow an
     * unsigned 64-bit integer, or which lie beyond {@link Instant#MAX}, are
     * not recognized.
     */
    EPOCH {
        @Override
        public Optional<Instant> recognize(CharSequence text) {
            int len = text.length();
            if (len == 0) {
                return Optional.empty();
            }
            for (int i = 0; i < len; i++) {
                char c = text.charAt(i);
                if (c < '0' || c > '9') {
                    return Optional.empty();
                }
            }
            long seconds;
            try {
                seconds = Long.parseUnsignedLong(text.toString());
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
            // Above Long.MAX_VALUE wraps negative
            if (seconds < 0 || seconds > Instant.MAX.getEpochSecond()) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochSecond(seconds));
        }
    };

    /**
     * Attempt to match the entire text against this grammar.
     *
     * @param text Header text
     * @return The instant, or empty if the text does not match
     */
    public abstract Optional<Instant> recognize(CharSequence text);

    /**
     * Run every recognizer in order, returning the first match.
     *
     * @param text Header text
     * @return The instant, or empty if no grammar matches
     */
    public static Optional<Instant> recognizeAny(CharSequence text) {
        Checks.notNull("text", text);
        for (DateRecognizer r : values()) {
            Optional<Instant> result = r.recognize(text);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * Parse text whose final space-separated token is a zone name, applying
     * that zone's fixed offset to the local time the formatter reads from
     * the rest.
     */
    static Optional<Instant> parseZoned(DateTimeFormatter fmt, String text) {
        int lastSpace = text.lastIndexOf(' ');
        if (lastSpace < 0) {
            return Optional.empty();
        }
        ZoneAbbreviation zone = ZoneAbbreviation.find(text.substring(lastSpace + 1));
        if (zone == null) {
            return Optional.empty();
        }
        try {
            LocalDateTime local = fmt.parse(text.substring(0, lastSpace), LocalDateTime::from);
            return Optional.of(local.toInstant(zone.offset()));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    /**
     * Trims the text and collapses each run of whitespace into a single
     * space, so <code>Sun Nov  6</code> and <code>Sun Nov 6</code> match the
     * same pattern.
     */
    static String normalizeWhitespace(CharSequence text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean lastWasSpace = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                lastWasSpace = true;
            } else {
                if (lastWasSpace && sb.length() > 0) {
                    sb.append(' ');
                }
                lastWasSpace = false;
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
