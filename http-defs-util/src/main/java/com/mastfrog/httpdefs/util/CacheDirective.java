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
import com.mastfrog.util.strings.Strings;
import java.time.Duration;
import java.util.Objects;

/**
 * One directive of a Cache-Control header, such as <code>no-cache</code> or
 * <code>max-age=3600</code>. Only the kinds for which
 * {@link CacheDirectiveKind#takesValue()} is true carry a duration; for every
 * other kind any duration passed to the constructor is ignored. Directives
 * of kind EXT are created with {@link #extension(CharSequence)}.
 * <p>
 * Instances are immutable.
 *
 * @author Tim Boudreau
 */
public final class CacheDirective {

    private final CacheDirectiveKind kind;
    private final long seconds;
    private final String extension;

    public CacheDirective(CacheDirectiveKind kind) {
        this(kind, Duration.ZERO);
    }

    public CacheDirective(CacheDirectiveKind kind, Duration delta) {
        this.kind = Checks.notNull("kind", kind);
        Checks.notNull("delta", delta);
        if (kind == CacheDirectiveKind.EXT) {
            throw new IllegalArgumentException("Extension directives have no "
                    + "fixed token; use CacheDirective.extension()");
        }
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Negative delta for " + kind
                    + ": " + delta);
        }
        this.seconds = kind.takesValue ? delta.getSeconds() : 0;
        this.extension = null;
    }

    private CacheDirective(String extension) {
        this.kind = CacheDirectiveKind.EXT;
        this.seconds = 0;
        this.extension = extension;
    }

    /**
     * Create a directive for a token this library does not model, which
     * is preserved verbatim.
     *
     * @param token The directive text
     * @return A directive of kind EXT
     */
    public static CacheDirective extension(CharSequence token) {
        Checks.notNull("token", token);
        CharSequence trimmed = Strings.trim(token);
        if (trimmed.length() == 0) {
            throw new IllegalArgumentException("Empty extension directive");
        }
        return new CacheDirective(trimmed.toString());
    }

    public CacheDirectiveKind kind() {
        return kind;
    }

    public boolean hasDelta() {
        return kind.takesValue;
    }

    /**
     * Get the duration argument of this directive.
     *
     * @return The duration
     * @throws IllegalStateException if this kind of directive does not take
     * a duration - calling this for such a directive is a bug in the caller
     */
    public Duration delta() {
        switch (kind) {
            case MAX_AGE:
            case S_MAXAGE:
            case MAX_STALE:
            case MIN_FRESH:
                return Duration.ofSeconds(seconds);
            default:
                throw new IllegalStateException("Invalid operation on cache "
                        + "directive " + this);
        }
    }

    /**
     * Parse a single directive, e.g. <code>max-age=60</code>. Names that
     * do not match a known kind produce an EXT directive.
     *
     * @param text The directive text
     * @return A directive
     * @throws IllegalArgumentException if a duration-bearing directive has
     * a missing or malformed number
     */
    public static CacheDirective parse(CharSequence text) {
        Checks.notNull("text", text);
        CharSequence trimmed = Strings.trim(text);
        int eq = Strings.indexOf('=', trimmed);
        CharSequence name = eq < 0 ? trimmed : Strings.trim(trimmed.subSequence(0, eq));
        CacheDirectiveKind kind = CacheDirectiveKind.find(name);
        if (kind == null) {
            return extension(trimmed);
        }
        if (!kind.takesValue) {
            return new CacheDirective(kind);
        }
        if (eq < 0) {
            throw new IllegalArgumentException(kind + " requires a value: '"
                    + text + "'");
        }
        CharSequence num = Strings.trim(trimmed.subSequence(eq + 1, trimmed.length()));
        // Quoted values are permitted by the grammar, if rare
        if (num.length() >= 2 && num.charAt(0) == '"' && num.charAt(num.length() - 1) == '"') {
            num = num.subSequence(1, num.length() - 1);
        }
        long value = Strings.parseLong(num);
        if (value < 0) {
            throw new IllegalArgumentException("Negative value for " + kind
                    + ": '" + text + "'");
        }
        return new CacheDirective(kind, Duration.ofSeconds(value));
    }

    @Override
    public String toString() {
        if (kind == CacheDirectiveKind.EXT) {
            return extension;
        } else if (kind.takesValue) {
            return kind + "=" + seconds;
        } else {
            return kind.toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        } else if (!(o instanceof CacheDirective)) {
            return false;
        }
        CacheDirective other = (CacheDirective) o;
        return other.kind == kind && other.seconds == seconds
                && Objects.equals(other.extension, extension);
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 23 * hash + kind.hashCode();
        hash = 23 * hash + (int) (seconds ^ (seconds >>> 32));
        hash = 23 * hash + Objects.hashCode(extension);
        return hash;
    }
}
