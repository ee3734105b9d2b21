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
import com.mastfrog.util.preconditions.Checks;
import com.mastfrog.util.strings.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The value of a Cache-Control header - an ordered set of directives, with
 * at most one directive of each kind (extension directives excepted).
 *
 * @author Tim Boudreau
 */
public final class CacheControl {

    private static final Logger LOG = Logger.getLogger(CacheControl.class.getName());
    private final List<CacheDirective> entries = new ArrayList<>();
    private boolean shared;
    public static final CacheControl PUBLIC
            = new CacheControl(CacheDirectiveKind.PUBLIC).share();
    public static final CacheControl PUBLIC_MUST_REVALIDATE
            = new CacheControl(CacheDirectiveKind.PUBLIC, MUST_REVALIDATE).share();
    public static final CacheControl PUBLIC_MUST_REVALIDATE_MAX_AGE_1_DAY
            = new CacheControl(CacheDirectiveKind.PUBLIC, MUST_REVALIDATE).add(MAX_AGE, Duration.ofDays(1)).share();
    public static final CacheControl PRIVATE_NO_CACHE_NO_STORE
            = new CacheControl(PRIVATE, NO_CACHE, NO_STORE).share();
    public static final CacheControl PUBLIC_IMMUTABLE
            = new CacheControl(CacheDirectiveKind.PUBLIC, IMMUTABLE).share();
    public static final CacheControl PUBLIC_MAX_AGE_TEN_YEARS
            = new CacheControl(CacheDirectiveKind.PUBLIC).add(MAX_AGE, Duration.ofDays(10 * 365)).share();

    public CacheControl(CacheDirectiveKind... types) {
        add(types);
    }

    private CacheControl share() {
        shared = true;
        return this;
    }

    /**
     * Whether this instance may be added to. The constants on this class are
     * shared by every caller and cannot be; use {@link #copy()} to start from
     * one of them.
     *
     * @return true unless this is one of the shared constants
     */
    public boolean isModifiable() {
        return !shared;
    }

    /**
     * Create a modifiable copy of this instance, with the same directives in
     * the same order.
     *
     * @return A new CacheControl
     */
    public CacheControl copy() {
        CacheControl result = new CacheControl();
        result.entries.addAll(entries);
        return result;
    }

    public CacheControl add(CacheDirectiveKind... types) {
        for (CacheDirectiveKind type : Checks.notNull("types", types)) {
            if (type.takesValue) {
                throw new IllegalArgumentException(type + " requires a value");
            }
            add(new CacheDirective(type));
        }
        return this;
    }

    public CacheControl add(CacheDirectiveKind type, Duration value) {
        Checks.notNull("type", type);
        if (!type.takesValue) {
            throw new IllegalArgumentException(type + " does not take a value");
        }
        return add(new CacheDirective(type, value));
    }

    /**
     * Add a directive, replacing any existing directive of the same kind.
     *
     * @param directive A directive
     * @return this
     * @throws UnsupportedOperationException if called on one of the shared
     * constants
     */
    public CacheControl add(CacheDirective directive) {
        Checks.notNull("directive", directive);
        if (shared) {
            throw new UnsupportedOperationException("Cannot add " + directive
                    + " to the shared instance '" + this + "'; use copy()");
        }
        if (directive.kind() != EXT) {
            for (Iterator<CacheDirective> it = entries.iterator(); it.hasNext();) {
                if (it.next().kind() == directive.kind()) {
                    it.remove();
                }
            }
        } else if (entries.contains(directive)) {
            return this;
        }
        entries.add(directive);
        return this;
    }

    public boolean contains(CacheDirectiveKind type) {
        for (CacheDirective e : entries) {
            if (e.kind() == type) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get the duration for a duration-bearing kind.
     *
     * @param type A kind which takes a value
     * @return The duration, or null if this header does not contain it
     */
    public Duration get(CacheDirectiveKind type) {
        if (!Checks.notNull("type", type).takesValue) {
            throw new IllegalArgumentException(type + " does not take a value");
        }
        for (CacheDirective e : entries) {
            if (e.kind() == type) {
                return e.delta();
            }
        }
        return null;
    }

    public List<CacheDirective> directives() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public int hashCode() {
        int result = 7;
        for (CacheDirective e : entries) {
            result += 79 * e.hashCode();
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof CacheControl) {
            return new HashSet<>(entries).equals(new HashSet<>(((CacheControl) o).entries));
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Iterator<CacheDirective> it = entries.iterator(); it.hasNext();) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.toString();
    }

    /**
     * Parse a Cache-Control header value. Directives with malformed numbers
     * are logged and skipped rather than failing the whole header.
     *
     * @param s The header value
     * @return A CacheControl, possibly empty
     */
    public static CacheControl fromString(CharSequence s) {
        Checks.notNull("s", s);
        CacheControl result = new CacheControl();
        for (CharSequence part : Strings.split(',', s)) {
            part = Strings.trim(part);
            if (part.length() == 0) {
                continue;
            }
            try {
                CacheDirective dir = CacheDirective.parse(part);
                if (dir.kind() == EXT) {
                    LOG.log(Level.FINE, "Unrecognized cache directive ''{0}''", part);
                }
                result.add(dir);
            } catch (IllegalArgumentException ex) {
                LOG.log(Level.FINE, "Bad cache directive '" + part + "'", ex);
            }
        }
        return result;
    }
}
