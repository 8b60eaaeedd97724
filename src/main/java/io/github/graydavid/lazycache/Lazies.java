/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache;

import io.github.graydavid.lazycache.core.ConstructionContext;
import io.github.graydavid.lazycache.core.Digest;

/**
 * Convenience entry points working against {@link ConstructionContext#shared()}. Callers that want isolated stamp
 * sequences or custom ValueKinds should create their own ConstructionContext and use
 * {@link Lazy#wrap(ConstructionContext, Object, boolean)} instead.
 */
public class Lazies {
    private Lazies() {}

    /** Wraps value, unowned, in the shared context. Returns value itself if it's already a Lazy. */
    public static Lazy lazy(Object value) {
        return Lazy.wrap(ConstructionContext.shared(), value, false);
    }

    /** Wraps value in the shared context. Returns value itself if it's already a Lazy. */
    public static Lazy lazy(Object value, boolean own) {
        return Lazy.wrap(ConstructionContext.shared(), value, own);
    }

    public static Digest secureHash(Lazy lazy) {
        return lazy.secureHash();
    }

    public static String trace(Lazy lazy) {
        return lazy.toString();
    }

    /** Computes value if it's a Lazy; otherwise returns value unchanged. */
    public static Object compute(Object value) {
        if (value instanceof Lazy) {
            return ((Lazy) value).compute();
        }
        return value;
    }
}
