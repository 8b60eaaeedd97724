/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.security.MessageDigest;
import java.util.Objects;

/**
 * Describes a category of raw values that can be wrapped in a lazy graph: whether values of the category are
 * immutable by value, how they render in a textual trace, and which bytes represent their content for hashing.
 * ValueKinds are collected in a {@link ValueKinds} registry, which dispatches each raw value to the first registered
 * kind that {@link #accepts(Object)} it.
 *
 * The name of a ValueKind is part of every content hash computed for its values, so two kinds with different names
 * never produce the same hash for otherwise-identical content bytes. Changing a kind's name changes the hashes of all
 * of its values.
 */
public abstract class ValueKind<T> {
    private final String name;
    private final Class<T> valueClass;

    protected ValueKind(String name, Class<T> valueClass) {
        this.name = Names.requireNonBlank(name, "ValueKind");
        this.valueClass = Objects.requireNonNull(valueClass);
    }

    public final String getName() {
        return name;
    }

    public final Class<T> getValueClass() {
        return valueClass;
    }

    /** Answers whether value belongs to this kind. By default, true for all instances of the value class. */
    public boolean accepts(Object value) {
        return valueClass.isInstance(value);
    }

    /**
     * Answers whether value can never change after construction, considering its contents as well as its class.
     *
     * @param kinds the registry that dispatched to this kind, for kinds whose answer depends on their elements.
     */
    public abstract boolean isImmutableByValue(T value, ValueKinds kinds);

    /**
     * Answers whether value is too long to inline in a textual trace even when it's immutable. Only text-like and
     * byte-like kinds ever answer true.
     */
    public boolean isTooLongToInline(T value) {
        return false;
    }

    /** A single-line rendering of value suitable for inlining as an argument in a textual trace. */
    public String literal(T value, ValueKinds kinds) {
        return String.valueOf(value);
    }

    /**
     * A single-line summary of value. Defaults to {@link #literal(Object, ValueKinds)}; large or buffer-like kinds
     * should summarize (e.g. by shape) rather than print contents.
     */
    public String shortDescription(T value, ValueKinds kinds) {
        return literal(value, kinds);
    }

    /**
     * Feeds the bytes representing value's content into digest. Buffer-like kinds must feed their element bytes, never
     * anything derived from object identity.
     *
     * @param elementHasher the hasher to use for any nested elements of value.
     */
    public abstract void writeContent(T value, MessageDigest digest, ContentHasher elementHasher);

    @Override
    public String toString() {
        return name;
    }
}
