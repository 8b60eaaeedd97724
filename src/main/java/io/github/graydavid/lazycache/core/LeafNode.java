/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.Objects;

/** A node wrapping a raw input value with no dependencies. */
public final class LeafNode extends Node {
    private final Object value;
    private final boolean immutableByValue;
    private final boolean owned;
    private final Digest hash;

    LeafNode(ConstructionContext context, Object value, boolean own) {
        super(context);
        this.value = Objects.requireNonNull(value);
        this.immutableByValue = context.getValueKinds().isImmutableByValue(value);
        this.owned = own || immutableByValue;
        this.hash = context.getContentHasher().hash(value);
    }

    public Object getValue() {
        return value;
    }

    public boolean isImmutableByValue() {
        return immutableByValue;
    }

    /**
     * Answers whether the graph owns this leaf's value: either the creator explicitly marked it as owned or the value
     * is immutable by value, so nobody else can change it.
     */
    public boolean isOwned() {
        return owned;
    }

    @Override
    public Digest getHash() {
        return hash;
    }
}
