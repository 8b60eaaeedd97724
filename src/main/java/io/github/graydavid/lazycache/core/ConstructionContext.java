/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The state shared by every node in a family of lazy graphs: the construction stamp counter, plus the ValueKinds and
 * ContentHasher used to classify and hash leaf values. Nodes are created through a context and can only use nodes from
 * the same context as arguments, since stamps from different contexts aren't comparable.
 *
 * The stamp counter starts at zero, is never reset, and is incremented atomically, so nodes may be created from
 * multiple threads while still receiving strictly ordered, unique stamps.
 */
public class ConstructionContext {
    private static final ConstructionContext SHARED = builder().build();

    private final AtomicLong nextStamp = new AtomicLong();
    private final ValueKinds valueKinds;
    private final ContentHasher contentHasher;

    private ConstructionContext(Builder builder) {
        this.valueKinds = builder.valueKinds;
        this.contentHasher = (builder.contentHasher == null) ? Sha256ContentHasher.from(valueKinds)
                : builder.contentHasher;
    }

    /**
     * The process-wide context, with standard ValueKinds and a SHA-256 content hasher. Used by the convenience methods
     * that don't take a context explicitly.
     */
    public static ConstructionContext shared() {
        return SHARED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ValueKinds getValueKinds() {
        return valueKinds;
    }

    public ContentHasher getContentHasher() {
        return contentHasher;
    }

    /** The stamp that the next node created in this context will receive. */
    public long peekNextStamp() {
        return nextStamp.get();
    }

    long nextStamp() {
        return nextStamp.getAndIncrement();
    }

    /**
     * Creates a new leaf node wrapping value.
     *
     * @param own whether the caller hands ownership of value to the graph. Leaves of immutable values are always owned.
     * @throws NullPointerException if value is null.
     * @throws UnhashableValueException if this context's ContentHasher can't hash value.
     */
    public LeafNode newLeaf(Object value, boolean own) {
        return new LeafNode(this, value, own);
    }

    /**
     * Creates a new node applying operation to arguments, in order.
     *
     * @throws IllegalArgumentException if any argument belongs to a different context.
     */
    public OperationNode newOperation(Operation operation, List<? extends Node> arguments) {
        return new OperationNode(this, operation, arguments);
    }

    @Override
    public String toString() {
        return "ConstructionContext@" + Integer.toHexString(System.identityHashCode(this)) + "(nextStamp="
                + nextStamp.get() + ")";
    }

    /** Configures a new ConstructionContext. */
    public static class Builder {
        private ValueKinds valueKinds = ValueKinds.standard();
        private ContentHasher contentHasher;

        private Builder() {}

        /** The registry used to classify leaf values. Defaults to {@link ValueKinds#standard()}. */
        public Builder valueKinds(ValueKinds valueKinds) {
            this.valueKinds = Objects.requireNonNull(valueKinds);
            return this;
        }

        /** The hasher used for leaf values. Defaults to a {@link Sha256ContentHasher} over the valueKinds. */
        public Builder contentHasher(ContentHasher contentHasher) {
            this.contentHasher = Objects.requireNonNull(contentHasher);
            return this;
        }

        public ConstructionContext build() {
            return new ConstructionContext(this);
        }
    }
}
