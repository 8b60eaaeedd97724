/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.Objects;

/**
 * A node in a lazy expression graph: either a {@link LeafNode} wrapping a raw value or an {@link OperationNode}
 * applying an Operation to earlier nodes. Nodes are immutable after construction.
 *
 * Every node carries two pieces of identity:<br>
 * 1. A content hash, derived purely from the node's content (a leaf's value, or an operation's identity plus its
 * arguments' hashes). Structurally identical subexpressions have equal hashes, which makes the hash a suitable key for
 * external memoizing caches.<br>
 * 2. A construction stamp, drawn from the node's {@link ConstructionContext} when the node is created. Stamps are
 * unique within a context and increase in creation order. They decide the order in which a {@link Program} evaluates
 * and prints nodes, and, because they're unique, they also serve as the node's identity within its context: two nodes
 * are the same node if and only if they share a context and a stamp.
 *
 * Nodes can only be created through {@link ConstructionContext#newLeaf(Object, boolean)} and
 * {@link ConstructionContext#newOperation(Operation, java.util.List)}.
 */
public abstract class Node {
    private final ConstructionContext context;
    private final long stamp;

    Node(ConstructionContext context) {
        this.context = Objects.requireNonNull(context);
        this.stamp = context.nextStamp();
    }

    public final ConstructionContext getContext() {
        return context;
    }

    /** The construction stamp allocated to this node when it was created. */
    public final long getStamp() {
        return stamp;
    }

    /** The content hash of this node. */
    public abstract Digest getHash();

    /** Answers whether this node is a same-context node with the same stamp as other. */
    public final boolean isSameNodeAs(Node other) {
        return context == other.context && stamp == other.stamp;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(stamp=" + stamp + ", hash=" + getHash().toHexPrefix(3) + ")";
    }
}
