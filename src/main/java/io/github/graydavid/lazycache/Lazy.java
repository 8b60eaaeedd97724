/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.github.graydavid.lazycache.core.ConstructionContext;
import io.github.graydavid.lazycache.core.Digest;
import io.github.graydavid.lazycache.core.Evaluator;
import io.github.graydavid.lazycache.core.Node;
import io.github.graydavid.lazycache.core.Operation;
import io.github.graydavid.lazycache.core.TraceFormatter;
import io.github.graydavid.lazycache.operations.ArithmeticOperations;

/**
 * A handle on a lazy value: the root node of a graph describing how to compute the value, without computing it. Lazy
 * values are combined with builder methods like {@link #add(Object)} and {@link #multiply(Object)}, each of which
 * creates a new Lazy around a new operation node; nothing is computed until {@link #compute()}.
 *
 * Every Lazy has a {@link #secureHash()} derived purely from its inputs and the operations applied to them, so
 * structurally identical computations can be recognized (e.g. as cache keys) without running them. When computed, every
 * node in the graph runs at most once, in the order the nodes were constructed.
 *
 * Lazy instances are immutable.
 */
public final class Lazy {
    private final Node root;

    private Lazy(Node root) {
        this.root = Objects.requireNonNull(root);
    }

    /** Wraps an existing node. */
    public static Lazy ofNode(Node root) {
        return new Lazy(root);
    }

    /**
     * Wraps value as a Lazy in context. If value is already a Lazy, it's returned unchanged. Otherwise, a new leaf node
     * is created for it.
     *
     * @param own whether the caller hands ownership of value to the graph, promising not to modify it afterwards.
     *        Immutable values are always owned.
     * @throws NullPointerException if context or value is null.
     * @throws io.github.graydavid.lazycache.core.UnhashableValueException if value can't be hashed.
     */
    public static Lazy wrap(ConstructionContext context, Object value, boolean own) {
        Objects.requireNonNull(context);
        Objects.requireNonNull(value);
        if (value instanceof Lazy) {
            return (Lazy) value;
        }
        return new Lazy(context.newLeaf(value, own));
    }

    /** Same as {@link #wrap(ConstructionContext, Object, boolean)}, except not owning value. */
    public static Lazy wrap(ConstructionContext context, Object value) {
        return wrap(context, value, false);
    }

    public Node getRoot() {
        return root;
    }

    public ConstructionContext getContext() {
        return root.getContext();
    }

    /** The content hash of this value's graph. */
    public Digest secureHash() {
        return root.getHash();
    }

    /**
     * Applies operation to this value followed by others, in order. Non-Lazy arguments are wrapped first, unowned, in
     * this value's context.
     *
     * @throws IllegalArgumentException if any Lazy argument belongs to a different context.
     */
    public Lazy apply(Operation operation, Object... others) {
        Objects.requireNonNull(operation);
        List<Node> arguments = new ArrayList<>(others.length + 1);
        arguments.add(root);
        for (Object other : others) {
            arguments.add(rootOf(other));
        }
        return new Lazy(getContext().newOperation(operation, arguments));
    }

    /** Same as {@link #apply(Operation, Object...)}, except other comes before this value. */
    public Lazy applyReversed(Operation operation, Object other) {
        Objects.requireNonNull(operation);
        return new Lazy(getContext().newOperation(operation, List.of(rootOf(other), root)));
    }

    private Node rootOf(Object value) {
        return wrap(getContext(), value).root;
    }

    /** this + other */
    public Lazy add(Object other) {
        return apply(ArithmeticOperations.ADD, other);
    }

    /** this - other */
    public Lazy subtract(Object other) {
        return apply(ArithmeticOperations.SUBTRACT, other);
    }

    /** this * other */
    public Lazy multiply(Object other) {
        return apply(ArithmeticOperations.MULTIPLY, other);
    }

    /** this / other */
    public Lazy divide(Object other) {
        return apply(ArithmeticOperations.DIVIDE, other);
    }

    /** other + this */
    public Lazy reverseAdd(Object other) {
        return applyReversed(ArithmeticOperations.ADD, other);
    }

    /** other - this */
    public Lazy reverseSubtract(Object other) {
        return applyReversed(ArithmeticOperations.SUBTRACT, other);
    }

    /** other * this */
    public Lazy reverseMultiply(Object other) {
        return applyReversed(ArithmeticOperations.MULTIPLY, other);
    }

    /** other / this */
    public Lazy reverseDivide(Object other) {
        return applyReversed(ArithmeticOperations.DIVIDE, other);
    }

    /**
     * Computes this value, running each distinct node in the graph once, in construction order. Exceptions from
     * operation functions propagate unchanged.
     */
    public Object compute() {
        return Evaluator.evaluate(root);
    }

    /** The textual trace of this value's graph, as per {@link TraceFormatter#standard()}. */
    @Override
    public String toString() {
        return TraceFormatter.standard().format(root);
    }
}
