/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.security.MessageDigest;
import java.util.List;
import java.util.Objects;

import io.github.graydavid.naryfunctions.NAryFunction;

/**
 * A named function that OperationNodes apply to their arguments' values. Besides the function itself, an Operation has
 * an identity: a Digest standing for the function, independent of any arguments, which is the first input to the hash
 * of every OperationNode that applies it. Two Operations with the same identity are treated as the same function for
 * hashing purposes, so callers must give different functions different identities.
 *
 * By default, an Operation's identity is the SHA-256 hash of its name. Callers whose names aren't unique enough (e.g. a
 * function whose behavior is versioned) can specify an identity explicitly.
 */
public final class Operation {
    private final String name;
    private final Digest identity;
    private final Notation notation;
    private final NAryFunction<Object, Object> function;

    private Operation(String name, Digest identity, Notation notation, NAryFunction<Object, Object> function) {
        this.name = Names.requireNonBlank(name, "Operation");
        this.identity = Objects.requireNonNull(identity);
        this.notation = Objects.requireNonNull(notation);
        this.function = Objects.requireNonNull(function);
    }

    /**
     * Creates an operation that renders as "(a NAME b)" in textual traces. Its identity is derived from name.
     *
     * @throws NullPointerException if any argument is null.
     * @throws IllegalArgumentException if name is blank, as per {@link String#isBlank()}.
     */
    public static Operation infix(String name, NAryFunction<Object, Object> function) {
        return new Operation(name, identityOf(name), Notation.INFIX, function);
    }

    /**
     * Creates an operation that renders as "NAME(a, b, ...)" in textual traces. Its identity is derived from name.
     *
     * @throws NullPointerException if any argument is null.
     * @throws IllegalArgumentException if name is blank, as per {@link String#isBlank()}.
     */
    public static Operation call(String name, NAryFunction<Object, Object> function) {
        return new Operation(name, identityOf(name), Notation.CALL, function);
    }

    /** Creates an operation with an explicitly-specified identity. */
    public static Operation of(String name, Digest identity, Notation notation,
            NAryFunction<Object, Object> function) {
        return new Operation(name, identity, notation, function);
    }

    /** The identity that {@link #infix(String, NAryFunction)} and {@link #call(String, NAryFunction)} assign. */
    public static Digest identityOf(String name) {
        MessageDigest digest = Sha256ContentHasher.newMessageDigest();
        return Digest.of(digest.digest(name.getBytes(UTF_8)));
    }

    public String getName() {
        return name;
    }

    public Digest getIdentity() {
        return identity;
    }

    public Notation getNotation() {
        return notation;
    }

    public NAryFunction<Object, Object> getFunction() {
        return function;
    }

    /** Renders this operation applied to the given argument references, on a single line. */
    public String render(List<String> argumentReferences) {
        return notation.render(name, argumentReferences);
    }

    @Override
    public String toString() {
        return name;
    }

    /** How an Operation is rendered in textual traces. Notation has no effect on hashing. */
    public enum Notation {
        INFIX {
            @Override
            String render(String name, List<String> argumentReferences) {
                return "(" + String.join(" " + name + " ", argumentReferences) + ")";
            }
        },
        CALL {
            @Override
            String render(String name, List<String> argumentReferences) {
                return name + "(" + String.join(", ", argumentReferences) + ")";
            }
        };

        abstract String render(String name, List<String> argumentReferences);
    }
}
