/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A node applying an Operation to an ordered list of argument nodes. The hash is the SHA-256 of the operation's
 * identity followed by each argument's hash, in argument order. Order matters even for commutative operations: a + b
 * and b + a hash differently, since the order in which a caller builds arguments is what drives evaluation order.
 */
public final class OperationNode extends Node {
    private final Operation operation;
    private final List<Node> arguments;
    private final Digest hash;

    OperationNode(ConstructionContext context, Operation operation, List<? extends Node> arguments) {
        super(context);
        this.operation = Objects.requireNonNull(operation);
        this.arguments = requireSameContext(context, List.copyOf(arguments));
        List<Digest> argumentHashes = this.arguments.stream().map(Node::getHash).collect(Collectors.toList());
        this.hash = Sha256ContentHasher.concatenate(operation.getIdentity(), argumentHashes);
    }

    private static List<Node> requireSameContext(ConstructionContext context, List<Node> arguments) {
        arguments.stream().filter(argument -> argument.getContext() != context).findFirst().ifPresent(argument -> {
            String message = String.format(
                    "Expected all arguments to belong to context '%s', but argument '%s' belongs to '%s'", context,
                    argument, argument.getContext());
            throw new IllegalArgumentException(message);
        });
        return arguments;
    }

    public Operation getOperation() {
        return operation;
    }

    /** The arguments this node applies its operation to, in order. */
    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public Digest getHash() {
        return hash;
    }

    @Override
    public String toString() {
        return operation + super.toString();
    }
}
