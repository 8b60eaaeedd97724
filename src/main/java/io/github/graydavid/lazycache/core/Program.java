/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A flattened, single-assignment rendition of the graph under a root node. Each distinct node appears exactly once,
 * no matter how many paths lead to it, and nodes appear in the order they were constructed (i.e. by stamp), which is
 * the order in which the caller built the graph rather than an arbitrary topological order. That makes the order of
 * any side effects in operation functions predictable.
 *
 * Leaves whose values can't be inlined in a textual trace are bound to names "v0", "v1", ...; operation nodes are bound
 * to names "e0", "e1", ..., each with a {@link Statement}. Both sets of names are assigned in stamp order.
 * Deduplication is by node (i.e. by stamp within the root's context), never by hash: two separately-constructed nodes
 * with equal hashes still get separate names and statements.
 *
 * If the root is itself a leaf, the program has no statements, and consumers must use the leaf's value directly.
 */
public final class Program {
    private static final Logger logger = LogManager.getLogger();
    private static final Comparator<Node> BY_STAMP = Comparator.comparingLong(Node::getStamp);

    private final Node root;
    private final Map<String, LeafNode> leafBindings;
    private final List<Statement> statements;

    private Program(Node root, Map<String, LeafNode> leafBindings, List<Statement> statements) {
        this.root = root;
        this.leafBindings = Collections.unmodifiableMap(leafBindings);
        this.statements = List.copyOf(statements);
    }

    /** Builds the program for the graph under root. */
    public static Program build(Node root) {
        Objects.requireNonNull(root);
        List<LeafNode> leaves = new ArrayList<>();
        List<OperationNode> operations = new ArrayList<>();
        gather(root, leaves, operations);
        leaves.sort(BY_STAMP);
        operations.sort(BY_STAMP);

        ValueKinds kinds = root.getContext().getValueKinds();
        Map<Long, String> stampToName = new HashMap<>();
        Map<String, LeafNode> leafBindings = new LinkedHashMap<>();
        for (LeafNode leaf : leaves) {
            if (!stampToName.containsKey(leaf.getStamp()) && !kinds.shouldInlineInTrace(leaf.getValue())) {
                String name = "v" + leafBindings.size();
                stampToName.put(leaf.getStamp(), name);
                leafBindings.put(name, leaf);
            }
        }

        List<Statement> statements = new ArrayList<>();
        for (OperationNode operation : operations) {
            if (!stampToName.containsKey(operation.getStamp())) {
                String name = "e" + statements.size();
                stampToName.put(operation.getStamp(), name);
                List<String> argumentReferences = operation.getArguments()
                        .stream()
                        .map(argument -> reference(argument, stampToName, kinds))
                        .collect(Collectors.toList());
                statements.add(new Statement(name, operation, argumentReferences));
            }
        }

        logger.debug("Built program with {} input bindings and {} statements for root {}", leafBindings.size(),
                statements.size(), root);
        return new Program(root, leafBindings, statements);
    }

    /**
     * Collects every distinct node under root. Since results are sorted by stamp afterwards, the traversal order
     * doesn't matter, and visiting each node once yields the same program as visiting it along every path.
     */
    private static void gather(Node root, List<LeafNode> leaves, List<OperationNode> operations) {
        Set<Long> visited = new HashSet<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (!visited.add(node.getStamp())) {
                continue;
            }
            if (node instanceof OperationNode) {
                OperationNode operation = (OperationNode) node;
                operations.add(operation);
                operation.getArguments().forEach(pending::push);
            } else {
                leaves.add((LeafNode) node);
            }
        }
    }

    private static String reference(Node argument, Map<Long, String> stampToName, ValueKinds kinds) {
        String name = stampToName.get(argument.getStamp());
        if (name != null) {
            return name;
        }
        if (argument instanceof LeafNode) {
            return kinds.literal(((LeafNode) argument).getValue());
        }
        throw new ProgramDesynchronizationException(
                "Operation argument was referenced before its own statement was created: " + argument);
    }

    public Node getRoot() {
        return root;
    }

    /** Answers whether the root is a leaf, in which case there are no statements. */
    public boolean isRootLeaf() {
        return root instanceof LeafNode;
    }

    /** The names bound to non-inlined leaves, in the order the names were assigned (i.e. by stamp). */
    public Map<String, LeafNode> getLeafBindings() {
        return leafBindings;
    }

    /** The statements computing each distinct operation node, in stamp order. The last statement is the root's. */
    public List<Statement> getStatements() {
        return statements;
    }

    /** One assignment in a Program: a name, the operation node computed, and references to each argument. */
    public static final class Statement {
        private final String name;
        private final OperationNode node;
        private final List<String> argumentReferences;

        private Statement(String name, OperationNode node, List<String> argumentReferences) {
            this.name = name;
            this.node = node;
            this.argumentReferences = List.copyOf(argumentReferences);
        }

        public String getName() {
            return name;
        }

        public OperationNode getNode() {
            return node;
        }

        /**
         * For each argument, in order: the name of the binding holding its value, or, for inlined leaves, the literal
         * rendering of its value.
         */
        public List<String> getArgumentReferences() {
            return argumentReferences;
        }

        /** Renders the operation applied to the argument references, e.g. "(v0 + 4)". */
        public String renderExpression() {
            return node.getOperation().render(argumentReferences);
        }

        @Override
        public String toString() {
            return name + " = " + renderExpression();
        }
    }
}
