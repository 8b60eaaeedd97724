/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.github.graydavid.lazycache.core.Program.Statement;

/**
 * Runs Programs. Statements execute sequentially, in order, on the calling thread; each operation function is invoked
 * exactly once per statement. Any exception thrown by an operation function propagates unchanged, and evaluation stops
 * there: there are no retries and no partial results.
 */
public class Evaluator {
    private static final Logger logger = LogManager.getLogger();

    private Evaluator() {}

    /** Builds the program for the graph under root and evaluates it. */
    public static Object evaluate(Node root) {
        return evaluate(Program.build(root));
    }

    /** Evaluates program's statements to produce the value of its root. */
    public static Object evaluate(Program program) {
        return evaluate(program.getRoot(), program.getStatements());
    }

    /**
     * Executes statements in order until the statement computing root has run, returning its result. The root's result
     * is returned without being bound; every other result is bound to its statement's name for later statements. If
     * root is a leaf, its value is returned directly.
     *
     * @throws ProgramDesynchronizationException if the statements run out before root is computed, or if a statement
     *         refers to a binding that no earlier statement produced.
     */
    public static Object evaluate(Node root, List<Statement> statements) {
        Objects.requireNonNull(root);
        if (root instanceof LeafNode) {
            return ((LeafNode) root).getValue();
        }

        logger.debug("Evaluating {} statements for root {}", statements.size(), root);
        Map<String, Object> bindings = new HashMap<>();
        for (Statement statement : statements) {
            OperationNode node = statement.getNode();
            List<Object> arguments = resolveArguments(statement, bindings);
            logger.trace("Executing {}", statement);
            Object result = node.getOperation().getFunction().apply(arguments);
            if (node.isSameNodeAs(root)) {
                logger.debug("Finished evaluating root {}", root);
                return result;
            }
            bindings.put(statement.getName(), result);
        }
        throw new ProgramDesynchronizationException(
                "Ran out of statements without computing root " + root + " from " + statements);
    }

    private static List<Object> resolveArguments(Statement statement, Map<String, Object> bindings) {
        List<Node> argumentNodes = statement.getNode().getArguments();
        List<String> references = statement.getArgumentReferences();
        List<Object> arguments = new ArrayList<>(argumentNodes.size());
        for (int i = 0; i < argumentNodes.size(); ++i) {
            Node argument = argumentNodes.get(i);
            if (argument instanceof LeafNode) {
                arguments.add(((LeafNode) argument).getValue());
            } else {
                String reference = references.get(i);
                if (!bindings.containsKey(reference)) {
                    throw new ProgramDesynchronizationException("Statement '" + statement
                            + "' refers to binding '" + reference + "', which no earlier statement produced");
                }
                arguments.add(bindings.get(reference));
            }
        }
        return arguments;
    }
}
