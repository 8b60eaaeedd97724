/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.github.graydavid.lazycache.core.Program.Statement;

/**
 * Renders the graph under a node as human-readable text. A leaf renders on a single line:
 *
 * <pre>
 * &lt;lazy 31f889 double[](shape=(3,))&gt;
 * </pre>
 *
 * Anything else renders the root's hash followed by the same Program that evaluation would run:
 *
 * <pre>
 * &lt;lazy 165062
 *   input:
 *     v0: 31f889 double[](shape=(3,))
 *     v1: 31f889 double[](shape=(3,))
 *   program:
 *     e0: 9ab2c1 (v0 + v1)
 *     e1: 1f0e3d (e0 * 4)
 * &gt;
 * </pre>
 *
 * Inputs are listed sorted by binding name as text, so "v10" comes between "v1" and "v2". Hashes are truncated to a
 * short hexadecimal prefix.
 */
public class TraceFormatter {
    public static final int DEFAULT_HASH_PREFIX_BYTES = 3;
    private static final TraceFormatter STANDARD = builder().build();

    private final int hashPrefixBytes;

    private TraceFormatter(int hashPrefixBytes) {
        this.hashPrefixBytes = hashPrefixBytes;
    }

    /** A formatter showing {@link #DEFAULT_HASH_PREFIX_BYTES} bytes of each hash. */
    public static TraceFormatter standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String format(Node root) {
        ValueKinds kinds = root.getContext().getValueKinds();
        if (root instanceof LeafNode) {
            Object value = ((LeafNode) root).getValue();
            return "<lazy " + prefix(root.getHash()) + " " + kinds.shortDescription(value) + ">";
        }

        Program program = Program.build(root);
        List<String> lines = new ArrayList<>();
        lines.add("<lazy " + prefix(root.getHash()));
        lines.add("  input:");
        for (Map.Entry<String, LeafNode> binding : new TreeMap<>(program.getLeafBindings()).entrySet()) {
            LeafNode leaf = binding.getValue();
            lines.add("    " + binding.getKey() + ": " + prefix(leaf.getHash()) + " "
                    + kinds.shortDescription(leaf.getValue()));
        }
        lines.add("  program:");
        for (Statement statement : program.getStatements()) {
            lines.add("    " + statement.getName() + ": " + prefix(statement.getNode().getHash()) + " "
                    + statement.renderExpression());
        }
        lines.add(">");
        return String.join("\n", lines);
    }

    private String prefix(Digest hash) {
        return hash.toHexPrefix(hashPrefixBytes);
    }

    public static class Builder {
        private int hashPrefixBytes = DEFAULT_HASH_PREFIX_BYTES;

        private Builder() {}

        /**
         * How many leading bytes of each hash to show.
         *
         * @throws IllegalArgumentException if hashPrefixBytes isn't positive.
         */
        public Builder hashPrefixBytes(int hashPrefixBytes) {
            if (hashPrefixBytes <= 0) {
                throw new IllegalArgumentException("hashPrefixBytes must be positive: " + hashPrefixBytes);
            }
            this.hashPrefixBytes = hashPrefixBytes;
            return this;
        }

        public TraceFormatter build() {
            return new TraceFormatter(hashPrefixBytes);
        }
    }
}
