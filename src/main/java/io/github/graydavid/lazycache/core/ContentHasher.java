/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

/**
 * Computes content hashes of raw values. Implementations must be deterministic and stable across process runs: equal
 * content must always produce equal Digests, including for distinct in-memory buffers with identical contents.
 */
@FunctionalInterface
public interface ContentHasher {
    /**
     * @throws UnhashableValueException if value is of a kind this hasher doesn't know how to hash.
     */
    Digest hash(Object value);
}
