/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

/** Indicates that a ContentHasher was asked to hash a value whose kind it doesn't know how to hash. */
public class UnhashableValueException extends IllegalArgumentException {
    private static final long serialVersionUID = 1;

    public UnhashableValueException(String message) {
        super(message);
    }
}
