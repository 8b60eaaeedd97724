/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

/**
 * Indicates that a Program and the Evaluator running it disagree: e.g. the program's statements ran out without ever
 * computing the root. This is an internal invariant violation, never a failure of a user-provided operation, and should
 * be treated seriously, since no result computed alongside it can be trusted.
 */
public class ProgramDesynchronizationException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public ProgramDesynchronizationException(String message) {
        super(message);
    }
}
