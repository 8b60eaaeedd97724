/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.StringJoiner;

/** Validation shared by the named types in this package. */
final class Names {
    private Names() {}

    /**
     * Returns name if it isn't blank.
     *
     * @param owner what the name belongs to, e.g. "Operation", used in the exception message.
     * @throws NullPointerException if name is null.
     * @throws IllegalArgumentException if name is blank, as per {@link String#isBlank()}. The message lists the name's
     *         code points, since whitespace characters are otherwise hard to tell apart.
     */
    static String requireNonBlank(String name, String owner) {
        if (name.isBlank()) {
            StringJoiner codePoints = name.codePoints()
                    .collect(() -> new StringJoiner(", ", "[", "]"),
                            (joiner, point) -> joiner.add(String.valueOf(point)), StringJoiner::merge);
            throw new IllegalArgumentException(
                    owner + " names must not be blank but found whitespace character in code points: " + codePoints);
        }
        return name;
    }
}
