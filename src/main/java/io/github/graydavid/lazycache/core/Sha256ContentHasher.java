/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.security.MessageDigest;
import java.util.Objects;

import io.github.graydavid.onemoretry.Try;

/**
 * The default ContentHasher: SHA-256 over a value's kind name, a zero separator byte, and the content bytes the kind
 * writes. The same class also combines operation and argument digests into operation node hashes.
 */
public class Sha256ContentHasher implements ContentHasher {
    public static final String ALGORITHM = "SHA-256";
    private final ValueKinds kinds;

    private Sha256ContentHasher(ValueKinds kinds) {
        this.kinds = Objects.requireNonNull(kinds);
    }

    /** Creates a hasher that hashes the values of any kind in kinds. */
    public static Sha256ContentHasher from(ValueKinds kinds) {
        return new Sha256ContentHasher(kinds);
    }

    /** @throws UnhashableValueException if value belongs to no kind registered in this hasher's ValueKinds. */
    @Override
    public Digest hash(Object value) {
        Objects.requireNonNull(value);
        ValueKind<?> kind = kinds.findKind(value)
                .orElseThrow(() -> new UnhashableValueException(
                        "No registered ValueKind can hash values of class " + value.getClass().getName()));
        return hash(kind, value);
    }

    private <T> Digest hash(ValueKind<T> kind, Object value) {
        MessageDigest digest = newMessageDigest();
        digest.update(kind.getName().getBytes(UTF_8));
        digest.update((byte) 0);
        kind.writeContent(kind.getValueClass().cast(value), digest, this);
        return Digest.of(digest.digest());
    }

    /** Hashes the concatenation of first and each of rest's bytes, in order. */
    public static Digest concatenate(Digest first, Iterable<Digest> rest) {
        MessageDigest digest = newMessageDigest();
        digest.update(first.toBytes());
        rest.forEach(next -> digest.update(next.toBytes()));
        return Digest.of(digest.digest());
    }

    static MessageDigest newMessageDigest() {
        // Every JVM is required to support SHA-256
        return Try.callCatchException(() -> MessageDigest.getInstance(ALGORITHM))
                .getOrThrowUnchecked(IllegalStateException::new);
    }
}
