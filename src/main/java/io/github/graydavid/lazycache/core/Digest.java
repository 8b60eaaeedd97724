/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.Arrays;

import com.google.common.io.BaseEncoding;

/**
 * A content hash: a fixed-size sequence of bytes produced by a secure hash function. Digests compare equal when their
 * bytes are equal, regardless of which value or node produced them, which is what allows structurally identical
 * subexpressions to be recognized without executing them.
 */
public final class Digest implements Comparable<Digest> {
    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();
    private final byte[] bytes;

    private Digest(byte[] bytes) {
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Digests must contain at least one byte");
        }
        this.bytes = bytes;
    }

    /**
     * Creates a Digest from a copy of bytes.
     *
     * @throws NullPointerException if bytes is null.
     * @throws IllegalArgumentException if bytes is empty.
     */
    public static Digest of(byte[] bytes) {
        return new Digest(bytes.clone());
    }

    /** Parses a Digest from its full hexadecimal representation, as produced by {@link #toHex()}. */
    public static Digest fromHex(String hex) {
        return new Digest(HEX.decode(hex.toLowerCase()));
    }

    /** Returns a copy of the underlying bytes. */
    public byte[] toBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public String toHex() {
        return HEX.encode(bytes);
    }

    /**
     * Returns the hexadecimal representation of the first byteCount bytes, or of all bytes if byteCount exceeds the
     * length of this Digest.
     *
     * @throws IllegalArgumentException if byteCount is negative.
     */
    public String toHexPrefix(int byteCount) {
        if (byteCount < 0) {
            throw new IllegalArgumentException("byteCount must be non-negative: " + byteCount);
        }
        return HEX.encode(bytes, 0, Math.min(byteCount, bytes.length));
    }

    @Override
    public int compareTo(Digest other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }

        if (!(object instanceof Digest)) {
            return false;
        }

        Digest other = (Digest) object;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
