/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Longs;

/**
 * The ValueKinds every registry starts with in {@link ValueKinds#standard()}. Scalars (integers, floating point,
 * booleans, text, bytes) and frozen sets ({@link ImmutableSet}) are immutable by value. Tuples ({@link ImmutableList})
 * are immutable by value when all their elements are. Arrays and byte buffers never are.
 */
public class StandardValueKinds {
    private StandardValueKinds() {}

    /** Byte, Short, Integer, Long, and BigInteger. Equal numbers hash equally regardless of their boxed class. */
    public static final ValueKind<Number> INTEGER = new ValueKind<>("integer", Number.class) {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Byte || value instanceof Short || value instanceof Integer
                    || value instanceof Long || value instanceof BigInteger;
        }

        @Override
        public boolean isImmutableByValue(Number value, ValueKinds kinds) {
            return true;
        }

        @Override
        public void writeContent(Number value, MessageDigest digest, ContentHasher elementHasher) {
            BigInteger bigValue = (value instanceof BigInteger) ? (BigInteger) value
                    : BigInteger.valueOf(value.longValue());
            digest.update(bigValue.toByteArray());
        }
    };

    /** Float and Double, hashed by the bits of their double value. */
    public static final ValueKind<Number> FLOATING_POINT = new ValueKind<>("float", Number.class) {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Float || value instanceof Double;
        }

        @Override
        public boolean isImmutableByValue(Number value, ValueKinds kinds) {
            return true;
        }

        @Override
        public void writeContent(Number value, MessageDigest digest, ContentHasher elementHasher) {
            digest.update(Longs.toByteArray(Double.doubleToLongBits(value.doubleValue())));
        }
    };

    public static final ValueKind<Boolean> BOOLEAN = new ValueKind<>("boolean", Boolean.class) {
        @Override
        public boolean isImmutableByValue(Boolean value, ValueKinds kinds) {
            return true;
        }

        @Override
        public void writeContent(Boolean value, MessageDigest digest, ContentHasher elementHasher) {
            digest.update(value ? (byte) 1 : (byte) 0);
        }
    };

    /**
     * Strings. Literals are double-quoted and stay on one line: backslashes, quotes, and newlines are backslash-escaped,
     * and other control characters render as four-digit hexadecimal unicode escapes.
     */
    public static final ValueKind<String> TEXT = new ValueKind<>("text", String.class) {
        @Override
        public boolean isImmutableByValue(String value, ValueKinds kinds) {
            return true;
        }

        @Override
        public boolean isTooLongToInline(String value) {
            return value.length() > ValueKinds.MAX_INLINE_LENGTH;
        }

        @Override
        public String literal(String value, ValueKinds kinds) {
            StringBuilder literal = new StringBuilder(value.length() + 2).append('"');
            for (int i = 0; i < value.length(); ++i) {
                char c = value.charAt(i);
                if (c == '\\' || c == '"') {
                    literal.append('\\').append(c);
                } else if (c == '\n') {
                    literal.append("\\n");
                } else if (Character.isISOControl(c)) {
                    literal.append(String.format("\\u%04x", (int) c));
                } else {
                    literal.append(c);
                }
            }
            return literal.append('"').toString();
        }

        @Override
        public void writeContent(String value, MessageDigest digest, ContentHasher elementHasher) {
            digest.update(value.getBytes(UTF_8));
        }
    };

    public static final ValueKind<byte[]> BYTES = new ValueKind<>("bytes", byte[].class) {
        private final BaseEncoding hex = BaseEncoding.base16().lowerCase();

        @Override
        public boolean isImmutableByValue(byte[] value, ValueKinds kinds) {
            return true;
        }

        @Override
        public boolean isTooLongToInline(byte[] value) {
            return value.length > ValueKinds.MAX_INLINE_LENGTH;
        }

        @Override
        public String literal(byte[] value, ValueKinds kinds) {
            return "bytes(" + hex.encode(value) + ")";
        }

        @Override
        public String shortDescription(byte[] value, ValueKinds kinds) {
            return isTooLongToInline(value) ? "byte[](length=" + value.length + ")" : literal(value, kinds);
        }

        @Override
        public void writeContent(byte[] value, MessageDigest digest, ContentHasher elementHasher) {
            digest.update(value);
        }
    };

    /** Frozen sets. Hashing is independent of iteration order. */
    public static final ValueKind<ImmutableSet<?>> FROZEN_SET = new ValueKind<ImmutableSet<?>>(
            "frozenset", immutableSetClass()) {
        @Override
        public boolean isImmutableByValue(ImmutableSet<?> value, ValueKinds kinds) {
            return true;
        }

        @Override
        public String literal(ImmutableSet<?> value, ValueKinds kinds) {
            return value.stream().map(kinds::literal).collect(Collectors.joining(", ", "frozenset{", "}"));
        }

        @Override
        public void writeContent(ImmutableSet<?> value, MessageDigest digest, ContentHasher elementHasher) {
            value.stream().map(elementHasher::hash).sorted().forEach(element -> digest.update(element.toBytes()));
        }
    };

    @SuppressWarnings("unchecked")
    private static Class<ImmutableSet<?>> immutableSetClass() {
        return (Class<ImmutableSet<?>>) (Class<?>) ImmutableSet.class;
    }

    /** Fixed-size ordered sequences. Immutable by value only when every element is, recursively. */
    public static final ValueKind<ImmutableList<?>> TUPLE = new ValueKind<ImmutableList<?>>(
            "tuple", immutableListClass()) {
        @Override
        public boolean isImmutableByValue(ImmutableList<?> value, ValueKinds kinds) {
            return value.stream().allMatch(kinds::isImmutableByValue);
        }

        @Override
        public String literal(ImmutableList<?> value, ValueKinds kinds) {
            return value.stream().map(kinds::literal).collect(Collectors.joining(", ", "(", ")"));
        }

        @Override
        public void writeContent(ImmutableList<?> value, MessageDigest digest, ContentHasher elementHasher) {
            value.forEach(element -> digest.update(elementHasher.hash(element).toBytes()));
        }
    };

    @SuppressWarnings("unchecked")
    private static Class<ImmutableList<?>> immutableListClass() {
        return (Class<ImmutableList<?>>) (Class<?>) ImmutableList.class;
    }

    public static final ValueKind<double[]> DOUBLE_ARRAY = new ValueKind<>("double[]", double[].class) {
        @Override
        public boolean isImmutableByValue(double[] value, ValueKinds kinds) {
            return false;
        }

        @Override
        public String shortDescription(double[] value, ValueKinds kinds) {
            return arrayDescription("double", value.length);
        }

        @Override
        public void writeContent(double[] value, MessageDigest digest, ContentHasher elementHasher) {
            ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES * value.length);
            buffer.asDoubleBuffer().put(value);
            digest.update(buffer);
        }
    };

    public static final ValueKind<long[]> LONG_ARRAY = new ValueKind<>("long[]", long[].class) {
        @Override
        public boolean isImmutableByValue(long[] value, ValueKinds kinds) {
            return false;
        }

        @Override
        public String shortDescription(long[] value, ValueKinds kinds) {
            return arrayDescription("long", value.length);
        }

        @Override
        public void writeContent(long[] value, MessageDigest digest, ContentHasher elementHasher) {
            ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES * value.length);
            buffer.asLongBuffer().put(value);
            digest.update(buffer);
        }
    };

    public static final ValueKind<int[]> INT_ARRAY = new ValueKind<>("int[]", int[].class) {
        @Override
        public boolean isImmutableByValue(int[] value, ValueKinds kinds) {
            return false;
        }

        @Override
        public String shortDescription(int[] value, ValueKinds kinds) {
            return arrayDescription("int", value.length);
        }

        @Override
        public void writeContent(int[] value, MessageDigest digest, ContentHasher elementHasher) {
            ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES * value.length);
            buffer.asIntBuffer().put(value);
            digest.update(buffer);
        }
    };

    /**
     * Byte buffers, including memory-mapped ones. Hashes the remaining bytes without moving the buffer's position.
     */
    public static final ValueKind<ByteBuffer> BYTE_BUFFER = new ValueKind<>("ByteBuffer", ByteBuffer.class) {
        @Override
        public boolean isImmutableByValue(ByteBuffer value, ValueKinds kinds) {
            return false;
        }

        @Override
        public String shortDescription(ByteBuffer value, ValueKinds kinds) {
            return "ByteBuffer(remaining=" + value.remaining() + ")";
        }

        @Override
        public void writeContent(ByteBuffer value, MessageDigest digest, ContentHasher elementHasher) {
            digest.update(value.duplicate());
        }
    };

    private static String arrayDescription(String elementType, int length) {
        return elementType + "[](shape=(" + length + ",))";
    }

    /** All standard kinds, in the order {@link ValueKinds#standard()} dispatches to them. */
    public static List<ValueKind<?>> all() {
        return List.of(INTEGER, FLOATING_POINT, BOOLEAN, TEXT, BYTES, FROZEN_SET, TUPLE, DOUBLE_ARRAY, LONG_ARRAY,
                INT_ARRAY, BYTE_BUFFER);
    }
}
