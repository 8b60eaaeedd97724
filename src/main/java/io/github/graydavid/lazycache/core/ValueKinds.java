/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.lazycache.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A registry of ValueKinds: classifies raw values and formats them for textual traces. Dispatch is by registration
 * order: a value belongs to the first registered kind that accepts it. Classification is total: values of no
 * registered kind are never immutable by value and are formatted with {@link String#valueOf(Object)}.
 */
public class ValueKinds {
    /** Text and byte values longer than this are never inlined in textual traces. */
    public static final int MAX_INLINE_LENGTH = 10;

    private static final ValueKinds STANDARD = builder().registerAll(StandardValueKinds.all()).build();

    private final List<ValueKind<?>> kinds;

    private ValueKinds(List<ValueKind<?>> kinds) {
        this.kinds = List.copyOf(kinds);
    }

    /** Returns a registry containing just the kinds from {@link StandardValueKinds#all()}. */
    public static ValueKinds standard() {
        return STANDARD;
    }

    /** Starts the creation of a new, empty registry. */
    public static Builder builder() {
        return new Builder();
    }

    /** Starts the creation of a new registry with the standard kinds already registered. */
    public static Builder standardBuilder() {
        return builder().registerAll(StandardValueKinds.all());
    }

    /** Returns the registered kinds, in dispatch order. */
    public List<ValueKind<?>> getKinds() {
        return kinds;
    }

    /** Finds the kind that value belongs to, if any. */
    public Optional<ValueKind<?>> findKind(Object value) {
        Objects.requireNonNull(value);
        return kinds.stream().filter(kind -> kind.accepts(value)).findFirst();
    }

    /** Answers whether value can never change after construction. False for values of no registered kind. */
    public boolean isImmutableByValue(Object value) {
        return findKind(value).map(kind -> isImmutableByValue(kind, value)).orElse(false);
    }

    private <T> boolean isImmutableByValue(ValueKind<T> kind, Object value) {
        return kind.isImmutableByValue(kind.getValueClass().cast(value), this);
    }

    /**
     * Answers whether value should be rendered directly in a textual trace rather than through a named input binding:
     * true if value is immutable by value and is not text or bytes longer than {@link #MAX_INLINE_LENGTH}.
     */
    public boolean shouldInlineInTrace(Object value) {
        return findKind(value).map(kind -> shouldInlineInTrace(kind, value)).orElse(false);
    }

    private <T> boolean shouldInlineInTrace(ValueKind<T> kind, Object value) {
        T typed = kind.getValueClass().cast(value);
        return kind.isImmutableByValue(typed, this) && !kind.isTooLongToInline(typed);
    }

    /** A single-line rendering of value, suitable for an inlined trace argument. */
    public String literal(Object value) {
        return findKind(value).map(kind -> literal(kind, value)).orElseGet(() -> String.valueOf(value));
    }

    private <T> String literal(ValueKind<T> kind, Object value) {
        return kind.literal(kind.getValueClass().cast(value), this);
    }

    /** A single-line summary of value, e.g. an array renders as its shape and element type. */
    public String shortDescription(Object value) {
        return findKind(value).map(kind -> shortDescription(kind, value)).orElseGet(() -> String.valueOf(value));
    }

    private <T> String shortDescription(ValueKind<T> kind, Object value) {
        return kind.shortDescription(kind.getValueClass().cast(value), this);
    }

    @Override
    public String toString() {
        return "ValueKinds" + kinds;
    }

    /** Registers ValueKinds in dispatch order. */
    public static class Builder {
        private final List<ValueKind<?>> kinds = new ArrayList<>();

        private Builder() {}

        /**
         * Registers kind after all previously-registered kinds.
         *
         * @throws IllegalArgumentException if a kind with the same name is already registered.
         */
        public Builder register(ValueKind<?> kind) {
            Objects.requireNonNull(kind);
            boolean nameTaken = kinds.stream().anyMatch(existing -> existing.getName().equals(kind.getName()));
            if (nameTaken) {
                throw new IllegalArgumentException("A ValueKind named '" + kind.getName() + "' is already registered");
            }
            kinds.add(kind);
            return this;
        }

        public Builder registerAll(List<? extends ValueKind<?>> kinds) {
            kinds.forEach(this::register);
            return this;
        }

        public ValueKinds build() {
            return new ValueKinds(kinds);
        }
    }
}
