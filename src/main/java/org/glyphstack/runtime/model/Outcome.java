package org.glyphstack.runtime.model;

import java.util.Objects;

/**
 * The result of a primitive that may fault: a value that is always usable, plus the fault
 * that occurred while producing it, if any. A faulted outcome carries the policy value.
 *
 * @param value The produced value, or the policy value when {@code fault} is set.
 * @param fault The fault that occurred, or {@code null} for a clean result.
 * @param <T> The value type.
 */
public record Outcome<T>(T value, FaultKind fault) {

    public Outcome {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Creates a clean outcome.
     * @param value The produced value.
     * @param <T> The value type.
     * @return An outcome without fault.
     */
    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(value, null);
    }

    /**
     * Creates a faulted outcome carrying a substitute value.
     * @param policyValue The value to continue with.
     * @param kind The fault that occurred.
     * @param <T> The value type.
     * @return A faulted outcome.
     */
    public static <T> Outcome<T> faulted(T policyValue, FaultKind kind) {
        return new Outcome<>(policyValue, Objects.requireNonNull(kind, "kind"));
    }

    public boolean isFaulted() {
        return fault != null;
    }
}
