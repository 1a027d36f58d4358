package org.glyphstack.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A sparse bank of independent value stacks addressed by positive index.
 * <p>
 * A stack springs into existence, empty, the first time its index is referenced and lives
 * until the bank is discarded. Popping or peeking an empty stack never fails the call: it
 * reports {@link FaultKind#EMPTY_STACK} and hands back the policy value.
 */
public class StackBank {

    private final Map<Integer, Deque<Rational>> stacks = new HashMap<>();
    private final Rational policyValue;

    /**
     * Creates an empty bank.
     * @param policyValue The value substituted when a stack is empty.
     */
    public StackBank(Rational policyValue) {
        this.policyValue = Objects.requireNonNull(policyValue, "policyValue");
    }

    public void push(int index, Rational value) {
        Objects.requireNonNull(value, "value");
        stack(index).push(value);
    }

    /**
     * Removes and returns the top value of a stack.
     * @param index The stack index, at least 1.
     * @return The top value, or the policy value with {@link FaultKind#EMPTY_STACK}.
     */
    public Outcome<Rational> pop(int index) {
        Deque<Rational> stack = stack(index);
        if (stack.isEmpty()) {
            return Outcome.faulted(policyValue, FaultKind.EMPTY_STACK);
        }
        return Outcome.ok(stack.pop());
    }

    /**
     * Returns the top value of a stack without removing it.
     * @param index The stack index, at least 1.
     * @return The top value, or the policy value with {@link FaultKind#EMPTY_STACK}.
     */
    public Outcome<Rational> peek(int index) {
        Deque<Rational> stack = stack(index);
        if (stack.isEmpty()) {
            return Outcome.faulted(policyValue, FaultKind.EMPTY_STACK);
        }
        return Outcome.ok(stack.peek());
    }

    /**
     * Returns the sign of the top value of a stack. An empty stack reads as sign 0.
     * @param index The stack index, at least 1.
     * @return -1, 0 or 1, faulted with {@link FaultKind#EMPTY_STACK} if the stack is empty.
     */
    public Outcome<Integer> peekSign(int index) {
        Outcome<Rational> top = peek(index);
        return new Outcome<>(top.value().sign(), top.fault());
    }

    public int depth(int index) {
        Deque<Rational> stack = stacks.get(checkIndex(index));
        return stack == null ? 0 : stack.size();
    }

    /**
     * Returns a snapshot of one stack, bottom first.
     * @param index The stack index, at least 1.
     * @return An immutable copy; empty for a stack never referenced.
     */
    public List<Rational> snapshot(int index) {
        Deque<Rational> stack = stacks.get(checkIndex(index));
        if (stack == null) {
            return List.of();
        }
        List<Rational> bottomFirst = new ArrayList<>(stack);
        Collections.reverse(bottomFirst);
        return List.copyOf(bottomFirst);
    }

    /**
     * @return The indices of every stack referenced so far, ascending.
     */
    public NavigableSet<Integer> indices() {
        return Collections.unmodifiableNavigableSet(new TreeSet<>(stacks.keySet()));
    }

    private Deque<Rational> stack(int index) {
        return stacks.computeIfAbsent(checkIndex(index), i -> new ArrayDeque<>());
    }

    private static int checkIndex(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("Stack index must be at least 1, got " + index);
        }
        return index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StackBank{");
        boolean first = true;
        for (int index : indices()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(index).append('=').append(snapshot(index));
            first = false;
        }
        return sb.append('}').toString();
    }
}
