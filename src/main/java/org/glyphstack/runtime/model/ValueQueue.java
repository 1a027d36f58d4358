package org.glyphstack.runtime.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * The single FIFO buffer shared by all stacks of one run.
 */
public class ValueQueue {

    private final Deque<Rational> values = new ArrayDeque<>();
    private final Rational policyValue;

    /**
     * Creates an empty queue.
     * @param policyValue The value handed out when dequeuing from an empty queue.
     */
    public ValueQueue(Rational policyValue) {
        this.policyValue = Objects.requireNonNull(policyValue, "policyValue");
    }

    public void enqueue(Rational value) {
        values.addLast(Objects.requireNonNull(value, "value"));
    }

    /**
     * Removes the value at the front.
     * @return The front value, or the policy value with {@link FaultKind#EMPTY_QUEUE}.
     */
    public Outcome<Rational> dequeue() {
        Rational front = values.pollFirst();
        if (front == null) {
            return Outcome.faulted(policyValue, FaultKind.EMPTY_QUEUE);
        }
        return Outcome.ok(front);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return An immutable copy of the queue, front first.
     */
    public List<Rational> snapshot() {
        return List.copyOf(values);
    }

    @Override
    public String toString() {
        return "ValueQueue" + values;
    }
}
