package org.glyphstack.runtime.internal.services;

import org.glyphstack.runtime.io.IoAdapter;
import org.glyphstack.runtime.model.CurseCounter;
import org.glyphstack.runtime.model.FaultKind;
import org.glyphstack.runtime.model.Outcome;
import org.glyphstack.runtime.model.RationalBackend;
import org.glyphstack.runtime.model.StackBank;
import org.glyphstack.runtime.model.ValueQueue;

import java.util.Objects;

/**
 * Encapsulates the mutable machine state of one run: the stack bank, the queue, the curse
 * counter, the numeric backend and the I/O adapter. It is created by the host and passed by
 * reference into every instruction handler, so nothing about a run lives in global state.
 */
public class ExecutionContext {

    private final RationalBackend backend;
    private final StackBank stacks;
    private final ValueQueue queue;
    private final CurseCounter curses;
    private final IoAdapter io;
    private int currentInstructionIndex = -1;

    /**
     * Creates a fresh, empty machine state.
     * @param backend The numeric backend for every value of this run.
     * @param io The adapter used by the I/O instructions.
     */
    public ExecutionContext(RationalBackend backend, IoAdapter io) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.io = Objects.requireNonNull(io, "io");
        this.stacks = new StackBank(backend.zero());
        this.queue = new ValueQueue(backend.zero());
        this.curses = new CurseCounter();
    }

    /**
     * Unwraps a primitive's result, recording its fault (if any) against the current instruction.
     * @param outcome The result of a stack, queue, arithmetic or parse primitive.
     * @param <T> The value type.
     * @return The value, which is the policy value if the primitive faulted.
     */
    public <T> T absorb(Outcome<T> outcome) {
        if (outcome.isFaulted()) {
            curses.curse(outcome.fault(), currentInstructionIndex);
        }
        return outcome.value();
    }

    /**
     * Records a fault detected by a handler itself.
     * @param kind The fault.
     */
    public void curse(FaultKind kind) {
        curses.curse(kind, currentInstructionIndex);
    }

    public RationalBackend getBackend() {
        return backend;
    }

    public StackBank getStacks() {
        return stacks;
    }

    public ValueQueue getQueue() {
        return queue;
    }

    public CurseCounter getCurses() {
        return curses;
    }

    public IoAdapter getIo() {
        return io;
    }

    public int getCurrentInstructionIndex() {
        return currentInstructionIndex;
    }

    /**
     * Sets the index of the instruction about to execute; faults are attributed to it.
     * @param index The instruction index.
     */
    public void setCurrentInstructionIndex(int index) {
        this.currentInstructionIndex = index;
    }
}
