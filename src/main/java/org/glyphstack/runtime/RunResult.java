package org.glyphstack.runtime;

import java.util.Objects;

/**
 * How a run ended. There are exactly two exit paths: the program completed (by TERMINATE or
 * by running off the end), or it was aborted by a fatal condition.
 */
public sealed interface RunResult permits RunResult.Completed, RunResult.Aborted {

    /**
     * @return The curse counter value at the moment the run ended.
     */
    long curses();

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /**
     * The only fatal condition of the engine.
     */
    enum AbortReason {
        /** A jump target outside {@code [0, program length]}. */
        INVALID_JUMP_TARGET
    }

    /**
     * The run ended normally.
     * @param curses The final curse counter value.
     */
    record Completed(long curses) implements RunResult {}

    /**
     * The run was stopped by a fatal condition.
     * @param reason Why the run was aborted.
     * @param instructionIndex The index of the offending instruction.
     * @param target The jump target that was rejected.
     * @param curses The curse counter value at the moment of the abort.
     */
    record Aborted(AbortReason reason, int instructionIndex, long target, long curses) implements RunResult {
        public Aborted {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
