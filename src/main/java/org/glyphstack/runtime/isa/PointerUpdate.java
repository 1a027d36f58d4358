package org.glyphstack.runtime.isa;

/**
 * What the run loop does with the instruction pointer after an instruction executed.
 */
public sealed interface PointerUpdate permits PointerUpdate.Advance, PointerUpdate.JumpTo, PointerUpdate.Halt {

    PointerUpdate ADVANCE = new Advance();
    PointerUpdate HALT = new Halt();

    static PointerUpdate jumpTo(long target) {
        return new JumpTo(target);
    }

    /** Move on to the next instruction. */
    record Advance() implements PointerUpdate {}

    /**
     * Continue at an absolute index. The run loop validates the target.
     * @param target The absolute instruction index.
     */
    record JumpTo(long target) implements PointerUpdate {}

    /** Stop the run successfully. */
    record Halt() implements PointerUpdate {}
}
