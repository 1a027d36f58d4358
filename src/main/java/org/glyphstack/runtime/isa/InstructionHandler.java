package org.glyphstack.runtime.isa;

import org.glyphstack.runtime.internal.services.ExecutionContext;

/**
 * Executes the instructions of one family against the machine state.
 */
@FunctionalInterface
public interface InstructionHandler {

    /**
     * Executes one instruction.
     * @param instruction The instruction to execute.
     * @param context The mutable machine state of the current run.
     * @return How the instruction pointer moves next.
     */
    PointerUpdate execute(Instruction instruction, ExecutionContext context);
}
