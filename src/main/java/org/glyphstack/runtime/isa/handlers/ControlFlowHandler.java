package org.glyphstack.runtime.isa.handlers;

import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.InstructionHandler;
import org.glyphstack.runtime.isa.PointerUpdate;

/**
 * Handles jumps and TERMINATE. Jump targets are returned unchecked; validating them against
 * the program length is the run loop's job.
 */
public class ControlFlowHandler implements InstructionHandler {

    @Override
    public PointerUpdate execute(Instruction instruction, ExecutionContext context) {
        return switch (instruction.opcode()) {
            case JUMP_IF_NONPOSITIVE -> {
                // an empty stack reads as sign 0, so the jump is taken
                int sign = context.absorb(context.getStacks().peekSign(instruction.span()));
                yield sign <= 0 ? PointerUpdate.jumpTo(instruction.magnitude()) : PointerUpdate.ADVANCE;
            }
            case JUMP_ALWAYS -> PointerUpdate.jumpTo(instruction.magnitude());
            case TERMINATE -> PointerUpdate.HALT;
            default -> throw new IllegalArgumentException("Not a control flow instruction: " + instruction.opcode());
        };
    }
}
