package org.glyphstack.runtime.isa.handlers;

import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.InstructionHandler;
import org.glyphstack.runtime.isa.PointerUpdate;
import org.glyphstack.runtime.model.Rational;

/**
 * Moves values between stack {@code span} and the shared queue.
 */
public class QueueHandler implements InstructionHandler {

    @Override
    public PointerUpdate execute(Instruction instruction, ExecutionContext context) {
        switch (instruction.opcode()) {
            case TRANSFER_TO_QUEUE -> {
                Rational value = context.absorb(context.getStacks().pop(instruction.span()));
                context.getQueue().enqueue(value);
            }
            case TRANSFER_FROM_QUEUE -> {
                Rational value = context.absorb(context.getQueue().dequeue());
                context.getStacks().push(instruction.span(), value);
            }
            default -> throw new IllegalArgumentException("Not a queue instruction: " + instruction.opcode());
        }
        return PointerUpdate.ADVANCE;
    }
}
