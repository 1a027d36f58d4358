package org.glyphstack.runtime.isa.handlers;

import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.InstructionHandler;
import org.glyphstack.runtime.isa.PointerUpdate;
import org.glyphstack.runtime.model.Rational;
import org.glyphstack.runtime.model.StackBank;

/**
 * Handles the value-placing instructions PUSH and DUPLICATE_SPREAD.
 */
public class DataHandler implements InstructionHandler {

    @Override
    public PointerUpdate execute(Instruction instruction, ExecutionContext context) {
        StackBank stacks = context.getStacks();
        switch (instruction.opcode()) {
            case PUSH -> {
                Rational value = context.getBackend().fromInteger(instruction.magnitude());
                for (int i = 1; i <= instruction.span(); i++) {
                    stacks.push(i, value);
                }
            }
            case DUPLICATE_SPREAD -> {
                Rational top = context.absorb(stacks.peek(1));
                for (int i = 2; i <= instruction.span(); i++) {
                    stacks.push(i, top);
                }
            }
            default -> throw new IllegalArgumentException("Not a data instruction: " + instruction.opcode());
        }
        return PointerUpdate.ADVANCE;
    }
}
