package org.glyphstack.runtime.isa.handlers;

import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.isa.CombineOperator;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.InstructionHandler;
import org.glyphstack.runtime.isa.PointerUpdate;
import org.glyphstack.runtime.model.Rational;
import org.glyphstack.runtime.model.StackBank;

/**
 * Handles the COMBINE family. For each adjacent pair {@code (i, i+1)} with {@code i} in
 * {@code 1..span-1} the tops of both stacks are popped, combined with the pop from stack
 * {@code i} as left operand, and the result is pushed onto stack {@code i+1}. The chain
 * therefore leaves its accumulated result on stack {@code span}.
 * <p>
 * An empty pop, a zero divisor or a bounded overflow each raise one curse and substitute
 * {@code 0/1} for that single step; the chain always runs to the end.
 */
public class ArithmeticHandler implements InstructionHandler {

    @Override
    public PointerUpdate execute(Instruction instruction, ExecutionContext context) {
        CombineOperator operator = instruction.opcode().combineOperator();
        if (operator == null) {
            throw new IllegalArgumentException("Not a combine instruction: " + instruction.opcode());
        }
        StackBank stacks = context.getStacks();
        for (int i = 1; i < instruction.span(); i++) {
            Rational left = context.absorb(stacks.pop(i));
            Rational right = context.absorb(stacks.pop(i + 1));
            Rational result = context.absorb(operator.apply(left, right));
            stacks.push(i + 1, result);
        }
        return PointerUpdate.ADVANCE;
    }
}
