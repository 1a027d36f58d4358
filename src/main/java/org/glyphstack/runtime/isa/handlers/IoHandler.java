package org.glyphstack.runtime.isa.handlers;

import org.glyphstack.runtime.Config;
import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.InstructionHandler;
import org.glyphstack.runtime.isa.PointerUpdate;
import org.glyphstack.runtime.model.FaultKind;
import org.glyphstack.runtime.model.Outcome;
import org.glyphstack.runtime.model.Rational;

import java.math.BigInteger;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Handles the four I/O instructions by calling out to the run's
 * {@link org.glyphstack.runtime.io.IoAdapter}.
 */
public class IoHandler implements InstructionHandler {

    private static final BigInteger MAX_CODE_POINT = BigInteger.valueOf(Config.MAX_CODE_POINT);

    @Override
    public PointerUpdate execute(Instruction instruction, ExecutionContext context) {
        int stack = instruction.span();
        switch (instruction.opcode()) {
            case OUTPUT_NUMBER -> {
                Rational value = context.absorb(context.getStacks().pop(stack));
                context.getIo().writeText(Rational.format(value));
            }
            case OUTPUT_CHAR -> outputChar(stack, context);
            case INPUT_NUMBER -> {
                Optional<String> token = context.getIo().readNumber();
                Rational value;
                if (token.isEmpty()) {
                    context.curse(FaultKind.END_OF_INPUT);
                    value = context.getBackend().zero();
                } else {
                    value = context.absorb(context.getBackend().parse(token.get()));
                }
                context.getStacks().push(stack, value);
            }
            case INPUT_CHAR -> {
                OptionalInt codePoint = context.getIo().readCodepoint();
                Rational value;
                if (codePoint.isEmpty()) {
                    context.curse(FaultKind.END_OF_INPUT);
                    value = context.getBackend().zero();
                } else {
                    value = context.getBackend().fromInteger(codePoint.getAsInt());
                }
                context.getStacks().push(stack, value);
            }
            default -> throw new IllegalArgumentException("Not an I/O instruction: " + instruction.opcode());
        }
        return PointerUpdate.ADVANCE;
    }

    private void outputChar(int stack, ExecutionContext context) {
        Outcome<Rational> popped = context.getStacks().pop(stack);
        if (popped.isFaulted()) {
            context.absorb(popped);
            return;
        }
        Optional<BigInteger> integer = popped.value().toIntegerIfExact();
        if (integer.isEmpty() || integer.get().signum() < 0 || integer.get().compareTo(MAX_CODE_POINT) > 0) {
            context.curse(FaultKind.INVALID_CODE_POINT);
            return;
        }
        int codePoint = integer.get().intValueExact();
        if (Character.getType(codePoint) == Character.SURROGATE) {
            context.curse(FaultKind.INVALID_CODE_POINT);
            return;
        }
        context.getIo().writeCodepoint(codePoint);
    }
}
