package org.glyphstack.runtime.isa;

import java.util.Objects;

/**
 * One decoded instruction. Instances are produced once by a decoder or the listing assembler
 * and never change.
 *
 * @param opcode The operation.
 * @param span How many stacks the operation touches, or which stack it addresses.
 * @param magnitude The literal value or absolute jump target.
 * @param originIndex Where the instruction came from (source position), for diagnostics only;
 *                    -1 if unknown.
 */
public record Instruction(OpKind opcode, int span, long magnitude, int originIndex) {

    public Instruction {
        Objects.requireNonNull(opcode, "opcode");
        if (span < 0) {
            throw new IllegalArgumentException("Span must not be negative, got " + span);
        }
        if (magnitude < 0) {
            throw new IllegalArgumentException("Magnitude must not be negative, got " + magnitude);
        }
        if (opcode.addressesSingleStack() && span == 0) {
            throw new IllegalArgumentException(opcode + " addresses stack 'span', which must be at least 1");
        }
    }

    public static Instruction of(OpKind opcode, int span, long magnitude) {
        return new Instruction(opcode, span, magnitude, -1);
    }

    public static Instruction of(OpKind opcode, int span) {
        return new Instruction(opcode, span, 0L, -1);
    }

    public static Instruction of(OpKind opcode) {
        return new Instruction(opcode, 0, 0L, -1);
    }
}
