package org.glyphstack.runtime.services;

import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.OpKind;
import org.glyphstack.runtime.isa.Program;

/**
 * Renders instructions and programs in the textual listing format understood by
 * {@link org.glyphstack.assembler.Assembler}. Jump targets are written as absolute indices,
 * so a formatted program assembles back to the same instruction sequence.
 */
public class ProgramFormatter {

    /**
     * Formats a single instruction, e.g. {@code PUSH 2 5} or {@code JMP 0}.
     * @param instruction The instruction.
     * @return The listing text without trailing newline.
     */
    public String format(Instruction instruction) {
        OpKind.Operands operands = instruction.opcode().operands();
        StringBuilder sb = new StringBuilder(instruction.opcode().mnemonic());
        if (operands.hasSpan()) {
            sb.append(' ').append(instruction.span());
        }
        if (operands.hasMagnitude()) {
            sb.append(' ').append(instruction.magnitude());
        }
        return sb.toString();
    }

    /**
     * Formats a whole program, one instruction per line, each line annotated with its index.
     * @param program The program.
     * @return The listing.
     */
    public String format(Program program) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(program.getName()).append(" (").append(program.size()).append(" instructions)\n");
        int width = String.valueOf(Math.max(0, program.size() - 1)).length();
        for (int i = 0; i < program.size(); i++) {
            String line = format(program.get(i));
            sb.append(String.format("%-24s # %" + width + "d", line, i));
            int origin = program.get(i).originIndex();
            if (origin >= 0) {
                sb.append(" (line ").append(origin).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
