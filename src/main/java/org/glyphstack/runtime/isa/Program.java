package org.glyphstack.runtime.isa;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, 0-indexed sequence of instructions.
 */
public final class Program implements Iterable<Instruction> {

    private final String name;
    private final List<Instruction> instructions;

    /**
     * Creates a program.
     * @param name A display name (usually the source file), used in logs.
     * @param instructions The instructions, copied.
     */
    public Program(String name, List<Instruction> instructions) {
        this.name = Objects.requireNonNull(name, "name");
        this.instructions = List.copyOf(instructions);
    }

    public static Program of(Instruction... instructions) {
        return new Program("<memory>", List.of(instructions));
    }

    public String getName() {
        return name;
    }

    public int size() {
        return instructions.size();
    }

    public Instruction get(int index) {
        return instructions.get(index);
    }

    /**
     * @param index A pointer value.
     * @return {@code true} if an instruction exists at that index.
     */
    public boolean isInRange(long index) {
        return index >= 0 && index < instructions.size();
    }

    /**
     * @param target A jump target.
     * @return {@code true} if the target lies in {@code [0, size]}; {@code size} itself ends the run.
     */
    public boolean isValidJumpTarget(long target) {
        return target >= 0 && target <= instructions.size();
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    @Override
    public Iterator<Instruction> iterator() {
        return instructions.iterator();
    }

    @Override
    public String toString() {
        return "Program{name='" + name + "', size=" + instructions.size() + '}';
    }
}
