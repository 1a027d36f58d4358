package org.glyphstack.runtime.instructions;

import org.glyphstack.runtime.RunResult;
import org.glyphstack.runtime.VirtualMachine;
import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.io.IoAdapter;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.OpKind;
import org.glyphstack.runtime.isa.Program;
import org.glyphstack.runtime.model.BigRational;
import org.glyphstack.runtime.model.FaultKind;
import org.glyphstack.runtime.model.RationalBackend;
import org.glyphstack.runtime.model.StackBank;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigInteger;
import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class VMIoInstructionTest {

    private IoAdapter io;
    private ExecutionContext context;
    private StackBank stacks;

    @BeforeEach
    void setUp() {
        io = mock(IoAdapter.class);
        context = new ExecutionContext(RationalBackend.ARBITRARY_PRECISION, io);
        stacks = context.getStacks();
    }

    private RunResult run(Instruction... instructions) {
        return new VirtualMachine(Program.of(instructions), context).run();
    }

    // --- OUTPUT_NUMBER ---
    @Test
    @Tag("unit")
    void testOutputNumberWritesTextForm() {
        stacks.push(2, BigRational.of(BigInteger.valueOf(-7), BigInteger.TWO));
        stacks.push(2, BigRational.of(12));
        RunResult result = run(Instruction.of(OpKind.OUTPUT_NUMBER, 2), Instruction.of(OpKind.OUTPUT_NUMBER, 2));

        InOrder order = inOrder(io);
        order.verify(io).writeText("12");
        order.verify(io).writeText("-7/2");
        assertThat(stacks.depth(2)).isZero();
        assertThat(result.curses()).isZero();
    }

    @Test
    @Tag("unit")
    void testOutputNumberFromEmptyStackWritesZero() {
        RunResult result = run(Instruction.of(OpKind.OUTPUT_NUMBER, 1));
        verify(io).writeText("0");
        assertThat(result.curses()).isEqualTo(1);
    }

    // --- OUTPUT_CHAR ---
    @Test
    @Tag("unit")
    void testOutputCharWritesCodePoint() {
        stacks.push(1, BigRational.of(0x1F600));
        stacks.push(1, BigRational.of('A'));
        RunResult result = run(Instruction.of(OpKind.OUTPUT_CHAR, 1), Instruction.of(OpKind.OUTPUT_CHAR, 1));
        verify(io).writeCodepoint('A');
        verify(io).writeCodepoint(0x1F600);
        assertThat(result.curses()).isZero();
    }

    @Test
    @Tag("unit")
    void testOutputCharRejectsValuesThatAreNotCodePoints() {
        stacks.push(1, BigRational.of(-1));
        stacks.push(1, BigRational.of(BigInteger.ONE, BigInteger.TWO));
        stacks.push(1, BigRational.of(Character.MAX_CODE_POINT + 1L));
        stacks.push(1, BigRational.of(0xD800));
        RunResult result = run(
                Instruction.of(OpKind.OUTPUT_CHAR, 1),
                Instruction.of(OpKind.OUTPUT_CHAR, 1),
                Instruction.of(OpKind.OUTPUT_CHAR, 1),
                Instruction.of(OpKind.OUTPUT_CHAR, 1));
        verify(io, never()).writeCodepoint(anyInt());
        assertThat(context.getCurses().count(FaultKind.INVALID_CODE_POINT)).isEqualTo(4);
        assertThat(result.curses()).isEqualTo(4);
        assertThat(stacks.depth(1)).isZero();
    }

    @Test
    @Tag("unit")
    void testOutputCharFromEmptyStackEmitsNothing() {
        RunResult result = run(Instruction.of(OpKind.OUTPUT_CHAR, 3));
        verify(io, never()).writeCodepoint(anyInt());
        assertThat(result.curses()).isEqualTo(1);
        assertThat(context.getCurses().count(FaultKind.EMPTY_STACK)).isEqualTo(1);
    }

    // --- INPUT_NUMBER ---
    @Test
    @Tag("unit")
    void testInputNumberPushesParsedValue() {
        when(io.readNumber()).thenReturn(Optional.of("3/4"), Optional.of("-2"));
        RunResult result = run(Instruction.of(OpKind.INPUT_NUMBER, 2), Instruction.of(OpKind.INPUT_NUMBER, 2));
        assertThat(stacks.snapshot(2)).containsExactly(
                BigRational.of(BigInteger.valueOf(3), BigInteger.valueOf(4)), BigRational.of(-2));
        assertThat(result.curses()).isZero();
    }

    @Test
    @Tag("unit")
    void testInputNumberFaultsOnMalformedTokenAndEndOfInput() {
        when(io.readNumber()).thenReturn(Optional.of("twelve"), Optional.empty());
        RunResult result = run(Instruction.of(OpKind.INPUT_NUMBER, 1), Instruction.of(OpKind.INPUT_NUMBER, 1));
        assertThat(stacks.snapshot(1)).containsExactly(BigRational.ZERO, BigRational.ZERO);
        assertThat(context.getCurses().count(FaultKind.MALFORMED_INPUT)).isEqualTo(1);
        assertThat(context.getCurses().count(FaultKind.END_OF_INPUT)).isEqualTo(1);
        assertThat(result.curses()).isEqualTo(2);
    }

    // --- INPUT_CHAR ---
    @Test
    @Tag("unit")
    void testInputCharPushesCodePointValue() {
        when(io.readCodepoint()).thenReturn(OptionalInt.of(0x1F600), OptionalInt.empty());
        RunResult result = run(Instruction.of(OpKind.INPUT_CHAR, 1), Instruction.of(OpKind.INPUT_CHAR, 1));
        assertThat(stacks.snapshot(1)).containsExactly(BigRational.of(0x1F600), BigRational.ZERO);
        assertThat(context.getCurses().count(FaultKind.END_OF_INPUT)).isEqualTo(1);
        assertThat(result.curses()).isEqualTo(1);
    }
}
