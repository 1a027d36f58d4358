package org.glyphstack.runtime.instructions;

import org.glyphstack.junit.extensions.logging.ExpectLog;
import org.glyphstack.junit.extensions.logging.LogLevel;
import org.glyphstack.junit.extensions.logging.LogWatchExtension;
import org.glyphstack.runtime.RunResult;
import org.glyphstack.runtime.VirtualMachine;
import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.io.StreamIoAdapter;
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
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(LogWatchExtension.class)
public class VMControlFlowInstructionTest {

    private ExecutionContext context;
    private StackBank stacks;
    private StringWriter output;

    @BeforeEach
    void setUp() {
        output = new StringWriter();
        context = new ExecutionContext(RationalBackend.ARBITRARY_PRECISION,
                new StreamIoAdapter(new StringReader(""), output));
        stacks = context.getStacks();
    }

    private RunResult run(Instruction... instructions) {
        return new VirtualMachine(Program.of(instructions), context).run();
    }

    // --- JUMP_IF_NONPOSITIVE ---
    @Test
    @Tag("unit")
    void testJnpFallsThroughOnPositiveTop() {
        stacks.push(1, BigRational.of(1));
        run(Instruction.of(OpKind.JUMP_IF_NONPOSITIVE, 1, 3),
                Instruction.of(OpKind.PUSH, 2, 9),
                Instruction.of(OpKind.TERMINATE));
        assertThat(stacks.snapshot(2)).containsExactly(BigRational.of(9));
        assertThat(stacks.snapshot(1)).containsExactly(BigRational.of(1), BigRational.of(9));
    }

    @Test
    @Tag("unit")
    void testJnpJumpsOnZeroAndNegativeTop() {
        stacks.push(1, BigRational.ZERO);
        stacks.push(2, BigRational.of(-4));
        RunResult result = run(Instruction.of(OpKind.JUMP_IF_NONPOSITIVE, 1, 2),
                Instruction.of(OpKind.PUSH, 3, 1),
                Instruction.of(OpKind.JUMP_IF_NONPOSITIVE, 2, 4),
                Instruction.of(OpKind.PUSH, 3, 1));
        assertThat(stacks.snapshot(3)).isEmpty();
        // the peek never pops
        assertThat(stacks.depth(1)).isEqualTo(1);
        assertThat(stacks.depth(2)).isEqualTo(1);
        assertThat(result).isEqualTo(new RunResult.Completed(0));
    }

    @Test
    @Tag("unit")
    void testJnpOnEmptyStackJumpsAndCurses() {
        RunResult result = run(Instruction.of(OpKind.JUMP_IF_NONPOSITIVE, 5, 2),
                Instruction.of(OpKind.PUSH, 1, 1));
        assertThat(stacks.snapshot(1)).isEmpty();
        assertThat(result.curses()).isEqualTo(1);
        assertThat(context.getCurses().count(FaultKind.EMPTY_STACK)).isEqualTo(1);
    }

    // --- JUMP_ALWAYS ---
    @Test
    @Tag("unit")
    void testJumpBackwardsDrivesALoop() {
        for (int value : new int[]{2, 1, 0}) {
            context.getQueue().enqueue(BigRational.of(value));
        }
        RunResult result = run(
                Instruction.of(OpKind.TRANSFER_FROM_QUEUE, 1),      // 0
                Instruction.of(OpKind.JUMP_IF_NONPOSITIVE, 1, 5),   // 1
                Instruction.of(OpKind.OUTPUT_NUMBER, 1),            // 2
                Instruction.of(OpKind.JUMP_ALWAYS, 0, 0),           // 3
                Instruction.of(OpKind.PUSH, 2, 99),                 // 4, skipped
                Instruction.of(OpKind.TERMINATE));                  // 5
        assertThat(output.toString()).isEqualTo("21");
        assertThat(stacks.snapshot(1)).containsExactly(BigRational.ZERO);
        assertThat(stacks.snapshot(2)).isEmpty();
        assertThat(result.curses()).isZero();
    }

    @Test
    @Tag("unit")
    void testJumpToProgramLengthCompletesNormally() {
        RunResult result = run(Instruction.of(OpKind.JUMP_ALWAYS, 0, 2), Instruction.of(OpKind.PUSH, 1, 1));
        assertThat(result).isEqualTo(new RunResult.Completed(0));
        assertThat(stacks.indices()).isEmpty();
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*instruction 1 jumps to 7.*")
    void testJumpBeyondProgramAborts() {
        RunResult result = run(Instruction.of(OpKind.PUSH, 1, 1),
                Instruction.of(OpKind.JUMP_ALWAYS, 0, 7),
                Instruction.of(OpKind.PUSH, 2, 1));
        assertThat(result).isEqualTo(new RunResult.Aborted(RunResult.AbortReason.INVALID_JUMP_TARGET, 1, 7, 0));
        assertThat(result.isCompleted()).isFalse();
        assertThat(stacks.snapshot(2)).isEmpty();
    }

    // --- TERMINATE ---
    @Test
    @Tag("unit")
    void testTerminateStopsTheRun() {
        RunResult result = run(Instruction.of(OpKind.TERMINATE), Instruction.of(OpKind.PUSH, 1, 1));
        assertThat(result.isCompleted()).isTrue();
        assertThat(stacks.indices()).isEmpty();
    }
}
