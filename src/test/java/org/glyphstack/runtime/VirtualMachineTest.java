package org.glyphstack.runtime;

import org.glyphstack.junit.extensions.logging.ExpectLog;
import org.glyphstack.junit.extensions.logging.LogLevel;
import org.glyphstack.junit.extensions.logging.LogWatchExtension;
import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.io.StreamIoAdapter;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.OpKind;
import org.glyphstack.runtime.isa.Program;
import org.glyphstack.runtime.model.BigRational;
import org.glyphstack.runtime.model.BoundedRational;
import org.glyphstack.runtime.model.Rational;
import org.glyphstack.runtime.model.RationalBackend;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class VirtualMachineTest {

    private static ExecutionContext newContext(RationalBackend backend) {
        return new ExecutionContext(backend, new StreamIoAdapter(new StringReader(""), new StringWriter()));
    }

    @Test
    void emptyProgramCompletesImmediately() {
        VirtualMachine vm = new VirtualMachine(Program.of(), newContext(RationalBackend.BOUNDED));
        assertThat(vm.run()).isEqualTo(new RunResult.Completed(0));
        assertThat(vm.getStepsExecuted()).isZero();
        assertThat(vm.isFinished()).isTrue();
    }

    @Test
    void walkingOffTheEndIsNormalTerminationWithoutExtraFaults() {
        ExecutionContext context = newContext(RationalBackend.ARBITRARY_PRECISION);
        VirtualMachine vm = new VirtualMachine(Program.of(
                Instruction.of(OpKind.PUSH, 1, 1),
                Instruction.of(OpKind.TRANSFER_FROM_QUEUE, 1)), context);

        assertThat(vm.step()).isEmpty();
        assertThat(vm.getPointer()).isEqualTo(1);
        assertThat(vm.step()).isEmpty();
        assertThat(vm.getPointer()).isEqualTo(2);
        assertThat(context.getCurses().total()).isEqualTo(1);

        Optional<RunResult> result = vm.step();
        assertThat(result).contains(new RunResult.Completed(1));
        assertThat(vm.getStepsExecuted()).isEqualTo(2);
        assertThat(context.getCurses().total()).isEqualTo(1);
    }

    @Test
    void stepAfterTheEndKeepsReturningTheResult() {
        VirtualMachine vm = new VirtualMachine(Program.of(Instruction.of(OpKind.TERMINATE)),
                newContext(RationalBackend.BOUNDED));
        RunResult first = vm.run();
        assertThat(vm.step()).contains(first);
        assertThat(vm.getStepsExecuted()).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*aborted.*")
    void fatalJumpStopsExecutionImmediately() {
        ExecutionContext context = newContext(RationalBackend.ARBITRARY_PRECISION);
        VirtualMachine vm = new VirtualMachine(Program.of(
                Instruction.of(OpKind.TRANSFER_FROM_QUEUE, 1),
                Instruction.of(OpKind.JUMP_ALWAYS, 0, 4),
                Instruction.of(OpKind.PUSH, 1, 1)), context);

        RunResult result = vm.run();

        assertThat(result).isInstanceOf(RunResult.Aborted.class);
        RunResult.Aborted aborted = (RunResult.Aborted) result;
        assertThat(aborted.reason()).isEqualTo(RunResult.AbortReason.INVALID_JUMP_TARGET);
        assertThat(aborted.instructionIndex()).isEqualTo(1);
        assertThat(aborted.target()).isEqualTo(4);
        assertThat(aborted.curses()).isEqualTo(1);
        assertThat(vm.getStepsExecuted()).isEqualTo(2);
        assertThat(context.getStacks().snapshot(1)).containsExactly(BigRational.ZERO);
    }

    @Test
    void curseCounterNeverDecreasesAndCountsEachFault() {
        ExecutionContext context = newContext(RationalBackend.ARBITRARY_PRECISION);
        VirtualMachine vm = new VirtualMachine(Program.of(
                Instruction.of(OpKind.OUTPUT_NUMBER, 1),        // 1 fault
                Instruction.of(OpKind.PUSH, 2, 0),
                Instruction.of(OpKind.COMBINE_DIV, 2),          // 0 / 0: 1 fault
                Instruction.of(OpKind.TRANSFER_TO_QUEUE, 3),    // 1 fault
                Instruction.of(OpKind.PUSH, 1, 4),
                Instruction.of(OpKind.JUMP_IF_NONPOSITIVE, 7, 7),  // empty, jumps to end: 1 fault
                Instruction.of(OpKind.OUTPUT_CHAR, 1)), context);

        long[] expectedAfterStep = {1, 1, 2, 3, 3, 4};
        long previous = 0;
        for (long expected : expectedAfterStep) {
            assertThat(vm.step()).isEmpty();
            long now = context.getCurses().total();
            assertThat(now).isGreaterThanOrEqualTo(previous).isEqualTo(expected);
            previous = now;
        }
        assertThat(vm.step()).contains(new RunResult.Completed(4));
    }

    @Test
    void divisionThenMultiplicationRoundTripsExactly() {
        Rational[][] pairs = {
                {BigRational.of(7), BigRational.of(3)},
                {BigRational.of(BigInteger.valueOf(-5), BigInteger.valueOf(6)), BigRational.of(BigInteger.valueOf(4), BigInteger.valueOf(9))},
                {BigRational.of(BigInteger.TEN.pow(30)), BigRational.of(BigInteger.valueOf(-17))},
        };
        Program program = Program.of(
                Instruction.of(OpKind.COMBINE_DIV, 2),
                Instruction.of(OpKind.TRANSFER_TO_QUEUE, 2),
                Instruction.of(OpKind.TRANSFER_FROM_QUEUE, 1),
                Instruction.of(OpKind.COMBINE_MUL, 2));

        for (Rational[] pair : pairs) {
            ExecutionContext context = newContext(RationalBackend.ARBITRARY_PRECISION);
            context.getStacks().push(1, pair[0]);
            context.getStacks().push(2, pair[1]);
            context.getStacks().push(2, pair[1]);

            RunResult result = new VirtualMachine(program, context).run();

            assertThat(result.curses()).isZero();
            assertThat(context.getStacks().snapshot(2)).containsExactly(pair[0]);
        }
    }

    @Test
    void boundedBackendOverflowsWhereArbitraryPrecisionDoesNot() {
        Program program = Program.of(
                Instruction.of(OpKind.PUSH, 2, Long.MAX_VALUE),
                Instruction.of(OpKind.COMBINE_ADD, 2));

        ExecutionContext bounded = newContext(RationalBackend.BOUNDED);
        RunResult boundedResult = new VirtualMachine(program, bounded).run();
        assertThat(boundedResult.curses()).isEqualTo(1);
        assertThat(bounded.getStacks().snapshot(2)).containsExactly(BoundedRational.ZERO);

        ExecutionContext exact = newContext(RationalBackend.ARBITRARY_PRECISION);
        RunResult exactResult = new VirtualMachine(program, exact).run();
        assertThat(exactResult.curses()).isZero();
        assertThat(exact.getStacks().peek(2).value().numerator())
                .isEqualTo(BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.TWO));
    }

    @Test
    void independentRunsShareNoState() {
        Program program = Program.of(Instruction.of(OpKind.PUSH, 1, 3), Instruction.of(OpKind.TRANSFER_FROM_QUEUE, 2));
        ExecutionContext first = newContext(RationalBackend.ARBITRARY_PRECISION);
        ExecutionContext second = newContext(RationalBackend.ARBITRARY_PRECISION);

        new VirtualMachine(program, first).run();
        new VirtualMachine(program, second).run();

        assertThat(first.getStacks().snapshot(1)).containsExactly(BigRational.of(3));
        assertThat(second.getStacks().snapshot(1)).containsExactly(BigRational.of(3));
        assertThat(first.getCurses().total()).isEqualTo(1);
        assertThat(second.getCurses().total()).isEqualTo(1);
    }

    @Test
    void tracingDoesNotChangeTheResult() {
        Program program = Program.of(Instruction.of(OpKind.PUSH, 2, 5), Instruction.of(OpKind.COMBINE_MUL, 2));
        ExecutionContext context = newContext(RationalBackend.ARBITRARY_PRECISION);
        VirtualMachine vm = new VirtualMachine(program, context);
        vm.setTraceEnabled(true);
        assertThat(vm.isTraceEnabled()).isTrue();
        assertThat(vm.run()).isEqualTo(new RunResult.Completed(0));
        assertThat(context.getStacks().snapshot(2)).containsExactly(BigRational.of(25));
    }

    @Test
    void rejectsMissingCollaborators() {
        assertThatThrownBy(() -> new VirtualMachine(null, newContext(RationalBackend.BOUNDED)))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new VirtualMachine(Program.of(), null))
                .isInstanceOf(NullPointerException.class);
    }
}
