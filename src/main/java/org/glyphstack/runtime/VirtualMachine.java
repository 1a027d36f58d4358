package org.glyphstack.runtime;

import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.isa.Dispatcher;
import org.glyphstack.runtime.isa.Instruction;
import org.glyphstack.runtime.isa.PointerUpdate;
import org.glyphstack.runtime.isa.Program;
import org.glyphstack.runtime.services.ProgramFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * The run loop. It owns the instruction pointer and drives the pointer state machine:
 * <ul>
 *   <li>{@code Running(p)}: fetch the instruction at {@code p}; a pointer outside the program
 *       is the normal end of the run and yields {@link RunResult.Completed}.</li>
 *   <li>Dispatch it and apply the returned {@link PointerUpdate}. A jump to a target outside
 *       {@code [0, length]} is fatal and yields {@link RunResult.Aborted}.</li>
 * </ul>
 * Recoverable faults never stop the loop; they only grow the curse counter of the context.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final Program program;
    private final ExecutionContext context;
    private final Dispatcher dispatcher;
    private final ProgramFormatter formatter = new ProgramFormatter();
    private int pointer = 0;
    private long stepsExecuted = 0L;
    private RunResult result = null;
    private boolean traceEnabled = false;

    /**
     * Creates a VM for one run of a program.
     * @param program The program to execute.
     * @param context A fresh machine state; it must not be shared with another run.
     */
    public VirtualMachine(Program program, ExecutionContext context) {
        this(program, context, new Dispatcher());
    }

    public VirtualMachine(Program program, ExecutionContext context, Dispatcher dispatcher) {
        this.program = Objects.requireNonNull(program, "program");
        this.context = Objects.requireNonNull(context, "context");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Runs the program until it completes or aborts.
     * @return The run result.
     */
    public RunResult run() {
        LOG.debug("Starting run of '{}' ({} instructions, backend={})",
                program.getName(), program.size(), context.getBackend());
        Optional<RunResult> finished = step();
        while (finished.isEmpty()) {
            finished = step();
        }
        return finished.get();
    }

    /**
     * Executes at most one instruction.
     * @return The run result once the run has ended, empty while it is still running.
     */
    public Optional<RunResult> step() {
        if (result != null) {
            return Optional.of(result);
        }
        if (!program.isInRange(pointer)) {
            return Optional.of(complete());
        }

        int index = pointer;
        Instruction instruction = program.get(index);
        context.setCurrentInstructionIndex(index);
        long cursesBefore = context.getCurses().total();

        PointerUpdate update = dispatcher.dispatch(instruction, context);
        stepsExecuted++;

        if (traceEnabled) {
            LOG.debug("Step={} IP={} Instr={} Update={} Curses={}(+{})",
                    stepsExecuted, index, formatter.format(instruction), update,
                    context.getCurses().total(), context.getCurses().total() - cursesBefore);
            LOG.trace("  Stacks={} Queue={}", context.getStacks(), context.getQueue());
        }

        if (update instanceof PointerUpdate.Advance) {
            pointer = index + 1;
        } else if (update instanceof PointerUpdate.JumpTo jump) {
            if (!program.isValidJumpTarget(jump.target())) {
                return Optional.of(abort(index, jump.target()));
            }
            pointer = (int) jump.target();
        } else if (update instanceof PointerUpdate.Halt) {
            return Optional.of(complete());
        }
        return Optional.empty();
    }

    private RunResult complete() {
        result = new RunResult.Completed(context.getCurses().total());
        LOG.debug("Run of '{}' completed after {} steps with {} curses {}",
                program.getName(), stepsExecuted, context.getCurses().total(), context.getCurses().breakdown());
        return result;
    }

    private RunResult abort(int index, long target) {
        result = new RunResult.Aborted(RunResult.AbortReason.INVALID_JUMP_TARGET, index, target,
                context.getCurses().total());
        LOG.warn("Run of '{}' aborted: instruction {} jumps to {}, outside [0, {}]",
                program.getName(), index, target, program.size());
        return result;
    }

    public boolean isFinished() {
        return result != null;
    }

    /**
     * @return The index of the next instruction to execute.
     */
    public int getPointer() {
        return pointer;
    }

    public long getStepsExecuted() {
        return stepsExecuted;
    }

    public Program getProgram() {
        return program;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public boolean isTraceEnabled() {
        return traceEnabled;
    }

    public void setTraceEnabled(boolean traceEnabled) {
        this.traceEnabled = traceEnabled;
    }
}
