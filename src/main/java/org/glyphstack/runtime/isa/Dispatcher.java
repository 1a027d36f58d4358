package org.glyphstack.runtime.isa;

import org.glyphstack.runtime.internal.services.ExecutionContext;
import org.glyphstack.runtime.isa.handlers.ArithmeticHandler;
import org.glyphstack.runtime.isa.handlers.ControlFlowHandler;
import org.glyphstack.runtime.isa.handlers.DataHandler;
import org.glyphstack.runtime.isa.handlers.IoHandler;
import org.glyphstack.runtime.isa.handlers.QueueHandler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes each instruction to the handler of its family. Dispatch is a function of the
 * instruction and the machine state alone; the returned {@link PointerUpdate} is applied by
 * the run loop.
 */
public class Dispatcher {

    private final Map<OpKind, InstructionHandler> handlers = new EnumMap<>(OpKind.class);

    /**
     * Creates a dispatcher with every instruction family registered.
     */
    public Dispatcher() {
        registerFamily(new DataHandler(), List.of(OpKind.PUSH, OpKind.DUPLICATE_SPREAD));
        registerFamily(new ArithmeticHandler(),
                List.of(OpKind.COMBINE_ADD, OpKind.COMBINE_SUB, OpKind.COMBINE_MUL, OpKind.COMBINE_DIV));
        registerFamily(new QueueHandler(), List.of(OpKind.TRANSFER_TO_QUEUE, OpKind.TRANSFER_FROM_QUEUE));
        registerFamily(new ControlFlowHandler(),
                List.of(OpKind.JUMP_IF_NONPOSITIVE, OpKind.JUMP_ALWAYS, OpKind.TERMINATE));
        registerFamily(new IoHandler(),
                List.of(OpKind.OUTPUT_NUMBER, OpKind.OUTPUT_CHAR, OpKind.INPUT_NUMBER, OpKind.INPUT_CHAR));

        for (OpKind kind : OpKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler registered for " + kind);
            }
        }
    }

    private void registerFamily(InstructionHandler handler, List<OpKind> kinds) {
        for (OpKind kind : kinds) {
            InstructionHandler previous = handlers.put(kind, handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for " + kind);
            }
        }
    }

    /**
     * Executes one instruction.
     * @param instruction The instruction.
     * @param context The machine state of the current run.
     * @return The pointer update requested by the instruction.
     */
    public PointerUpdate dispatch(Instruction instruction, ExecutionContext context) {
        return handlers.get(instruction.opcode()).execute(instruction, context);
    }
}
