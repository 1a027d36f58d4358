package org.glyphstack.runtime.isa;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of operations an {@link Instruction} can carry, together with the mnemonic
 * used in program listings and the operands each one reads.
 */
public enum OpKind {
    PUSH("PUSH", Operands.SPAN_AND_MAGNITUDE, false, null),
    COMBINE_ADD("ADD", Operands.SPAN, false, CombineOperator.ADD),
    COMBINE_SUB("SUB", Operands.SPAN, false, CombineOperator.SUB),
    COMBINE_MUL("MUL", Operands.SPAN, false, CombineOperator.MUL),
    COMBINE_DIV("DIV", Operands.SPAN, false, CombineOperator.DIV),
    TRANSFER_TO_QUEUE("ENQ", Operands.SPAN, true, null),
    TRANSFER_FROM_QUEUE("DEQ", Operands.SPAN, true, null),
    DUPLICATE_SPREAD("SPRD", Operands.SPAN, false, null),
    JUMP_IF_NONPOSITIVE("JNP", Operands.SPAN_AND_TARGET, true, null),
    JUMP_ALWAYS("JMP", Operands.TARGET, false, null),
    OUTPUT_NUMBER("OUTN", Operands.SPAN, true, null),
    OUTPUT_CHAR("OUTC", Operands.SPAN, true, null),
    INPUT_NUMBER("INN", Operands.SPAN, true, null),
    INPUT_CHAR("INC", Operands.SPAN, true, null),
    TERMINATE("HALT", Operands.NONE, false, null);

    /**
     * Which of span and magnitude an operation reads. A target is a magnitude used as an
     * absolute instruction index.
     */
    public enum Operands {
        NONE(false, false),
        SPAN(true, false),
        SPAN_AND_MAGNITUDE(true, true),
        SPAN_AND_TARGET(true, true),
        TARGET(false, true);

        private final boolean span;
        private final boolean magnitude;

        Operands(boolean span, boolean magnitude) {
            this.span = span;
            this.magnitude = magnitude;
        }

        public boolean hasSpan() {
            return span;
        }

        public boolean hasMagnitude() {
            return magnitude;
        }

        public boolean isJumpTarget() {
            return this == SPAN_AND_TARGET || this == TARGET;
        }

        public int count() {
            return (span ? 1 : 0) + (magnitude ? 1 : 0);
        }
    }

    private final String mnemonic;
    private final Operands operands;
    private final boolean addressesSingleStack;
    private final CombineOperator combineOperator;

    OpKind(String mnemonic, Operands operands, boolean addressesSingleStack, CombineOperator combineOperator) {
        this.mnemonic = mnemonic;
        this.operands = operands;
        this.addressesSingleStack = addressesSingleStack;
        this.combineOperator = combineOperator;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public Operands operands() {
        return operands;
    }

    /**
     * @return {@code true} if the span names one stack ("stack {@code span}") rather than a
     *         range of stacks, which makes a span of zero meaningless.
     */
    public boolean addressesSingleStack() {
        return addressesSingleStack;
    }

    /**
     * @return The arithmetic operator of a combine operation, or {@code null} for other kinds.
     */
    public CombineOperator combineOperator() {
        return combineOperator;
    }

    public boolean isCombine() {
        return combineOperator != null;
    }

    /**
     * Looks up an operation by its listing mnemonic, ignoring case.
     * @param mnemonic The mnemonic, e.g. {@code "jnp"}.
     * @return The operation, or empty if unknown.
     */
    public static Optional<OpKind> byMnemonic(String mnemonic) {
        String upper = mnemonic.toUpperCase(Locale.ROOT);
        for (OpKind kind : values()) {
            if (kind.mnemonic.equals(upper)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
