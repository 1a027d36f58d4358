package org.glyphstack.runtime.isa;

import org.glyphstack.runtime.model.Outcome;
import org.glyphstack.runtime.model.Rational;

/**
 * The arithmetic operators a {@link OpKind} combine instruction can chain across stacks.
 * The value popped from the lower-numbered stack is always the left operand.
 */
public enum CombineOperator {
    ADD {
        @Override
        public Outcome<Rational> apply(Rational left, Rational right) {
            return left.add(right);
        }
    },
    SUB {
        @Override
        public Outcome<Rational> apply(Rational left, Rational right) {
            return left.subtract(right);
        }
    },
    MUL {
        @Override
        public Outcome<Rational> apply(Rational left, Rational right) {
            return left.multiply(right);
        }
    },
    DIV {
        @Override
        public Outcome<Rational> apply(Rational left, Rational right) {
            return left.divide(right);
        }
    };

    public abstract Outcome<Rational> apply(Rational left, Rational right);
}
