package org.glyphstack.runtime.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * An exact, immutable signed rational number, always held in lowest terms with a positive
 * denominator. Arithmetic never rounds: results that cannot be produced (division by zero,
 * bounded-width overflow) come back as a faulted {@link Outcome} carrying {@code 0/1}.
 * <p>
 * Values of different backends may be combined; the receiver's backend decides the
 * representation of the result.
 */
public interface Rational extends Comparable<Rational> {

    /**
     * @return The reduced numerator.
     */
    BigInteger numerator();

    /**
     * @return The reduced denominator, always positive.
     */
    BigInteger denominator();

    /**
     * @return The backend this value belongs to.
     */
    RationalBackend backend();

    Outcome<Rational> add(Rational other);

    Outcome<Rational> subtract(Rational other);

    Outcome<Rational> multiply(Rational other);

    /**
     * Divides this value by {@code other}.
     * @param other The divisor.
     * @return The quotient, or a {@link FaultKind#DIVISION_BY_ZERO} outcome carrying {@code 0/1}.
     */
    Outcome<Rational> divide(Rational other);

    Outcome<Rational> negate();

    /**
     * @return -1, 0 or 1.
     */
    int sign();

    /**
     * @return {@code true} if the denominator is one.
     */
    default boolean isInteger() {
        return BigInteger.ONE.equals(denominator());
    }

    /**
     * @return The integer value if this rational is integral, empty otherwise.
     */
    default Optional<BigInteger> toIntegerIfExact() {
        return isInteger() ? Optional.of(numerator()) : Optional.empty();
    }

    /**
     * Orders two rationals by cross-multiplying their reduced numerators and denominators.
     */
    @Override
    default int compareTo(Rational other) {
        BigInteger left = numerator().multiply(other.denominator());
        BigInteger right = other.numerator().multiply(denominator());
        return left.compareTo(right);
    }

    /**
     * Formats a value in its decimal text form: {@code -12} for integers,
     * {@code -7/2} otherwise.
     * @param value The value to format.
     * @return The text form.
     */
    static String format(Rational value) {
        if (value.isInteger()) {
            return value.numerator().toString();
        }
        return value.numerator() + "/" + value.denominator();
    }

    /**
     * Equality shared by both backends: same reduced numerator and denominator.
     * @param value The receiver.
     * @param other The object to compare against.
     * @return {@code true} if both denote the same number.
     */
    static boolean sameValue(Rational value, Object other) {
        if (value == other) {
            return true;
        }
        if (!(other instanceof Rational r)) {
            return false;
        }
        return value.numerator().equals(r.numerator()) && value.denominator().equals(r.denominator());
    }

    /**
     * Hash code shared by both backends so equal values hash alike.
     * @param value The value.
     * @return The hash code.
     */
    static int hash(Rational value) {
        return 31 * value.numerator().hashCode() + value.denominator().hashCode();
    }
}
