package org.glyphstack.runtime.model;

import java.math.BigInteger;

/**
 * A rational with unbounded numerator and denominator. Arithmetic never overflows; the only
 * fault this backend can raise is {@link FaultKind#DIVISION_BY_ZERO}.
 */
public final class BigRational implements Rational {

    /** The additive identity and policy value of this backend. */
    public static final BigRational ZERO = new BigRational(BigInteger.ZERO, BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private BigRational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static BigRational of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static BigRational of(BigInteger value) {
        return value.signum() == 0 ? ZERO : new BigRational(value, BigInteger.ONE);
    }

    /**
     * Creates a reduced value.
     * @param numerator The numerator.
     * @param denominator The denominator, must not be zero.
     * @return The value in lowest terms with a positive denominator.
     * @throws ArithmeticException if the denominator is zero.
     */
    public static BigRational of(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Denominator is zero");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (gcd.equals(BigInteger.ONE)) {
            return new BigRational(numerator, denominator);
        }
        return new BigRational(numerator.divide(gcd), denominator.divide(gcd));
    }

    @Override
    public BigInteger numerator() {
        return numerator;
    }

    @Override
    public BigInteger denominator() {
        return denominator;
    }

    @Override
    public RationalBackend backend() {
        return RationalBackend.ARBITRARY_PRECISION;
    }

    @Override
    public Outcome<Rational> add(Rational other) {
        BigInteger n = numerator.multiply(other.denominator()).add(other.numerator().multiply(denominator));
        return Outcome.ok(of(n, denominator.multiply(other.denominator())));
    }

    @Override
    public Outcome<Rational> subtract(Rational other) {
        BigInteger n = numerator.multiply(other.denominator()).subtract(other.numerator().multiply(denominator));
        return Outcome.ok(of(n, denominator.multiply(other.denominator())));
    }

    @Override
    public Outcome<Rational> multiply(Rational other) {
        return Outcome.ok(of(numerator.multiply(other.numerator()), denominator.multiply(other.denominator())));
    }

    @Override
    public Outcome<Rational> divide(Rational other) {
        if (other.sign() == 0) {
            return Outcome.faulted(ZERO, FaultKind.DIVISION_BY_ZERO);
        }
        return Outcome.ok(of(numerator.multiply(other.denominator()), denominator.multiply(other.numerator())));
    }

    @Override
    public Outcome<Rational> negate() {
        return Outcome.ok(numerator.signum() == 0 ? ZERO : new BigRational(numerator.negate(), denominator));
    }

    @Override
    public int sign() {
        return numerator.signum();
    }

    @Override
    public boolean equals(Object o) {
        return Rational.sameValue(this, o);
    }

    @Override
    public int hashCode() {
        return Rational.hash(this);
    }

    @Override
    public String toString() {
        return Rational.format(this);
    }
}
