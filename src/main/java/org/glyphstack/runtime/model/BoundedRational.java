package org.glyphstack.runtime.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * A rational held in two 64-bit signed integers.
 * <p>
 * Every intermediate product and sum is computed with the {@code Math.*Exact} family, so a
 * result that does not fit is reported as an {@link FaultKind#OVERFLOW} outcome instead of
 * wrapping around.
 */
public final class BoundedRational implements Rational {

    /** The additive identity and policy value of this backend. */
    public static final BoundedRational ZERO = new BoundedRational(0L, 1L);

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final long numerator;
    private final long denominator;

    private BoundedRational(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * Creates an integral value.
     * @param value The integer.
     * @return The rational {@code value/1}.
     */
    public static BoundedRational of(long value) {
        return value == 0L ? ZERO : new BoundedRational(value, 1L);
    }

    /**
     * Creates a reduced value from an arbitrary numerator/denominator pair.
     * @param numerator The numerator.
     * @param denominator The denominator, must not be zero.
     * @return The reduced value.
     * @throws ArithmeticException if the denominator is zero or normalizing the sign overflows.
     */
    public static BoundedRational of(long numerator, long denominator) {
        if (denominator == 0L) {
            throw new ArithmeticException("Denominator is zero");
        }
        if (denominator < 0L) {
            numerator = Math.negateExact(numerator);
            denominator = Math.negateExact(denominator);
        }
        return reduce(numerator, denominator);
    }

    /**
     * Narrows an unbounded pair into this representation.
     * @param numerator The numerator.
     * @param denominator The denominator, must not be zero.
     * @return The value, or empty if the reduced pair does not fit in 64 bits.
     */
    public static Optional<BoundedRational> fromBigIntegers(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Denominator is zero");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        BigInteger n = numerator.divide(gcd);
        BigInteger d = denominator.divide(gcd);
        if (!fits(n) || !fits(d)) {
            return Optional.empty();
        }
        return Optional.of(n.signum() == 0 ? ZERO : new BoundedRational(n.longValueExact(), d.longValueExact()));
    }

    private static boolean fits(BigInteger value) {
        return value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0;
    }

    /**
     * Reduces a pair whose denominator is already positive.
     */
    private static BoundedRational reduce(long numerator, long denominator) {
        if (numerator == 0L) {
            return ZERO;
        }
        long gcd = gcd(numerator, denominator);
        return new BoundedRational(numerator / gcd, denominator / gcd);
    }

    /**
     * Euclid on signed operands; the remainder sequence never needs the absolute value of
     * {@code Long.MIN_VALUE} unless both operands are it.
     */
    private static long gcd(long a, long b) {
        while (b != 0L) {
            long t = a % b;
            a = b;
            b = t;
        }
        return Math.absExact(a);
    }

    private static Outcome<Rational> overflow() {
        return Outcome.faulted(ZERO, FaultKind.OVERFLOW);
    }

    /**
     * Brings {@code other} into this representation.
     */
    private static Optional<BoundedRational> narrow(Rational other) {
        if (other instanceof BoundedRational bounded) {
            return Optional.of(bounded);
        }
        return fromBigIntegers(other.numerator(), other.denominator());
    }

    public long longNumerator() {
        return numerator;
    }

    public long longDenominator() {
        return denominator;
    }

    @Override
    public BigInteger numerator() {
        return BigInteger.valueOf(numerator);
    }

    @Override
    public BigInteger denominator() {
        return BigInteger.valueOf(denominator);
    }

    @Override
    public RationalBackend backend() {
        return RationalBackend.BOUNDED;
    }

    @Override
    public Outcome<Rational> add(Rational other) {
        Optional<BoundedRational> narrowed = narrow(other);
        if (narrowed.isEmpty()) {
            return overflow();
        }
        BoundedRational o = narrowed.get();
        try {
            long g = gcd(denominator, o.denominator);
            long n = Math.addExact(
                    Math.multiplyExact(numerator, o.denominator / g),
                    Math.multiplyExact(o.numerator, denominator / g));
            long d = Math.multiplyExact(denominator, o.denominator / g);
            return Outcome.ok(reduce(n, d));
        } catch (ArithmeticException e) {
            return overflow();
        }
    }

    @Override
    public Outcome<Rational> subtract(Rational other) {
        Optional<BoundedRational> narrowed = narrow(other);
        if (narrowed.isEmpty()) {
            return overflow();
        }
        BoundedRational o = narrowed.get();
        try {
            long g = gcd(denominator, o.denominator);
            long n = Math.subtractExact(
                    Math.multiplyExact(numerator, o.denominator / g),
                    Math.multiplyExact(o.numerator, denominator / g));
            long d = Math.multiplyExact(denominator, o.denominator / g);
            return Outcome.ok(reduce(n, d));
        } catch (ArithmeticException e) {
            return overflow();
        }
    }

    @Override
    public Outcome<Rational> multiply(Rational other) {
        Optional<BoundedRational> narrowed = narrow(other);
        if (narrowed.isEmpty()) {
            return overflow();
        }
        BoundedRational o = narrowed.get();
        if (numerator == 0L || o.numerator == 0L) {
            return Outcome.ok(ZERO);
        }
        try {
            // cross-reduce first so the products stay as small as possible
            long g1 = gcd(numerator, o.denominator);
            long g2 = gcd(o.numerator, denominator);
            long n = Math.multiplyExact(numerator / g1, o.numerator / g2);
            long d = Math.multiplyExact(denominator / g2, o.denominator / g1);
            return Outcome.ok(new BoundedRational(n, d));
        } catch (ArithmeticException e) {
            return overflow();
        }
    }

    @Override
    public Outcome<Rational> divide(Rational other) {
        if (other.sign() == 0) {
            return Outcome.faulted(ZERO, FaultKind.DIVISION_BY_ZERO);
        }
        Optional<BoundedRational> narrowed = narrow(other);
        if (narrowed.isEmpty()) {
            return overflow();
        }
        BoundedRational o = narrowed.get();
        if (numerator == 0L) {
            return Outcome.ok(ZERO);
        }
        try {
            // equal numerators cancel to 1; gcd(MIN_VALUE, MIN_VALUE) has no positive long form
            long g1 = numerator == o.numerator ? numerator : gcd(numerator, o.numerator);
            long g2 = gcd(denominator, o.denominator);
            long n = Math.multiplyExact(numerator / g1, o.denominator / g2);
            long d = Math.multiplyExact(denominator / g2, o.numerator / g1);
            if (d < 0L) {
                n = Math.negateExact(n);
                d = Math.negateExact(d);
            }
            return Outcome.ok(new BoundedRational(n, d));
        } catch (ArithmeticException e) {
            return overflow();
        }
    }

    @Override
    public Outcome<Rational> negate() {
        if (numerator == Long.MIN_VALUE) {
            return overflow();
        }
        return Outcome.ok(numerator == 0L ? ZERO : new BoundedRational(-numerator, denominator));
    }

    @Override
    public int sign() {
        return Long.signum(numerator);
    }

    @Override
    public boolean isInteger() {
        return denominator == 1L;
    }

    @Override
    public int compareTo(Rational other) {
        if (other instanceof BoundedRational o) {
            if (denominator == o.denominator) {
                return Long.compare(numerator, o.numerator);
            }
            try {
                return Long.compare(
                        Math.multiplyExact(numerator, o.denominator),
                        Math.multiplyExact(o.numerator, denominator));
            } catch (ArithmeticException e) {
                return Rational.super.compareTo(other);
            }
        }
        return Rational.super.compareTo(other);
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof BoundedRational other) {
            return numerator == other.numerator && denominator == other.denominator;
        }
        return Rational.sameValue(this, o);
    }

    @Override
    public int hashCode() {
        return Rational.hash(this);
    }

    @Override
    public String toString() {
        return denominator == 1L ? Long.toString(numerator) : numerator + "/" + denominator;
    }
}
