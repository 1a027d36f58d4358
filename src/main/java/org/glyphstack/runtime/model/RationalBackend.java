package org.glyphstack.runtime.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Selects the {@link Rational} implementation used for one run and creates its values.
 * The two backends differ only in whether overflow can occur.
 */
public enum RationalBackend {

    /** 64-bit numerator and denominator; overflow is a recoverable fault. */
    BOUNDED("bounded") {
        @Override
        public Rational zero() {
            return BoundedRational.ZERO;
        }

        @Override
        public Rational fromInteger(long value) {
            return BoundedRational.of(value);
        }

        @Override
        public Optional<Rational> fromFraction(BigInteger numerator, BigInteger denominator) {
            return BoundedRational.fromBigIntegers(numerator, denominator).map(r -> r);
        }
    },

    /** Unbounded numerator and denominator. */
    ARBITRARY_PRECISION("arbitrary-precision") {
        @Override
        public Rational zero() {
            return BigRational.ZERO;
        }

        @Override
        public Rational fromInteger(long value) {
            return BigRational.of(value);
        }

        @Override
        public Optional<Rational> fromFraction(BigInteger numerator, BigInteger denominator) {
            return Optional.of(BigRational.of(numerator, denominator));
        }
    };

    private static final Pattern FRACTION = Pattern.compile("([+-]?\\d+)/(\\d+)");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final String configValue;

    RationalBackend(String configValue) {
        this.configValue = configValue;
    }

    /**
     * @return The additive identity {@code 0/1}, which is also the policy value.
     */
    public abstract Rational zero();

    public abstract Rational fromInteger(long value);

    /**
     * Creates a reduced value from an unbounded pair.
     * @param numerator The numerator.
     * @param denominator The denominator, must not be zero.
     * @return The value, or empty if it does not fit this backend.
     */
    public abstract Optional<Rational> fromFraction(BigInteger numerator, BigInteger denominator);

    /**
     * Parses a numeric input token. Accepted forms are integers ({@code -12}), fractions
     * ({@code 3/4}) and finite decimals ({@code 1.25}).
     *
     * @param token The token text.
     * @return The parsed value, or a faulted outcome ({@link FaultKind#MALFORMED_INPUT} or
     *         {@link FaultKind#OVERFLOW}) carrying the policy value.
     */
    public Outcome<Rational> parse(String token) {
        String text = token == null ? "" : token.trim();
        BigInteger numerator;
        BigInteger denominator;

        Matcher fraction = FRACTION.matcher(text);
        if (fraction.matches()) {
            numerator = new BigInteger(stripPlus(fraction.group(1)));
            denominator = new BigInteger(fraction.group(2));
            if (denominator.signum() == 0) {
                return Outcome.faulted(zero(), FaultKind.MALFORMED_INPUT);
            }
        } else if (DECIMAL.matcher(text).matches()) {
            BigDecimal decimal = new BigDecimal(text);
            numerator = decimal.unscaledValue();
            denominator = BigInteger.ONE;
            if (decimal.scale() > 0) {
                denominator = BigInteger.TEN.pow(decimal.scale());
            } else if (decimal.scale() < 0) {
                numerator = numerator.multiply(BigInteger.TEN.pow(-decimal.scale()));
            }
        } else {
            return Outcome.faulted(zero(), FaultKind.MALFORMED_INPUT);
        }

        return fromFraction(numerator, denominator)
                .map(Outcome::ok)
                .orElseGet(() -> Outcome.faulted(zero(), FaultKind.OVERFLOW));
    }

    private static String stripPlus(String text) {
        return text.startsWith("+") ? text.substring(1) : text;
    }

    /**
     * @return The name used for this backend in configuration files and on the command line.
     */
    public String configValue() {
        return configValue;
    }

    /**
     * Resolves a configuration value such as {@code "bounded"} or {@code "arbitrary-precision"}.
     * The enum constant name is accepted as well.
     *
     * @param value The configured value.
     * @return The backend.
     * @throws IllegalArgumentException if the value names no backend.
     */
    public static RationalBackend fromConfigValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (RationalBackend backend : values()) {
            if (backend.configValue.equals(normalized)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown numeric backend: '" + value
                + "' (expected 'bounded' or 'arbitrary-precision')");
    }
}
