package org.javai.cdlexport.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;

/**
 * Real number held as an exact, normalized rational so that folding is deterministic:
 * {@code 4000 / 1.2} is exactly {@code 10000/3}. Operations without a rational result
 * (roots, logarithms, fractional powers) go through {@code double} and are converted
 * back from its shortest decimal form.
 *
 * @param numerator the numerator, carrying the sign
 * @param denominator the denominator, always positive
 */
public record NumberValue(BigInteger numerator, BigInteger denominator) implements Value, Comparable<NumberValue> {

	public static final NumberValue ZERO = of(0);
	public static final NumberValue ONE = of(1);

	private static final List<BigInteger> TERMINATING_FACTORS = List.of(BigInteger.TWO, BigInteger.valueOf(5));

	private static final int MAX_EXACT_EXPONENT = 4096;

	public NumberValue {
		Objects.requireNonNull(numerator, "numerator must not be null");
		Objects.requireNonNull(denominator, "denominator must not be null");
		if (denominator.signum() == 0) {
			throw new ArithmeticException("Division by zero");
		}
		if (denominator.signum() < 0) {
			numerator = numerator.negate();
			denominator = denominator.negate();
		}
		BigInteger gcd = numerator.gcd(denominator);
		if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
			numerator = numerator.divide(gcd);
			denominator = denominator.divide(gcd);
		}
		if (numerator.signum() == 0) {
			denominator = BigInteger.ONE;
		}
	}

	public static NumberValue of(long value) {
		return new NumberValue(BigInteger.valueOf(value), BigInteger.ONE);
	}

	public static NumberValue of(long numerator, long denominator) {
		return new NumberValue(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
	}

	/**
	 * Parses a decimal literal such as {@code 42}, {@code -1.2} or {@code 2.5e-3}.
	 */
	public static NumberValue parse(String text) {
		Objects.requireNonNull(text, "text must not be null");
		return of(new BigDecimal(text.trim()));
	}

	public static NumberValue of(BigDecimal decimal) {
		BigInteger unscaled = decimal.unscaledValue();
		int scale = decimal.scale();
		if (scale >= 0) {
			return new NumberValue(unscaled, BigInteger.TEN.pow(scale));
		}
		return new NumberValue(unscaled.multiply(BigInteger.TEN.pow(-scale)), BigInteger.ONE);
	}

	public static NumberValue ofDouble(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new ArithmeticException("Result is not a finite number: " + value);
		}
		return of(new BigDecimal(Double.toString(value)));
	}

	public boolean isInteger() {
		return denominator.equals(BigInteger.ONE);
	}

	public int signum() {
		return numerator.signum();
	}

	public NumberValue add(NumberValue other) {
		return new NumberValue(
				numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
				denominator.multiply(other.denominator));
	}

	public NumberValue subtract(NumberValue other) {
		return add(other.negate());
	}

	public NumberValue multiply(NumberValue other) {
		return new NumberValue(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
	}

	public NumberValue divide(NumberValue other) {
		if (other.signum() == 0) {
			throw new ArithmeticException("Division by zero");
		}
		return new NumberValue(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
	}

	public NumberValue negate() {
		return new NumberValue(numerator.negate(), denominator);
	}

	public NumberValue abs() {
		return signum() < 0 ? negate() : this;
	}

	public NumberValue pow(NumberValue exponent) {
		if (exponent.isInteger() && exponent.numerator.abs().compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) <= 0) {
			int e = exponent.numerator.intValue();
			if (e < 0 && signum() == 0) {
				throw new ArithmeticException("Zero raised to a negative power");
			}
			NumberValue raised = new NumberValue(numerator.pow(Math.abs(e)), denominator.pow(Math.abs(e)));
			return e < 0 ? ONE.divide(raised) : raised;
		}
		return ofDouble(Math.pow(doubleValue(), exponent.doubleValue()));
	}

	/**
	 * Largest integer not greater than this value.
	 */
	public NumberValue floor() {
		BigInteger[] qr = numerator.divideAndRemainder(denominator);
		BigInteger q = qr[0];
		if (qr[1].signum() < 0) {
			q = q.subtract(BigInteger.ONE);
		}
		return new NumberValue(q, BigInteger.ONE);
	}

	public NumberValue ceil() {
		return negate().floor().negate();
	}

	/**
	 * Converts to an {@code int}, failing when the value is fractional or out of range.
	 */
	public int intValueExact() {
		if (!isInteger()) {
			throw new ArithmeticException("Not an integer: " + render());
		}
		return numerator.intValueExact();
	}

	public double doubleValue() {
		if (isInteger()) {
			return numerator.doubleValue();
		}
		return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64).doubleValue();
	}

	/**
	 * Exact decimal when the expansion terminates, otherwise rounded to 16 significant digits.
	 */
	public BigDecimal toBigDecimal() {
		if (isInteger()) {
			return new BigDecimal(numerator);
		}
		BigDecimal n = new BigDecimal(numerator);
		BigDecimal d = new BigDecimal(denominator);
		try {
			return n.divide(d);
		} catch (ArithmeticException nonTerminating) {
			return n.divide(d, MathContext.DECIMAL64);
		}
	}

	/**
	 * True when {@link #toBigDecimal()} is exact, that is when the reduced denominator
	 * has no prime factor other than 2 and 5.
	 */
	public boolean hasTerminatingDecimal() {
		BigInteger rest = denominator;
		for (BigInteger factor : TERMINATING_FACTORS) {
			while (rest.mod(factor).signum() == 0) {
				rest = rest.divide(factor);
			}
		}
		return rest.equals(BigInteger.ONE);
	}

	/**
	 * The value as {@code numerator/denominator}, or just the numerator for integers.
	 */
	public String toFraction() {
		return isInteger() ? numerator.toString() : numerator + "/" + denominator;
	}

	@Override
	public int compareTo(NumberValue other) {
		return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
	}

	@Override
	public String typeName() {
		return isInteger() ? "Integer" : "Real";
	}

	@Override
	public String render() {
		return toBigDecimal().stripTrailingZeros().toPlainString();
	}
}
