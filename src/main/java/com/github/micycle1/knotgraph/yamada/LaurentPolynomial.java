package com.github.micycle1.knotgraph.yamada;

import java.util.Arrays;

/**
 * Immutable Laurent polynomial in a single variable {@code A} with integer
 * coefficients. Coefficients are stored densely from the lowest to the highest
 * exponent; arithmetic overflow raises {@link ArithmeticException}.
 */
public final class LaurentPolynomial {

	public static final LaurentPolynomial ZERO = new LaurentPolynomial(0, new long[0]);
	public static final LaurentPolynomial ONE = monomial(1, 0);

	private final int minExp;
	private final long[] coeffs;

	private LaurentPolynomial(int minExp, long[] coeffs) {
		this.minExp = minExp;
		this.coeffs = coeffs;
	}

	/**
	 * Polynomial with the given coefficients for exponents {@code minExp},
	 * {@code minExp + 1}, ...
	 */
	public static LaurentPolynomial of(int minExp, long... coeffs) {
		return trim(minExp, coeffs.clone());
	}

	public static LaurentPolynomial monomial(long coefficient, int exponent) {
		return trim(exponent, new long[] { coefficient });
	}

	private static LaurentPolynomial trim(int minExp, long[] c) {
		int lo = 0;
		int hi = c.length;
		while (lo < hi && c[lo] == 0) {
			lo++;
		}
		while (hi > lo && c[hi - 1] == 0) {
			hi--;
		}
		if (lo == hi) {
			return ZERO;
		}
		if (lo == 0 && hi == c.length) {
			return new LaurentPolynomial(minExp, c);
		}
		return new LaurentPolynomial(minExp + lo, Arrays.copyOfRange(c, lo, hi));
	}

	public boolean isZero() {
		return coeffs.length == 0;
	}

	/** Lowest exponent with a non-zero coefficient; 0 for the zero polynomial. */
	public int minExponent() {
		return minExp;
	}

	/** Highest exponent with a non-zero coefficient; 0 for the zero polynomial. */
	public int maxExponent() {
		return isZero() ? 0 : minExp + coeffs.length - 1;
	}

	public long coefficient(int exponent) {
		int i = exponent - minExp;
		return i < 0 || i >= coeffs.length ? 0 : coeffs[i];
	}

	public LaurentPolynomial add(LaurentPolynomial o) {
		if (isZero()) {
			return o;
		}
		if (o.isZero()) {
			return this;
		}
		int lo = Math.min(minExp, o.minExp);
		int hi = Math.max(maxExponent(), o.maxExponent());
		long[] c = new long[hi - lo + 1];
		for (int i = 0; i < coeffs.length; i++) {
			c[minExp - lo + i] = coeffs[i];
		}
		for (int i = 0; i < o.coeffs.length; i++) {
			int k = o.minExp - lo + i;
			c[k] = Math.addExact(c[k], o.coeffs[i]);
		}
		return trim(lo, c);
	}

	public LaurentPolynomial subtract(LaurentPolynomial o) {
		return add(o.negate());
	}

	public LaurentPolynomial multiply(LaurentPolynomial o) {
		if (isZero() || o.isZero()) {
			return ZERO;
		}
		long[] c = new long[coeffs.length + o.coeffs.length - 1];
		for (int i = 0; i < coeffs.length; i++) {
			if (coeffs[i] == 0) {
				continue;
			}
			for (int j = 0; j < o.coeffs.length; j++) {
				c[i + j] = Math.addExact(c[i + j], Math.multiplyExact(coeffs[i], o.coeffs[j]));
			}
		}
		return trim(minExp + o.minExp, c);
	}

	public LaurentPolynomial pow(int n) {
		if (n < 0) {
			throw new IllegalArgumentException("Negative power: " + n);
		}
		LaurentPolynomial result = ONE;
		for (int i = 0; i < n; i++) {
			result = result.multiply(this);
		}
		return result;
	}

	public LaurentPolynomial negate() {
		return scale(-1);
	}

	public LaurentPolynomial scale(long factor) {
		long[] c = new long[coeffs.length];
		for (int i = 0; i < c.length; i++) {
			c[i] = Math.multiplyExact(coeffs[i], factor);
		}
		return trim(minExp, c);
	}

	/** Multiplies by {@code A^k}. */
	public LaurentPolynomial shift(int k) {
		return isZero() ? this : new LaurentPolynomial(minExp + k, coeffs);
	}

	public double evaluate(double a) {
		double sum = 0;
		for (int i = coeffs.length - 1; i >= 0; i--) {
			sum = sum * a + coeffs[i];
		}
		return sum * Math.pow(a, minExp);
	}

	/**
	 * Representative free of the {@code (-A)^k} ambiguity: multiplied by
	 * {@code (-A)^-minExponent} so the lowest exponent becomes zero, then negated
	 * if the constant term is negative.
	 */
	public LaurentPolynomial normalized() {
		if (isZero()) {
			return this;
		}
		LaurentPolynomial p = shift(-minExp);
		if ((minExp & 1) != 0) {
			p = p.negate();
		}
		return p.coeffs[0] < 0 ? p.negate() : p;
	}

	/**
	 * Parses the {@link #toString()} form, e.g. {@code "A^4 + A^3 + 2*A^2 + A + 1"}
	 * or {@code "-A^-1 + 3"}.
	 */
	public static LaurentPolynomial parse(String text) {
		String s = text.replace(" ", "");
		if (s.isEmpty()) {
			throw new IllegalArgumentException("Empty polynomial text");
		}
		LaurentPolynomial result = ZERO;
		int i = 0;
		while (i < s.length()) {
			int start = i;
			i++;
			// a term runs to the next sign that is not an exponent sign
			while (i < s.length() && !((s.charAt(i) == '+' || s.charAt(i) == '-') && s.charAt(i - 1) != '^')) {
				i++;
			}
			result = result.add(parseTerm(s.substring(start, i), text));
		}
		return result;
	}

	private static LaurentPolynomial parseTerm(String term, String text) {
		try {
			long sign = 1;
			String t = term;
			if (t.startsWith("+") || t.startsWith("-")) {
				sign = t.charAt(0) == '-' ? -1 : 1;
				t = t.substring(1);
			}
			int a = t.indexOf('A');
			if (a < 0) {
				return monomial(sign * Long.parseLong(t), 0);
			}
			long coefficient = 1;
			if (a > 0) {
				if (!t.substring(a - 1, a).equals("*")) {
					throw new IllegalArgumentException("Missing '*' in term '" + term + "'");
				}
				coefficient = Long.parseLong(t.substring(0, a - 1));
			}
			int exponent = 1;
			if (a + 1 < t.length()) {
				if (t.charAt(a + 1) != '^') {
					throw new IllegalArgumentException("Expected '^' in term '" + term + "'");
				}
				exponent = Integer.parseInt(t.substring(a + 2));
			}
			return monomial(sign * coefficient, exponent);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Cannot parse polynomial '" + text + "'", e);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LaurentPolynomial)) {
			return false;
		}
		LaurentPolynomial o = (LaurentPolynomial) obj;
		return minExp == o.minExp && Arrays.equals(coeffs, o.coeffs);
	}

	@Override
	public int hashCode() {
		return 31 * minExp + Arrays.hashCode(coeffs);
	}

	/** Terms from the highest exponent down, e.g. {@code A^6 + 2*A^5 - A^-1}. */
	@Override
	public String toString() {
		if (isZero()) {
			return "0";
		}
		StringBuilder sb = new StringBuilder();
		for (int i = coeffs.length - 1; i >= 0; i--) {
			long c = coeffs[i];
			if (c == 0) {
				continue;
			}
			int e = minExp + i;
			long abs = Math.abs(c);
			if (sb.length() == 0) {
				if (c < 0) {
					sb.append('-');
				}
			} else {
				sb.append(c < 0 ? " - " : " + ");
			}
			if (e == 0) {
				sb.append(abs);
				continue;
			}
			if (abs != 1) {
				sb.append(abs).append('*');
			}
			sb.append('A');
			if (e != 1) {
				sb.append('^').append(e);
			}
		}
		return sb.toString();
	}
}
