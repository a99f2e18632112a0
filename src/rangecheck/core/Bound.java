// This file is part of the RangeCheck Analyser (rca).
//
// The RangeCheck Analyser is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The RangeCheck Analyser is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the RangeCheck Analyser. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.

package rangecheck.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * An end point of a range. This is either a finite (decimal) number, or one of
 * the two infinities. Bounds are immutable.
 */
public final class Bound implements Comparable<Bound> {
	/**
	 * Precision used when a real division does not terminate. The direction of
	 * rounding is always chosen by the caller.
	 */
	private static final int PRECISION = 34;

	public static final Bound NEGATIVE_INFINITY = new Bound(-1, null);
	public static final Bound POSITIVE_INFINITY = new Bound(1, null);
	public static final Bound ZERO = new Bound(0, BigDecimal.ZERO);
	public static final Bound ONE = new Bound(0, BigDecimal.ONE);

	/**
	 * Either -1 (negative infinity), +1 (positive infinity) or 0 (finite).
	 */
	private final int infinity;
	private final BigDecimal value;

	private Bound(int infinity, BigDecimal value) {
		this.infinity = infinity;
		this.value = value;
	}

	public static Bound of(long value) {
		return of(BigDecimal.valueOf(value));
	}

	public static Bound of(BigInteger value) {
		return of(new BigDecimal(value));
	}

	public static Bound of(BigDecimal value) {
		return new Bound(0, value);
	}

	public boolean isFinite() {
		return infinity == 0;
	}

	public boolean isPositiveInfinity() {
		return infinity > 0;
	}

	public boolean isNegativeInfinity() {
		return infinity < 0;
	}

	/**
	 * Get the finite value of this bound.
	 *
	 * @return
	 */
	public BigDecimal value() {
		if (value == null) {
			throw new IllegalStateException("infinite bound has no value");
		}
		return value;
	}

	public int signum() {
		return infinity != 0 ? infinity : value.signum();
	}

	/**
	 * Check whether this bound is a whole number (infinities are not).
	 *
	 * @return
	 */
	public boolean isIntegral() {
		return isFinite() && (value.signum() == 0 || value.stripTrailingZeros().scale() <= 0);
	}

	public Bound add(Bound b) {
		if (infinity != 0 || b.infinity != 0) {
			if (infinity + b.infinity == 0 && infinity != 0) {
				throw new ArithmeticException("indeterminate sum of opposite infinities");
			}
			return infinity != 0 ? this : b;
		}
		return of(value.add(b.value));
	}

	public Bound negate() {
		if (infinity != 0) {
			return infinity > 0 ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
		}
		return of(value.negate());
	}

	public Bound subtract(Bound b) {
		return add(b.negate());
	}

	/**
	 * Multiply two bounds. Zero times an infinity is zero here, since a range
	 * endpoint of zero multiplied by an unbounded endpoint can only ever produce
	 * zero for concrete values.
	 *
	 * @param b
	 * @return
	 */
	public Bound multiply(Bound b) {
		int s = signum() * b.signum();
		if (s == 0) {
			return ZERO;
		} else if (infinity != 0 || b.infinity != 0) {
			return s > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY;
		}
		return of(value.multiply(b.value));
	}

	/**
	 * Divide this bound by another non-zero bound, rounding in the given
	 * direction. Integral division truncates toward zero, whilst real division
	 * rounds according to <code>mode</code>. A finite value divided by an
	 * infinity is zero; an infinity divided by an infinity is taken as a unit of
	 * the appropriate sign (which always lies inside the hull of the remaining
	 * corners).
	 *
	 * @param b
	 * @param mode
	 * @param integral
	 * @return
	 */
	public Bound divide(Bound b, RoundingMode mode, boolean integral) {
		if (b.signum() == 0) {
			throw new ArithmeticException("division by zero bound");
		}
		int s = signum() * b.signum();
		if (infinity != 0 && b.infinity != 0) {
			return s > 0 ? ONE : ONE.negate();
		} else if (infinity != 0) {
			return s > 0 ? POSITIVE_INFINITY : NEGATIVE_INFINITY;
		} else if (b.infinity != 0) {
			return ZERO;
		} else if (integral) {
			return of(value.divide(b.value, 0, RoundingMode.DOWN));
		} else {
			return of(value.divide(b.value, new MathContext(PRECISION, mode)));
		}
	}

	public Bound floor() {
		return infinity != 0 ? this : of(value.setScale(0, RoundingMode.FLOOR));
	}

	public Bound ceiling() {
		return infinity != 0 ? this : of(value.setScale(0, RoundingMode.CEILING));
	}

	public static Bound min(Bound a, Bound b) {
		return a.compareTo(b) <= 0 ? a : b;
	}

	public static Bound max(Bound a, Bound b) {
		return a.compareTo(b) >= 0 ? a : b;
	}

	public static Bound min(Bound... bounds) {
		Bound r = bounds[0];
		for (int i = 1; i != bounds.length; ++i) {
			r = min(r, bounds[i]);
		}
		return r;
	}

	public static Bound max(Bound... bounds) {
		Bound r = bounds[0];
		for (int i = 1; i != bounds.length; ++i) {
			r = max(r, bounds[i]);
		}
		return r;
	}

	/**
	 * Convert this bound into an exact integer.
	 *
	 * @return
	 */
	public BigInteger toBigInteger() {
		return value().toBigIntegerExact();
	}

	@Override
	public int compareTo(Bound o) {
		if (infinity != 0 || o.infinity != 0) {
			return Integer.compare(infinity, o.infinity);
		}
		return value.compareTo(o.value);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Bound) {
			return compareTo((Bound) o) == 0;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return infinity != 0 ? infinity : value.stripTrailingZeros().hashCode();
	}

	@Override
	public String toString() {
		if (infinity > 0) {
			return "+inf";
		} else if (infinity < 0) {
			return "-inf";
		} else if (value.signum() == 0) {
			return "0";
		} else {
			return value.stripTrailingZeros().toPlainString();
		}
	}
}
