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

import java.math.BigInteger;
import java.math.RoundingMode;

import rangecheck.core.Syntax.BinaryOperator;
import rangecheck.util.Pair;

/**
 * A closed interval of values of a given scalar kind, used as the type of every
 * scalar variable and expression. Integral ranges are normalised so that a
 * range whose minimum is non-negative is always <code>NATURAL</code>, and
 * <code>INTEGER</code> otherwise. A range may be empty, in which case no value
 * inhabits it and the program point it describes cannot be reached.
 *
 * All operations round outwards, so the result of an operation always contains
 * every value the corresponding concrete operation can produce.
 *
 * @author David J. Pearce
 *
 */
public final class Range implements Type {
	/**
	 * Shift amounts beyond this are treated as unbounded.
	 */
	private static final int MAX_SHIFT = 1024;

	public static final Range TRUE = new Range(Bound.ONE, Bound.ONE, ScalarKind.BOOLEAN);
	public static final Range FALSE = new Range(Bound.ZERO, Bound.ZERO, ScalarKind.BOOLEAN);
	public static final Range BOOL = new Range(Bound.ZERO, Bound.ONE, ScalarKind.BOOLEAN);

	private final Bound min;
	private final Bound max;
	private final ScalarKind kind;

	private Range(Bound min, Bound max, ScalarKind kind) {
		this.min = min;
		this.max = max;
		this.kind = kind;
	}

	/**
	 * Construct a range of a given kind, normalising it as necessary. Integral and
	 * boolean bounds are rounded inwards to whole numbers, since no other values
	 * inhabit them.
	 *
	 * @param kind
	 * @param min
	 * @param max
	 * @return
	 */
	public static Range of(ScalarKind kind, Bound min, Bound max) {
		if (kind == ScalarKind.BOOLEAN) {
			min = Bound.max(min.ceiling(), Bound.ZERO);
			max = Bound.min(max.floor(), Bound.ONE);
		} else if (kind.isIntegral()) {
			min = min.ceiling();
			max = max.floor();
			kind = min.signum() >= 0 ? ScalarKind.NATURAL : ScalarKind.INTEGER;
		}
		if (min.compareTo(max) > 0) {
			return empty(kind);
		}
		return new Range(min, max, kind);
	}

	public static Range of(ScalarKind kind, long min, long max) {
		return of(kind, Bound.of(min), Bound.of(max));
	}

	/**
	 * Construct an integral range.
	 *
	 * @param min
	 * @param max
	 * @return
	 */
	public static Range of(long min, long max) {
		return of(ScalarKind.INTEGER, min, max);
	}

	public static Range constant(long value) {
		return of(value, value);
	}

	public static Range constant(BigInteger value) {
		Bound b = Bound.of(value);
		return of(ScalarKind.INTEGER, b, b);
	}

	public static Range constant(ScalarKind kind, Bound value) {
		return of(kind, value, value);
	}

	public static Range bool(boolean value) {
		return value ? TRUE : FALSE;
	}

	/**
	 * The range containing every value of a given kind.
	 *
	 * @param kind
	 * @return
	 */
	public static Range top(ScalarKind kind) {
		return of(kind, kind.floor(), kind.ceiling());
	}

	public static Range empty(ScalarKind kind) {
		return new Range(Bound.POSITIVE_INFINITY, Bound.NEGATIVE_INFINITY, kind);
	}

	public Bound min() {
		return min;
	}

	public Bound max() {
		return max;
	}

	public ScalarKind kind() {
		return kind;
	}

	public boolean isEmpty() {
		return min.compareTo(max) > 0;
	}

	public boolean isConstant() {
		return min.isFinite() && min.equals(max);
	}

	public boolean contains(Bound b) {
		return min.compareTo(b) <= 0 && b.compareTo(max) <= 0;
	}

	/**
	 * Check whether every value in a given range is also in this range. The
	 * empty range is contained in every range.
	 *
	 * @param r
	 * @return
	 */
	public boolean contains(Range r) {
		return r.isEmpty() || (min.compareTo(r.min) <= 0 && r.max.compareTo(max) <= 0);
	}

	@Override
	public boolean isCompatible(Type t) {
		return t instanceof Range && kind.join(((Range) t).kind) != null;
	}

	@Override
	public Range union(Type t) {
		if (!isCompatible(t)) {
			throw new IllegalArgumentException("cannot union " + this + " with " + t);
		}
		Range r = (Range) t;
		ScalarKind k = kind.join(r.kind);
		if (isEmpty()) {
			return of(k, r.min, r.max);
		} else if (r.isEmpty()) {
			return of(k, min, max);
		}
		return of(k, Bound.min(min, r.min), Bound.max(max, r.max));
	}

	/**
	 * Intersect this range with another. The result has the kind of this range.
	 *
	 * @param r
	 * @return
	 */
	public Range intersect(Range r) {
		return of(kind, Bound.max(min, r.min), Bound.min(max, r.max));
	}

	// ================================================================================
	// Arithmetic
	// ================================================================================

	public Range add(Range r) {
		ScalarKind k = arithmetic(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(k);
		}
		return of(k, min.add(r.min), max.add(r.max));
	}

	public Range subtract(Range r) {
		ScalarKind k = arithmetic(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(k);
		}
		return of(k, min.subtract(r.max), max.subtract(r.min));
	}

	public Range negate() {
		ScalarKind k = arithmetic(this, this);
		if (isEmpty()) {
			return empty(k);
		}
		return of(k, max.negate(), min.negate());
	}

	public Range multiply(Range r) {
		ScalarKind k = arithmetic(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(k);
		}
		Bound a = min.multiply(r.min);
		Bound b = min.multiply(r.max);
		Bound c = max.multiply(r.min);
		Bound d = max.multiply(r.max);
		return of(k, Bound.min(a, b, c, d), Bound.max(a, b, c, d));
	}

	/**
	 * Divide this range by another. Integral division truncates towards zero, and
	 * the divisor is split into its negative and positive parts so neither part
	 * contains zero. A real divisor which contains zero gives the whole kind, as
	 * does an integral divisor which is exactly zero.
	 *
	 * @param r
	 * @return
	 */
	public Range divide(Range r) {
		ScalarKind k = arithmetic(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(k);
		} else if (k.isIntegral()) {
			Range result = empty(k);
			if (r.min.signum() < 0) {
				Range negative = of(r.kind, r.min, Bound.min(r.max, Bound.ONE.negate()));
				result = result.union(divideCorners(k, negative));
			}
			if (r.max.signum() > 0) {
				Range positive = of(r.kind, Bound.max(r.min, Bound.ONE), r.max);
				result = result.union(divideCorners(k, positive));
			}
			return result.isEmpty() ? top(k) : result;
		} else if (r.contains(Bound.ZERO)) {
			return top(k);
		} else {
			return divideCorners(k, r);
		}
	}

	private Range divideCorners(ScalarKind k, Range d) {
		boolean integral = k.isIntegral();
		Bound lo = Bound.min(min.divide(d.min, RoundingMode.FLOOR, integral),
				min.divide(d.max, RoundingMode.FLOOR, integral), max.divide(d.min, RoundingMode.FLOOR, integral),
				max.divide(d.max, RoundingMode.FLOOR, integral));
		Bound hi = Bound.max(min.divide(d.min, RoundingMode.CEILING, integral),
				min.divide(d.max, RoundingMode.CEILING, integral), max.divide(d.min, RoundingMode.CEILING, integral),
				max.divide(d.max, RoundingMode.CEILING, integral));
		return of(k, lo, hi);
	}

	/**
	 * Compute the remainder of this range by another. The remainder takes the
	 * sign of the dividend, and its magnitude is bounded both by the dividend and
	 * by the largest divisor magnitude. Constant operands are folded exactly.
	 *
	 * @param r
	 * @return
	 */
	public Range remainder(Range r) {
		ScalarKind k = arithmetic(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(k);
		} else if (r.isConstant() && r.min.signum() == 0) {
			return top(k);
		} else if (isConstant() && r.isConstant()) {
			Bound b = Bound.of(min.value().remainder(r.min.value()));
			return of(k, b, b);
		}
		Bound magnitude = Bound.max(r.min.negate(), r.max);
		Bound limit = k.isIntegral() ? magnitude.subtract(Bound.ONE) : magnitude;
		Bound lo = min.signum() >= 0 ? Bound.ZERO : Bound.max(min, limit.negate());
		Bound hi = max.signum() <= 0 ? Bound.ZERO : Bound.min(max, limit);
		return of(k, lo, hi);
	}

	private static ScalarKind arithmetic(Range lhs, Range rhs) {
		if (!lhs.kind.isNumeric() || !rhs.kind.isNumeric()) {
			throw new IllegalArgumentException("arithmetic on non-numeric range");
		}
		return lhs.kind.join(rhs.kind);
	}

	// ================================================================================
	// Bitwise
	// ================================================================================

	public Range bitwiseAnd(Range r) {
		bitwise(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.NATURAL);
		}
		if (isConstant() && r.isConstant()) {
			return constant(min.toBigInteger().and(r.min.toBigInteger()));
		}
		return of(ScalarKind.NATURAL, Bound.ZERO, Bound.min(max, r.max));
	}

	public Range bitwiseOr(Range r) {
		bitwise(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.NATURAL);
		}
		if (isConstant() && r.isConstant()) {
			return constant(min.toBigInteger().or(r.min.toBigInteger()));
		}
		return of(ScalarKind.NATURAL, Bound.max(min, r.min), ones(max, r.max));
	}

	public Range bitwiseXor(Range r) {
		bitwise(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.NATURAL);
		}
		if (isConstant() && r.isConstant()) {
			return constant(min.toBigInteger().xor(r.min.toBigInteger()));
		}
		return of(ScalarKind.NATURAL, Bound.ZERO, ones(max, r.max));
	}

	public Range shiftLeft(Range r) {
		bitwise(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.NATURAL);
		}
		Bound lo = shift(min, Bound.min(r.min, Bound.of(MAX_SHIFT)), true);
		Bound hi;
		if (max.signum() == 0) {
			hi = Bound.ZERO;
		} else if (!max.isFinite() || r.max.compareTo(Bound.of(MAX_SHIFT)) > 0) {
			hi = Bound.POSITIVE_INFINITY;
		} else {
			hi = shift(max, r.max, true);
		}
		return of(ScalarKind.NATURAL, lo, hi);
	}

	public Range shiftRight(Range r) {
		bitwise(this, r);
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.NATURAL);
		}
		Bound lo = !r.max.isFinite() || r.max.compareTo(Bound.of(MAX_SHIFT)) > 0 ? Bound.ZERO
				: shift(min, r.max, false);
		Bound hi;
		if (!max.isFinite()) {
			hi = Bound.POSITIVE_INFINITY;
		} else if (r.min.compareTo(Bound.of(MAX_SHIFT)) > 0) {
			hi = Bound.ZERO;
		} else {
			hi = shift(max, r.min, false);
		}
		return of(ScalarKind.NATURAL, lo, hi);
	}

	private static Bound shift(Bound value, Bound amount, boolean left) {
		if (!value.isFinite()) {
			return value;
		}
		BigInteger v = value.toBigInteger();
		int n = amount.toBigInteger().intValueExact();
		return Bound.of(left ? v.shiftLeft(n) : v.shiftRight(n));
	}

	/**
	 * The smallest all-ones value covering both bounds.
	 */
	private static Bound ones(Bound a, Bound b) {
		if (!a.isFinite() || !b.isFinite()) {
			return Bound.POSITIVE_INFINITY;
		}
		int n = Math.max(a.toBigInteger().bitLength(), b.toBigInteger().bitLength());
		return Bound.of(BigInteger.ONE.shiftLeft(n).subtract(BigInteger.ONE));
	}

	private static void bitwise(Range lhs, Range rhs) {
		if ((lhs.kind != ScalarKind.NATURAL && !lhs.isEmpty())
				|| (rhs.kind != ScalarKind.NATURAL && !rhs.isEmpty())) {
			throw new IllegalArgumentException("bitwise operation on non-natural range");
		}
	}

	// ================================================================================
	// Comparisons & Logic
	// ================================================================================

	/**
	 * Determine the boolean range of comparing this range against another.
	 *
	 * @param op
	 *            A comparison operator
	 * @param r
	 * @return
	 */
	public Range compare(BinaryOperator op, Range r) {
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.BOOLEAN);
		}
		switch (op) {
		case LT:
			return decide(max.compareTo(r.min) < 0, min.compareTo(r.max) >= 0);
		case LTEQ:
			return decide(max.compareTo(r.min) <= 0, min.compareTo(r.max) > 0);
		case GT:
			return r.compare(BinaryOperator.LT, this);
		case GTEQ:
			return r.compare(BinaryOperator.LTEQ, this);
		case EQ:
			return decide(isConstant() && r.isConstant() && min.equals(r.min),
					max.compareTo(r.min) < 0 || min.compareTo(r.max) > 0);
		case NEQ:
			return compare(BinaryOperator.EQ, r).logicalNot();
		default:
			throw new IllegalArgumentException("not a comparison: " + op);
		}
	}

	private static Range decide(boolean alwaysTrue, boolean alwaysFalse) {
		if (alwaysTrue) {
			return TRUE;
		} else if (alwaysFalse) {
			return FALSE;
		} else {
			return BOOL;
		}
	}

	public Range logicalAnd(Range r) {
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.BOOLEAN);
		}
		return of(ScalarKind.BOOLEAN, Bound.min(min, r.min), Bound.min(max, r.max));
	}

	public Range logicalOr(Range r) {
		if (isEmpty() || r.isEmpty()) {
			return empty(ScalarKind.BOOLEAN);
		}
		return of(ScalarKind.BOOLEAN, Bound.max(min, r.min), Bound.max(max, r.max));
	}

	public Range logicalNot() {
		if (isEmpty()) {
			return this;
		}
		return of(ScalarKind.BOOLEAN, Bound.ONE.subtract(max), Bound.ONE.subtract(min));
	}

	// ================================================================================
	// Narrowing
	// ================================================================================

	/**
	 * Narrow this range under the assumption that <code>this op r</code> holds
	 * (first component) and that it does not hold (second component). On discrete
	 * kinds strict comparisons shift the bound by one; on reals the closed bound is
	 * used, which includes the excluded end point.
	 *
	 * @param op
	 *            A comparison operator
	 * @param r
	 *            The range of the other operand
	 * @return
	 */
	public Pair<Range, Range> narrow(BinaryOperator op, Range r) {
		if (isEmpty() || r.isEmpty()) {
			return new Pair<>(empty(kind), empty(kind));
		}
		switch (op) {
		case LT:
			return new Pair<>(below(r.max, true), above(r.min, false));
		case LTEQ:
			return new Pair<>(below(r.max, false), above(r.min, true));
		case GT:
			return new Pair<>(above(r.min, true), below(r.max, false));
		case GTEQ:
			return new Pair<>(above(r.min, false), below(r.max, true));
		case EQ:
			return new Pair<>(intersect(r), exclude(r));
		case NEQ:
			return new Pair<>(exclude(r), intersect(r));
		default:
			throw new IllegalArgumentException("not a comparison: " + op);
		}
	}

	private Range below(Bound b, boolean strict) {
		Bound hi = strict && kind != ScalarKind.REAL ? b.ceiling().subtract(Bound.ONE) : b;
		return of(kind, min, Bound.min(max, hi));
	}

	private Range above(Bound b, boolean strict) {
		Bound lo = strict && kind != ScalarKind.REAL ? b.floor().add(Bound.ONE) : b;
		return of(kind, Bound.max(min, lo), max);
	}

	/**
	 * Remove a single constant from this range, which is only possible when it
	 * sits at one of the end points.
	 */
	private Range exclude(Range r) {
		if (!r.isConstant()) {
			return this;
		} else if (isConstant() && min.equals(r.min)) {
			return empty(kind);
		} else if (kind == ScalarKind.REAL) {
			return this;
		} else if (min.equals(r.min)) {
			return of(kind, min.add(Bound.ONE), max);
		} else if (max.equals(r.min)) {
			return of(kind, min, max.subtract(Bound.ONE));
		} else {
			return this;
		}
	}

	// ================================================================================
	// Layout
	// ================================================================================

	/**
	 * Determine the number of bytes needed to store any value in this range.
	 * Integral values use the smallest of 1, 2, 4 or 8 bytes which holds the
	 * range (signed when the range is negative), booleans one byte and reals
	 * eight.
	 *
	 * @return
	 */
	public int byteWidth() {
		if (kind == ScalarKind.BOOLEAN) {
			return 1;
		} else if (kind == ScalarKind.REAL) {
			return 8;
		} else if (isEmpty()) {
			return 1;
		} else if (!min.isFinite() || !max.isFinite()) {
			return 8;
		}
		for (int bytes = 1; bytes < 8; bytes *= 2) {
			int bits = 8 * bytes;
			BigInteger lo, hi;
			if (kind == ScalarKind.NATURAL) {
				lo = BigInteger.ZERO;
				hi = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
			} else {
				lo = BigInteger.ONE.shiftLeft(bits - 1).negate();
				hi = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
			}
			if (Bound.of(lo).compareTo(min) <= 0 && max.compareTo(Bound.of(hi)) <= 0) {
				return bytes;
			}
		}
		return 8;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Range) {
			Range r = (Range) o;
			if (isEmpty() || r.isEmpty()) {
				return isEmpty() && r.isEmpty() && kind == r.kind;
			}
			return kind == r.kind && min.equals(r.min) && max.equals(r.max);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return isEmpty() ? kind.hashCode() : kind.hashCode() ^ min.hashCode() ^ (max.hashCode() * 31);
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return kind + "[]";
		}
		return kind + "[" + min + "," + max + "]";
	}
}
