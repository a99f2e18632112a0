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

/**
 * The scalar kinds a value range can carry. Natural numbers are the
 * non-negative integers, and booleans are encoded as the range
 * <code>[0,1]</code>.
 */
public enum ScalarKind {
	BOOLEAN, NATURAL, INTEGER, REAL;

	public boolean isIntegral() {
		return this == NATURAL || this == INTEGER;
	}

	public boolean isNumeric() {
		return this != BOOLEAN;
	}

	/**
	 * Determine the smallest kind covering both this and another kind, or
	 * <code>null</code> if there is none (i.e. booleans mixed with numbers).
	 *
	 * @param k
	 * @return
	 */
	public ScalarKind join(ScalarKind k) {
		if (this == k) {
			return this;
		} else if (this == BOOLEAN || k == BOOLEAN) {
			return null;
		} else if (this == REAL || k == REAL) {
			return REAL;
		} else {
			return INTEGER;
		}
	}

	/**
	 * The least value a range of this kind can hold.
	 *
	 * @return
	 */
	public Bound floor() {
		switch (this) {
		case BOOLEAN:
		case NATURAL:
			return Bound.ZERO;
		default:
			return Bound.NEGATIVE_INFINITY;
		}
	}

	public Bound ceiling() {
		return this == BOOLEAN ? Bound.ONE : Bound.POSITIVE_INFINITY;
	}

	@Override
	public String toString() {
		return name().toLowerCase();
	}
}
