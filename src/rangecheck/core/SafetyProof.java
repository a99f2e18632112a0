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

import rangecheck.core.Syntax.Term;

/**
 * Evidence that an element access cannot go out of bounds: the proven range of
 * its index lies within the elements guaranteed to exist.
 *
 * @author David J. Pearce
 *
 */
public final class SafetyProof {
	private final Term declaration;
	private final Range index;
	private final Bound limit;

	public SafetyProof(Term declaration, Range index, Bound limit) {
		this.declaration = declaration;
		this.index = index;
		this.limit = limit;
	}

	/**
	 * The declaration of the array being accessed.
	 *
	 * @return
	 */
	public Term declaration() {
		return declaration;
	}

	public Range index() {
		return index;
	}

	/**
	 * The exclusive upper bound the index was checked against.
	 *
	 * @return
	 */
	public Bound limit() {
		return limit;
	}

	@Override
	public String toString() {
		return index + " < " + limit;
	}
}
