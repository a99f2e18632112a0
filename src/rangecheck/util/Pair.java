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

package rangecheck.util;

import java.util.Objects;

/**
 * An immutable pair of items, used throughout the analyser to return an
 * updated environment alongside the type of a term.
 *
 * @param <FIRST> Type of first item
 * @param <SECOND> Type of second item
 */
public class Pair<FIRST,SECOND> {
	protected final FIRST first;
	protected final SECOND second;

	public Pair(FIRST f, SECOND s) {
		first=f;
		second=s;
	}

	public FIRST first() { return first; }
	public SECOND second() { return second; }

	@Override
	public int hashCode() {
		return Objects.hashCode(first) ^ Objects.hashCode(second);
	}

	@Override
	public boolean equals(Object o) {
		if(o instanceof Pair) {
			Pair<?, ?> p = (Pair<?, ?>) o;
			return Objects.equals(first, p.first) && Objects.equals(second, p.second);
		}
		return false;
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}
}
