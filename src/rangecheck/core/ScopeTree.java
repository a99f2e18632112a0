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

import java.util.ArrayList;

/**
 * An arena holding every scope created while analysing one unit. Scopes are
 * identified by their index in the arena and refer to their parent by index,
 * so no scope holds a reference to another. Index <code>0</code> is the root.
 *
 * @author David J. Pearce
 *
 */
public final class ScopeTree {
	public static final int ROOT = 0;

	public enum Kind {
		FUNCTION, BLOCK, BRANCH, LOOP
	}

	private final ArrayList<Integer> parents = new ArrayList<>();
	private final ArrayList<Kind> kinds = new ArrayList<>();

	public ScopeTree() {
		parents.add(-1);
		kinds.add(Kind.FUNCTION);
	}

	/**
	 * Allocate a fresh scope nested directly within a given parent.
	 *
	 * @param parent
	 * @param kind
	 * @return Index of the new scope.
	 */
	public int fresh(int parent, Kind kind) {
		if (parent < 0 || parent >= parents.size()) {
			throw new IllegalArgumentException("invalid scope: " + parent);
		}
		parents.add(parent);
		kinds.add(kind);
		return parents.size() - 1;
	}

	public int parent(int scope) {
		return parents.get(scope);
	}

	public Kind kind(int scope) {
		return kinds.get(scope);
	}

	/**
	 * Check whether one scope is the same as, or encloses, another.
	 *
	 * @param outer
	 * @param inner
	 * @return
	 */
	public boolean encloses(int outer, int inner) {
		while (inner >= 0) {
			if (inner == outer) {
				return true;
			}
			inner = parents.get(inner);
		}
		return false;
	}

	public int depth(int scope) {
		int depth = 0;
		while (scope != ROOT) {
			scope = parents.get(scope);
			depth++;
		}
		return depth;
	}

	public int size() {
		return parents.size();
	}
}
