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
 * The kinds of fatal diagnostic the analyser can raise. Every one of them
 * aborts the analysis of the enclosing unit.
 */
public enum ErrorKind {
	NameCollision,
	UnresolvedIdentifier,
	TypeMismatch,
	NonMonotonicIterator,
	ConflictingIteratorMutation,
	/**
	 * No finite upper bound on the number of elements could be derived.
	 */
	UnboundedArray,
	IncompleteInitialization,
	IndexOutOfProvenRange,
	/**
	 * Attempt to change the layout of an array after it was constructed.
	 */
	IllegalStructuralWrite
}
