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

import rangecheck.core.Type.Array.Discipline;

/**
 * Describes the layout of one array as established by the analysis.
 *
 * @author David J. Pearce
 *
 */
public final class ArrayDescriptor {
	private final String name;
	private final ScalarKind elementKind;
	private final Discipline discipline;
	private final BigInteger minElements;
	private final BigInteger maxElements;
	private final Range elements;

	public ArrayDescriptor(String name, ScalarKind elementKind, Discipline discipline, BigInteger minElements,
			BigInteger maxElements, Range elements) {
		if (minElements.compareTo(maxElements) > 0) {
			throw new IllegalArgumentException("invalid element bounds");
		}
		this.name = name;
		this.elementKind = elementKind;
		this.discipline = discipline;
		this.minElements = minElements;
		this.maxElements = maxElements;
		this.elements = elements;
	}

	public String name() {
		return name;
	}

	public ScalarKind elementKind() {
		return elementKind;
	}

	public Discipline discipline() {
		return discipline;
	}

	/**
	 * Number of elements guaranteed to be present once the array is first
	 * accessed. For fixed arrays this is their size.
	 *
	 * @return
	 */
	public BigInteger minElements() {
		return minElements;
	}

	public BigInteger maxElements() {
		return maxElements;
	}

	/**
	 * Range of every value the array may hold.
	 *
	 * @return
	 */
	public Range elements() {
		return elements;
	}

	public int elementSize() {
		return elements.isEmpty() ? Range.top(elementKind).byteWidth() : elements.byteWidth();
	}

	/**
	 * Number of bytes to allocate for the array, which is enough for the largest
	 * possible number of elements.
	 *
	 * @return
	 */
	public BigInteger allocationSize() {
		return maxElements.multiply(BigInteger.valueOf(elementSize()));
	}

	@Override
	public String toString() {
		return discipline + " " + name + "[" + minElements + "," + maxElements + "] of " + elements + " ("
				+ allocationSize() + " bytes)";
	}
}
