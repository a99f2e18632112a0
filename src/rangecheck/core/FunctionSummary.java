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

import java.util.Arrays;

/**
 * Summarises what the analysis established about a function, so that it can
 * be invoked from units which depend on the one declaring it.
 *
 * @author David J. Pearce
 *
 */
public final class FunctionSummary {
	private final String name;
	private final Range[] parameters;
	private final Range declaredReturn;
	private final Type inferredReturn;

	public FunctionSummary(String name, Range[] parameters, Range declaredReturn, Type inferredReturn) {
		this.name = name;
		this.parameters = parameters.clone();
		this.declaredReturn = declaredReturn;
		this.inferredReturn = inferredReturn;
	}

	public String name() {
		return name;
	}

	public Range[] parameters() {
		return parameters.clone();
	}

	/**
	 * Get the declared return range of this function.
	 *
	 * @return null if no return was declared.
	 */
	public Range declaredReturn() {
		return declaredReturn;
	}

	/**
	 * Get the type of the function's body, which is never wider than the
	 * declared return range.
	 *
	 * @return
	 */
	public Type inferredReturn() {
		return inferredReturn;
	}

	@Override
	public String toString() {
		String r = name + Arrays.toString(parameters);
		if (declaredReturn != null) {
			r += " -> " + declaredReturn;
		}
		return r + " : " + inferredReturn;
	}
}
