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
 * The outcome of analysing one unit: either its annotated program, or the
 * diagnostic which stopped the analysis.
 *
 * @author David J. Pearce
 *
 */
public final class AnalysisResult {
	private final String unit;
	private final AnnotatedProgram program;
	private final Diagnostic diagnostic;

	public AnalysisResult(AnnotatedProgram program) {
		this.unit = program.name();
		this.program = program;
		this.diagnostic = null;
	}

	public AnalysisResult(Diagnostic diagnostic) {
		this.unit = diagnostic.unit();
		this.program = null;
		this.diagnostic = diagnostic;
	}

	public String unit() {
		return unit;
	}

	public boolean isSuccess() {
		return program != null;
	}

	/**
	 * Get the annotated program.
	 *
	 * @return null if the analysis failed.
	 */
	public AnnotatedProgram program() {
		return program;
	}

	/**
	 * Get the diagnostic explaining why the analysis failed.
	 *
	 * @return null if the analysis succeeded.
	 */
	public Diagnostic diagnostic() {
		return diagnostic;
	}

	@Override
	public String toString() {
		return isSuccess() ? unit + ": ok" : diagnostic.toString();
	}
}
