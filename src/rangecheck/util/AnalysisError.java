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

import rangecheck.core.Diagnostic;
import rangecheck.core.ErrorKind;
import rangecheck.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when the analysis of a unit fails. It carries the
 * structured diagnostic describing the failure, and unwinds the analysis of
 * the enclosing unit in one go.
 */
public class AnalysisError extends RuntimeException {

	private final Diagnostic diagnostic;

	/**
	 * Identify an analysis failure at a particular point in a program.
	 *
	 * @param diagnostic
	 *            Structured description of the problem.
	 */
	public AnalysisError(Diagnostic diagnostic) {
		super(diagnostic.message());
		this.diagnostic = diagnostic;
	}

	/**
	 * The diagnostic this error reports.
	 *
	 * @return
	 */
	public Diagnostic diagnostic() {
		return diagnostic;
	}

	/**
	 * The kind of failure this error reports.
	 *
	 * @return
	 */
	public ErrorKind kind() {
		return diagnostic.kind();
	}

	public static final long serialVersionUID = 1l;

	public static void analysisError(ErrorKind kind, String msg, SyntacticElement elem) {
		analysisError(kind, msg, elem, null);
	}

	/**
	 * Raise an analysis error against a given element, which optionally conflicts
	 * with some other (earlier) element.
	 *
	 * @param kind
	 * @param msg
	 * @param elem
	 * @param conflict
	 *            Element the offending one conflicts with, or null.
	 */
	public static void analysisError(ErrorKind kind, String msg, SyntacticElement elem, SyntacticElement conflict) {
		throw new AnalysisError(new Diagnostic(null, sourceOf(elem), kind, msg, conflict == null ? null : sourceOf(conflict)));
	}

	/**
	 * Determine the source location of a given element.
	 *
	 * @param elem
	 * @return UNKNOWN if the element carries no location.
	 */
	public static Attribute.Source sourceOf(SyntacticElement elem) {
		if (elem != null) {
			Attribute.Source attr = elem.attribute(Attribute.Source.class);
			if (attr != null) {
				return attr;
			}
		}
		return Attribute.Source.UNKNOWN;
	}
}
