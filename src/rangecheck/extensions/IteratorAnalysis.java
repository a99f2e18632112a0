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

package rangecheck.extensions;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Value;

/**
 * Syntactic queries about the bodies of loops, which are needed before a loop
 * can be analysed.
 *
 * @author David J. Pearce
 *
 */
public final class IteratorAnalysis {

	private IteratorAnalysis() {

	}

	/**
	 * Determine every variable which may be changed by a given term. This
	 * includes variables which are assigned, and arrays which are appended to or
	 * have an element assigned.
	 *
	 * @param t
	 * @return
	 */
	public static Set<String> modified(Term t) {
		LinkedHashSet<String> modified = new LinkedHashSet<>();
		modified(t, modified);
		return modified;
	}

	private static void modified(Term t, Set<String> modified) {
		if (t instanceof Term.Assignment) {
			modified.add(((Term.Assignment) t).variable());
		} else if (t instanceof ControlFlow.Syntax.CompoundAssignment) {
			modified.add(((ControlFlow.Syntax.CompoundAssignment) t).variable());
		} else if (t instanceof Arrays.Syntax.Append) {
			modified.add(((Arrays.Syntax.Append) t).array());
		} else if (t instanceof Arrays.Syntax.IndexAssignment) {
			modified.add(((Arrays.Syntax.IndexAssignment) t).array());
		}
		for (Term c : children(t)) {
			modified(c, modified);
		}
	}

	/**
	 * Find an assignment to a given variable within a loop nested inside a given
	 * term.
	 *
	 * @param t
	 * @param x
	 * @return null if there is no such assignment.
	 */
	public static Term.Assignment nestedAssignment(Term t, String x) {
		return nestedAssignment(t, x, false);
	}

	private static Term.Assignment nestedAssignment(Term t, String x, boolean nested) {
		if (nested && t instanceof Term.Assignment && ((Term.Assignment) t).variable().equals(x)) {
			return (Term.Assignment) t;
		}
		boolean loop = t instanceof ControlFlow.Syntax.Loop;
		for (Term c : children(t)) {
			Term.Assignment a = nestedAssignment(c, x, nested || loop);
			if (a != null) {
				return a;
			}
		}
		return null;
	}

	/**
	 * Determine every variable read by a given term.
	 *
	 * @param t
	 * @return
	 */
	public static Set<String> reads(Term t) {
		HashSet<String> reads = new HashSet<>();
		reads(t, reads);
		return reads;
	}

	private static void reads(Term t, Set<String> reads) {
		if (t instanceof Term.Variable) {
			reads.add(((Term.Variable) t).name());
		} else if (t instanceof Arrays.Syntax.IndexAccess) {
			reads.add(((Arrays.Syntax.IndexAccess) t).array());
		}
		for (Term c : children(t)) {
			reads(c, reads);
		}
	}

	/**
	 * Get the immediate subterms of a given term.
	 *
	 * @param t
	 * @return
	 */
	public static Term[] children(Term t) {
		if (t instanceof Term.Let) {
			return new Term[] { ((Term.Let) t).initialiser() };
		} else if (t instanceof Term.Assignment) {
			return new Term[] { ((Term.Assignment) t).rightOperand() };
		} else if (t instanceof Term.Block) {
			return ((Term.Block) t).toArray();
		} else if (t instanceof Term.Binary) {
			Term.Binary b = (Term.Binary) t;
			return new Term[] { b.leftOperand(), b.rightOperand() };
		} else if (t instanceof Term.Unary) {
			return new Term[] { ((Term.Unary) t).operand() };
		} else if (t instanceof Term.Variable || t instanceof Value) {
			return new Term[0];
		} else if (t instanceof ControlFlow.Syntax.IfElse) {
			ControlFlow.Syntax.IfElse s = (ControlFlow.Syntax.IfElse) t;
			if (s.falseBlock() == null) {
				return new Term[] { s.condition(), s.trueBlock() };
			}
			return new Term[] { s.condition(), s.trueBlock(), s.falseBlock() };
		} else if (t instanceof ControlFlow.Syntax.Loop) {
			ControlFlow.Syntax.Loop s = (ControlFlow.Syntax.Loop) t;
			return new Term[] { s.limit(), s.body() };
		} else if (t instanceof ControlFlow.Syntax.While) {
			ControlFlow.Syntax.While s = (ControlFlow.Syntax.While) t;
			return new Term[] { s.condition(), s.body() };
		} else if (t instanceof ControlFlow.Syntax.CompoundAssignment) {
			return new Term[] { ((ControlFlow.Syntax.CompoundAssignment) t).rightOperand() };
		} else if (t instanceof Arrays.Syntax.ArrayDeclaration) {
			Arrays.Syntax.ArrayDeclaration s = (Arrays.Syntax.ArrayDeclaration) t;
			Term[] inits = s.initialisers();
			if (s.size() == null) {
				return inits;
			}
			Term[] ts = java.util.Arrays.copyOf(inits, inits.length + 1);
			ts[inits.length] = s.size();
			return ts;
		} else if (t instanceof Arrays.Syntax.Append) {
			return new Term[] { ((Arrays.Syntax.Append) t).value() };
		} else if (t instanceof Arrays.Syntax.IndexAccess) {
			return new Term[] { ((Arrays.Syntax.IndexAccess) t).index() };
		} else if (t instanceof Arrays.Syntax.IndexAssignment) {
			Arrays.Syntax.IndexAssignment s = (Arrays.Syntax.IndexAssignment) t;
			return new Term[] { s.index(), s.value() };
		} else if (t instanceof Functions.Syntax.Invoke) {
			return ((Functions.Syntax.Invoke) t).getOperands();
		}
		throw new IllegalArgumentException("Invalid term encountered: " + t);
	}
}
