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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangecheck.core.AnnotatedProgram;
import rangecheck.core.ErrorKind;
import rangecheck.core.FactTable;
import rangecheck.core.FunctionSummary;
import rangecheck.core.Normaliser;
import rangecheck.core.Options;
import rangecheck.core.Range;
import rangecheck.core.RangeChecker;
import rangecheck.core.RangeChecker.Environment;
import rangecheck.core.RangeChecker.Slot;
import rangecheck.core.ScalarKind;
import rangecheck.core.ScopeTree;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Term.AbstractTerm;
import rangecheck.core.Type;
import rangecheck.util.Pair;
import rangecheck.util.SyntacticElement;

/**
 * Extends the core calculus with functions. Functions declare the range of
 * each parameter and, optionally, of their return value. A unit groups the
 * functions declared together, and names the units whose functions it
 * invokes.
 *
 * @author David J. Pearce
 *
 */
public class Functions {
	public final static int TERM_invoke = 41;
	// Error messages
	public final static String UNKNOWN_FUNCTION = "unknown function";
	public final static String DUPLICATE_FUNCTION = "function already declared";
	public final static String INCORRECT_ARGUMENTS = "incorrect number of arguments";
	public final static String INCOMPATIBLE_ARGUMENT = "argument exceeds parameter range";
	public final static String INCOMPATIBLE_RETURN = "function body exceeds return range";

	public static class Syntax {

		/**
		 * Represents a Function Declaration
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class FunctionDeclaration extends SyntacticElement.Impl {
			private final String name;
			private final Pair<String, Range>[] params;
			private final Range ret;
			private final Term.Block body;

			public FunctionDeclaration(String name, Pair<String, Range>[] params, Range ret, Term.Block body,
					Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.params = params;
				this.ret = ret;
				this.body = body;
			}

			/**
			 * Get the name of this function.
			 *
			 * @return
			 */
			public String getName() {
				return name;
			}

			/**
			 * Get the declared parameters for this function.
			 *
			 * @return
			 */
			public Pair<String, Range>[] getParameters() {
				return params;
			}

			/**
			 * Get the declared return range for this function.
			 *
			 * @return null if the function returns nothing.
			 */
			public Range getReturn() {
				return ret;
			}

			/**
			 * Get the body of this function.
			 *
			 * @return
			 */
			public Term.Block getBody() {
				return body;
			}

			@Override
			public String toString() {
				String r = "fn " + name + "(";
				for (int i = 0; i != params.length; ++i) {
					if (i != 0) {
						r += ", ";
					}
					r += params[i].first() + ": " + params[i].second();
				}
				r += ")";
				return (ret == null ? r : r + " -> " + ret) + " " + body;
			}
		}

		/**
		 * Represents the invocation of a given function with a given set of argument
		 * operands.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Invoke extends AbstractTerm implements Term {
			private final String name;
			private final Term[] operands;

			public Invoke(String name, Term[] operands, Attribute... attributes) {
				super(TERM_invoke, attributes);
				this.name = name;
				this.operands = operands;
			}

			public String getName() {
				return name;
			}

			public Term[] getOperands() {
				return operands;
			}

			@Override
			public String toString() {
				return name + "(" + rangecheck.core.Syntax.toString(operands) + ")";
			}
		}

		/**
		 * A compilation unit, which is analysed as a whole.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Unit extends SyntacticElement.Impl {
			private final String name;
			private final String[] dependencies;
			private final FunctionDeclaration[] functions;

			public Unit(String name, String[] dependencies, FunctionDeclaration[] functions, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.dependencies = dependencies;
				this.functions = functions;
			}

			public String getName() {
				return name;
			}

			/**
			 * Get the names of the units whose functions this unit may invoke.
			 *
			 * @return
			 */
			public String[] getDependencies() {
				return dependencies;
			}

			public FunctionDeclaration[] getFunctions() {
				return functions;
			}

			@Override
			public String toString() {
				String r = "";
				for (String d : dependencies) {
					r += "use " + d + ";\n";
				}
				for (FunctionDeclaration f : functions) {
					r += f + "\n";
				}
				return r;
			}
		}
	}

	public static class Normalisation extends Normaliser.Extension {

		@Override
		public Pair<Void, Term> apply(Void state, int scope, Term term) {
			if (term instanceof Syntax.Invoke) {
				Syntax.Invoke t = (Syntax.Invoke) term;
				Term[] operands = self.apply(t.getOperands());
				return self.rewrite(t,
						operands == t.getOperands() ? t : new Syntax.Invoke(t.getName(), operands, t.attributes()));
			}
			return null;
		}

		/**
		 * Normalise the body of every function in a unit.
		 *
		 * @param unit
		 * @return
		 */
		public Syntax.Unit apply(Syntax.Unit unit) {
			Syntax.FunctionDeclaration[] fns = unit.getFunctions().clone();
			for (int i = 0; i != fns.length; ++i) {
				Syntax.FunctionDeclaration f = fns[i];
				fns[i] = new Syntax.FunctionDeclaration(f.getName(), f.getParameters(), f.getReturn(),
						self.apply(f.getBody()), f.attributes());
			}
			return new Syntax.Unit(unit.getName(), unit.getDependencies(), fns, unit.attributes());
		}
	}

	public static class Typing extends RangeChecker.Extension {
		private final Map<String, Syntax.FunctionDeclaration> fns = new HashMap<>();
		private final List<AnnotatedProgram> dependencies;

		/**
		 * Construct typing for invocations within one unit.
		 *
		 * @param decls
		 *            Functions declared in the unit.
		 * @param dependencies
		 *            Units on which it depends, which have already been analysed.
		 */
		public Typing(Syntax.FunctionDeclaration[] decls, List<AnnotatedProgram> dependencies) {
			for (int i = 0; i != decls.length; ++i) {
				Syntax.FunctionDeclaration ith = decls[i];
				fns.put(ith.getName(), ith);
			}
			this.dependencies = dependencies;
		}

		@Override
		public Pair<Environment, Type> apply(Environment state, int scope, Term term) {
			if (term instanceof Syntax.Invoke) {
				return apply(state, scope, (Syntax.Invoke) term);
			}
			return null;
		}

		public Pair<Environment, Type> apply(Environment R, int scope, Syntax.Invoke term) {
			// Determine function being invoked
			Range[] parameters;
			Type returns;
			Syntax.FunctionDeclaration decl = fns.get(term.getName());
			if (decl != null) {
				parameters = ranges(decl.getParameters());
				returns = decl.getReturn() == null ? Type.Unit : decl.getReturn();
			} else {
				FunctionSummary summary = lookup(term.getName());
				self.check(summary != null, ErrorKind.UnresolvedIdentifier, UNKNOWN_FUNCTION, term);
				parameters = summary.parameters();
				returns = summary.inferredReturn();
			}
			Term[] operands = term.getOperands();
			self.check(operands.length == parameters.length, ErrorKind.TypeMismatch, INCORRECT_ARGUMENTS, term);
			// Check arguments
			for (int i = 0; i != operands.length; ++i) {
				Range arg = self.expectRange(self.apply(R, scope, operands[i]).second(), operands[i]);
				ScalarKind kind = parameters[i].kind().isIntegral() ? ScalarKind.INTEGER : parameters[i].kind();
				arg = self.coerce(kind, arg, operands[i]);
				self.checkRange(parameters[i].contains(arg), ErrorKind.TypeMismatch, INCOMPATIBLE_ARGUMENT,
						operands[i]);
			}
			return new Pair<>(R, returns);
		}

		private FunctionSummary lookup(String name) {
			for (AnnotatedProgram p : dependencies) {
				FunctionSummary s = p.summary(name);
				if (s != null) {
					return s;
				}
			}
			return null;
		}
	}

	/**
	 * Extract the declared range of each parameter.
	 *
	 * @param params
	 * @return
	 */
	public static Range[] ranges(Pair<String, Range>[] params) {
		Range[] ranges = new Range[params.length];
		for (int i = 0; i != params.length; ++i) {
			ranges[i] = params[i].second();
		}
		return ranges;
	}

	public static class Checker extends RangeChecker {
		private static final Logger LOGGER = LoggerFactory.getLogger(Functions.Checker.class);

		public Checker(Options options, ScopeTree scopes, FactTable facts, RangeChecker.Extension... extensions) {
			super(options, scopes, facts, extensions);
		}

		/**
		 * Analyse the body of a function.
		 *
		 * @param fn
		 * @return A summary of the function for use by other units.
		 */
		public FunctionSummary apply(Syntax.FunctionDeclaration fn) {
			LOGGER.debug("analysing function {}", fn.getName());
			Pair<String, Range>[] params = fn.getParameters();
			int scope = scopes.fresh(ScopeTree.ROOT, ScopeTree.Kind.FUNCTION);
			Environment R1 = RangeChecker.EMPTY_ENVIRONMENT;
			// Lower parameters into environment
			for (int i = 0; i != params.length; ++i) {
				String p = params[i].first();
				check(R1.get(p) == null, ErrorKind.NameCollision, VARIABLE_ALREADY_DECLARED, fn);
				R1 = R1.put(p, new Slot(params[i].second(), scope, fn, null));
			}
			// Type method body
			Pair<Environment, Type> p = apply(R1, scope, fn.getBody());
			Type T = p.second();
			// Check type compatibility
			if (fn.getReturn() != null) {
				Range ret = fn.getReturn();
				Range r = expectRange(T, fn.getBody());
				r = coerce(ret.kind().isIntegral() ? ScalarKind.INTEGER : ret.kind(), r, fn.getBody());
				check(ret.contains(r), ErrorKind.TypeMismatch, INCOMPATIBLE_RETURN, fn.getBody());
			}
			return new FunctionSummary(fn.getName(), ranges(params), fn.getReturn(), T);
		}
	}
}
