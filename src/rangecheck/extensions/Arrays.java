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

import rangecheck.core.ErrorKind;
import rangecheck.core.FactTable.Flagged;
import rangecheck.core.Normaliser;
import rangecheck.core.Range;
import rangecheck.core.RangeChecker;
import rangecheck.core.RangeChecker.Environment;
import rangecheck.core.RangeChecker.Slot;
import rangecheck.core.ScalarKind;
import rangecheck.core.Syntax.BinaryOperator;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Term.AbstractTerm;
import rangecheck.core.Type;
import rangecheck.core.Type.Array.Discipline;
import rangecheck.util.Pair;

/**
 * Extends the core calculus with arrays. An array is either <i>fixed</i>, in
 * which case its size is given when it is declared, or <i>back-insertion</i>,
 * in which case it starts empty and grows by appending elements until it is
 * first accessed.
 *
 * @author David J. Pearce
 *
 */
public class Arrays {
	public final static int TERM_arraydecl = 30;
	public final static int TERM_append = 31;
	public final static int TERM_index = 32;
	public final static int TERM_indexassign = 33;
	// Error messages
	public final static String EXPECTED_ARRAY = "expected array";
	public final static String EXPECTED_INTEGRAL_INDEX = "array index must be integral";
	public final static String EXPECTED_INTEGRAL_SIZE = "array size must be integral";
	public final static String MISSING_SIZE = "fixed array requires a size";
	public final static String UNEXPECTED_SIZE = "back-insertion array cannot have a size";
	public final static String FIXED_APPEND = "cannot append to fixed array";

	public static class Syntax {

		/**
		 * Represents the declaration of an array, such as
		 * <code>let a = fixed nat[4] {1, 2}</code> or
		 * <code>let b = vec int {}</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class ArrayDeclaration extends AbstractTerm {
			private final String name;
			private final ScalarKind kind;
			private final Discipline discipline;
			private final Term size;
			private final Term[] initialisers;

			public ArrayDeclaration(String name, ScalarKind kind, Discipline discipline, Term size,
					Term[] initialisers, Attribute... attributes) {
				super(TERM_arraydecl, attributes);
				this.name = name;
				this.kind = kind;
				this.discipline = discipline;
				this.size = size;
				this.initialisers = initialisers;
			}

			public String name() {
				return name;
			}

			public ScalarKind kind() {
				return kind;
			}

			public Discipline discipline() {
				return discipline;
			}

			/**
			 * Get the size of a fixed array.
			 *
			 * @return null for a back-insertion array.
			 */
			public Term size() {
				return size;
			}

			public Term[] initialisers() {
				return initialisers;
			}

			@Override
			public String toString() {
				String s = size == null ? "" : "[" + size + "]";
				return "let " + name + " = " + discipline + " " + kind + s + " {"
						+ rangecheck.core.Syntax.toString(initialisers) + "}";
			}
		}

		public static class Append extends AbstractTerm {
			private final String array;
			private final Term value;

			public Append(String array, Term value, Attribute... attributes) {
				super(TERM_append, attributes);
				this.array = array;
				this.value = value;
			}

			public String array() {
				return array;
			}

			public Term value() {
				return value;
			}

			@Override
			public String toString() {
				return array + ".push(" + value + ")";
			}
		}

		public static class IndexAccess extends AbstractTerm {
			private final String array;
			private final Term index;

			public IndexAccess(String array, Term index, Attribute... attributes) {
				super(TERM_index, attributes);
				this.array = array;
				this.index = index;
			}

			public String array() {
				return array;
			}

			public Term index() {
				return index;
			}

			@Override
			public String toString() {
				return array + "[" + index + "]";
			}
		}

		public static class IndexAssignment extends AbstractTerm {
			private final String array;
			private final Term index;
			private final Term value;

			public IndexAssignment(String array, Term index, Term value, Attribute... attributes) {
				super(TERM_indexassign, attributes);
				this.array = array;
				this.index = index;
				this.value = value;
			}

			public String array() {
				return array;
			}

			public Term index() {
				return index;
			}

			public Term value() {
				return value;
			}

			@Override
			public String toString() {
				return array + "[" + index + "] = " + value;
			}
		}
	}

	public static class Normalisation extends Normaliser.Extension {

		@Override
		public Pair<Void, Term> apply(Void state, int scope, Term term) {
			if (term instanceof Syntax.ArrayDeclaration) {
				Syntax.ArrayDeclaration t = (Syntax.ArrayDeclaration) term;
				Term size = t.size() == null ? null : self.apply(t.size());
				Term[] inits = self.apply(t.initialisers());
				if (size == t.size() && inits == t.initialisers()) {
					return new Pair<>(null, t);
				}
				return self.rewrite(t,
						new Syntax.ArrayDeclaration(t.name(), t.kind(), t.discipline(), size, inits, t.attributes()));
			} else if (term instanceof Syntax.Append) {
				Syntax.Append t = (Syntax.Append) term;
				Term value = self.apply(t.value());
				return self.rewrite(t, value == t.value() ? t : new Syntax.Append(t.array(), value, t.attributes()));
			} else if (term instanceof Syntax.IndexAccess) {
				Syntax.IndexAccess t = (Syntax.IndexAccess) term;
				Term index = self.apply(t.index());
				return self.rewrite(t,
						index == t.index() ? t : new Syntax.IndexAccess(t.array(), index, t.attributes()));
			} else if (term instanceof Syntax.IndexAssignment) {
				Syntax.IndexAssignment t = (Syntax.IndexAssignment) term;
				Term index = self.apply(t.index());
				Term value = self.apply(t.value());
				if (index == t.index() && value == t.value()) {
					return new Pair<>(null, t);
				}
				return self.rewrite(t, new Syntax.IndexAssignment(t.array(), index, value, t.attributes()));
			} else {
				return null;
			}
		}
	}

	/**
	 * Tracks the range of elements held by each array, and flags every statement
	 * which determines the size of an array or accesses it for the second phase.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Typing extends RangeChecker.Extension {

		@Override
		public Pair<Environment, Type> apply(Environment state, int scope, Term term) {
			if (term instanceof Syntax.ArrayDeclaration) {
				return apply(state, scope, (Syntax.ArrayDeclaration) term);
			} else if (term instanceof Syntax.Append) {
				return apply(state, scope, (Syntax.Append) term);
			} else if (term instanceof Syntax.IndexAccess) {
				return apply(state, scope, (Syntax.IndexAccess) term);
			} else if (term instanceof Syntax.IndexAssignment) {
				return apply(state, scope, (Syntax.IndexAssignment) term);
			} else {
				return null;
			}
		}

		private Pair<Environment, Type> apply(Environment R1, int scope, Syntax.ArrayDeclaration t) {
			String x = t.name();
			Slot Sx = R1.get(x);
			self.check(Sx == null, ErrorKind.NameCollision, RangeChecker.VARIABLE_ALREADY_DECLARED, t,
					Sx == null ? null : Sx.declaration());
			Range size = null;
			if (t.discipline() == Discipline.FIXED) {
				self.check(t.size() != null, ErrorKind.TypeMismatch, MISSING_SIZE, t);
				size = self.expectRange(self.apply(R1, scope, t.size()).second(), t.size());
				self.check(size.kind().isIntegral(), ErrorKind.TypeMismatch, EXPECTED_INTEGRAL_SIZE, t.size());
			} else {
				self.check(t.size() == null, ErrorKind.TypeMismatch, UNEXPECTED_SIZE, t.size());
			}
			Type.Array A = new Type.Array(t.discipline(), t.kind());
			for (Term init : t.initialisers()) {
				Range v = self.expectRange(self.apply(R1, scope, init).second(), init);
				A = A.write(self.coerce(t.kind(), v, init));
			}
			if (self.isRecording(R1)) {
				self.facts().flag(Flagged.declare(t, x, self.regions(), size, t.initialisers().length, A.elements()));
			}
			Environment R2 = R1.put(x, new Slot(A, scope, t, null));
			return new Pair<>(R2, Type.Unit);
		}

		private Pair<Environment, Type> apply(Environment R1, int scope, Syntax.Append t) {
			Slot S = array(R1, t.array(), t);
			Type.Array A = (Type.Array) S.type();
			self.check(A.discipline() == Discipline.BACK_INSERTION, ErrorKind.IllegalStructuralWrite, FIXED_APPEND, t,
					S.declaration());
			Range v = self.expectRange(self.apply(R1, scope, t.value()).second(), t.value());
			v = self.coerce(A.elementKind(), v, t.value());
			if (self.isRecording(R1)) {
				self.facts().flag(Flagged.append(t, (Term) S.declaration(), t.array(), self.regions(), v));
			}
			return new Pair<>(R1.put(t.array(), S.with(A.write(v))), Type.Unit);
		}

		private Pair<Environment, Type> apply(Environment R1, int scope, Syntax.IndexAccess t) {
			Slot S = array(R1, t.array(), t);
			Type.Array A = (Type.Array) S.type();
			Range index = index(R1, scope, t.index());
			if (self.isRecording(R1)) {
				Pair<String, Range> v = indexVariable(R1, scope, t.index());
				self.facts().flag(Flagged.read(t, (Term) S.declaration(), t.array(), self.regions(), index,
						v.first(), v.second()));
			}
			Range elements = A.elements();
			return new Pair<>(R1, elements.isEmpty() ? Range.top(A.elementKind()) : elements);
		}

		private Pair<Environment, Type> apply(Environment R1, int scope, Syntax.IndexAssignment t) {
			Slot S = array(R1, t.array(), t);
			Type.Array A = (Type.Array) S.type();
			Range index = index(R1, scope, t.index());
			Range v = self.expectRange(self.apply(R1, scope, t.value()).second(), t.value());
			v = self.coerce(A.elementKind(), v, t.value());
			if (self.isRecording(R1)) {
				Pair<String, Range> iv = indexVariable(R1, scope, t.index());
				self.facts().flag(Flagged.write(t, (Term) S.declaration(), t.array(), self.regions(), index,
						iv.first(), iv.second(), v));
			}
			return new Pair<>(R1.put(t.array(), S.with(A.write(v))), Type.Unit);
		}

		private Slot array(Environment R, String x, Term t) {
			Slot S = R.get(x);
			self.check(S != null, ErrorKind.UnresolvedIdentifier, RangeChecker.UNDECLARED_VARIABLE, t);
			self.check(S.type() instanceof Type.Array, ErrorKind.TypeMismatch, EXPECTED_ARRAY, t);
			return S;
		}

		private Range index(Environment R, int scope, Term index) {
			Range r = self.expectRange(self.apply(R, scope, index).second(), index);
			self.check(r.kind().isIntegral(), ErrorKind.TypeMismatch, EXPECTED_INTEGRAL_INDEX, index);
			return r;
		}

		/**
		 * Determine whether an index is a variable plus some constant, such as
		 * <code>i</code> or <code>i + 1</code>. If so, the variable is returned
		 * along with how far the index is from the value the variable held at the
		 * start of the current iteration (if known).
		 */
		private Pair<String, Range> indexVariable(Environment R, int scope, Term index) {
			if (index instanceof Term.Variable) {
				String x = ((Term.Variable) index).name();
				return new Pair<>(x, R.get(x).offset());
			} else if (index instanceof Term.Binary) {
				Term.Binary b = (Term.Binary) index;
				BinaryOperator op = b.operator();
				if ((op == BinaryOperator.ADD || op == BinaryOperator.SUB) && b.leftOperand() instanceof Term.Variable) {
					String x = ((Term.Variable) b.leftOperand()).name();
					Range offset = R.get(x).offset();
					Range c = self.evaluate(R, scope, b.rightOperand());
					if (offset != null && c.isConstant()) {
						offset = op == BinaryOperator.ADD ? offset.add(c) : offset.subtract(c);
						return new Pair<>(x, offset);
					}
				}
			}
			return new Pair<>(null, null);
		}
	}
}
