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

import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangecheck.core.Bound;
import rangecheck.core.ErrorKind;
import rangecheck.core.FactTable.CollapsedLoop;
import rangecheck.core.FactTable.BranchRegion;
import rangecheck.core.FactTable.LoopFact;
import rangecheck.core.FactTable.LoopRegion;
import rangecheck.core.FactTable.Verdict;
import rangecheck.core.Narrowing;
import rangecheck.core.Normaliser;
import rangecheck.core.Range;
import rangecheck.core.RangeChecker;
import rangecheck.core.RangeChecker.Environment;
import rangecheck.core.RangeChecker.Slot;
import rangecheck.core.ScalarKind;
import rangecheck.core.ScopeTree;
import rangecheck.core.Syntax.BinaryOperator;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Term.AbstractTerm;
import rangecheck.core.Syntax.Value;
import rangecheck.core.Type;
import rangecheck.util.AnalysisError;
import rangecheck.util.Pair;

/**
 * Extensions to the core calculus for control-flow constructs (e.g. if-else,
 * while, for, etc). Surface loops are normalised into a single canonical form
 * before being analysed.
 *
 * @author David J. Pearce
 *
 */
public class ControlFlow {
	public final static int TERM_ifelse = 20;
	public final static int TERM_while = 22;
	public final static int TERM_for = 24;
	public final static int TERM_loop = 25;
	public final static int TERM_compound = 26;
	// Error messages
	public final static String EXPECTED_NUMERIC_ITERATOR = "loop iterator must be numeric";
	public final static String ITERATOR_ALREADY_ACTIVE = "iterator already drives an enclosing loop";
	public final static String NESTED_ITERATOR_MUTATION = "iterator assigned within nested loop";
	public final static String LIMIT_MODIFIED = "loop limit modified within loop";
	public final static String ITERATOR_NOT_INCREASING = "iterator not strictly increasing";
	public final static String UNSUPPORTED_CONDITION = "loop condition does not bound an iterator";

	/**
	 * Extensions to the core syntax of the language.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Syntax {
		/**
		 * Represents an if-else statement, where the else block is optional.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class IfElse extends AbstractTerm implements Term.Compound {
			private final Term condition;
			private final Term.Block trueBlock;
			private final Term.Block falseBlock;

			public IfElse(Term condition, Term.Block trueBlock, Term.Block falseBlock, Attribute... attributes) {
				super(TERM_ifelse, attributes);
				this.condition = condition;
				this.trueBlock = trueBlock;
				this.falseBlock = falseBlock;
			}

			public Term condition() {
				return condition;
			}

			/**
			 * Get the true block for this statement.
			 *
			 * @return
			 */
			public Term.Block trueBlock() {
				return trueBlock;
			}

			/**
			 * Get the false block for this statement.
			 *
			 * @return null if there is no else block.
			 */
			public Term.Block falseBlock() {
				return falseBlock;
			}

			@Override
			public String toString() {
				String r = "if " + condition + " " + trueBlock;
				return falseBlock == null ? r : r + " else " + falseBlock;
			}
		}

		public static class While extends AbstractTerm implements Term.Compound {
			private final Term condition;
			private final Term.Block body;

			public While(Term condition, Term.Block body, Attribute... attributes) {
				super(TERM_while, attributes);
				this.condition = condition;
				this.body = body;
			}

			public Term condition() {
				return condition;
			}

			public Term.Block body() {
				return body;
			}

			@Override
			public String toString() {
				return "while " + condition + " " + body;
			}
		}

		/**
		 * Represents a counted loop <code>for i in s..l step d { ... }</code>, which
		 * declares its iterator <code>i</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class For extends AbstractTerm implements Term.Compound {
			private final String variable;
			private final Term start;
			private final Term limit;
			private final boolean inclusive;
			private final Term step;
			private final Term.Block body;

			public For(String variable, Term start, Term limit, boolean inclusive, Term step, Term.Block body,
					Attribute... attributes) {
				super(TERM_for, attributes);
				this.variable = variable;
				this.start = start;
				this.limit = limit;
				this.inclusive = inclusive;
				this.step = step;
				this.body = body;
			}

			public String variable() {
				return variable;
			}

			public Term start() {
				return start;
			}

			public Term limit() {
				return limit;
			}

			/**
			 * Check whether the limit is the last value of the iterator (i.e.
			 * <code>..=</code>) or the first value which is not.
			 *
			 * @return
			 */
			public boolean inclusive() {
				return inclusive;
			}

			/**
			 * Get the amount added to the iterator after each iteration.
			 *
			 * @return null when the step is one.
			 */
			public Term step() {
				return step;
			}

			public Term.Block body() {
				return body;
			}

			@Override
			public String toString() {
				String r = "for " + variable + " in " + start + (inclusive ? "..=" : "..") + limit;
				return (step == null ? r : r + " step " + step) + " " + body;
			}
		}

		/**
		 * The canonical loop, which repeats its body whilst the iterator is below
		 * (or, if inclusive, not above) the limit. The body is responsible for
		 * moving the iterator.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Loop extends AbstractTerm implements Term.Compound {
			private final String iterator;
			private final Term limit;
			private final boolean inclusive;
			private final Term.Block body;
			private final Term.Binary condition;

			public Loop(String iterator, Term limit, boolean inclusive, Term.Block body, Attribute... attributes) {
				super(TERM_loop, attributes);
				this.iterator = iterator;
				this.limit = limit;
				this.inclusive = inclusive;
				this.body = body;
				this.condition = new Term.Binary(inclusive ? BinaryOperator.LTEQ : BinaryOperator.LT,
						new Term.Variable(iterator, attributes), limit, attributes);
			}

			public String iterator() {
				return iterator;
			}

			public Term limit() {
				return limit;
			}

			public boolean inclusive() {
				return inclusive;
			}

			public Term.Block body() {
				return body;
			}

			/**
			 * Get the condition controlling this loop.
			 *
			 * @return
			 */
			public Term.Binary condition() {
				return condition;
			}

			@Override
			public String toString() {
				return "loop " + condition + " " + body;
			}
		}

		/**
		 * Represents an assignment such as <code>x += e</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class CompoundAssignment extends AbstractTerm {
			private final BinaryOperator operator;
			private final String variable;
			private final Term rhs;

			public CompoundAssignment(BinaryOperator operator, String variable, Term rhs, Attribute... attributes) {
				super(TERM_compound, attributes);
				this.operator = operator;
				this.variable = variable;
				this.rhs = rhs;
			}

			public BinaryOperator operator() {
				return operator;
			}

			public String variable() {
				return variable;
			}

			public Term rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return variable + " " + operator + "= " + rhs;
			}
		}
	}

	/**
	 * Rewrites surface loops and compound assignments into canonical form.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Normalisation extends Normaliser.Extension {

		@Override
		public Pair<Void, Term> apply(Void state, int scope, Term term) {
			if (term instanceof Syntax.IfElse) {
				return apply((Syntax.IfElse) term);
			} else if (term instanceof Syntax.While) {
				return apply((Syntax.While) term);
			} else if (term instanceof Syntax.For) {
				return apply((Syntax.For) term);
			} else if (term instanceof Syntax.Loop) {
				return apply((Syntax.Loop) term);
			} else if (term instanceof Syntax.CompoundAssignment) {
				return apply((Syntax.CompoundAssignment) term);
			} else {
				return null;
			}
		}

		private Pair<Void, Term> apply(Syntax.IfElse t) {
			Term c = self.apply(t.condition());
			Term.Block tb = self.apply(t.trueBlock());
			Term.Block fb = t.falseBlock() == null ? null : self.apply(t.falseBlock());
			if (c == t.condition() && tb == t.trueBlock() && fb == t.falseBlock()) {
				return new Pair<>(null, t);
			}
			return self.rewrite(t, new Syntax.IfElse(c, tb, fb, t.attributes()));
		}

		private Pair<Void, Term> apply(Syntax.Loop t) {
			Term limit = self.apply(t.limit());
			Term.Block body = self.apply(t.body());
			if (limit == t.limit() && body == t.body()) {
				return new Pair<>(null, t);
			}
			return self.rewrite(t, new Syntax.Loop(t.iterator(), limit, t.inclusive(), body, t.attributes()));
		}

		/**
		 * A while loop is canonical when its condition bounds a variable from above,
		 * as in <code>x < e</code> or <code>e >= x</code>.
		 */
		private Pair<Void, Term> apply(Syntax.While t) {
			Term.Block body = self.apply(t.body());
			if (t.condition() instanceof Term.Binary) {
				Term.Binary c = (Term.Binary) t.condition();
				BinaryOperator op = c.operator();
				Term lhs = c.leftOperand();
				Term rhs = c.rightOperand();
				if ((op == BinaryOperator.GT || op == BinaryOperator.GTEQ) && rhs instanceof Term.Variable) {
					// Flip condition around
					op = op.flip();
					Term tmp = lhs;
					lhs = rhs;
					rhs = tmp;
				}
				if ((op == BinaryOperator.LT || op == BinaryOperator.LTEQ) && lhs instanceof Term.Variable) {
					String x = ((Term.Variable) lhs).name();
					Term limit = self.apply(rhs);
					return self.rewrite(t, new Syntax.Loop(x, limit, op == BinaryOperator.LTEQ, body, t.attributes()));
				}
			}
			AnalysisError.analysisError(ErrorKind.NonMonotonicIterator, UNSUPPORTED_CONDITION, t.condition());
			return null;
		}

		/**
		 * A for loop becomes a block which declares the iterator, followed by a
		 * canonical loop whose body finishes by moving the iterator.
		 */
		private Pair<Void, Term> apply(Syntax.For t) {
			String x = t.variable();
			Term start = self.apply(t.start());
			Term limit = self.apply(t.limit());
			Term step = t.step() == null ? new Value.Integer(1, t.attributes()) : self.apply(t.step());
			Term.Block body = self.apply(t.body());
			Term[] stmts = java.util.Arrays.copyOf(body.toArray(), body.size() + 1);
			stmts[body.size()] = new Term.Assignment(x,
					new Term.Binary(BinaryOperator.ADD, new Term.Variable(x, t.attributes()), step, t.attributes()),
					t.attributes());
			Syntax.Loop loop = new Syntax.Loop(x, limit, t.inclusive(), new Term.Block(stmts, body.attributes()),
					t.attributes());
			Term.Block block = new Term.Block(new Term[] { new Term.Let(x, start, t.attributes()), loop },
					t.attributes());
			// Facts about the for loop are those of the canonical loop
			self.rewrite(t, loop);
			return new Pair<>(null, block);
		}

		private Pair<Void, Term> apply(Syntax.CompoundAssignment t) {
			Term rhs = self.apply(t.rightOperand());
			Term.Binary b = new Term.Binary(t.operator(), new Term.Variable(t.variable(), t.attributes()), rhs,
					t.attributes());
			return self.rewrite(t, new Term.Assignment(t.variable(), b, t.attributes()));
		}
	}

	public static class Typing extends RangeChecker.Extension {
		private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlow.Typing.class);

		@Override
		public Pair<Environment, Type> apply(Environment state, int scope, Term term) {
			if (term instanceof Syntax.IfElse) {
				return apply(state, scope, (Syntax.IfElse) term);
			} else if (term instanceof Syntax.Loop) {
				return apply(state, scope, (Syntax.Loop) term);
			} else {
				return null;
			}
		}

		private Pair<Environment, Type> apply(Environment R1, int scope, Syntax.IfElse t) {
			// Type condition
			Range c = self.expectRange(self.apply(R1, scope, t.condition()).second(), t.condition());
			self.check(c.kind() == ScalarKind.BOOLEAN, ErrorKind.TypeMismatch, RangeChecker.EXPECTED_BOOLEAN,
					t.condition());
			// Narrow environment for each branch
			Pair<Environment, Environment> n = Narrowing.narrow(self, R1, scope, t.condition());
			Verdict verdict = Narrowing.verdict(n);
			if (self.isRecording(R1)) {
				self.facts().verdict(t, verdict);
			}
			if (R1.isReachable() && self.collector() != null) {
				self.collector().add(t, verdict);
			}
			// Type true and false blocks
			Pair<Environment, Type> pTrue = branch(n.first(), scope, t, true, verdict, t.trueBlock());
			Pair<Environment, Type> pFalse;
			if (t.falseBlock() == null) {
				pFalse = new Pair<>(n.second(), Type.Unit);
			} else {
				pFalse = branch(n.second(), scope, t, false, verdict, t.falseBlock());
			}
			// Join environment and types from both branches
			Environment R2 = self.join(pTrue.first(), pFalse.first());
			return new Pair<>(R2, join(pTrue, pFalse, t));
		}

		private Pair<Environment, Type> branch(Environment R, int scope, Syntax.IfElse t, boolean branch,
				Verdict verdict, Term.Block block) {
			self.enterRegion(new BranchRegion(t, branch, verdict));
			try {
				return self.apply(R, self.scopes().fresh(scope, ScopeTree.Kind.BRANCH), block);
			} finally {
				self.exitRegion();
			}
		}

		/**
		 * Determine the type of a conditional from those of its branches. Branches
		 * which cannot be taken are ignored.
		 */
		private Type join(Pair<Environment, Type> lhs, Pair<Environment, Type> rhs, Syntax.IfElse t) {
			Type T1 = lhs.second();
			Type T2 = rhs.second();
			if (!lhs.first().isReachable()) {
				return T2;
			} else if (!rhs.first().isReachable()) {
				return T1;
			} else if (T1 instanceof Range && T2 instanceof Range) {
				self.check(T1.isCompatible(T2), ErrorKind.TypeMismatch, RangeChecker.INCOMPATIBLE_TYPE, t);
				return T1.union(T2);
			} else {
				return Type.Unit;
			}
		}

		private Pair<Environment, Type> apply(Environment R1, int scope, Syntax.Loop t) {
			final String i = t.iterator();
			Slot Si = R1.get(i);
			self.check(Si != null, ErrorKind.UnresolvedIdentifier, RangeChecker.UNDECLARED_VARIABLE, t);
			self.check(Si.type() instanceof Range && ((Range) Si.type()).kind().isNumeric(), ErrorKind.TypeMismatch,
					EXPECTED_NUMERIC_ITERATOR, t);
			Term outer = self.activeLoop(i);
			self.check(outer == null, ErrorKind.ConflictingIteratorMutation, ITERATOR_ALREADY_ACTIVE, t, outer);
			// Determine what the body can change
			Set<String> modified = IteratorAnalysis.modified(t.body());
			modified.retainAll(R1.bindings());
			Term.Assignment nested = IteratorAnalysis.nestedAssignment(t.body(), i);
			self.check(nested == null, ErrorKind.ConflictingIteratorMutation, NESTED_ITERATOR_MUTATION, nested, t);
			for (String x : IteratorAnalysis.reads(t.limit())) {
				self.check(!modified.contains(x), ErrorKind.NonMonotonicIterator, LIMIT_MODIFIED, t.limit());
			}
			final Range start = (Range) Si.type();
			final Range limit = self.expectRange(self.apply(R1, scope, t.limit()).second(), t.limit());
			self.check(limit.kind().isNumeric(), ErrorKind.TypeMismatch, RangeChecker.EXPECTED_NUMERIC, t.limit());
			if (!R1.isReachable() || start.isEmpty() || limit.isEmpty()) {
				// Still check the body
				self.mute();
				try {
					body(R1, scope, t);
				} finally {
					self.unmute();
				}
				return new Pair<>(R1, Type.Unit);
			}
			// Pass 1: determine how far each variable moves in one iteration. The
			// iterator cannot fall below its start, provided it only increases.
			Environment E1;
			self.mute();
			try {
				E1 = narrowTrue(widen(R1, modified, i, start.min()), scope, t);
				if (!E1.isReachable()) {
					// Never entered
					E1 = narrowTrue(widen(R1, modified, i, null), scope, t);
				}
				E1 = body(E1, scope, t);
			} finally {
				self.unmute();
			}
			final Range delta = E1.isReachable() ? E1.get(i).offset() : null;
			if (!self.checkRange(delta != null && delta.min().signum() > 0, ErrorKind.NonMonotonicIterator,
					ITERATOR_NOT_INCREASING, t)) {
				// Only reached when muted, where the loop may change anything it modifies
				return new Pair<>(havoc(R1, modified), Type.Unit);
			}
			// Determine iteration counts
			final Bound last, exitMin;
			if (start.kind() != ScalarKind.REAL && !t.inclusive()) {
				last = limit.max().ceiling().subtract(Bound.ONE);
				exitMin = limit.min().ceiling();
			} else if (start.kind() != ScalarKind.REAL) {
				last = limit.max().floor();
				exitMin = limit.min().floor().add(Bound.ONE);
			} else {
				last = limit.max();
				exitMin = limit.min();
			}
			Bound minCount = Bound.ZERO;
			Bound distance = exitMin.subtract(start.max());
			if (distance.signum() > 0) {
				minCount = distance.divide(delta.max(), RoundingMode.CEILING, false).ceiling();
			}
			Bound maxCount = Bound.ZERO;
			if (last.compareTo(start.min()) >= 0) {
				Bound steps = last.subtract(start.min()).divide(delta.min(), RoundingMode.FLOOR, false).floor();
				maxCount = steps.add(Bound.ONE);
			}
			final Range count = Range.of(ScalarKind.NATURAL, Bound.min(minCount, maxCount), maxCount);
			LOGGER.debug("loop {} iterates {} times (delta {})", i, count, delta);
			// Determine loop-carried ranges
			Environment entry = R1;
			Environment exit = R1;
			HashMap<String, Range> offsets = new HashMap<>();
			for (String x : modified) {
				Slot S = R1.get(x);
				if (S.type() instanceof Range) {
					Range pre = (Range) S.type();
					Range off = E1.get(x).offset();
					Range en, ex;
					if (off != null) {
						en = maxCount.signum() == 0 ? pre
								: pre.add(off.multiply(Range.of(ScalarKind.NATURAL, Bound.ZERO, maxCount.subtract(Bound.ONE))));
						ex = pre.add(off.multiply(count));
						if (minCount.signum() == 0) {
							ex = ex.union(pre);
						}
					} else {
						en = pre.union(E1.get(x).type());
						ex = en;
					}
					ScalarKind kind = pre.kind().isIntegral() ? ScalarKind.INTEGER : pre.kind();
					entry = entry.put(x, S.with(self.coerce(kind, en, t)));
					exit = exit.put(x, S.with(self.coerce(kind, ex, t)));
					if (S.offset() != null && off != null) {
						offsets.put(x, S.offset().add(off.multiply(count)));
					}
				}
			}
			// Array elements are carried until they stop growing
			Map<String, Type.Array> arrays = stabilise(entry, scope, t, modified);
			for (Map.Entry<String, Type.Array> e : arrays.entrySet()) {
				entry = entry.put(e.getKey(), e.getValue());
				exit = exit.put(e.getKey(), e.getValue());
			}
			// Determine environment after loop
			Environment post = narrowFalse(exit, scope, t);
			Range clamp = Range.of(start.kind(), Bound.max(start.min(), exitMin),
					Bound.max(start.max(), last.add(delta.max())));
			post = clamp(post, i, clamp);
			final LoopFact fact = new LoopFact(i, start, limit, delta, count,
					post.isReachable() ? (Range) post.get(i).type() : Range.empty(start.kind()));
			if (self.isRecording(R1)) {
				self.facts().loop(t, fact);
			}
			// Pass 2: record facts about the body
			CollapsedLoop collector = self.collector();
			self.enterRegion(new LoopRegion(t, fact));
			self.setCollector(null);
			try {
				body(narrowTrue(track(entry, modified), scope, t), scope, t);
			} finally {
				self.setCollector(collector);
				self.exitRegion();
			}
			// Expand loops with a known number of iterations, unless the expansion of
			// enclosing loops already repeats this one too often
			int limitCollapse = self.options().getMaxCollapseIterations();
			if (count.isConstant() && self.options().getCollapse()
					&& count.max().compareTo(Bound.of(limitCollapse)) <= 0) {
				int k = count.max().toBigInteger().intValueExact();
				if (self.expansion() * k <= limitCollapse) {
					post = collapse(R1, scope, t, k);
				} else {
					LOGGER.debug("loop {} not collapsed ({} enclosing expansions)", i, self.expansion());
				}
			}
			// Restore offsets of enclosing loop
			for (String x : modified) {
				Slot S = post.get(x);
				if (S != null && S.type() instanceof Range) {
					post = post.put(x, S.with(S.type(), offsets.get(x)));
				}
			}
			return new Pair<>(post, Type.Unit);
		}

		/**
		 * Expand the body of a loop a given number of times, recording the verdict of
		 * every conditional on each iteration.
		 */
		private Environment collapse(Environment R1, int scope, Syntax.Loop t, int k) {
			CollapsedLoop collapsed = new CollapsedLoop(k);
			CollapsedLoop collector = self.collector();
			long expansion = self.expansion();
			self.setCollector(collapsed);
			self.setExpansion(expansion * k);
			self.mute();
			Environment Rj = R1;
			try {
				for (int j = 0; j != k; ++j) {
					Rj = body(narrowTrue(Rj, scope, t), scope, t);
				}
				Rj = narrowFalse(Rj, scope, t);
			} finally {
				self.unmute();
				self.setExpansion(expansion);
				self.setCollector(collector);
			}
			if (self.isRecording(R1)) {
				self.facts().collapsed(t, collapsed);
			}
			LOGGER.debug("loop {} collapsed into {} iterations", t.iterator(), k);
			return Rj;
		}

		/**
		 * Re-analyse the body until the elements of every array it changes stop
		 * growing. Arrays which do not stabilise are widened to every value of their
		 * kind.
		 */
		private Map<String, Type.Array> stabilise(Environment entry, int scope, Syntax.Loop t, Set<String> modified) {
			HashMap<String, Type.Array> arrays = new HashMap<>();
			for (String x : modified) {
				if (entry.get(x).type() instanceof Type.Array) {
					arrays.put(x, (Type.Array) entry.get(x).type());
				}
			}
			if (arrays.isEmpty()) {
				return arrays;
			}
			self.mute();
			try {
				for (int round = 0; round != MAX_ROUNDS; ++round) {
					Environment E = track(entry, modified);
					for (Map.Entry<String, Type.Array> e : arrays.entrySet()) {
						E = E.put(e.getKey(), e.getValue());
					}
					E = body(narrowTrue(E, scope, t), scope, t);
					boolean stable = true;
					for (Map.Entry<String, Type.Array> e : arrays.entrySet()) {
						Type.Array before = e.getValue();
						Type.Array after = E.isReachable() ? (Type.Array) E.get(e.getKey()).type() : before;
						if (!before.elements().contains(after.elements())) {
							stable = false;
							e.setValue(before.union(after));
						}
					}
					if (stable) {
						return arrays;
					}
				}
			} finally {
				self.unmute();
			}
			for (Map.Entry<String, Type.Array> e : arrays.entrySet()) {
				Type.Array A = e.getValue();
				e.setValue(new Type.Array(A.discipline(), A.elementKind(), Range.top(A.elementKind())));
			}
			return arrays;
		}

		private static final int MAX_ROUNDS = 3;

		/**
		 * Analyse the body of a loop with it registered as active.
		 */
		private Environment body(Environment R, int scope, Syntax.Loop t) {
			self.enterLoop(t.iterator(), t);
			try {
				int inner = self.scopes().fresh(scope, ScopeTree.Kind.LOOP);
				return self.apply(R, inner, t.body()).first();
			} finally {
				self.exitLoop();
			}
		}

		private Environment narrowTrue(Environment R, int scope, Syntax.Loop t) {
			return Narrowing.narrow(self, R, scope, t.condition()).first();
		}

		private Environment narrowFalse(Environment R, int scope, Syntax.Loop t) {
			return Narrowing.narrow(self, R, scope, t.condition()).second();
		}

		/**
		 * Set every scalar modified by a loop to any value of its kind, and start
		 * tracking its offset. The iterator is kept at or above a given bound, when
		 * there is one.
		 */
		private static Environment widen(Environment R, Set<String> modified, String iterator, Bound floor) {
			for (String x : modified) {
				Slot S = R.get(x);
				if (S.type() instanceof Range) {
					Range top = top(((Range) S.type()).kind());
					if (floor != null && x.equals(iterator)) {
						top = Range.of(top.kind(), floor, top.max());
					}
					R = R.put(x, S.with(top, Range.constant(0)));
				} else {
					Type.Array A = (Type.Array) S.type();
					R = R.put(x, S.with(new Type.Array(A.discipline(), A.elementKind(), Range.top(A.elementKind()))));
				}
			}
			return R;
		}

		/**
		 * Set everything modified by a loop to any value of its kind, with no known
		 * offset.
		 */
		private static Environment havoc(Environment R, Set<String> modified) {
			for (String x : modified) {
				Slot S = R.get(x);
				if (S.type() instanceof Range) {
					R = R.put(x, S.with(top(((Range) S.type()).kind()), null));
				} else {
					Type.Array A = (Type.Array) S.type();
					R = R.put(x, S.with(new Type.Array(A.discipline(), A.elementKind(), Range.top(A.elementKind()))));
				}
			}
			return R;
		}

		private static Range top(ScalarKind kind) {
			return Range.top(kind.isIntegral() ? ScalarKind.INTEGER : kind);
		}

		/**
		 * Start tracking the offset of every scalar modified by a loop.
		 */
		private static Environment track(Environment R, Set<String> modified) {
			for (String x : modified) {
				Slot S = R.get(x);
				if (S.type() instanceof Range) {
					R = R.put(x, S.with(S.type(), Range.constant(0)));
				}
			}
			return R;
		}

		private static Environment clamp(Environment R, String x, Range range) {
			if (!R.isReachable()) {
				return R;
			}
			Slot S = R.get(x);
			Range r = ((Range) S.type()).intersect(range);
			return r.isEmpty() ? R.unreachable() : R.put(x, S.with(r));
		}
	}
}
