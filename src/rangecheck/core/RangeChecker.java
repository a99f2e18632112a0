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
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangecheck.core.FactTable.CollapsedLoop;
import rangecheck.core.FactTable.Region;
import rangecheck.core.Syntax.BinaryOperator;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Value;
import rangecheck.util.AbstractTransformer;
import rangecheck.util.AnalysisError;
import rangecheck.util.Pair;
import rangecheck.util.SyntacticElement;

/**
 * Responsible for inferring the range of every variable at every statement of a
 * program (the first phase of the analysis). Each term is transformed into the
 * environment holding after it, together with its type.
 *
 * Parts of a program are frequently analysed more than once (e.g. loop bodies,
 * or branches which cannot be reached). Facts are only recorded when the
 * checker is not <i>muted</i> and the environment is reachable, so that each
 * statement contributes exactly one set of facts.
 *
 * @author David J. Pearce
 *
 */
public class RangeChecker extends AbstractTransformer<RangeChecker.Environment, Type, RangeChecker.Extension> {
	private static final Logger LOGGER = LoggerFactory.getLogger(RangeChecker.class);
	/**
	 * Constant to reduce unnecessary environment instances.
	 */
	public final static Environment EMPTY_ENVIRONMENT = new Environment();
	// Error messages
	public final static String UNDECLARED_VARIABLE = "variable undeclared";
	public final static String VARIABLE_ALREADY_DECLARED = "variable already declared";
	public final static String INCOMPATIBLE_TYPE = "incompatible type";
	public final static String EXPECTED_VALUE = "expected a value";
	public final static String EXPECTED_BOOLEAN = "expected boolean operand";
	public final static String EXPECTED_NUMERIC = "expected numeric operand";
	public final static String EXPECTED_NATURAL = "bitwise operand must be natural";
	public final static String ARRAY_AS_VALUE = "array cannot be used as a value";
	public final static String ARRAY_ASSIGNMENT = "cannot assign to an array variable";

	protected final Options options;
	protected final ScopeTree scopes;
	protected final FactTable facts;
	/**
	 * Number of enclosing analyses whose facts must not be recorded.
	 */
	private int muted;
	/**
	 * Loops and branches enclosing the term being analysed, outermost first.
	 */
	private final ArrayList<Region> regions = new ArrayList<>();
	/**
	 * Loops currently being analysed, outermost first.
	 */
	private final ArrayList<Pair<String, Term>> loops = new ArrayList<>();
	/**
	 * Receives the verdict of each conditional whilst a loop is being expanded.
	 */
	private CollapsedLoop collector;
	/**
	 * Product of the iteration counts of every loop currently being expanded.
	 */
	private long expansion = 1;

	public RangeChecker(Options options, ScopeTree scopes, FactTable facts, Extension... extensions) {
		super(extensions);
		this.options = options;
		this.scopes = scopes;
		this.facts = facts;
		// Bind self in extensions
		for (Extension e : extensions) {
			e.self = this;
		}
	}

	@Override
	public Pair<Environment, Type> apply(Environment R1, int scope, Term t) {
		Pair<Environment, Type> p = super.apply(R1, scope, t);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{} |- {} : {} -| {}", R1, t, p.second(), p.first());
		}
		return p;
	}

	public Options options() {
		return options;
	}

	public ScopeTree scopes() {
		return scopes;
	}

	public FactTable facts() {
		return facts;
	}

	/**
	 * T-Const
	 */
	@Override
	protected Pair<Environment, Type> apply(Environment R, int scope, Value.Integer t) {
		return new Pair<>(R, Range.constant(t.value()));
	}

	@Override
	protected Pair<Environment, Type> apply(Environment R, int scope, Value.Real t) {
		return new Pair<>(R, Range.constant(ScalarKind.REAL, Bound.of(t.value())));
	}

	@Override
	protected Pair<Environment, Type> apply(Environment R, int scope, Value.Bool t) {
		return new Pair<>(R, Range.bool(t.value()));
	}

	/**
	 * T-Var
	 */
	@Override
	protected Pair<Environment, Type> apply(Environment R, int scope, Term.Variable t) {
		Slot S = R.get(t.name());
		check(S != null, ErrorKind.UnresolvedIdentifier, UNDECLARED_VARIABLE, t);
		check(S.type() instanceof Range, ErrorKind.TypeMismatch, ARRAY_AS_VALUE, t);
		return new Pair<>(R, S.type());
	}

	/**
	 * T-Binary
	 */
	@Override
	protected Pair<Environment, Type> apply(Environment R, int scope, Term.Binary t) {
		BinaryOperator op = t.operator();
		Range lhs = expectRange(apply(R, scope, t.leftOperand()).second(), t.leftOperand());
		if (op.isLogical()) {
			check(lhs.kind() == ScalarKind.BOOLEAN, ErrorKind.TypeMismatch, EXPECTED_BOOLEAN, t.leftOperand());
			// Right-hand side only evaluated when left-hand side does not decide
			Pair<Environment, Environment> n = Narrowing.narrow(this, R, scope, t.leftOperand());
			Environment R2 = op == BinaryOperator.AND ? n.first() : n.second();
			Range rhs = expectRange(apply(R2, scope, t.rightOperand()).second(), t.rightOperand());
			check(rhs.kind() == ScalarKind.BOOLEAN, ErrorKind.TypeMismatch, EXPECTED_BOOLEAN, t.rightOperand());
			return new Pair<>(R, logical(op, lhs, rhs));
		}
		Range rhs = expectRange(apply(R, scope, t.rightOperand()).second(), t.rightOperand());
		if (op.isComparison()) {
			check(lhs.kind().join(rhs.kind()) != null, ErrorKind.TypeMismatch, INCOMPATIBLE_TYPE, t);
			if (op != BinaryOperator.EQ && op != BinaryOperator.NEQ) {
				check(lhs.kind().isNumeric(), ErrorKind.TypeMismatch, EXPECTED_NUMERIC, t.leftOperand());
			}
			return new Pair<>(R, lhs.compare(op, rhs));
		} else if (op.isBitwise()) {
			check(lhs.kind().isIntegral(), ErrorKind.TypeMismatch, EXPECTED_NATURAL, t.leftOperand());
			check(rhs.kind().isIntegral(), ErrorKind.TypeMismatch, EXPECTED_NATURAL, t.rightOperand());
			checkRange(isNatural(lhs), ErrorKind.TypeMismatch, EXPECTED_NATURAL, t.leftOperand());
			checkRange(isNatural(rhs), ErrorKind.TypeMismatch, EXPECTED_NATURAL, t.rightOperand());
			return new Pair<>(R, bitwise(op, natural(lhs), natural(rhs)));
		} else {
			check(lhs.kind().isNumeric(), ErrorKind.TypeMismatch, EXPECTED_NUMERIC, t.leftOperand());
			check(rhs.kind().isNumeric(), ErrorKind.TypeMismatch, EXPECTED_NUMERIC, t.rightOperand());
			return new Pair<>(R, arithmetic(op, lhs, rhs));
		}
	}

	/**
	 * T-Unary
	 */
	@Override
	protected Pair<Environment, Type> apply(Environment R, int scope, Term.Unary t) {
		Range operand = expectRange(apply(R, scope, t.operand()).second(), t.operand());
		switch (t.operator()) {
		case NEG:
			check(operand.kind().isNumeric(), ErrorKind.TypeMismatch, EXPECTED_NUMERIC, t.operand());
			return new Pair<>(R, operand.negate());
		default:
			check(operand.kind() == ScalarKind.BOOLEAN, ErrorKind.TypeMismatch, EXPECTED_BOOLEAN, t.operand());
			return new Pair<>(R, operand.logicalNot());
		}
	}

	/**
	 * T-Seq
	 */
	protected Pair<Environment, Type> apply(Environment R1, int scope, Term... ts) {
		Environment Rn = R1;
		Type Tn = Type.Unit;
		for (int i = 0; i != ts.length; ++i) {
			Term ith = ts[i];
			if (isRecording(Rn)) {
				facts.snapshot(ith, Rn.snapshot());
			}
			Pair<Environment, Type> p = apply(Rn, scope, ith);
			Rn = p.first();
			Tn = p.second();
		}
		//
		return new Pair<>(Rn, Tn);
	}

	/**
	 * T-Block
	 */
	@Override
	protected Pair<Environment, Type> apply(Environment R1, int scope, Term.Block t) {
		int inner = scopes.fresh(scope, ScopeTree.Kind.BLOCK);
		Pair<Environment, Type> p = apply(R1, inner, t.toArray());
		// Variables declared in the block are destroyed on exit
		Environment R2 = drop(p.first(), inner);
		return new Pair<>(R2, p.second());
	}

	/**
	 * T-Declare
	 */
	@Override
	protected Pair<Environment, Type> apply(Environment R1, int scope, Term.Let t) {
		// Sanity check variable not already declared
		String x = t.variable();
		Slot Sx = R1.get(x);
		if (Sx != null) {
			analysisError(ErrorKind.NameCollision, VARIABLE_ALREADY_DECLARED, t, Sx.declaration());
		}
		// Type operand
		Pair<Environment, Type> p = apply(R1, scope, t.initialiser());
		Environment R2 = p.first();
		Range T = expectRange(p.second(), t.initialiser());
		// Update environment
		Environment R3 = R2.put(x, new Slot(T, scope, t, null));
		// Done
		return new Pair<>(R3, Type.Unit);
	}

	/**
	 * T-Assign
	 */
	@Override
	protected Pair<Environment, Type> apply(Environment R1, int scope, Term.Assignment t) {
		String x = t.variable();
		Slot Sx = R1.get(x);
		check(Sx != null, ErrorKind.UnresolvedIdentifier, UNDECLARED_VARIABLE, t);
		check(Sx.type() instanceof Range, ErrorKind.IllegalStructuralWrite, ARRAY_ASSIGNMENT, t);
		// Type operand
		Pair<Environment, Type> p = apply(R1, scope, t.rightOperand());
		Environment R2 = p.first();
		Range value = expectRange(p.second(), t.rightOperand());
		ScalarKind kind = ((Range) Sx.type()).kind();
		Range T = coerce(kind.isIntegral() ? ScalarKind.INTEGER : kind, value, t.rightOperand());
		// Track how far the variable moves relative to its own previous value
		Range offset = offset(R1, scope, x, t.rightOperand(), Sx.offset());
		Environment R3 = R2.put(x, Sx.with(T, offset));
		return new Pair<>(R3, Type.Unit);
	}

	/**
	 * Determine the new offset of a variable being assigned. Assignments of the
	 * form <code>x = x + e</code>, <code>x = e + x</code> and
	 * <code>x = x - e</code> move the offset by the range of <code>e</code>;
	 * anything else loses it.
	 */
	private Range offset(Environment R, int scope, String x, Term rhs, Range offset) {
		if (offset == null) {
			return null;
		} else if (rhs instanceof Term.Variable && ((Term.Variable) rhs).name().equals(x)) {
			return offset;
		} else if (rhs instanceof Term.Binary) {
			Term.Binary b = (Term.Binary) rhs;
			if (b.operator() == BinaryOperator.ADD && isVariable(b.leftOperand(), x)) {
				return offset.add(evaluate(R, scope, b.rightOperand()));
			} else if (b.operator() == BinaryOperator.ADD && isVariable(b.rightOperand(), x)) {
				return offset.add(evaluate(R, scope, b.leftOperand()));
			} else if (b.operator() == BinaryOperator.SUB && isVariable(b.leftOperand(), x)) {
				return offset.subtract(evaluate(R, scope, b.rightOperand()));
			}
		}
		return null;
	}

	private static boolean isVariable(Term t, String x) {
		return t instanceof Term.Variable && ((Term.Variable) t).name().equals(x);
	}

	// ================================================================================
	// Operators
	// ================================================================================

	private static Range logical(BinaryOperator op, Range lhs, Range rhs) {
		if (lhs.isEmpty()) {
			return lhs;
		}
		// Value when the left-hand side decides
		Range decided = op == BinaryOperator.AND ? Range.FALSE : Range.TRUE;
		Bound deciding = op == BinaryOperator.AND ? Bound.ZERO : Bound.ONE;
		Range r = Range.empty(ScalarKind.BOOLEAN);
		if (lhs.contains(deciding)) {
			r = r.union(decided);
		}
		if (lhs.contains(Bound.ONE.subtract(deciding))) {
			r = r.union(rhs);
		}
		return r;
	}

	private static Range bitwise(BinaryOperator op, Range lhs, Range rhs) {
		switch (op) {
		case SHL:
			return lhs.shiftLeft(rhs);
		case SHR:
			return lhs.shiftRight(rhs);
		case BITAND:
			return lhs.bitwiseAnd(rhs);
		case BITOR:
			return lhs.bitwiseOr(rhs);
		default:
			return lhs.bitwiseXor(rhs);
		}
	}

	private static Range arithmetic(BinaryOperator op, Range lhs, Range rhs) {
		switch (op) {
		case ADD:
			return lhs.add(rhs);
		case SUB:
			return lhs.subtract(rhs);
		case MUL:
			return lhs.multiply(rhs);
		case DIV:
			return lhs.divide(rhs);
		case REM:
			return lhs.remainder(rhs);
		default:
			throw new IllegalArgumentException("invalid arithmetic operator: " + op);
		}
	}

	private static boolean isNatural(Range r) {
		return r.kind() == ScalarKind.NATURAL || (r.isEmpty() && r.kind().isIntegral());
	}

	/**
	 * Drop the negative part of an integral range.
	 */
	private static Range natural(Range r) {
		return r.isEmpty() ? Range.empty(ScalarKind.NATURAL) : r.intersect(Range.top(ScalarKind.NATURAL));
	}

	/**
	 * Check that a value can be stored somewhere of a given kind, and convert it
	 * into that kind. Integral values can be stored as reals, but not vice-versa;
	 * values stored as naturals must be non-negative.
	 *
	 * @param kind
	 * @param value
	 * @param e
	 * @return
	 */
	public Range coerce(ScalarKind kind, Range value, SyntacticElement e) {
		ScalarKind vk = value.kind();
		switch (kind) {
		case BOOLEAN:
			check(vk == ScalarKind.BOOLEAN, ErrorKind.TypeMismatch, INCOMPATIBLE_TYPE, e);
			return value;
		case NATURAL:
			check(vk.isIntegral(), ErrorKind.TypeMismatch, INCOMPATIBLE_TYPE, e);
			checkRange(value.isEmpty() || value.min().signum() >= 0, ErrorKind.TypeMismatch, INCOMPATIBLE_TYPE, e);
			return natural(value);
		case INTEGER:
			check(vk.isIntegral(), ErrorKind.TypeMismatch, INCOMPATIBLE_TYPE, e);
			return value;
		default:
			check(vk.isNumeric(), ErrorKind.TypeMismatch, INCOMPATIBLE_TYPE, e);
			return value.isEmpty() ? Range.empty(ScalarKind.REAL)
					: Range.of(ScalarKind.REAL, value.min(), value.max());
		}
	}

	// ================================================================================
	// Helpers
	// ================================================================================

	/**
	 * Determine the range of an expression without recording anything about it.
	 *
	 * @param R
	 * @param scope
	 * @param t
	 * @return
	 */
	public Range evaluate(Environment R, int scope, Term t) {
		muted++;
		try {
			return expectRange(apply(R, scope, t).second(), t);
		} finally {
			muted--;
		}
	}

	/**
	 * Check that a term produced a scalar value.
	 *
	 * @param T
	 * @param t
	 * @return
	 */
	public Range expectRange(Type T, Term t) {
		check(T instanceof Range, ErrorKind.TypeMismatch, T instanceof Type.Array ? ARRAY_AS_VALUE : EXPECTED_VALUE,
				t);
		return (Range) T;
	}

	/**
	 * Check whether facts established in a given environment should be recorded.
	 *
	 * @param R
	 * @return
	 */
	public boolean isRecording(Environment R) {
		return muted == 0 && R.isReachable();
	}

	public void mute() {
		muted++;
	}

	public void unmute() {
		muted--;
	}

	public void enterRegion(Region region) {
		regions.add(region);
	}

	public void exitRegion() {
		regions.remove(regions.size() - 1);
	}

	/**
	 * Get the loops and branches currently enclosing the analysis, outermost
	 * first.
	 *
	 * @return
	 */
	public List<Region> regions() {
		return regions;
	}

	public void enterLoop(String iterator, Term loop) {
		loops.add(new Pair<>(iterator, loop));
	}

	public void exitLoop() {
		loops.remove(loops.size() - 1);
	}

	/**
	 * Find the active loop driven by a given iterator.
	 *
	 * @param iterator
	 * @return null if no such loop is active.
	 */
	public Term activeLoop(String iterator) {
		for (Pair<String, Term> p : loops) {
			if (p.first().equals(iterator)) {
				return p.second();
			}
		}
		return null;
	}

	public CollapsedLoop collector() {
		return collector;
	}

	public void setCollector(CollapsedLoop collector) {
		this.collector = collector;
	}

	/**
	 * Get how many times the term being analysed is repeated by the expansion of
	 * enclosing loops.
	 *
	 * @return
	 */
	public long expansion() {
		return expansion;
	}

	public void setExpansion(long expansion) {
		this.expansion = expansion;
	}

	/**
	 * Remove every variable declared within a given scope (or any scope it
	 * encloses).
	 *
	 * @param R
	 * @param scope
	 * @return
	 */
	public Environment drop(Environment R, int scope) {
		ArrayList<String> dead = new ArrayList<>();
		for (String x : R.bindings()) {
			if (scopes.encloses(scope, R.get(x).scope())) {
				dead.add(x);
			}
		}
		return dead.isEmpty() ? R : R.remove(dead.toArray(new String[dead.size()]));
	}

	/**
	 * Join two environments at a point where control-flow meets. An unreachable
	 * environment contributes nothing.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public Environment join(Environment lhs, Environment rhs) {
		if (!lhs.isReachable()) {
			return rhs;
		} else if (!rhs.isReachable()) {
			return lhs;
		} else if (!lhs.bindings().equals(rhs.bindings())) {
			// When joining environments, should always have same number of keys.
			throw new IllegalStateException("invalid environment keys");
		}
		Environment R = lhs;
		for (String x : lhs.bindings()) {
			Slot Sl = lhs.get(x);
			Slot Sr = rhs.get(x);
			if (Sl.equals(Sr)) {
				continue;
			}
			Range offset = Sl.offset() == null || Sr.offset() == null ? null : Sl.offset().union(Sr.offset());
			R = R.put(x, Sl.with(Sl.type().union(Sr.type()), offset));
		}
		return R;
	}

	/**
	 * Provides a specific extension mechanism for the range checker.
	 *
	 * @author David J. Pearce
	 *
	 */
	public abstract static class Extension implements AbstractTransformer.Extension<RangeChecker.Environment, Type> {
		protected RangeChecker self;
	}

	/**
	 * Environment maintains the mapping from variables to the slots which
	 * characterise their current type. Environments are never modified in place.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Environment {
		/**
		 * Mapping from variable names to types
		 */
		private final HashMap<String, Slot> mapping;
		/**
		 * Set when no execution can reach the point this environment describes.
		 */
		private final boolean unreachable;

		private Environment() {
			this.mapping = new HashMap<>();
			this.unreachable = false;
		}

		public Environment(Map<String, Slot> mapping) {
			this(mapping, false);
		}

		private Environment(Map<String, Slot> mapping, boolean unreachable) {
			this.mapping = new HashMap<>(mapping);
			this.unreachable = unreachable;
		}

		/**
		 * Get the slot associated with a given variable
		 *
		 * @param name
		 * @return
		 */
		public Slot get(String name) {
			return mapping.get(name);
		}

		/**
		 * Update the slot associated with a given variable name
		 *
		 * @param name
		 * @param slot
		 * @return
		 */
		public Environment put(String name, Slot slot) {
			Environment nenv = new Environment(mapping, unreachable);
			nenv.mapping.put(name, slot);
			return nenv;
		}

		/**
		 * Update the type of an existing variable.
		 *
		 * @param name
		 * @param type
		 * @return
		 */
		public Environment put(String name, Type type) {
			return put(name, get(name).with(type));
		}

		/**
		 * Remove a given variable mapping.
		 *
		 * @param names
		 * @return
		 */
		public Environment remove(String... names) {
			Environment nenv = new Environment(mapping, unreachable);
			for (int i = 0; i != names.length; ++i) {
				nenv.mapping.remove(names[i]);
			}
			return nenv;
		}

		/**
		 * Mark this environment as one which cannot be reached.
		 *
		 * @return
		 */
		public Environment unreachable() {
			return unreachable ? this : new Environment(mapping, true);
		}

		public boolean isReachable() {
			return !unreachable;
		}

		/**
		 * Get collection of all slots in the environment.
		 *
		 * @return
		 */
		public Collection<Slot> slots() {
			return mapping.values();
		}

		/**
		 * Get set of all bound variables in the environment
		 *
		 * @return
		 */
		public Set<String> bindings() {
			return mapping.keySet();
		}

		public FactTable.Snapshot snapshot() {
			TreeMap<String, Type> types = new TreeMap<>();
			for (Map.Entry<String, Slot> e : mapping.entrySet()) {
				types.put(e.getKey(), e.getValue().type());
			}
			return new FactTable.Snapshot(types);
		}

		@Override
		public String toString() {
			String body = unreachable ? "!{" : "{";
			boolean firstTime = true;
			for (Map.Entry<String, Slot> e : new TreeMap<>(mapping).entrySet()) {
				if (!firstTime) {
					body = body + ",";
				}
				firstTime = false;
				body = body + e.getKey() + ":" + e.getValue();
			}
			return body + "}";
		}
	}

	/**
	 * Represents the information associated about a given variable in the
	 * environment. This includes its <i>type</i>, the <i>scope</i> it was declared
	 * in and the declaring term. When a loop is being analysed, the slot of a
	 * variable assigned in the loop also carries its <i>offset</i> from its value
	 * at the start of the current iteration.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Slot {
		private final Type type;
		private final int scope;
		private final SyntacticElement declaration;
		private final Range offset;

		public Slot(Type type, int scope, SyntacticElement declaration, Range offset) {
			this.type = type;
			this.scope = scope;
			this.declaration = declaration;
			this.offset = offset;
		}

		public Type type() {
			return type;
		}

		public int scope() {
			return scope;
		}

		/**
		 * The element which declared this variable (e.g. a let statement or a
		 * function declaration for parameters).
		 *
		 * @return
		 */
		public SyntacticElement declaration() {
			return declaration;
		}

		/**
		 * Get the offset of this variable from the start of the current iteration.
		 *
		 * @return null if unknown or not tracked.
		 */
		public Range offset() {
			return offset;
		}

		public Slot with(Type type) {
			return new Slot(type, scope, declaration, offset);
		}

		public Slot with(Type type, Range offset) {
			return new Slot(type, scope, declaration, offset);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Slot) {
				Slot c = (Slot) o;
				return type.equals(c.type) && scope == c.scope && declaration == c.declaration
						&& (offset == null ? c.offset == null : offset.equals(c.offset));
			}
			return false;
		}

		@Override
		public int hashCode() {
			return type.hashCode() ^ scope;
		}

		@Override
		public String toString() {
			return offset == null ? type.toString() : type + "+" + offset;
		}
	}

	public void check(boolean result, ErrorKind kind, String msg, SyntacticElement e) {
		if (!result) {
			analysisError(kind, msg, e, null);
		}
	}

	public void check(boolean result, ErrorKind kind, String msg, SyntacticElement e, SyntacticElement conflict) {
		if (!result) {
			analysisError(kind, msg, e, conflict);
		}
	}

	/**
	 * Check a condition on the values a term may take, rather than on its kind.
	 * Whilst muted the environment can be wider than any state the program
	 * reaches (e.g. the first pass over a loop body), so failures are only
	 * reported once the same term is analysed unmuted.
	 *
	 * @param result
	 * @param kind
	 * @param msg
	 * @param e
	 * @return whether the condition held.
	 */
	public boolean checkRange(boolean result, ErrorKind kind, String msg, SyntacticElement e) {
		if (!result && muted == 0) {
			analysisError(kind, msg, e, null);
		}
		return result;
	}

	protected void analysisError(ErrorKind kind, String msg, SyntacticElement e, SyntacticElement conflict) {
		LOGGER.debug("{}: {} at {}", kind, msg, e);
		AnalysisError.analysisError(kind, msg, e, conflict);
	}
}
