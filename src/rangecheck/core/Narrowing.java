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

import rangecheck.core.FactTable.Verdict;
import rangecheck.core.RangeChecker.Environment;
import rangecheck.core.RangeChecker.Slot;
import rangecheck.core.Syntax.BinaryOperator;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.UnaryOperator;
import rangecheck.util.Pair;

/**
 * Refines an environment under the assumption that a condition holds, and
 * under the assumption that it does not. The result is a pair of environments
 * <code>(T, F)</code>. Either may be marked unreachable, which happens when a
 * variable is narrowed to an empty range or the condition is decided.
 *
 * @author David J. Pearce
 *
 */
public final class Narrowing {

	private Narrowing() {

	}

	/**
	 * Narrow an environment by a given (boolean) condition.
	 *
	 * @param self
	 *            Checker used to evaluate operands.
	 * @param R
	 *            Environment holding before the condition.
	 * @param scope
	 * @param condition
	 * @return
	 */
	public static Pair<Environment, Environment> narrow(RangeChecker self, Environment R, int scope, Term condition) {
		if (!R.isReachable()) {
			return new Pair<>(R, R);
		} else if (condition instanceof Term.Binary) {
			Term.Binary b = (Term.Binary) condition;
			BinaryOperator op = b.operator();
			if (op == BinaryOperator.AND) {
				Pair<Environment, Environment> lhs = narrow(self, R, scope, b.leftOperand());
				Pair<Environment, Environment> rhs = narrow(self, lhs.first(), scope, b.rightOperand());
				return new Pair<>(rhs.first(), self.join(lhs.second(), rhs.second()));
			} else if (op == BinaryOperator.OR) {
				Pair<Environment, Environment> lhs = narrow(self, R, scope, b.leftOperand());
				Pair<Environment, Environment> rhs = narrow(self, lhs.second(), scope, b.rightOperand());
				return new Pair<>(self.join(lhs.first(), rhs.first()), rhs.second());
			} else if (op.isComparison()) {
				return compare(self, R, scope, b);
			}
		} else if (condition instanceof Term.Unary) {
			Term.Unary u = (Term.Unary) condition;
			if (u.operator() == UnaryOperator.NOT) {
				Pair<Environment, Environment> p = narrow(self, R, scope, u.operand());
				return new Pair<>(p.second(), p.first());
			}
		} else if (condition instanceof Term.Variable) {
			String x = ((Term.Variable) condition).name();
			Range r = self.evaluate(R, scope, condition);
			if (r.kind() == ScalarKind.BOOLEAN) {
				return new Pair<>(restrict(R, x, Range.TRUE), restrict(R, x, Range.FALSE));
			}
		}
		return decide(R, self.evaluate(R, scope, condition));
	}

	/**
	 * Determine the verdict of a condition from its narrowed environments.
	 *
	 * @param p
	 * @return
	 */
	public static Verdict verdict(Pair<Environment, Environment> p) {
		if (p.first().isReachable() && p.second().isReachable()) {
			return Verdict.RUNTIME;
		} else if (p.first().isReachable()) {
			return Verdict.ALWAYS_TRUE;
		} else {
			return Verdict.ALWAYS_FALSE;
		}
	}

	private static Pair<Environment, Environment> compare(RangeChecker self, Environment R, int scope, Term.Binary b) {
		BinaryOperator op = b.operator();
		Range lhs = self.evaluate(R, scope, b.leftOperand());
		Range rhs = self.evaluate(R, scope, b.rightOperand());
		Pair<Environment, Environment> p = decide(R, lhs.compare(op, rhs));
		Environment T = p.first();
		Environment F = p.second();
		if (b.leftOperand() instanceof Term.Variable && lhs.kind().isNumeric()) {
			String x = ((Term.Variable) b.leftOperand()).name();
			Pair<Range, Range> n = lhs.narrow(op, rhs);
			T = restrict(T, x, n.first());
			F = restrict(F, x, n.second());
		}
		if (b.rightOperand() instanceof Term.Variable && rhs.kind().isNumeric()) {
			String y = ((Term.Variable) b.rightOperand()).name();
			Pair<Range, Range> n = rhs.narrow(op.flip(), lhs);
			T = restrict(T, y, n.first());
			F = restrict(F, y, n.second());
		}
		return new Pair<>(T, F);
	}

	/**
	 * Intersect the range of a variable with a given range, marking the
	 * environment unreachable if nothing remains.
	 */
	private static Environment restrict(Environment R, String x, Range r) {
		if (!R.isReachable()) {
			return R;
		}
		Slot S = R.get(x);
		Range current = (Range) S.type();
		Range narrowed = current.intersect(r);
		if (narrowed.isEmpty()) {
			return R.unreachable();
		} else if (narrowed.equals(current)) {
			return R;
		} else {
			return R.put(x, S.with(narrowed));
		}
	}

	private static Pair<Environment, Environment> decide(Environment R, Range condition) {
		if (condition.isEmpty()) {
			return new Pair<>(R.unreachable(), R.unreachable());
		} else if (condition.equals(Range.TRUE)) {
			return new Pair<>(R, R.unreachable());
		} else if (condition.equals(Range.FALSE)) {
			return new Pair<>(R.unreachable(), R);
		} else {
			return new Pair<>(R, R);
		}
	}
}
