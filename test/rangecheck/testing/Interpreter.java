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

package rangecheck.testing;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import rangecheck.core.Range;
import rangecheck.core.Syntax.BinaryOperator;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Value;
import rangecheck.extensions.Arrays;
import rangecheck.extensions.ControlFlow;
import rangecheck.extensions.Functions;
import rangecheck.util.Pair;

/**
 * Executes programs on concrete values, remembering the variables in scope on
 * entry to every statement of a block. The values observed can then be compared
 * against the ranges inferred for the same statements. Integers are represented
 * as <code>BigInteger</code>, reals as <code>BigDecimal</code>, booleans as
 * <code>Boolean</code> and arrays as lists of these.
 *
 * @author David J. Pearce
 *
 */
public class Interpreter {
	private final Map<String, Functions.Syntax.FunctionDeclaration> functions = new HashMap<>();
	private final IdentityHashMap<Term, List<Map<String, Object>>> observations = new IdentityHashMap<>();

	public Interpreter(Functions.Syntax.Unit unit) {
		for (Functions.Syntax.FunctionDeclaration f : unit.getFunctions()) {
			functions.put(f.getName(), f);
		}
	}

	/**
	 * Get every environment observed on entry to each statement executed so far.
	 *
	 * @return
	 */
	public Map<Term, List<Map<String, Object>>> observations() {
		return Collections.unmodifiableMap(observations);
	}

	public Object invoke(String name, Object... arguments) {
		Functions.Syntax.FunctionDeclaration f = functions.get(name);
		if (f == null) {
			throw new IllegalArgumentException("unknown function " + name);
		}
		Pair<String, Range>[] params = f.getParameters();
		if (params.length != arguments.length) {
			throw new IllegalArgumentException("incorrect number of arguments");
		}
		Frame frame = new Frame();
		for (int i = 0; i != params.length; ++i) {
			frame.declare(params[i].first(), arguments[i]);
		}
		return execute(f.getBody(), frame);
	}

	private Object execute(Term term, Frame frame) {
		if (term instanceof Term.Block) {
			return execute((Term.Block) term, frame);
		} else if (term instanceof Term.Let) {
			Term.Let t = (Term.Let) term;
			frame.declare(t.variable(), execute(t.initialiser(), frame));
			return null;
		} else if (term instanceof Term.Assignment) {
			Term.Assignment t = (Term.Assignment) term;
			frame.assign(t.variable(), execute(t.rightOperand(), frame));
			return null;
		} else if (term instanceof Term.Variable) {
			return frame.lookup(((Term.Variable) term).name());
		} else if (term instanceof Term.Binary) {
			return execute((Term.Binary) term, frame);
		} else if (term instanceof Term.Unary) {
			Term.Unary t = (Term.Unary) term;
			Object v = execute(t.operand(), frame);
			switch (t.operator()) {
			case NEG:
				return v instanceof BigDecimal ? ((BigDecimal) v).negate() : ((BigInteger) v).negate();
			default:
				return !((Boolean) v);
			}
		} else if (term instanceof Value.Integer) {
			return ((Value.Integer) term).value();
		} else if (term instanceof Value.Real) {
			return ((Value.Real) term).value();
		} else if (term instanceof Value.Bool) {
			return ((Value.Bool) term).value();
		} else if (term instanceof ControlFlow.Syntax.IfElse) {
			ControlFlow.Syntax.IfElse t = (ControlFlow.Syntax.IfElse) term;
			if ((Boolean) execute(t.condition(), frame)) {
				return execute(t.trueBlock(), frame);
			} else if (t.falseBlock() != null) {
				return execute(t.falseBlock(), frame);
			}
			return null;
		} else if (term instanceof ControlFlow.Syntax.While) {
			ControlFlow.Syntax.While t = (ControlFlow.Syntax.While) term;
			while ((Boolean) execute(t.condition(), frame)) {
				execute(t.body(), frame);
			}
			return null;
		} else if (term instanceof ControlFlow.Syntax.For) {
			return execute((ControlFlow.Syntax.For) term, frame);
		} else if (term instanceof ControlFlow.Syntax.CompoundAssignment) {
			ControlFlow.Syntax.CompoundAssignment t = (ControlFlow.Syntax.CompoundAssignment) term;
			Object rhs = execute(t.rightOperand(), frame);
			frame.assign(t.variable(), apply(t.operator(), frame.lookup(t.variable()), rhs));
			return null;
		} else if (term instanceof Arrays.Syntax.ArrayDeclaration) {
			Arrays.Syntax.ArrayDeclaration t = (Arrays.Syntax.ArrayDeclaration) term;
			ArrayList<Object> elements = new ArrayList<>();
			for (Term e : t.initialisers()) {
				elements.add(execute(e, frame));
			}
			if (t.size() != null) {
				int n = ((BigInteger) execute(t.size(), frame)).intValueExact();
				while (elements.size() < n) {
					elements.add(null);
				}
			}
			frame.declare(t.name(), elements);
			return null;
		} else if (term instanceof Arrays.Syntax.Append) {
			Arrays.Syntax.Append t = (Arrays.Syntax.Append) term;
			array(frame, t.array()).add(execute(t.value(), frame));
			return null;
		} else if (term instanceof Arrays.Syntax.IndexAccess) {
			Arrays.Syntax.IndexAccess t = (Arrays.Syntax.IndexAccess) term;
			BigInteger i = (BigInteger) execute(t.index(), frame);
			return array(frame, t.array()).get(i.intValueExact());
		} else if (term instanceof Arrays.Syntax.IndexAssignment) {
			Arrays.Syntax.IndexAssignment t = (Arrays.Syntax.IndexAssignment) term;
			BigInteger i = (BigInteger) execute(t.index(), frame);
			Object v = execute(t.value(), frame);
			array(frame, t.array()).set(i.intValueExact(), v);
			return null;
		} else if (term instanceof Functions.Syntax.Invoke) {
			Functions.Syntax.Invoke t = (Functions.Syntax.Invoke) term;
			Object[] arguments = new Object[t.getOperands().length];
			for (int i = 0; i != arguments.length; ++i) {
				arguments[i] = execute(t.getOperands()[i], frame);
			}
			return invoke(t.getName(), arguments);
		}
		throw new IllegalArgumentException("unknown term encountered: " + term);
	}

	private Object execute(Term.Block block, Frame frame) {
		Object result = null;
		frame.enter();
		for (int i = 0; i != block.size(); ++i) {
			Term stmt = block.get(i);
			observations.computeIfAbsent(stmt, k -> new ArrayList<>()).add(frame.snapshot());
			result = execute(stmt, frame);
		}
		frame.exit();
		return result;
	}

	private Object execute(ControlFlow.Syntax.For t, Frame frame) {
		String x = t.variable();
		frame.enter();
		frame.declare(x, execute(t.start(), frame));
		while (true) {
			Object limit = execute(t.limit(), frame);
			int c = compare(frame.lookup(x), limit);
			if (t.inclusive() ? c > 0 : c >= 0) {
				break;
			}
			execute(t.body(), frame);
			Object step = t.step() == null ? BigInteger.ONE : execute(t.step(), frame);
			frame.assign(x, apply(BinaryOperator.ADD, frame.lookup(x), step));
		}
		frame.exit();
		return null;
	}

	private Object execute(Term.Binary t, Frame frame) {
		Object lhs = execute(t.leftOperand(), frame);
		switch (t.operator()) {
		case AND:
			return (Boolean) lhs && (Boolean) execute(t.rightOperand(), frame);
		case OR:
			return (Boolean) lhs || (Boolean) execute(t.rightOperand(), frame);
		default:
			return apply(t.operator(), lhs, execute(t.rightOperand(), frame));
		}
	}

	private static Object apply(BinaryOperator op, Object lhs, Object rhs) {
		switch (op) {
		case EQ:
			return lhs instanceof Boolean ? lhs.equals(rhs) : compare(lhs, rhs) == 0;
		case NEQ:
			return lhs instanceof Boolean ? !lhs.equals(rhs) : compare(lhs, rhs) != 0;
		case LT:
			return compare(lhs, rhs) < 0;
		case LTEQ:
			return compare(lhs, rhs) <= 0;
		case GT:
			return compare(lhs, rhs) > 0;
		case GTEQ:
			return compare(lhs, rhs) >= 0;
		default:
			break;
		}
		if (lhs instanceof BigDecimal || rhs instanceof BigDecimal) {
			BigDecimal l = real(lhs);
			BigDecimal r = real(rhs);
			switch (op) {
			case ADD:
				return l.add(r);
			case SUB:
				return l.subtract(r);
			case MUL:
				return l.multiply(r);
			case DIV:
				return l.divide(r, MathContext.DECIMAL64);
			case REM:
				return l.remainder(r);
			default:
				throw new IllegalArgumentException("invalid operator for reals: " + op);
			}
		}
		BigInteger l = (BigInteger) lhs;
		BigInteger r = (BigInteger) rhs;
		switch (op) {
		case ADD:
			return l.add(r);
		case SUB:
			return l.subtract(r);
		case MUL:
			return l.multiply(r);
		case DIV:
			return l.divide(r);
		case REM:
			return l.remainder(r);
		case SHL:
			return l.shiftLeft(r.intValueExact());
		case SHR:
			return l.shiftRight(r.intValueExact());
		case BITAND:
			return l.and(r);
		case BITOR:
			return l.or(r);
		case XOR:
			return l.xor(r);
		default:
			throw new IllegalArgumentException("invalid operator: " + op);
		}
	}

	private static int compare(Object lhs, Object rhs) {
		return real(lhs).compareTo(real(rhs));
	}

	private static BigDecimal real(Object v) {
		return v instanceof BigDecimal ? (BigDecimal) v : new BigDecimal((BigInteger) v);
	}

	@SuppressWarnings("unchecked")
	private static List<Object> array(Frame frame, String name) {
		return (List<Object>) frame.lookup(name);
	}

	/**
	 * The variables of one invocation, organised into nested scopes.
	 */
	private static class Frame {
		private final ArrayList<Map<String, Object>> scopes = new ArrayList<>();

		public Frame() {
			enter();
		}

		public void enter() {
			scopes.add(new HashMap<>());
		}

		public void exit() {
			scopes.remove(scopes.size() - 1);
		}

		public void declare(String x, Object v) {
			scopes.get(scopes.size() - 1).put(x, v);
		}

		public void assign(String x, Object v) {
			for (int i = scopes.size() - 1; i >= 0; --i) {
				Map<String, Object> scope = scopes.get(i);
				if (scope.containsKey(x)) {
					scope.put(x, v);
					return;
				}
			}
			throw new IllegalArgumentException("undeclared variable " + x);
		}

		public Object lookup(String x) {
			for (int i = scopes.size() - 1; i >= 0; --i) {
				Map<String, Object> scope = scopes.get(i);
				if (scope.containsKey(x)) {
					return scope.get(x);
				}
			}
			throw new IllegalArgumentException("undeclared variable " + x);
		}

		/**
		 * Flatten the visible scalar variables into a single map.
		 *
		 * @return
		 */
		public Map<String, Object> snapshot() {
			LinkedHashMap<String, Object> r = new LinkedHashMap<>();
			for (Map<String, Object> scope : scopes) {
				for (Map.Entry<String, Object> e : scope.entrySet()) {
					if (!(e.getValue() instanceof List)) {
						r.put(e.getKey(), e.getValue());
					}
				}
			}
			return r;
		}
	}
}
