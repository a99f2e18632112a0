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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import rangecheck.core.AnnotatedProgram;
import rangecheck.core.Bound;
import rangecheck.core.FactTable.Snapshot;
import rangecheck.core.Range;
import rangecheck.core.ScalarKind;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Type;
import rangecheck.extensions.Functions.Syntax.FunctionDeclaration;
import rangecheck.extensions.Functions.Syntax.Unit;
import rangecheck.io.Parser;
import rangecheck.util.Pair;

/**
 * Executes programs on every combination of their parameters, and checks that
 * every value observed at a statement lies within the range inferred for it.
 *
 * @author David J. Pearce
 *
 */
public class SoundnessTests {

	@ParameterizedTest
	@ValueSource(strings = {
			"fn f(x: int[-3,3], y: int[0,4]) { let z = x * y; if z > 2 { z = z - x } else { z = z + y } z }",
			"fn f(n: nat[0,6]) { let s = 0; for i in 0..n { s = s + i } s }",
			"fn f(n: nat[0,5], k: nat[1,3]) { let s = 0; let i = 0; while i < n { s = s + k; i = i + k } s }",
			"fn f(x: int[-5,5]) { let r = 0; if x < 0 && x > -3 { r = x }"
					+ " else { if x == 4 || x == -5 { r = 10 } else { r = x % 3 } } r }",
			"fn f(a: int[0,4], b: int[1,3]) { let q = a / b; let m = a % b; q + m }",
			"fn f(n: nat[1,4]) { let s = 0; for i in 0..n { for j in i..n { s = s + 1 } } s }",
			"fn f(x: int[0,7], y: int[0,7]) { let b = x < y; let c = !b || x == 3; if c { x & y } else { x | y } }",
			"fn f(n: nat[0,8]) { let s = 0; for i in 0..=n step 2 { s += i } s }",
			"fn f(x: int[0,4]) { let y = x << 2; y >> 1 }",
			"fn f(b: bool, x: int[0,3]) { let r = 1; if b { r = x * 2 } r }",
			"fn f(x: int[-4,4]) { let y = -x; if y >= 2 { y = y - 2 } else { if y != -4 { y = y + 1 } } y }",
			"fn f(n: nat[0,5]) { let v = vec nat {}; for i in 0..5 { v.push(i * 2) }"
					+ " let s = 0; for j in 0..n { s = s + v[j] } s }" })
	public void test_soundness(String input) {
		Unit unit = Parser.parse("test", input);
		AnnotatedProgram program = CoreTests.check(unit);
		Range returns = CoreTests.returnOf(program);
		FunctionDeclaration f = unit.getFunctions()[0];
		Interpreter interpreter = new Interpreter(unit);
		List<Object[]> inputs = enumerate(f.getParameters(), 0, new Object[f.getParameters().length]);
		assertFalse(inputs.isEmpty());
		for (Object[] args : inputs) {
			Object r = interpreter.invoke("f", args);
			assertTrue(returns + " does not contain " + r, returns.contains(bound(r)));
		}
		for (Map.Entry<Term, List<Map<String, Object>>> e : interpreter.observations().entrySet()) {
			Snapshot s = program.snapshot(e.getKey());
			assertNotNull("no snapshot for " + e.getKey(), s);
			for (Map<String, Object> env : e.getValue()) {
				for (Map.Entry<String, Object> b : env.entrySet()) {
					Type T = s.get(b.getKey());
					assertTrue(b.getKey() + " not a value at " + e.getKey(), T instanceof Range);
					assertTrue(b.getKey() + "=" + b.getValue() + " outside " + T + " at " + e.getKey(),
							((Range) T).contains(bound(b.getValue())));
				}
			}
		}
	}

	/**
	 * Construct every combination of values for a set of parameters.
	 */
	private static List<Object[]> enumerate(Pair<String, Range>[] params, int i, Object[] args) {
		ArrayList<Object[]> r = new ArrayList<>();
		if (i == params.length) {
			r.add(args.clone());
		} else {
			Range p = params[i].second();
			if (p.kind() == ScalarKind.BOOLEAN) {
				for (boolean b : new boolean[] { false, true }) {
					args[i] = b;
					r.addAll(enumerate(params, i + 1, args));
				}
			} else {
				BigInteger max = p.max().toBigInteger();
				for (BigInteger v = p.min().toBigInteger(); v.compareTo(max) <= 0; v = v.add(BigInteger.ONE)) {
					args[i] = v;
					r.addAll(enumerate(params, i + 1, args));
				}
			}
		}
		return r;
	}

	private static Bound bound(Object v) {
		if (v instanceof Boolean) {
			return (Boolean) v ? Bound.ONE : Bound.ZERO;
		} else if (v instanceof BigDecimal) {
			return Bound.of((BigDecimal) v);
		} else {
			return Bound.of((BigInteger) v);
		}
	}
}
