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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import rangecheck.core.AnalysisResult;
import rangecheck.core.Analyser;
import rangecheck.core.ErrorKind;
import rangecheck.core.Options;
import rangecheck.core.Range;
import rangecheck.extensions.Functions.Syntax.Unit;
import rangecheck.io.Parser;

/**
 * Tests for analysing several units together, where some depend on others.
 *
 * @author David J. Pearce
 *
 */
public class AnalyserTests {
	private static final String LIB = "fn g(x: nat[0,10]) -> nat[0,100] { x * 2 }";

	@Test
	public void test_0x001() throws Exception {
		// Dependencies are analysed first regardless of the order given
		List<AnalysisResult> rs = analyse(new Options(), Parser.parse("main", "use lib; fn f() { g(5) }"),
				Parser.parse("lib", LIB));
		assertEquals("main", rs.get(0).unit());
		assertEquals("lib", rs.get(1).unit());
		assertTrue(rs.get(0).isSuccess());
		assertTrue(rs.get(1).isSuccess());
		// Invocations across units use the inferred return
		assertEquals(Range.of(0, 20), CoreTests.returnOf(rs.get(0).program()));
	}

	@Test
	public void test_0x002() throws Exception {
		// Functions of a unit not depended upon are not visible
		List<AnalysisResult> rs = analyse(new Options(), Parser.parse("main", "fn f() { g(5) }"),
				Parser.parse("lib", LIB));
		assertEquals(ErrorKind.UnresolvedIdentifier, rs.get(0).diagnostic().kind());
		assertTrue(rs.get(1).isSuccess());
	}

	@Test
	public void test_0x003() throws Exception {
		List<AnalysisResult> rs = analyse(new Options(), Parser.parse("main", "use missing; fn f() { 1 }"));
		assertFalse(rs.get(0).isSuccess());
		assertEquals(ErrorKind.UnresolvedIdentifier, rs.get(0).diagnostic().kind());
		assertEquals(Analyser.UNKNOWN_UNIT, rs.get(0).diagnostic().message());
		assertEquals("main", rs.get(0).diagnostic().unit());
	}

	@Test
	public void test_0x004() throws Exception {
		// Failures propagate to dependents
		List<AnalysisResult> rs = analyse(new Options(), Parser.parse("main", "use lib; fn f() { g(5) }"),
				Parser.parse("lib", "fn g(x: nat[0,10]) -> nat[0,5] { x }"));
		assertEquals(Analyser.UNKNOWN_UNIT, rs.get(0).diagnostic().message());
		assertEquals(ErrorKind.TypeMismatch, rs.get(1).diagnostic().kind());
		assertEquals("lib", rs.get(1).diagnostic().unit());
	}

	@Test
	public void test_0x005() throws Exception {
		List<AnalysisResult> rs = analyse(new Options(), Parser.parse("a", "use b; fn f() { 1 }"),
				Parser.parse("b", "use a; fn g() { 2 }"), Parser.parse("c", "fn h() { 3 }"));
		assertEquals(Analyser.CYCLIC_DEPENDENCY, rs.get(0).diagnostic().message());
		assertEquals(Analyser.CYCLIC_DEPENDENCY, rs.get(1).diagnostic().message());
		assertTrue(rs.get(2).isSuccess());
	}

	@Test
	public void test_0x006() throws Exception {
		Unit a = Parser.parse("a", "fn f() { 1 }");
		Unit b = Parser.parse("a", "fn g() { 2 }");
		assertThrows(IllegalArgumentException.class, () -> new Analyser(new Options()).analyse(Arrays.asList(a, b)));
	}

	@Test
	public void test_0x007() throws Exception {
		// Analysing the same unit twice gives the same facts
		Unit u = Parser.parse("test", "fn f(n: nat[0,6]) { let v = vec nat {}; for i in 0..6 { v.push(i) }"
				+ " let s = 0; for j in 0..n { s = s + v[j] } s }");
		String first = analyse(new Options(), u).get(0).program().toString();
		String second = analyse(new Options(), u).get(0).program().toString();
		assertEquals(first, second);
	}

	@Test
	public void test_0x008() throws Exception {
		List<Unit> units = workload(16);
		List<AnalysisResult> sequential = new Analyser(new Options().setThreads(1)).analyse(units);
		List<AnalysisResult> parallel = new Analyser(new Options().setThreads(4)).analyse(units);
		assertEquals(units.size(), parallel.size());
		for (int i = 0; i != units.size(); ++i) {
			AnalysisResult s = sequential.get(i);
			AnalysisResult p = parallel.get(i);
			assertEquals("u" + i, p.unit());
			assertEquals(s.isSuccess(), p.isSuccess());
			if (s.isSuccess()) {
				assertEquals(s.program().toString(), p.program().toString());
			} else {
				assertEquals(s.diagnostic(), p.diagnostic());
			}
		}
		assertFalse(parallel.get(4).isSuccess());
		assertEquals(Analyser.UNKNOWN_UNIT, parallel.get(5).diagnostic().message());
		assertTrue(parallel.get(7).isSuccess());
	}

	/**
	 * Construct a number of units, where every odd unit depends on the one before
	 * it and every fifth unit fails.
	 *
	 * @param n
	 * @return
	 */
	private static List<Unit> workload(int n) {
		ArrayList<Unit> units = new ArrayList<>();
		for (int i = 0; i != n; ++i) {
			boolean odd = (i % 2) == 1;
			String src = odd ? "use u" + (i - 1) + ";\n" : "";
			src += "fn g" + i + "(n: nat[0," + i + "]) " + (i % 5 == 4 ? "-> nat[0,1] " : "");
			src += "{ let s = 0; for j in 0..n { s = s + j } " + (odd ? "s + g" + (i - 1) + "(0)" : "s") + " }";
			units.add(Parser.parse("u" + i, src));
		}
		return units;
	}

	private static List<AnalysisResult> analyse(Options options, Unit... units) throws Exception {
		return new Analyser(options).analyse(Arrays.asList(units));
	}
}
