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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static rangecheck.testing.CoreTests.check;
import static rangecheck.testing.CoreTests.checkInvalid;
import static rangecheck.testing.NarrowingTests.statement;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import rangecheck.core.AnnotatedProgram;
import rangecheck.core.Bound;
import rangecheck.core.Diagnostic;
import rangecheck.core.ErrorKind;
import rangecheck.core.FactTable.LoopFact;
import rangecheck.core.FactTable.Snapshot;
import rangecheck.core.Options;
import rangecheck.core.Range;
import rangecheck.core.ScalarKind;
import rangecheck.extensions.ControlFlow;
import rangecheck.extensions.Functions.Syntax.Unit;
import rangecheck.io.Parser;

public class IteratorTests {

	@Test
	public void test_0x001() {
		String input = "fn f() { let s = 0; for i in 0..10 { s = s + 1 } s }";
		check(input, Range.constant(10));
	}

	@Test
	public void test_0x002() {
		String input = "fn f() { let s = 0; for i in 0..10 { s = s + 1 } s }";
		check(input, new Options().setCollapse(false), Range.constant(10));
	}

	@Test
	public void test_0x003() {
		String input = "fn f(n: nat[2,7]) { let s = 0; for i in 0..n { s = s + 1 } s }";
		check(input, Range.of(2, 7));
	}

	@Test
	public void test_0x004() {
		String input = "fn f() { let s = 0; for i in 0..10 step 3 { s = s + 1 } s }";
		check(input, Range.constant(4));
	}

	@Test
	public void test_0x005() {
		String input = "fn f() { let s = 0; for i in 1..=5 { s = s + i } s }";
		check(input, Range.constant(15));
	}

	@Test
	public void test_0x006() {
		String input = "fn f() { let i = 0; let s = 0; while i < 10 { s = s + 2; i = i + 1 } s }";
		check(input, Range.constant(20));
	}

	@Test
	public void test_0x007() {
		String input = "fn f() { let i = 0; let s = 0; while 10 > i { s += 2; i++ } s }";
		check(input, Range.constant(20));
	}

	@Test
	public void test_0x008() {
		String input = "fn f() { let i = 0; let s = 0; while i <= 10 { s += 1; i += 5 } s }";
		check(input, Range.constant(3));
	}

	@Test
	public void test_0x009() {
		String input = "fn f() { let i = 0; while i != 10 { i = i + 1 } i }";
		checkInvalid(input, ErrorKind.NonMonotonicIterator);
	}

	@Test
	public void test_0x00A() {
		String input = "fn f() { let i = 10; while i < 20 { i = i - 1 } i }";
		checkInvalid(input, ErrorKind.NonMonotonicIterator);
	}

	@Test
	public void test_0x00B() {
		String input = "fn f() { let i = 0; while i < 20 { i = 0 } i }";
		checkInvalid(input, ErrorKind.NonMonotonicIterator);
	}

	@Test
	public void test_0x00C() {
		String input = "fn f(x: int[0,2]) { let i = 0; while i < 20 { i = i + x } i }";
		checkInvalid(input, ErrorKind.NonMonotonicIterator);
	}

	@Test
	public void test_0x00D() {
		// Limit changed by the body
		String input = "fn f() { let n = 10; let i = 0; while i < n { n = n + 1; i = i + 1 } i }";
		checkInvalid(input, ErrorKind.NonMonotonicIterator);
	}

	@Test
	public void test_0x00E() {
		// Iterator assigned in a nested loop
		String input = "fn f() { for i in 0..10 { for j in 0..5 { i = i + 1 } } 0 }";
		Diagnostic d = checkInvalid(input, ErrorKind.ConflictingIteratorMutation);
		assertNotNull(d.conflictingLocation());
	}

	@Test
	public void test_0x00F() {
		String input = "fn f() { let i = 0; while i < 10 { while i < 5 { i = i + 1 } i = i + 1 } i }";
		checkInvalid(input, ErrorKind.ConflictingIteratorMutation);
	}

	@Test
	public void test_0x010() {
		// Iterator reused by an inner loop
		String input = "fn f() { let s = 0; for i in 0..3 { while i < 2 { s = s + 1 } } s }";
		checkInvalid(input, ErrorKind.ConflictingIteratorMutation);
	}

	@Test
	public void test_0x011() {
		String input = "fn f(n: nat[0,5]) { let x = 0; for i in 0..n { x = 7 } x }";
		check(input, Range.of(0, 7));
	}

	@Test
	public void test_0x012() {
		String input = "fn f() { let x = 0.0; while x < 1.0 { x = x + 0.25 } x }";
		check(input, new Options().setCollapse(false),
				Range.of(ScalarKind.REAL, Bound.ONE, Bound.of(new BigDecimal("1.25"))));
	}

	@Test
	public void test_0x013() {
		String input = "fn f() { let s = 5; for i in 3..3 { s = 0 } s }";
		check(input, Range.constant(5));
	}

	@Test
	public void test_0x014() {
		String input = "fn f() { let s = 0; for i in 0..4 { for j in 0..i { s = s + 1 } } s }";
		check(input, Range.constant(6));
	}

	@Test
	public void test_0x015() {
		String input = "fn f(n: nat[1,4]) { let s = 0; for i in 0..n { for j in 0..3 { s = s + 1 } } s }";
		check(input, Range.of(3, 12));
	}

	@Test
	public void test_0x016() {
		String input = "fn f(n: nat[0,10]) { let i = 0; while i < n { i = i + 1 } i }";
		check(input, Range.of(0, 10));
	}

	@Test
	public void test_0x017() {
		String input = "fn f() { for i in 0..10 { let i = 1; } 0 }";
		checkInvalid(input, ErrorKind.NameCollision);
	}

	@Test
	public void test_0x018() {
		String input = "fn f() { let b = true; while b < 10 { b = false } 0 }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x019() {
		Unit u = Parser.parse("test", "fn f(n: nat[2,7]) { let s = 0; for i in 0..n { s = s + 1 } s }");
		AnnotatedProgram p = check(u);
		LoopFact fact = p.loop(statement(u, 1));
		assertNotNull(fact);
		assertEquals("i", fact.iterator());
		assertEquals(Range.constant(1), fact.delta());
		assertEquals(Range.of(2, 7), fact.count());
		assertEquals(Bound.of(2), fact.minCount());
		assertEquals(Bound.of(7), fact.maxCount());
		assertEquals(Range.of(2, 7), fact.exit());
	}

	@Test
	public void test_0x01A() {
		Unit u = Parser.parse("test", "fn f() { for i in 0..10 step 3 { } 0 }");
		LoopFact fact = check(u).loop(statement(u, 0));
		assertEquals(Range.constant(3), fact.delta());
		assertEquals(Range.constant(4), fact.count());
		assertEquals(Range.constant(12), fact.exit());
	}

	@Test
	public void test_0x01B() {
		// Counts round outwards when the distance is not a multiple of the step
		Unit u = Parser.parse("test", "fn f(n: nat[5,9]) { for i in 1..n step 3 { } 0 }");
		LoopFact fact = check(u).loop(statement(u, 0));
		assertEquals(Range.of(2, 3), fact.count());
		assertTrue(fact.exit().contains(Range.of(7, 10)));
	}

	@Test
	public void test_0x01C() {
		Unit u = Parser.parse("test", "fn f(k: nat[1,2]) { let i = 0; while i < 10 { i = i + k } i }");
		AnnotatedProgram p = check(u);
		LoopFact fact = p.loop(statement(u, 1));
		assertEquals(Range.of(1, 2), fact.delta());
		assertEquals(Range.of(5, 10), fact.count());
		assertEquals(Range.of(10, 11), CoreTests.returnOf(p));
	}

	@Test
	public void test_0x01D() {
		Unit u = Parser.parse("test", "fn f() { let x = 0.0; while x < 1.0 { x = x + 0.25 } x }");
		LoopFact fact = check(u, new Options().setCollapse(false)).loop(statement(u, 1));
		assertEquals(Range.of(4, 5), fact.count());
	}

	@Test
	public void test_0x01E() {
		// Variables carried into the body
		Unit u = Parser.parse("test", "fn f() { let s = 0; for i in 0..5 { let t = s; s = s + 2 } s }");
		AnnotatedProgram p = check(u, new Options().setCollapse(false));
		ControlFlow.Syntax.For loop = (ControlFlow.Syntax.For) statement(u, 1);
		Snapshot s = p.snapshot(loop.body().get(0));
		assertEquals(Range.of(0, 8), s.get("s"));
		assertEquals(Range.of(0, 4), s.get("i"));
		assertEquals(Range.constant(10), CoreTests.returnOf(p));
	}

	@Test
	public void test_0x01F() {
		// Bitwise operations on the iterator
		check("fn f() { let s = 0; for i in 0..10 { s = s + (i & 1) } s }", Range.constant(5));
	}

	@Test
	public void test_0x020() {
		String input = "fn f() { let s = 0; let b = 0; for i in 0..10 { s = s + 3; b = s & 1 } b }";
		check(input, new Options().setCollapse(false), Range.of(0, 1));
	}

	@Test
	public void test_0x021() {
		String input = "fn f() { let s = 0; for i in 0..3 { let y = i - 5; s = s + (y & 1) } s }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x022() {
		// Step of the inner loop is only known once the outer one is
		String input = "fn f() { let k = 1; for i in 0..3 { let j = 0; while j < 5 { j = j + k } k = 1 } k }";
		check(input, Range.constant(1));
	}

	@Test
	public void test_0x023() {
		String input = "fn f() { let k = 1; for i in 0..3 { let j = 0; while j < 5 { j = j + k } k = 0 } k }";
		checkInvalid(input, ErrorKind.NonMonotonicIterator);
	}

	@Test
	public void test_0x024() {
		// Never entered
		String input = "fn f() { let s = 7; for i in 9..3 { s = s + (i & 1) } s }";
		check(input, Range.constant(7));
	}
}
