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
import static rangecheck.testing.CoreTests.check;
import static rangecheck.testing.CoreTests.checkInvalid;
import static rangecheck.testing.NarrowingTests.statement;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import rangecheck.core.AnnotatedProgram;
import rangecheck.core.ArrayDescriptor;
import rangecheck.core.Bound;
import rangecheck.core.ErrorKind;
import rangecheck.core.Range;
import rangecheck.core.SafetyProof;
import rangecheck.core.ScalarKind;
import rangecheck.core.Type.Array.Discipline;
import rangecheck.extensions.Functions.Syntax.Unit;
import rangecheck.io.Parser;

/**
 * Tests for the sizing of arrays, and for proving their accesses safe.
 *
 * @author David J. Pearce
 *
 */
public class ArrayBoundTests {

	// ======================================================================
	// Back insertion
	// ======================================================================

	@Test
	public void test_0x001() {
		// One element for each of between 2 and 7 iterations
		Unit u = Parser.parse("test", "fn f(n: nat[2,7]) { let v = vec int {}; for i in 0..n { v.push(i) } v[1] }");
		AnnotatedProgram p = check(u);
		ArrayDescriptor d = p.descriptor(statement(u, 0));
		assertNotNull(d);
		assertEquals(Discipline.BACK_INSERTION, d.discipline());
		assertEquals(BigInteger.valueOf(2), d.minElements());
		assertEquals(BigInteger.valueOf(7), d.maxElements());
		assertEquals(Range.of(0, 6), d.elements());
		assertEquals(1, d.elementSize());
		assertEquals(BigInteger.valueOf(7), d.allocationSize());
		SafetyProof proof = p.proof(statement(u, 2));
		assertNotNull(proof);
		assertEquals(Range.constant(1), proof.index());
		assertEquals(Bound.of(2), proof.limit());
		assertEquals(Range.of(0, 6), CoreTests.returnOf(p));
	}

	@Test
	public void test_0x002() {
		String input = "fn f(n: nat[2,7]) { let v = vec int {}; for i in 0..n { v.push(i) } let s = 0; for j in 0..2 { s = s + v[j] } s }";
		check(input);
	}

	@Test
	public void test_0x003() {
		String input = "fn f(n: nat[2,7]) { let v = vec int {}; for i in 0..n { v.push(i) } let s = 0; for j in 0..n { s = s + v[j] } s }";
		checkInvalid(input, ErrorKind.IndexOutOfProvenRange);
	}

	@Test
	public void test_0x004() {
		String input = "fn f(n: nat[2,7]) { let v = vec int {}; for i in 0..n { v.push(i) } v[2] }";
		checkInvalid(input, ErrorKind.IndexOutOfProvenRange);
	}

	@Test
	public void test_0x005() {
		String input = "fn f(x: int[-1,1]) { let v = vec int {1, 2}; v[x] }";
		checkInvalid(input, ErrorKind.IndexOutOfProvenRange);
	}

	@Test
	public void test_0x006() {
		String input = "fn f() { let v = vec int {1, 2}; v[1] }";
		check(input, Range.of(1, 2));
	}

	@Test
	public void test_0x007() {
		Unit u = Parser.parse("test", "fn f(x: int[0,10]) { let v = vec int {}; v.push(1); if x < 5 { v.push(2) } v[0] }");
		ArrayDescriptor d = check(u).descriptor(statement(u, 0));
		assertEquals(BigInteger.ONE, d.minElements());
		assertEquals(BigInteger.valueOf(2), d.maxElements());
	}

	@Test
	public void test_0x008() {
		String input = "fn f(x: int[0,10]) { let v = vec int {}; v.push(1); if x < 5 { v.push(2) } v[1] }";
		checkInvalid(input, ErrorKind.IndexOutOfProvenRange);
	}

	@Test
	public void test_0x009() {
		// Appends inside a decided branch always happen
		Unit u = Parser.parse("test", "fn f(x: int[0,10]) { let v = vec int {}; if x < 50 { v.push(2) } v[0] }");
		ArrayDescriptor d = check(u).descriptor(statement(u, 0));
		assertEquals(BigInteger.ONE, d.minElements());
		assertEquals(BigInteger.ONE, d.maxElements());
	}

	@Test
	public void test_0x00A() {
		Unit u = Parser.parse("test",
				"fn f() { let v = vec int {}; for i in 0..3 { for j in 0..4 { v.push(j) } } v[11] }");
		ArrayDescriptor d = check(u).descriptor(statement(u, 0));
		assertEquals(BigInteger.valueOf(12), d.minElements());
		assertEquals(BigInteger.valueOf(12), d.maxElements());
		assertEquals(Range.of(0, 3), d.elements());
	}

	@Test
	public void test_0x00B() {
		String input = "fn f(n: nat) { let v = vec int {}; for i in 0..n { v.push(1) } 0 }";
		checkInvalid(input, ErrorKind.UnboundedArray);
	}

	@Test
	public void test_0x00C() {
		String input = "fn f() { let v = vec int {1}; let x = v[0]; v.push(2); x }";
		checkInvalid(input, ErrorKind.IllegalStructuralWrite);
	}

	@Test
	public void test_0x00D() {
		// Appends repeated after the array is sealed
		String input = "fn f() { let v = vec int {1}; for i in 0..3 { let x = v[0]; v.push(x) } 0 }";
		checkInvalid(input, ErrorKind.IllegalStructuralWrite);
	}

	@Test
	public void test_0x00E() {
		String input = "fn f() { let v = vec int {}; v = 1; 0 }";
		checkInvalid(input, ErrorKind.IllegalStructuralWrite);
	}

	@Test
	public void test_0x00F() {
		String input = "fn f() { let v = vec int[3] {}; 0 }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x010() {
		String input = "fn f() { let v = vec int {}; v.push(0.5); 0 }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x011() {
		String input = "fn f() { let v = vec nat {}; v.push(0 - 1); 0 }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x012() {
		String input = "fn f() { let v = vec int {1}; v }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x013() {
		// Writes to a sealed array widen its elements
		String input = "fn f() { let v = vec int {1, 2}; v[0] = 7; v[1] }";
		check(input, Range.of(1, 7));
	}

	// ======================================================================
	// Fixed
	// ======================================================================

	@Test
	public void test_0x101() {
		Unit u = Parser.parse("test", "fn f() { let a = fixed nat[3] {1, 2, 3}; a[2] }");
		AnnotatedProgram p = check(u);
		ArrayDescriptor d = p.descriptor(statement(u, 0));
		assertEquals(Discipline.FIXED, d.discipline());
		assertEquals(BigInteger.valueOf(3), d.minElements());
		assertEquals(BigInteger.valueOf(3), d.maxElements());
		assertEquals(Range.of(1, 3), CoreTests.returnOf(p));
	}

	@Test
	public void test_0x102() {
		String input = "fn f() { let a = fixed nat[3] {1, 2, 3}; a[3] }";
		checkInvalid(input, ErrorKind.IndexOutOfProvenRange);
	}

	@Test
	public void test_0x103() {
		String input = "fn f() { let a = fixed nat[4] {1, 2}; a[0] }";
		checkInvalid(input, ErrorKind.IncompleteInitialization);
	}

	@Test
	public void test_0x104() {
		String input = "fn f() { let a = fixed nat[4] {1, 2}; a[2] = 3; a[3] = 4; a[0] }";
		check(input, Range.of(1, 4));
	}

	@Test
	public void test_0x105() {
		Unit u = Parser.parse("test", "fn f() { let a = fixed int[5] {}; for i in 0..5 { a[i] = i * 2 } a[4] }");
		AnnotatedProgram p = check(u);
		assertEquals(Range.of(0, 8), p.descriptor(statement(u, 0)).elements());
		assertEquals(Range.of(0, 8), CoreTests.returnOf(p));
	}

	@Test
	public void test_0x106() {
		String input = "fn f() { let a = fixed int[5] {}; for i in 1..5 { a[i] = i } a[0] }";
		checkInvalid(input, ErrorKind.IncompleteInitialization);
	}

	@Test
	public void test_0x107() {
		String input = "fn f() { let a = fixed int[5] {0}; for i in 1..5 { a[i] = i } a[0] }";
		check(input, Range.of(0, 4));
	}

	@Test
	public void test_0x108() {
		String input = "fn f() { let a = fixed int[5] {}; for i in 0..5 { a[i + 1] = i } 0 }";
		checkInvalid(input, ErrorKind.IndexOutOfProvenRange);
	}

	@Test
	public void test_0x109() {
		String input = "fn f() { let a = fixed int[6] {0}; for i in 0..5 { a[i + 1] = i } a[5] }";
		check(input, Range.of(0, 4));
	}

	@Test
	public void test_0x10A() {
		// Writes in the same loop as the first read do not count
		String input = "fn f() { let a = fixed int[3] {}; for i in 0..3 { a[i] = 1; let x = a[i]; } 0 }";
		checkInvalid(input, ErrorKind.IncompleteInitialization);
	}

	@Test
	public void test_0x10B() {
		// Writes which may not happen do not count
		String input = "fn f(x: int[0,10]) { let a = fixed int[1] {}; if x < 5 { a[0] = 1 } a[0] }";
		checkInvalid(input, ErrorKind.IncompleteInitialization);
	}

	@Test
	public void test_0x10D() {
		String input = "fn f(n: nat[1,4]) { let a = fixed int[n] {}; 0 }";
		checkInvalid(input, ErrorKind.UnboundedArray);
	}

	@Test
	public void test_0x10E() {
		String input = "fn f() { let a = fixed nat[1] {1, 2}; 0 }";
		checkInvalid(input, ErrorKind.IndexOutOfProvenRange);
	}

	@Test
	public void test_0x10F() {
		String input = "fn f() { let a = fixed int[2] {1, 2}; a.push(3); 0 }";
		checkInvalid(input, ErrorKind.IllegalStructuralWrite);
	}

	@Test
	public void test_0x110() {
		String input = "fn f() { let a = fixed int {1, 2}; 0 }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x111() {
		Unit u = Parser.parse("test", "fn f() { let a = fixed int[4] {-1, 300, 0, 0}; 0 }");
		ArrayDescriptor d = check(u).descriptor(statement(u, 0));
		assertEquals(Range.of(-1, 300), d.elements());
		assertEquals(2, d.elementSize());
		assertEquals(BigInteger.valueOf(8), d.allocationSize());
	}

	@Test
	public void test_0x112() {
		Unit u = Parser.parse("test", "fn f() { let a = fixed real[2] {0.5, 1}; let b = fixed bool[3] {true, false, true}; 0 }");
		AnnotatedProgram p = check(u);
		ArrayDescriptor a = p.descriptor(statement(u, 0));
		assertEquals(ScalarKind.REAL, a.elementKind());
		assertEquals(BigInteger.valueOf(16), a.allocationSize());
		ArrayDescriptor b = p.descriptor(statement(u, 1));
		assertEquals(BigInteger.valueOf(3), b.allocationSize());
	}

	@Test
	public void test_0x113() {
		String input = "fn f(x: real[0,1]) { let a = fixed int[2] {1, 2}; a[x] }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}

	@Test
	public void test_0x114() {
		Unit u = Parser.parse("test", "fn f() { let v = vec nat {}; for i in 0..5 { v.push(i * 2) } v[4] }");
		AnnotatedProgram p = check(u);
		ArrayDescriptor d = p.descriptor(statement(u, 0));
		assertEquals(BigInteger.valueOf(5), d.minElements());
		assertEquals(BigInteger.valueOf(5), d.maxElements());
		assertEquals(Range.of(0, 8), d.elements());
	}

	@Test
	public void test_0x115() {
		Unit u = Parser.parse("test", "fn f() { let a = fixed nat[5] {}; for i in 0..5 { a[i] = i * 2 } a[4] }");
		AnnotatedProgram p = check(u);
		assertEquals(Range.of(0, 8), p.descriptor(statement(u, 0)).elements());
		assertEquals(Range.of(0, 8), CoreTests.returnOf(p));
	}

	@Test
	public void test_0x116() {
		String input = "fn f() { let v = vec nat {}; for i in 0..5 { v.push(i - 1) } 0 }";
		checkInvalid(input, ErrorKind.TypeMismatch);
	}
}
