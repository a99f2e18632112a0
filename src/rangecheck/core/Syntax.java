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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;

import rangecheck.util.SyntacticElement;

/**
 * The core abstract syntax handed to the analyser. Terms are compared by
 * identity, since the facts produced by the analysis are keyed on the term
 * they describe.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int TERM_let = 0;
	public final static int TERM_assignment = 1;
	public final static int TERM_block = 3;
	public final static int TERM_variable = 4;
	public final static int TERM_binary = 5;
	public final static int TERM_unary = 6;
	public final static int TERM_integer = 10;
	public final static int TERM_real = 11;
	public final static int TERM_bool = 12;

	public enum BinaryOperator {
		ADD("+"), SUB("-"), MUL("*"), DIV("/"), REM("%"),
		SHL("<<"), SHR(">>"), BITAND("&"), BITOR("|"), XOR("^"),
		LT("<"), LTEQ("<="), GT(">"), GTEQ(">="), EQ("=="), NEQ("!="),
		AND("&&"), OR("||");

		private final String symbol;

		BinaryOperator(String symbol) {
			this.symbol = symbol;
		}

		public boolean isComparison() {
			return ordinal() >= LT.ordinal() && ordinal() <= NEQ.ordinal();
		}

		public boolean isBitwise() {
			return ordinal() >= SHL.ordinal() && ordinal() <= XOR.ordinal();
		}

		public boolean isLogical() {
			return this == AND || this == OR;
		}

		/**
		 * Get the comparison which holds when the operands are swapped (e.g.
		 * <code>a &lt; b</code> is <code>b &gt; a</code>).
		 *
		 * @return
		 */
		public BinaryOperator flip() {
			switch (this) {
			case LT:
				return GT;
			case LTEQ:
				return GTEQ;
			case GT:
				return LT;
			case GTEQ:
				return LTEQ;
			case EQ:
			case NEQ:
				return this;
			default:
				throw new IllegalArgumentException("not a comparison: " + this);
			}
		}

		public String symbol() {
			return symbol;
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	public enum UnaryOperator {
		NEG("-"), NOT("!");

		private final String symbol;

		UnaryOperator(String symbol) {
			this.symbol = symbol;
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	public interface Term extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * An abstract term to be implemented by all other terms.
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm extends SyntacticElement.Impl implements Term {
			private final int opcode;

			public AbstractTerm(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * A marker interface to indicates terms which contain other terms, and which
		 * therefore need no separator after them.
		 *
		 * @author David J. Pearce
		 *
		 */
		public interface Compound {

		}

		/**
		 * Represents a variable declaration of the form:
		 *
		 * <pre>
		 * let x = e
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Let extends AbstractTerm {
			private final String variable;
			private final Term initialiser;

			public Let(String variable, Term initialiser, Attribute... attributes) {
				super(TERM_let, attributes);
				this.variable = variable;
				this.initialiser = initialiser;
			}

			/**
			 * Return the variable being declared.
			 *
			 * @return
			 */
			public String variable() {
				return variable;
			}

			/**
			 * Return the expression used to initialise variable
			 *
			 * @return
			 */
			public Term initialiser() {
				return initialiser;
			}

			@Override
			public String toString() {
				return "let " + variable + " = " + initialiser;
			}
		}

		/**
		 * Represents an assignment such as the following:
		 *
		 * <pre>
		 * x = e
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Assignment extends AbstractTerm {
			private final String variable;
			private final Term rhs;

			public Assignment(String variable, Term rhs, Attribute... attributes) {
				super(TERM_assignment, attributes);
				this.variable = variable;
				this.rhs = rhs;
			}

			public String variable() {
				return variable;
			}

			public Term rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return variable + " = " + rhs;
			}
		}

		/**
		 * Represents a group of statements, such as the following:
		 *
		 * <pre>
		 * { }
		 * { let x = 1; x }
		 * </pre>
		 *
		 * A block opens a fresh scope, and its value is that of its last term.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Block extends AbstractTerm implements Compound {
			private final Term[] terms;

			public Block(Term[] stmts, Attribute... attributes) {
				super(TERM_block, attributes);
				this.terms = stmts;
			}

			public int size() {
				return terms.length;
			}

			public Term get(int i) {
				return terms[i];
			}

			public Term[] toArray() {
				return terms;
			}

			@Override
			public String toString() {
				String contents = "";
				for (int i = 0; i != terms.length; ++i) {
					Term ith = terms[i];
					contents += ith.toString();
					if (!(ith instanceof Compound)) {
						contents += ";";
					}
					contents += " ";
				}
				return "{ " + contents + "}";
			}
		}

		/**
		 * Represents a read of a variable.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Variable extends AbstractTerm {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(TERM_variable, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Represents a binary operation, including comparisons and the short-circuiting
		 * logical connectives.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Binary extends AbstractTerm {
			private final BinaryOperator operator;
			private final Term lhs;
			private final Term rhs;

			public Binary(BinaryOperator operator, Term lhs, Term rhs, Attribute... attributes) {
				super(TERM_binary, attributes);
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public BinaryOperator operator() {
				return operator;
			}

			public Term leftOperand() {
				return lhs;
			}

			public Term rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return "(" + lhs + " " + operator + " " + rhs + ")";
			}
		}

		public class Unary extends AbstractTerm {
			private final UnaryOperator operator;
			private final Term operand;

			public Unary(UnaryOperator operator, Term operand, Attribute... attributes) {
				super(TERM_unary, attributes);
				this.operator = operator;
				this.operand = operand;
			}

			public UnaryOperator operator() {
				return operator;
			}

			public Term operand() {
				return operand;
			}

			@Override
			public String toString() {
				return operator + "" + operand;
			}
		}
	}

	/**
	 * Represents the literal values of the language.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Value extends Term {

		public class Integer extends AbstractTerm implements Value {
			private final BigInteger value;

			public Integer(long value, Attribute... attributes) {
				this(BigInteger.valueOf(value), attributes);
			}

			public Integer(BigInteger value, Attribute... attributes) {
				super(TERM_integer, attributes);
				this.value = value;
			}

			public BigInteger value() {
				return value;
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		public class Real extends AbstractTerm implements Value {
			private final BigDecimal value;

			public Real(BigDecimal value, Attribute... attributes) {
				super(TERM_real, attributes);
				this.value = value;
			}

			public BigDecimal value() {
				return value;
			}

			@Override
			public String toString() {
				return value.toPlainString();
			}
		}

		public class Bool extends AbstractTerm implements Value {
			private final boolean value;

			public Bool(boolean value, Attribute... attributes) {
				super(TERM_bool, attributes);
				this.value = value;
			}

			public boolean value() {
				return value;
			}

			@Override
			public String toString() {
				return java.lang.Boolean.toString(value);
			}
		}
	}

	/**
	 * Render a sequence of terms separated by commas.
	 *
	 * @param terms
	 * @return
	 */
	public static String toString(Term... terms) {
		String r = Arrays.toString(terms);
		return r.substring(1, r.length() - 1);
	}
}
