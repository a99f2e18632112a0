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

import java.util.Objects;

/**
 * The type inferred for a term or held by a variable. Scalars are typed by a
 * {@link Range}; arrays by their discipline, element kind and the range of
 * elements written so far; statements by {@link Type#Unit}.
 *
 * @author David J. Pearce
 *
 */
public interface Type {
	public static final Type Unit = new Unit();

	/**
	 * Check whether values of this type and another could flow into the same
	 * variable.
	 *
	 * @param t
	 * @return
	 */
	public boolean isCompatible(Type t);

	/**
	 * Join this type with another compatible type, as happens where control-flow
	 * paths meet.
	 *
	 * @param t
	 * @return
	 */
	public Type union(Type t);

	public static class Unit implements Type {

		private Unit() {
		}

		@Override
		public boolean isCompatible(Type t) {
			return t == this;
		}

		@Override
		public Type union(Type t) {
			if (t != this) {
				throw new IllegalArgumentException("cannot union unit with " + t);
			}
			return this;
		}

		@Override
		public String toString() {
			return "()";
		}
	}

	/**
	 * Describes an array variable.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Array implements Type {
		public enum Discipline {
			/**
			 * Exact size known when declared; elements written by index.
			 */
			FIXED,
			/**
			 * Grows by appending until first accessed.
			 */
			BACK_INSERTION;

			@Override
			public String toString() {
				return this == FIXED ? "fixed" : "vec";
			}
		}

		private final Discipline discipline;
		private final ScalarKind kind;
		private final Range elements;

		public Array(Discipline discipline, ScalarKind kind) {
			this(discipline, kind, Range.empty(kind));
		}

		public Array(Discipline discipline, ScalarKind kind, Range elements) {
			this.discipline = Objects.requireNonNull(discipline);
			this.kind = Objects.requireNonNull(kind);
			this.elements = Objects.requireNonNull(elements);
		}

		public Discipline discipline() {
			return discipline;
		}

		/**
		 * The declared kind of elements.
		 *
		 * @return
		 */
		public ScalarKind elementKind() {
			return kind;
		}

		/**
		 * The range of every element written so far. This is empty when nothing has
		 * been written yet.
		 *
		 * @return
		 */
		public Range elements() {
			return elements;
		}

		/**
		 * Record that an element from a given range may now be held by this array.
		 *
		 * @param element
		 * @return
		 */
		public Array write(Range element) {
			return new Array(discipline, kind, elements.union(element));
		}

		@Override
		public boolean isCompatible(Type t) {
			if (t instanceof Array) {
				Array a = (Array) t;
				return discipline == a.discipline && kind == a.kind;
			}
			return false;
		}

		@Override
		public Array union(Type t) {
			if (!isCompatible(t)) {
				throw new IllegalArgumentException("cannot union " + this + " with " + t);
			}
			return new Array(discipline, kind, elements.union(((Array) t).elements));
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Array) {
				Array a = (Array) o;
				return discipline == a.discipline && kind == a.kind && elements.equals(a.elements);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return discipline.hashCode() ^ elements.hashCode();
		}

		@Override
		public String toString() {
			return discipline + " " + kind + "<" + elements + ">";
		}
	}
}
