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

package rangecheck.util;

/**
 * A Syntactic Element represents any part of a program handed to the analyser
 * to which information can be attached (e.g. where it came from in the
 * original source text). The analyser never reads source text itself; the
 * parser records locations as attributes.
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type. This is useful short-hand.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	public class Impl implements SyntacticElement {

		private final Attribute[] attributes;

		public Impl(Attribute x) {
			attributes = new Attribute[]{x};
		}

		public Impl(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public Attribute[] attributes() {
			return attributes;
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 */
	public interface Attribute {

		/**
		 * Identifies the span of source text a term was parsed from. Offsets are
		 * zero-based byte offsets; lines and columns start at one, with a tab
		 * advancing the column by eight.
		 */
		public static class Source implements Attribute {
			public static final Source UNKNOWN = new Source(-1, -1, 0, 0);

			public final int start;
			public final int end;
			public final int line;
			public final int column;

			public Source(int start, int end, int line, int column) {
				this.start = start;
				this.end = end;
				this.line = line;
				this.column = column;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Source) {
					Source s = (Source) o;
					return start == s.start && end == s.end && line == s.line && column == s.column;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return start ^ (end << 8) ^ (line << 16) ^ column;
			}

			@Override
			public String toString() {
				return line + ":" + column + "@" + start + ":" + end;
			}
		}
	}
}
