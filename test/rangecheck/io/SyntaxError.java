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

package rangecheck.io;

/**
 * This exception is thrown when a syntax error occurs in the parser.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {

	private final String msg;
	private final String src;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular point in a file.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param src
	 *            The program source this error is referring to.
	 * @param start
	 *            Index of first offending character.
	 * @param end
	 *            Index of last offending character.
	 */
	public SyntaxError(String msg, String src, int start, int end) {
		this.msg = msg;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		if (msg != null) {
			return msg + " (at " + start + ")";
		} else {
			return "";
		}
	}

	/**
	 * Error message
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * The program source where the error arose.
	 *
	 * @return
	 */
	public String source() {
		return src;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	public static final long serialVersionUID = 1l;
}
