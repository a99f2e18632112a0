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

/**
 * Configuration for an analysis run.
 *
 * @author David J. Pearce
 *
 */
public class Options {
	/**
	 * Whether loops with a single possible trip count are expanded.
	 */
	private boolean collapse = true;

	/**
	 * Loops are only expanded when their iterations, multiplied by those of every
	 * enclosing loop being expanded, do not exceed this.
	 */
	private int maxCollapseIterations = 1024;

	/**
	 * Configure number of threads to use when analysing independent units.
	 */
	private int nthreads = Runtime.getRuntime().availableProcessors();

	public boolean getCollapse() {
		return collapse;
	}

	public Options setCollapse(boolean collapse) {
		this.collapse = collapse;
		return this;
	}

	public int getMaxCollapseIterations() {
		return maxCollapseIterations;
	}

	public Options setMaxCollapseIterations(int max) {
		if (max < 0) {
			throw new IllegalArgumentException("invalid collapse limit: " + max);
		}
		this.maxCollapseIterations = max;
		return this;
	}

	public int getThreads() {
		return nthreads;
	}

	/**
	 * Configure the number of units which can be analysed at the same time.
	 *
	 * @param nthreads
	 * @return
	 */
	public Options setThreads(int nthreads) {
		if (nthreads < 1) {
			throw new IllegalArgumentException("invalid thread count: " + nthreads);
		}
		this.nthreads = nthreads;
		return this;
	}

	@Override
	public String toString() {
		return "{collapse=" + collapse + ", maxCollapseIterations=" + maxCollapseIterations + ", threads=" + nthreads
				+ "}";
	}
}
