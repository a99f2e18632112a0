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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import rangecheck.core.FactTable.CollapsedLoop;
import rangecheck.core.FactTable.LoopFact;
import rangecheck.core.FactTable.Snapshot;
import rangecheck.core.FactTable.Verdict;
import rangecheck.core.Syntax.Term;

/**
 * The outcome of successfully analysing a unit. This provides a read-only view
 * of every fact established about the unit, which can be looked up using
 * either the terms given to the analyser or those they were normalised into.
 *
 * @author David J. Pearce
 *
 */
public final class AnnotatedProgram {
	private final String name;
	private final FactTable facts;
	private final Map<String, FunctionSummary> summaries;
	private final Map<Term, Term> rewrites;

	public AnnotatedProgram(String name, FactTable facts, Map<String, FunctionSummary> summaries,
			Map<Term, Term> rewrites) {
		this.name = name;
		this.facts = facts;
		this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
		this.rewrites = rewrites;
	}

	public String name() {
		return name;
	}

	/**
	 * Map a term given to the analyser onto the term it was normalised into.
	 *
	 * @param t
	 * @return
	 */
	public Term resolve(Term t) {
		Term r = rewrites.get(t);
		while (r != null) {
			t = r;
			r = rewrites.get(t);
		}
		return t;
	}

	public Snapshot snapshot(Term statement) {
		return facts.getSnapshot(resolve(statement));
	}

	public ArrayDescriptor descriptor(Term declaration) {
		return facts.getDescriptor(resolve(declaration));
	}

	public SafetyProof proof(Term access) {
		return facts.getProof(resolve(access));
	}

	public LoopFact loop(Term loop) {
		return facts.getLoop(resolve(loop));
	}

	public Verdict verdict(Term conditional) {
		return facts.getVerdict(resolve(conditional));
	}

	public CollapsedLoop collapsed(Term loop) {
		return facts.getCollapsed(resolve(loop));
	}

	public FunctionSummary summary(String function) {
		return summaries.get(function);
	}

	public Map<String, FunctionSummary> summaries() {
		return summaries;
	}

	/**
	 * Check whether a conditional must still be decided at runtime. This is the
	 * case when its predicate could not be decided, unless it sits in a loop which
	 * was expanded and on every iteration of which it was decided.
	 *
	 * @param conditional
	 * @return
	 */
	public boolean isResidualRuntimeBranch(Term conditional) {
		Term t = resolve(conditional);
		if (facts.getVerdict(t) != Verdict.RUNTIME) {
			return false;
		}
		for (CollapsedLoop c : facts.collapsed().values()) {
			if (c.isDecided(t)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		String r = facts.toString();
		for (FunctionSummary s : summaries.values()) {
			r += "fn " + s + "\n";
		}
		return r;
	}
}
