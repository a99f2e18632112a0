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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import rangecheck.core.Syntax.Term;
import rangecheck.util.SyntacticElement.Attribute;

/**
 * Holds every fact established about one unit. Facts are keyed on the identity
 * of the term they describe and kept in the order they were established, which
 * makes the rendering of a table deterministic. A table is owned by exactly one
 * analysis and is only read by others once that analysis is complete.
 *
 * @author David J. Pearce
 *
 */
public final class FactTable {

	/**
	 * The outcome of a conditional's predicate as far as the analysis can tell.
	 */
	public enum Verdict {
		ALWAYS_TRUE, ALWAYS_FALSE, RUNTIME;

		public Verdict union(Verdict v) {
			return this == v ? this : RUNTIME;
		}
	}

	private final LinkedHashMap<Term, Snapshot> snapshots = new LinkedHashMap<>();
	private final LinkedHashMap<Term, LoopFact> loops = new LinkedHashMap<>();
	private final LinkedHashMap<Term, Verdict> verdicts = new LinkedHashMap<>();
	private final LinkedHashMap<Term, CollapsedLoop> collapsed = new LinkedHashMap<>();
	private final LinkedHashMap<Term, ArrayDescriptor> descriptors = new LinkedHashMap<>();
	private final LinkedHashMap<Term, SafetyProof> proofs = new LinkedHashMap<>();
	/**
	 * Size-determining statements awaiting the second phase, in program order.
	 */
	private final ArrayList<Flagged> flagged = new ArrayList<>();

	public void snapshot(Term statement, Snapshot snapshot) {
		Snapshot old = snapshots.get(statement);
		snapshots.put(statement, old == null ? snapshot : old.union(snapshot));
	}

	public void loop(Term loop, LoopFact fact) {
		loops.put(loop, fact);
	}

	public void verdict(Term conditional, Verdict verdict) {
		Verdict old = verdicts.get(conditional);
		verdicts.put(conditional, old == null ? verdict : old.union(verdict));
	}

	public void collapsed(Term loop, CollapsedLoop fact) {
		collapsed.put(loop, fact);
	}

	public void flag(Flagged statement) {
		flagged.add(statement);
	}

	/**
	 * Remove and return all statements flagged since the last call.
	 *
	 * @return
	 */
	public List<Flagged> drainFlagged() {
		List<Flagged> r = new ArrayList<>(flagged);
		flagged.clear();
		return r;
	}

	public void descriptor(Term declaration, ArrayDescriptor descriptor) {
		descriptors.put(declaration, descriptor);
	}

	public void proof(Term access, SafetyProof proof) {
		proofs.put(access, proof);
	}

	public Snapshot getSnapshot(Term statement) {
		return snapshots.get(statement);
	}

	public LoopFact getLoop(Term loop) {
		return loops.get(loop);
	}

	public Verdict getVerdict(Term conditional) {
		return verdicts.get(conditional);
	}

	public CollapsedLoop getCollapsed(Term loop) {
		return collapsed.get(loop);
	}

	public ArrayDescriptor getDescriptor(Term declaration) {
		return descriptors.get(declaration);
	}

	public SafetyProof getProof(Term access) {
		return proofs.get(access);
	}

	public Map<Term, Snapshot> snapshots() {
		return Collections.unmodifiableMap(snapshots);
	}

	public Map<Term, LoopFact> loops() {
		return Collections.unmodifiableMap(loops);
	}

	public Map<Term, Verdict> verdicts() {
		return Collections.unmodifiableMap(verdicts);
	}

	public Map<Term, CollapsedLoop> collapsed() {
		return Collections.unmodifiableMap(collapsed);
	}

	public Map<Term, ArrayDescriptor> descriptors() {
		return Collections.unmodifiableMap(descriptors);
	}

	public Map<Term, SafetyProof> proofs() {
		return Collections.unmodifiableMap(proofs);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		render(sb, "snapshot", snapshots);
		render(sb, "loop", loops);
		render(sb, "verdict", verdicts);
		render(sb, "collapsed", collapsed);
		render(sb, "array", descriptors);
		render(sb, "proof", proofs);
		return sb.toString();
	}

	private static void render(StringBuilder sb, String label, Map<Term, ?> facts) {
		for (Map.Entry<Term, ?> e : facts.entrySet()) {
			sb.append(label).append(' ').append(location(e.getKey())).append(' ').append(e.getKey()).append(" : ")
					.append(e.getValue()).append('\n');
		}
	}

	static String location(Term t) {
		Attribute.Source src = t.attribute(Attribute.Source.class);
		return src == null ? Attribute.Source.UNKNOWN.toString() : src.toString();
	}

	/**
	 * The types of all variables in scope on entry to a statement.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Snapshot {
		private final TreeMap<String, Type> bindings;

		public Snapshot(Map<String, Type> bindings) {
			this.bindings = new TreeMap<>(bindings);
		}

		public Type get(String variable) {
			return bindings.get(variable);
		}

		public Set<String> variables() {
			return Collections.unmodifiableSet(bindings.keySet());
		}

		/**
		 * Combine two snapshots of the same statement. Only variables present in
		 * both are kept.
		 *
		 * @param s
		 * @return
		 */
		public Snapshot union(Snapshot s) {
			TreeMap<String, Type> r = new TreeMap<>();
			for (Map.Entry<String, Type> e : bindings.entrySet()) {
				Type t = s.bindings.get(e.getKey());
				if (t != null && t.isCompatible(e.getValue())) {
					r.put(e.getKey(), e.getValue().union(t));
				}
			}
			return new Snapshot(r);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Snapshot && bindings.equals(((Snapshot) o).bindings);
		}

		@Override
		public int hashCode() {
			return bindings.hashCode();
		}

		@Override
		public String toString() {
			return bindings.toString();
		}
	}

	/**
	 * What is known about a canonical loop.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class LoopFact {
		private final String iterator;
		private final Range start;
		private final Range limit;
		private final Range delta;
		private final Range count;
		private final Range exit;

		public LoopFact(String iterator, Range start, Range limit, Range delta, Range count, Range exit) {
			this.iterator = iterator;
			this.start = start;
			this.limit = limit;
			this.delta = delta;
			this.count = count;
			this.exit = exit;
		}

		public String iterator() {
			return iterator;
		}

		/**
		 * Range of the iterator before the first iteration.
		 *
		 * @return
		 */
		public Range start() {
			return start;
		}

		public Range limit() {
			return limit;
		}

		/**
		 * Range by which the iterator grows on every iteration.
		 *
		 * @return
		 */
		public Range delta() {
			return delta;
		}

		/**
		 * Range of the number of iterations. The maximum may be unbounded.
		 *
		 * @return
		 */
		public Range count() {
			return count;
		}

		public Bound minCount() {
			return count.min();
		}

		public Bound maxCount() {
			return count.max();
		}

		/**
		 * Range of the iterator once the loop has finished.
		 *
		 * @return
		 */
		public Range exit() {
			return exit;
		}

		@Override
		public String toString() {
			return iterator + " from " + start + " to " + limit + " by " + delta + " count " + count + " exit "
					+ exit;
		}
	}

	/**
	 * Records that a loop was expanded a fixed number of times, along with the
	 * verdict each conditional in its body received on every iteration.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class CollapsedLoop {
		private final int iterations;
		private final LinkedHashMap<Term, List<Verdict>> verdicts = new LinkedHashMap<>();

		public CollapsedLoop(int iterations) {
			this.iterations = iterations;
		}

		public int iterations() {
			return iterations;
		}

		public void add(Term conditional, Verdict verdict) {
			verdicts.computeIfAbsent(conditional, k -> new ArrayList<>()).add(verdict);
		}

		/**
		 * Get the verdicts given to a conditional, one for each iteration on which
		 * it was reached.
		 *
		 * @param conditional
		 * @return null if the conditional was never reached.
		 */
		public List<Verdict> verdicts(Term conditional) {
			List<Verdict> vs = verdicts.get(conditional);
			return vs == null ? null : Collections.unmodifiableList(vs);
		}

		/**
		 * Check whether a conditional was decided on every iteration it was reached.
		 *
		 * @param conditional
		 * @return
		 */
		public boolean isDecided(Term conditional) {
			List<Verdict> vs = verdicts.get(conditional);
			return vs != null && !vs.contains(Verdict.RUNTIME);
		}

		@Override
		public String toString() {
			String r = iterations + "x";
			for (Map.Entry<Term, List<Verdict>> e : verdicts.entrySet()) {
				r += " " + location(e.getKey()) + "=" + e.getValue();
			}
			return r;
		}
	}

	/**
	 * A loop or conditional branch enclosing a flagged statement.
	 */
	public interface Region {
		public Term term();
	}

	public static final class LoopRegion implements Region {
		private final Term loop;
		private final LoopFact fact;

		public LoopRegion(Term loop, LoopFact fact) {
			this.loop = loop;
			this.fact = fact;
		}

		@Override
		public Term term() {
			return loop;
		}

		public LoopFact fact() {
			return fact;
		}

		@Override
		public String toString() {
			return "loop " + location(loop);
		}
	}

	public static final class BranchRegion implements Region {
		private final Term conditional;
		private final boolean branch;
		private final Verdict verdict;

		public BranchRegion(Term conditional, boolean branch, Verdict verdict) {
			this.conditional = conditional;
			this.branch = branch;
			this.verdict = verdict;
		}

		@Override
		public Term term() {
			return conditional;
		}

		/**
		 * Which branch this is: <code>true</code> for the branch taken when the
		 * predicate holds.
		 *
		 * @return
		 */
		public boolean branch() {
			return branch;
		}

		public Verdict verdict() {
			return verdict;
		}

		/**
		 * Check whether this branch is taken every time its conditional is reached.
		 *
		 * @return
		 */
		public boolean isDefinite() {
			return verdict == (branch ? Verdict.ALWAYS_TRUE : Verdict.ALWAYS_FALSE);
		}

		@Override
		public String toString() {
			return (branch ? "then " : "else ") + location(conditional);
		}
	}

	/**
	 * A statement which determines the size of an array or accesses one. These are
	 * recorded in program order by the first phase, together with the loops and
	 * branches enclosing them, and consumed by the second.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Flagged {
		public enum Kind {
			DECLARE, APPEND, READ, WRITE
		}

		private final Kind kind;
		private final Term term;
		private final Term declaration;
		private final String array;
		private final List<Region> regions;
		private final Range index;
		private final String indexVariable;
		private final Range indexOffset;
		private final Range value;
		private final Range size;
		private final int initialisers;

		private Flagged(Kind kind, Term term, Term declaration, String array, List<Region> regions, Range index,
				String indexVariable, Range indexOffset, Range value, Range size, int initialisers) {
			this.kind = kind;
			this.term = term;
			this.declaration = declaration;
			this.array = array;
			this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
			this.index = index;
			this.indexVariable = indexVariable;
			this.indexOffset = indexOffset;
			this.value = value;
			this.size = size;
			this.initialisers = initialisers;
		}

		/**
		 * Flag the declaration of an array.
		 *
		 * @param term
		 * @param array
		 * @param regions
		 * @param size
		 *            Range of the declared size, or null for back-insertion.
		 * @param initialisers
		 *            Number of elements in the initialiser list.
		 * @param elements
		 *            Range of the initial elements.
		 * @return
		 */
		public static Flagged declare(Term term, String array, List<Region> regions, Range size, int initialisers,
				Range elements) {
			return new Flagged(Kind.DECLARE, term, term, array, regions, null, null, null, elements, size,
					initialisers);
		}

		public static Flagged append(Term term, Term declaration, String array, List<Region> regions, Range value) {
			return new Flagged(Kind.APPEND, term, declaration, array, regions, null, null, null, value, null, 0);
		}

		public static Flagged read(Term term, Term declaration, String array, List<Region> regions, Range index,
				String indexVariable, Range indexOffset) {
			return new Flagged(Kind.READ, term, declaration, array, regions, index, indexVariable, indexOffset, null,
					null, 0);
		}

		public static Flagged write(Term term, Term declaration, String array, List<Region> regions, Range index,
				String indexVariable, Range indexOffset, Range value) {
			return new Flagged(Kind.WRITE, term, declaration, array, regions, index, indexVariable, indexOffset,
					value, null, 0);
		}

		public Kind kind() {
			return kind;
		}

		public Term term() {
			return term;
		}

		/**
		 * The declaration of the array this statement concerns.
		 *
		 * @return
		 */
		public Term declaration() {
			return declaration;
		}

		public String array() {
			return array;
		}

		/**
		 * The loops and branches enclosing this statement, outermost first.
		 *
		 * @return
		 */
		public List<Region> regions() {
			return regions;
		}

		public Range index() {
			return index;
		}

		/**
		 * Name of the variable used directly as the index, if any.
		 *
		 * @return
		 */
		public String indexVariable() {
			return indexVariable;
		}

		/**
		 * How far the index variable has moved since the start of the current
		 * iteration of the innermost loop changing it, or null if unknown.
		 *
		 * @return
		 */
		public Range indexOffset() {
			return indexOffset;
		}

		public Range value() {
			return value;
		}

		public Range size() {
			return size;
		}

		public int initialisers() {
			return initialisers;
		}

		@Override
		public String toString() {
			return kind + " " + array + " " + location(term) + " " + regions;
		}
	}
}
