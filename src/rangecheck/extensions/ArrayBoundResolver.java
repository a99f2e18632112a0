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

package rangecheck.extensions;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangecheck.core.ArrayDescriptor;
import rangecheck.core.Bound;
import rangecheck.core.ErrorKind;
import rangecheck.core.FactTable;
import rangecheck.core.FactTable.BranchRegion;
import rangecheck.core.FactTable.CollapsedLoop;
import rangecheck.core.FactTable.Flagged;
import rangecheck.core.FactTable.LoopFact;
import rangecheck.core.FactTable.LoopRegion;
import rangecheck.core.FactTable.Region;
import rangecheck.core.FactTable.Verdict;
import rangecheck.core.Range;
import rangecheck.core.SafetyProof;
import rangecheck.core.ScalarKind;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Type.Array.Discipline;
import rangecheck.util.AnalysisError;

/**
 * The second phase of the analysis, which visits only the statements flagged
 * by the first. For each array this determines how many elements it holds,
 * and proves that every access lies within them.
 *
 * <p>
 * A fixed array must have an exact size, and must be completely initialised
 * before it is first read. A back-insertion array grows by appending elements
 * until it is first accessed (at which point it is <i>sealed</i>), and the
 * number of elements is determined from the iteration counts of the loops
 * enclosing each append.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class ArrayBoundResolver {
	private static final Logger LOGGER = LoggerFactory.getLogger(ArrayBoundResolver.class);
	// Error messages
	public final static String UNKNOWN_SIZE = "array size not a known natural";
	public final static String TOO_MANY_INITIALISERS = "too many initialisers for array";
	public final static String INDEX_OUT_OF_RANGE = "index not proven within array";
	public final static String INCOMPLETE_INITIALISATION = "array not fully initialised before read";
	public final static String UNBOUNDED_ELEMENTS = "array has no bound on its elements";
	public final static String APPEND_AFTER_ACCESS = "append after array accessed";
	public final static String APPEND_IN_ACCESSING_LOOP = "append repeated after array accessed";

	private final FactTable facts;

	public ArrayBoundResolver(FactTable facts) {
		this.facts = facts;
	}

	/**
	 * Resolve the arrays of one function, given its flagged statements in program
	 * order.
	 *
	 * @param flagged
	 */
	public void apply(List<Flagged> flagged) {
		LinkedHashMap<Term, Resolution> arrays = new LinkedHashMap<>();
		for (Flagged f : flagged) {
			switch (f.kind()) {
			case DECLARE: {
				Resolution r = f.size() == null ? new BackInsertion(f) : new Fixed(f);
				arrays.put(f.term(), r);
				break;
			}
			case APPEND:
				arrays.get(f.declaration()).append(f);
				break;
			default:
				facts.proof(f.term(), arrays.get(f.declaration()).access(f));
			}
		}
		for (Resolution r : arrays.values()) {
			ArrayDescriptor d = r.descriptor();
			LOGGER.debug("array {} resolved as {}", d.name(), d);
			facts.descriptor(r.declaration.term(), d);
		}
	}

	/**
	 * The state of one array as its flagged statements are visited.
	 */
	private abstract class Resolution {
		protected final Flagged declaration;
		protected Range elements;

		public Resolution(Flagged declaration) {
			this.declaration = declaration;
			this.elements = declaration.value();
		}

		/**
		 * Get the regions enclosing a statement which do not also enclose the
		 * declaration.
		 */
		protected List<Region> regions(Flagged f) {
			List<Region> regions = f.regions();
			return regions.subList(declaration.regions().size(), regions.size());
		}

		protected abstract void append(Flagged f);

		protected abstract SafetyProof access(Flagged f);

		protected abstract ArrayDescriptor descriptor();

		protected ScalarKind kind() {
			return ((Arrays.Syntax.ArrayDeclaration) declaration.term()).kind();
		}
	}

	private class Fixed extends Resolution {
		private final BigInteger size;
		private final ArrayList<Coverage> coverage = new ArrayList<>();
		private boolean initialised;

		public Fixed(Flagged f) {
			super(f);
			Range s = f.size();
			check(s.isConstant() && s.min().signum() >= 0, ErrorKind.UnboundedArray, UNKNOWN_SIZE, f.term(), null);
			this.size = s.min().toBigInteger();
			check(BigInteger.valueOf(f.initialisers()).compareTo(size) <= 0, ErrorKind.IndexOutOfProvenRange,
					TOO_MANY_INITIALISERS, f.term(), null);
			if (f.initialisers() > 0) {
				coverage.add(new Coverage(BigInteger.ZERO, BigInteger.valueOf(f.initialisers() - 1),
						Collections.emptySet()));
			}
			this.initialised = size.signum() == 0;
		}

		@Override
		protected void append(Flagged f) {
			// Appends to fixed arrays are rejected by the first phase
			throw new IllegalStateException("append to fixed array");
		}

		@Override
		protected SafetyProof access(Flagged f) {
			Range index = f.index();
			Bound limit = Bound.of(size);
			check(index.min().signum() >= 0 && index.max().compareTo(limit) < 0, ErrorKind.IndexOutOfProvenRange,
					INDEX_OUT_OF_RANGE, f.term(), declaration.term());
			List<Region> regions = regions(f);
			if (f.kind() == Flagged.Kind.WRITE) {
				elements = elements.union(f.value());
				cover(f, regions);
			} else if (!initialised) {
				check(covered(loops(regions)), ErrorKind.IncompleteInitialization, INCOMPLETE_INITIALISATION,
						f.term(), declaration.term());
				initialised = true;
			}
			return new SafetyProof(declaration.term(), index, limit);
		}

		/**
		 * Determine the indices definitely written by a given write.
		 */
		private void cover(Flagged f, List<Region> regions) {
			Range index = f.index();
			if (index.isConstant() && isDefinite(regions, null)) {
				BigInteger i = index.min().toBigInteger();
				coverage.add(new Coverage(i, i, loops(regions)));
			} else if (f.indexVariable() != null && f.indexOffset() != null && f.indexOffset().isConstant()) {
				for (Region r : regions) {
					if (r instanceof LoopRegion && ((LoopRegion) r).fact().iterator().equals(f.indexVariable())) {
						LoopFact fact = ((LoopRegion) r).fact();
						if (!fact.delta().equals(Range.constant(1)) || !isDefinite(regions, r)) {
							return;
						}
						// Every value of the iterator from the latest start is written
						Bound c = f.indexOffset().min();
						Bound lo = fact.start().max().add(c);
						Bound hi = fact.start().min().add(c).add(fact.minCount()).subtract(Bound.ONE);
						if (lo.isFinite() && hi.isFinite() && lo.compareTo(hi) <= 0) {
							coverage.add(new Coverage(lo.toBigInteger(), hi.toBigInteger(), loops(regions)));
						}
						return;
					}
				}
			}
		}

		/**
		 * Check whether every index is written, ignoring writes which share a loop
		 * with the read.
		 */
		private boolean covered(Set<Term> loops) {
			ArrayList<Coverage> cs = new ArrayList<>();
			for (Coverage c : coverage) {
				if (Collections.disjoint(c.loops, loops)) {
					cs.add(c);
				}
			}
			cs.sort(Comparator.comparing(c -> c.lo));
			BigInteger next = BigInteger.ZERO;
			for (Coverage c : cs) {
				if (c.lo.compareTo(next) > 0) {
					break;
				} else if (c.hi.compareTo(next) >= 0) {
					next = c.hi.add(BigInteger.ONE);
				}
			}
			return next.compareTo(size) >= 0;
		}

		@Override
		protected ArrayDescriptor descriptor() {
			return new ArrayDescriptor(declaration.array(), kind(), Discipline.FIXED, size, size, elements);
		}
	}

	private class BackInsertion extends Resolution {
		private final ArrayList<Flagged> appends = new ArrayList<>();
		private Bound minElements;
		private Bound maxElements;
		private Flagged sealed;

		public BackInsertion(Flagged f) {
			super(f);
			this.minElements = Bound.of(f.initialisers());
			this.maxElements = minElements;
		}

		@Override
		protected void append(Flagged f) {
			check(sealed == null, ErrorKind.IllegalStructuralWrite, APPEND_AFTER_ACCESS, f.term(), sealed == null ? null
					: sealed.term());
			Range count = count(regions(f));
			minElements = minElements.add(count.min());
			maxElements = maxElements.add(count.max());
			elements = elements.union(f.value());
			appends.add(f);
		}

		@Override
		protected SafetyProof access(Flagged f) {
			List<Region> regions = regions(f);
			if (sealed == null) {
				sealed = f;
				for (Flagged a : appends) {
					for (Region r : regions(a)) {
						if (r instanceof LoopRegion && regions.contains(r)
								&& ((LoopRegion) r).fact().maxCount().compareTo(Bound.ONE) > 0) {
							check(false, ErrorKind.IllegalStructuralWrite, APPEND_IN_ACCESSING_LOOP, a.term(), f.term());
						}
					}
				}
			}
			Range index = f.index();
			check(index.min().signum() >= 0 && index.max().compareTo(minElements) < 0,
					ErrorKind.IndexOutOfProvenRange, INDEX_OUT_OF_RANGE, f.term(), declaration.term());
			if (f.kind() == Flagged.Kind.WRITE) {
				elements = elements.union(f.value());
			}
			return new SafetyProof(declaration.term(), index, minElements);
		}

		/**
		 * Determine how many times a statement enclosed by given regions executes.
		 */
		private Range count(List<Region> regions) {
			Range count = Range.constant(1);
			for (int i = 0; i != regions.size(); ++i) {
				Region r = regions.get(i);
				if (r instanceof LoopRegion) {
					Range refined = i + 1 < regions.size() ? refine((LoopRegion) r, regions.get(i + 1)) : null;
					if (refined != null) {
						// Loop and branch counted together
						count = count.multiply(refined);
						i = i + 1;
					} else {
						count = count.multiply(((LoopRegion) r).fact().count());
					}
				} else {
					BranchRegion b = (BranchRegion) r;
					count = count.multiply(b.isDefinite() ? Range.constant(1) : Range.of(0, 1));
				}
			}
			return count;
		}

		/**
		 * Count how often a branch directly inside an expanded loop was taken, using
		 * the verdict it received on each iteration.
		 *
		 * @return null if the loop was not expanded.
		 */
		private Range refine(LoopRegion loop, Region region) {
			CollapsedLoop collapsed = facts.getCollapsed(loop.term());
			if (collapsed == null || !(region instanceof BranchRegion)) {
				return null;
			}
			BranchRegion branch = (BranchRegion) region;
			List<Verdict> verdicts = collapsed.verdicts(branch.term());
			if (verdicts == null) {
				return null;
			}
			Verdict taken = branch.branch() ? Verdict.ALWAYS_TRUE : Verdict.ALWAYS_FALSE;
			Verdict skipped = branch.branch() ? Verdict.ALWAYS_FALSE : Verdict.ALWAYS_TRUE;
			long min = 0, max = 0;
			for (Verdict v : verdicts) {
				min += v == taken ? 1 : 0;
				max += v != skipped ? 1 : 0;
			}
			return Range.of(min, max);
		}

		@Override
		protected ArrayDescriptor descriptor() {
			check(maxElements.isFinite(), ErrorKind.UnboundedArray, UNBOUNDED_ELEMENTS, declaration.term(), null);
			return new ArrayDescriptor(declaration.array(), kind(), Discipline.BACK_INSERTION,
					minElements.toBigInteger(), maxElements.toBigInteger(), elements);
		}
	}

	/**
	 * A contiguous block of indices definitely written by one statement.
	 */
	private static final class Coverage {
		private final BigInteger lo;
		private final BigInteger hi;
		private final Set<Term> loops;

		public Coverage(BigInteger lo, BigInteger hi, Set<Term> loops) {
			this.lo = lo;
			this.hi = hi;
			this.loops = loops;
		}
	}

	private static Set<Term> loops(List<Region> regions) {
		HashSet<Term> loops = new HashSet<>();
		for (Region r : regions) {
			if (r instanceof LoopRegion) {
				loops.add(r.term());
			}
		}
		return loops;
	}

	/**
	 * Check whether every region (other than one to ignore) is entered whenever
	 * the region enclosing it is.
	 */
	private static boolean isDefinite(List<Region> regions, Region ignore) {
		for (Region r : regions) {
			if (r == ignore) {
				continue;
			} else if (r instanceof LoopRegion && ((LoopRegion) r).fact().minCount().signum() <= 0) {
				return false;
			} else if (r instanceof BranchRegion && !((BranchRegion) r).isDefinite()) {
				return false;
			}
		}
		return true;
	}

	private static void check(boolean result, ErrorKind kind, String msg, Term e, Term conflict) {
		if (!result) {
			AnalysisError.analysisError(kind, msg, e, conflict);
		}
	}
}
