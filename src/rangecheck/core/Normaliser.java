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
import java.util.IdentityHashMap;
import java.util.Map;

import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Value;
import rangecheck.util.AbstractTransformer;
import rangecheck.util.Pair;

/**
 * Rewrites surface constructs into the canonical forms understood by the
 * analysis (e.g. counted and conditional loops into canonical loops). A term
 * whose children are unchanged is returned as is, so that facts about it can
 * be looked up using the original term. Every term which is replaced is
 * remembered, along with its replacement.
 *
 * @author David J. Pearce
 *
 */
public class Normaliser extends AbstractTransformer<Void, Term, Normaliser.Extension> {
	private final IdentityHashMap<Term, Term> rewrites = new IdentityHashMap<>();

	public Normaliser(Extension... extensions) {
		super(extensions);
		// Bind self in extensions
		for (Extension e : extensions) {
			e.self = this;
		}
	}

	/**
	 * Normalise a given term.
	 *
	 * @param t
	 * @return
	 */
	public Term apply(Term t) {
		return apply(null, ScopeTree.ROOT, t).second();
	}

	/**
	 * Normalise a sequence of terms, returning the original array when nothing
	 * changed.
	 *
	 * @param ts
	 * @return
	 */
	public Term[] apply(Term[] ts) {
		Term[] nts = ts;
		for (int i = 0; i != ts.length; ++i) {
			Term t = apply(ts[i]);
			if (t != ts[i]) {
				if (nts == ts) {
					nts = ts.clone();
				}
				nts[i] = t;
			}
		}
		return nts;
	}

	public Term.Block apply(Term.Block b) {
		return (Term.Block) apply((Term) b);
	}

	/**
	 * Get the replacement of every term which was rewritten.
	 *
	 * @return
	 */
	public Map<Term, Term> rewrites() {
		return Collections.unmodifiableMap(rewrites);
	}

	/**
	 * Record that a given term has been replaced.
	 *
	 * @param original
	 * @param replacement
	 * @return
	 */
	public <T extends Term> Pair<Void, Term> rewrite(Term original, T replacement) {
		if (original != replacement) {
			rewrites.put(original, replacement);
		}
		return new Pair<>(null, replacement);
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Term.Let t) {
		Term init = apply(t.initialiser());
		return rewrite(t, init == t.initialiser() ? t : new Term.Let(t.variable(), init, t.attributes()));
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Term.Assignment t) {
		Term rhs = apply(t.rightOperand());
		return rewrite(t, rhs == t.rightOperand() ? t : new Term.Assignment(t.variable(), rhs, t.attributes()));
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Term.Block t) {
		Term[] ts = t.toArray();
		Term[] nts = apply(ts);
		return rewrite(t, nts == ts ? t : new Term.Block(nts, t.attributes()));
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Term.Variable t) {
		return new Pair<>(null, t);
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Term.Binary t) {
		Term lhs = apply(t.leftOperand());
		Term rhs = apply(t.rightOperand());
		if (lhs == t.leftOperand() && rhs == t.rightOperand()) {
			return new Pair<>(null, t);
		}
		return rewrite(t, new Term.Binary(t.operator(), lhs, rhs, t.attributes()));
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Term.Unary t) {
		Term operand = apply(t.operand());
		return rewrite(t, operand == t.operand() ? t : new Term.Unary(t.operator(), operand, t.attributes()));
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Value.Integer t) {
		return new Pair<>(null, t);
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Value.Real t) {
		return new Pair<>(null, t);
	}

	@Override
	protected Pair<Void, Term> apply(Void state, int scope, Value.Bool t) {
		return new Pair<>(null, t);
	}

	/**
	 * Provides a specific extension mechanism for the normaliser.
	 *
	 * @author David J. Pearce
	 *
	 */
	public abstract static class Extension implements AbstractTransformer.Extension<Void, Term> {
		protected Normaliser self;
	}
}
