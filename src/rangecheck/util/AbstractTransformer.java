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

import rangecheck.core.Syntax;
import rangecheck.core.Syntax.Term;
import rangecheck.core.Syntax.Value;

/**
 * Dispatches each core term to a dedicated method, handing any term it does not
 * recognise to a list of extensions. The first extension producing a result
 * wins.
 *
 * @param <T> The state threaded through the transformation (e.g. an
 *        environment).
 * @param <S> The result of transforming a single term (e.g. its type).
 * @param <E> The kind of extension supported.
 */
public abstract class AbstractTransformer<T, S, E extends AbstractTransformer.Extension<T, S>> {
	/**
	 * The set of available extensions for this transformer.
	 */
	private final E[] extensions;

	@SafeVarargs
	public AbstractTransformer(E... extensions) {
		this.extensions = extensions;
	}

	/**
	 * Get the extensions registered with this transformer.
	 *
	 * @return
	 */
	protected E[] extensions() {
		return extensions;
	}

	public Pair<T, S> apply(T state, int scope, Term term) {
		switch(term.getOpcode()) {
		case Syntax.TERM_let:
			return apply(state, scope, (Term.Let) term);
		case Syntax.TERM_assignment:
			return apply(state, scope, (Term.Assignment) term);
		case Syntax.TERM_block:
			return apply(state, scope, (Term.Block) term);
		case Syntax.TERM_variable:
			return apply(state, scope, (Term.Variable) term);
		case Syntax.TERM_binary:
			return apply(state, scope, (Term.Binary) term);
		case Syntax.TERM_unary:
			return apply(state, scope, (Term.Unary) term);
		case Syntax.TERM_integer:
			return apply(state, scope, (Value.Integer) term);
		case Syntax.TERM_real:
			return apply(state, scope, (Value.Real) term);
		case Syntax.TERM_bool:
			return apply(state, scope, (Value.Bool) term);
		}
		// Attempt to run extensions
		for(int i=0;i!=extensions.length;++i) {
			Pair<T,S> r = extensions[i].apply(state, scope, term);
			if(r != null) {
				return r;
			}
		}
		// Give up
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	/**
	 * Apply this transformer to a given let statement.
	 *
	 * @param state The current state (e.g. typing environment)
	 * @param scope The enclosing scope of this term
	 * @param term  The term being transformed.
	 * @return
	 */
	protected abstract Pair<T, S> apply(T state, int scope, Term.Let term);

	/**
	 * Apply this transformer to a given assignment statement.
	 *
	 * @param state The current state (e.g. typing environment)
	 * @param scope The enclosing scope of this term
	 * @param term  The term being transformed.
	 * @return
	 */
	protected abstract Pair<T, S> apply(T state, int scope, Term.Assignment term);

	/**
	 * Apply this transformer to a given block statement.
	 *
	 * @param state The current state (e.g. typing environment)
	 * @param scope The enclosing scope of this term
	 * @param term  The term being transformed.
	 * @return
	 */
	protected abstract Pair<T, S> apply(T state, int scope, Term.Block term);

	protected abstract Pair<T, S> apply(T state, int scope, Term.Variable term);

	protected abstract Pair<T, S> apply(T state, int scope, Term.Binary term);

	protected abstract Pair<T, S> apply(T state, int scope, Term.Unary term);

	protected abstract Pair<T, S> apply(T state, int scope, Value.Integer value);

	protected abstract Pair<T, S> apply(T state, int scope, Value.Real value);

	protected abstract Pair<T, S> apply(T state, int scope, Value.Bool value);

	/**
	 * Provides a mechanism by which a transformer can be extended.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Extension<T,S> {
		/**
		 * Transform a term this extension understands.
		 *
		 * @return null if this extension does not recognise the term.
		 */
		abstract Pair<T, S> apply(T state, int scope, Term term);
	}
}
