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

import rangecheck.util.SyntacticElement.Attribute;

/**
 * A structured description of a fatal analysis failure. Formatting these for
 * users is left to the reporting layer.
 */
public final class Diagnostic {
	private final String unit;
	private final Attribute.Source location;
	private final ErrorKind kind;
	private final String message;
	private final Attribute.Source conflicting;

	public Diagnostic(String unit, Attribute.Source location, ErrorKind kind, String message,
			Attribute.Source conflicting) {
		this.unit = unit;
		this.location = location == null ? Attribute.Source.UNKNOWN : location;
		this.kind = Objects.requireNonNull(kind);
		this.message = message;
		this.conflicting = conflicting;
	}

	/**
	 * Name of the compilation unit this diagnostic belongs to (may be null).
	 *
	 * @return
	 */
	public String unit() {
		return unit;
	}

	public Attribute.Source location() {
		return location;
	}

	public ErrorKind kind() {
		return kind;
	}

	public String message() {
		return message;
	}

	/**
	 * The location of a prior statement this failure conflicts with, such as the
	 * original declaration of a name or the loop owning an iterator.
	 *
	 * @return null if there is no such statement.
	 */
	public Attribute.Source conflictingLocation() {
		return conflicting;
	}

	/**
	 * Attach the name of the unit in which this diagnostic arose.
	 *
	 * @param unit
	 * @return
	 */
	public Diagnostic inUnit(String unit) {
		return new Diagnostic(unit, location, kind, message, conflicting);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Diagnostic) {
			Diagnostic d = (Diagnostic) o;
			return Objects.equals(unit, d.unit) && location.equals(d.location) && kind == d.kind
					&& Objects.equals(message, d.message) && Objects.equals(conflicting, d.conflicting);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(unit, location, kind, message, conflicting);
	}

	@Override
	public String toString() {
		String r = kind + "@" + location + ": " + message;
		if (conflicting != null) {
			r += " (see " + conflicting + ")";
		}
		return r;
	}
}
