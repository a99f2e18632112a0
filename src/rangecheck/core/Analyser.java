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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rangecheck.extensions.ArrayBoundResolver;
import rangecheck.extensions.Arrays;
import rangecheck.extensions.ControlFlow;
import rangecheck.extensions.Functions;
import rangecheck.extensions.Functions.Syntax.FunctionDeclaration;
import rangecheck.extensions.Functions.Syntax.Unit;
import rangecheck.util.AnalysisError;

/**
 * Analyses a set of units. Each unit is normalised, its functions are analysed
 * in turn (first inferring ranges, then resolving arrays), and the facts
 * established are gathered into an annotated program. Units are analysed in
 * parallel, except that no unit is started before the units it depends on are
 * complete.
 *
 * @author David J. Pearce
 *
 */
public class Analyser {
	private static final Logger LOGGER = LoggerFactory.getLogger(Analyser.class);
	public final static String UNKNOWN_UNIT = "unknown or failed dependency";
	public final static String CYCLIC_DEPENDENCY = "cyclic dependency";

	private final Options options;

	public Analyser(Options options) {
		this.options = options;
	}

	/**
	 * Analyse a given set of units.
	 *
	 * @param units
	 * @return One result for each unit, in the order given.
	 * @throws InterruptedException
	 * @throws ExecutionException
	 */
	public List<AnalysisResult> analyse(List<Unit> units) throws InterruptedException, ExecutionException {
		LinkedHashMap<String, Unit> pending = new LinkedHashMap<>();
		for (Unit u : units) {
			if (pending.put(u.getName(), u) != null) {
				throw new IllegalArgumentException("duplicate unit " + u.getName());
			}
		}
		HashSet<String> names = new HashSet<>(pending.keySet());
		HashMap<String, AnalysisResult> results = new HashMap<>();
		ExecutorService executor = Executors.newFixedThreadPool(options.getThreads());
		try {
			while (!pending.isEmpty()) {
				// Determine next wave
				ArrayList<Unit> wave = new ArrayList<>();
				boolean failed = false;
				for (Unit u : new ArrayList<>(pending.values())) {
					boolean ready = true;
					for (String d : u.getDependencies()) {
						AnalysisResult r = results.get(d);
						if (!names.contains(d) || (r != null && !r.isSuccess())) {
							results.put(u.getName(), failure(u, UNKNOWN_UNIT));
							pending.remove(u.getName());
							failed = true;
							ready = false;
							break;
						} else if (r == null) {
							ready = false;
						}
					}
					if (ready) {
						wave.add(u);
					}
				}
				if (wave.isEmpty()) {
					if (!failed) {
						// Everything remaining waits on something else remaining
						for (Unit u : pending.values()) {
							results.put(u.getName(), failure(u, CYCLIC_DEPENDENCY));
						}
						pending.clear();
					}
					continue;
				}
				LOGGER.debug("analysing {} unit(s) in parallel", wave.size());
				// Submit wave for processing
				ArrayList<Future<AnalysisResult>> threads = new ArrayList<>();
				for (Unit u : wave) {
					pending.remove(u.getName());
					List<AnnotatedProgram> dependencies = new ArrayList<>();
					for (String d : u.getDependencies()) {
						dependencies.add(results.get(d).program());
					}
					threads.add(executor.submit(() -> analyse(u, dependencies)));
				}
				// Join all back together
				for (int i = 0; i != wave.size(); ++i) {
					results.put(wave.get(i).getName(), threads.get(i).get());
				}
			}
		} finally {
			executor.shutdown();
		}
		ArrayList<AnalysisResult> rs = new ArrayList<>();
		for (Unit u : units) {
			rs.add(results.get(u.getName()));
		}
		return rs;
	}

	/**
	 * Analyse a single unit whose dependencies have been analysed.
	 *
	 * @param unit
	 * @param dependencies
	 * @return
	 */
	public AnalysisResult analyse(Unit unit, List<AnnotatedProgram> dependencies) {
		String name = unit.getName();
		LOGGER.debug("analysing unit {}", name);
		try {
			Functions.Normalisation fns = new Functions.Normalisation();
			Normaliser normaliser = new Normaliser(new ControlFlow.Normalisation(), new Arrays.Normalisation(), fns);
			Unit normalised = fns.apply(unit);
			FunctionDeclaration[] decls = normalised.getFunctions();
			HashMap<String, FunctionDeclaration> declared = new HashMap<>();
			for (FunctionDeclaration f : decls) {
				FunctionDeclaration g = declared.put(f.getName(), f);
				if (g != null) {
					AnalysisError.analysisError(ErrorKind.NameCollision, Functions.DUPLICATE_FUNCTION, f, g);
				}
			}
			FactTable facts = new FactTable();
			Functions.Checker checker = new Functions.Checker(options, new ScopeTree(), facts, new ControlFlow.Typing(),
					new Arrays.Typing(), new Functions.Typing(decls, dependencies));
			ArrayBoundResolver resolver = new ArrayBoundResolver(facts);
			LinkedHashMap<String, FunctionSummary> summaries = new LinkedHashMap<>();
			for (FunctionDeclaration f : decls) {
				summaries.put(f.getName(), checker.apply(f));
				resolver.apply(facts.drainFlagged());
			}
			LOGGER.debug("unit {} analysed", name);
			return new AnalysisResult(new AnnotatedProgram(name, facts, summaries, normaliser.rewrites()));
		} catch (AnalysisError e) {
			LOGGER.debug("unit {} failed: {}", name, e.diagnostic());
			return new AnalysisResult(e.diagnostic().inUnit(name));
		}
	}

	private static AnalysisResult failure(Unit u, String msg) {
		return new AnalysisResult(
				new Diagnostic(u.getName(), AnalysisError.sourceOf(u), ErrorKind.UnresolvedIdentifier, msg, null));
	}
}
