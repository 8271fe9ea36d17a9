package com.github.micycle1.knotgraph.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.DegenerateViewException;
import com.github.micycle1.knotgraph.ExhaustedSearchException;
import com.github.micycle1.knotgraph.Workers;
import com.github.micycle1.knotgraph.graph.GraphSimplifier;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.projection.ProjectedView;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;
import com.github.micycle1.knotgraph.yamada.LaurentPolynomial;
import com.github.micycle1.knotgraph.yamada.YamadaEvaluator;

/**
 * <p>
 * Yamada evaluation for trivalent graphs, where the polynomial is an isotopy
 * invariant and any two valid views must agree.
 * </p>
 * <p>
 * Samples {@code samples} view directions, drops degenerate ones and ranks the
 * rest by crossing count, then cost. The two best views are evaluated
 * concurrently; if they agree the result is returned at once. Otherwise further
 * views are evaluated in rank order until one agrees with an earlier view. If
 * none does, the result is {@link YamadaResult.Status#AMBIGUOUS} and carries
 * every evaluated pair.
 * </p>
 */
public class TrivalentViewSearch {

	private static final Logger log = LoggerFactory.getLogger(TrivalentViewSearch.class);

	private final Projector projector;
	private final ViewCost cost;
	private final YamadaEvaluator evaluator;

	private int samples = 50;
	private boolean randomSampling = false;
	private long seed = 0;

	public TrivalentViewSearch(Projector projector, ViewCost cost, YamadaEvaluator evaluator) {
		this.projector = Objects.requireNonNull(projector, "projector");
		this.cost = Objects.requireNonNull(cost, "cost");
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
	}

	public void setSamples(int samples) {
		if (samples < 1) {
			throw new IllegalArgumentException("Samples must be >= 1: " + samples);
		}
		this.samples = samples;
	}

	public int getSamples() {
		return samples;
	}

	/** Uniform random directions from {@link #setSeed(long)} instead of a Fibonacci spiral. */
	public void setRandomSampling(boolean randomSampling) {
		this.randomSampling = randomSampling;
	}

	public void setSeed(long seed) {
		this.seed = seed;
	}

	/**
	 * @throws IllegalArgumentException if the graph is not trivalent
	 * @throws ExhaustedSearchException if every sampled view is degenerate
	 */
	public YamadaResult evaluate(SpatialGraph graph) {
		if (!GraphSimplifier.isTrivalent(graph)) {
			throw new IllegalArgumentException("Graph has a node of degree " + graph.maxDegree() + "; use a manual view");
		}
		List<Rotation> rotations = randomSampling ? RotationSampler.random(samples, new Random(seed)) : RotationSampler.even(samples);
		List<ScoredView> valid = new ArrayList<>();
		for (Rotation r : rotations) {
			try {
				ProjectedView view = projector.project(graph, r);
				valid.add(new ScoredView(view, cost.score(view)));
			} catch (DegenerateViewException e) {
				log.debug("Discarding degenerate view {}: {}", r, e.getMessage());
			}
		}
		if (valid.isEmpty()) {
			log.warn("All {} sampled views of {} are degenerate", samples, graph);
			throw new ExhaustedSearchException("No valid view among sampled rotations", samples);
		}
		valid.sort(ScoredView.BY_CROSSINGS);

		List<YamadaResult.Candidate> evaluated = new ArrayList<>();
		int head = Math.min(2, valid.size());
		List<Callable<LaurentPolynomial>> tasks = new ArrayList<>(head);
		for (int i = 0; i < head; i++) {
			ProjectedView view = valid.get(i).view;
			tasks.add(() -> evaluator.evaluate(view.getCode()));
		}
		List<LaurentPolynomial> polys = Workers.invokeAll(tasks, head);
		for (int i = 0; i < head; i++) {
			evaluated.add(new YamadaResult.Candidate(valid.get(i).view, polys.get(i)));
		}
		if (head == 1) {
			log.info("Only one valid view of {}: {}", graph, polys.get(0));
			return new YamadaResult(YamadaResult.Status.SINGLE_VIEW, evaluated.get(0), evaluated);
		}
		if (agree(polys.get(0), polys.get(1))) {
			log.info("Top two views of {} agree: {}", graph, polys.get(0));
			return new YamadaResult(YamadaResult.Status.AGREED, evaluated.get(0), evaluated);
		}
		for (int i = 2; i < valid.size(); i++) {
			ProjectedView view = valid.get(i).view;
			LaurentPolynomial p = evaluator.evaluate(view.getCode());
			YamadaResult.Candidate next = new YamadaResult.Candidate(view, p);
			for (YamadaResult.Candidate earlier : evaluated) {
				if (agree(earlier.polynomial, p)) {
					evaluated.add(next);
					log.info("Views agree after {} evaluations of {}: {}", evaluated.size(), graph, p);
					return new YamadaResult(YamadaResult.Status.AGREED, earlier, evaluated);
				}
			}
			evaluated.add(next);
		}
		log.warn("{} views of {} gave {} disagreeing polynomials", valid.size(), graph, evaluated.size());
		return new YamadaResult(YamadaResult.Status.AMBIGUOUS, null, evaluated);
	}

	private static boolean agree(LaurentPolynomial a, LaurentPolynomial b) {
		return a.normalized().equals(b.normalized());
	}
}
