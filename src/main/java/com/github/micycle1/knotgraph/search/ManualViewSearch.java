package com.github.micycle1.knotgraph.search;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.DegenerateViewException;
import com.github.micycle1.knotgraph.ExhaustedSearchException;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.projection.ProjectedView;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;
import com.github.micycle1.knotgraph.yamada.YamadaEvaluator;

/**
 * Caller-controlled views. For graphs with nodes of degree above three the
 * Yamada polynomial depends on the diagram, so only explicitly supplied
 * rotations are used.
 */
public class ManualViewSearch {

	private static final Logger log = LoggerFactory.getLogger(ManualViewSearch.class);

	private final Projector projector;
	private final ViewCost cost;

	public ManualViewSearch(Projector projector, ViewCost cost) {
		this.projector = Objects.requireNonNull(projector, "projector");
		this.cost = Objects.requireNonNull(cost, "cost");
	}

	/**
	 * @throws DegenerateViewException if the rotation gives a degenerate view
	 */
	public ScoredView view(SpatialGraph graph, Rotation rotation) {
		ProjectedView view = projector.project(graph, rotation);
		return new ScoredView(view, cost.score(view));
	}

	/**
	 * Lowest-cost valid view among the candidates.
	 *
	 * @throws ExhaustedSearchException if every candidate is degenerate
	 */
	public ScoredView best(SpatialGraph graph, List<Rotation> candidates) {
		ScoredView best = null;
		for (Rotation r : candidates) {
			try {
				ScoredView s = view(graph, r);
				if (best == null || s.cost < best.cost) {
					best = s;
				}
			} catch (DegenerateViewException e) {
				log.debug("Candidate {} is degenerate: {}", r, e.getMessage());
			}
		}
		if (best == null) {
			log.warn("All {} candidate views of {} are degenerate", candidates.size(), graph);
			throw new ExhaustedSearchException("No valid view among candidates", candidates.size());
		}
		return best;
	}

	/** Evaluates the polynomial of the lowest-cost valid candidate view. */
	public YamadaResult evaluate(SpatialGraph graph, List<Rotation> candidates, YamadaEvaluator evaluator) {
		ScoredView s = best(graph, candidates);
		YamadaResult.Candidate c = new YamadaResult.Candidate(s.view, evaluator.evaluate(s.view.getCode()));
		log.info("Manual view {} of {}: {}", s.view.getRotation(), graph, c.polynomial);
		return new YamadaResult(YamadaResult.Status.MANUAL, c, List.of(c));
	}
}
