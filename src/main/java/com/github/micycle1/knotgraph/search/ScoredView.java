package com.github.micycle1.knotgraph.search;

import java.util.Comparator;

import com.github.micycle1.knotgraph.projection.ProjectedView;

/** A valid view and its {@link ViewCost}. */
public final class ScoredView {

	/** Fewest crossings first, then lowest cost. */
	public static final Comparator<ScoredView> BY_CROSSINGS = Comparator.comparingInt((ScoredView s) -> s.view.crossingCount()).thenComparingDouble(s -> s.cost);

	public final ProjectedView view;
	public final double cost;

	public ScoredView(ProjectedView view, double cost) {
		this.view = view;
		this.cost = cost;
	}

	@Override
	public String toString() {
		return "ScoredView[cost=" + cost + ", " + view + "]";
	}
}
