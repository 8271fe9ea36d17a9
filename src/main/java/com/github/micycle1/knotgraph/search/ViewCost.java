package com.github.micycle1.knotgraph.search;

import com.github.micycle1.knotgraph.graph.Point3;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.projection.ProjectedView;

/**
 * <p>
 * Cost of a projected view:
 * </p>
 *
 * <pre>
 * crossings + crowdingWeight * sum(max(0, 1 - d / dRef)) + shortSegmentWeight * sum(max(0, 1 - l / lRef))
 * </pre>
 * <p>
 * where {@code d} runs over the nearest-feature separation of every crossing
 * and node (from a Delaunay triangulation of their projected positions) and
 * {@code l} over the projected segment lengths. The reference distances are
 * fractions of the graph's bounding-box diagonal, so the cost does not depend
 * on the physical scale of the input. Degenerate views score
 * {@link Double#POSITIVE_INFINITY} in the searches.
 * </p>
 */
public final class ViewCost {

	private final double crowdingWeight;
	private final double crowdingFraction;
	private final double shortSegmentWeight;
	private final double shortSegmentFraction;

	public ViewCost() {
		this(0.5, 0.02, 0.1, 0.005);
	}

	public ViewCost(double crowdingWeight, double crowdingFraction, double shortSegmentWeight, double shortSegmentFraction) {
		if (crowdingWeight < 0 || shortSegmentWeight < 0) {
			throw new IllegalArgumentException("Penalty weights must be >= 0");
		}
		if (!(crowdingFraction > 0) || !(shortSegmentFraction > 0)) {
			throw new IllegalArgumentException("Reference fractions must be > 0");
		}
		this.crowdingWeight = crowdingWeight;
		this.crowdingFraction = crowdingFraction;
		this.shortSegmentWeight = shortSegmentWeight;
		this.shortSegmentFraction = shortSegmentFraction;
	}

	public double score(ProjectedView view) {
		double scale = diagonal(view.getGraph());
		double cost = view.crossingCount();
		if (scale == 0) {
			return cost;
		}
		if (crowdingWeight > 0) {
			double ref = crowdingFraction * scale;
			for (double d : view.getSeparations().nearestSeparations()) {
				if (d < ref) {
					cost += crowdingWeight * (1 - d / ref);
				}
			}
		}
		if (shortSegmentWeight > 0) {
			double ref = shortSegmentFraction * scale;
			for (double l : view.getSegmentLengths()) {
				if (l < ref) {
					cost += shortSegmentWeight * (1 - l / ref);
				}
			}
		}
		return cost;
	}

	static double diagonal(SpatialGraph graph) {
		double[] lo = { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };
		double[] hi = { Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY };
		for (SpatialGraph.Node n : graph.nodes()) {
			include(n.coordinate, lo, hi);
		}
		for (SpatialGraph.Edge e : graph.edges()) {
			for (Point3 p : e.polyline) {
				include(p, lo, hi);
			}
		}
		if (lo[0] > hi[0]) {
			return 0;
		}
		return Math.sqrt((hi[0] - lo[0]) * (hi[0] - lo[0]) + (hi[1] - lo[1]) * (hi[1] - lo[1]) + (hi[2] - lo[2]) * (hi[2] - lo[2]));
	}

	private static void include(Point3 p, double[] lo, double[] hi) {
		lo[0] = Math.min(lo[0], p.x);
		lo[1] = Math.min(lo[1], p.y);
		lo[2] = Math.min(lo[2], p.z);
		hi[0] = Math.max(hi[0], p.x);
		hi[1] = Math.max(hi[1], p.y);
		hi[2] = Math.max(hi[2], p.z);
	}

	public double getCrowdingWeight() {
		return crowdingWeight;
	}

	public double getShortSegmentWeight() {
		return shortSegmentWeight;
	}

	@Override
	public String toString() {
		return "ViewCost[crowding=" + crowdingWeight + "@" + crowdingFraction + ", short=" + shortSegmentWeight + "@" + shortSegmentFraction + "]";
	}
}
