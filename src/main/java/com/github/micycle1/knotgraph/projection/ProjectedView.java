package com.github.micycle1.knotgraph.projection;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.github.micycle1.knotgraph.graph.SpatialGraph;

/**
 * Result of projecting a spatial graph under one rotation: the planar diagram
 * code together with the geometry needed to score the view.
 */
public final class ProjectedView {

	private final SpatialGraph graph;
	private final Rotation rotation;
	private final PlanarDiagramCode code;
	private final List<Arc> arcs;
	private final List<Crossing> crossings;
	private final Map<Integer, double[]> nodePositions;
	private final double[] segmentLengths;
	private SeparationTriangulation separations;

	ProjectedView(SpatialGraph graph, Rotation rotation, PlanarDiagramCode code, List<Arc> arcs, List<Crossing> crossings, Map<Integer, double[]> nodePositions,
			double[] segmentLengths) {
		this.graph = graph;
		this.rotation = rotation;
		this.code = code;
		this.arcs = Collections.unmodifiableList(arcs);
		this.crossings = Collections.unmodifiableList(crossings);
		this.nodePositions = Collections.unmodifiableMap(nodePositions);
		this.segmentLengths = segmentLengths;
	}

	public SpatialGraph getGraph() {
		return graph;
	}

	public Rotation getRotation() {
		return rotation;
	}

	public PlanarDiagramCode getCode() {
		return code;
	}

	public List<Arc> getArcs() {
		return arcs;
	}

	public List<Crossing> getCrossings() {
		return crossings;
	}

	public int crossingCount() {
		return crossings.size();
	}

	/** Projected (x, y) of each node, keyed by node id. */
	public Map<Integer, double[]> getNodePositions() {
		return nodePositions;
	}

	/** Projected lengths of all non-degenerate polyline segments. */
	public double[] getSegmentLengths() {
		return segmentLengths.clone();
	}

	/**
	 * Triangulation over crossings (indices {@code 0..c-1}) followed by nodes in
	 * id order. Built on first use.
	 */
	public synchronized SeparationTriangulation getSeparations() {
		if (separations == null) {
			int c = crossings.size();
			double[] xs = new double[c + nodePositions.size()];
			double[] ys = new double[xs.length];
			for (int i = 0; i < c; i++) {
				xs[i] = crossings.get(i).x;
				ys[i] = crossings.get(i).y;
			}
			int i = c;
			for (SpatialGraph.Node n : graph.nodes()) {
				double[] p = nodePositions.get(n.id);
				xs[i] = p[0];
				ys[i] = p[1];
				i++;
			}
			separations = new SeparationTriangulation(xs, ys);
		}
		return separations;
	}

	@Override
	public String toString() {
		return "ProjectedView[" + rotation + ", " + crossings.size() + " crossings: " + code + "]";
	}
}
