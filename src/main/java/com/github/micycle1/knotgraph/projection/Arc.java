package com.github.micycle1.knotgraph.projection;

/**
 * Piece of a projected edge between two consecutive events along it (a node
 * or a crossing), with the projected polyline and its depth profile.
 */
public final class Arc {

	public final int id;
	public final int edgeId;
	/** crossing the arc leaves, or -1 when it starts at a node */
	public final int startCrossing;
	/** crossing the arc enters, or -1 when it ends at a node */
	public final int endCrossing;
	private final double[] xs;
	private final double[] ys;
	private final double[] depths;

	Arc(int id, int edgeId, int startCrossing, int endCrossing, double[] xs, double[] ys, double[] depths) {
		this.id = id;
		this.edgeId = edgeId;
		this.startCrossing = startCrossing;
		this.endCrossing = endCrossing;
		this.xs = xs;
		this.ys = ys;
		this.depths = depths;
	}

	public int pointCount() {
		return xs.length;
	}

	public double x(int i) {
		return xs[i];
	}

	public double y(int i) {
		return ys[i];
	}

	public double depth(int i) {
		return depths[i];
	}

	/** Length of the projected polyline. */
	public double projectedLength() {
		double len = 0;
		for (int i = 1; i < xs.length; i++) {
			len += Math.hypot(xs[i] - xs[i - 1], ys[i] - ys[i - 1]);
		}
		return len;
	}

	@Override
	public String toString() {
		return "Arc[" + id + " on edge " + edgeId + ", " + xs.length + " pts]";
	}
}
