package com.github.micycle1.knotgraph.projection;

/**
 * A transverse crossing of two projected strands.
 */
public final class Crossing {

	public final int id;
	public final double x;
	public final double y;
	public final int overEdge;
	public final int underEdge;
	public final double overDepth;
	public final double underDepth;
	private final PlanarDiagramCode.Token token;

	Crossing(int id, double x, double y, int overEdge, int underEdge, double overDepth, double underDepth, PlanarDiagramCode.Token token) {
		this.id = id;
		this.x = x;
		this.y = y;
		this.overEdge = overEdge;
		this.underEdge = underEdge;
		this.overDepth = overDepth;
		this.underDepth = underDepth;
		this.token = token;
	}

	/** The {@code X[a,b,c,d]} token: under-in, then counter-clockwise. */
	public PlanarDiagramCode.Token token() {
		return token;
	}

	public int underIn() {
		return token.arc(0);
	}

	public int underOut() {
		return token.arc(2);
	}

	@Override
	public String toString() {
		return "Crossing[" + id + " " + token + " @ (" + x + ", " + y + ")]";
	}
}
