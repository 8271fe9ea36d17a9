package com.github.micycle1.knotgraph;

/**
 * A projection whose crossings cannot be resolved unambiguously: three or more
 * strands meet at one point, two strands tie in depth, segments overlap, or a
 * strand leaves a node with no usable direction. View searches discard such
 * candidates.
 */
public class DegenerateViewException extends KnotGraphException {

	private static final long serialVersionUID = 1L;

	private final double x;
	private final double y;

	public DegenerateViewException(String message) {
		this(message, Double.NaN, Double.NaN);
	}

	public DegenerateViewException(String message, double x, double y) {
		super(Double.isNaN(x) ? message : message + " at (" + x + ", " + y + ")");
		this.x = x;
		this.y = y;
	}

	/** Projected x of the offending location, NaN when unknown. */
	public double getX() {
		return x;
	}

	/** Projected y of the offending location, NaN when unknown. */
	public double getY() {
		return y;
	}
}
