package com.github.micycle1.knotgraph;

public final class MathUtil {

	private static final double TWO_PI = 2 * Math.PI;

	private MathUtil() {
	}

	/** Wraps an angle into {@code [0, 2pi)}. */
	public static double wrapAngle(double a) {
		double r = a % TWO_PI;
		return r < 0 ? r + TWO_PI : r;
	}

	// acos with the argument clipped to [-1, 1] against rounding drift
	public static double clampedAcos(double cos) {
		if (cos > 1.0) {
			cos = 1.0;
		} else if (cos < -1.0) {
			cos = -1.0;
		}
		return Math.acos(cos);
	}
}
