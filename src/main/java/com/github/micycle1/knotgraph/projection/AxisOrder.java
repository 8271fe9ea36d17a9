package com.github.micycle1.knotgraph.projection;

/**
 * Order in which the three angles of a {@link Rotation} are applied. {@code ZYX}
 * rotates about Z by the first angle, then about Y by the second, then about X
 * by the third.
 */
public enum AxisOrder {
	XYZ, XZY, YXZ, YZX, ZXY, ZYX;

	/** Axis index (0 = x, 1 = y, 2 = z) of the i-th rotation step. */
	public int axis(int step) {
		return name().charAt(step) - 'X';
	}
}
