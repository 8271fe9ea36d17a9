package com.github.micycle1.knotgraph.projection;

import java.util.Arrays;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * <p>
 * 3x3 rotation built from an ordered triple of angles (radians) and an
 * {@link AxisOrder}. The first angle is applied first, so for order
 * {@code (a1, a2, a3)} the matrix is {@code R = R3(a3) * R2(a2) * R1(a1)}.
 * </p>
 * <p>
 * After rotation the view looks down the z axis: (x, y) is the projected
 * position and z the depth, with larger z nearer the viewer.
 * </p>
 */
public final class Rotation {

	private final double[] angles;
	private final AxisOrder order;
	private final DMatrixRMaj matrix;

	public Rotation(double a1, double a2, double a3, AxisOrder order) {
		this.angles = new double[] { a1, a2, a3 };
		this.order = Objects.requireNonNull(order, "order");
		for (double a : angles) {
			if (!Double.isFinite(a)) {
				throw new IllegalArgumentException("Rotation angles must be finite: " + a1 + ", " + a2 + ", " + a3);
			}
		}
		DMatrixRMaj r = CommonOps_DDRM.identity(3);
		DMatrixRMaj tmp = new DMatrixRMaj(3, 3);
		for (int step = 0; step < 3; step++) {
			CommonOps_DDRM.mult(elementary(order.axis(step), angles[step]), r, tmp);
			r.setTo(tmp);
		}
		this.matrix = r;
	}

	public static Rotation identity() {
		return new Rotation(0, 0, 0, AxisOrder.ZYX);
	}

	/**
	 * Rotation in {@link AxisOrder#YXZ} order, whose last (z) angle only spins
	 * the projection plane and so leaves the crossing structure unchanged.
	 */
	public static Rotation view(double yAngle, double xAngle, double inPlane) {
		return new Rotation(yAngle, xAngle, inPlane, AxisOrder.YXZ);
	}

	public double angle(int i) {
		return angles[i];
	}

	public double[] getAngles() {
		return angles.clone();
	}

	public AxisOrder getOrder() {
		return order;
	}

	/** Copy of the 3x3 matrix. */
	public DMatrixRMaj getMatrix() {
		return matrix.copy();
	}

	/**
	 * Rotates a 3xN matrix of column points, returning a new 3xN matrix.
	 */
	public DMatrixRMaj apply(DMatrixRMaj points) {
		if (points.numRows != 3) {
			throw new IllegalArgumentException("Expected a 3xN point matrix, got " + points.numRows + "x" + points.numCols);
		}
		DMatrixRMaj out = new DMatrixRMaj(3, points.numCols);
		CommonOps_DDRM.mult(matrix, points, out);
		return out;
	}

	private static DMatrixRMaj elementary(int axis, double a) {
		double c = Math.cos(a), s = Math.sin(a);
		switch (axis) {
			case 0:
				return new DMatrixRMaj(new double[][] { { 1, 0, 0 }, { 0, c, -s }, { 0, s, c } });
			case 1:
				return new DMatrixRMaj(new double[][] { { c, 0, s }, { 0, 1, 0 }, { -s, 0, c } });
			case 2:
				return new DMatrixRMaj(new double[][] { { c, -s, 0 }, { s, c, 0 }, { 0, 0, 1 } });
			default:
				throw new IllegalArgumentException("Unexpected axis: " + axis);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Rotation)) {
			return false;
		}
		Rotation o = (Rotation) obj;
		return order == o.order && Arrays.equals(angles, o.angles);
	}

	@Override
	public int hashCode() {
		return 31 * order.hashCode() + Arrays.hashCode(angles);
	}

	@Override
	public String toString() {
		return String.format("Rotation[%s: %.6f, %.6f, %.6f]", order, angles[0], angles[1], angles[2]);
	}
}
