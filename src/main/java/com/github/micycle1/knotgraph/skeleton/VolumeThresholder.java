package com.github.micycle1.knotgraph.skeleton;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.MalformedVolumeException;

/**
 * <p>
 * Binarises a sampled scalar magnitude grid (values {@code |f|} supplied by the
 * external field evaluator on a regular grid spanning {@code [min, max]} per
 * axis) into a {@link BinaryVolume}.
 * </p>
 * <ul>
 * <li>Solid mode: voxels with {@code |f| <= thickness}; the thickness is
 * floored to {@code 10 / pointsPerDimension} so a zero set always has some
 * volume.</li>
 * <li>Shell mode ({@code epsilon > 0}): voxels with
 * {@code abs(|f| - thickness) < epsilon}.</li>
 * </ul>
 */
public final class VolumeThresholder {

	private static final Logger log = LoggerFactory.getLogger(VolumeThresholder.class);

	private final int[] dims;
	private final double[] min;
	private final double[] max;

	/**
	 * @param dims samples per axis (x, y, z), each at least 2
	 * @param min  lower grid bound per axis
	 * @param max  upper grid bound per axis
	 */
	public VolumeThresholder(int[] dims, double[] min, double[] max) {
		if (dims == null || min == null || max == null || dims.length != 3 || min.length != 3 || max.length != 3) {
			throw new IllegalArgumentException("dims, min and max need three components");
		}
		for (int a = 0; a < 3; a++) {
			if (dims[a] < 2 || !(max[a] > min[a])) {
				throw new IllegalArgumentException("Bad extent on axis " + a + ": " + dims[a] + " samples over [" + min[a] + ", " + max[a] + "]");
			}
		}
		this.dims = dims.clone();
		this.min = min.clone();
		this.max = max.clone();
	}

	/** Cube grid with the same extent and sample count on every axis. */
	public static VolumeThresholder cube(int pointsPerDimension, double lo, double hi) {
		return new VolumeThresholder(new int[] { pointsPerDimension, pointsPerDimension, pointsPerDimension }, new double[] { lo, lo, lo }, new double[] { hi, hi, hi });
	}

	public BinaryVolume solid(double[] magnitudes, double thickness) {
		return binarize(magnitudes, thickness, 0);
	}

	public BinaryVolume shell(double[] magnitudes, double thickness, double epsilon) {
		if (!(epsilon > 0)) {
			throw new IllegalArgumentException("Shell mode needs a positive epsilon: " + epsilon);
		}
		return binarize(magnitudes, thickness, epsilon);
	}

	private BinaryVolume binarize(double[] magnitudes, double thickness, double epsilon) {
		int n = dims[0] * dims[1] * dims[2];
		if (magnitudes == null || magnitudes.length != n) {
			throw new MalformedVolumeException("Expected " + n + " samples for grid " + Arrays.toString(dims));
		}
		boolean[] occ = new boolean[n];
		double t = thickness;
		if (epsilon <= 0) {
			double floor = 10.0 / Math.max(dims[0], Math.max(dims[1], dims[2]));
			if (t < floor) {
				t = floor;
			}
		}
		int count = 0;
		for (int i = 0; i < n; i++) {
			double m = Math.abs(magnitudes[i]);
			boolean in = epsilon > 0 ? Math.abs(m - t) < epsilon : m <= t;
			occ[i] = in;
			if (in) {
				count++;
			}
		}
		if (count == 0) {
			throw new MalformedVolumeException("No voxel passes the threshold (thickness=" + t + ", epsilon=" + epsilon + ")");
		}
		log.debug("Thresholded {} of {} voxels (thickness={}, epsilon={})", count, n, t, epsilon);
		double[] spacing = new double[3];
		for (int a = 0; a < 3; a++) {
			spacing[a] = (max[a] - min[a]) / (dims[a] - 1);
		}
		return new BinaryVolume(dims[0], dims[1], dims[2], occ, spacing, min);
	}
}
