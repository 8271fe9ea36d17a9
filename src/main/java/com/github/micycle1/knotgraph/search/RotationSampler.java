package com.github.micycle1.knotgraph.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.github.micycle1.knotgraph.MathUtil;
import com.github.micycle1.knotgraph.projection.AxisOrder;
import com.github.micycle1.knotgraph.projection.Rotation;

/**
 * View rotations spread over the sphere of view directions. Rotations use
 * {@link AxisOrder#YXZ} with the final in-plane angle fixed at 0, since
 * spinning the projection plane never changes the diagram. The first angle is
 * the longitude and the second the latitude of the view direction.
 */
public final class RotationSampler {

	private static final double GOLDEN_ANGLE = Math.PI * (3 - Math.sqrt(5));

	private RotationSampler() {
	}

	/** {@code count} directions drawn uniformly on the sphere. */
	public static List<Rotation> random(int count, Random rnd) {
		if (rnd == null) {
			rnd = new Random();
		}
		List<Rotation> out = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			double y = 2 * rnd.nextDouble() - 1;
			out.add(direction(rnd.nextDouble() * 2 * Math.PI, y));
		}
		return out;
	}

	/** {@code count} nearly evenly spaced directions on a Fibonacci spiral. */
	public static List<Rotation> even(int count) {
		List<Rotation> out = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			double y = 1 - (2.0 * i + 1) / count;
			out.add(direction(MathUtil.wrapAngle(i * GOLDEN_ANGLE), y));
		}
		return out;
	}

	/** Three independent uniform angles in the given order, for unconstrained searches. */
	public static Rotation uniform(Random rnd, AxisOrder order) {
		double twoPi = 2 * Math.PI;
		return new Rotation(rnd.nextDouble() * twoPi, rnd.nextDouble() * twoPi, rnd.nextDouble() * twoPi, order);
	}

	private static Rotation direction(double longitude, double y) {
		double latitude = Math.PI / 2 - MathUtil.clampedAcos(y);
		return Rotation.view(longitude, latitude, 0);
	}
}
