package com.github.micycle1.knotgraph.projection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.tinfour.common.IIncrementalTin;
import org.tinfour.common.Vertex;
import org.tinfour.standard.IncrementalTin;

/**
 * Delaunay triangulation of the projected crossing and node positions of a
 * view. The Delaunay graph contains every nearest-neighbour pair, so scanning
 * its edges yields the closest-feature separation of each point without an
 * all-pairs search.
 */
public class SeparationTriangulation {

	private final boolean triangulated;
	private final double[] nearest;

	/**
	 * @param xs projected x of each feature point
	 * @param ys projected y of each feature point
	 */
	public SeparationTriangulation(double[] xs, double[] ys) {
		if (xs.length != ys.length) {
			throw new IllegalArgumentException("Coordinate arrays differ in length: " + xs.length + " vs " + ys.length);
		}
		int n = xs.length;
		nearest = new double[n];
		Arrays.fill(nearest, Double.POSITIVE_INFINITY);

		IIncrementalTin tin = null;
		if (n >= 3) {
			List<Vertex> vertices = new ArrayList<>(n);
			for (int i = 0; i < n; i++) {
				vertices.add(new Vertex(xs[i], ys[i], 0.0, i));
			}
			tin = new IncrementalTin();
			tin.add(vertices, null);
			if (!tin.isBootstrapped() || countVertices(tin) < n) {
				// collinear or coincident input
				tin = null;
			}
		}
		triangulated = tin != null;
		if (!triangulated) {
			bruteForce(xs, ys);
			return;
		}
		tin.edges().forEach(e -> {
			Vertex a = e.getA();
			Vertex b = e.getB();
			if (a == null || b == null || a.isSynthetic() || b.isSynthetic()) {
				return;
			}
			double d = Math.hypot(a.getX() - b.getX(), a.getY() - b.getY());
			nearest[a.getIndex()] = Math.min(nearest[a.getIndex()], d);
			nearest[b.getIndex()] = Math.min(nearest[b.getIndex()], d);
		});
	}

	private static int countVertices(IIncrementalTin t) {
		int[] count = { 0 };
		t.vertices().forEach(v -> {
			if (!v.isSynthetic()) {
				count[0]++;
			}
		});
		return count[0];
	}

	private void bruteForce(double[] xs, double[] ys) {
		for (int i = 0; i < xs.length; i++) {
			for (int j = i + 1; j < xs.length; j++) {
				double d = Math.hypot(xs[i] - xs[j], ys[i] - ys[j]);
				nearest[i] = Math.min(nearest[i], d);
				nearest[j] = Math.min(nearest[j], d);
			}
		}
	}

	public int getVertexCount() {
		return nearest.length;
	}

	/** Whether a Delaunay triangulation was built (at least three non-collinear distinct points). */
	public boolean isTriangulated() {
		return triangulated;
	}

	/** Distance from point {@code v} to its closest other point; infinite for a lone point. */
	public double nearestSeparation(int v) {
		return nearest[v];
	}

	public double[] nearestSeparations() {
		return nearest.clone();
	}

	public double minimumSeparation() {
		double min = Double.POSITIVE_INFINITY;
		for (double d : nearest) {
			min = Math.min(min, d);
		}
		return min;
	}
}
