package com.github.micycle1.knotgraph;

import java.util.ArrayList;
import java.util.List;

import com.github.micycle1.knotgraph.graph.Point3;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.yamada.LaurentPolynomial;

/**
 * Spatial graph fixtures shared by the tests, with their normalised Yamada
 * polynomials.
 */
public final class TestGraphs {

	public static final LaurentPolynomial UNKNOT = LaurentPolynomial.parse("A^2 + A + 1");
	public static final LaurentPolynomial THETA = LaurentPolynomial.parse("A^4 + A^3 + 2*A^2 + A + 1");
	public static final LaurentPolynomial HOPF = LaurentPolynomial.parse("A^8 + A^7 + A^6 + A^5 + A^4 + A^3 + A^2 + A + 1");
	public static final LaurentPolynomial HANDCUFF = LaurentPolynomial.parse("-A^9 - A^8 - A^7 - A^6 + A^3 + A^2 + A + 1");
	public static final LaurentPolynomial TREFOIL = LaurentPolynomial.parse("A^11 + A^10 + A^9 + A^8 + A^7 - A^4 - A^3 - A^2 + 1");
	public static final LaurentPolynomial MIRROR_TREFOIL = LaurentPolynomial.parse("A^11 - A^9 - A^8 - A^7 + A^4 + A^3 + A^2 + A + 1");

	private TestGraphs() {
	}

	/**
	 * Closed regular polygon of n points around c in the plane spanned by u and
	 * v, starting at the given phase; the first point is repeated at the end.
	 */
	public static List<Point3> circle(Point3 c, Point3 u, Point3 v, double r, int n, double phase) {
		List<Point3> pts = new ArrayList<>(n + 1);
		for (int k = 0; k < n; k++) {
			double a = phase + 2 * Math.PI * k / n;
			double cos = Math.cos(a), sin = Math.sin(a);
			pts.add(new Point3(c.x + r * (cos * u.x + sin * v.x), c.y + r * (cos * u.y + sin * v.y), c.z + r * (cos * u.z + sin * v.z)));
		}
		pts.add(pts.get(0));
		return pts;
	}

	private static final Point3 ORIGIN = new Point3(0, 0, 0);
	private static final Point3 X = new Point3(1, 0, 0);
	private static final Point3 Y = new Point3(0, 1, 0);
	private static final Point3 Z = new Point3(0, 0, 1);

	/** Two linked unit circles, each a self-loop at one degree-2 node. */
	public static SpatialGraph hopf() {
		List<Point3> a = circle(ORIGIN, X, Y, 1, 16, 0.1);
		List<Point3> b = circle(X, X, Z, 1, 16, 0.23);
		return SpatialGraph.builder().addNode(0, a.get(0)).addNode(1, b.get(0)).addEdge(0, 0, a).addEdge(1, 1, b).build();
	}

	/** Two unlinked unit circles. */
	public static SpatialGraph unlink() {
		List<Point3> a = circle(ORIGIN, X, Y, 1, 16, 0.1);
		List<Point3> b = circle(new Point3(4, 0, 0), X, Z, 1, 16, 0.23);
		return SpatialGraph.builder().addNode(0, a.get(0)).addNode(1, b.get(0)).addEdge(0, 0, a).addEdge(1, 1, b).build();
	}

	/** (2,3) torus knot as a closed 48-gon with one node. */
	public static SpatialGraph trefoil() {
		return trefoil(false);
	}

	/** The trefoil reflected in the xy plane. */
	public static SpatialGraph mirrorTrefoil() {
		return trefoil(true);
	}

	private static SpatialGraph trefoil(boolean mirror) {
		int n = 48;
		List<Point3> pts = new ArrayList<>(n + 1);
		for (int k = 0; k < n; k++) {
			double t = 2 * Math.PI * k / n + 0.05;
			double z = -Math.sin(3 * t);
			pts.add(new Point3(Math.sin(t) + 2 * Math.sin(2 * t), Math.cos(t) - 2 * Math.cos(2 * t), mirror ? -z : z));
		}
		pts.add(pts.get(0));
		return SpatialGraph.builder().addNode(0, pts.get(0)).addEdge(0, 0, pts).build();
	}

	/** Hopf-linked circles joined by a bar, so both nodes are trivalent. */
	public static SpatialGraph handcuff() {
		List<Point3> a = circle(ORIGIN, X, Y, 1, 16, Math.PI);
		List<Point3> b = circle(X, X, Z, 1, 16, 0);
		List<Point3> bar = List.of(a.get(0), new Point3(-1.5, -2, 0.3), new Point3(2.5, -2, -0.2), b.get(0));
		return SpatialGraph.builder().addNode(0, a.get(0)).addNode(1, b.get(0)).addEdge(0, 0, a).addEdge(1, 1, b).addEdge(0, 1, bar).build();
	}

	/** Planar theta graph, lifted slightly out of the plane. */
	public static SpatialGraph theta() {
		Point3 p = new Point3(-1, 0, 0);
		Point3 q = new Point3(1, 0, 0);
		return SpatialGraph.builder().addNode(0, p).addNode(1, q).addEdge(0, 1).addEdge(0, 1, List.of(p, new Point3(0, 1, 0.1), q))
				.addEdge(0, 1, List.of(p, new Point3(0, -1, -0.1), q)).build();
	}

	/** Three straight edges at different heights whose projections meet at the origin. */
	public static SpatialGraph threeLinesThroughOrigin() {
		return SpatialGraph.builder().addNode(0, new Point3(-1, 0, 0)).addNode(1, new Point3(1, 0, 0)).addNode(2, new Point3(0, -1, 1))
				.addNode(3, new Point3(0, 1, 1)).addNode(4, new Point3(-1, -1, 2)).addNode(5, new Point3(1, 1, 2)).addEdge(0, 1).addEdge(2, 3)
				.addEdge(4, 5).build();
	}

	/** Two straight edges, edge 1 passing over edge 0 at the origin. */
	public static SpatialGraph simpleCrossing() {
		return SpatialGraph.builder().addNode(0, new Point3(-1, 0, 0)).addNode(1, new Point3(1, 0, 0)).addNode(2, new Point3(0, -1, 1))
				.addNode(3, new Point3(0, 1, 1)).addEdge(0, 1).addEdge(2, 3).build();
	}

	/** Four-valent node: two unit circles sharing their start point. */
	public static SpatialGraph figureEight() {
		List<Point3> a = circle(new Point3(-1, 0, 0), X, Y, 1, 16, 0);
		List<Point3> b = circle(new Point3(1, 0, 0.05), X, Y, 1, 16, Math.PI);
		Point3 node = a.get(0);
		List<Point3> b2 = new ArrayList<>(b);
		b2.set(0, node);
		b2.set(b2.size() - 1, node);
		return SpatialGraph.builder().addNode(0, node).addEdge(0, 0, a).addEdge(0, 0, b2).build();
	}
}
