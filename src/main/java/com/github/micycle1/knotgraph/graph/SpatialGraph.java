package com.github.micycle1.knotgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <p>
 * Immutable spatial multigraph: nodes carry a 3D coordinate, edges carry the
 * ordered polyline between their two endpoint nodes. Self-loops and parallel
 * edges are allowed.
 * </p>
 *
 * <p>
 * Conventions:
 * </p>
 * <ul>
 * <li>Nodes are stored in an arena sorted by id; ids need not be dense (see
 * {@link GraphSimplifier} for relabelling).</li>
 * <li>Each edge is stored with {@code u <= v} and its polyline runs from node u
 * to node v. Edges with the same endpoint pair are distinguished by
 * {@code parallelIndex}.</li>
 * <li>The degree of a node counts incident edge-ends, so a self-loop
 * contributes two.</li>
 * <li>The adjacency index is built once at construction.</li>
 * </ul>
 */
public final class SpatialGraph {

	/** Node record: id, coordinate and degree. */
	public static final class Node {
		public final int id;
		public final Point3 coordinate;
		public final int degree;

		Node(int id, Point3 coordinate, int degree) {
			this.id = id;
			this.coordinate = coordinate;
			this.degree = degree;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Node)) {
				return false;
			}
			Node o = (Node) obj;
			return id == o.id && degree == o.degree && coordinate.equals(o.coordinate);
		}

		@Override
		public int hashCode() {
			return Objects.hash(id, coordinate, degree);
		}

		@Override
		public String toString() {
			return "Node[" + id + " @ " + coordinate + ", deg=" + degree + "]";
		}
	}

	/** Edge record: endpoint pair, parallel index and polyline. */
	public static final class Edge {
		public final int id;
		public final int u;
		public final int v;
		public final int parallelIndex;
		public final List<Point3> polyline;
		public final double length;

		Edge(int id, int u, int v, int parallelIndex, List<Point3> polyline) {
			this.id = id;
			this.u = u;
			this.v = v;
			this.parallelIndex = parallelIndex;
			this.polyline = Collections.unmodifiableList(new ArrayList<>(polyline));
			this.length = polylineLength(polyline);
		}

		public boolean isSelfLoop() {
			return u == v;
		}

		/** The endpoint opposite to {@code node} (itself for a self-loop). */
		public int other(int node) {
			if (node == u) {
				return v;
			}
			if (node == v) {
				return u;
			}
			throw new IllegalArgumentException("Node " + node + " is not an endpoint of edge " + id);
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Edge)) {
				return false;
			}
			Edge o = (Edge) obj;
			return id == o.id && u == o.u && v == o.v && parallelIndex == o.parallelIndex && polyline.equals(o.polyline);
		}

		@Override
		public int hashCode() {
			return Objects.hash(id, u, v, parallelIndex, polyline);
		}

		@Override
		public String toString() {
			return "Edge[" + id + ": " + u + "-" + v + "#" + parallelIndex + ", " + polyline.size() + " pts]";
		}
	}

	private final List<Node> nodes;
	private final List<Edge> edges;
	private final Map<Integer, Integer> indexOf;
	private final List<List<Integer>> incident;

	private SpatialGraph(List<Node> nodes, List<Edge> edges) {
		this.nodes = Collections.unmodifiableList(nodes);
		this.edges = Collections.unmodifiableList(edges);
		indexOf = new HashMap<>();
		incident = new ArrayList<>();
		for (int i = 0; i < nodes.size(); i++) {
			indexOf.put(nodes.get(i).id, i);
			incident.add(new ArrayList<>());
		}
		for (Edge e : edges) {
			incident.get(indexOf.get(e.u)).add(e.id);
			if (!e.isSelfLoop()) {
				incident.get(indexOf.get(e.v)).add(e.id);
			}
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public List<Node> nodes() {
		return nodes;
	}

	public List<Edge> edges() {
		return edges;
	}

	public int nodeCount() {
		return nodes.size();
	}

	public int edgeCount() {
		return edges.size();
	}

	public boolean hasNode(int id) {
		return indexOf.containsKey(id);
	}

	public Node node(int id) {
		Integer i = indexOf.get(id);
		if (i == null) {
			throw new IllegalArgumentException("No node with id " + id);
		}
		return nodes.get(i);
	}

	public Edge edge(int edgeId) {
		return edges.get(edgeId);
	}

	public int degree(int id) {
		return node(id).degree;
	}

	/** Ids of edges incident to the node; a self-loop is listed once. */
	public List<Integer> incidentEdges(int id) {
		Integer i = indexOf.get(id);
		if (i == null) {
			throw new IllegalArgumentException("No node with id " + id);
		}
		return Collections.unmodifiableList(incident.get(i));
	}

	public int maxDegree() {
		int max = 0;
		for (Node n : nodes) {
			max = Math.max(max, n.degree);
		}
		return max;
	}

	/**
	 * Stable 64-bit fingerprint of the structure and geometry, used as a cache
	 * key.
	 */
	public long fingerprint() {
		long h = 1125899906842597L;
		for (Node n : nodes) {
			h = 31 * h + n.hashCode();
		}
		for (Edge e : edges) {
			h = 31 * h + e.hashCode();
		}
		return h;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SpatialGraph)) {
			return false;
		}
		SpatialGraph o = (SpatialGraph) obj;
		return nodes.equals(o.nodes) && edges.equals(o.edges);
	}

	@Override
	public int hashCode() {
		return Objects.hash(nodes, edges);
	}

	@Override
	public String toString() {
		return "SpatialGraph[" + nodes.size() + " nodes, " + edges.size() + " edges]";
	}

	static double polylineLength(List<Point3> polyline) {
		double len = 0;
		for (int i = 1; i < polyline.size(); i++) {
			len += polyline.get(i - 1).distance(polyline.get(i));
		}
		return len;
	}

	/**
	 * Accumulates nodes and edges. Edge endpoints are normalised to
	 * {@code u <= v} (reversing the polyline when needed), node degrees are
	 * derived, and every polyline must start and end on its node coordinates.
	 */
	public static final class Builder {

		private static final double ENDPOINT_TOLERANCE = 1e-9;

		private final Map<Integer, Point3> coords = new LinkedHashMap<>();
		private final List<int[]> ends = new ArrayList<>();
		private final List<List<Point3>> polylines = new ArrayList<>();

		private Builder() {
		}

		public Builder addNode(int id, Point3 coordinate) {
			Objects.requireNonNull(coordinate, "coordinate");
			if (coords.putIfAbsent(id, coordinate) != null) {
				throw new IllegalArgumentException("Duplicate node id " + id);
			}
			return this;
		}

		/** Adds an edge whose polyline is the straight segment between u and v. */
		public Builder addEdge(int u, int v) {
			return addEdge(u, v, List.of(requireNode(u), requireNode(v)));
		}

		public Builder addEdge(int u, int v, List<Point3> polyline) {
			Point3 pu = requireNode(u);
			Point3 pv = requireNode(v);
			if (polyline == null || polyline.size() < 2) {
				throw new IllegalArgumentException("Edge " + u + "-" + v + " needs a polyline of at least two points");
			}
			double tol = ENDPOINT_TOLERANCE * Math.max(1.0, scale(pu, pv));
			List<Point3> pts = new ArrayList<>(polyline);
			if (!pts.get(0).approxEquals(pu, tol) || !pts.get(pts.size() - 1).approxEquals(pv, tol)) {
				throw new IllegalArgumentException("Polyline of edge " + u + "-" + v + " does not join its node coordinates");
			}
			if (u > v) {
				Collections.reverse(pts);
				int t = u;
				u = v;
				v = t;
			}
			ends.add(new int[] { u, v });
			polylines.add(pts);
			return this;
		}

		public SpatialGraph build() {
			List<Integer> ids = new ArrayList<>(coords.keySet());
			Collections.sort(ids);
			Map<Integer, Integer> degree = new HashMap<>();
			for (int[] uv : ends) {
				degree.merge(uv[0], 1, Integer::sum);
				degree.merge(uv[1], 1, Integer::sum);
			}
			List<Node> nodes = new ArrayList<>(ids.size());
			for (int id : ids) {
				nodes.add(new Node(id, coords.get(id), degree.getOrDefault(id, 0)));
			}
			Map<Long, Integer> parallel = new HashMap<>();
			List<Edge> edges = new ArrayList<>(ends.size());
			for (int i = 0; i < ends.size(); i++) {
				int[] uv = ends.get(i);
				long key = ((long) uv[0] << 32) ^ (uv[1] & 0xffffffffL);
				int p = parallel.merge(key, 1, Integer::sum) - 1;
				edges.add(new Edge(i, uv[0], uv[1], p, polylines.get(i)));
			}
			return new SpatialGraph(nodes, edges);
		}

		private Point3 requireNode(int id) {
			Point3 p = coords.get(id);
			if (p == null) {
				throw new IllegalArgumentException("Unknown node id " + id);
			}
			return p;
		}

		private static double scale(Point3 a, Point3 b) {
			return Math.max(Math.max(Math.abs(a.x), Math.abs(a.y)), Math.max(Math.max(Math.abs(a.z), Math.abs(b.x)), Math.max(Math.abs(b.y), Math.abs(b.z))));
		}
	}
}
