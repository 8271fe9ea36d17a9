package com.github.micycle1.knotgraph.graph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Simple undirected graph on vertices {@code 0..n-1} with sorted neighbour
 * lists. Multi-edges collapse and self-loops are dropped on construction.
 */
public final class SimpleGraph {

	private final int n;
	private final List<List<Integer>> adjacency;
	private final BitSet[] adjacent;
	private final int edgeCount;

	public SimpleGraph(int n, List<int[]> edges) {
		if (n < 0) {
			throw new IllegalArgumentException("Vertex count must be >= 0: " + n);
		}
		this.n = n;
		adjacent = new BitSet[n];
		for (int i = 0; i < n; i++) {
			adjacent[i] = new BitSet(n);
		}
		int m = 0;
		for (int[] e : edges) {
			int u = e[0], v = e[1];
			if (u < 0 || v < 0 || u >= n || v >= n) {
				throw new IllegalArgumentException("Edge " + u + "-" + v + " outside 0.." + (n - 1));
			}
			if (u != v && !adjacent[u].get(v)) {
				adjacent[u].set(v);
				adjacent[v].set(u);
				m++;
			}
		}
		edgeCount = m;
		List<List<Integer>> adj = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			List<Integer> nb = new ArrayList<>();
			adjacent[i].stream().forEach(nb::add);
			adj.add(Collections.unmodifiableList(nb));
		}
		adjacency = Collections.unmodifiableList(adj);
	}

	/**
	 * Adjacency of a spatial graph, with node ids mapped to {@code 0..n-1} in
	 * ascending order (the identity for a relabelled simplified graph).
	 */
	public static SimpleGraph of(SpatialGraph graph) {
		Map<Integer, Integer> index = new TreeMap<>();
		for (SpatialGraph.Node node : graph.nodes()) {
			index.put(node.id, index.size());
		}
		List<int[]> edges = new ArrayList<>();
		for (SpatialGraph.Edge e : graph.edges()) {
			edges.add(new int[] { index.get(e.u), index.get(e.v) });
		}
		return new SimpleGraph(graph.nodeCount(), edges);
	}

	public int vertexCount() {
		return n;
	}

	public int edgeCount() {
		return edgeCount;
	}

	public List<Integer> neighbours(int v) {
		return adjacency.get(v);
	}

	public int degree(int v) {
		return adjacency.get(v).size();
	}

	public boolean isAdjacent(int u, int v) {
		return adjacent[u].get(v);
	}

	/** Each undirected edge once, as {u, v} with u &lt; v. */
	public List<int[]> edges() {
		List<int[]> out = new ArrayList<>(edgeCount);
		for (int u = 0; u < n; u++) {
			for (int v : adjacency.get(u)) {
				if (u < v) {
					out.add(new int[] { u, v });
				}
			}
		}
		return out;
	}

	@Override
	public String toString() {
		return "SimpleGraph[" + n + " vertices, " + edgeCount + " edges]";
	}
}
