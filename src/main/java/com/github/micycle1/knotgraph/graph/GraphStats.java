package com.github.micycle1.knotgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.TreeMap;

/**
 * Summary statistics of a spatial graph: counts, degree histogram, connected
 * components and, for connected graphs, diameter and average shortest path
 * length (hop counts).
 */
public final class GraphStats {

	public final int nodeCount;
	public final int edgeCount;
	/** degree -> number of nodes with that degree */
	public final TreeMap<Integer, Integer> degreeHistogram;
	/** component sizes, largest first */
	public final List<Integer> componentSizes;
	/** -1 when disconnected */
	public final int diameter;
	/** NaN when disconnected or with fewer than two nodes */
	public final double averageShortestPath;

	private GraphStats(int nodeCount, int edgeCount, TreeMap<Integer, Integer> degreeHistogram, List<Integer> componentSizes, int diameter, double averageShortestPath) {
		this.nodeCount = nodeCount;
		this.edgeCount = edgeCount;
		this.degreeHistogram = degreeHistogram;
		this.componentSizes = componentSizes;
		this.diameter = diameter;
		this.averageShortestPath = averageShortestPath;
	}

	public static GraphStats of(SpatialGraph graph) {
		TreeMap<Integer, Integer> hist = new TreeMap<>();
		for (SpatialGraph.Node n : graph.nodes()) {
			hist.merge(n.degree, 1, Integer::sum);
		}
		SimpleGraph g = SimpleGraph.of(graph);
		int n = g.vertexCount();

		int[] comp = new int[n];
		Arrays.fill(comp, -1);
		List<Integer> sizes = new ArrayList<>();
		for (int s = 0; s < n; s++) {
			if (comp[s] >= 0) {
				continue;
			}
			int id = sizes.size();
			int size = 0;
			Queue<Integer> q = new ArrayDeque<>();
			q.add(s);
			comp[s] = id;
			while (!q.isEmpty()) {
				int v = q.poll();
				size++;
				for (int w : g.neighbours(v)) {
					if (comp[w] < 0) {
						comp[w] = id;
						q.add(w);
					}
				}
			}
			sizes.add(size);
		}
		sizes.sort(Collections.reverseOrder());

		int diameter = -1;
		double avg = Double.NaN;
		if (sizes.size() == 1) {
			diameter = 0;
			long sum = 0;
			for (int s = 0; s < n; s++) {
				int[] dist = bfs(g, s);
				for (int d : dist) {
					diameter = Math.max(diameter, d);
					sum += d;
				}
			}
			if (n > 1) {
				avg = sum / (double) ((long) n * (n - 1));
			}
		}
		return new GraphStats(n, graph.edgeCount(), hist, Collections.unmodifiableList(sizes), diameter, avg);
	}

	public boolean isConnected() {
		return componentSizes.size() == 1;
	}

	private static int[] bfs(SimpleGraph g, int s) {
		int[] dist = new int[g.vertexCount()];
		Arrays.fill(dist, -1);
		dist[s] = 0;
		Queue<Integer> q = new ArrayDeque<>();
		q.add(s);
		while (!q.isEmpty()) {
			int v = q.poll();
			for (int w : g.neighbours(v)) {
				if (dist[w] < 0) {
					dist[w] = dist[v] + 1;
					q.add(w);
				}
			}
		}
		return dist;
	}

	/** Multi-line report in the spirit of a property printout. */
	public String summary() {
		StringBuilder sb = new StringBuilder();
		sb.append("Number of nodes: ").append(nodeCount).append('\n');
		sb.append("Number of edges: ").append(edgeCount).append('\n');
		sb.append("Degree distribution (degree: frequency):\n");
		degreeHistogram.forEach((d, c) -> sb.append("  ").append(d).append(": ").append(c).append('\n'));
		if (isConnected()) {
			sb.append("Graph is connected.\n");
			sb.append("Diameter: ").append(diameter).append('\n');
			sb.append("Average shortest path length: ").append(averageShortestPath).append('\n');
		} else {
			sb.append("Graph is not connected.\n");
			sb.append("Number of connected components: ").append(componentSizes.size()).append('\n');
			for (int i = 0; i < componentSizes.size(); i++) {
				sb.append("  Component ").append(i + 1).append(" has ").append(componentSizes.get(i)).append(" nodes.\n");
			}
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return "GraphStats[nodes=" + nodeCount + ", edges=" + edgeCount + ", components=" + componentSizes.size() + ", diameter=" + diameter + "]";
	}
}
