package com.github.micycle1.knotgraph.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Small reference graphs used as minor targets. The Petersen graph and K7
 * certify intrinsic linking and intrinsic knotting respectively.
 */
public final class ReferenceGraphs {

	private ReferenceGraphs() {
	}

	public static SimpleGraph complete(int n) {
		List<int[]> edges = new ArrayList<>();
		for (int u = 0; u < n; u++) {
			for (int v = u + 1; v < n; v++) {
				edges.add(new int[] { u, v });
			}
		}
		return new SimpleGraph(n, edges);
	}

	public static SimpleGraph completeBipartite(int a, int b) {
		List<int[]> edges = new ArrayList<>();
		for (int u = 0; u < a; u++) {
			for (int v = 0; v < b; v++) {
				edges.add(new int[] { u, a + v });
			}
		}
		return new SimpleGraph(a + b, edges);
	}

	public static SimpleGraph triangle() {
		return complete(3);
	}

	public static SimpleGraph cycle(int n) {
		List<int[]> edges = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			edges.add(new int[] { i, (i + 1) % n });
		}
		return new SimpleGraph(n, edges);
	}

	/** Outer 5-cycle 0..4, inner pentagram 5..9, spokes i -- i+5. */
	public static SimpleGraph petersen() {
		List<int[]> edges = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			edges.add(new int[] { i, (i + 1) % 5 });
			edges.add(new int[] { 5 + i, 5 + (i + 2) % 5 });
			edges.add(new int[] { i, 5 + i });
		}
		return new SimpleGraph(10, edges);
	}
}
