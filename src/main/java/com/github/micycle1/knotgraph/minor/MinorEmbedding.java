package com.github.micycle1.knotgraph.minor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.github.micycle1.knotgraph.graph.SimpleGraph;

/**
 * Result of a minor search: either a chain of host vertices for every target
 * vertex, or a refusal. A refusal is a normal negative answer; the search is
 * heuristic, so it does not prove that no embedding exists.
 */
public final class MinorEmbedding {

	private static final MinorEmbedding NOT_FOUND = new MinorEmbedding(-1, null);

	private final long seed;
	private final Map<Integer, List<Integer>> chains;

	MinorEmbedding(long seed, Map<Integer, List<Integer>> chains) {
		this.seed = seed;
		this.chains = chains == null ? null : Collections.unmodifiableMap(new TreeMap<>(chains));
	}

	public static MinorEmbedding notFound() {
		return NOT_FOUND;
	}

	public boolean isFound() {
		return chains != null;
	}

	/** Seed of the successful attempt; -1 when not found. */
	public long getSeed() {
		return seed;
	}

	/** Target vertex to its sorted chain of host vertices; empty when not found. */
	public Map<Integer, List<Integer>> getChains() {
		return chains == null ? Map.of() : chains;
	}

	public List<Integer> chain(int targetVertex) {
		if (chains == null) {
			throw new IllegalStateException("No embedding was found");
		}
		List<Integer> c = chains.get(targetVertex);
		if (c == null) {
			throw new IllegalArgumentException("No chain for target vertex " + targetVertex);
		}
		return c;
	}

	/**
	 * Checks the mapping against the graphs: every target vertex has a non-empty
	 * chain of valid host vertices, chains are pairwise disjoint and connected in
	 * the host, and every target edge is realised by a host edge between the two
	 * chains.
	 */
	public boolean verify(SimpleGraph host, SimpleGraph target) {
		if (chains == null) {
			return false;
		}
		int n = host.vertexCount();
		BitSet used = new BitSet(n);
		List<BitSet> members = new ArrayList<>(target.vertexCount());
		for (int x = 0; x < target.vertexCount(); x++) {
			List<Integer> c = chains.get(x);
			if (c == null || c.isEmpty()) {
				return false;
			}
			BitSet m = new BitSet(n);
			for (int v : c) {
				if (v < 0 || v >= n || used.get(v)) {
					return false;
				}
				used.set(v);
				m.set(v);
			}
			if (!connected(host, c.get(0), m)) {
				return false;
			}
			members.add(m);
		}
		for (int[] e : target.edges()) {
			if (!touching(host, chains.get(e[0]), members.get(e[1]))) {
				return false;
			}
		}
		return true;
	}

	private static boolean connected(SimpleGraph host, int start, BitSet members) {
		BitSet seen = new BitSet();
		Deque<Integer> stack = new ArrayDeque<>();
		stack.push(start);
		seen.set(start);
		while (!stack.isEmpty()) {
			int v = stack.pop();
			for (int u : host.neighbours(v)) {
				if (members.get(u) && !seen.get(u)) {
					seen.set(u);
					stack.push(u);
				}
			}
		}
		return seen.equals(members);
	}

	private static boolean touching(SimpleGraph host, List<Integer> chain, BitSet other) {
		for (int v : chain) {
			for (int u : host.neighbours(v)) {
				if (other.get(u)) {
					return true;
				}
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return isFound() ? "MinorEmbedding[seed=" + seed + ", " + chains + "]" : "MinorEmbedding[not found]";
	}
}
