package com.github.micycle1.knotgraph.minor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.Workers;
import com.github.micycle1.knotgraph.graph.SimpleGraph;

/**
 * <p>
 * Heuristic minor embedding in the style of Cai, Macready and Roy. Each round
 * visits the target vertices in a seeded random order and re-places each one:
 * its old chain is dropped, host vertices are weighted exponentially in the
 * number of other chains using them, and the new chain is grown from the root
 * minimising the summed weighted distance to the chains of its already placed
 * target neighbours, as the union of those shortest paths. Roots whose host
 * degree is below the target degree pay an extra penalty.
 * </p>
 * <p>
 * A round that leaves every host vertex in at most one chain yields a
 * candidate, which is returned once {@link MinorEmbedding#verify} accepts it.
 * A round that does not reduce the total overlap clears all chains and starts
 * over with the same random stream. An attempt gives up after
 * {@code maxRounds} rounds.
 * </p>
 */
public class MinorEmbedder {

	private static final Logger log = LoggerFactory.getLogger(MinorEmbedder.class);

	private static final int DEFICIT_PENALTY = 3;

	private int maxRounds = 100;
	private int workers = 1;

	public void setMaxRounds(int maxRounds) {
		if (maxRounds < 1) {
			throw new IllegalArgumentException("Rounds must be >= 1: " + maxRounds);
		}
		this.maxRounds = maxRounds;
	}

	public int getMaxRounds() {
		return maxRounds;
	}

	/** Attempts with different seeds run in batches of this size. */
	public void setWorkers(int workers) {
		if (workers < 1) {
			throw new IllegalArgumentException("Workers must be >= 1: " + workers);
		}
		this.workers = workers;
	}

	/**
	 * Tries seeds {@code seed, seed + 1, ..., seed + retries - 1} and returns the
	 * verified embedding of the lowest successful seed, or
	 * {@link MinorEmbedding#notFound()}.
	 */
	public MinorEmbedding find(SimpleGraph host, SimpleGraph target, long seed, int retries) {
		if (retries < 1) {
			throw new IllegalArgumentException("Retries must be >= 1: " + retries);
		}
		for (int batch = 0; batch < retries; batch += workers) {
			List<Callable<MinorEmbedding>> tasks = new ArrayList<>();
			for (int i = batch; i < Math.min(retries, batch + workers); i++) {
				long s = seed + i;
				tasks.add(() -> attempt(host, target, s));
			}
			for (MinorEmbedding e : Workers.invokeAll(tasks, workers)) {
				if (e.isFound()) {
					log.info("Embedded {} into {} with seed {}", target, host, e.getSeed());
					return e;
				}
			}
		}
		log.warn("No embedding of {} into {} after {} seeds", target, host, retries);
		return MinorEmbedding.notFound();
	}

	/** One seeded attempt. */
	public MinorEmbedding attempt(SimpleGraph host, SimpleGraph target, long seed) {
		return new Attempt(host, target, seed).run();
	}

	private final class Attempt {
		final SimpleGraph host;
		final SimpleGraph target;
		final long seed;
		final Random rnd;
		final int n;
		final int t;
		final List<TreeSet<Integer>> chains;
		final int[] usage;
		final double base;

		Attempt(SimpleGraph host, SimpleGraph target, long seed) {
			this.host = host;
			this.target = target;
			this.seed = seed;
			this.rnd = new Random(seed);
			this.n = host.vertexCount();
			this.t = target.vertexCount();
			this.chains = new ArrayList<>(t);
			for (int x = 0; x < t; x++) {
				chains.add(new TreeSet<>());
			}
			this.usage = new int[n];
			this.base = Math.max(2.0, n);
		}

		MinorEmbedding run() {
			if (t == 0) {
				return new MinorEmbedding(seed, Map.of());
			}
			if (n < t) {
				return MinorEmbedding.notFound();
			}
			int best = Integer.MAX_VALUE;
			for (int round = 0; round < maxRounds; round++) {
				List<Integer> order = new ArrayList<>(t);
				for (int x = 0; x < t; x++) {
					order.add(x);
				}
				Collections.shuffle(order, rnd);
				for (int x : order) {
					place(x);
				}
				int overlap = 0;
				for (int u : usage) {
					overlap += Math.max(0, u - 1);
				}
				if (overlap == 0) {
					Map<Integer, List<Integer>> map = new TreeMap<>();
					for (int x = 0; x < t; x++) {
						map.put(x, new ArrayList<>(chains.get(x)));
					}
					MinorEmbedding e = new MinorEmbedding(seed, map);
					if (e.verify(host, target)) {
						log.debug("Seed {} embedded after {} rounds", seed, round + 1);
						return e;
					}
				}
				if (overlap < best) {
					best = overlap;
				} else {
					for (int x = 0; x < t; x++) {
						clear(x);
					}
					best = Integer.MAX_VALUE;
				}
			}
			log.debug("Seed {} failed after {} rounds", seed, maxRounds);
			return MinorEmbedding.notFound();
		}

		void clear(int x) {
			for (int v : chains.get(x)) {
				usage[v]--;
			}
			chains.get(x).clear();
		}

		void place(int x) {
			clear(x);
			TreeSet<Integer> chain = chains.get(x);
			double[] w = new double[n];
			for (int v = 0; v < n; v++) {
				w[v] = Math.pow(base, usage[v]);
			}
			List<Integer> placed = new ArrayList<>();
			for (int y : target.neighbours(x)) {
				if (!chains.get(y).isEmpty()) {
					placed.add(y);
				}
			}
			if (placed.isEmpty()) {
				chain.add(leastUsed(x));
			} else {
				double[][] dist = new double[placed.size()][];
				int[][] pred = new int[placed.size()][];
				boolean[] blocked = new boolean[n];
				for (int k = 0; k < placed.size(); k++) {
					dist[k] = new double[n];
					pred[k] = new int[n];
					shortestPaths(chains.get(placed.get(k)), w, dist[k], pred[k]);
					for (int v : chains.get(placed.get(k))) {
						blocked[v] = true;
					}
				}
				double bestCost = Double.POSITIVE_INFINITY;
				List<Integer> candidates = new ArrayList<>();
				for (int v = 0; v < n; v++) {
					if (blocked[v]) {
						continue;
					}
					double c = 0;
					for (int k = 0; k < placed.size(); k++) {
						c += dist[k][v];
					}
					if (Double.isInfinite(c)) {
						continue;
					}
					c -= (placed.size() - 1) * w[v];
					c += Math.max(0, target.degree(x) - host.degree(v)) * DEFICIT_PENALTY * w[v];
					if (c < bestCost) {
						bestCost = c;
						candidates.clear();
						candidates.add(v);
					} else if (c == bestCost) {
						candidates.add(v);
					}
				}
				if (candidates.isEmpty()) {
					chain.add(leastUsed(x));
				} else {
					int root = candidates.get(rnd.nextInt(candidates.size()));
					chain.add(root);
					for (int k = 0; k < placed.size(); k++) {
						int u = pred[k][root];
						while (u >= 0 && dist[k][u] > 0) {
							chain.add(u);
							u = pred[k][u];
						}
					}
				}
			}
			for (int v : chain) {
				usage[v]++;
			}
		}

		/** Random least-used host vertex, preferring those with enough degree for x. */
		int leastUsed(int x) {
			int min = Integer.MAX_VALUE;
			for (int u : usage) {
				min = Math.min(min, u);
			}
			List<Integer> all = new ArrayList<>();
			List<Integer> wide = new ArrayList<>();
			for (int v = 0; v < n; v++) {
				if (usage[v] == min) {
					all.add(v);
					if (host.degree(v) >= target.degree(x)) {
						wide.add(v);
					}
				}
			}
			List<Integer> c = wide.isEmpty() ? all : wide;
			return c.get(rnd.nextInt(c.size()));
		}

		/** Vertex-weighted Dijkstra from a chain; entering vertex u costs w[u]. */
		void shortestPaths(TreeSet<Integer> sources, double[] w, double[] dist, int[] pred) {
			Arrays.fill(dist, Double.POSITIVE_INFINITY);
			Arrays.fill(pred, -1);
			boolean[] done = new boolean[n];
			for (int s : sources) {
				dist[s] = 0;
			}
			while (true) {
				int v = -1;
				for (int i = 0; i < n; i++) {
					if (!done[i] && dist[i] < Double.POSITIVE_INFINITY && (v < 0 || dist[i] < dist[v])) {
						v = i;
					}
				}
				if (v < 0) {
					return;
				}
				done[v] = true;
				for (int u : host.neighbours(v)) {
					double nd = dist[v] + w[u];
					if (nd < dist[u]) {
						dist[u] = nd;
						pred[u] = v;
					}
				}
			}
		}
	}
}
