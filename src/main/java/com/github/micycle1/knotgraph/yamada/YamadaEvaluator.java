package com.github.micycle1.knotgraph.yamada;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.InvalidDiagramException;
import com.github.micycle1.knotgraph.projection.PlanarDiagramCode;

/**
 * <p>
 * Evaluates the Yamada polynomial of a spatial graph diagram given as a
 * {@link PlanarDiagramCode}.
 * </p>
 * <p>
 * Each crossing {@code X[a,b,c,d]} (a = incoming under-arc, counter-clockwise)
 * is resolved by the skein relation
 * </p>
 *
 * <pre>
 * R(D) = A * R(a~d, b~c) + A^-1 * R(a~b, c~d) + R(D with the crossing made a 4-valent vertex)
 * </pre>
 * <p>
 * where {@code a~d} joins two arcs into one strand. Joining a strand to itself
 * closes a free circle, worth {@code sigma = A + 1 + A^-1}. Once every
 * crossing is resolved the remaining plane graph G contributes
 * {@code H(G)(-1, -sigma - 1)}, computed by deletion-contraction: a non-loop
 * edge gives {@code H(G-e) + H(G/e)}, a loop a factor {@code -sigma}, and each
 * edgeless vertex a factor {@code -1}.
 * </p>
 * <p>
 * The crossing expansion runs over an explicit worklist. Plane-graph values are
 * memoised in a concurrent map, so one evaluator may serve several threads.
 * </p>
 */
public class YamadaEvaluator {

	private static final Logger log = LoggerFactory.getLogger(YamadaEvaluator.class);

	/** sigma = A + 1 + A^-1, the value of a free circle. */
	public static final LaurentPolynomial SIGMA = LaurentPolynomial.of(-1, 1, 1, 1);
	private static final LaurentPolynomial LOOP = SIGMA.negate();
	private static final LaurentPolynomial A = LaurentPolynomial.monomial(1, 1);
	private static final LaurentPolynomial A_INV = LaurentPolynomial.monomial(1, -1);

	private final ConcurrentHashMap<String, LaurentPolynomial> memo = new ConcurrentHashMap<>();
	private boolean normalize = true;

	public YamadaEvaluator() {
	}

	public YamadaEvaluator(boolean normalize) {
		this.normalize = normalize;
	}

	/** Whether {@link #evaluate} returns {@link LaurentPolynomial#normalized()} values. */
	public void setNormalize(boolean normalize) {
		this.normalize = normalize;
	}

	public boolean isNormalize() {
		return normalize;
	}

	public LaurentPolynomial evaluate(PlanarDiagramCode code) {
		LaurentPolynomial raw = evaluateRaw(code);
		return normalize ? raw.normalized() : raw;
	}

	/** Number of memoised plane-graph values. */
	public int memoSize() {
		return memo.size();
	}

	public void clearMemo() {
		memo.clear();
	}

	private static final class State {
		final int next;
		final int[] parent;
		final List<int[]> promoted;
		final int loops;
		final LaurentPolynomial weight;

		State(int next, int[] parent, List<int[]> promoted, int loops, LaurentPolynomial weight) {
			this.next = next;
			this.parent = parent;
			this.promoted = promoted;
			this.loops = loops;
			this.weight = weight;
		}
	}

	/**
	 * Unnormalised value, defined up to a factor {@code (-A)^k} that depends on
	 * the diagram.
	 *
	 * @throws InvalidDiagramException if a strand does not end on two vertex
	 *                                 slots once crossings are resolved
	 */
	public LaurentPolynomial evaluateRaw(PlanarDiagramCode code) {
		// dense arc indices
		Map<Integer, Integer> dense = new HashMap<>();
		for (PlanarDiagramCode.Token t : code.tokens()) {
			for (int a : t.arcs()) {
				dense.putIfAbsent(a, dense.size());
			}
		}
		List<int[]> vertices = new ArrayList<>();
		List<int[]> crossings = new ArrayList<>();
		for (PlanarDiagramCode.Token t : code.tokens()) {
			int[] arcs = t.arcs();
			for (int i = 0; i < arcs.length; i++) {
				arcs[i] = dense.get(arcs[i]);
			}
			(t.kind == PlanarDiagramCode.Kind.CROSSING ? crossings : vertices).add(arcs);
		}

		int[] identity = new int[dense.size()];
		for (int i = 0; i < identity.length; i++) {
			identity[i] = i;
		}
		Deque<State> work = new ArrayDeque<>();
		work.push(new State(0, identity, List.of(), 0, LaurentPolynomial.ONE));
		LaurentPolynomial total = LaurentPolynomial.ZERO;
		long states = 0;
		while (!work.isEmpty()) {
			State s = work.pop();
			states++;
			if (s.next == crossings.size()) {
				LaurentPolynomial h = planeGraph(vertices, s);
				total = total.add(s.weight.multiply(h).multiply(SIGMA.pow(s.loops)));
				continue;
			}
			int[] x = crossings.get(s.next);
			int a = x[0], b = x[1], c = x[2], d = x[3];
			work.push(join(s, a, d, b, c, A));
			work.push(join(s, a, b, c, d, A_INV));
			List<int[]> promoted = new ArrayList<>(s.promoted);
			promoted.add(x);
			work.push(new State(s.next + 1, s.parent, promoted, s.loops, s.weight));
		}
		log.debug("Evaluated {} crossings over {} states: {}", crossings.size(), states, total);
		return total;
	}

	private static State join(State s, int p1, int q1, int p2, int q2, LaurentPolynomial factor) {
		int[] parent = s.parent.clone();
		int loops = s.loops;
		if (!union(parent, p1, q1)) {
			loops++;
		}
		if (!union(parent, p2, q2)) {
			loops++;
		}
		return new State(s.next + 1, parent, s.promoted, loops, s.weight.multiply(factor));
	}

	private static int find(int[] parent, int x) {
		while (parent[x] != x) {
			parent[x] = parent[parent[x]];
			x = parent[x];
		}
		return x;
	}

	/** False when both arcs already belong to one strand. */
	private static boolean union(int[] parent, int p, int q) {
		int rp = find(parent, p);
		int rq = find(parent, q);
		if (rp == rq) {
			return false;
		}
		parent[rq] = rp;
		return true;
	}

	private LaurentPolynomial planeGraph(List<int[]> vertices, State s) {
		int nv = vertices.size() + s.promoted.size();
		Map<Integer, int[]> ends = new HashMap<>(); // strand -> {vertex, vertex}
		int v = 0;
		for (List<int[]> group : List.of(vertices, s.promoted)) {
			for (int[] arcs : group) {
				for (int arc : arcs) {
					int strand = find(s.parent, arc);
					int[] e = ends.get(strand);
					if (e == null) {
						ends.put(strand, new int[] { v, -1 });
					} else if (e[1] < 0) {
						e[1] = v;
					} else {
						throw new InvalidDiagramException("Strand through arc " + arc + " meets more than two vertex slots");
					}
				}
				v++;
			}
		}
		List<int[]> edges = new ArrayList<>(ends.size());
		for (int[] e : ends.values()) {
			if (e[1] < 0) {
				throw new InvalidDiagramException("Strand at vertex " + e[0] + " has a free end");
			}
			edges.add(e);
		}
		return h(nv, edges);
	}

	private LaurentPolynomial h(int nv, List<int[]> edges) {
		String key = signature(nv, edges);
		LaurentPolynomial cached = memo.get(key);
		if (cached != null) {
			return cached;
		}
		LaurentPolynomial result = deleteContract(nv, edges);
		memo.put(key, result);
		return result;
	}

	private LaurentPolynomial deleteContract(int nv, List<int[]> edges) {
		List<int[]> rest = new ArrayList<>(edges.size());
		int loops = 0;
		for (int[] e : edges) {
			if (e[0] == e[1]) {
				loops++;
			} else {
				rest.add(e);
			}
		}
		if (loops > 0) {
			return LOOP.pow(loops).multiply(h(nv, rest));
		}
		if (rest.isEmpty()) {
			return LaurentPolynomial.monomial((nv & 1) == 0 ? 1 : -1, 0);
		}
		int u = rest.get(0)[0];
		int w = rest.get(0)[1];
		List<int[]> remaining = rest.subList(1, rest.size());
		LaurentPolynomial deleted = h(nv, remaining);

		// contract w into u, closing the gap left by w
		int target = u > w ? u - 1 : u;
		List<int[]> contracted = new ArrayList<>(remaining.size());
		for (int[] e : remaining) {
			contracted.add(new int[] { rename(e[0], w, target), rename(e[1], w, target) });
		}
		return deleted.add(h(nv - 1, contracted));
	}

	private static int rename(int x, int removed, int target) {
		if (x == removed) {
			return target;
		}
		return x > removed ? x - 1 : x;
	}

	private static String signature(int nv, List<int[]> edges) {
		long[] packed = new long[edges.size()];
		for (int i = 0; i < packed.length; i++) {
			int[] e = edges.get(i);
			int lo = Math.min(e[0], e[1]);
			int hi = Math.max(e[0], e[1]);
			packed[i] = ((long) lo << 32) | hi;
		}
		Arrays.sort(packed);
		StringBuilder sb = new StringBuilder().append(nv).append(':');
		for (long p : packed) {
			sb.append(p >>> 32).append('-').append(p & 0xffffffffL).append(',');
		}
		return sb.toString();
	}
}
