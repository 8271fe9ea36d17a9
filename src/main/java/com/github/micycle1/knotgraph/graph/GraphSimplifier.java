package com.github.micycle1.knotgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Reduces a {@link SpatialGraph} to its simplified form:
 * </p>
 * <ol>
 * <li>branch points (degree &ge; 3) joined by an edge shorter than the merge
 * distance are fused at their midpoint;</li>
 * <li>every degree-2 node is contracted into its neighbours, concatenating the
 * two polylines in point order;</li>
 * <li>a component that is a bare cycle keeps its lowest-id node with one
 * self-loop;</li>
 * <li>polylines are smoothed with 3D Douglas-Peucker at the smoothing
 * tolerance;</li>
 * <li>steps 1 to 4 repeat until none of them changes the graph, then nodes
 * are relabelled {@code 0..n-1} in order of their original ids.</li>
 * </ol>
 * <p>
 * The operation is idempotent: simplifying a simplified graph returns an equal
 * graph. A simplifier made with the no-argument constructor neither merges nor
 * smooths; {@link com.github.micycle1.knotgraph.AnalysisConfig} supplies a
 * smoothing tolerance by default.
 * </p>
 */
public class GraphSimplifier {

	private static final Logger log = LoggerFactory.getLogger(GraphSimplifier.class);

	private double mergeDistance = 0;
	private double smoothingTolerance = 0;

	public GraphSimplifier() {
	}

	public GraphSimplifier(double mergeDistance, double smoothingTolerance) {
		setMergeDistance(mergeDistance);
		setSmoothingTolerance(smoothingTolerance);
	}

	public void setMergeDistance(double mergeDistance) {
		if (mergeDistance < 0 || Double.isNaN(mergeDistance)) {
			throw new IllegalArgumentException("Merge distance must be >= 0: " + mergeDistance);
		}
		this.mergeDistance = mergeDistance;
	}

	public double getMergeDistance() {
		return mergeDistance;
	}

	public void setSmoothingTolerance(double smoothingTolerance) {
		if (smoothingTolerance < 0 || Double.isNaN(smoothingTolerance)) {
			throw new IllegalArgumentException("Smoothing tolerance must be >= 0: " + smoothingTolerance);
		}
		this.smoothingTolerance = smoothingTolerance;
	}

	public double getSmoothingTolerance() {
		return smoothingTolerance;
	}

	/** True when every node has degree at most 3. */
	public static boolean isTrivalent(SpatialGraph graph) {
		return graph.maxDegree() <= 3;
	}

	public SpatialGraph simplify(SpatialGraph graph) {
		TreeMap<Integer, Point3> nodes = new TreeMap<>();
		for (SpatialGraph.Node n : graph.nodes()) {
			nodes.put(n.id, n.coordinate);
		}
		List<WorkEdge> edges = new ArrayList<>();
		for (SpatialGraph.Edge e : graph.edges()) {
			edges.add(new WorkEdge(e.u, e.v, new ArrayList<>(e.polyline)));
		}

		// smoothing shortens edges, which can bring new branch pairs under the merge distance
		int merged = 0, contracted = 0, removedPoints = 0;
		boolean changed = true;
		while (changed) {
			int m = mergeBranchPoints(nodes, edges);
			int c = contractDegreeTwo(nodes, edges);
			int r = smooth(edges);
			merged += m;
			contracted += c;
			removedPoints += r;
			changed = m + c + r > 0;
		}

		SpatialGraph out = relabel(nodes, edges);
		log.debug("Simplified graph: merged {} branch pairs, contracted {} nodes, dropped {} polyline points -> {}", merged, contracted, removedPoints, out);
		return out;
	}

	private int smooth(List<WorkEdge> edges) {
		if (smoothingTolerance <= 0) {
			return 0;
		}
		int removed = 0;
		for (WorkEdge e : edges) {
			int before = e.line.size();
			e.line = douglasPeucker(e.line, smoothingTolerance);
			removed += before - e.line.size();
		}
		return removed;
	}

	private int mergeBranchPoints(TreeMap<Integer, Point3> nodes, List<WorkEdge> edges) {
		if (mergeDistance <= 0) {
			return 0;
		}
		int merges = 0;
		boolean found = true;
		while (found) {
			found = false;
			Map<Integer, Integer> degree = degrees(nodes, edges);
			WorkEdge shortest = null;
			for (WorkEdge e : edges) {
				if (e.u != e.v && degree.get(e.u) >= 3 && degree.get(e.v) >= 3 && e.length() < mergeDistance) {
					if (shortest == null || e.length() < shortest.length()) {
						shortest = e;
					}
				}
			}
			if (shortest != null) {
				int keep = Math.min(shortest.u, shortest.v);
				int drop = Math.max(shortest.u, shortest.v);
				Point3 mid = nodes.get(keep).midpoint(nodes.get(drop));
				edges.remove(shortest);
				nodes.remove(drop);
				nodes.put(keep, mid);
				for (WorkEdge e : edges) {
					if (e.u == drop) {
						e.u = keep;
					}
					if (e.v == drop) {
						e.v = keep;
					}
					if (e.u == keep) {
						e.line.set(0, mid);
					}
					if (e.v == keep) {
						e.line.set(e.line.size() - 1, mid);
					}
				}
				merges++;
				found = true;
			}
		}
		return merges;
	}

	/*
	 * Highest ids are contracted first so a bare cycle ends on its lowest-id node.
	 */
	private static int contractDegreeTwo(TreeMap<Integer, Point3> nodes, List<WorkEdge> edges) {
		int count = 0;
		boolean found = true;
		while (found) {
			found = false;
			Map<Integer, List<WorkEdge>> incident = new HashMap<>();
			for (WorkEdge e : edges) {
				incident.computeIfAbsent(e.u, k -> new ArrayList<>()).add(e);
				if (e.v != e.u) {
					incident.computeIfAbsent(e.v, k -> new ArrayList<>()).add(e);
				}
			}
			for (int n : nodes.descendingKeySet()) {
				List<WorkEdge> inc = incident.getOrDefault(n, Collections.emptyList());
				if (inc.size() != 2 || inc.get(0).u == inc.get(0).v || inc.get(1).u == inc.get(1).v) {
					continue;
				}
				WorkEdge e1 = inc.get(0);
				WorkEdge e2 = inc.get(1);
				// e1 oriented a -> n, e2 oriented n -> b
				List<Point3> first = e1.v == n ? e1.line : reversed(e1.line);
				List<Point3> second = e2.u == n ? e2.line : reversed(e2.line);
				int a = e1.other(n);
				int b = e2.other(n);
				List<Point3> line = new ArrayList<>(first);
				line.addAll(second.subList(1, second.size()));
				edges.remove(e1);
				edges.remove(e2);
				edges.add(new WorkEdge(a, b, line));
				nodes.remove(n);
				count++;
				found = true;
				break;
			}
		}
		return count;
	}

	private static SpatialGraph relabel(TreeMap<Integer, Point3> nodes, List<WorkEdge> edges) {
		Map<Integer, Integer> label = new HashMap<>();
		SpatialGraph.Builder b = SpatialGraph.builder();
		for (Map.Entry<Integer, Point3> n : nodes.entrySet()) {
			int id = label.size();
			label.put(n.getKey(), id);
			b.addNode(id, n.getValue());
		}
		List<WorkEdge> relabelled = new ArrayList<>();
		for (WorkEdge e : edges) {
			int u = label.get(e.u);
			int v = label.get(e.v);
			List<Point3> line = e.line;
			if (u > v) {
				int t = u;
				u = v;
				v = t;
				line = reversed(line);
			}
			relabelled.add(new WorkEdge(u, v, line));
		}
		relabelled.sort(EDGE_ORDER);
		for (WorkEdge e : relabelled) {
			b.addEdge(e.u, e.v, e.line);
		}
		return b.build();
	}

	private static final Comparator<Point3> POINT_ORDER = Comparator.<Point3>comparingDouble(p -> p.x).thenComparingDouble(p -> p.y).thenComparingDouble(p -> p.z);

	private static final Comparator<WorkEdge> EDGE_ORDER = Comparator.<WorkEdge>comparingInt(e -> e.u).thenComparingInt(e -> e.v).thenComparingInt(e -> e.line.size())
			.thenComparing((e1, e2) -> {
				for (int i = 0; i < e1.line.size(); i++) {
					int c = POINT_ORDER.compare(e1.line.get(i), e2.line.get(i));
					if (c != 0) {
						return c;
					}
				}
				return 0;
			});

	/**
	 * 3D Douglas-Peucker: keeps the endpoints and, recursively, the interior point
	 * farthest from the current chord while that distance exceeds the tolerance.
	 */
	static List<Point3> douglasPeucker(List<Point3> line, double tolerance) {
		int n = line.size();
		if (n <= 2) {
			return line;
		}
		boolean[] keep = new boolean[n];
		keep[0] = true;
		keep[n - 1] = true;
		List<int[]> stack = new ArrayList<>();
		stack.add(new int[] { 0, n - 1 });
		while (!stack.isEmpty()) {
			int[] range = stack.remove(stack.size() - 1);
			int lo = range[0], hi = range[1];
			double best = -1;
			int bestIdx = -1;
			for (int i = lo + 1; i < hi; i++) {
				double d = line.get(i).distanceToLine(line.get(lo), line.get(hi));
				if (d > best) {
					best = d;
					bestIdx = i;
				}
			}
			if (bestIdx >= 0 && best > tolerance) {
				keep[bestIdx] = true;
				stack.add(new int[] { lo, bestIdx });
				stack.add(new int[] { bestIdx, hi });
			}
		}
		List<Point3> out = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			if (keep[i]) {
				out.add(line.get(i));
			}
		}
		return out;
	}

	private static Map<Integer, Integer> degrees(Map<Integer, Point3> nodes, List<WorkEdge> edges) {
		Map<Integer, Integer> degree = new HashMap<>();
		for (int id : nodes.keySet()) {
			degree.put(id, 0);
		}
		for (WorkEdge e : edges) {
			degree.merge(e.u, 1, Integer::sum);
			degree.merge(e.v, 1, Integer::sum);
		}
		return degree;
	}

	private static List<Point3> reversed(List<Point3> line) {
		List<Point3> r = new ArrayList<>(line);
		Collections.reverse(r);
		return r;
	}

	private static final class WorkEdge {
		int u, v;
		List<Point3> line;

		WorkEdge(int u, int v, List<Point3> line) {
			this.u = u;
			this.v = v;
			this.line = line;
		}

		int other(int n) {
			return u == n ? v : u;
		}

		double length() {
			return SpatialGraph.polylineLength(line);
		}
	}
}
