package com.github.micycle1.knotgraph.skeleton;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.MalformedVolumeException;
import com.github.micycle1.knotgraph.graph.Point3;
import com.github.micycle1.knotgraph.graph.SpatialGraph;

/**
 * <p>
 * Skeleton builder: binary volume to embedded spatial multigraph.
 * </p>
 *
 * <ol>
 * <li>Thin a copy of the volume to a curve skeleton ({@link Thinning}).</li>
 * <li>Classify skeleton voxels by their 26-neighbour count: exactly two
 * neighbours is a pass-through voxel, anything else (end points, branch points)
 * is a node voxel. 26-connected clusters of node voxels collapse to a single
 * node at the cluster centroid.</li>
 * <li>Walk from every node cluster through pass-through voxels until another
 * cluster is reached; each walk becomes one edge polyline. Closed loops made
 * only of pass-through voxels become a synthetic node with one self-loop.</li>
 * <li>Prune spurs (edges to a degree-1 node, or self-loops hanging off a
 * branch point) shorter than the spur length, repeatedly. Optionally remove
 * every leaf.</li>
 * </ol>
 * Voxel indices are mapped to physical coordinates through the volume's spacing
 * and origin. The result is deterministic for a fixed volume and threshold.
 */
public class Skeletonizer {

	private static final Logger log = LoggerFactory.getLogger(Skeletonizer.class);

	private double spurLength = 0;
	private boolean cleanLeaves = false;

	public Skeletonizer() {
	}

	public Skeletonizer(double spurLength, boolean cleanLeaves) {
		setSpurLength(spurLength);
		setCleanLeaves(cleanLeaves);
	}

	/** Physical length below which dangling branches are pruned. 0 disables. */
	public void setSpurLength(double spurLength) {
		if (spurLength < 0 || Double.isNaN(spurLength)) {
			throw new IllegalArgumentException("Spur length must be >= 0: " + spurLength);
		}
		this.spurLength = spurLength;
	}

	public double getSpurLength() {
		return spurLength;
	}

	/** When set, every degree-1 node is removed iteratively after pruning. */
	public void setCleanLeaves(boolean cleanLeaves) {
		this.cleanLeaves = cleanLeaves;
	}

	public boolean isCleanLeaves() {
		return cleanLeaves;
	}

	/** The thinned volume. */
	public BinaryVolume skeleton(BinaryVolume volume) {
		if (volume == null || volume.occupiedCount() == 0) {
			throw new MalformedVolumeException("Volume is empty");
		}
		BinaryVolume skel = Thinning.thin(volume);
		if (skel.occupiedCount() == 0) {
			throw new MalformedVolumeException("Skeleton is empty");
		}
		return skel;
	}

	/** Physical coordinates of every skeleton voxel, in scan order. */
	public List<Point3> skeletonPoints(BinaryVolume volume) {
		BinaryVolume skel = skeleton(volume);
		List<Point3> pts = new ArrayList<>();
		for (int k = 0; k < skel.sizeZ(); k++) {
			for (int j = 0; j < skel.sizeY(); j++) {
				for (int i = 0; i < skel.sizeX(); i++) {
					if (skel.get(i, j, k)) {
						pts.add(skel.physical(i, j, k));
					}
				}
			}
		}
		return pts;
	}

	public SpatialGraph skeletonize(BinaryVolume volume) {
		BinaryVolume skel = skeleton(volume);
		WorkGraph g = trace(skel);
		int traced = g.edges.size();
		pruneSpurs(g);
		if (cleanLeaves) {
			removeLeaves(g);
		}
		if (g.nodes.isEmpty()) {
			throw new MalformedVolumeException("Skeleton graph is empty after pruning");
		}
		SpatialGraph graph = g.build();
		log.info("Skeleton graph: {} nodes, {} edges ({} traced, {} skeleton voxels)", graph.nodeCount(), graph.edgeCount(), traced, skel.occupiedCount());
		return graph;
	}

	private static WorkGraph trace(BinaryVolume skel) {
		int nx = skel.sizeX(), ny = skel.sizeY(), nz = skel.sizeZ();
		int[] cluster = new int[skel.voxelCount()];
		Arrays.fill(cluster, -1);
		boolean[] nodeVoxel = new boolean[skel.voxelCount()];
		for (int k = 0; k < nz; k++) {
			for (int j = 0; j < ny; j++) {
				for (int i = 0; i < nx; i++) {
					if (skel.get(i, j, k) && Thinning.neighbourCount(skel, i, j, k) != 2) {
						nodeVoxel[skel.index(i, j, k)] = true;
					}
				}
			}
		}

		WorkGraph g = new WorkGraph();
		List<int[]> stack = new ArrayList<>();
		// 1) node clusters
		for (int k = 0; k < nz; k++) {
			for (int j = 0; j < ny; j++) {
				for (int i = 0; i < nx; i++) {
					int idx = skel.index(i, j, k);
					if (!nodeVoxel[idx] || cluster[idx] >= 0) {
						continue;
					}
					int id = g.nodes.size();
					double sx = 0, sy = 0, sz = 0;
					int count = 0;
					stack.add(new int[] { i, j, k });
					cluster[idx] = id;
					while (!stack.isEmpty()) {
						int[] c = stack.remove(stack.size() - 1);
						sx += c[0];
						sy += c[1];
						sz += c[2];
						count++;
						for (int[] n : neighbours(skel, c[0], c[1], c[2])) {
							int nIdx = skel.index(n[0], n[1], n[2]);
							if (nodeVoxel[nIdx] && cluster[nIdx] < 0) {
								cluster[nIdx] = id;
								stack.add(n);
							}
						}
					}
					g.nodes.put(id, skel.physical(sx / count, sy / count, sz / count));
				}
			}
		}

		// 2) walks between clusters
		boolean[] visited = new boolean[skel.voxelCount()];
		for (int k = 0; k < nz; k++) {
			for (int j = 0; j < ny; j++) {
				for (int i = 0; i < nx; i++) {
					int idx = skel.index(i, j, k);
					if (!nodeVoxel[idx] || !skel.get(i, j, k)) {
						continue;
					}
					for (int[] s : neighbours(skel, i, j, k)) {
						int sIdx = skel.index(s[0], s[1], s[2]);
						if (nodeVoxel[sIdx] || visited[sIdx]) {
							continue;
						}
						List<Point3> line = new ArrayList<>();
						line.add(g.nodes.get(cluster[idx]));
						int[] prev = { i, j, k };
						int[] cur = s;
						visited[sIdx] = true;
						line.add(skel.physical(s[0], s[1], s[2]));
						int end = -1;
						while (end < 0) {
							int[] next = null;
							for (int[] n : neighbours(skel, cur[0], cur[1], cur[2])) {
								if (n[0] != prev[0] || n[1] != prev[1] || n[2] != prev[2]) {
									next = n;
									break;
								}
							}
							if (next == null) {
								throw new IllegalStateException("Pass-through voxel without continuation at " + skel.physical(cur[0], cur[1], cur[2]));
							}
							int nIdx = skel.index(next[0], next[1], next[2]);
							if (nodeVoxel[nIdx]) {
								end = cluster[nIdx];
								line.add(g.nodes.get(end));
							} else {
								if (visited[nIdx]) {
									throw new IllegalStateException("Walk re-entered a visited voxel at " + skel.physical(next[0], next[1], next[2]));
								}
								visited[nIdx] = true;
								line.add(skel.physical(next[0], next[1], next[2]));
								prev = cur;
								cur = next;
							}
						}
						g.addEdge(cluster[idx], end, line);
					}
				}
			}
		}

		// 3) closed loops without any node voxel
		for (int k = 0; k < nz; k++) {
			for (int j = 0; j < ny; j++) {
				for (int i = 0; i < nx; i++) {
					int idx = skel.index(i, j, k);
					if (!skel.get(i, j, k) || nodeVoxel[idx] || visited[idx]) {
						continue;
					}
					int id = g.nodes.isEmpty() ? 0 : g.nodes.lastKey() + 1;
					Point3 start = skel.physical(i, j, k);
					g.nodes.put(id, start);
					List<Point3> line = new ArrayList<>();
					line.add(start);
					visited[idx] = true;
					int[] prev = { i, j, k };
					int[] cur = neighbours(skel, i, j, k).get(0);
					while (cur[0] != i || cur[1] != j || cur[2] != k) {
						visited[skel.index(cur[0], cur[1], cur[2])] = true;
						line.add(skel.physical(cur[0], cur[1], cur[2]));
						int[] next = null;
						for (int[] n : neighbours(skel, cur[0], cur[1], cur[2])) {
							if (n[0] != prev[0] || n[1] != prev[1] || n[2] != prev[2]) {
								next = n;
								break;
							}
						}
						prev = cur;
						cur = next;
					}
					line.add(start);
					g.addEdge(id, id, line);
				}
			}
		}
		return g;
	}

	private void pruneSpurs(WorkGraph g) {
		if (spurLength <= 0) {
			return;
		}
		boolean changed = true;
		int pruned = 0;
		while (changed) {
			changed = false;
			Map<Integer, Integer> degree = g.degrees();
			Iterator<WorkEdge> it = g.edges.iterator();
			while (it.hasNext()) {
				WorkEdge e = it.next();
				if (e.length >= spurLength) {
					continue;
				}
				boolean spur;
				if (e.u == e.v) {
					spur = degree.get(e.u) > 2;
				} else {
					spur = degree.get(e.u) == 1 || degree.get(e.v) == 1;
				}
				if (spur) {
					it.remove();
					degree.merge(e.u, -1, Integer::sum);
					degree.merge(e.v, -1, Integer::sum);
					pruned++;
					changed = true;
				}
			}
			g.dropIsolated(degree);
		}
		log.debug("Pruned {} spurs shorter than {}", pruned, spurLength);
	}

	private static void removeLeaves(WorkGraph g) {
		boolean changed = true;
		while (changed) {
			changed = false;
			Map<Integer, Integer> degree = g.degrees();
			Iterator<WorkEdge> it = g.edges.iterator();
			while (it.hasNext()) {
				WorkEdge e = it.next();
				if (e.u != e.v && (degree.get(e.u) == 1 || degree.get(e.v) == 1)) {
					it.remove();
					degree.merge(e.u, -1, Integer::sum);
					degree.merge(e.v, -1, Integer::sum);
					changed = true;
				}
			}
			g.dropIsolated(degree);
		}
	}

	private static List<int[]> neighbours(BinaryVolume skel, int i, int j, int k) {
		List<int[]> out = new ArrayList<>(4);
		for (int dz = -1; dz <= 1; dz++) {
			for (int dy = -1; dy <= 1; dy++) {
				for (int dx = -1; dx <= 1; dx++) {
					if ((dx | dy | dz) != 0 && skel.get(i + dx, j + dy, k + dz)) {
						out.add(new int[] { i + dx, j + dy, k + dz });
					}
				}
			}
		}
		return out;
	}

	private static final class WorkEdge {
		final int u, v;
		final List<Point3> line;
		final double length;

		WorkEdge(int u, int v, List<Point3> line) {
			this.u = u;
			this.v = v;
			this.line = line;
			double len = 0;
			for (int i = 1; i < line.size(); i++) {
				len += line.get(i - 1).distance(line.get(i));
			}
			this.length = len;
		}
	}

	private static final class WorkGraph {
		final TreeMap<Integer, Point3> nodes = new TreeMap<>();
		final List<WorkEdge> edges = new ArrayList<>();

		void addEdge(int u, int v, List<Point3> line) {
			edges.add(new WorkEdge(u, v, line));
		}

		Map<Integer, Integer> degrees() {
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

		void dropIsolated(Map<Integer, Integer> degree) {
			degree.forEach((id, d) -> {
				if (d == 0) {
					nodes.remove(id);
				}
			});
		}

		SpatialGraph build() {
			SpatialGraph.Builder b = SpatialGraph.builder();
			nodes.forEach(b::addNode);
			for (WorkEdge e : edges) {
				b.addEdge(e.u, e.v, e.line);
			}
			return b.build();
		}
	}
}
