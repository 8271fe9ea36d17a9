package com.github.micycle1.knotgraph.skeleton;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>
 * Topology-preserving 3D thinning of a {@link BinaryVolume} down to a
 * one-voxel-wide curve skeleton.
 * </p>
 *
 * <p>
 * Each pass runs six directional sub-iterations (one per face direction). In a
 * sub-iteration, border voxels of that direction are collected first and then
 * deleted one by one, re-checking each against the current image, when they
 * are
 * </p>
 * <ul>
 * <li>not curve end points (at least two foreground 26-neighbours), and</li>
 * <li>simple for (26, 6) connectivity: exactly one 26-connected foreground
 * component in the 26-neighbourhood, and exactly one 6-connected background
 * component in the 18-neighbourhood that touches a face neighbour.</li>
 * </ul>
 * Passes repeat until nothing is removed. The scan order is fixed, so the
 * result is deterministic.
 */
public final class Thinning {

	// cube positions: (dx+1) + 3*(dy+1) + 9*(dz+1), centre = 13
	private static final int CENTER = 13;
	private static final int[][] ADJ26 = new int[27][];
	private static final int[][] ADJ6 = new int[27][];
	private static final boolean[] IN18 = new boolean[27];
	private static final int[] FACES = { 4, 22, 10, 16, 12, 14 };

	private static final int[][] DIRECTIONS = { { 0, 0, 1 }, { 0, 0, -1 }, { 0, 1, 0 }, { 0, -1, 0 }, { 1, 0, 0 }, { -1, 0, 0 } };

	static {
		for (int p = 0; p < 27; p++) {
			int[] a = coords(p);
			IN18[p] = p != CENTER && Math.abs(a[0]) + Math.abs(a[1]) + Math.abs(a[2]) <= 2;
			List<Integer> n26 = new ArrayList<>();
			List<Integer> n6 = new ArrayList<>();
			for (int q = 0; q < 27; q++) {
				if (q == p || q == CENTER) {
					continue;
				}
				int[] b = coords(q);
				int dx = Math.abs(a[0] - b[0]), dy = Math.abs(a[1] - b[1]), dz = Math.abs(a[2] - b[2]);
				if (dx <= 1 && dy <= 1 && dz <= 1) {
					n26.add(q);
					if (dx + dy + dz == 1) {
						n6.add(q);
					}
				}
			}
			ADJ26[p] = n26.stream().mapToInt(Integer::intValue).toArray();
			ADJ6[p] = n6.stream().mapToInt(Integer::intValue).toArray();
		}
	}

	private Thinning() {
	}

	/**
	 * Thins a copy of the volume and returns it; the input is untouched.
	 */
	public static BinaryVolume thin(BinaryVolume input) {
		BinaryVolume img = input.copy();
		int nx = img.sizeX(), ny = img.sizeY(), nz = img.sizeZ();
		boolean[] cube = new boolean[27];
		boolean removed = true;
		while (removed) {
			removed = false;
			for (int[] d : DIRECTIONS) {
				List<int[]> candidates = new ArrayList<>();
				for (int k = 0; k < nz; k++) {
					for (int j = 0; j < ny; j++) {
						for (int i = 0; i < nx; i++) {
							if (img.get(i, j, k) && !img.get(i + d[0], j + d[1], k + d[2])) {
								candidates.add(new int[] { i, j, k });
							}
						}
					}
				}
				for (int[] c : candidates) {
					load(img, c[0], c[1], c[2], cube);
					if (countNeighbours(cube) >= 2 && isSimple(cube)) {
						img.set(c[0], c[1], c[2], false);
						removed = true;
					}
				}
			}
		}
		return img;
	}

	/** Number of foreground voxels among the 26 neighbours. */
	public static int neighbourCount(BinaryVolume img, int i, int j, int k) {
		int c = 0;
		for (int dz = -1; dz <= 1; dz++) {
			for (int dy = -1; dy <= 1; dy++) {
				for (int dx = -1; dx <= 1; dx++) {
					if ((dx | dy | dz) != 0 && img.get(i + dx, j + dy, k + dz)) {
						c++;
					}
				}
			}
		}
		return c;
	}

	static boolean isSimple(boolean[] cube) {
		return foregroundComponents(cube) == 1 && backgroundComponents(cube) == 1;
	}

	private static int countNeighbours(boolean[] cube) {
		int c = 0;
		for (int p = 0; p < 27; p++) {
			if (p != CENTER && cube[p]) {
				c++;
			}
		}
		return c;
	}

	private static int foregroundComponents(boolean[] cube) {
		boolean[] seen = new boolean[27];
		int[] stack = new int[27];
		int components = 0;
		for (int p = 0; p < 27; p++) {
			if (p == CENTER || !cube[p] || seen[p]) {
				continue;
			}
			components++;
			int top = 0;
			stack[top++] = p;
			seen[p] = true;
			while (top > 0) {
				int q = stack[--top];
				for (int r : ADJ26[q]) {
					if (cube[r] && !seen[r]) {
						seen[r] = true;
						stack[top++] = r;
					}
				}
			}
		}
		return components;
	}

	private static int backgroundComponents(boolean[] cube) {
		boolean[] seen = new boolean[27];
		int[] stack = new int[27];
		int components = 0;
		for (int f : FACES) {
			if (cube[f] || seen[f]) {
				continue;
			}
			components++;
			int top = 0;
			stack[top++] = f;
			seen[f] = true;
			while (top > 0) {
				int q = stack[--top];
				for (int r : ADJ6[q]) {
					if (IN18[r] && !cube[r] && !seen[r]) {
						seen[r] = true;
						stack[top++] = r;
					}
				}
			}
		}
		return components;
	}

	private static void load(BinaryVolume img, int i, int j, int k, boolean[] cube) {
		int p = 0;
		for (int dz = -1; dz <= 1; dz++) {
			for (int dy = -1; dy <= 1; dy++) {
				for (int dx = -1; dx <= 1; dx++) {
					cube[p++] = img.get(i + dx, j + dy, k + dz);
				}
			}
		}
	}

	private static int[] coords(int p) {
		return new int[] { p % 3 - 1, (p / 3) % 3 - 1, p / 9 - 1 };
	}
}
