package com.github.micycle1.knotgraph.skeleton;

import java.util.Arrays;
import java.util.Collection;

import com.github.micycle1.knotgraph.MalformedVolumeException;
import com.github.micycle1.knotgraph.graph.Point3;

/**
 * 3D boolean occupancy grid with physical spacing and origin. Voxel (i, j, k)
 * sits at {@code origin + (i, j, k) * spacing}. Storage is x-fastest.
 */
public final class BinaryVolume {

	private final int nx, ny, nz;
	private final boolean[] occupied;
	private final double[] spacing;
	private final double[] origin;

	public BinaryVolume(int nx, int ny, int nz, double[] spacing, double[] origin) {
		this(nx, ny, nz, new boolean[checkedSize(nx, ny, nz)], spacing, origin);
	}

	public BinaryVolume(int nx, int ny, int nz, boolean[] occupied, double[] spacing, double[] origin) {
		int size = checkedSize(nx, ny, nz);
		if (occupied == null || occupied.length != size) {
			throw new MalformedVolumeException("Occupancy array does not match dimensions " + nx + "x" + ny + "x" + nz);
		}
		if (spacing == null || spacing.length != 3 || origin == null || origin.length != 3) {
			throw new MalformedVolumeException("Spacing and origin must have three components");
		}
		for (double s : spacing) {
			if (!(s > 0) || Double.isInfinite(s)) {
				throw new MalformedVolumeException("Spacing must be positive and finite: " + Arrays.toString(spacing));
			}
		}
		this.nx = nx;
		this.ny = ny;
		this.nz = nz;
		this.occupied = occupied.clone();
		this.spacing = spacing.clone();
		this.origin = origin.clone();
	}

	/**
	 * Voxelises a point cloud at the given isotropic spacing. The grid covers the
	 * bounding box of the points plus one empty voxel of padding on every side.
	 */
	public static BinaryVolume fromPoints(Collection<Point3> points, double spacing) {
		if (points == null || points.isEmpty()) {
			throw new MalformedVolumeException("Point cloud is empty");
		}
		if (!(spacing > 0)) {
			throw new MalformedVolumeException("Spacing must be positive: " + spacing);
		}
		double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY, minZ = Double.POSITIVE_INFINITY;
		double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY, maxZ = Double.NEGATIVE_INFINITY;
		for (Point3 p : points) {
			minX = Math.min(minX, p.x);
			minY = Math.min(minY, p.y);
			minZ = Math.min(minZ, p.z);
			maxX = Math.max(maxX, p.x);
			maxY = Math.max(maxY, p.y);
			maxZ = Math.max(maxZ, p.z);
		}
		double[] origin = { minX - spacing, minY - spacing, minZ - spacing };
		int nx = (int) Math.round((maxX - minX) / spacing) + 3;
		int ny = (int) Math.round((maxY - minY) / spacing) + 3;
		int nz = (int) Math.round((maxZ - minZ) / spacing) + 3;
		BinaryVolume v = new BinaryVolume(nx, ny, nz, new double[] { spacing, spacing, spacing }, origin);
		for (Point3 p : points) {
			int i = (int) Math.round((p.x - origin[0]) / spacing);
			int j = (int) Math.round((p.y - origin[1]) / spacing);
			int k = (int) Math.round((p.z - origin[2]) / spacing);
			v.occupied[v.index(i, j, k)] = true;
		}
		return v;
	}

	public int sizeX() {
		return nx;
	}

	public int sizeY() {
		return ny;
	}

	public int sizeZ() {
		return nz;
	}

	public int voxelCount() {
		return occupied.length;
	}

	public int index(int i, int j, int k) {
		return i + nx * (j + ny * k);
	}

	public boolean inBounds(int i, int j, int k) {
		return i >= 0 && j >= 0 && k >= 0 && i < nx && j < ny && k < nz;
	}

	/** Occupancy; voxels outside the grid read as empty. */
	public boolean get(int i, int j, int k) {
		return inBounds(i, j, k) && occupied[index(i, j, k)];
	}

	/** Sets a voxel. Volumes are mutable only through this method while being filled. */
	public void set(int i, int j, int k, boolean value) {
		if (!inBounds(i, j, k)) {
			throw new IndexOutOfBoundsException("Voxel (" + i + ", " + j + ", " + k + ") outside " + nx + "x" + ny + "x" + nz);
		}
		occupied[index(i, j, k)] = value;
	}

	public int occupiedCount() {
		int c = 0;
		for (boolean b : occupied) {
			if (b) {
				c++;
			}
		}
		return c;
	}

	public Point3 physical(double i, double j, double k) {
		return new Point3(origin[0] + i * spacing[0], origin[1] + j * spacing[1], origin[2] + k * spacing[2]);
	}

	public double[] getSpacing() {
		return spacing.clone();
	}

	public double[] getOrigin() {
		return origin.clone();
	}

	/** Copy of the raw occupancy, x-fastest. */
	public boolean[] toArray() {
		return occupied.clone();
	}

	/**
	 * 64-bit fingerprint of dimensions, geometry and occupancy. Computed on each
	 * call since the volume is mutable.
	 */
	public long fingerprint() {
		long h = 1125899906842597L;
		h = 31 * h + nx;
		h = 31 * h + ny;
		h = 31 * h + nz;
		h = 31 * h + Arrays.hashCode(spacing);
		h = 31 * h + Arrays.hashCode(origin);
		for (int i = 0; i < occupied.length; i++) {
			if (occupied[i]) {
				h = 31 * h + i;
			}
		}
		return h;
	}

	/** Deep copy; skeletonisation works on its own copy. */
	public BinaryVolume copy() {
		return new BinaryVolume(nx, ny, nz, occupied, spacing, origin);
	}

	private static int checkedSize(int nx, int ny, int nz) {
		if (nx <= 0 || ny <= 0 || nz <= 0) {
			throw new MalformedVolumeException("Volume dimensions must be positive: " + nx + "x" + ny + "x" + nz);
		}
		long size = (long) nx * ny * nz;
		if (size > Integer.MAX_VALUE - 8) {
			throw new MalformedVolumeException("Volume too large: " + nx + "x" + ny + "x" + nz);
		}
		return (int) size;
	}
}
