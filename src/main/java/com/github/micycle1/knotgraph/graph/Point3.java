package com.github.micycle1.knotgraph.graph;

/**
 * Immutable 3D coordinate. Used for node positions and polyline vertices of a
 * {@link SpatialGraph}.
 */
public final class Point3 {

	public final double x;
	public final double y;
	public final double z;

	public Point3(double x, double y, double z) {
		this.x = x;
		this.y = y;
		this.z = z;
	}

	public double distance(Point3 o) {
		double dx = x - o.x, dy = y - o.y, dz = z - o.z;
		return Math.sqrt(dx * dx + dy * dy + dz * dz);
	}

	public Point3 midpoint(Point3 o) {
		return new Point3(0.5 * (x + o.x), 0.5 * (y + o.y), 0.5 * (z + o.z));
	}

	/**
	 * Distance from this point to the infinite line through a and b (or to a when a
	 * and b coincide).
	 */
	public double distanceToLine(Point3 a, Point3 b) {
		double ux = b.x - a.x, uy = b.y - a.y, uz = b.z - a.z;
		double wx = x - a.x, wy = y - a.y, wz = z - a.z;
		double uu = ux * ux + uy * uy + uz * uz;
		if (uu <= 1e-30) {
			return distance(a);
		}
		// |u x w| / |u|
		double cx = uy * wz - uz * wy;
		double cy = uz * wx - ux * wz;
		double cz = ux * wy - uy * wx;
		return Math.sqrt((cx * cx + cy * cy + cz * cz) / uu);
	}

	public boolean approxEquals(Point3 o, double tol) {
		return Math.abs(x - o.x) <= tol && Math.abs(y - o.y) <= tol && Math.abs(z - o.z) <= tol;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Point3)) {
			return false;
		}
		Point3 o = (Point3) obj;
		return Double.compare(x, o.x) == 0 && Double.compare(y, o.y) == 0 && Double.compare(z, o.z) == 0;
	}

	@Override
	public int hashCode() {
		int h = Double.hashCode(x);
		h = 31 * h + Double.hashCode(y);
		return 31 * h + Double.hashCode(z);
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ", " + z + ")";
	}
}
