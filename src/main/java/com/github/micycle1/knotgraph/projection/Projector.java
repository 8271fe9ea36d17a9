package com.github.micycle1.knotgraph.projection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.DegenerateViewException;
import com.github.micycle1.knotgraph.graph.Point3;
import com.github.micycle1.knotgraph.graph.SpatialGraph;

/**
 * <p>
 * Projects a spatial graph onto the xy-plane after a {@link Rotation} and
 * encodes the result as a {@link PlanarDiagramCode}.
 * </p>
 * <p>
 * Every pair of polyline segments is intersected in the plane; each transverse
 * intersection becomes a crossing whose over-strand is the one with the larger
 * rotated depth. Edges are cut into arcs at their crossings and arcs are
 * numbered consecutively along each edge, edges in id order. Node tokens list
 * the arcs leaving a node counter-clockwise; crossing tokens start at the
 * incoming under-arc and proceed counter-clockwise.
 * </p>
 * <p>
 * A view is rejected with {@link DegenerateViewException} when strands touch
 * at a polyline vertex, overlap collinearly, tie in depth at a crossing, when
 * two crossings coincide, or when two strands leave a node in the same
 * direction. All comparisons use the projector's absolute tolerance.
 * </p>
 */
public class Projector {

	private static final Logger log = LoggerFactory.getLogger(Projector.class);

	public static final double DEFAULT_TOLERANCE = 1e-9;

	private static final double PARALLEL_SINE = 1e-12;
	private static final double ANGLE_TOLERANCE = 1e-9;

	private final double tolerance;

	public Projector() {
		this(DEFAULT_TOLERANCE);
	}

	public Projector(double tolerance) {
		if (!(tolerance > 0) || !Double.isFinite(tolerance)) {
			throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
		}
		this.tolerance = tolerance;
	}

	public double getTolerance() {
		return tolerance;
	}

	private static final class Segment {
		final int edge;
		final int index;
		final boolean first;
		final boolean last;
		final double ax, ay, az, dx, dy, dz, len;

		Segment(int edge, int index, boolean first, boolean last, double ax, double ay, double az, double bx, double by, double bz) {
			this.edge = edge;
			this.index = index;
			this.first = first;
			this.last = last;
			this.ax = ax;
			this.ay = ay;
			this.az = az;
			this.dx = bx - ax;
			this.dy = by - ay;
			this.dz = bz - az;
			this.len = Math.hypot(dx, dy);
		}
	}

	private static final class RawCrossing {
		final double x, y;
		final Segment s1, s2;
		final double t1, t2;
		final double z1, z2;
		int in1 = -1, out1 = -1, in2 = -1, out2 = -1;

		RawCrossing(double x, double y, Segment s1, double t1, double z1, Segment s2, double t2, double z2) {
			this.x = x;
			this.y = y;
			this.s1 = s1;
			this.t1 = t1;
			this.z1 = z1;
			this.s2 = s2;
			this.t2 = t2;
			this.z2 = z2;
		}
	}

	private static final class Event {
		final double param;
		final RawCrossing crossing;
		final boolean firstStrand;

		Event(double param, RawCrossing crossing, boolean firstStrand) {
			this.param = param;
			this.crossing = crossing;
			this.firstStrand = firstStrand;
		}
	}

	/**
	 * @throws DegenerateViewException if the projection under {@code rotation}
	 *                                 is not generic
	 */
	public ProjectedView project(SpatialGraph graph, Rotation rotation) {
		List<SpatialGraph.Edge> edges = graph.edges();
		List<SpatialGraph.Node> nodes = graph.nodes();
		int m = edges.size();

		// 1) rotate all polyline points and node coordinates in one product
		int[] offset = new int[m + 1];
		for (int k = 0; k < m; k++) {
			offset[k + 1] = offset[k] + edges.get(k).polyline.size();
		}
		int nodeOffset = offset[m];
		DMatrixRMaj points = new DMatrixRMaj(3, nodeOffset + nodes.size());
		for (int k = 0; k < m; k++) {
			List<Point3> line = edges.get(k).polyline;
			for (int j = 0; j < line.size(); j++) {
				setColumn(points, offset[k] + j, line.get(j));
			}
		}
		for (int i = 0; i < nodes.size(); i++) {
			setColumn(points, nodeOffset + i, nodes.get(i).coordinate);
		}
		DMatrixRMaj rotated = rotation.apply(points);
		int total = rotated.numCols;
		double[] px = new double[total];
		double[] py = new double[total];
		double[] pz = new double[total];
		for (int c = 0; c < total; c++) {
			px[c] = rotated.get(0, c);
			py[c] = rotated.get(1, c);
			pz[c] = rotated.get(2, c);
		}

		Map<Integer, double[]> nodePositions = new LinkedHashMap<>();
		for (int i = 0; i < nodes.size(); i++) {
			nodePositions.put(nodes.get(i).id, new double[] { px[nodeOffset + i], py[nodeOffset + i] });
		}

		// 2) segments
		List<Segment> segments = new ArrayList<>();
		List<Double> lengths = new ArrayList<>();
		for (int k = 0; k < m; k++) {
			int count = edges.get(k).polyline.size() - 1;
			for (int j = 0; j < count; j++) {
				int a = offset[k] + j;
				int b = a + 1;
				Segment s = new Segment(k, j, j == 0, j == count - 1, px[a], py[a], pz[a], px[b], py[b], pz[b]);
				segments.add(s);
				if (s.len > tolerance) {
					lengths.add(s.len);
				}
			}
		}
		checkFoldBacks(segments);

		// 3) crossings
		List<RawCrossing> raw = findCrossings(edges, segments);
		for (int i = 0; i < raw.size(); i++) {
			for (int j = i + 1; j < raw.size(); j++) {
				RawCrossing a = raw.get(i);
				RawCrossing b = raw.get(j);
				if (Math.hypot(a.x - b.x, a.y - b.y) <= tolerance) {
					throw new DegenerateViewException("Three or more strands meet in one point", a.x, a.y);
				}
			}
		}

		// 4) cut edges into arcs at their crossing events
		List<List<Event>> events = new ArrayList<>(m);
		for (int k = 0; k < m; k++) {
			events.add(new ArrayList<>());
		}
		for (RawCrossing c : raw) {
			events.get(c.s1.edge).add(new Event(c.s1.index + c.t1, c, true));
			events.get(c.s2.edge).add(new Event(c.s2.index + c.t2, c, false));
		}
		Map<RawCrossing, Integer> crossingIds = new LinkedHashMap<>();
		for (RawCrossing c : raw) {
			crossingIds.put(c, crossingIds.size());
		}

		List<Arc> arcs = new ArrayList<>();
		int[] firstArc = new int[m];
		int[] lastArc = new int[m];
		for (int k = 0; k < m; k++) {
			List<Event> ev = events.get(k);
			ev.sort(Comparator.comparingDouble(e -> e.param));
			int segCount = edges.get(k).polyline.size() - 1;
			firstArc[k] = arcs.size();
			for (int j = 0; j <= ev.size(); j++) {
				int id = arcs.size();
				double from = j == 0 ? 0 : ev.get(j - 1).param;
				double to = j == ev.size() ? segCount : ev.get(j).param;
				if (j > 0) {
					Event e = ev.get(j - 1);
					if (e.firstStrand) {
						e.crossing.out1 = id;
					} else {
						e.crossing.out2 = id;
					}
				}
				if (j < ev.size()) {
					Event e = ev.get(j);
					if (e.firstStrand) {
						e.crossing.in1 = id;
					} else {
						e.crossing.in2 = id;
					}
				}
				int startCrossing = j == 0 ? -1 : crossingIds.get(ev.get(j - 1).crossing);
				int endCrossing = j == ev.size() ? -1 : crossingIds.get(ev.get(j).crossing);
				arcs.add(buildArc(id, k, startCrossing, endCrossing, offset[k], from, to, px, py, pz));
			}
			lastArc[k] = arcs.size() - 1;
		}

		// 5) tokens
		List<PlanarDiagramCode.Token> tokens = new ArrayList<>();
		for (int i = 0; i < nodes.size(); i++) {
			SpatialGraph.Node node = nodes.get(i);
			tokens.add(vertexToken(graph, node, nodeOffset + i, offset, firstArc, lastArc, px, py));
		}
		List<Crossing> crossings = new ArrayList<>(raw.size());
		for (RawCrossing c : raw) {
			Crossing crossing = crossingToken(crossingIds.get(c), c);
			crossings.add(crossing);
			tokens.add(crossing.token());
		}
		PlanarDiagramCode code = new PlanarDiagramCode(tokens);

		double[] segmentLengths = new double[lengths.size()];
		for (int i = 0; i < segmentLengths.length; i++) {
			segmentLengths[i] = lengths.get(i);
		}
		log.debug("Projected {} under {}: {} crossings, {} arcs", graph, rotation, crossings.size(), arcs.size());
		return new ProjectedView(graph, rotation, code, arcs, crossings, nodePositions, segmentLengths);
	}

	private static void setColumn(DMatrixRMaj points, int col, Point3 p) {
		points.set(0, col, p.x);
		points.set(1, col, p.y);
		points.set(2, col, p.z);
	}

	/** Consecutive segments of one edge that double back onto each other. */
	private void checkFoldBacks(List<Segment> segments) {
		for (int i = 1; i < segments.size(); i++) {
			Segment a = segments.get(i - 1);
			Segment b = segments.get(i);
			if (a.edge != b.edge || a.len <= tolerance || b.len <= tolerance) {
				continue;
			}
			double cross = a.dx * b.dy - a.dy * b.dx;
			double dot = a.dx * b.dx + a.dy * b.dy;
			if (Math.abs(cross) <= PARALLEL_SINE * a.len * b.len && dot < 0) {
				throw new DegenerateViewException("Edge " + a.edge + " folds back onto itself", b.ax, b.ay);
			}
		}
	}

	private List<RawCrossing> findCrossings(List<SpatialGraph.Edge> edges, List<Segment> segments) {
		List<RawCrossing> out = new ArrayList<>();
		for (int i = 0; i < segments.size(); i++) {
			Segment s1 = segments.get(i);
			if (s1.len <= tolerance) {
				continue;
			}
			double minX1 = Math.min(s1.ax, s1.ax + s1.dx) - tolerance;
			double maxX1 = Math.max(s1.ax, s1.ax + s1.dx) + tolerance;
			double minY1 = Math.min(s1.ay, s1.ay + s1.dy) - tolerance;
			double maxY1 = Math.max(s1.ay, s1.ay + s1.dy) + tolerance;
			for (int j = i + 1; j < segments.size(); j++) {
				Segment s2 = segments.get(j);
				if (s2.len <= tolerance) {
					continue;
				}
				if (Math.max(s2.ax, s2.ax + s2.dx) < minX1 || Math.min(s2.ax, s2.ax + s2.dx) > maxX1 || Math.max(s2.ay, s2.ay + s2.dy) < minY1
						|| Math.min(s2.ay, s2.ay + s2.dy) > maxY1) {
					continue;
				}
				if (adjacent(edges, s1, s2)) {
					continue;
				}
				RawCrossing c = intersect(s1, s2);
				if (c != null) {
					out.add(c);
				}
			}
		}
		return out;
	}

	/** Segments that meet at a shared polyline vertex or node. */
	private static boolean adjacent(List<SpatialGraph.Edge> edges, Segment s1, Segment s2) {
		if (s1.edge == s2.edge && Math.abs(s1.index - s2.index) == 1) {
			return true;
		}
		SpatialGraph.Edge e1 = edges.get(s1.edge);
		SpatialGraph.Edge e2 = edges.get(s2.edge);
		if (s1.first && ((s2.first && e1.u == e2.u) || (s2.last && e1.u == e2.v))) {
			return true;
		}
		return s1.last && ((s2.first && e1.v == e2.u) || (s2.last && e1.v == e2.v));
	}

	private RawCrossing intersect(Segment s1, Segment s2) {
		double qx = s2.ax - s1.ax;
		double qy = s2.ay - s1.ay;
		double denom = s1.dx * s2.dy - s1.dy * s2.dx;
		if (Math.abs(denom) <= PARALLEL_SINE * s1.len * s2.len) {
			double offLine = Math.abs(qx * s1.dy - qy * s1.dx) / s1.len;
			if (offLine > tolerance) {
				return null;
			}
			double l2 = s1.len * s1.len;
			double t0 = (qx * s1.dx + qy * s1.dy) / l2;
			double t1 = ((qx + s2.dx) * s1.dx + (qy + s2.dy) * s1.dy) / l2;
			double lo = Math.max(Math.min(t0, t1), 0);
			double hi = Math.min(Math.max(t0, t1), 1);
			if (hi - lo >= -tolerance / s1.len) {
				double t = (lo + hi) / 2;
				throw new DegenerateViewException("Collinear overlapping strands", s1.ax + t * s1.dx, s1.ay + t * s1.dy);
			}
			return null;
		}
		double t = (qx * s2.dy - qy * s2.dx) / denom;
		double u = (qx * s1.dy - qy * s1.dx) / denom;
		double et = tolerance / s1.len;
		double eu = tolerance / s2.len;
		if (t < -et || t > 1 + et || u < -eu || u > 1 + eu) {
			return null;
		}
		double x = s1.ax + t * s1.dx;
		double y = s1.ay + t * s1.dy;
		if (t <= et || t >= 1 - et || u <= eu || u >= 1 - eu) {
			throw new DegenerateViewException("Strands meet at a polyline vertex", x, y);
		}
		double z1 = s1.az + t * s1.dz;
		double z2 = s2.az + u * s2.dz;
		if (Math.abs(z1 - z2) <= tolerance) {
			throw new DegenerateViewException("Strands tie in depth at a crossing", x, y);
		}
		return new RawCrossing(x, y, s1, t, z1, s2, u, z2);
	}

	private static Arc buildArc(int id, int edge, int startCrossing, int endCrossing, int base, double from, double to, double[] px, double[] py, double[] pz) {
		List<double[]> pts = new ArrayList<>();
		pts.add(interpolate(base, from, px, py, pz));
		for (int p = (int) Math.floor(from) + 1; p < to; p++) {
			pts.add(new double[] { px[base + p], py[base + p], pz[base + p] });
		}
		pts.add(interpolate(base, to, px, py, pz));
		double[] xs = new double[pts.size()];
		double[] ys = new double[pts.size()];
		double[] zs = new double[pts.size()];
		for (int i = 0; i < pts.size(); i++) {
			xs[i] = pts.get(i)[0];
			ys[i] = pts.get(i)[1];
			zs[i] = pts.get(i)[2];
		}
		return new Arc(id, edge, startCrossing, endCrossing, xs, ys, zs);
	}

	private static double[] interpolate(int base, double param, double[] px, double[] py, double[] pz) {
		int i = (int) Math.floor(param);
		double t = param - i;
		int a = base + i;
		if (t == 0) {
			return new double[] { px[a], py[a], pz[a] };
		}
		return new double[] { px[a] + t * (px[a + 1] - px[a]), py[a] + t * (py[a + 1] - py[a]), pz[a] + t * (pz[a + 1] - pz[a]) };
	}

	private PlanarDiagramCode.Token vertexToken(SpatialGraph graph, SpatialGraph.Node node, int col, int[] offset, int[] firstArc, int[] lastArc, double[] px,
			double[] py) {
		double nx = px[col];
		double ny = py[col];
		List<double[]> ends = new ArrayList<>(); // {angle, arc}
		for (int k : graph.incidentEdges(node.id)) {
			SpatialGraph.Edge e = graph.edge(k);
			int size = e.polyline.size();
			if (e.u == node.id) {
				ends.add(new double[] { leavingAngle(k, node.id, offset[k], 1, size, 1, nx, ny, px, py), firstArc[k] });
			}
			if (e.v == node.id) {
				ends.add(new double[] { leavingAngle(k, node.id, offset[k], size - 2, -1, -1, nx, ny, px, py), lastArc[k] });
			}
		}
		ends.sort(Comparator.comparingDouble(a -> a[0]));
		for (int i = 0; i < ends.size() && ends.size() > 1; i++) {
			double a = ends.get(i)[0];
			double b = i + 1 < ends.size() ? ends.get(i + 1)[0] : ends.get(0)[0] + 2 * Math.PI;
			if (b - a <= ANGLE_TOLERANCE) {
				throw new DegenerateViewException("Two strands leave node " + node.id + " in the same direction", nx, ny);
			}
		}
		int[] arcIds = new int[ends.size()];
		for (int i = 0; i < arcIds.length; i++) {
			arcIds[i] = (int) ends.get(i)[1];
		}
		return PlanarDiagramCode.vertex(arcIds);
	}

	/** Angle of the first polyline point that is clear of the node. */
	private double leavingAngle(int edge, int node, int base, int from, int until, int step, double nx, double ny, double[] px, double[] py) {
		for (int j = from; j != until; j += step) {
			double dx = px[base + j] - nx;
			double dy = py[base + j] - ny;
			if (Math.hypot(dx, dy) > tolerance) {
				return Math.atan2(dy, dx);
			}
		}
		throw new DegenerateViewException("Edge " + edge + " has no projected extent at node " + node, nx, ny);
	}

	private static Crossing crossingToken(int id, RawCrossing c) {
		boolean firstOver = c.z1 > c.z2;
		Segment under = firstOver ? c.s2 : c.s1;
		Segment over = firstOver ? c.s1 : c.s2;
		int underIn = firstOver ? c.in2 : c.in1;
		int underOut = firstOver ? c.out2 : c.out1;
		int overIn = firstOver ? c.in1 : c.in2;
		int overOut = firstOver ? c.out1 : c.out2;
		double turn = under.dx * over.dy - under.dy * over.dx;
		PlanarDiagramCode.Token token = turn < 0 ? PlanarDiagramCode.crossing(underIn, overOut, underOut, overIn)
				: PlanarDiagramCode.crossing(underIn, overIn, underOut, overOut);
		return new Crossing(id, c.x, c.y, over.edge, under.edge, Math.max(c.z1, c.z2), Math.min(c.z1, c.z2), token);
	}
}
