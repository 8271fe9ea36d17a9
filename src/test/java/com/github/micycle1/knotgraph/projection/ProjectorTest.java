package com.github.micycle1.knotgraph.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.DegenerateViewException;
import com.github.micycle1.knotgraph.TestGraphs;
import com.github.micycle1.knotgraph.graph.Point3;
import com.github.micycle1.knotgraph.graph.SpatialGraph;

public class ProjectorTest {

	private final Projector projector = new Projector();

	@Test
	public void testSimpleCrossingCode() {
		ProjectedView view = projector.project(TestGraphs.simpleCrossing(), Rotation.identity());
		assertEquals(1, view.crossingCount());
		// under-strand in, over-strand in (coming from below), under out, over out
		assertEquals("V[0];V[1];V[2];V[3];X[0,2,1,3]", view.getCode().toString());

		Crossing c = view.getCrossings().get(0);
		assertEquals(1, c.overEdge);
		assertEquals(0, c.underEdge);
		assertEquals(1.0, c.overDepth, 1e-12);
		assertEquals(0.0, c.underDepth, 1e-12);
		assertEquals(0.0, c.x, 1e-12);
		assertEquals(0.0, c.y, 1e-12);
		assertEquals(0, c.underIn());
		assertEquals(1, c.underOut());
	}

	@Test
	public void testFlippedViewSwapsOverAndUnder() {
		// half turn about x: depth changes sign
		ProjectedView view = projector.project(TestGraphs.simpleCrossing(), new Rotation(Math.PI, 0, 0, AxisOrder.XYZ));
		Crossing c = view.getCrossings().get(0);
		assertEquals(0, c.overEdge);
		assertEquals(1, c.underEdge);
		assertEquals(2, c.underIn());
	}

	@Test
	public void testArcsCoverEdges() {
		ProjectedView view = projector.project(TestGraphs.simpleCrossing(), Rotation.identity());
		assertEquals(4, view.getArcs().size());
		Arc first = view.getArcs().get(0);
		assertEquals(0, first.edgeId);
		assertEquals(-1, first.startCrossing);
		assertEquals(0, first.endCrossing);
		assertEquals(1.0, first.projectedLength(), 1e-12);
		double total = 0;
		for (Arc a : view.getArcs()) {
			total += a.projectedLength();
		}
		assertEquals(4.0, total, 1e-12);
	}

	@Test
	public void testHopfProjection() {
		SpatialGraph hopf = TestGraphs.hopf();
		ProjectedView view = projector.project(hopf, new Rotation(0.3, 0.4, 0.1, AxisOrder.XYZ));
		assertEquals(2, view.crossingCount());
		assertEquals(2, view.getCode().vertexCount());
		// two self-loops cut twice each
		assertEquals(4, view.getCode().arcCount());
		for (Crossing c : view.getCrossings()) {
			assertTrue(c.overDepth > c.underDepth);
			assertTrue(c.overEdge != c.underEdge);
		}
	}

	@Test
	public void testArcIdsAreDense() {
		ProjectedView view = projector.project(TestGraphs.trefoil(), new Rotation(1.1, 0.7, 0.2, AxisOrder.ZYX));
		Map<Integer, Integer> uses = new HashMap<>();
		for (PlanarDiagramCode.Token t : view.getCode().tokens()) {
			for (int a : t.arcs()) {
				uses.merge(a, 1, Integer::sum);
			}
		}
		assertEquals(view.getArcs().size(), uses.size());
		for (int a = 0; a < uses.size(); a++) {
			assertEquals(2, uses.get(a), "arc " + a);
		}
	}

	@Test
	public void testThreeStrandsThroughOnePointIsDegenerate() {
		DegenerateViewException e = assertThrows(DegenerateViewException.class, () -> projector.project(TestGraphs.threeLinesThroughOrigin(), Rotation.identity()));
		assertEquals(0.0, e.getX(), 1e-9);
		assertEquals(0.0, e.getY(), 1e-9);
	}

	@Test
	public void testEdgeOnViewIsDegenerate() {
		// the second circle is seen edge-on and collapses onto a line
		assertThrows(DegenerateViewException.class, () -> projector.project(TestGraphs.hopf(), Rotation.identity()));
	}

	@Test
	public void testDepthTieIsDegenerate() {
		SpatialGraph flat = SpatialGraph.builder().addNode(0, new Point3(-1, 0, 0))
				.addNode(1, new Point3(1, 0, 0)).addNode(2, new Point3(0, -1, 0))
				.addNode(3, new Point3(0, 1, 0)).addEdge(0, 1).addEdge(2, 3).build();
		assertThrows(DegenerateViewException.class, () -> projector.project(flat, Rotation.identity()));
	}

	@Test
	public void testNodePositionsAndSeparations() {
		ProjectedView view = projector.project(TestGraphs.simpleCrossing(), Rotation.identity());
		assertEquals(-1.0, view.getNodePositions().get(0)[0], 1e-12);
		SeparationTriangulation sep = view.getSeparations();
		// crossing first, then four nodes
		assertEquals(5, sep.getVertexCount());
		assertEquals(1.0, sep.nearestSeparation(0), 1e-12);
	}
}
