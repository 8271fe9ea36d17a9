package com.github.micycle1.knotgraph.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.TestGraphs;

public class SpatialGraphTest {

	private static final Point3 P = new Point3(0, 0, 0);
	private static final Point3 Q = new Point3(3, 4, 0);

	@Test
	public void testSelfLoopCountsTwice() {
		SpatialGraph hopf = TestGraphs.hopf();
		assertEquals(2, hopf.degree(0));
		assertEquals(List.of(0), hopf.incidentEdges(0));
		assertTrue(hopf.edge(0).isSelfLoop());
		assertEquals(0, hopf.edge(0).other(0));
	}

	@Test
	public void testEdgesAreStoredLowToHigh() {
		Point3 mid = new Point3(1, 1, 1);
		SpatialGraph g = SpatialGraph.builder().addNode(5, Q).addNode(2, P).addEdge(5, 2, List.of(Q, mid, P)).build();
		SpatialGraph.Edge e = g.edge(0);
		assertEquals(2, e.u);
		assertEquals(5, e.v);
		assertEquals(List.of(P, mid, Q), e.polyline);
		// nodes sorted by id
		assertEquals(2, g.nodes().get(0).id);
		assertEquals(5, e.other(2));
	}

	@Test
	public void testParallelEdges() {
		SpatialGraph theta = TestGraphs.theta();
		assertEquals(3, theta.edgeCount());
		for (int i = 0; i < 3; i++) {
			assertEquals(i, theta.edge(i).parallelIndex);
		}
		assertEquals(3, theta.maxDegree());
		assertEquals(2.0, theta.edge(0).length, 1e-12);
	}

	@Test
	public void testStraightEdgeLength() {
		SpatialGraph g = SpatialGraph.builder().addNode(0, P).addNode(1, Q).addEdge(0, 1).build();
		assertEquals(5.0, g.edge(0).length, 1e-12);
	}

	@Test
	public void testEqualityAndFingerprint() {
		assertEquals(TestGraphs.trefoil(), TestGraphs.trefoil());
		assertEquals(TestGraphs.trefoil().fingerprint(), TestGraphs.trefoil().fingerprint());
		assertNotEquals(TestGraphs.trefoil(), TestGraphs.mirrorTrefoil());
		assertNotEquals(TestGraphs.trefoil().fingerprint(), TestGraphs.mirrorTrefoil().fingerprint());
	}

	@Test
	public void testBuilderValidation() {
		assertThrows(IllegalArgumentException.class, () -> SpatialGraph.builder().addNode(0, P).addNode(0, Q));
		assertThrows(IllegalArgumentException.class, () -> SpatialGraph.builder().addNode(0, P).addEdge(0, 1));
		assertThrows(IllegalArgumentException.class, () -> SpatialGraph.builder().addNode(0, P).addNode(1, Q).addEdge(0, 1, List.of(P)));
		assertThrows(IllegalArgumentException.class,
				() -> SpatialGraph.builder().addNode(0, P).addNode(1, Q).addEdge(0, 1, List.of(P, new Point3(3, 4, 1))));
		assertThrows(IllegalArgumentException.class, () -> TestGraphs.hopf().node(7));
	}
}
