package com.github.micycle1.knotgraph.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.TestGraphs;
import com.github.micycle1.knotgraph.graph.Point3;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.projection.ProjectedView;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;

public class ViewCostTest {

	private final ProjectedView crossing = new Projector().project(TestGraphs.simpleCrossing(), Rotation.identity());

	@Test
	public void testWellSpreadViewCostsItsCrossings() {
		assertEquals(1.0, new ViewCost().score(crossing), 1e-12);
	}

	@Test
	public void testCrowdingPenalty() {
		// bounding box diagonal is 3, so the reference separation is 3 and every
		// one of the five features sits at distance 1 from its nearest neighbour
		ViewCost cost = new ViewCost(1.0, 1.0, 0.0, 0.1);
		assertEquals(1.0 + 5 * (1 - 1 / 3.0), cost.score(crossing), 1e-9);
	}

	@Test
	public void testShortSegmentPenalty() {
		// both projected segments have length 2 against a reference of 3
		ViewCost cost = new ViewCost(0.0, 0.1, 1.0, 1.0);
		assertEquals(1.0 + 2 * (1 - 2 / 3.0), cost.score(crossing), 1e-9);
	}

	@Test
	public void testScaleInvariant() {
		SpatialGraph big = SpatialGraph.builder().addNode(0, new Point3(-10, 0, 0)).addNode(1, new Point3(10, 0, 0)).addNode(2, new Point3(0, -10, 10))
				.addNode(3, new Point3(0, 10, 10)).addEdge(0, 1).addEdge(2, 3).build();
		ViewCost cost = new ViewCost(1.0, 1.0, 1.0, 1.0);
		assertEquals(cost.score(crossing), cost.score(new Projector().project(big, Rotation.identity())), 1e-9);
	}

	@Test
	public void testPenaltiesOnlyAdd() {
		ProjectedView trefoil = new Projector().project(TestGraphs.trefoil(), Rotation.identity());
		assertTrue(new ViewCost(1.0, 0.5, 1.0, 0.5).score(trefoil) >= trefoil.crossingCount());
	}

	@Test
	public void testRejectsBadWeights() {
		assertThrows(IllegalArgumentException.class, () -> new ViewCost(-1, 0.1, 0, 0.1));
		assertThrows(IllegalArgumentException.class, () -> new ViewCost(0, 0, 0, 0.1));
		assertThrows(IllegalArgumentException.class, () -> new ViewCost(0, 0.1, 0, Double.NaN));
	}
}
