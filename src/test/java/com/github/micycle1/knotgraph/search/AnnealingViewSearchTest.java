package com.github.micycle1.knotgraph.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.TestGraphs;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.projection.AxisOrder;
import com.github.micycle1.knotgraph.projection.Projector;

public class AnnealingViewSearchTest {

	private static AnnealingViewSearch search(int workers) {
		AnnealingViewSearch search = new AnnealingViewSearch(new Projector(), new ViewCost());
		search.setSteps(25);
		search.setStarts(3);
		search.setSeed(11);
		search.setWorkers(workers);
		return search;
	}

	@Test
	public void testFindsValidView() {
		ScoredView best = search(1).search(TestGraphs.hopf());
		// a linked pair always crosses at least twice
		assertTrue(best.view.crossingCount() >= 2);
		assertTrue(best.cost >= best.view.crossingCount());
		assertEquals(AxisOrder.ZYX, best.view.getRotation().getOrder());
	}

	@Test
	public void testResultIndependentOfWorkerCount() {
		SpatialGraph trefoil = TestGraphs.trefoil();
		ScoredView sequential = search(1).search(trefoil);
		ScoredView pooled = search(3).search(trefoil);
		assertEquals(sequential.view.getRotation(), pooled.view.getRotation());
		assertEquals(sequential.cost, pooled.cost);
	}

	@Test
	public void testBestStartIsAtLeastAsGoodAsEachStart() {
		AnnealingViewSearch search = search(1);
		SpatialGraph graph = TestGraphs.handcuff();
		ScoredView best = search.search(graph);
		for (int i = 0; i < search.getStarts(); i++) {
			ScoredView s = search.anneal(graph, search.getSeed() + i);
			assertTrue(best.cost <= s.cost);
		}
	}

	@Test
	public void testAxisOrderIsUsed() {
		AnnealingViewSearch search = search(1);
		search.setAxisOrder(AxisOrder.XYZ);
		assertEquals(AxisOrder.XYZ, search.search(TestGraphs.theta()).view.getRotation().getOrder());
	}

	@Test
	public void testRejectsBadSettings() {
		AnnealingViewSearch search = search(1);
		assertThrows(IllegalArgumentException.class, () -> search.setSteps(0));
		assertThrows(IllegalArgumentException.class, () -> search.setStarts(0));
		assertThrows(IllegalArgumentException.class, () -> search.setWorkers(0));
		assertThrows(IllegalArgumentException.class, () -> search.setTemperatures(1e-3, 1.0));
		assertThrows(IllegalArgumentException.class, () -> search.setTemperatures(0, 0));
	}
}
