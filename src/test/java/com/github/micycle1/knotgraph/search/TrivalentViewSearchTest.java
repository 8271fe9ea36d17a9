package com.github.micycle1.knotgraph.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.ExhaustedSearchException;
import com.github.micycle1.knotgraph.TestGraphs;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.yamada.YamadaEvaluator;

public class TrivalentViewSearchTest {

	private static TrivalentViewSearch search(int samples) {
		TrivalentViewSearch search = new TrivalentViewSearch(new Projector(), new ViewCost(), new YamadaEvaluator());
		search.setSamples(samples);
		return search;
	}

	@Test
	public void testHopfLink() {
		YamadaResult result = search(30).evaluate(TestGraphs.hopf());
		assertEquals(YamadaResult.Status.AGREED, result.getStatus());
		assertEquals(TestGraphs.HOPF, result.getPolynomial());
		assertEquals(2, result.getCandidates().size());
		assertEquals(2, result.getView().crossingCount());
	}

	@Test
	public void testChiralityIsDetected() {
		assertEquals(TestGraphs.TREFOIL, search(30).evaluate(TestGraphs.trefoil()).getPolynomial());
		assertEquals(TestGraphs.MIRROR_TREFOIL, search(30).evaluate(TestGraphs.mirrorTrefoil()).getPolynomial());
	}

	@Test
	public void testTrivalentNodes() {
		assertEquals(TestGraphs.HANDCUFF, search(30).evaluate(TestGraphs.handcuff()).getPolynomial());
		assertEquals(TestGraphs.THETA, search(30).evaluate(TestGraphs.theta()).getPolynomial());
	}

	@Test
	public void testRandomSampling() {
		TrivalentViewSearch search = search(20);
		search.setRandomSampling(true);
		search.setSeed(42);
		YamadaResult result = search.evaluate(TestGraphs.trefoil());
		assertTrue(!result.isAmbiguous());
		assertEquals(TestGraphs.TREFOIL, result.getPolynomial());
	}

	@Test
	public void testSingleValidView() {
		// one sample looks straight down the z axis
		YamadaResult result = search(1).evaluate(TestGraphs.trefoil());
		assertEquals(YamadaResult.Status.SINGLE_VIEW, result.getStatus());
		assertEquals(TestGraphs.TREFOIL, result.getPolynomial());
	}

	@Test
	public void testNoValidView() {
		// the only sample sees the second circle edge-on
		ExhaustedSearchException e = assertThrows(ExhaustedSearchException.class, () -> search(1).evaluate(TestGraphs.hopf()));
		assertEquals(1, e.getAttempts());
	}

	@Test
	public void testRejectsHigherDegree() {
		assertThrows(IllegalArgumentException.class, () -> search(10).evaluate(TestGraphs.figureEight()));
		assertThrows(IllegalArgumentException.class, () -> search(0));
	}
}
