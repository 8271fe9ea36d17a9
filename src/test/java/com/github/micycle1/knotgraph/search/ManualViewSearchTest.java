package com.github.micycle1.knotgraph.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.DegenerateViewException;
import com.github.micycle1.knotgraph.ExhaustedSearchException;
import com.github.micycle1.knotgraph.TestGraphs;
import com.github.micycle1.knotgraph.projection.AxisOrder;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;
import com.github.micycle1.knotgraph.yamada.LaurentPolynomial;
import com.github.micycle1.knotgraph.yamada.YamadaEvaluator;

public class ManualViewSearchTest {

	private final ManualViewSearch manual = new ManualViewSearch(new Projector(), new ViewCost());

	@Test
	public void testFourValentNode() {
		YamadaResult result = manual.evaluate(TestGraphs.figureEight(), List.of(Rotation.identity()), new YamadaEvaluator());
		assertEquals(YamadaResult.Status.MANUAL, result.getStatus());
		// two circles touching at a planar 4-valent vertex
		assertEquals(LaurentPolynomial.parse("A^4 + 2*A^3 + 3*A^2 + 2*A + 1"), result.getPolynomial());
		assertEquals(0, result.getView().crossingCount());
	}

	@Test
	public void testSkipsDegenerateCandidates() {
		Rotation valid = new Rotation(0.3, 0.4, 0.1, AxisOrder.XYZ);
		ScoredView best = manual.best(TestGraphs.hopf(), List.of(Rotation.identity(), valid));
		assertEquals(valid, best.view.getRotation());
	}

	@Test
	public void testPicksLowestCost() {
		Rotation a = new Rotation(0.3, 0.4, 0.1, AxisOrder.XYZ);
		Rotation b = new Rotation(1.1, 0.7, 0.2, AxisOrder.ZYX);
		ScoredView best = manual.best(TestGraphs.trefoil(), List.of(a, b));
		ScoredView other = manual.view(TestGraphs.trefoil(), best.view.getRotation().equals(a) ? b : a);
		assertEquals(Math.min(best.cost, other.cost), best.cost);
	}

	@Test
	public void testAllDegenerate() {
		assertThrows(DegenerateViewException.class, () -> manual.view(TestGraphs.hopf(), Rotation.identity()));
		ExhaustedSearchException e = assertThrows(ExhaustedSearchException.class,
				() -> manual.evaluate(TestGraphs.hopf(), List.of(Rotation.identity()), new YamadaEvaluator()));
		assertEquals(1, e.getAttempts());
	}
}
