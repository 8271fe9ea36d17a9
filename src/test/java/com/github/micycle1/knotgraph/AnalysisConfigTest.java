package com.github.micycle1.knotgraph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.github.micycle1.knotgraph.projection.AxisOrder;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;

public class AnalysisConfigTest {

	@Test
	public void testDefaults() {
		AnalysisConfig c = new AnalysisConfig();
		assertNull(c.getManualView());
		assertEquals(AxisOrder.ZYX, c.getAxisOrder());
		assertEquals(Projector.DEFAULT_TOLERANCE, c.getTolerance());
		assertEquals(1e-3, c.getFinalTemperature());
		assertEquals(400, c.getAnnealSteps());
		assertEquals(50, c.getSamples());
		assertEquals(1, c.getWorkers());
		assertEquals(5, c.getMinorRetries());
		assertTrue(c.isNormalize());
		assertEquals(0.5, c.getSmoothingTolerance());
		assertEquals(0.0, c.getMergeDistance());
	}

	@Test
	public void testFromPropertiesFile() throws IOException {
		Properties p = new Properties();
		try (InputStream in = AnalysisConfigTest.class.getResourceAsStream("/analysis.properties")) {
			p.load(in);
		}
		AnalysisConfig c = AnalysisConfig.fromProperties(p);
		assertEquals(new Rotation(0.1, 0.2, 0.3, AxisOrder.YXZ), c.getManualView());
		assertEquals(50, c.getAnnealSteps());
		assertEquals(0.9, c.getCoolingFactor());
		assertEquals(Math.pow(0.9, 50), c.getFinalTemperature(), 1e-15);
		assertEquals(12, c.getSamples());
		assertTrue(c.isRandomSampling());
		assertEquals(2, c.getWorkers());
		assertEquals(17, c.getSeed());
		assertEquals(3, c.getMinorRetries());
		assertEquals(2.5, c.getSpurLength());
		assertFalse(c.isCleanLeaves());
		assertEquals(1.5, c.getMergeDistance());
	}

	@Test
	public void testTemperaturesFromProperties() {
		Properties p = new Properties();
		p.setProperty("knotgraph.anneal.initialTemperature", "2");
		p.setProperty("knotgraph.anneal.finalTemperature", "0.5");
		AnalysisConfig c = AnalysisConfig.fromProperties(p);
		assertEquals(2.0, c.getInitialTemperature());
		assertEquals(0.5, c.getFinalTemperature());
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = { //
			"knotgraph.unknown          | 1", //
			"knotgraph.workers          | two", //
			"knotgraph.workers          | 0", //
			"knotgraph.normalize        | yes", //
			"knotgraph.view.angles      | 0.1, 0.2", //
			"knotgraph.view.axisOrder   | ABC", //
			"knotgraph.tolerance        | -1", //
			"knotgraph.anneal.crowdingFraction | 0", //
			"knotgraph.anneal.coolingFactor    | 1.5", //
			"knotgraph.anneal.finalTemperature | 5" })
	public void testRejectsBadProperty(String key, String value) {
		Properties p = new Properties();
		p.setProperty(key, value);
		assertThrows(IllegalArgumentException.class, () -> AnalysisConfig.fromProperties(p));
	}

	@Test
	public void testManualView() {
		AnalysisConfig c = new AnalysisConfig().setManualView(0.5, 0, 0, AxisOrder.XYZ);
		assertEquals(new Rotation(0.5, 0, 0, AxisOrder.XYZ), c.getManualView());
		assertNull(c.clearManualView().getManualView());
		assertThrows(IllegalArgumentException.class, () -> c.setManualView(Double.NaN, 0, 0, AxisOrder.XYZ));
		assertThrows(NullPointerException.class, () -> c.setManualView(0, 0, 0, null));
	}

	@Test
	public void testCacheKeysFollowOptions() {
		AnalysisConfig a = new AnalysisConfig();
		AnalysisConfig b = new AnalysisConfig().setSamples(10);
		assertEquals(a.skeletonKey(), b.skeletonKey());
		assertEquals(a.minorKey(), b.minorKey());
		assertNotEquals(a.yamadaKey(), b.yamadaKey());
		assertNotEquals(a.yamadaKey(), new AnalysisConfig().setManualView(0, 0, 0, AxisOrder.ZYX).yamadaKey());
		assertNotEquals(a.viewKey(), new AnalysisConfig().setCoolingFactor(0.99).viewKey());
		assertNotEquals(a.skeletonKey(), new AnalysisConfig().setCleanLeaves(true).skeletonKey());
	}

	@Test
	public void testSetterValidation() {
		AnalysisConfig c = new AnalysisConfig();
		assertThrows(IllegalArgumentException.class, () -> c.setAnnealStarts(0));
		assertThrows(IllegalArgumentException.class, () -> c.setMinorRounds(0));
		assertThrows(IllegalArgumentException.class, () -> c.setSpurLength(-1));
		assertThrows(IllegalArgumentException.class, () -> c.setPenalties(0.5, 0, 0.1, 0.1));
		assertThrows(IllegalArgumentException.class, () -> c.setTemperatures(1, 2));
	}
}
