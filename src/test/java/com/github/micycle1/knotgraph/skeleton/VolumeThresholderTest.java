package com.github.micycle1.knotgraph.skeleton;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.MalformedVolumeException;

public class VolumeThresholderTest {

	// 5 samples per axis over [-1, 1]
	private final VolumeThresholder grid = VolumeThresholder.cube(5, -1, 1);

	private static double[] field(double background) {
		double[] m = new double[125];
		Arrays.fill(m, background);
		return m;
	}

	@Test
	public void testSolidThicknessIsFloored() {
		double[] m = field(3.0);
		m[0] = 0.5;
		m[62] = -1.9;
		// floor is 10 / 5 = 2
		BinaryVolume v = grid.solid(m, 0.0);
		assertEquals(2, v.occupiedCount());
		assertTrue(v.get(2, 2, 2));
		assertArrayEquals(new double[] { 0.5, 0.5, 0.5 }, v.getSpacing());
		assertArrayEquals(new double[] { -1, -1, -1 }, v.getOrigin());
	}

	@Test
	public void testSolidAboveFloor() {
		double[] m = field(3.0);
		m[10] = 2.5;
		assertEquals(125, grid.solid(m, 3.0).occupiedCount());
		assertEquals(1, grid.solid(m, 2.5).occupiedCount());
	}

	@Test
	public void testShell() {
		double[] m = field(0.0);
		m[7] = 1.1;
		m[8] = 0.95;
		m[9] = 1.3;
		BinaryVolume v = grid.shell(m, 1.0, 0.2);
		assertEquals(2, v.occupiedCount());
		assertThrows(IllegalArgumentException.class, () -> grid.shell(m, 1.0, 0));
	}

	@Test
	public void testNothingPassesThreshold() {
		assertThrows(MalformedVolumeException.class, () -> grid.solid(field(5.0), 0.1));
		assertThrows(MalformedVolumeException.class, () -> grid.shell(field(0.0), 1.0, 0.1));
		assertThrows(MalformedVolumeException.class, () -> grid.solid(new double[10], 0.1));
	}

	@Test
	public void testBadGrid() {
		assertThrows(IllegalArgumentException.class, () -> VolumeThresholder.cube(1, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> VolumeThresholder.cube(4, 1, 1));
	}
}
