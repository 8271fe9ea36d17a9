package com.github.micycle1.knotgraph.minor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.micycle1.knotgraph.graph.ReferenceGraphs;
import com.github.micycle1.knotgraph.graph.SimpleGraph;

public class MinorEmbedderTest {

	private final MinorEmbedder embedder = new MinorEmbedder();

	@Test
	public void testPetersenInSubdividedPetersen() {
		SimpleGraph petersen = ReferenceGraphs.petersen();
		SimpleGraph host = subdivide(10, petersenEdges(), 0);
		MinorEmbedding e = embedder.find(host, petersen, 0, 5);
		assertTrue(e.isFound());
		assertEquals(0, e.getSeed());
		assertTrue(e.verify(host, petersen));
	}

	@Test
	public void testPetersenWithExtraEdges() {
		SimpleGraph petersen = ReferenceGraphs.petersen();
		SimpleGraph host = subdivide(10, petersenEdges(), 2);
		int n = host.vertexCount() - 2;
		List<int[]> edges = new ArrayList<>(host.edges());
		edges.add(new int[] { 0, n });
		edges.add(new int[] { n, n + 1 });
		edges.add(new int[] { 3, n + 1 });
		host = new SimpleGraph(n + 2, edges);
		MinorEmbedding e = embedder.find(host, petersen, 0, 5);
		assertTrue(e.verify(host, petersen));
	}

	@Test
	public void testSmallTargetsInPetersen() {
		SimpleGraph petersen = ReferenceGraphs.petersen();
		for (SimpleGraph target : List.of(ReferenceGraphs.completeBipartite(3, 3), ReferenceGraphs.complete(4), ReferenceGraphs.cycle(5), petersen)) {
			MinorEmbedding e = embedder.find(petersen, target, 0, 5);
			assertTrue(e.verify(petersen, target), target.toString());
		}
	}

	@Test
	public void testK7InSubdividedK7() {
		SimpleGraph k7 = ReferenceGraphs.complete(7);
		SimpleGraph host = subdivide(7, k7.edges(), 0);
		MinorEmbedding e = embedder.find(host, k7, 0, 5);
		assertTrue(e.verify(host, k7));
		assertEquals(7, e.getChains().size());
	}

	@Test
	public void testCycleHasNoK4Minor() {
		MinorEmbedding e = embedder.find(ReferenceGraphs.cycle(10), ReferenceGraphs.complete(4), 0, 5);
		assertFalse(e.isFound());
		assertTrue(e.getChains().isEmpty());
		assertThrows(IllegalStateException.class, () -> e.chain(0));
	}

	@Test
	public void testHostTooSmall() {
		assertFalse(embedder.attempt(ReferenceGraphs.triangle(), ReferenceGraphs.complete(4), 0).isFound());
		assertFalse(embedder.find(ReferenceGraphs.complete(4), ReferenceGraphs.complete(5), 0, 3).isFound());
		assertTrue(embedder.find(ReferenceGraphs.complete(4), ReferenceGraphs.triangle(), 0, 3).isFound());
	}

	@Test
	public void testEmptyTarget() {
		MinorEmbedding e = embedder.attempt(ReferenceGraphs.triangle(), new SimpleGraph(0, List.of()), 4);
		assertTrue(e.isFound());
		assertTrue(e.getChains().isEmpty());
	}

	@Test
	public void testWorkersReturnLowestSeed() {
		SimpleGraph petersen = ReferenceGraphs.petersen();
		SimpleGraph host = subdivide(10, petersenEdges(), 0);
		MinorEmbedder pooled = new MinorEmbedder();
		pooled.setWorkers(3);
		MinorEmbedding a = embedder.find(host, petersen, 0, 5);
		MinorEmbedding b = pooled.find(host, petersen, 0, 5);
		assertEquals(a.getSeed(), b.getSeed());
		assertEquals(a.getChains(), b.getChains());
	}

	@Test
	public void testRejectsBadSettings() {
		assertThrows(IllegalArgumentException.class, () -> embedder.setMaxRounds(0));
		assertThrows(IllegalArgumentException.class, () -> embedder.setWorkers(0));
		assertThrows(IllegalArgumentException.class, () -> embedder.find(ReferenceGraphs.triangle(), ReferenceGraphs.triangle(), 0, 0));
	}

	// each edge u-v becomes u-k-v with a fresh vertex k, numbered in edge order;
	// spare vertices are left isolated
	private static SimpleGraph subdivide(int n, List<int[]> graphEdges, int spare) {
		List<int[]> edges = new ArrayList<>();
		int k = n;
		for (int[] e : graphEdges) {
			edges.add(new int[] { e[0], k });
			edges.add(new int[] { k, e[1] });
			k++;
		}
		return new SimpleGraph(k + spare, edges);
	}

	// construction order of ReferenceGraphs.petersen()
	private static List<int[]> petersenEdges() {
		List<int[]> edges = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			edges.add(new int[] { i, (i + 1) % 5 });
			edges.add(new int[] { 5 + i, 5 + (i + 2) % 5 });
			edges.add(new int[] { i, 5 + i });
		}
		return edges;
	}
}
