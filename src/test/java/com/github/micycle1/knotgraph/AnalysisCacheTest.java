package com.github.micycle1.knotgraph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class AnalysisCacheTest {

	@Test
	public void testGetAndPut() {
		AnalysisCache cache = new AnalysisCache();
		assertNull(cache.get(1L, "a", String.class));
		cache.put(1L, "a", "value");
		assertEquals("value", cache.get(1L, "a", String.class));
		assertNull(cache.get(1L, "b", String.class));
		assertNull(cache.get(2L, "a", String.class));
		assertEquals(1, cache.getHits());
		assertEquals(3, cache.getMisses());
		assertThrows(ClassCastException.class, () -> cache.get(1L, "a", Integer.class));
	}

	@Test
	public void testComputesOnce() {
		AnalysisCache cache = new AnalysisCache();
		AtomicInteger calls = new AtomicInteger();
		for (int i = 0; i < 3; i++) {
			assertEquals(42, cache.getOrCompute(5L, "p", Integer.class, () -> {
				calls.incrementAndGet();
				return 42;
			}));
		}
		assertEquals(1, calls.get());
		assertEquals(2, cache.getHits());
		assertEquals(1, cache.getMisses());
	}

	@Test
	public void testFailedComputationIsNotStored() {
		AnalysisCache cache = new AnalysisCache();
		assertThrows(DegenerateViewException.class, () -> cache.getOrCompute(5L, "p", Integer.class, () -> {
			throw new DegenerateViewException("tangent", 0, 0);
		}));
		assertEquals(0, cache.size());
	}

	@Test
	public void testInvalidateAndClear() {
		AnalysisCache cache = new AnalysisCache();
		cache.put(1L, "a", 1);
		cache.put(1L, "b", 2);
		cache.put(2L, "a", 3);
		assertEquals(2, cache.invalidate(1L));
		assertEquals(0, cache.invalidate(1L));
		assertEquals(1, cache.size());
		cache.get(2L, "a", Integer.class);
		cache.clear();
		assertEquals(0, cache.size());
		assertEquals(0, cache.getHits());
		assertEquals(0, cache.getMisses());
	}
}
