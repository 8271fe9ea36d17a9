package com.github.micycle1.knotgraph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class WorkersTest {

	private static List<Callable<Integer>> squares(int n) {
		List<Callable<Integer>> tasks = new ArrayList<>();
		for (int i = 0; i < n; i++) {
			int k = i;
			tasks.add(() -> {
				Thread.sleep((n - k) % 3);
				return k * k;
			});
		}
		return tasks;
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 8 })
	public void testResultsInSubmissionOrder(int workers) {
		List<Integer> results = Workers.invokeAll(squares(10), workers);
		for (int i = 0; i < 10; i++) {
			assertEquals(i * i, results.get(i));
		}
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 3 })
	public void testLibraryFailuresPassThrough(int workers) {
		ExhaustedSearchException failure = new ExhaustedSearchException("none", 7);
		List<Callable<Integer>> tasks = squares(3);
		tasks.add(() -> {
			throw failure;
		});
		ExhaustedSearchException e = assertThrows(ExhaustedSearchException.class, () -> Workers.invokeAll(tasks, workers));
		assertSame(failure, e);
		assertEquals(7, e.getAttempts());
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 3 })
	public void testCheckedFailuresAreWrapped(int workers) {
		List<Callable<Integer>> tasks = squares(3);
		tasks.add(() -> {
			throw new IOException("disk");
		});
		IllegalStateException e = assertThrows(IllegalStateException.class, () -> Workers.invokeAll(tasks, workers));
		assertEquals(IOException.class, e.getCause().getClass());
	}

	@Test
	public void testEmptyAndInvalid() {
		assertEquals(List.of(), Workers.invokeAll(new ArrayList<Callable<Integer>>(), 4));
		assertThrows(IllegalArgumentException.class, () -> Workers.invokeAll(squares(2), 0));
	}
}
