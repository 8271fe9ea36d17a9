package com.github.micycle1.knotgraph;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs independent tasks on a fixed thread pool and collects their results in
 * submission order. With a single worker the tasks run on the calling thread.
 */
public final class Workers {

	private Workers() {
	}

	/**
	 * @throws KnotGraphException    rethrown as-is when a task failed with one
	 * @throws IllegalStateException wrapping any other task failure or an
	 *                               interruption (the interrupt flag is restored)
	 */
	public static <T> List<T> invokeAll(List<Callable<T>> tasks, int workers) {
		if (workers < 1) {
			throw new IllegalArgumentException("Worker count must be >= 1: " + workers);
		}
		List<T> results = new ArrayList<>(tasks.size());
		if (workers == 1 || tasks.size() <= 1) {
			for (Callable<T> task : tasks) {
				try {
					results.add(task.call());
				} catch (RuntimeException e) {
					throw e;
				} catch (Exception e) {
					throw new IllegalStateException("Task failed", e);
				}
			}
			return results;
		}
		ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, tasks.size()));
		try {
			List<Future<T>> futures = new ArrayList<>(tasks.size());
			for (Callable<T> task : tasks) {
				futures.add(executor.submit(task));
			}
			for (Future<T> future : futures) {
				results.add(future.get());
			}
			return results;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for workers", e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof KnotGraphException) {
				throw (KnotGraphException) e.getCause();
			}
			throw new IllegalStateException("Worker task failed", e.getCause());
		} finally {
			executor.shutdownNow();
		}
	}
}
