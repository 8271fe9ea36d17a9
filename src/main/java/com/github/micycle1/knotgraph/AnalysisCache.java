package com.github.micycle1.knotgraph;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Results of earlier analyses, keyed by the fingerprint of the input (graph or
 * volume) and a string describing the parameters that produced them. The
 * cache is owned by the caller; nothing is evicted unless
 * {@link #invalidate(long)} or {@link #clear()} is called. Safe for concurrent
 * use.
 */
public final class AnalysisCache {

	private static final Logger log = LoggerFactory.getLogger(AnalysisCache.class);

	private static final class Key {
		final long fingerprint;
		final String parameters;

		Key(long fingerprint, String parameters) {
			this.fingerprint = fingerprint;
			this.parameters = Objects.requireNonNull(parameters, "parameters");
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Key)) {
				return false;
			}
			Key o = (Key) obj;
			return fingerprint == o.fingerprint && parameters.equals(o.parameters);
		}

		@Override
		public int hashCode() {
			return Long.hashCode(fingerprint) * 31 + parameters.hashCode();
		}
	}

	private final ConcurrentHashMap<Key, Object> entries = new ConcurrentHashMap<>();
	private final AtomicLong hits = new AtomicLong();
	private final AtomicLong misses = new AtomicLong();

	/**
	 * @return the cached value, or null if absent
	 * @throws ClassCastException if the entry holds another type
	 */
	public <T> T get(long fingerprint, String parameters, Class<T> type) {
		Object value = entries.get(new Key(fingerprint, parameters));
		if (value == null) {
			misses.incrementAndGet();
			return null;
		}
		hits.incrementAndGet();
		return type.cast(value);
	}

	public void put(long fingerprint, String parameters, Object value) {
		entries.put(new Key(fingerprint, parameters), Objects.requireNonNull(value, "value"));
	}

	/**
	 * Returns the cached value or computes and stores it. The computation runs
	 * outside any lock, so it may itself use the cache; if two threads race, the
	 * first stored value wins.
	 */
	public <T> T getOrCompute(long fingerprint, String parameters, Class<T> type, Supplier<T> compute) {
		T value = get(fingerprint, parameters, type);
		if (value != null) {
			return value;
		}
		T computed = Objects.requireNonNull(compute.get(), "computed value");
		Object previous = entries.putIfAbsent(new Key(fingerprint, parameters), computed);
		return previous == null ? computed : type.cast(previous);
	}

	/** Drops every entry of one input; returns how many were removed. */
	public int invalidate(long fingerprint) {
		int removed = 0;
		for (Iterator<Key> it = entries.keySet().iterator(); it.hasNext();) {
			if (it.next().fingerprint == fingerprint) {
				it.remove();
				removed++;
			}
		}
		log.debug("Invalidated {} entries of input {}", removed, Long.toHexString(fingerprint));
		return removed;
	}

	public void clear() {
		entries.clear();
		hits.set(0);
		misses.set(0);
	}

	public int size() {
		return entries.size();
	}

	public long getHits() {
		return hits.get();
	}

	public long getMisses() {
		return misses.get();
	}

	@Override
	public String toString() {
		return "AnalysisCache[" + entries.size() + " entries, " + hits.get() + " hits, " + misses.get() + " misses]";
	}
}
