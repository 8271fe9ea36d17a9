package com.github.micycle1.knotgraph;

/**
 * Root of the library's unchecked failures.
 */
public class KnotGraphException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public KnotGraphException(String message) {
		super(message);
	}

	public KnotGraphException(String message, Throwable cause) {
		super(message, cause);
	}
}
