package com.github.micycle1.knotgraph;

/**
 * No valid (non-degenerate) view was found within the attempt budget. Callers
 * should retry with a larger budget or supply a manual view.
 */
public class ExhaustedSearchException extends KnotGraphException {

	private static final long serialVersionUID = 1L;

	private final int attempts;

	public ExhaustedSearchException(String message, int attempts) {
		super(message + " (" + attempts + " attempts)");
		this.attempts = attempts;
	}

	public int getAttempts() {
		return attempts;
	}
}
