package com.github.micycle1.knotgraph;

/**
 * Malformed planar diagram code, e.g. a dangling arc id. Indicates a projection
 * bug upstream; evaluation of that diagram is aborted.
 */
public class InvalidDiagramException extends KnotGraphException {

	private static final long serialVersionUID = 1L;

	public InvalidDiagramException(String message) {
		super(message);
	}

	public InvalidDiagramException(String message, Throwable cause) {
		super(message, cause);
	}
}
