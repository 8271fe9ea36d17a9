package com.github.micycle1.knotgraph;

/**
 * Input volume that cannot be skeletonised: empty, inconsistent in shape or
 * spacing, or thinning to nothing.
 */
public class MalformedVolumeException extends KnotGraphException {

	private static final long serialVersionUID = 1L;

	public MalformedVolumeException(String message) {
		super(message);
	}
}
