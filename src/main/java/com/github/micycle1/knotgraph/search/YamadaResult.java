package com.github.micycle1.knotgraph.search;

import java.util.Collections;
import java.util.List;

import com.github.micycle1.knotgraph.projection.ProjectedView;
import com.github.micycle1.knotgraph.yamada.LaurentPolynomial;

/**
 * Outcome of evaluating a graph's Yamada polynomial through one or more views.
 * When {@link #isAmbiguous()} the evaluated views disagreed and no polynomial
 * is selected; every (view, polynomial) pair is available for inspection.
 */
public final class YamadaResult {

	public enum Status {
		/** two independent views gave the same polynomial */
		AGREED,
		/** only one valid view was available */
		SINGLE_VIEW,
		/** a caller-supplied view; valid for that diagram only */
		MANUAL,
		/** every evaluated view disagreed with every other */
		AMBIGUOUS
	}

	public static final class Candidate {
		public final ProjectedView view;
		public final LaurentPolynomial polynomial;

		public Candidate(ProjectedView view, LaurentPolynomial polynomial) {
			this.view = view;
			this.polynomial = polynomial;
		}

		@Override
		public String toString() {
			return polynomial + " from " + view.getRotation() + " (" + view.crossingCount() + " crossings)";
		}
	}

	private final Status status;
	private final Candidate selected;
	private final List<Candidate> candidates;

	YamadaResult(Status status, Candidate selected, List<Candidate> candidates) {
		this.status = status;
		this.selected = selected;
		this.candidates = Collections.unmodifiableList(candidates);
	}

	public Status getStatus() {
		return status;
	}

	public boolean isAmbiguous() {
		return status == Status.AMBIGUOUS;
	}

	/**
	 * @throws IllegalStateException when the result is ambiguous
	 */
	public LaurentPolynomial getPolynomial() {
		if (selected == null) {
			throw new IllegalStateException("Ambiguous result: " + candidates.size() + " disagreeing views");
		}
		return selected.polynomial;
	}

	/**
	 * @throws IllegalStateException when the result is ambiguous
	 */
	public ProjectedView getView() {
		if (selected == null) {
			throw new IllegalStateException("Ambiguous result: " + candidates.size() + " disagreeing views");
		}
		return selected.view;
	}

	/** All evaluated (view, polynomial) pairs in evaluation order. */
	public List<Candidate> getCandidates() {
		return candidates;
	}

	@Override
	public String toString() {
		return "YamadaResult[" + status + (selected == null ? ", " + candidates.size() + " candidates" : ": " + selected.polynomial) + "]";
	}
}
