package com.github.micycle1.knotgraph.projection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.github.micycle1.knotgraph.InvalidDiagramException;

/**
 * <p>
 * Planar diagram code of a projected spatial graph: an ordered list of
 * {@code V[...]} tokens (a node and the arcs leaving it, counter-clockwise)
 * and {@code X[a,b,c,d]} tokens (a crossing, listed counter-clockwise starting
 * from the incoming under-arc, so {@code a} and {@code c} are the under-strand
 * and {@code b} and {@code d} the over-strand).
 * </p>
 * <p>
 * Every arc id occurs exactly twice over all tokens. The textual form joins
 * tokens with {@code ;}, e.g. {@code V[2,0];V[5,3];X[0,5,1,4];X[3,2,4,1]}.
 * </p>
 */
public final class PlanarDiagramCode {

	public enum Kind {
		VERTEX('V'), CROSSING('X');

		final char symbol;

		Kind(char symbol) {
			this.symbol = symbol;
		}
	}

	public static final class Token {
		public final Kind kind;
		private final int[] arcs;

		private Token(Kind kind, int[] arcs) {
			this.kind = kind;
			this.arcs = arcs;
		}

		public int size() {
			return arcs.length;
		}

		public int arc(int i) {
			return arcs[i];
		}

		public int[] arcs() {
			return arcs.clone();
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Token)) {
				return false;
			}
			Token o = (Token) obj;
			return kind == o.kind && Arrays.equals(arcs, o.arcs);
		}

		@Override
		public int hashCode() {
			return 31 * kind.hashCode() + Arrays.hashCode(arcs);
		}

		@Override
		public String toString() {
			return kind.symbol + Arrays.stream(arcs).mapToObj(Integer::toString).collect(Collectors.joining(",", "[", "]"));
		}
	}

	private final List<Token> tokens;

	/**
	 * @throws InvalidDiagramException if an arc id is negative or does not occur
	 *                                 exactly twice
	 */
	public PlanarDiagramCode(List<Token> tokens) {
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		validate();
	}

	public static Token vertex(int... arcs) {
		return new Token(Kind.VERTEX, arcs.clone());
	}

	public static Token crossing(int a, int b, int c, int d) {
		return new Token(Kind.CROSSING, new int[] { a, b, c, d });
	}

	private void validate() {
		Map<Integer, Integer> uses = new TreeMap<>();
		for (Token t : tokens) {
			if (t.kind == Kind.CROSSING && t.arcs.length != 4) {
				throw new InvalidDiagramException("Crossing must list 4 arcs: " + t);
			}
			for (int a : t.arcs) {
				if (a < 0) {
					throw new InvalidDiagramException("Negative arc id in " + t);
				}
				uses.merge(a, 1, Integer::sum);
			}
		}
		for (Map.Entry<Integer, Integer> e : uses.entrySet()) {
			if (e.getValue() != 2) {
				throw new InvalidDiagramException("Arc " + e.getKey() + " occurs " + e.getValue() + " times, expected 2");
			}
		}
	}

	/**
	 * Parses the textual form. Whitespace around tokens and ids is ignored; the
	 * empty string is the empty diagram.
	 *
	 * @throws InvalidDiagramException on malformed text or invalid arc usage
	 */
	public static PlanarDiagramCode parse(String text) {
		if (text == null) {
			throw new InvalidDiagramException("Diagram text is null");
		}
		List<Token> tokens = new ArrayList<>();
		String trimmed = text.trim();
		if (trimmed.isEmpty()) {
			return new PlanarDiagramCode(tokens);
		}
		for (String raw : trimmed.split(";", -1)) {
			String s = raw.trim();
			if (s.length() < 3 || s.charAt(1) != '[' || s.charAt(s.length() - 1) != ']') {
				throw new InvalidDiagramException("Malformed token '" + s + "'");
			}
			Kind kind;
			switch (s.charAt(0)) {
				case 'V':
					kind = Kind.VERTEX;
					break;
				case 'X':
					kind = Kind.CROSSING;
					break;
				default:
					throw new InvalidDiagramException("Unknown token kind '" + s.charAt(0) + "' in '" + s + "'");
			}
			String body = s.substring(2, s.length() - 1).trim();
			int[] arcs;
			if (body.isEmpty()) {
				arcs = new int[0];
			} else {
				String[] parts = body.split(",");
				arcs = new int[parts.length];
				for (int i = 0; i < parts.length; i++) {
					try {
						arcs[i] = Integer.parseInt(parts[i].trim());
					} catch (NumberFormatException e) {
						throw new InvalidDiagramException("Bad arc id '" + parts[i].trim() + "' in '" + s + "'", e);
					}
				}
			}
			tokens.add(new Token(kind, arcs));
		}
		return new PlanarDiagramCode(tokens);
	}

	public List<Token> tokens() {
		return tokens;
	}

	public List<Token> vertices() {
		return tokens.stream().filter(t -> t.kind == Kind.VERTEX).toList();
	}

	public List<Token> crossings() {
		return tokens.stream().filter(t -> t.kind == Kind.CROSSING).toList();
	}

	public int crossingCount() {
		return (int) tokens.stream().filter(t -> t.kind == Kind.CROSSING).count();
	}

	public int vertexCount() {
		return tokens.size() - crossingCount();
	}

	/** Number of distinct arcs (half the total arc occurrences). */
	public int arcCount() {
		int total = 0;
		for (Token t : tokens) {
			total += t.arcs.length;
		}
		return total / 2;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof PlanarDiagramCode && tokens.equals(((PlanarDiagramCode) obj).tokens);
	}

	@Override
	public int hashCode() {
		return tokens.hashCode();
	}

	@Override
	public String toString() {
		return tokens.stream().map(Token::toString).collect(Collectors.joining(";"));
	}
}
