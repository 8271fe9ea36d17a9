package com.github.micycle1.knotgraph;

import java.util.Objects;
import java.util.Properties;
import java.util.TreeSet;

import com.github.micycle1.knotgraph.projection.AxisOrder;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;

/**
 * <p>
 * Options for a {@link NodalKnotAnalyzer}. Setters validate their argument and
 * return this config, so options can be chained:
 * </p>
 *
 * <pre>
 * AnalysisConfig config = new AnalysisConfig().setWorkers(4).setSeed(7).setManualView(0.1, 0.2, 0.3, AxisOrder.ZYX);
 * </pre>
 *
 * <p>
 * The same options can be read from {@code knotgraph.*} properties with
 * {@link #fromProperties(Properties)}.
 * </p>
 */
public final class AnalysisConfig {

	public static final String PREFIX = "knotgraph.";

	// manual view
	private double[] viewAngles = null;
	private AxisOrder axisOrder = AxisOrder.ZYX;

	private double tolerance = Projector.DEFAULT_TOLERANCE;

	// annealing
	private double initialTemperature = 1.0;
	private double finalTemperature = 1e-3;
	private double coolingFactor = 0;
	private int annealSteps = 400;
	private int annealStarts = 4;
	private double crowdingWeight = 0.5;
	private double crowdingFraction = 0.02;
	private double shortSegmentWeight = 0.1;
	private double shortSegmentFraction = 0.005;

	// trivalent search
	private int samples = 50;
	private boolean randomSampling = false;

	private boolean normalize = true;
	private int workers = 1;
	private long seed = 0;

	// minor search
	private long minorSeed = 0;
	private int minorRetries = 5;
	private int minorRounds = 100;

	// skeleton and simplification
	private double spurLength = 0;
	private boolean cleanLeaves = false;
	private double mergeDistance = 0;
	// half a voxel at unit spacing
	private double smoothingTolerance = 0.5;

	/**
	 * Reads every {@code knotgraph.*} key of the given properties; options without
	 * a key keep their default.
	 *
	 * @throws IllegalArgumentException for an unknown key under the prefix or a
	 *                                  value that does not parse
	 */
	public static AnalysisConfig fromProperties(Properties properties) {
		AnalysisConfig c = new AnalysisConfig();
		Double initialT = null;
		Double finalT = null;
		for (String key : new TreeSet<>(properties.stringPropertyNames())) {
			if (!key.startsWith(PREFIX)) {
				continue;
			}
			String value = properties.getProperty(key).trim();
			try {
				switch (key.substring(PREFIX.length())) {
					case "view.angles":
						c.viewAngles = parseAngles(value);
						break;
					case "view.axisOrder":
						c.setAxisOrder(AxisOrder.valueOf(value.toUpperCase()));
						break;
					case "tolerance":
						c.setTolerance(Double.parseDouble(value));
						break;
					case "anneal.initialTemperature":
						initialT = Double.parseDouble(value);
						break;
					case "anneal.finalTemperature":
						finalT = Double.parseDouble(value);
						break;
					case "anneal.coolingFactor":
						c.setCoolingFactor(Double.parseDouble(value));
						break;
					case "anneal.steps":
						c.setAnnealSteps(Integer.parseInt(value));
						break;
					case "anneal.starts":
						c.setAnnealStarts(Integer.parseInt(value));
						break;
					case "anneal.crowdingWeight":
						c.crowdingWeight = nonNegative(key, Double.parseDouble(value));
						break;
					case "anneal.crowdingFraction":
						c.crowdingFraction = positive(key, Double.parseDouble(value));
						break;
					case "anneal.shortSegmentWeight":
						c.shortSegmentWeight = nonNegative(key, Double.parseDouble(value));
						break;
					case "anneal.shortSegmentFraction":
						c.shortSegmentFraction = positive(key, Double.parseDouble(value));
						break;
					case "search.samples":
						c.setSamples(Integer.parseInt(value));
						break;
					case "search.random":
						c.setRandomSampling(parseBoolean(value));
						break;
					case "normalize":
						c.setNormalize(parseBoolean(value));
						break;
					case "workers":
						c.setWorkers(Integer.parseInt(value));
						break;
					case "seed":
						c.setSeed(Long.parseLong(value));
						break;
					case "minor.seed":
						c.setMinorSeed(Long.parseLong(value));
						break;
					case "minor.retries":
						c.setMinorRetries(Integer.parseInt(value));
						break;
					case "minor.rounds":
						c.setMinorRounds(Integer.parseInt(value));
						break;
					case "skeleton.spurLength":
						c.setSpurLength(Double.parseDouble(value));
						break;
					case "skeleton.cleanLeaves":
						c.setCleanLeaves(parseBoolean(value));
						break;
					case "simplify.mergeDistance":
						c.setMergeDistance(Double.parseDouble(value));
						break;
					case "simplify.smoothingTolerance":
						c.setSmoothingTolerance(Double.parseDouble(value));
						break;
					default:
						throw new IllegalArgumentException("Unknown option " + key);
				}
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Cannot parse " + key + "=" + value, e);
			}
		}
		if (initialT != null || finalT != null) {
			c.setTemperatures(initialT != null ? initialT : c.initialTemperature, finalT != null ? finalT : c.finalTemperature);
		}
		return c;
	}

	private static double[] parseAngles(String value) {
		String[] parts = value.split(",");
		if (parts.length != 3) {
			throw new IllegalArgumentException("Expected three comma-separated angles: " + value);
		}
		double[] a = new double[3];
		for (int i = 0; i < 3; i++) {
			a[i] = Double.parseDouble(parts[i].trim());
			if (!Double.isFinite(a[i])) {
				throw new IllegalArgumentException("Angles must be finite: " + value);
			}
		}
		return a;
	}

	private static boolean parseBoolean(String value) {
		if ("true".equalsIgnoreCase(value)) {
			return true;
		}
		if ("false".equalsIgnoreCase(value)) {
			return false;
		}
		throw new IllegalArgumentException("Not a boolean: " + value);
	}

	private static double nonNegative(String name, double value) {
		if (value < 0 || Double.isNaN(value)) {
			throw new IllegalArgumentException(name + " must be >= 0: " + value);
		}
		return value;
	}

	private static double positive(String name, double value) {
		if (!(value > 0) || Double.isInfinite(value)) {
			throw new IllegalArgumentException(name + " must be positive and finite: " + value);
		}
		return value;
	}

	/** Fixes the view used for Yamada evaluation, bypassing the automatic search. */
	public AnalysisConfig setManualView(double a1, double a2, double a3, AxisOrder order) {
		if (!Double.isFinite(a1) || !Double.isFinite(a2) || !Double.isFinite(a3)) {
			throw new IllegalArgumentException("Angles must be finite: " + a1 + ", " + a2 + ", " + a3);
		}
		axisOrder = Objects.requireNonNull(order, "order");
		viewAngles = new double[] { a1, a2, a3 };
		return this;
	}

	public AnalysisConfig clearManualView() {
		viewAngles = null;
		return this;
	}

	/** The manual view, or null when none is set. */
	public Rotation getManualView() {
		return viewAngles == null ? null : new Rotation(viewAngles[0], viewAngles[1], viewAngles[2], axisOrder);
	}

	/** Axis order of the manual view and of the annealing search. */
	public AnalysisConfig setAxisOrder(AxisOrder axisOrder) {
		this.axisOrder = Objects.requireNonNull(axisOrder, "axisOrder");
		return this;
	}

	public AxisOrder getAxisOrder() {
		return axisOrder;
	}

	public AnalysisConfig setTolerance(double tolerance) {
		if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
			throw new IllegalArgumentException("Tolerance must be positive and finite: " + tolerance);
		}
		this.tolerance = tolerance;
		return this;
	}

	public double getTolerance() {
		return tolerance;
	}

	public AnalysisConfig setTemperatures(double initialTemperature, double finalTemperature) {
		if (!(initialTemperature > 0) || !(finalTemperature > 0) || finalTemperature > initialTemperature) {
			throw new IllegalArgumentException("Temperatures must satisfy 0 < final <= initial: " + initialTemperature + ", " + finalTemperature);
		}
		this.initialTemperature = initialTemperature;
		this.finalTemperature = finalTemperature;
		return this;
	}

	public double getInitialTemperature() {
		return initialTemperature;
	}

	/**
	 * The final annealing temperature: {@code initial * coolingFactor^steps} when a
	 * cooling factor is set, otherwise the configured final temperature.
	 */
	public double getFinalTemperature() {
		if (coolingFactor > 0) {
			return Math.min(initialTemperature, initialTemperature * Math.pow(coolingFactor, annealSteps));
		}
		return finalTemperature;
	}

	/** Per-step geometric cooling factor in (0, 1); 0 derives it from the final temperature. */
	public AnalysisConfig setCoolingFactor(double coolingFactor) {
		if (coolingFactor != 0 && !(coolingFactor > 0 && coolingFactor < 1)) {
			throw new IllegalArgumentException("Cooling factor must be in (0, 1) or 0: " + coolingFactor);
		}
		this.coolingFactor = coolingFactor;
		return this;
	}

	public double getCoolingFactor() {
		return coolingFactor;
	}

	public AnalysisConfig setAnnealSteps(int annealSteps) {
		if (annealSteps < 1) {
			throw new IllegalArgumentException("Steps must be >= 1: " + annealSteps);
		}
		this.annealSteps = annealSteps;
		return this;
	}

	public int getAnnealSteps() {
		return annealSteps;
	}

	public AnalysisConfig setAnnealStarts(int annealStarts) {
		if (annealStarts < 1) {
			throw new IllegalArgumentException("Starts must be >= 1: " + annealStarts);
		}
		this.annealStarts = annealStarts;
		return this;
	}

	public int getAnnealStarts() {
		return annealStarts;
	}

	/** Penalty weights and reference fractions of the view cost. */
	public AnalysisConfig setPenalties(double crowdingWeight, double crowdingFraction, double shortSegmentWeight, double shortSegmentFraction) {
		this.crowdingWeight = nonNegative("Crowding weight", crowdingWeight);
		this.crowdingFraction = positive("Crowding fraction", crowdingFraction);
		this.shortSegmentWeight = nonNegative("Short segment weight", shortSegmentWeight);
		this.shortSegmentFraction = positive("Short segment fraction", shortSegmentFraction);
		return this;
	}

	public double getCrowdingWeight() {
		return crowdingWeight;
	}

	public double getCrowdingFraction() {
		return crowdingFraction;
	}

	public double getShortSegmentWeight() {
		return shortSegmentWeight;
	}

	public double getShortSegmentFraction() {
		return shortSegmentFraction;
	}

	public AnalysisConfig setSamples(int samples) {
		if (samples < 1) {
			throw new IllegalArgumentException("Samples must be >= 1: " + samples);
		}
		this.samples = samples;
		return this;
	}

	public int getSamples() {
		return samples;
	}

	public AnalysisConfig setRandomSampling(boolean randomSampling) {
		this.randomSampling = randomSampling;
		return this;
	}

	public boolean isRandomSampling() {
		return randomSampling;
	}

	public AnalysisConfig setNormalize(boolean normalize) {
		this.normalize = normalize;
		return this;
	}

	public boolean isNormalize() {
		return normalize;
	}

	public AnalysisConfig setWorkers(int workers) {
		if (workers < 1) {
			throw new IllegalArgumentException("Workers must be >= 1: " + workers);
		}
		this.workers = workers;
		return this;
	}

	public int getWorkers() {
		return workers;
	}

	/** Seed of the annealing and random view sampling. */
	public AnalysisConfig setSeed(long seed) {
		this.seed = seed;
		return this;
	}

	public long getSeed() {
		return seed;
	}

	public AnalysisConfig setMinorSeed(long minorSeed) {
		this.minorSeed = minorSeed;
		return this;
	}

	public long getMinorSeed() {
		return minorSeed;
	}

	public AnalysisConfig setMinorRetries(int minorRetries) {
		if (minorRetries < 1) {
			throw new IllegalArgumentException("Retries must be >= 1: " + minorRetries);
		}
		this.minorRetries = minorRetries;
		return this;
	}

	public int getMinorRetries() {
		return minorRetries;
	}

	public AnalysisConfig setMinorRounds(int minorRounds) {
		if (minorRounds < 1) {
			throw new IllegalArgumentException("Rounds must be >= 1: " + minorRounds);
		}
		this.minorRounds = minorRounds;
		return this;
	}

	public int getMinorRounds() {
		return minorRounds;
	}

	public AnalysisConfig setSpurLength(double spurLength) {
		this.spurLength = nonNegative("Spur length", spurLength);
		return this;
	}

	public double getSpurLength() {
		return spurLength;
	}

	public AnalysisConfig setCleanLeaves(boolean cleanLeaves) {
		this.cleanLeaves = cleanLeaves;
		return this;
	}

	public boolean isCleanLeaves() {
		return cleanLeaves;
	}

	public AnalysisConfig setMergeDistance(double mergeDistance) {
		this.mergeDistance = nonNegative("Merge distance", mergeDistance);
		return this;
	}

	public double getMergeDistance() {
		return mergeDistance;
	}

	/**
	 * Douglas-Peucker tolerance for edge polylines, in physical units. The
	 * default suits unit voxel spacing; scale it with the spacing of the volume,
	 * or set 0 to keep every skeleton point.
	 */
	public AnalysisConfig setSmoothingTolerance(double smoothingTolerance) {
		this.smoothingTolerance = nonNegative("Smoothing tolerance", smoothingTolerance);
		return this;
	}

	public double getSmoothingTolerance() {
		return smoothingTolerance;
	}

	String skeletonKey() {
		return "skeleton:" + spurLength + "," + cleanLeaves;
	}

	String simplifyKey() {
		return "simplify:" + mergeDistance + "," + smoothingTolerance;
	}

	String viewKey() {
		return "view:" + tolerance + "," + initialTemperature + "," + getFinalTemperature() + "," + annealSteps + "," + annealStarts + "," + seed + ","
				+ axisOrder + "," + crowdingWeight + "," + crowdingFraction + "," + shortSegmentWeight + "," + shortSegmentFraction;
	}

	String yamadaKey() {
		Rotation manual = getManualView();
		return "yamada:" + tolerance + "," + samples + "," + randomSampling + "," + seed + "," + normalize + "," + manual + "," + crowdingWeight + ","
				+ crowdingFraction + "," + shortSegmentWeight + "," + shortSegmentFraction;
	}

	String minorKey() {
		return "minor:" + minorSeed + "," + minorRetries + "," + minorRounds;
	}
}
