package com.github.micycle1.knotgraph.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.DegenerateViewException;
import com.github.micycle1.knotgraph.ExhaustedSearchException;
import com.github.micycle1.knotgraph.MathUtil;
import com.github.micycle1.knotgraph.Workers;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.projection.AxisOrder;
import com.github.micycle1.knotgraph.projection.ProjectedView;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;

/**
 * <p>
 * Multi-start simulated annealing over the three rotation angles.
 * </p>
 * <p>
 * Each start draws random angles until it finds a valid view, then takes
 * {@code steps} Gaussian perturbations whose spread shrinks with the
 * temperature, cooling geometrically from {@code initialTemperature} to
 * {@code finalTemperature}. A candidate with lower cost is always accepted; a
 * worse one with probability {@code exp(-delta / T)}; degenerate candidates
 * never. Start {@code i} is seeded with {@code seed + i}, so a search is
 * reproducible regardless of the worker count.
 * </p>
 */
public class AnnealingViewSearch {

	private static final Logger log = LoggerFactory.getLogger(AnnealingViewSearch.class);

	private final Projector projector;
	private final ViewCost cost;

	private double initialTemperature = 1.0;
	private double finalTemperature = 1e-3;
	private int steps = 400;
	private int starts = 4;
	private int workers = 1;
	private long seed = 0;
	private int initialAttempts = 50;
	private AxisOrder axisOrder = AxisOrder.ZYX;

	public AnnealingViewSearch(Projector projector, ViewCost cost) {
		this.projector = Objects.requireNonNull(projector, "projector");
		this.cost = Objects.requireNonNull(cost, "cost");
	}

	public void setTemperatures(double initialTemperature, double finalTemperature) {
		if (!(initialTemperature > 0) || !(finalTemperature > 0) || finalTemperature > initialTemperature) {
			throw new IllegalArgumentException("Temperatures must satisfy 0 < final <= initial: " + initialTemperature + ", " + finalTemperature);
		}
		this.initialTemperature = initialTemperature;
		this.finalTemperature = finalTemperature;
	}

	public void setSteps(int steps) {
		if (steps < 1) {
			throw new IllegalArgumentException("Steps must be >= 1: " + steps);
		}
		this.steps = steps;
	}

	public void setStarts(int starts) {
		if (starts < 1) {
			throw new IllegalArgumentException("Starts must be >= 1: " + starts);
		}
		this.starts = starts;
	}

	public void setWorkers(int workers) {
		if (workers < 1) {
			throw new IllegalArgumentException("Workers must be >= 1: " + workers);
		}
		this.workers = workers;
	}

	public void setSeed(long seed) {
		this.seed = seed;
	}

	public void setInitialAttempts(int initialAttempts) {
		if (initialAttempts < 1) {
			throw new IllegalArgumentException("Initial attempts must be >= 1: " + initialAttempts);
		}
		this.initialAttempts = initialAttempts;
	}

	public void setAxisOrder(AxisOrder axisOrder) {
		this.axisOrder = Objects.requireNonNull(axisOrder, "axisOrder");
	}

	public int getSteps() {
		return steps;
	}

	public int getStarts() {
		return starts;
	}

	public long getSeed() {
		return seed;
	}

	/**
	 * @throws ExhaustedSearchException if no start found a valid view
	 */
	public ScoredView search(SpatialGraph graph) {
		List<Callable<ScoredView>> tasks = new ArrayList<>(starts);
		for (int i = 0; i < starts; i++) {
			long startSeed = seed + i;
			tasks.add(() -> anneal(graph, startSeed));
		}
		ScoredView best = null;
		for (ScoredView s : Workers.invokeAll(tasks, workers)) {
			if (s != null && (best == null || s.cost < best.cost)) {
				best = s;
			}
		}
		int attempts = starts * (steps + 1);
		if (best == null) {
			log.warn("No valid view of {} after {} annealing starts", graph, starts);
			throw new ExhaustedSearchException("No valid view found", attempts);
		}
		log.info("Selected view {} with {} crossings (cost {})", best.view.getRotation(), best.view.crossingCount(), best.cost);
		return best;
	}

	/** One annealing run; null when it never saw a valid view. */
	ScoredView anneal(SpatialGraph graph, long startSeed) {
		Random rnd = new Random(startSeed);
		Rotation start = null;
		ScoredView best = null;
		for (int i = 0; i < initialAttempts && best == null; i++) {
			start = RotationSampler.uniform(rnd, axisOrder);
			best = tryView(graph, start);
		}
		double[] current = start.getAngles();
		double currentCost = best == null ? Double.POSITIVE_INFINITY : best.cost;

		int accepted = 0;
		for (int step = 0; step < steps; step++) {
			double t = steps == 1 ? initialTemperature : initialTemperature * Math.pow(finalTemperature / initialTemperature, step / (double) (steps - 1));
			double[] cand = new double[3];
			for (int i = 0; i < 3; i++) {
				cand[i] = MathUtil.wrapAngle(current[i] + rnd.nextGaussian() * t * Math.PI / 2);
			}
			ScoredView s = tryView(graph, new Rotation(cand[0], cand[1], cand[2], axisOrder));
			double c = s == null ? Double.POSITIVE_INFINITY : s.cost;
			boolean accept;
			if (c < currentCost) {
				accept = true;
			} else if (Double.isFinite(c)) {
				accept = rnd.nextDouble() < Math.exp(-(c - currentCost) / t);
			} else {
				accept = false;
			}
			if (accept) {
				current = cand;
				currentCost = c;
				accepted++;
			}
			if (s != null && (best == null || c < best.cost)) {
				best = s;
			}
		}
		log.debug("Annealing start {}: accepted {}/{}, best cost {}", startSeed, accepted, steps, best == null ? "none" : best.cost);
		return best;
	}

	private ScoredView tryView(SpatialGraph graph, Rotation rotation) {
		try {
			ProjectedView view = projector.project(graph, rotation);
			return new ScoredView(view, cost.score(view));
		} catch (DegenerateViewException e) {
			log.debug("Discarding degenerate view {}: {}", rotation, e.getMessage());
			return null;
		}
	}
}
