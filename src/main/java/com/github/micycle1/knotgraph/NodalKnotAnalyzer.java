package com.github.micycle1.knotgraph;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.knotgraph.graph.GraphSimplifier;
import com.github.micycle1.knotgraph.graph.GraphStats;
import com.github.micycle1.knotgraph.graph.SimpleGraph;
import com.github.micycle1.knotgraph.graph.SpatialGraph;
import com.github.micycle1.knotgraph.minor.MinorEmbedder;
import com.github.micycle1.knotgraph.minor.MinorEmbedding;
import com.github.micycle1.knotgraph.projection.ProjectedView;
import com.github.micycle1.knotgraph.projection.Projector;
import com.github.micycle1.knotgraph.projection.Rotation;
import com.github.micycle1.knotgraph.search.AnnealingViewSearch;
import com.github.micycle1.knotgraph.search.ManualViewSearch;
import com.github.micycle1.knotgraph.search.ScoredView;
import com.github.micycle1.knotgraph.search.TrivalentViewSearch;
import com.github.micycle1.knotgraph.search.ViewCost;
import com.github.micycle1.knotgraph.search.YamadaResult;
import com.github.micycle1.knotgraph.skeleton.BinaryVolume;
import com.github.micycle1.knotgraph.skeleton.Skeletonizer;
import com.github.micycle1.knotgraph.yamada.YamadaEvaluator;

/**
 * <p>
 * Entry point of the nodal knot pipeline: volume to skeleton graph, skeleton to
 * simplified graph, graph to planar diagram, diagram to Yamada polynomial, and
 * graph minor checks.
 * </p>
 * <p>
 * Components are configured once from the {@link AnalysisConfig} given at
 * construction; later changes to the config are not seen. Results are stored in
 * the caller's {@link AnalysisCache} under the fingerprint of the input and the
 * options that affect them, so analyzers with different configs can share one
 * cache.
 * </p>
 * <p>
 * Yamada evaluation picks its views as follows. A manual view in the config is
 * always used as given. Otherwise a trivalent graph is searched automatically,
 * and a graph with a node of higher degree raises
 * {@link ExhaustedSearchException}, since its polynomial depends on the diagram
 * and a view has to be chosen by the caller.
 * </p>
 */
public class NodalKnotAnalyzer {

	private static final Logger log = LoggerFactory.getLogger(NodalKnotAnalyzer.class);

	private final AnalysisConfig config;
	private final AnalysisCache cache;

	private final Skeletonizer skeletonizer;
	private final GraphSimplifier simplifier;
	private final Projector projector;
	private final ViewCost cost;
	private final YamadaEvaluator evaluator;
	private final AnnealingViewSearch annealing;
	private final TrivalentViewSearch trivalent;
	private final ManualViewSearch manual;
	private final MinorEmbedder embedder;

	private final Rotation manualView;
	private final String skeletonKey, simplifyKey, viewKey, yamadaKey, minorKey;

	public NodalKnotAnalyzer() {
		this(new AnalysisConfig(), new AnalysisCache());
	}

	public NodalKnotAnalyzer(AnalysisConfig config, AnalysisCache cache) {
		this.config = Objects.requireNonNull(config, "config");
		this.cache = Objects.requireNonNull(cache, "cache");

		skeletonizer = new Skeletonizer(config.getSpurLength(), config.isCleanLeaves());
		simplifier = new GraphSimplifier(config.getMergeDistance(), config.getSmoothingTolerance());
		projector = new Projector(config.getTolerance());
		cost = new ViewCost(config.getCrowdingWeight(), config.getCrowdingFraction(), config.getShortSegmentWeight(), config.getShortSegmentFraction());
		evaluator = new YamadaEvaluator(config.isNormalize());

		annealing = new AnnealingViewSearch(projector, cost);
		annealing.setTemperatures(config.getInitialTemperature(), config.getFinalTemperature());
		annealing.setSteps(config.getAnnealSteps());
		annealing.setStarts(config.getAnnealStarts());
		annealing.setWorkers(config.getWorkers());
		annealing.setSeed(config.getSeed());
		annealing.setAxisOrder(config.getAxisOrder());

		trivalent = new TrivalentViewSearch(projector, cost, evaluator);
		trivalent.setSamples(config.getSamples());
		trivalent.setRandomSampling(config.isRandomSampling());
		trivalent.setSeed(config.getSeed());

		manual = new ManualViewSearch(projector, cost);

		embedder = new MinorEmbedder();
		embedder.setMaxRounds(config.getMinorRounds());
		embedder.setWorkers(config.getWorkers());

		manualView = config.getManualView();
		skeletonKey = config.skeletonKey();
		simplifyKey = config.simplifyKey();
		viewKey = config.viewKey();
		yamadaKey = config.yamadaKey();
		minorKey = config.minorKey();
	}

	public AnalysisConfig getConfig() {
		return config;
	}

	public AnalysisCache getCache() {
		return cache;
	}

	/**
	 * @throws MalformedVolumeException if the volume is empty or thins to nothing
	 */
	public SpatialGraph skeletonize(BinaryVolume volume) {
		Objects.requireNonNull(volume, "volume");
		return cache.getOrCompute(volume.fingerprint(), skeletonKey, SpatialGraph.class, () -> {
			SpatialGraph g = skeletonizer.skeletonize(volume);
			if (log.isDebugEnabled()) {
				log.debug("Skeleton statistics:\n{}", GraphStats.of(g).summary());
			}
			return g;
		});
	}

	public SpatialGraph simplify(SpatialGraph graph) {
		Objects.requireNonNull(graph, "graph");
		return cache.getOrCompute(graph.fingerprint(), simplifyKey, SpatialGraph.class, () -> simplifier.simplify(graph));
	}

	/**
	 * @throws DegenerateViewException if the rotation gives a degenerate view
	 */
	public ProjectedView project(SpatialGraph graph, Rotation rotation) {
		Objects.requireNonNull(graph, "graph");
		Objects.requireNonNull(rotation, "rotation");
		return cache.getOrCompute(graph.fingerprint(), "project:" + projector.getTolerance() + "," + rotation, ProjectedView.class,
				() -> projector.project(graph, rotation));
	}

	/**
	 * Lowest-cost view found by simulated annealing.
	 *
	 * @throws ExhaustedSearchException if no valid view was found
	 */
	public ScoredView bestView(SpatialGraph graph) {
		Objects.requireNonNull(graph, "graph");
		return cache.getOrCompute(graph.fingerprint(), viewKey, ScoredView.class, () -> annealing.search(graph));
	}

	/**
	 * Yamada polynomial of the graph through the configured manual view, or an
	 * automatic search for a trivalent graph.
	 *
	 * @throws ExhaustedSearchException if the manual view is degenerate, no
	 *                                  sampled view is valid, or the graph is not
	 *                                  trivalent and no manual view is configured
	 */
	public YamadaResult yamada(SpatialGraph graph) {
		Objects.requireNonNull(graph, "graph");
		return cache.getOrCompute(graph.fingerprint(), yamadaKey, YamadaResult.class, () -> {
			if (manualView != null) {
				return manual.evaluate(graph, List.of(manualView), evaluator);
			}
			if (GraphSimplifier.isTrivalent(graph)) {
				return trivalent.evaluate(graph);
			}
			log.warn("{} has a node of degree {}; a manual view is required", graph, graph.maxDegree());
			throw new ExhaustedSearchException("Graph is not trivalent and no manual view is configured", 0);
		});
	}

	/**
	 * Yamada polynomial through the lowest-cost valid view among the candidates.
	 * Not cached.
	 *
	 * @throws ExhaustedSearchException if every candidate is degenerate
	 */
	public YamadaResult yamada(SpatialGraph graph, List<Rotation> candidates) {
		Objects.requireNonNull(graph, "graph");
		return manual.evaluate(graph, candidates, evaluator);
	}

	/**
	 * Searches for the target as a minor of the graph. Chains refer to host
	 * vertices by position in {@link SpatialGraph#nodes()}.
	 */
	public MinorEmbedding containsMinor(SpatialGraph graph, SimpleGraph target) {
		Objects.requireNonNull(graph, "graph");
		Objects.requireNonNull(target, "target");
		StringBuilder key = new StringBuilder(minorKey).append(':').append(target.vertexCount());
		for (int[] e : target.edges()) {
			key.append(',').append(e[0]).append('-').append(e[1]);
		}
		return cache.getOrCompute(graph.fingerprint(), key.toString(), MinorEmbedding.class,
				() -> embedder.find(SimpleGraph.of(graph), target, config.getMinorSeed(), config.getMinorRetries()));
	}

	/** Simplifies the graph, then evaluates its Yamada polynomial. */
	public YamadaResult analyze(BinaryVolume volume) {
		SpatialGraph g = simplify(skeletonize(volume));
		log.info("Simplified skeleton: {} nodes, {} edges, max degree {}", g.nodeCount(), g.edgeCount(), g.maxDegree());
		return yamada(g);
	}
}
