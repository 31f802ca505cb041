package com.github.micycle1.chromaprop;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.chromaprop.graph.GraphBuilder;
import com.github.micycle1.chromaprop.graph.SimilarityGraph;
import com.github.micycle1.chromaprop.image.ImageData;
import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.image.RgbImage;
import com.github.micycle1.chromaprop.seed.SeedMode;
import com.github.micycle1.chromaprop.seed.SeedSampler;
import com.github.micycle1.chromaprop.seed.SeedSet;

/**
 * <p>
 * Entry point of the enhancement + colorization core.
 * </p>
 *
 * <p>
 * One run:
 * </p>
 * <ol>
 * <li>detect grayscale vs. RGB input and extract its luminance;</li>
 * <li>enhance the luminance ({@link EnhancementEngine});</li>
 * <li>sample chroma seeds ({@link SeedSampler}) unless the caller supplies
 * them;</li>
 * <li>build the similarity graph of the enhanced luminance
 * ({@link GraphBuilder});</li>
 * <li>solve U and V over the graph ({@link ChromaSolver});</li>
 * <li>reconstruct RGB ({@link Reconstructor}).</li>
 * </ol>
 *
 * <p>
 * When no seed mode is given it is chosen as follows: a grayscale input uses
 * {@link SeedMode#REFERENCE} if a reference image is supplied and
 * {@link SeedMode#PSEUDO_COLOR} otherwise; an RGB input uses its own
 * chrominance ({@link SeedMode#RANDOM_TRUE}).
 * </p>
 *
 * <p>
 * The pipeline holds no state. Runs are deterministic for equal inputs and
 * parameters (including the RNG seed) and may execute concurrently.
 * </p>
 */
public class ColorizationPipeline {

	private static final Logger LOG = LoggerFactory.getLogger(ColorizationPipeline.class);

	/**
	 * Runs the pipeline with the automatically selected seed mode.
	 *
	 * @param input     grayscale or RGB image
	 * @param params    parameter set
	 * @param reference optional RGB reference of the same size, may be null
	 */
	public PipelineResult run(ImageData input, PipelineParameters params, ImageData reference) {
		if (input == null) {
			throw new InvalidInputException(PipelineStage.INPUT, "Input image is required");
		}
		return run(input, params, selectMode(input, reference), reference);
	}

	/**
	 * Runs the pipeline with an explicit seed mode.
	 *
	 * @param reference required for {@link SeedMode#REFERENCE}, ignored otherwise
	 */
	public PipelineResult run(ImageData input, PipelineParameters params, SeedMode mode, ImageData reference) {
		checkArguments(input, params);
		if (mode == null) {
			throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "Seed mode is required");
		}
		long t0 = System.nanoTime();
		boolean gray = input.isGrayscale();
		Plane enhanced = enhance(input, params);

		ImageData source = mode == SeedMode.REFERENCE ? reference : (mode == SeedMode.RANDOM_TRUE ? input : null);
		SeedSet seeds = SeedSampler.sample(mode, enhanced, source, params.getSeedRatio(), params.getRngSeed(), params.getColormap());

		PipelineResult result = colorize(enhanced, seeds, mode, params, gray);
		LOG.debug("Pipeline {}x{} ({}, {}) finished in {} ms", input.getHeight(), input.getWidth(), gray ? "gray" : "rgb", mode,
				(System.nanoTime() - t0) / 1_000_000);
		return result;
	}

	/**
	 * Runs the pipeline with seeds chosen by the caller (e.g. hand-placed colour
	 * scribbles). The seed set must match the input size.
	 */
	public PipelineResult run(ImageData input, PipelineParameters params, SeedSet seeds) {
		checkArguments(input, params);
		if (seeds == null || !seeds.fitsImage(input.getHeight(), input.getWidth())) {
			throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "Seed set does not match the " + input.getHeight() + "x"
					+ input.getWidth() + " input");
		}
		Plane enhanced = enhance(input, params);
		return colorize(enhanced, seeds, null, params, input.isGrayscale());
	}

	/** The seed mode {@link #run(ImageData, PipelineParameters, ImageData)} picks. */
	public static SeedMode selectMode(ImageData input, ImageData reference) {
		if (!input.isGrayscale()) {
			return SeedMode.RANDOM_TRUE;
		}
		return reference != null ? SeedMode.REFERENCE : SeedMode.PSEUDO_COLOR;
	}

	private static void checkArguments(ImageData input, PipelineParameters params) {
		if (input == null) {
			throw new InvalidInputException(PipelineStage.INPUT, "Input image is required");
		}
		if (params == null) {
			throw new InvalidParameterException(PipelineStage.PARAMETERS, "Parameters are required");
		}
	}

	private static Plane enhance(ImageData input, PipelineParameters p) {
		return EnhancementEngine.enhance(input.luminance(), p.getW(), p.getE(), p.getKLog(), p.getSmoothSigma());
	}

	private PipelineResult colorize(Plane enhanced, SeedSet seeds, SeedMode mode, PipelineParameters params, boolean gray) {
		SimilarityGraph graph = GraphBuilder.build(enhanced, params.getSigma());
		LaplacianSystem system = ChromaSolver.assemble(graph, seeds, ChromaSolver.LAMBDA);
		LOG.debug("{} with {} seeds, system nnz={}", graph, seeds.size(), system.nonZeros());

		ChannelSolution u;
		ChannelSolution v;
		if (params.isParallelChannels()) {
			ChannelSolution[] uv = solveParallel(system);
			u = uv[0];
			v = uv[1];
		} else {
			u = ChromaSolver.solve(system, ChromaChannel.U);
			v = ChromaSolver.solve(system, ChromaChannel.V);
		}
		RgbImage rgb = Reconstructor.reconstruct(enhanced, u.getValues(), v.getValues());
		return new PipelineResult(enhanced, seeds, mode, u, v, rgb, gray);
	}

	// U and V share only the read-only system
	private static ChannelSolution[] solveParallel(LaplacianSystem system) {
		ExecutorService pool = Executors.newFixedThreadPool(2);
		try {
			Future<ChannelSolution> fu = pool.submit(() -> ChromaSolver.solve(system, ChromaChannel.U));
			Future<ChannelSolution> fv = pool.submit(() -> ChromaSolver.solve(system, ChromaChannel.V));
			return new ChannelSolution[] { fu.get(), fv.get() };
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SolverFailureException(null, "Interrupted while solving chroma channels", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new SolverFailureException(null, "Chroma solve failed", cause);
		} finally {
			pool.shutdownNow();
		}
	}
}
