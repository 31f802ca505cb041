package com.github.micycle1.chromaprop;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.interfaces.linsol.LinearSolverSparse;
import org.ejml.sparse.FillReducing;
import org.ejml.sparse.csc.factory.LinearSolverFactory_DSCC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.chromaprop.graph.SimilarityGraph;
import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.linalg.ConjugateGradientSolver;
import com.github.micycle1.chromaprop.linalg.LsqrSolver;
import com.github.micycle1.chromaprop.linalg.SSOR;
import com.github.micycle1.chromaprop.linalg.SparseCSR;
import com.github.micycle1.chromaprop.seed.SeedSet;

/**
 * Propagates seed chrominance over the similarity graph by solving a
 * {@link LaplacianSystem} per channel.
 * <p>
 * The solve is a pure function that tries, in order:
 * <ol>
 * <li>sparse Cholesky factorization (the system is symmetric positive definite
 * whenever every connected component holds a seed or {@code lambda > 0}),
 * skipped when {@link LaplacianSystem#choleskyFillBound()} exceeds
 * {@link #DIRECT_FILL_LIMIT};</li>
 * <li>if the factorization is skipped, fails, throws, or produces a non-finite
 * value, SSOR-preconditioned conjugate gradients;</li>
 * <li>if conjugate gradients break down or do not converge, LSQR.</li>
 * </ol>
 * Both iterative solvers use {@link #ITERATIVE_TOLERANCE} and an iteration cap
 * of {@code max(1000, 20 (H + W))}. If LSQR fails too a
 * {@link SolverFailureException} is thrown. Nothing is cached between calls,
 * so concurrent use is safe.
 */
public final class ChromaSolver {

	private static final Logger LOG = LoggerFactory.getLogger(ChromaSolver.class);

	/** Diagonal regularization used by the pipeline. */
	public static final double LAMBDA = 1e-6;
	/** Soft-constraint weight pinning seeded pixels to their target value. */
	public static final double SEED_PENALTY = 1e4;
	/** Relative residual tolerance of the iterative solvers. */
	public static final double ITERATIVE_TOLERANCE = 1e-10;
	/**
	 * Largest Cholesky fill bound factored directly, about 60 MB of factor. A
	 * 128x128 image (fill bound about 2.1 million) is factored; 256x256 (16.8
	 * million) goes to conjugate gradients.
	 */
	public static final long DIRECT_FILL_LIMIT = 5_000_000L;
	static final double SSOR_OMEGA = 1.2;
	static final int MIN_ITERATIONS = 1000;

	private ChromaSolver() {
	}

	/**
	 * Assembles the propagation system shared by both channels.
	 *
	 * @param lambda diagonal regularization, {@code >= 0}
	 */
	public static LaplacianSystem assemble(SimilarityGraph graph, SeedSet seeds, double lambda) {
		if (graph == null || seeds == null) {
			throw new InvalidInputException(PipelineStage.SOLVE, "Graph and seeds are required");
		}
		if (!seeds.fitsImage(graph.getHeight(), graph.getWidth())) {
			throw new InvalidInputException(PipelineStage.SOLVE, "Seeds were drawn for a " + seeds.getHeight() + "x" + seeds.getWidth()
					+ " image but the graph is " + graph.getHeight() + "x" + graph.getWidth());
		}
		if (!(lambda >= 0) || Double.isInfinite(lambda)) {
			throw new InvalidParameterException(PipelineStage.SOLVE, "lambda must be a finite value >= 0, got " + lambda);
		}
		return LaplacianSystem.assemble(graph, seeds, lambda, SEED_PENALTY);
	}

	/**
	 * Solves one channel from scratch: {@code assemble} followed by
	 * {@link #solve(LaplacianSystem, ChromaChannel)}.
	 */
	public static ChannelSolution solveChannel(SimilarityGraph graph, SeedSet seeds, ChromaChannel channel, double lambda) {
		return solve(assemble(graph, seeds, lambda), channel);
	}

	/**
	 * Solves one channel of an assembled system.
	 *
	 * @throws SolverFailureException if no solver yields a finite solution
	 */
	public static ChannelSolution solve(LaplacianSystem system, ChromaChannel channel) {
		return solve(system, channel, DIRECT_FILL_LIMIT);
	}

	static ChannelSolution solve(LaplacianSystem system, ChromaChannel channel, long directFillLimit) {
		final int n = system.size();
		final double[] b = system.rhs(channel);

		RuntimeException directFailure = null;
		long fill = system.choleskyFillBound();
		if (fill > directFillLimit) {
			LOG.debug("Channel {}: Cholesky fill bound {} of {} unknowns exceeds {}; using conjugate gradients", channel, fill, n,
					directFillLimit);
		} else {
			try {
				double[] x = solveDirect(system.matrixCopy(), b);
				if (x != null && MathUtil.allFinite(x)) {
					double rel = system.relativeResidual(x, b);
					LOG.debug("Channel {}: Cholesky solve of {} unknowns ({} non-zeros), relResidual={}", channel, n, system.nonZeros(), rel);
					return new ChannelSolution(channel, Plane.of(system.getHeight(), system.getWidth(), x), SolvePath.DIRECT, 0, rel);
				}
				LOG.warn("Channel {}: Cholesky factorization of {} unknowns failed (lambda={}); falling back to conjugate gradients", channel, n,
						system.getLambda());
			} catch (RuntimeException e) {
				directFailure = e;
				LOG.warn("Channel {}: Cholesky solve failed; falling back to conjugate gradients", channel, e);
			}
		}

		SparseCSR A = system.toCSR();
		int maxIters = iterationCap(system);
		double[] x = new double[n];
		ConjugateGradientSolver.Result cg = ConjugateGradientSolver.solve(A, b, x, ITERATIVE_TOLERANCE, maxIters, new SSOR(A, SSOR_OMEGA));
		if (cg.converged && MathUtil.allFinite(x)) {
			LOG.debug("Channel {}: conjugate gradients {}", channel, cg);
			return solution(system, channel, x, SolvePath.ITERATIVE, cg.iters, b);
		}
		LOG.warn("Channel {}: conjugate gradients did not converge ({}); falling back to LSQR", channel, cg);

		LsqrSolver.Result res = LsqrSolver.solve(A, b, x, ITERATIVE_TOLERANCE, maxIters);
		if (!res.converged || !MathUtil.allFinite(x)) {
			String msg = "Channel " + channel + ": Cholesky, conjugate gradients and LSQR all failed on " + n + " unknowns: CG " + cg + ", LSQR "
					+ res;
			throw directFailure == null ? new SolverFailureException(channel, msg) : new SolverFailureException(channel, msg, directFailure);
		}
		LOG.debug("Channel {}: LSQR {}", channel, res);
		return solution(system, channel, x, SolvePath.LEAST_SQUARES, res.iters, b);
	}

	static int iterationCap(LaplacianSystem system) {
		return Math.max(MIN_ITERATIONS, 20 * (system.getHeight() + system.getWidth()));
	}

	private static ChannelSolution solution(LaplacianSystem system, ChromaChannel channel, double[] x, SolvePath path, int iters, double[] b) {
		return new ChannelSolution(channel, Plane.of(system.getHeight(), system.getWidth(), x), path, iters, system.relativeResidual(x, b));
	}

	// null when the matrix is not positive definite
	private static double[] solveDirect(DMatrixSparseCSC A, double[] b) {
		LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> solver = LinearSolverFactory_DSCC.cholesky(FillReducing.NONE);
		if (!solver.setA(A)) {
			return null;
		}
		DMatrixRMaj rhs = new DMatrixRMaj(b.length, 1, true, b);
		DMatrixRMaj x = new DMatrixRMaj(A.numCols, 1);
		solver.solve(rhs, x);
		return x.data;
	}
}
