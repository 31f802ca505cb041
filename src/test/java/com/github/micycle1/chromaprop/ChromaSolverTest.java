package com.github.micycle1.chromaprop;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.github.micycle1.chromaprop.graph.GraphBuilder;
import com.github.micycle1.chromaprop.graph.SimilarityGraph;
import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.linalg.LsqrSolver;
import com.github.micycle1.chromaprop.seed.SeedSet;

public class ChromaSolverTest {

	private static Plane randomPlane(int h, int w, long seed) {
		Random rnd = new Random(seed);
		double[] d = new double[h * w];
		for (int i = 0; i < d.length; i++) {
			d[i] = rnd.nextDouble() * 255.0;
		}
		return Plane.of(h, w, d);
	}

	@Test
	void systemIsSymmetricAndDiagonallyDominant() {
		int h = 6, w = 5;
		SimilarityGraph g = GraphBuilder.build(randomPlane(h, w, 8), 20.0);
		SeedSet seeds = SeedSet.builder(h, w).add(0, 0, 10, -10).add(4, 3, -5, 5).build();
		LaplacianSystem sys = ChromaSolver.assemble(g, seeds, ChromaSolver.LAMBDA);
		int n = h * w;
		assertEquals(n, sys.size());
		assertEquals(ChromaSolver.SEED_PENALTY, sys.getPenalty(), 0.0);
		for (int i = 0; i < n; i++) {
			double off = 0;
			for (int j = 0; j < n; j++) {
				assertEquals(sys.get(i, j), sys.get(j, i), 0.0);
				if (j != i) {
					assertTrue(sys.get(i, j) <= 0.0);
					off += Math.abs(sys.get(i, j));
				}
			}
			assertTrue(sys.get(i, i) >= off);
			assertEquals(g.degree(i) + ChromaSolver.LAMBDA, sys.get(i, i) - (i == 0 || i == 4 * w + 3 ? sys.getPenalty() : 0), 1e-9);
		}
		double[] b = sys.rhs(ChromaChannel.U);
		assertEquals(sys.getPenalty() * 10, b[0], 0.0);
		assertEquals(sys.getPenalty() * -5, b[4 * w + 3], 0.0);
		assertEquals(0.0, b[1], 0.0);
		assertEquals(sys.getPenalty() * -10, sys.rhs(ChromaChannel.V)[0], 0.0);
	}

	@Test
	void fullySeededSolutionReproducesSeeds() {
		int h = 5, w = 5;
		Random rnd = new Random(21);
		SeedSet.Builder sb = SeedSet.builder(h, w);
		for (int r = 0; r < h; r++) {
			for (int c = 0; c < w; c++) {
				sb.add(r, c, rnd.nextDouble() * 100 - 50, rnd.nextDouble() * 100 - 50);
			}
		}
		SeedSet seeds = sb.build();
		SimilarityGraph g = GraphBuilder.build(randomPlane(h, w, 9), 5.0);
		for (ChromaChannel ch : ChromaChannel.values()) {
			ChannelSolution sol = ChromaSolver.solveChannel(g, seeds, ch, ChromaSolver.LAMBDA);
			assertEquals(SolvePath.DIRECT, sol.getPath());
			assertEquals(ch, sol.getChannel());
			for (int k = 0; k < seeds.size(); k++) {
				assertEquals(ch.seedValue(seeds, k), sol.getValues().get(seeds.pixelIndex(k)), 0.1);
			}
		}
	}

	@Test
	void uniformSeedsGiveUniformChroma() {
		int h = 8, w = 8;
		SimilarityGraph g = GraphBuilder.build(randomPlane(h, w, 10), 200.0);
		SeedSet seeds = SeedSet.builder(h, w).add(1, 1, 12.5, -7.0).add(6, 2, 12.5, -7.0).add(3, 7, 12.5, -7.0).build();
		LaplacianSystem sys = ChromaSolver.assemble(g, seeds, ChromaSolver.LAMBDA);
		Plane u = ChromaSolver.solve(sys, ChromaChannel.U).getValues();
		Plane v = ChromaSolver.solve(sys, ChromaChannel.V).getValues();
		for (int i = 0; i < h * w; i++) {
			assertEquals(12.5, u.get(i), 1e-2);
			assertEquals(-7.0, v.get(i), 1e-2);
		}
	}

	@Test
	void solutionObeysMaximumPrinciple() {
		int h = 10, w = 12;
		SimilarityGraph g = GraphBuilder.build(randomPlane(h, w, 12), 15.0);
		SeedSet seeds = SeedSet.builder(h, w).add(0, 0, -40, 3).add(9, 11, 60, 8).add(5, 5, 10, -20).build();
		ChannelSolution u = ChromaSolver.solveChannel(g, seeds, ChromaChannel.U, ChromaSolver.LAMBDA);
		assertTrue(u.getRelativeResidual() < 1e-8, u.toString());
		assertTrue(u.getValues().min() >= -40 - 1e-6);
		assertTrue(u.getValues().max() <= 60 + 1e-6);
	}

	@Test
	void isolatedUnseededPixelFallsBackToConjugateGradients() {
		// the middle pixel is cut off from both neighbours, so with lambda = 0 its row is all zero
		Plane y = Plane.of(1, 3, new double[] { 0, 255, 0 });
		SimilarityGraph g = GraphBuilder.build(y, 1.0);
		SeedSet seeds = SeedSet.builder(1, 3).add(0, 0, 20, -20).add(0, 2, -10, 10).build();
		try {
			ChannelSolution sol = ChromaSolver.solveChannel(g, seeds, ChromaChannel.U, 0.0);
			assertEquals(SolvePath.ITERATIVE, sol.getPath());
			Plane x = sol.getValues();
			for (int i = 0; i < x.size(); i++) {
				assertTrue(Double.isFinite(x.get(i)));
			}
			assertEquals(20.0, x.get(0), 1e-6);
			assertEquals(0.0, x.get(1), 1e-9);
			assertEquals(-10.0, x.get(2), 1e-6);
		} catch (SolverFailureException e) {
			assertEquals(ChromaChannel.U, e.getChannel());
			assertEquals(PipelineStage.SOLVE, e.getStage());
		}
	}

	@Test
	void regularizationMakesIsolatedPixelSolvableDirectly() {
		Plane y = Plane.of(1, 3, new double[] { 0, 255, 0 });
		SimilarityGraph g = GraphBuilder.build(y, 1.0);
		SeedSet seeds = SeedSet.builder(1, 3).add(0, 0, 20, -20).add(0, 2, -10, 10).build();
		ChannelSolution sol = ChromaSolver.solveChannel(g, seeds, ChromaChannel.V, ChromaSolver.LAMBDA);
		assertEquals(SolvePath.DIRECT, sol.getPath());
		assertEquals(0, sol.getIterations());
		assertEquals(-20.0, sol.getValues().get(0), 1e-6);
		assertEquals(0.0, sol.getValues().get(1), 0.0);
		assertEquals(10.0, sol.getValues().get(2), 1e-6);
	}

	@Test
	void disconnectedRegionsFollowTheirOwnSeeds() {
		// two 2x2 blocks separated by a hard edge
		Plane y = Plane.of(new double[][] { { 0, 0, 255, 255 }, { 0, 0, 255, 255 } });
		SimilarityGraph g = GraphBuilder.build(y, 2.0);
		SeedSet seeds = SeedSet.builder(2, 4).add(0, 0, 30, 0).add(1, 3, -30, 0).build();
		Plane u = ChromaSolver.solveChannel(g, seeds, ChromaChannel.U, ChromaSolver.LAMBDA).getValues();
		assertEquals(30.0, u.get(1, 1), 1e-3);
		assertEquals(-30.0, u.get(0, 2), 1e-3);
	}

	@Test
	void rejectsMismatchedSeedsAndBadLambda() {
		SimilarityGraph g = GraphBuilder.build(Plane.filled(3, 3, 0), 5.0);
		SeedSet wrong = SeedSet.builder(3, 4).add(0, 0, 1, 1).build();
		InvalidInputException ex = assertThrows(InvalidInputException.class, () -> ChromaSolver.assemble(g, wrong, ChromaSolver.LAMBDA));
		assertEquals(PipelineStage.SOLVE, ex.getStage());
		SeedSet ok = SeedSet.builder(3, 3).add(0, 0, 1, 1).build();
		assertThrows(InvalidParameterException.class, () -> ChromaSolver.assemble(g, ok, -1e-3));
		assertThrows(InvalidParameterException.class, () -> ChromaSolver.assemble(g, ok, Double.NaN));
	}

	@Test
	void iterativeSolverAgreesWithDirectSolver() {
		int h = 6, w = 6;
		SimilarityGraph g = GraphBuilder.build(randomPlane(h, w, 13), 200.0);
		SeedSet seeds = SeedSet.builder(h, w).add(0, 0, 5, 1).add(5, 5, -5, 2).add(2, 3, 1, 3).build();
		LaplacianSystem sys = ChromaSolver.assemble(g, seeds, 1e-2);
		Plane direct = ChromaSolver.solve(sys, ChromaChannel.U).getValues();

		double[] b = sys.rhs(ChromaChannel.U);
		double[] x = new double[b.length];
		LsqrSolver.Result res = LsqrSolver.solve(sys.toCSR(), b, x, ChromaSolver.ITERATIVE_TOLERANCE, 10_000);
		assertTrue(res.converged, res.toString());
		for (int i = 0; i < x.length; i++) {
			assertEquals(direct.get(i), x[i], 1e-2);
		}
	}

	@Test
	void conjugateGradientsAgreeWithDirectSolver() {
		int h = 9, w = 7;
		SimilarityGraph g = GraphBuilder.build(randomPlane(h, w, 14), 200.0);
		SeedSet seeds = SeedSet.builder(h, w).add(0, 0, 25, -3).add(8, 6, -15, 9).add(4, 2, 2, 30).build();
		LaplacianSystem sys = ChromaSolver.assemble(g, seeds, ChromaSolver.LAMBDA);
		for (ChromaChannel ch : ChromaChannel.values()) {
			ChannelSolution direct = ChromaSolver.solve(sys, ch);
			ChannelSolution cg = ChromaSolver.solve(sys, ch, 0L);
			assertEquals(SolvePath.DIRECT, direct.getPath());
			assertEquals(SolvePath.ITERATIVE, cg.getPath());
			assertTrue(cg.getIterations() > 0);
			assertTrue(cg.getRelativeResidual() < 1e-8, cg.toString());
			for (int i = 0; i < h * w; i++) {
				assertEquals(direct.getValues().get(i), cg.getValues().get(i), 1e-3);
			}
		}
	}

	@Test
	void fillBoundIsTheEnvelopeOfTheGrid() {
		int h = 3, w = 4;
		LaplacianSystem sys = ChromaSolver.assemble(GraphBuilder.build(Plane.filled(h, w, 100), 5.0),
				SeedSet.builder(h, w).add(1, 1, 0, 0).build(), ChromaSolver.LAMBDA);
		// first row reaches back one pixel, later rows one full row
		assertEquals(2 * w - 1 + (h - 1) * (w + 1), sys.choleskyFillBound());

		// no edges survive a hard checkerboard, leaving only the diagonal
		double[][] board = new double[h][w];
		for (int r = 0; r < h; r++) {
			for (int c = 0; c < w; c++) {
				board[r][c] = (r + c) % 2 == 0 ? 0 : 255;
			}
		}
		LaplacianSystem diag = ChromaSolver.assemble(GraphBuilder.build(Plane.of(board), 1.0), SeedSet.builder(h, w).add(0, 0, 0, 0).build(), 1.0);
		assertEquals(h * w, diag.choleskyFillBound());
	}

	@Test
	void wideImageSkipsFactorizationAndConverges() {
		int h = 300, w = 300;
		Random rnd = new Random(15);
		double[] y = new double[h * w];
		for (int r = 0; r < h; r++) {
			for (int c = 0; c < w; c++) {
				double tone = ((r / 20) + (c / 20)) % 2 == 0 ? 60 : 190;
				y[r * w + c] = tone + rnd.nextGaussian() * 3;
			}
		}
		SimilarityGraph g = GraphBuilder.build(Plane.of(h, w, y), 5.0);
		SeedSet.Builder sb = SeedSet.builder(h, w);
		for (int r = 2; r < h; r += 5) {
			for (int c = 3; c < w; c += 5) {
				sb.add(r, c, 40 * Math.sin(r / 30.0), 40 * Math.cos(c / 45.0));
			}
		}
		SeedSet seeds = sb.build();
		LaplacianSystem sys = ChromaSolver.assemble(g, seeds, ChromaSolver.LAMBDA);
		assertTrue(sys.choleskyFillBound() > ChromaSolver.DIRECT_FILL_LIMIT);

		ChannelSolution u = assertTimeout(Duration.ofSeconds(60), () -> ChromaSolver.solve(sys, ChromaChannel.U));
		assertEquals(SolvePath.ITERATIVE, u.getPath());
		assertTrue(u.getIterations() < ChromaSolver.iterationCap(sys));
		assertTrue(u.getRelativeResidual() < 1e-8, u.toString());
		assertTrue(u.getValues().min() >= -40.05);
		assertTrue(u.getValues().max() <= 40.05);
		for (int k = 0; k < seeds.size(); k++) {
			assertEquals(seeds.u(k), u.getValues().get(seeds.pixelIndex(k)), 0.1);
		}
	}
}
