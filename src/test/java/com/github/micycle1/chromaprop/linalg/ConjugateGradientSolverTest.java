package com.github.micycle1.chromaprop.linalg;

import static com.github.micycle1.chromaprop.linalg.CsrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class ConjugateGradientSolverTest {

	private static double[] randomVector(int n, long seed) {
		Random rnd = new Random(seed);
		double[] v = new double[n];
		for (int i = 0; i < n; i++) {
			v[i] = rnd.nextGaussian();
		}
		return v;
	}

	@Test
	void solvesWithAndWithoutPreconditioner() {
		int n = 40;
		SparseCSR A = csr(shiftedPath(n, 0.1));
		double[] xTrue = randomVector(n, 5);
		double[] b = new double[n];
		A.matVec(xTrue, b);

		double[] plain = new double[n];
		ConjugateGradientSolver.Result p = ConjugateGradientSolver.solve(A, b, plain, 1e-12, 1000, null);
		assertTrue(p.converged, p.toString());
		assertNull(p.breakdown);
		assertArrayEquals(xTrue, plain, 1e-8);

		double[] pre = new double[n];
		ConjugateGradientSolver.Result s = ConjugateGradientSolver.solve(A, b, pre, 1e-12, 1000, new SSOR(A, 1.2));
		assertTrue(s.converged, s.toString());
		assertArrayEquals(xTrue, pre, 1e-8);
		assertTrue(s.iters <= p.iters, s + " vs " + p);
	}

	@Test
	void ssorCutsIterationsOnStiffDiagonal() {
		// large penalties on a few rows, as seeded pixels produce
		int n = 400;
		double[][] a = shiftedPath(n, 1e-6);
		for (int i = 0; i < n; i += 37) {
			a[i][i] += 1e4;
		}
		SparseCSR A = csr(a);
		double[] b = new double[n];
		for (int i = 0; i < n; i += 37) {
			b[i] = 1e4 * (i % 2 == 0 ? 3.0 : -2.0);
		}
		double[] plain = new double[n];
		ConjugateGradientSolver.Result p = ConjugateGradientSolver.solve(A, b, plain, 1e-10, 5000, null);
		double[] pre = new double[n];
		ConjugateGradientSolver.Result s = ConjugateGradientSolver.solve(A, b, pre, 1e-10, 5000, new SSOR(A, 1.2));
		assertTrue(s.converged, s.toString());
		assertTrue(s.iters < p.iters, s + " vs " + p);
		for (int i = 0; i < n; i++) {
			assertTrue(pre[i] >= -2.0 - 1e-3 && pre[i] <= 3.0 + 1e-3, "x[" + i + "] = " + pre[i]);
		}
	}

	@Test
	void zeroRightHandSideReturnsZero() {
		SparseCSR A = csr(shiftedPath(4, 1));
		double[] x = { 1, 2, 3, 4 };
		ConjugateGradientSolver.Result res = ConjugateGradientSolver.solve(A, new double[4], x, 1e-10, 10, new SSOR(A, 1.0));
		assertTrue(res.converged);
		assertEquals(0, res.iters);
		assertArrayEquals(new double[4], x, 0.0);
	}

	@Test
	void indefiniteMatrixIsReportedAsBreakdown() {
		SparseCSR A = csr(new double[][] { { 1, 0 }, { 0, -1 } });
		double[] x = new double[2];
		ConjugateGradientSolver.Result res = ConjugateGradientSolver.solve(A, new double[] { 1, 1 }, x, 1e-10, 10, null);
		assertFalse(res.converged);
		assertNotNull(res.breakdown);
	}

	@Test
	void reportsNonConvergenceAtIterationCap() {
		int n = 200;
		SparseCSR A = csr(shiftedPath(n, 1e-8));
		double[] b = randomVector(n, 6);
		double[] x = new double[n];
		ConjugateGradientSolver.Result res = ConjugateGradientSolver.solve(A, b, x, 1e-14, 3, null);
		assertFalse(res.converged);
		assertNull(res.breakdown);
		assertEquals(3, res.iters);
		assertTrue(res.relResidual > 0);
	}

	@Test
	void ssorIsSymmetric() {
		int n = 12;
		double[][] a = shiftedPath(n, 0.3);
		a[3][3] += 50;
		SparseCSR A = csr(a);
		SSOR m = new SSOR(A, 1.3);
		double[] u = randomVector(n, 7);
		double[] v = randomVector(n, 8);
		double[] mu = new double[n];
		double[] mv = new double[n];
		m.apply(u, mu);
		m.apply(v, mv);
		assertEquals(ConjugateGradientSolver.dot(v, mu), ConjugateGradientSolver.dot(u, mv), 1e-10);
		assertTrue(ConjugateGradientSolver.dot(u, mu) > 0);
		assertArrayEquals(new double[] { a[0][0], a[1][1], a[2][2], a[3][3] }, Arrays.copyOf(A.diagonal(), 4), 0.0);
		assertThrows(IllegalArgumentException.class, () -> new SSOR(A, 2.0));
	}
}
