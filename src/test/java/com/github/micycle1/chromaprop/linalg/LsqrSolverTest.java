package com.github.micycle1.chromaprop.linalg;

import static com.github.micycle1.chromaprop.linalg.CsrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class LsqrSolverTest {

	@Test
	void csrConversionKeepsEntries() {
		double[][] a = { { 4, 0, -1 }, { 0, 3, 0 }, { 2, 0, 5 } };
		SparseCSR A = csr(a);
		assertEquals(3, A.n);
		assertEquals(5, A.nnz);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				assertEquals(a[i][j], A.get(i, j), 0.0);
			}
		}
		double[] y = new double[3];
		A.matVec(new double[] { 1, 2, 3 }, y);
		assertArrayEquals(new double[] { 1, 6, 17 }, y, 1e-15);
		A.matVecTransposed(new double[] { 1, 2, 3 }, y);
		assertArrayEquals(new double[] { 10, 6, 14 }, y, 1e-15);
	}

	@Test
	void solvesWellConditionedSystem() {
		int n = 30;
		SparseCSR A = csr(shiftedPath(n, 0.5));
		Random rnd = new Random(4);
		double[] xTrue = new double[n];
		for (int i = 0; i < n; i++) {
			xTrue[i] = rnd.nextGaussian();
		}
		double[] b = new double[n];
		A.matVec(xTrue, b);

		double[] x = new double[n];
		LsqrSolver.Result res = LsqrSolver.solve(A, b, x, 1e-10, 1000);
		assertTrue(res.converged, res.toString());
		assertNull(res.breakdown);
		assertTrue(res.iters > 0 && res.iters <= 1000);
		assertArrayEquals(xTrue, x, 1e-6);
	}

	@Test
	void minimumNormSolutionOfSingularConsistentSystem() {
		SparseCSR A = csr(new double[][] { { 1, 1 }, { 1, 1 } });
		double[] x = new double[2];
		LsqrSolver.Result res = LsqrSolver.solve(A, new double[] { 2, 2 }, x, 1e-10, 100);
		assertTrue(res.converged);
		assertArrayEquals(new double[] { 1, 1 }, x, 1e-12);
	}

	@Test
	void leastSquaresSolutionOfInconsistentSystem() {
		SparseCSR A = csr(new double[][] { { 2, 0 }, { 0, 0 } });
		double[] x = new double[2];
		LsqrSolver.Result res = LsqrSolver.solve(A, new double[] { 4, 3 }, x, 1e-10, 100);
		assertTrue(res.converged);
		assertArrayEquals(new double[] { 2, 0 }, x, 1e-12);
		assertEquals(3.0 / 5.0, res.relResidual, 1e-12);
	}

	@Test
	void zeroRightHandSideReturnsZero() {
		SparseCSR A = csr(shiftedPath(5, 1));
		double[] x = { 9, 9, 9, 9, 9 };
		LsqrSolver.Result res = LsqrSolver.solve(A, new double[5], x, 1e-10, 10);
		assertTrue(res.converged);
		assertEquals(0, res.iters);
		assertArrayEquals(new double[5], x, 0.0);
	}

	@Test
	void reportsNonConvergenceAtIterationCap() {
		int n = 200;
		SparseCSR A = csr(shiftedPath(n, 1e-8));
		double[] b = new double[n];
		b[0] = 1;
		b[n - 1] = -1;
		double[] x = new double[n];
		LsqrSolver.Result res = LsqrSolver.solve(A, b, x, 1e-14, 3);
		assertFalse(res.converged);
		assertEquals(3, res.iters);
		assertTrue(res.relResidual > 0);
	}
}
