package com.github.micycle1.chromaprop.linalg;

import java.util.Arrays;

/**
 * Iterative least-squares solver implementing LSQR (Paige &amp; Saunders, 1982)
 * for {@code min ||A x - b||} with A in {@link SparseCSR} format.
 * <p>
 * LSQR is mathematically equivalent to conjugate gradients on the normal
 * equations but is numerically more reliable. It makes no assumption on A
 * beyond the ability to form {@code A v} and {@code A^T u}, so it still returns
 * the minimum-norm least-squares solution for singular (but consistent)
 * systems, where a Cholesky factorization breaks down.
 * <p>
 * Stopping rules (both with tolerance {@code tol}):
 * <ul>
 * <li>compatible system: {@code ||r|| <= tol * (||b|| + ||A|| ||x||)};</li>
 * <li>least-squares: {@code ||A^T r|| <= tol * ||A|| ||r||}.</li>
 * </ul>
 * For fixed {@code tol} and {@code maxIters} the result is deterministic.
 */
public final class LsqrSolver {

	public static final class Result {
		public boolean converged;
		public int iters;
		public double relResidual; // ||b - A x|| / ||b||
		public String breakdown; // null if OK

		@Override
		public String toString() {
			return "Result{converged=" + converged + ", iters=" + iters + ", relResidual=" + relResidual
					+ (breakdown == null ? "" : ", breakdown=" + breakdown) + "}";
		}
	}

	private LsqrSolver() {
	}

	/**
	 * Solves in place.
	 *
	 * @param A        n x n CSR matrix
	 * @param b        right-hand side, length n (not modified)
	 * @param x        receives the solution, length n (its input value is
	 *                 ignored, LSQR starts from zero)
	 * @param tol      relative tolerance for both stopping rules
	 * @param maxIters iteration cap
	 */
	public static Result solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters) {
		final int n = A.n;
		Result res = new Result();
		Arrays.fill(x, 0.0);

		double[] u = b.clone();
		double[] v = new double[n];
		double[] w = new double[n];
		double[] tmp = new double[n];

		double bnorm = norm2(u);
		if (bnorm == 0.0) {
			res.converged = true;
			res.iters = 0;
			res.relResidual = 0.0;
			return res;
		}
		double beta = bnorm;
		scale(u, 1.0 / beta);

		A.matVecTransposed(u, v);
		double alpha = norm2(v);
		if (alpha == 0.0) {
			// A^T b = 0: x = 0 already is the least-squares solution
			res.converged = true;
			res.iters = 0;
			res.relResidual = 1.0;
			return res;
		}
		scale(v, 1.0 / alpha);
		System.arraycopy(v, 0, w, 0, n);

		double phiBar = beta;
		double rhoBar = alpha;
		double anorm2 = 0.0;

		int k = 0;
		while (k < maxIters) {
			k++;
			// bidiagonalization: beta u = A v - alpha u
			A.matVec(v, tmp);
			for (int i = 0; i < n; i++) {
				u[i] = tmp[i] - alpha * u[i];
			}
			beta = norm2(u);
			if (beta > 0) {
				scale(u, 1.0 / beta);
			}
			anorm2 += alpha * alpha + beta * beta;

			// alpha v = A^T u - beta v
			A.matVecTransposed(u, tmp);
			for (int i = 0; i < n; i++) {
				v[i] = tmp[i] - beta * v[i];
			}
			alpha = norm2(v);
			if (alpha > 0) {
				scale(v, 1.0 / alpha);
			}

			// plane rotation eliminating beta
			double rho = Math.hypot(rhoBar, beta);
			if (!finite(rho) || rho == 0.0) {
				res.breakdown = "rho breakdown";
				break;
			}
			double c = rhoBar / rho;
			double s = beta / rho;
			double theta = s * alpha;
			rhoBar = -c * alpha;
			double phi = c * phiBar;
			phiBar = s * phiBar;

			double t1 = phi / rho;
			double t2 = -theta / rho;
			for (int i = 0; i < n; i++) {
				x[i] += t1 * w[i];
				w[i] = v[i] + t2 * w[i];
			}

			double rnorm = phiBar;
			double anorm = Math.sqrt(anorm2);
			double arnorm = alpha * Math.abs(c) * phiBar;
			double xnorm = norm2(x);
			if (!finite(rnorm) || !finite(xnorm)) {
				res.breakdown = "non-finite iterate";
				break;
			}

			boolean compatible = rnorm <= tol * (bnorm + anorm * xnorm);
			boolean leastSquares = rnorm == 0.0 || arnorm <= tol * anorm * rnorm;
			if (compatible || leastSquares || alpha == 0.0) {
				res.converged = true;
				res.iters = k;
				res.relResidual = rnorm / bnorm;
				return res;
			}
		}

		res.converged = false;
		res.iters = k;
		res.relResidual = residualNorm(A, b, x) / bnorm;
		return res;
	}

	static double residualNorm(SparseCSR A, double[] b, double[] x) {
		double[] Ax = new double[A.n];
		A.matVec(x, Ax);
		double s = 0.0;
		for (int i = 0; i < A.n; i++) {
			double d = b[i] - Ax[i];
			s += d * d;
		}
		return Math.sqrt(s);
	}

	static void scale(double[] a, double f) {
		for (int i = 0; i < a.length; i++) {
			a[i] *= f;
		}
	}

	static double norm2(double[] a) {
		double s = 0.0;
		for (double v : a) {
			s += v * v;
		}
		return Math.sqrt(s);
	}

	static boolean finite(double v) {
		return !Double.isNaN(v) && !Double.isInfinite(v);
	}
}
