package com.github.micycle1.chromaprop.linalg;

import java.util.Arrays;

/**
 * Preconditioned conjugate gradients for symmetric positive (semi-)definite
 * systems {@code A x = b} with A in {@link SparseCSR} format.
 * <p>
 * Stops when the recurrence residual satisfies {@code ||r|| <= tol * ||b||}.
 * A non-positive curvature {@code p^T A p} means A is not positive definite on
 * the Krylov space and is reported as a breakdown; the caller should then use a
 * least-squares method such as {@link LsqrSolver}.
 */
public final class ConjugateGradientSolver {

	public static final class Result {
		public boolean converged;
		public int iters;
		public double relResidual; // ||r|| / ||b|| from the recurrence
		public String breakdown; // null if OK

		@Override
		public String toString() {
			return "Result{converged=" + converged + ", iters=" + iters + ", relResidual=" + relResidual
					+ (breakdown == null ? "" : ", breakdown=" + breakdown) + "}";
		}
	}

	private ConjugateGradientSolver() {
	}

	/**
	 * Solves in place, starting from zero.
	 *
	 * @param precond symmetric positive definite preconditioner, or null for
	 *                plain CG
	 */
	public static Result solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters, Preconditioner precond) {
		final int n = A.n;
		Result res = new Result();
		Arrays.fill(x, 0.0);

		double bnorm = LsqrSolver.norm2(b);
		if (bnorm == 0.0) {
			res.converged = true;
			res.iters = 0;
			res.relResidual = 0.0;
			return res;
		}

		double[] r = b.clone();
		double[] z = new double[n];
		double[] p = new double[n];
		double[] Ap = new double[n];

		applyPreconditioner(precond, r, z);
		System.arraycopy(z, 0, p, 0, n);
		double rz = dot(r, z);
		double rnorm = bnorm;

		for (int k = 1; k <= maxIters; k++) {
			A.matVec(p, Ap);
			double pAp = dot(p, Ap);
			if (!LsqrSolver.finite(pAp) || pAp <= 0.0) {
				res.breakdown = "non-positive curvature (pAp=" + pAp + ")";
				res.iters = k;
				res.relResidual = rnorm / bnorm;
				return res;
			}
			double alpha = rz / pAp;
			for (int i = 0; i < n; i++) {
				x[i] += alpha * p[i];
				r[i] -= alpha * Ap[i];
			}

			rnorm = LsqrSolver.norm2(r);
			if (rnorm / bnorm <= tol) {
				res.converged = true;
				res.iters = k;
				res.relResidual = rnorm / bnorm;
				return res;
			}

			applyPreconditioner(precond, r, z);
			double rzNew = dot(r, z);
			if (!LsqrSolver.finite(rzNew) || rzNew <= 0.0) {
				res.breakdown = "preconditioner breakdown (rz=" + rzNew + ")";
				res.iters = k;
				res.relResidual = rnorm / bnorm;
				return res;
			}
			double beta = rzNew / rz;
			for (int i = 0; i < n; i++) {
				p[i] = z[i] + beta * p[i];
			}
			rz = rzNew;
		}

		res.converged = false;
		res.iters = maxIters;
		res.relResidual = rnorm / bnorm;
		return res;
	}

	private static void applyPreconditioner(Preconditioner precond, double[] r, double[] z) {
		if (precond != null) {
			precond.apply(r, z);
		} else {
			System.arraycopy(r, 0, z, 0, r.length);
		}
	}

	static double dot(double[] a, double[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}
}
