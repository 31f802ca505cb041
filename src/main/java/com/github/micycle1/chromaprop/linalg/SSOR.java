package com.github.micycle1.chromaprop.linalg;

/**
 * Symmetric successive over-relaxation, {@code M = (D/w + L)(w/D)(D/w + U)} for
 * {@code A = L + D + U}. One forward and one backward Gauss-Seidel sweep per
 * application. For symmetric A with a positive diagonal, M is symmetric
 * positive definite, so it can precondition conjugate gradients.
 */
public final class SSOR implements Preconditioner {
	private final SparseCSR A;
	private final double[] scale; // omega / A[i,i]

	/**
	 * @param omega relaxation factor in (0, 2); 1 gives symmetric Gauss-Seidel
	 */
	public SSOR(SparseCSR A, double omega) {
		if (!(omega > 0.0 && omega < 2.0)) {
			throw new IllegalArgumentException("omega must lie in (0, 2), got " + omega);
		}
		this.A = A;
		double[] d = A.diagonal();
		this.scale = new double[A.n];
		for (int i = 0; i < A.n; i++) {
			double di = d[i];
			if (Math.abs(di) < 1e-14) {
				di = (di >= 0 ? 1e-14 : -1e-14);
			}
			scale[i] = omega / di;
		}
	}

	@Override
	public void apply(double[] r, double[] z) {
		final int n = A.n;
		final int[] rp = A.rowPtr;
		final int[] ci = A.colIdx;
		final double[] a = A.val;
		double[] y = z; // forward result kept in the output buffer
		// (D/w + L) y = r
		for (int i = 0; i < n; i++) {
			double sum = r[i];
			for (int p = rp[i]; p < rp[i + 1]; p++) {
				int j = ci[p];
				if (j < i) {
					sum -= a[p] * y[j];
				}
			}
			y[i] = sum * scale[i];
		}
		// (D/w + U) z = (D/w) y
		for (int i = n - 1; i >= 0; i--) {
			double sum = 0.0;
			for (int p = rp[i]; p < rp[i + 1]; p++) {
				int j = ci[p];
				if (j > i) {
					sum -= a[p] * z[j];
				}
			}
			z[i] = y[i] + sum * scale[i];
		}
	}
}
