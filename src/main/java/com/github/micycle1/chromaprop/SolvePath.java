package com.github.micycle1.chromaprop;

/** Which solver produced a channel estimate. */
public enum SolvePath {
	/** Sparse Cholesky factorization. */
	DIRECT,
	/**
	 * SSOR-preconditioned conjugate gradients, taken when the factorization
	 * would be too large or failed.
	 */
	ITERATIVE,
	/** LSQR, the last resort when conjugate gradients did not converge. */
	LEAST_SQUARES
}
