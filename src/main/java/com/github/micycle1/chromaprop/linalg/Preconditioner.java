package com.github.micycle1.chromaprop.linalg;

/**
 * Approximate inverse of a {@link SparseCSR} matrix applied inside an
 * iterative solve: {@code apply(r, z)} computes {@code z = M^{-1} r}.
 * <p>
 * Implementations used with {@link ConjugateGradientSolver} must be symmetric
 * positive definite.
 */
public interface Preconditioner {
	void apply(double[] r, double[] z);
}
