package com.github.micycle1.chromaprop;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;

import com.github.micycle1.chromaprop.graph.SimilarityGraph;
import com.github.micycle1.chromaprop.linalg.SparseCSR;
import com.github.micycle1.chromaprop.seed.SeedSet;

/**
 * The regularized propagation system {@code (L + P + lambda I) x = P s} over all
 * pixels of a similarity graph.
 * <ul>
 * <li>{@code L} is the weighted graph Laplacian: {@code L_ii} = weighted degree,
 * {@code L_ij = -w_ij} for neighbours.</li>
 * <li>{@code P} is diagonal with {@code penalty} at seeded pixels and 0
 * elsewhere; it pins the solution near the seed values without eliminating
 * their rows.</li>
 * <li>{@code s} holds the seed value of the channel being solved.</li>
 * </ul>
 * The matrix is shared by both chrominance channels; only the right-hand side
 * differs. It is symmetric, and diagonally dominant for any
 * {@code lambda >= 0}.
 */
public final class LaplacianSystem {

	private final int height;
	private final int width;
	private final double lambda;
	private final double penalty;
	private final SeedSet seeds;
	private final DMatrixSparseCSC matrix;

	private LaplacianSystem(int height, int width, double lambda, double penalty, SeedSet seeds, DMatrixSparseCSC matrix) {
		this.height = height;
		this.width = width;
		this.lambda = lambda;
		this.penalty = penalty;
		this.seeds = seeds;
		this.matrix = matrix;
	}

	/**
	 * Assembles the system. Entries are accumulated into a triplet matrix and
	 * compressed once; zero-weight edges are not stored.
	 */
	static LaplacianSystem assemble(SimilarityGraph graph, SeedSet seeds, double lambda, double penalty) {
		final int h = graph.getHeight();
		final int w = graph.getWidth();
		final int n = graph.getNodeCount();

		double[] diag = new double[n];
		for (int i = 0; i < n; i++) {
			diag[i] = graph.degree(i) + lambda;
		}
		for (int k = 0; k < seeds.size(); k++) {
			diag[seeds.pixelIndex(k)] += penalty;
		}

		DMatrixSparseTriplet Atr = new DMatrixSparseTriplet(n, n, n + 2 * graph.getEdgeCount());
		int[] nbrs = new int[4];
		double[] wts = new double[4];
		for (int i = 0; i < n; i++) {
			// diagonal always present, even when zero, so a factorization sees it
			Atr.addItem(i, i, diag[i]);
			int m = graph.neighbors(i, nbrs, wts);
			for (int j = 0; j < m; j++) {
				if (wts[j] != 0.0) {
					Atr.addItem(i, nbrs[j], -wts[j]);
				}
			}
		}

		DMatrixSparseCSC A = DConvertMatrixStruct.convert(Atr, (DMatrixSparseCSC) null);
		A.sortIndices(null);
		return new LaplacianSystem(h, w, lambda, penalty, seeds, A);
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	/** Number of unknowns (pixels). */
	public int size() {
		return matrix.numRows;
	}

	public double getLambda() {
		return lambda;
	}

	public double getPenalty() {
		return penalty;
	}

	/** Stored non-zeros of the system matrix. */
	public int nonZeros() {
		return matrix.nz_length;
	}

	/**
	 * Upper bound on the non-zeros of a Cholesky factor computed in natural
	 * order: the envelope {@code sum_j (j - firstRow_j + 1)} of the lower
	 * triangle. Fill cannot escape the envelope, and on a pixel grid it fills
	 * most of it, so the bound grows as {@code n * width}.
	 */
	public long choleskyFillBound() {
		long fill = 0;
		int[] colPtr = matrix.col_idx;
		int[] rows = matrix.nz_rows;
		for (int j = 0; j < matrix.numCols; j++) {
			int first = j;
			for (int p = colPtr[j]; p < colPtr[j + 1]; p++) {
				first = Math.min(first, rows[p]);
			}
			fill += j - first + 1;
		}
		return fill;
	}

	/** Right-hand side {@code P s} for a channel. */
	public double[] rhs(ChromaChannel channel) {
		double[] b = new double[size()];
		for (int k = 0; k < seeds.size(); k++) {
			b[seeds.pixelIndex(k)] = penalty * channel.seedValue(seeds, k);
		}
		return b;
	}

	/** Fresh copy of the system matrix; solvers may factor it in place. */
	DMatrixSparseCSC matrixCopy() {
		return matrix.copy();
	}

	SparseCSR toCSR() {
		return SparseCSR.fromCSC(matrix);
	}

	double get(int row, int col) {
		return matrix.get(row, col);
	}

	/** {@code ||b - A x|| / ||b||}, or {@code ||A x||} when b = 0. */
	double relativeResidual(double[] x, double[] b) {
		double[] Ax = new double[size()];
		int[] colPtr = matrix.col_idx;
		int[] rows = matrix.nz_rows;
		double[] vals = matrix.nz_values;
		for (int c = 0; c < matrix.numCols; c++) {
			double xc = x[c];
			for (int p = colPtr[c]; p < colPtr[c + 1]; p++) {
				Ax[rows[p]] += vals[p] * xc;
			}
		}
		double rr = 0.0;
		double bb = 0.0;
		for (int i = 0; i < Ax.length; i++) {
			double d = b[i] - Ax[i];
			rr += d * d;
			bb += b[i] * b[i];
		}
		return bb == 0.0 ? Math.sqrt(rr) : Math.sqrt(rr / bb);
	}
}
