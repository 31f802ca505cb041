package com.github.micycle1.chromaprop.linalg;

import java.util.Arrays;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * Square sparse matrix in compressed sparse row (CSR) format, as consumed by the
 * iterative solvers in this package.
 */
public final class SparseCSR {

	public final int n;
	public final int nnz;
	public final int[] rowPtr; // length n+1
	public final int[] colIdx; // length nnz
	public final double[] val; // length nnz

	public SparseCSR(int n, int nnz, int[] rowPtr, int[] colIdx, double[] val) {
		if (rowPtr.length != n + 1 || colIdx.length < nnz || val.length < nnz) {
			throw new IllegalArgumentException("CSR arrays do not describe an " + n + "x" + n + " matrix with " + nnz + " non-zeros");
		}
		this.n = n;
		this.nnz = nnz;
		this.rowPtr = rowPtr;
		this.colIdx = colIdx;
		this.val = val;
	}

	/**
	 * Converts an EJML compressed-column matrix. The CSC arrays of A^T are the CSR
	 * arrays of A, so this is one transpose.
	 */
	public static SparseCSR fromCSC(DMatrixSparseCSC A) {
		if (A.numRows != A.numCols) {
			throw new IllegalArgumentException("Matrix must be square, got " + A.numRows + "x" + A.numCols);
		}
		DMatrixSparseCSC At = CommonOps_DSCC.transpose(A, null, null);
		int n = A.numRows;
		int nnz = At.nz_length;
		return new SparseCSR(n, nnz, Arrays.copyOf(At.col_idx, n + 1), Arrays.copyOf(At.nz_rows, nnz), Arrays.copyOf(At.nz_values, nnz));
	}

	/** y = A x */
	public void matVec(double[] x, double[] y) {
		for (int i = 0; i < n; i++) {
			double sum = 0.0;
			for (int p = rowPtr[i], end = rowPtr[i + 1]; p < end; p++) {
				sum += val[p] * x[colIdx[p]];
			}
			y[i] = sum;
		}
	}

	/** y = A^T x */
	public void matVecTransposed(double[] x, double[] y) {
		Arrays.fill(y, 0.0);
		for (int i = 0; i < n; i++) {
			double xi = x[i];
			if (xi == 0.0) {
				continue;
			}
			for (int p = rowPtr[i], end = rowPtr[i + 1]; p < end; p++) {
				y[colIdx[p]] += val[p] * xi;
			}
		}
	}

	/** Diagonal entries, zero where none is stored. */
	public double[] diagonal() {
		double[] d = new double[n];
		for (int i = 0; i < n; i++) {
			for (int p = rowPtr[i]; p < rowPtr[i + 1]; p++) {
				if (colIdx[p] == i) {
					d[i] += val[p];
				}
			}
		}
		return d;
	}

	/** Entry (i, j), zero if not stored. */
	double get(int i, int j) {
		double s = 0.0;
		for (int p = rowPtr[i]; p < rowPtr[i + 1]; p++) {
			if (colIdx[p] == j) {
				s += val[p];
			}
		}
		return s;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("SparseCSR{");
		sb.append("n=").append(n).append(", ");
		sb.append("nnz=").append(nnz);
		if (n <= 16) {
			sb.append(", rowPtr=").append(Arrays.toString(rowPtr));
			sb.append(", colIdx=").append(Arrays.toString(Arrays.copyOf(colIdx, nnz)));
			sb.append(", val=").append(Arrays.toString(Arrays.copyOf(val, nnz)));
		}
		sb.append("}");
		return sb.toString();
	}
}
