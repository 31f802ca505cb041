package com.github.micycle1.chromaprop.image;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

import com.github.micycle1.chromaprop.InvalidInputException;
import com.github.micycle1.chromaprop.PipelineStage;

/**
 * Immutable single-channel 2-D grid of real samples, stored row-major. Used for
 * the luminance channel and for each chrominance channel.
 * <p>
 * Pixel {@code (row, col)} lives at linear index {@code row * width + col}; the
 * same indexing is used by the similarity graph and the sparse systems built on
 * top of it.
 */
public final class Plane {

	private final int height;
	private final int width;
	private final double[] data;

	private Plane(int height, int width, double[] data) {
		this.height = height;
		this.width = width;
		this.data = data;
	}

	/**
	 * Creates a plane from row-major samples. The array is copied.
	 *
	 * @throws InvalidInputException if the plane is empty or the sample count does
	 *                               not match {@code height * width}
	 */
	public static Plane of(int height, int width, double[] rowMajor) {
		if (height <= 0 || width <= 0) {
			throw new InvalidInputException(PipelineStage.INPUT, "Plane must be non-empty, got " + height + "x" + width);
		}
		if (rowMajor == null || rowMajor.length != height * width) {
			throw new InvalidInputException(PipelineStage.INPUT,
					"Expected " + (height * width) + " samples for a " + height + "x" + width + " plane");
		}
		return new Plane(height, width, rowMajor.clone());
	}

	/**
	 * Creates a plane from a rectangular {@code [row][col]} array.
	 *
	 * @throws InvalidInputException if the array is empty or ragged
	 */
	public static Plane of(double[][] rows) {
		if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
			throw new InvalidInputException(PipelineStage.INPUT, "Plane must be non-empty");
		}
		int h = rows.length;
		int w = rows[0].length;
		double[] d = new double[h * w];
		for (int r = 0; r < h; r++) {
			if (rows[r] == null || rows[r].length != w) {
				throw new InvalidInputException(PipelineStage.INPUT, "Ragged plane: row " + r + " does not have " + w + " columns");
			}
			System.arraycopy(rows[r], 0, d, r * w, w);
		}
		return new Plane(h, w, d);
	}

	/** A plane with every sample equal to {@code value}. */
	public static Plane filled(int height, int width, double value) {
		double[] d = new double[Math.max(0, height) * Math.max(0, width)];
		Arrays.fill(d, value);
		return of(height, width, d);
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	/** Number of samples (height * width). */
	public int size() {
		return data.length;
	}

	public double get(int row, int col) {
		return data[row * width + col];
	}

	public double get(int index) {
		return data[index];
	}

	/** Copy of the row-major samples. */
	public double[] toArray() {
		return data.clone();
	}

	/** Copy of the samples as a {@code [row][col]} array. */
	public double[][] toRows() {
		double[][] out = new double[height][width];
		for (int r = 0; r < height; r++) {
			System.arraycopy(data, r * width, out[r], 0, width);
		}
		return out;
	}

	/** A new plane holding {@code f(sample)} for every sample. */
	public Plane map(DoubleUnaryOperator f) {
		double[] d = new double[data.length];
		for (int i = 0; i < d.length; i++) {
			d[i] = f.applyAsDouble(data[i]);
		}
		return new Plane(height, width, d);
	}

	public double min() {
		double m = Double.POSITIVE_INFINITY;
		for (double v : data) {
			if (v < m) {
				m = v;
			}
		}
		return m;
	}

	public double max() {
		double m = Double.NEGATIVE_INFINITY;
		for (double v : data) {
			if (v > m) {
				m = v;
			}
		}
		return m;
	}

	public double mean() {
		double s = 0.0;
		for (double v : data) {
			s += v;
		}
		return s / data.length;
	}

	public boolean sameShape(Plane other) {
		return other != null && other.height == height && other.width == width;
	}

	/**
	 * Wraps an array without copying it. Only used by code in this library that
	 * has just allocated {@code rowMajor} and never touches it again.
	 */
	static Plane adopt(int height, int width, double[] rowMajor) {
		return new Plane(height, width, rowMajor);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Plane)) {
			return false;
		}
		Plane p = (Plane) o;
		return height == p.height && width == p.width && Arrays.equals(data, p.data);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * height + width) + Arrays.hashCode(data);
	}

	@Override
	public String toString() {
		return "Plane{" + height + "x" + width + "}";
	}
}
