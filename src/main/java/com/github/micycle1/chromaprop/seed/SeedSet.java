package com.github.micycle1.chromaprop.seed;

import java.util.Arrays;
import java.util.BitSet;

import com.github.micycle1.chromaprop.InvalidParameterException;
import com.github.micycle1.chromaprop.PipelineStage;

/**
 * Immutable sparse set of chroma anchors over an image of known size. Each seed
 * is a pixel {@code (row, col)} together with a target {@code (u, v)}
 * chrominance pair. Coordinates are within bounds and unique.
 */
public final class SeedSet {

	private final int height;
	private final int width;
	private final int[] pixels; // row * width + col
	private final double[] u;
	private final double[] v;

	private SeedSet(int height, int width, int[] pixels, double[] u, double[] v) {
		this.height = height;
		this.width = width;
		this.pixels = pixels;
		this.u = u;
		this.v = v;
	}

	public static Builder builder(int height, int width) {
		return new Builder(height, width);
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	public int size() {
		return pixels.length;
	}

	/** Linear pixel index ({@code row * width + col}) of seed {@code k}. */
	public int pixelIndex(int k) {
		return pixels[k];
	}

	public int row(int k) {
		return pixels[k] / width;
	}

	public int col(int k) {
		return pixels[k] % width;
	}

	public double u(int k) {
		return u[k];
	}

	public double v(int k) {
		return v[k];
	}

	public boolean fitsImage(int imageHeight, int imageWidth) {
		return height == imageHeight && width == imageWidth;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SeedSet)) {
			return false;
		}
		SeedSet s = (SeedSet) o;
		return height == s.height && width == s.width && Arrays.equals(pixels, s.pixels) && Arrays.equals(u, s.u) && Arrays.equals(v, s.v);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(pixels) * 31 + Arrays.hashCode(u) * 17 + Arrays.hashCode(v);
	}

	@Override
	public String toString() {
		return "SeedSet{" + pixels.length + " seeds over " + height + "x" + width + "}";
	}

	/**
	 * Accumulates seeds, rejecting coordinates outside the image and duplicate
	 * coordinates.
	 */
	public static final class Builder {

		private final int height;
		private final int width;
		private final BitSet taken;
		private int[] pixels = new int[16];
		private double[] u = new double[16];
		private double[] v = new double[16];
		private int count;

		private Builder(int height, int width) {
			if (height <= 0 || width <= 0) {
				throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "Seed grid must be non-empty, got " + height + "x" + width);
			}
			this.height = height;
			this.width = width;
			this.taken = new BitSet(height * width);
		}

		public Builder add(int row, int col, double uValue, double vValue) {
			if (row < 0 || row >= height || col < 0 || col >= width) {
				throw new InvalidParameterException(PipelineStage.SEED_SAMPLING,
						"Seed (" + row + "," + col + ") outside " + height + "x" + width + " image");
			}
			if (!Double.isFinite(uValue) || !Double.isFinite(vValue)) {
				throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "Seed (" + row + "," + col + ") has a non-finite chroma value");
			}
			int idx = row * width + col;
			if (taken.get(idx)) {
				throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "Duplicate seed at (" + row + "," + col + ")");
			}
			taken.set(idx);
			if (count == pixels.length) {
				int cap = count * 2;
				pixels = Arrays.copyOf(pixels, cap);
				u = Arrays.copyOf(u, cap);
				v = Arrays.copyOf(v, cap);
			}
			pixels[count] = idx;
			u[count] = uValue;
			v[count] = vValue;
			count++;
			return this;
		}

		public SeedSet build() {
			if (count == 0) {
				throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "A seed set needs at least one seed");
			}
			return new SeedSet(height, width, Arrays.copyOf(pixels, count), Arrays.copyOf(u, count), Arrays.copyOf(v, count));
		}
	}
}
