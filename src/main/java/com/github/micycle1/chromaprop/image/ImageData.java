package com.github.micycle1.chromaprop.image;

import java.awt.image.BufferedImage;

import com.github.micycle1.chromaprop.InvalidInputException;
import com.github.micycle1.chromaprop.PipelineStage;

/**
 * Immutable input image: a height x width grid with either one (grayscale) or
 * three (RGB) channels of real samples, nominally in [0, 255]. Samples are
 * stored interleaved, row-major.
 * <p>
 * Integer and real sample types are both accepted; integer samples are widened
 * to double on construction.
 */
public final class ImageData {

	// np.allclose defaults, used to decide whether an RGB image is really gray
	private static final double GRAY_ATOL = 1e-8;
	private static final double GRAY_RTOL = 1e-5;

	private final int height;
	private final int width;
	private final int channels;
	private final double[] samples;

	private ImageData(int height, int width, int channels, double[] samples) {
		this.height = height;
		this.width = width;
		this.channels = channels;
		this.samples = samples;
	}

	/**
	 * Interleaved samples: {@code samples[(row * width + col) * channels + c]}.
	 *
	 * @param channels 1 or 3
	 */
	public static ImageData of(int height, int width, int channels, double[] samples) {
		if (height <= 0 || width <= 0) {
			throw new InvalidInputException(PipelineStage.INPUT, "Image must be non-empty, got " + height + "x" + width);
		}
		if (channels != 1 && channels != 3) {
			throw new InvalidInputException(PipelineStage.INPUT, "Expected 1 or 3 channels, got " + channels);
		}
		if (samples == null || samples.length != height * width * channels) {
			throw new InvalidInputException(PipelineStage.INPUT, "Sample count does not match " + height + "x" + width + "x" + channels);
		}
		for (double v : samples) {
			if (!Double.isFinite(v)) {
				throw new InvalidInputException(PipelineStage.INPUT, "Image contains a non-finite sample");
			}
		}
		return new ImageData(height, width, channels, samples.clone());
	}

	public static ImageData ofGray(double[][] rows) {
		Plane p = Plane.of(rows);
		return new ImageData(p.getHeight(), p.getWidth(), 1, checkFinite(p.toArray()));
	}

	public static ImageData ofGray(int[][] rows) {
		return ofGray(widen(rows));
	}

	/** {@code pixels[row][col][channel]}; the innermost length must be 1 or 3. */
	public static ImageData ofPixels(double[][][] pixels) {
		if (pixels == null || pixels.length == 0 || pixels[0] == null || pixels[0].length == 0 || pixels[0][0] == null) {
			throw new InvalidInputException(PipelineStage.INPUT, "Image must be non-empty");
		}
		int h = pixels.length;
		int w = pixels[0].length;
		int c = pixels[0][0].length;
		double[] s = new double[h * w * c];
		int p = 0;
		for (int r = 0; r < h; r++) {
			if (pixels[r] == null || pixels[r].length != w) {
				throw new InvalidInputException(PipelineStage.INPUT, "Ragged image: row " + r + " does not have " + w + " columns");
			}
			for (int x = 0; x < w; x++) {
				double[] px = pixels[r][x];
				if (px == null || px.length != c) {
					throw new InvalidInputException(PipelineStage.INPUT, "Pixel (" + r + "," + x + ") does not have " + c + " channels");
				}
				System.arraycopy(px, 0, s, p, c);
				p += c;
			}
		}
		return of(h, w, c, s);
	}

	public static ImageData ofPixels(int[][][] pixels) {
		if (pixels == null) {
			throw new InvalidInputException(PipelineStage.INPUT, "Image must be non-empty");
		}
		double[][][] d = new double[pixels.length][][];
		for (int r = 0; r < pixels.length; r++) {
			d[r] = widen(pixels[r]);
		}
		return ofPixels(d);
	}

	/**
	 * Reads an in-memory {@link BufferedImage}. Images whose type is a gray type
	 * become single-channel; everything else is read as RGB (alpha dropped).
	 */
	public static ImageData fromBufferedImage(BufferedImage img) {
		if (img == null) {
			throw new InvalidInputException(PipelineStage.INPUT, "Image is null");
		}
		int h = img.getHeight();
		int w = img.getWidth();
		boolean gray = img.getType() == BufferedImage.TYPE_BYTE_GRAY || img.getType() == BufferedImage.TYPE_USHORT_GRAY;
		if (gray) {
			double scale = img.getType() == BufferedImage.TYPE_USHORT_GRAY ? 255.0 / 65535.0 : 1.0;
			double[] s = new double[h * w];
			var raster = img.getRaster();
			for (int r = 0; r < h; r++) {
				for (int c = 0; c < w; c++) {
					s[r * w + c] = raster.getSample(c, r, 0) * scale;
				}
			}
			return of(h, w, 1, s);
		}
		double[] s = new double[h * w * 3];
		int p = 0;
		for (int r = 0; r < h; r++) {
			for (int c = 0; c < w; c++) {
				int rgb = img.getRGB(c, r);
				s[p++] = (rgb >> 16) & 0xFF;
				s[p++] = (rgb >> 8) & 0xFF;
				s[p++] = rgb & 0xFF;
			}
		}
		return of(h, w, 3, s);
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	public int getChannels() {
		return channels;
	}

	public double get(int row, int col, int channel) {
		return samples[(row * width + col) * channels + channel];
	}

	/** One channel as a plane. */
	public Plane channel(int channel) {
		if (channel < 0 || channel >= channels) {
			throw new IndexOutOfBoundsException("Channel " + channel + " of " + channels);
		}
		double[] d = new double[height * width];
		for (int i = 0, p = channel; i < d.length; i++, p += channels) {
			d[i] = samples[p];
		}
		return Plane.adopt(height, width, d);
	}

	/**
	 * True for single-channel images, and for three-channel images whose channels
	 * are all (numerically) equal.
	 */
	public boolean isGrayscale() {
		if (channels == 1) {
			return true;
		}
		for (int p = 0; p < samples.length; p += 3) {
			if (!close(samples[p], samples[p + 1]) || !close(samples[p + 1], samples[p + 2])) {
				return false;
			}
		}
		return true;
	}

	/**
	 * The luminance channel: the (first) channel of a grayscale image, or the
	 * BT.601 luma of an RGB one.
	 */
	public Plane luminance() {
		if (isGrayscale()) {
			return channel(0);
		}
		return YuvConversion.toYuv(this)[0];
	}

	public boolean sameSize(ImageData other) {
		return other != null && other.height == height && other.width == width;
	}

	public boolean sameSize(Plane other) {
		return other != null && other.getHeight() == height && other.getWidth() == width;
	}

	private static boolean close(double a, double b) {
		return Math.abs(a - b) <= GRAY_ATOL + GRAY_RTOL * Math.abs(b);
	}

	private static double[][] widen(int[][] rows) {
		if (rows == null) {
			return null;
		}
		double[][] d = new double[rows.length][];
		for (int r = 0; r < rows.length; r++) {
			if (rows[r] == null) {
				continue;
			}
			d[r] = new double[rows[r].length];
			for (int c = 0; c < rows[r].length; c++) {
				d[r][c] = rows[r][c];
			}
		}
		return d;
	}

	private static double[] checkFinite(double[] s) {
		for (double v : s) {
			if (!Double.isFinite(v)) {
				throw new InvalidInputException(PipelineStage.INPUT, "Image contains a non-finite sample");
			}
		}
		return s;
	}

	@Override
	public String toString() {
		return "ImageData{" + height + "x" + width + "x" + channels + "}";
	}
}
