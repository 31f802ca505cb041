package com.github.micycle1.chromaprop.image;

import java.awt.image.BufferedImage;
import java.util.Arrays;

import com.github.micycle1.chromaprop.InvalidInputException;
import com.github.micycle1.chromaprop.PipelineStage;

/**
 * Immutable three-channel output image with integral samples in [0, 255],
 * stored interleaved and row-major. This is the form handed to image encoders.
 */
public final class RgbImage {

	private final int height;
	private final int width;
	private final int[] samples;

	private RgbImage(int height, int width, int[] samples) {
		this.height = height;
		this.width = width;
		this.samples = samples;
	}

	/**
	 * @param samples interleaved RGB samples, each in [0, 255]; copied
	 */
	public static RgbImage of(int height, int width, int[] samples) {
		if (height <= 0 || width <= 0 || samples == null || samples.length != height * width * 3) {
			throw new InvalidInputException(PipelineStage.RECONSTRUCTION, "RGB samples do not describe a " + height + "x" + width + " image");
		}
		for (int s : samples) {
			if (s < 0 || s > 255) {
				throw new InvalidInputException(PipelineStage.RECONSTRUCTION, "RGB sample out of [0, 255]: " + s);
			}
		}
		return new RgbImage(height, width, samples.clone());
	}

	public int getHeight() {
		return height;
	}

	public int getWidth() {
		return width;
	}

	/** @param channel 0 = red, 1 = green, 2 = blue */
	public int get(int row, int col, int channel) {
		return samples[(row * width + col) * 3 + channel];
	}

	/** Packed 0xRRGGBB value of a pixel. */
	public int getRGB(int row, int col) {
		int p = (row * width + col) * 3;
		return (samples[p] << 16) | (samples[p + 1] << 8) | samples[p + 2];
	}

	/** Copy of the interleaved samples. */
	public int[] toArray() {
		return samples.clone();
	}

	/** The same pixels as real-valued {@link ImageData}, e.g. to reuse an output as a colour reference. */
	public ImageData toImageData() {
		double[] d = new double[samples.length];
		for (int i = 0; i < d.length; i++) {
			d[i] = samples[i];
		}
		return ImageData.of(height, width, 3, d);
	}

	public BufferedImage toBufferedImage() {
		BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		for (int r = 0; r < height; r++) {
			for (int c = 0; c < width; c++) {
				img.setRGB(c, r, getRGB(r, c));
			}
		}
		return img;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof RgbImage)) {
			return false;
		}
		RgbImage other = (RgbImage) o;
		return height == other.height && width == other.width && Arrays.equals(samples, other.samples);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * height + width) + Arrays.hashCode(samples);
	}

	@Override
	public String toString() {
		return "RgbImage{" + height + "x" + width + "}";
	}
}
