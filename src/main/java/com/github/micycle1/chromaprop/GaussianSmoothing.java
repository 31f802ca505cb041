package com.github.micycle1.chromaprop;

import com.github.micycle1.chromaprop.image.Plane;

/**
 * Separable Gaussian blur with a kernel truncated at four standard deviations
 * and mirror-reflected borders.
 */
final class GaussianSmoothing {

	static final double TRUNCATE = 4.0;

	private GaussianSmoothing() {
	}

	static Plane smooth(Plane in, double sigma) {
		if (sigma <= 0) {
			return in;
		}
		double[] k = kernel(sigma);
		int h = in.getHeight();
		int w = in.getWidth();
		double[] src = in.toArray();
		double[] tmp = new double[src.length];
		double[] out = new double[src.length];

		// rows
		convolve(src, tmp, k, h, w, w, 1);
		// columns
		convolve(tmp, out, k, w, h, 1, w);
		return Plane.of(h, w, out);
	}

	// 1-D normalized kernel of radius round(4 sigma)
	static double[] kernel(double sigma) {
		int radius = (int) (TRUNCATE * sigma + 0.5);
		double[] k = new double[2 * radius + 1];
		double sum = 0.0;
		double inv = -0.5 / (sigma * sigma);
		for (int i = -radius; i <= radius; i++) {
			double v = Math.exp(inv * i * i);
			k[i + radius] = v;
			sum += v;
		}
		for (int i = 0; i < k.length; i++) {
			k[i] /= sum;
		}
		return k;
	}

	/*
	 * Convolve "lines" lines of length "len". Element j of line i sits at
	 * i * lineStride + j * step.
	 */
	private static void convolve(double[] src, double[] dst, double[] k, int lines, int len, int lineStride, int step) {
		int radius = k.length / 2;
		for (int i = 0; i < lines; i++) {
			int base = i * lineStride;
			for (int j = 0; j < len; j++) {
				double acc = 0.0;
				for (int t = -radius; t <= radius; t++) {
					int jj = MathUtil.reflect(j + t, len);
					acc += k[t + radius] * src[base + jj * step];
				}
				dst[base + j * step] = acc;
			}
		}
	}
}
