package com.github.micycle1.chromaprop.image;

/**
 * BT.601 luminance/chrominance decomposition on the [0, 255] scale.
 * <p>
 * {@code Y} is in [0, 255]; {@code U} and {@code V} are signed colour
 * differences (roughly [-111, 111] and [-157, 157]).
 */
public final class YuvConversion {

	private YuvConversion() {
	}

	public static double luma(double r, double g, double b) {
		return 0.299 * r + 0.587 * g + 0.114 * b;
	}

	public static double chromaU(double r, double g, double b) {
		return -0.14713 * r - 0.28886 * g + 0.436 * b;
	}

	public static double chromaV(double r, double g, double b) {
		return 0.615 * r - 0.51499 * g - 0.10001 * b;
	}

	/** Writes {R, G, B} for the given Y, U, V into {@code out}. Not clamped. */
	public static void toRgb(double y, double u, double v, double[] out) {
		out[0] = y + 1.13983 * v;
		out[1] = y - 0.39465 * u - 0.58060 * v;
		out[2] = y + 2.03211 * u;
	}

	/**
	 * Decomposes an image into {Y, U, V} planes. A single-channel image is treated
	 * as R = G = B.
	 */
	public static Plane[] toYuv(ImageData img) {
		int h = img.getHeight();
		int w = img.getWidth();
		boolean mono = img.getChannels() == 1;
		double[] y = new double[h * w];
		double[] u = new double[h * w];
		double[] v = new double[h * w];
		for (int r = 0, i = 0; r < h; r++) {
			for (int c = 0; c < w; c++, i++) {
				double R = img.get(r, c, 0);
				double G = mono ? R : img.get(r, c, 1);
				double B = mono ? R : img.get(r, c, 2);
				y[i] = luma(R, G, B);
				u[i] = chromaU(R, G, B);
				v[i] = chromaV(R, G, B);
			}
		}
		return new Plane[] { Plane.adopt(h, w, y), Plane.adopt(h, w, u), Plane.adopt(h, w, v) };
	}
}
