package com.github.micycle1.chromaprop.seed;

/**
 * Deterministic luminance-to-colour maps used to invent seed chrominance for
 * pure grayscale inputs.
 */
public enum Colormap {

	/** Perceptually uniform blue-green-yellow map, piecewise linear over 9 stops. */
	VIRIDIS {
		@Override
		void rgb(double t, double[] out) {
			double x = t * (VIRIDIS_STOPS.length - 1);
			int i = Math.min((int) x, VIRIDIS_STOPS.length - 2);
			double f = x - i;
			double[] a = VIRIDIS_STOPS[i];
			double[] b = VIRIDIS_STOPS[i + 1];
			for (int c = 0; c < 3; c++) {
				out[c] = 255.0 * (a[c] + f * (b[c] - a[c]));
			}
		}
	},

	/** Classic blue-cyan-yellow-red rainbow. */
	JET {
		@Override
		void rgb(double t, double[] out) {
			out[0] = 255.0 * clamp01(Math.min(4 * t - 1.5, -4 * t + 4.5));
			out[1] = 255.0 * clamp01(Math.min(4 * t - 0.5, -4 * t + 3.5));
			out[2] = 255.0 * clamp01(Math.min(4 * t + 0.5, -4 * t + 2.5));
		}
	},

	/** Black-red-yellow-white. */
	HOT {
		@Override
		void rgb(double t, double[] out) {
			out[0] = 255.0 * clamp01(t / 0.375);
			out[1] = 255.0 * clamp01((t - 0.375) / 0.375);
			out[2] = 255.0 * clamp01((t - 0.75) / 0.25);
		}
	};

	private static final double[][] VIRIDIS_STOPS = { //
			{ 0.267004, 0.004874, 0.329415 }, //
			{ 0.282623, 0.140926, 0.457517 }, //
			{ 0.229739, 0.322361, 0.545706 }, //
			{ 0.172719, 0.448791, 0.557885 }, //
			{ 0.127568, 0.566949, 0.550556 }, //
			{ 0.157851, 0.683765, 0.501686 }, //
			{ 0.369214, 0.788888, 0.382914 }, //
			{ 0.678489, 0.863742, 0.189503 }, //
			{ 0.993248, 0.906157, 0.143936 } };

	// t in [0, 1] -> RGB in [0, 255]
	abstract void rgb(double t, double[] out);

	/**
	 * Colour for a luminance value. Luminance is normalized from [0, 255] and
	 * clamped.
	 *
	 * @return {R, G, B} in [0, 255]
	 */
	public double[] apply(double luminance) {
		double[] out = new double[3];
		rgb(clamp01(luminance / 255.0), out);
		return out;
	}

	private static double clamp01(double v) {
		return v < 0 ? 0 : (v > 1 ? 1 : v);
	}
}
