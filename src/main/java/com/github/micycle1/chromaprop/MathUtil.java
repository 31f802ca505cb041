package com.github.micycle1.chromaprop;

final class MathUtil {

	private MathUtil() {
	}

	public static double clamp(double v, double lo, double hi) {
		if (v < lo) {
			return lo;
		}
		if (v > hi) {
			return hi;
		}
		return v;
	}

	// Logistic 1 / (1 + e^-x), written so that large |x| cannot overflow exp
	public static double sigmoid(double x) {
		if (x >= 0) {
			return 1.0 / (1.0 + Math.exp(-x));
		}
		double e = Math.exp(x);
		return e / (1.0 + e);
	}

	// Mirror index into [0, n) the way "reflect" boundary filters do:
	// (d c b a | a b c d | d c b a)
	public static int reflect(int i, int n) {
		if (n == 1) {
			return 0;
		}
		int period = 2 * n;
		i %= period;
		if (i < 0) {
			i += period;
		}
		return i < n ? i : period - 1 - i;
	}

	public static boolean allFinite(double[] a) {
		for (double v : a) {
			if (!Double.isFinite(v)) {
				return false;
			}
		}
		return true;
	}

	static void requireFinite(double v, String name, PipelineStage stage) {
		if (!Double.isFinite(v)) {
			throw new InvalidParameterException(stage, name + " must be finite, got " + v);
		}
	}
}
