package com.github.micycle1.chromaprop;

import com.github.micycle1.chromaprop.image.Plane;

/**
 * Tone-mapping stage that enhances a luminance plane.
 * <p>
 * The transforms are applied in a fixed order:
 * <ol>
 * <li>contrast-stretching transform (CST) around the image mean;</li>
 * <li>logistic S-curve around mid-gray;</li>
 * <li>logarithmic image processing (LIP) addition of the two, raised to the
 * power {@code W};</li>
 * <li>adaptive linear stretch onto [0, 255];</li>
 * <li>optional Gaussian smoothing.</li>
 * </ol>
 * Every step returns a new plane; the input is never modified. The final
 * output is clamped to [0, 255].
 * <p>
 * Range checks on {@code W}, {@code E}, {@code k_log} and the smoothing sigma
 * are done by {@link PipelineParameters}; this class accepts any finite value
 * (non-negative for {@code W}) so that the transforms can be studied at their
 * analytic limits.
 */
public final class EnhancementEngine {

	/** LIP gray-tone range. */
	public static final double L0 = 255.0;
	/** Normalizing constant of the CST exponent (half the 8-bit range). */
	public static final double CST_SCALE = 128.0;
	static final double MID_GRAY = 128.0;
	static final double FLAT_RANGE = 1e-8;

	private EnhancementEngine() {
	}

	/**
	 * Runs the full enhancement.
	 *
	 * @param luminance   input luminance, nominally in [0, 255]
	 * @param w           LIP fusion power
	 * @param e           CST slope
	 * @param kLog        logistic steepness
	 * @param smoothSigma Gaussian sigma in pixels; {@code <= 0} disables smoothing
	 * @return the enhanced luminance, same shape as the input, in [0, 255]
	 */
	public static Plane enhance(Plane luminance, double w, double e, double kLog, double smoothSigma) {
		if (luminance == null || luminance.size() == 0) {
			throw new InvalidInputException(PipelineStage.ENHANCEMENT, "Luminance plane is empty");
		}
		MathUtil.requireFinite(w, "W", PipelineStage.ENHANCEMENT);
		MathUtil.requireFinite(e, "E", PipelineStage.ENHANCEMENT);
		MathUtil.requireFinite(kLog, "k_log", PipelineStage.ENHANCEMENT);
		MathUtil.requireFinite(smoothSigma, "smooth_sigma", PipelineStage.ENHANCEMENT);
		if (w < 0) {
			throw new InvalidParameterException(PipelineStage.ENHANCEMENT, "W must be >= 0, got " + w);
		}

		Plane s = contrastStretch(luminance, e);
		Plane l = logisticCurve(luminance, kLog);
		Plane p = lipFusion(s, l, w);
		Plane n = adaptiveStretch(p);
		if (smoothSigma > 0) {
			n = GaussianSmoothing.smooth(n, smoothSigma);
		}
		return n.map(v -> MathUtil.clamp(v, 0.0, L0));
	}

	/**
	 * CST: {@code s = m + (Y - m) / (1 + exp(-E (Y - m) / 128))} with {@code m} the
	 * mean of the whole plane.
	 */
	public static Plane contrastStretch(Plane y, double e) {
		if (y == null || y.size() == 0) {
			throw new InvalidInputException(PipelineStage.ENHANCEMENT, "Luminance plane is empty");
		}
		final double m = y.mean();
		return y.map(v -> {
			double d = v - m;
			return m + d * MathUtil.sigmoid(e * d / CST_SCALE);
		});
	}

	/** Logistic S-curve: {@code l = 255 / (1 + exp(-k (Y - 128) / 128))}. */
	public static Plane logisticCurve(Plane y, double kLog) {
		return y.map(v -> L0 * MathUtil.sigmoid(kLog * (v - MID_GRAY) / MID_GRAY));
	}

	/**
	 * LIP addition followed by the power transform:
	 * {@code p = (max(0, s + l - s l / L0) / L0)^W * L0}.
	 * <p>
	 * The base is clamped at zero before exponentiation so fractional powers never
	 * see a negative operand. {@code W = 0} yields a flat plane at {@code L0}.
	 */
	public static Plane lipFusion(Plane s, Plane l, double w) {
		if (!s.sameShape(l)) {
			throw new InvalidInputException(PipelineStage.ENHANCEMENT, "CST and logistic planes differ in shape: " + s + " vs " + l);
		}
		double[] out = new double[s.size()];
		for (int i = 0; i < out.length; i++) {
			double si = s.get(i);
			double li = l.get(i);
			double base = Math.max(0.0, si + li - si * li / L0);
			out[i] = Math.pow(base / L0, w) * L0;
		}
		return Plane.of(s.getHeight(), s.getWidth(), out);
	}

	/**
	 * Maps {@code [min, max]} linearly onto [0, 255]. A (numerically) constant
	 * plane is returned clamped but otherwise unchanged.
	 */
	public static Plane adaptiveStretch(Plane p) {
		final double min = p.min();
		final double max = p.max();
		if (max - min < FLAT_RANGE) {
			return p.map(v -> MathUtil.clamp(v, 0.0, L0));
		}
		final double alpha = L0 / (max - min);
		return p.map(v -> MathUtil.clamp((v - min) * alpha, 0.0, L0));
	}
}
