package com.github.micycle1.chromaprop;

import com.github.micycle1.chromaprop.image.ImageData;
import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.image.RgbImage;

/**
 * Full-reference quality measures used to compare a colorized output with the
 * ground truth it was derived from.
 */
public final class QualityMetrics {

	public static final double PEAK = 255.0;

	private QualityMetrics() {
	}

	/**
	 * Peak signal-to-noise ratio in dB between a ground-truth RGB image and an
	 * output, both clamped to [0, 255] first. Identical images give
	 * {@link Double#POSITIVE_INFINITY}.
	 */
	public static double psnr(ImageData truth, RgbImage output) {
		if (truth == null || output == null || truth.getHeight() != output.getHeight() || truth.getWidth() != output.getWidth()) {
			throw new InvalidInputException(PipelineStage.INPUT, "PSNR operands must have the same size");
		}
		int h = truth.getHeight();
		int w = truth.getWidth();
		double sum = 0.0;
		for (int r = 0; r < h; r++) {
			for (int c = 0; c < w; c++) {
				for (int ch = 0; ch < 3; ch++) {
					double t = truth.get(r, c, truth.getChannels() == 1 ? 0 : ch);
					double d = MathUtil.clamp(t, 0.0, PEAK) - output.get(r, c, ch);
					sum += d * d;
				}
			}
		}
		return fromMse(sum / (h * w * 3.0));
	}

	/** PSNR between two planes of the same shape. */
	public static double psnr(Plane truth, Plane estimate) {
		if (truth == null || !truth.sameShape(estimate)) {
			throw new InvalidInputException(PipelineStage.INPUT, "PSNR operands must have the same shape");
		}
		double sum = 0.0;
		for (int i = 0; i < truth.size(); i++) {
			double d = MathUtil.clamp(truth.get(i), 0.0, PEAK) - MathUtil.clamp(estimate.get(i), 0.0, PEAK);
			sum += d * d;
		}
		return fromMse(sum / truth.size());
	}

	static double fromMse(double mse) {
		if (mse == 0.0) {
			return Double.POSITIVE_INFINITY;
		}
		return 20.0 * Math.log10(PEAK / Math.sqrt(mse));
	}
}
