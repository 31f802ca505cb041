package com.github.micycle1.chromaprop;

import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.image.RgbImage;
import com.github.micycle1.chromaprop.image.YuvConversion;

/**
 * Merges a luminance plane with two chrominance planes back into RGB using the
 * inverse BT.601 transform. Samples are clamped to [0, 255] and rounded to the
 * nearest integer.
 */
public final class Reconstructor {

	private Reconstructor() {
	}

	public static RgbImage reconstruct(Plane y, Plane u, Plane v) {
		if (y == null || u == null || v == null) {
			throw new InvalidInputException(PipelineStage.RECONSTRUCTION, "Luminance and both chroma planes are required");
		}
		if (!y.sameShape(u) || !y.sameShape(v)) {
			throw new InvalidInputException(PipelineStage.RECONSTRUCTION, "Plane shapes differ: Y=" + y + " U=" + u + " V=" + v);
		}
		int n = y.size();
		int[] out = new int[n * 3];
		double[] rgb = new double[3];
		for (int i = 0, p = 0; i < n; i++) {
			YuvConversion.toRgb(y.get(i), u.get(i), v.get(i), rgb);
			for (int c = 0; c < 3; c++) {
				out[p++] = toSample(rgb[c]);
			}
		}
		return RgbImage.of(y.getHeight(), y.getWidth(), out);
	}

	// NaN maps to 0
	static int toSample(double v) {
		if (!(v > 0)) {
			return 0;
		}
		return (int) Math.round(MathUtil.clamp(v, 0.0, 255.0));
	}
}
