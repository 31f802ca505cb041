package com.github.micycle1.chromaprop.graph;

import com.github.micycle1.chromaprop.InvalidInputException;
import com.github.micycle1.chromaprop.InvalidParameterException;
import com.github.micycle1.chromaprop.PipelineStage;
import com.github.micycle1.chromaprop.image.Plane;

/**
 * Builds the pixel similarity graph of a luminance plane. Neighbouring pixels
 * {@code i, j} are joined by an edge of weight
 * {@code exp(-(Y_i - Y_j)^2 / (2 sigma^2))}: large sigma gives near-uniform
 * weights, small sigma cuts the graph at luminance edges.
 */
public final class GraphBuilder {

	private GraphBuilder() {
	}

	public static SimilarityGraph build(Plane luminance, double sigma) {
		if (luminance == null || luminance.size() == 0) {
			throw new InvalidInputException(PipelineStage.GRAPH, "Luminance plane is empty");
		}
		if (!(sigma > 0) || Double.isInfinite(sigma)) {
			throw new InvalidParameterException(PipelineStage.GRAPH, "sigma must be a finite value > 0, got " + sigma);
		}
		final int h = luminance.getHeight();
		final int w = luminance.getWidth();
		final double inv2s2 = 1.0 / (2.0 * sigma * sigma);

		double[] horizontal = new double[h * (w - 1)];
		for (int r = 0, p = 0; r < h; r++) {
			for (int c = 0; c < w - 1; c++, p++) {
				horizontal[p] = weight(luminance.get(r, c), luminance.get(r, c + 1), inv2s2);
			}
		}
		double[] vertical = new double[(h - 1) * w];
		for (int r = 0, p = 0; r < h - 1; r++) {
			for (int c = 0; c < w; c++, p++) {
				vertical[p] = weight(luminance.get(r, c), luminance.get(r + 1, c), inv2s2);
			}
		}
		return new SimilarityGraph(h, w, sigma, horizontal, vertical);
	}

	/** Edge weight between two luminance values. */
	public static double edgeWeight(double yi, double yj, double sigma) {
		return weight(yi, yj, 1.0 / (2.0 * sigma * sigma));
	}

	private static double weight(double yi, double yj, double inv2s2) {
		double d = yi - yj;
		return Math.exp(-d * d * inv2s2);
	}
}
