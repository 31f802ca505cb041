package com.github.micycle1.chromaprop.seed;

import java.util.Arrays;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.chromaprop.InvalidInputException;
import com.github.micycle1.chromaprop.InvalidParameterException;
import com.github.micycle1.chromaprop.PipelineStage;
import com.github.micycle1.chromaprop.image.ImageData;
import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.image.YuvConversion;

/**
 * Picks a random subset of pixels and assigns each the chrominance pair taken
 * from the colour source selected by a {@link SeedMode}.
 * <p>
 * The number of seeds is {@code max(1, floor(seedRatio * H * W))}; the pixels are
 * distinct and drawn uniformly with a {@link Random} seeded by the caller, so
 * equal arguments always yield equal seed sets.
 */
public final class SeedSampler {

	private static final Logger LOG = LoggerFactory.getLogger(SeedSampler.class);

	private SeedSampler() {
	}

	/**
	 * @param mode         where chrominance comes from
	 * @param luminance    the (enhanced) luminance; defines the image size and
	 *                     drives {@link SeedMode#PSEUDO_COLOR}
	 * @param colourSource reference image for {@link SeedMode#REFERENCE}, the input
	 *                     image itself for {@link SeedMode#RANDOM_TRUE}; ignored
	 *                     (may be null) for {@link SeedMode#PSEUDO_COLOR}
	 * @param seedRatio    fraction of pixels to seed, in (0, 1]
	 * @param rngSeed      seed of the pixel selection
	 * @param colormap     colormap for {@link SeedMode#PSEUDO_COLOR}; null means
	 *                     {@link Colormap#VIRIDIS}
	 */
	public static SeedSet sample(SeedMode mode, Plane luminance, ImageData colourSource, double seedRatio, long rngSeed, Colormap colormap) {
		if (mode == null) {
			throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "Seed mode is required");
		}
		if (luminance == null || luminance.size() == 0) {
			throw new InvalidInputException(PipelineStage.SEED_SAMPLING, "Luminance plane is empty");
		}
		if (!(seedRatio > 0.0 && seedRatio <= 1.0)) {
			throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, "seed_ratio must be in (0, 1], got " + seedRatio);
		}
		final int h = luminance.getHeight();
		final int w = luminance.getWidth();
		if (mode.needsColourSource()) {
			if (colourSource == null) {
				throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, mode + " seeding requires a colour image");
			}
			if (!colourSource.sameSize(luminance)) {
				throw new InvalidParameterException(PipelineStage.SEED_SAMPLING, mode + " colour image is " + colourSource.getHeight() + "x"
						+ colourSource.getWidth() + " but the luminance is " + h + "x" + w);
			}
		}

		int[] picks = choose(h * w, seedCount(h * w, seedRatio), new Random(rngSeed));
		Colormap cmap = colormap == null ? Colormap.VIRIDIS : colormap;

		SeedSet.Builder b = SeedSet.builder(h, w);
		for (int idx : picks) {
			int r = idx / w;
			int c = idx % w;
			double R, G, B;
			if (mode == SeedMode.PSEUDO_COLOR) {
				double[] rgb = cmap.apply(luminance.get(idx));
				R = rgb[0];
				G = rgb[1];
				B = rgb[2];
			} else {
				R = colourSource.get(r, c, 0);
				G = colourSource.getChannels() == 1 ? R : colourSource.get(r, c, 1);
				B = colourSource.getChannels() == 1 ? R : colourSource.get(r, c, 2);
			}
			b.add(r, c, YuvConversion.chromaU(R, G, B), YuvConversion.chromaV(R, G, B));
		}
		SeedSet seeds = b.build();
		LOG.debug("Sampled {} {} seeds over {}x{} (ratio={}, rngSeed={})", seeds.size(), mode, h, w, seedRatio, rngSeed);
		return seeds;
	}

	/** {@code max(1, floor(ratio * pixelCount))}, never more than pixelCount. */
	public static int seedCount(int pixelCount, double ratio) {
		int n = (int) (ratio * pixelCount);
		return Math.min(pixelCount, Math.max(1, n));
	}

	/*
	 * k distinct indices from [0, n) by partial Fisher-Yates, returned in
	 * ascending order.
	 */
	static int[] choose(int n, int k, Random rnd) {
		int[] perm = new int[n];
		for (int i = 0; i < n; i++) {
			perm[i] = i;
		}
		for (int i = 0; i < k; i++) {
			int j = i + rnd.nextInt(n - i);
			int t = perm[i];
			perm[i] = perm[j];
			perm[j] = t;
		}
		int[] out = Arrays.copyOf(perm, k);
		Arrays.sort(out);
		return out;
	}
}
