package com.github.micycle1.chromaprop;

import com.github.micycle1.chromaprop.image.Plane;
import com.github.micycle1.chromaprop.image.RgbImage;
import com.github.micycle1.chromaprop.seed.SeedMode;
import com.github.micycle1.chromaprop.seed.SeedSet;

/**
 * Every intermediate artifact of a pipeline run, so that callers can inspect
 * and visualize each stage and not only the final RGB image.
 */
public final class PipelineResult {

	private final Plane enhancedLuminance;
	private final SeedSet seeds;
	private final SeedMode seedMode;
	private final ChannelSolution u;
	private final ChannelSolution v;
	private final RgbImage rgb;
	private final boolean grayscaleInput;

	PipelineResult(Plane enhancedLuminance, SeedSet seeds, SeedMode seedMode, ChannelSolution u, ChannelSolution v, RgbImage rgb,
			boolean grayscaleInput) {
		this.enhancedLuminance = enhancedLuminance;
		this.seeds = seeds;
		this.seedMode = seedMode;
		this.u = u;
		this.v = v;
		this.rgb = rgb;
		this.grayscaleInput = grayscaleInput;
	}

	public Plane getEnhancedLuminance() {
		return enhancedLuminance;
	}

	public SeedSet getSeeds() {
		return seeds;
	}

	/** How the seeds were sampled; null when the caller supplied the seeds. */
	public SeedMode getSeedMode() {
		return seedMode;
	}

	public Plane getChromaU() {
		return u.getValues();
	}

	public Plane getChromaV() {
		return v.getValues();
	}

	public ChannelSolution getSolutionU() {
		return u;
	}

	public ChannelSolution getSolutionV() {
		return v;
	}

	public RgbImage getRgb() {
		return rgb;
	}

	/** Whether the input was detected as grayscale. */
	public boolean isGrayscaleInput() {
		return grayscaleInput;
	}
}
