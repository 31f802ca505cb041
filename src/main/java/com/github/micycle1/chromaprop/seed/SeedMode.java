package com.github.micycle1.chromaprop.seed;

/**
 * Where the chrominance of the seed pixels comes from.
 */
public enum SeedMode {

	/** Chrominance of a caller-supplied RGB reference image of the same size. */
	REFERENCE,

	/**
	 * Chrominance of a synthetic colour image obtained by mapping the luminance
	 * through a {@link Colormap}. Used when no colour information exists at all.
	 */
	PSEUDO_COLOR,

	/**
	 * The input's own true chrominance. Only meaningful for offline analysis
	 * against known ground truth.
	 */
	RANDOM_TRUE;

	/** Whether this mode reads chrominance from a colour image. */
	public boolean needsColourSource() {
		return this != PSEUDO_COLOR;
	}
}
