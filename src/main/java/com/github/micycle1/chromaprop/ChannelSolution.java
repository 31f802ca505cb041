package com.github.micycle1.chromaprop;

import com.github.micycle1.chromaprop.image.Plane;

/**
 * Estimate of one chrominance channel over every pixel, together with how it
 * was obtained.
 */
public final class ChannelSolution {

	private final ChromaChannel channel;
	private final Plane values;
	private final SolvePath path;
	private final int iterations;
	private final double relativeResidual;

	ChannelSolution(ChromaChannel channel, Plane values, SolvePath path, int iterations, double relativeResidual) {
		this.channel = channel;
		this.values = values;
		this.path = path;
		this.iterations = iterations;
		this.relativeResidual = relativeResidual;
	}

	public ChromaChannel getChannel() {
		return channel;
	}

	public Plane getValues() {
		return values;
	}

	public SolvePath getPath() {
		return path;
	}

	/** Iterations of the iterative solver used; 0 for the direct path. */
	public int getIterations() {
		return iterations;
	}

	/** {@code ||b - A x|| / ||b||} of the returned estimate (0 when b = 0). */
	public double getRelativeResidual() {
		return relativeResidual;
	}

	@Override
	public String toString() {
		return "ChannelSolution{" + channel + ", " + path + ", iterations=" + iterations + ", relResidual=" + relativeResidual + "}";
	}
}
