package com.github.micycle1.chromaprop;

/**
 * Thrown when a chroma channel could be solved neither by direct sparse
 * factorization nor by the iterative least-squares fallback.
 */
public class SolverFailureException extends IllegalStateException implements PipelineFailure {

	private static final long serialVersionUID = 1L;

	private final ChromaChannel channel;

	public SolverFailureException(ChromaChannel channel, String message) {
		super(message);
		this.channel = channel;
	}

	public SolverFailureException(ChromaChannel channel, String message, Throwable cause) {
		super(message, cause);
		this.channel = channel;
	}

	/** The channel whose solve failed; null if the failure was not channel specific. */
	public ChromaChannel getChannel() {
		return channel;
	}

	@Override
	public PipelineStage getStage() {
		return PipelineStage.SOLVE;
	}
}
