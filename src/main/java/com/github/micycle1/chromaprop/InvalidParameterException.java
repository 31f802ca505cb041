package com.github.micycle1.chromaprop;

/**
 * Thrown when a parameter lies outside its recognised range, or when a seed
 * sampling mode is selected without a compatible colour source.
 */
public class InvalidParameterException extends IllegalArgumentException implements PipelineFailure {

	private static final long serialVersionUID = 1L;

	private final PipelineStage stage;

	public InvalidParameterException(PipelineStage stage, String message) {
		super(message);
		this.stage = stage;
	}

	public InvalidParameterException(PipelineStage stage, String message, Throwable cause) {
		super(message, cause);
		this.stage = stage;
	}

	@Override
	public PipelineStage getStage() {
		return stage;
	}
}
