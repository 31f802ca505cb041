package com.github.micycle1.chromaprop;

/**
 * Thrown when an image or plane is malformed: empty, ragged, non-finite, or of
 * a shape that does not match the other operands of a stage.
 */
public class InvalidInputException extends IllegalArgumentException implements PipelineFailure {

	private static final long serialVersionUID = 1L;

	private final PipelineStage stage;

	public InvalidInputException(PipelineStage stage, String message) {
		super(message);
		this.stage = stage;
	}

	@Override
	public PipelineStage getStage() {
		return stage;
	}
}
