package com.github.micycle1.chromaprop;

/** Implemented by the typed exceptions raised by the pipeline. */
public interface PipelineFailure {

	PipelineStage getStage();
}
