package com.github.micycle1.chromaprop;

/**
 * Stage of the colorization pipeline at which a failure was detected. Carried
 * by every exception the pipeline throws so that callers running many
 * invocations can report where a run broke.
 */
public enum PipelineStage {
	INPUT, PARAMETERS, ENHANCEMENT, SEED_SAMPLING, GRAPH, SOLVE, RECONSTRUCTION
}
