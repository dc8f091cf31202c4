/**
 * Job execution package.
 *
 * <p>{@link io.tissueflow.runtime.JobScheduler} drives an
 * {@link io.tissueflow.runtime.ExecutionEngine} with a blocking poll loop;
 * {@link io.tissueflow.runtime.TissueFlowRuntime} wires planning, storage,
 * submission and fusion together for the command line.
 */
package io.tissueflow.runtime;
