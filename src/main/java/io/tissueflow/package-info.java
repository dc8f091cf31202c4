/**
 * TissueFlow source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tissueflow.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tissueflow.cli.TissueFlowCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.tissueflow.workflow.WorkflowDescription} validates stage and step order.</li>
 *   <li>{@code io.tissueflow.batch.BatchPlanner} turns a step into run and collect batches.</li>
 *   <li>{@code io.tissueflow.runtime.JobScheduler} submits and monitors the jobs of a step.</li>
 *   <li>{@code io.tissueflow.fusion.DatasetFusion} combines the data fragments of the run jobs.</li>
 * </ul>
 */
package io.tissueflow;
