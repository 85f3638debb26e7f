/**
 * Batch orchestration of the scalogram pipeline.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.scalogram.service.orchestration.DefaultBatchOrchestrator} -
 *       runs load, transform, render and emit per input on the batch executor and returns
 *       one ordered result per input</li>
 *   <li>{@link com.phillippitts.scalogram.service.orchestration.FileStateMachine} - per-file
 *       lifecycle guarding stage order</li>
 *   <li>{@link com.phillippitts.scalogram.service.orchestration.BatchCancellation} - cooperative
 *       stop signal checked before each input starts</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Failure isolation:</b> a failing input becomes a failure result; the batch goes on</li>
 *   <li><b>Parallel execution:</b> CompletableFuture fan-out with index-tagged results</li>
 *   <li><b>Builder:</b> {@link com.phillippitts.scalogram.service.orchestration.BatchOrchestratorBuilder}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.scalogram.service.orchestration;
