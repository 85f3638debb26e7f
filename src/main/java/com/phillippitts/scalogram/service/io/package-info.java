/**
 * Input and output collaborators of the batch pipeline.
 *
 * <p>{@link com.phillippitts.scalogram.service.io.SignalSource} and
 * {@link com.phillippitts.scalogram.service.io.ScalogramSink} are the seams the orchestrator
 * depends on. This package also holds the implementations used by the command-line batch:
 * the {@code .aaa} reader, the directory scanner and the PNG writer.
 */
package com.phillippitts.scalogram.service.io;
