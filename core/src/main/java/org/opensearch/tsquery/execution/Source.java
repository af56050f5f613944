/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

/**
 * Root producer that drives an external table iterator into the graph. {@link #run} pushes every
 * table to the attached transformations and then delivers a single {@code finish} to each of
 * them, carrying the failure if the iteration failed or was cancelled.
 */
public interface Source extends Node {

  /** Runs the source to completion. Stops pulling as soon as {@code context} is cancelled. */
  void run(PipelineContext context);
}
