/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

/** How a transformation treats state already emitted when it is triggered again. */
public enum AccumulationMode {

  /** Emitted state is discarded; each trigger emits only new results. */
  DISCARDING,

  /** Emitted state is retained and re-emitted in full on every trigger. */
  ACCUMULATING
}
