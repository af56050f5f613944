/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Ordered fan-out list shared by datasets and sources. Every signal is forwarded to each
 * transformation in registration order; the first exception stops forwarding and propagates.
 *
 * <p>A table has a single owner, so {@link #process} hands a {@link Table#copy()} to every
 * consumer but the last, which receives the original: exactly one copy per extra consumer.
 */
@Log4j2
public class TransformationSet {

  private final List<Transformation> transformations = new ArrayList<>();

  public void add(Transformation transformation) {
    transformations.add(transformation);
  }

  public int size() {
    return transformations.size();
  }

  public boolean isEmpty() {
    return transformations.isEmpty();
  }

  public List<Transformation> asList() {
    return Collections.unmodifiableList(transformations);
  }

  public void process(DatasetId id, Table table) {
    int count = transformations.size();
    if (count == 0) {
      table.done();
      return;
    }
    int delivered = 0;
    try {
      for (; delivered < count - 1; delivered++) {
        transformations.get(delivered).process(id, table.copy());
      }
    } catch (RuntimeException e) {
      table.done();
      throw e;
    }
    transformations.get(delivered).process(id, table);
  }

  public void retractTable(DatasetId id, GroupKey key) {
    for (Transformation t : transformations) {
      t.retractTable(id, key);
    }
  }

  public void updateWatermark(DatasetId id, long time) {
    for (Transformation t : transformations) {
      t.updateWatermark(id, time);
    }
  }

  public void updateProcessingTime(DatasetId id, long time) {
    for (Transformation t : transformations) {
      t.updateProcessingTime(id, time);
    }
  }

  /**
   * Delivers {@code finish} to every transformation, even if one of them throws. The first failure
   * is rethrown once all transformations have been notified.
   */
  public void finish(DatasetId id, Throwable error) {
    RuntimeException failure = null;
    for (Transformation t : transformations) {
      try {
        t.finish(id, error);
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          log.warn("Additional failure while finishing dataset {}", id, e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
