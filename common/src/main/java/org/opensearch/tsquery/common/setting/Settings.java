/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Query engine settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Rewrite push-down eligible chains into stage operations before execution. */
    STAGE_ENABLED("plugins.query.stage.enabled"),

    /** Maximum number of nested pipelines a stage node runs in parallel. */
    STAGE_CONCURRENCY("plugins.query.stage.concurrency"),

    /** Size of the worker pool shared by all dispatchers. */
    EXECUTOR_WORKERS("plugins.query.executor.workers"),

    /** Memory budget of one query, in bytes. */
    QUERY_MEMORY_LIMIT("plugins.query.memory.limit");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
