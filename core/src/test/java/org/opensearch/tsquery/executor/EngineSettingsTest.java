/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.common.setting.Settings.Key;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class EngineSettingsTest {

  @Test
  void should_load_defaults() {
    EngineSettings settings = new EngineSettings();

    boolean enabled = settings.getSettingValue(Key.STAGE_ENABLED);
    int concurrency = settings.getSettingValue(Key.STAGE_CONCURRENCY);
    int workers = settings.getSettingValue(Key.EXECUTOR_WORKERS);
    long memory = settings.getSettingValue(Key.QUERY_MEMORY_LIMIT);

    assertTrue(enabled);
    assertEquals(4, concurrency);
    assertEquals(Runtime.getRuntime().availableProcessors(), workers);
    assertEquals(Long.MAX_VALUE, memory);
    assertEquals(Key.values().length, settings.getSettings().size());
  }

  @Test
  void should_apply_typed_and_textual_overrides() {
    EngineSettings settings =
        new EngineSettings(
            Map.of(
                "plugins.query.stage.enabled", "false",
                "plugins.query.stage.concurrency", 8,
                "plugins.query.memory.limit", "1024"));

    boolean enabled = settings.getSettingValue(Key.STAGE_ENABLED);
    int concurrency = settings.getSettingValue(Key.STAGE_CONCURRENCY);
    long memory = settings.getSettingValue(Key.QUERY_MEMORY_LIMIT);

    assertFalse(enabled);
    assertEquals(8, concurrency);
    assertEquals(1024L, memory);
  }

  @Test
  void should_reject_unknown_keys_and_invalid_values() {
    assertThrows(
        IllegalArgumentException.class, () -> new EngineSettings(Map.of("plugins.nope", 1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EngineSettings(Map.of("plugins.query.stage.concurrency", 0)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EngineSettings(Map.of("plugins.query.stage.enabled", "maybe")));
    assertThrows(
        IllegalArgumentException.class,
        () -> new EngineSettings(Map.of("plugins.query.memory.limit", "lots")));
  }
}
